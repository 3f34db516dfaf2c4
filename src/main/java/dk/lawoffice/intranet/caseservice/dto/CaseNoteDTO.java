package dk.lawoffice.intranet.caseservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CaseNoteDTO {

    private String uuid;

    @JsonProperty("case")
    private String caseuuid;

    @NotBlank(message = "This field is required.")
    private String content;

    private String author;
    private String authorName;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

}
