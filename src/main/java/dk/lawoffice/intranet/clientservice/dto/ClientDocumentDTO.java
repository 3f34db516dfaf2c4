package dk.lawoffice.intranet.clientservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
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
public class ClientDocumentDTO {

    private String uuid;
    private String client;

    @NotBlank(message = "This field is required.")
    @Size(max = 200, message = "Ensure this field has no more than 200 characters.")
    private String title;

    private String description;

    @Size(max = 50, message = "Ensure this field has no more than 50 characters.")
    private String documentType;

    private String filename;
    private String contentType;
    private long sizeBytes;
    private String downloadUrl;
    private String uploadedBy;
    private String uploadedByName;
    private LocalDateTime uploadedAt;

}
