package dk.lawoffice.intranet.caseservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dk.lawoffice.intranet.caseservice.model.enums.CaseStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Case representation used as request and response body. On input only client, title,
 * description, status and assigned_to are read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CaseDTO {

    private String uuid;

    @NotBlank(message = "This field is required.")
    private String client;

    private String clientName;

    @NotBlank(message = "This field is required.")
    @Size(max = 200, message = "Ensure this field has no more than 200 characters.")
    private String title;

    private String description;
    private CaseStatus status;
    private String statusDisplay;
    private String createdBy;
    private String createdByName;

    @Builder.Default
    private List<String> assignedTo = new ArrayList<>();

    @Builder.Default
    private List<String> assignedToNames = new ArrayList<>();

    @Builder.Default
    private List<CaseNoteDTO> notes = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime closedAt;

}
