package dk.lawoffice.intranet.appointmentservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Appointment representation used as request and response body. The owner is always the
 * caller; {@code user}, the display names and the timestamps are ignored on input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AppointmentDTO {

    private String uuid;
    private String user;
    private String userName;
    private String client;
    private String clientName;

    @JsonProperty("case")
    private String caseuuid;

    private String caseTitle;

    @NotBlank(message = "This field is required.")
    @Size(max = 200, message = "Ensure this field has no more than 200 characters.")
    private String title;

    private String description;

    @NotNull(message = "This field is required.")
    private LocalDateTime startTime;

    @NotNull(message = "This field is required.")
    private LocalDateTime endTime;

    private AppointmentStatus status;
    private String statusDisplay;

    @Size(max = 200, message = "Ensure this field has no more than 200 characters.")
    private String location;

    private String notes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

}
