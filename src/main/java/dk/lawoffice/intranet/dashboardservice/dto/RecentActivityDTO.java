package dk.lawoffice.intranet.dashboardservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dk.lawoffice.intranet.events.ActivityType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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
public class RecentActivityDTO {

    private String uuid;
    private String user;

    @NotNull(message = "This field is required.")
    private ActivityType activityType;

    private String activityTypeDisplay;

    @NotBlank(message = "This field is required.")
    @Size(max = 500, message = "Ensure this field has no more than 500 characters.")
    private String description;

    @Size(max = 36, message = "Ensure this field has no more than 36 characters.")
    private String relatedObjectId;

    private LocalDateTime createdAt;

}
