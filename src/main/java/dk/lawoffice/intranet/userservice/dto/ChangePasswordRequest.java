package dk.lawoffice.intranet.userservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChangePasswordRequest {

    @NotBlank(message = "This field is required.")
    private String oldPassword;

    @NotBlank(message = "This field is required.")
    @Size(min = 8, message = "This password is too short. It must contain at least 8 characters.")
    private String newPassword;

}
