package dk.lawoffice.intranet.userservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dk.lawoffice.intranet.userservice.model.enums.UserType;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Payload of self-registration and of administrator-created accounts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserCreateRequest {

    @NotBlank(message = "This field is required.")
    @Email(message = "Enter a valid email address.")
    private String email;

    @NotBlank(message = "This field is required.")
    @Size(min = 8, message = "This password is too short. It must contain at least 8 characters.")
    private String password;

    private String passwordConfirm;

    @NotBlank(message = "This field is required.")
    @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
    private String firstName;

    @NotBlank(message = "This field is required.")
    @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
    private String lastName;

    private UserType userType;

    @Size(max = 20, message = "Ensure this field has no more than 20 characters.")
    private String phone;

    private String address;

    private LocalDate dateOfBirth;

}
