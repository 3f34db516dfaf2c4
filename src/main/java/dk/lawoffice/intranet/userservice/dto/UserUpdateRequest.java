package dk.lawoffice.intranet.userservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dk.lawoffice.intranet.userservice.model.enums.UserType;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Partial update of a user. Null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserUpdateRequest {

    @Email(message = "Enter a valid email address.")
    private String email;

    @Size(min = 1, max = 150, message = "Ensure this field has between 1 and 150 characters.")
    private String firstName;

    @Size(min = 1, max = 150, message = "Ensure this field has between 1 and 150 characters.")
    private String lastName;

    @Size(max = 20, message = "Ensure this field has no more than 20 characters.")
    private String phone;

    private String address;

    private LocalDate dateOfBirth;

    private UserType userType;

    @JsonProperty("is_active")
    private Boolean active;

}
