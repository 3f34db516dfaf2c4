package dk.lawoffice.intranet.clientservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Client representation used both as request and response body. The server ignores the
 * read-only fields (uuid, full_name, created_*, updated_at) on input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClientDTO {

    private String uuid;

    @NotBlank(message = "This field is required.")
    @Size(max = 100, message = "Ensure this field has no more than 100 characters.")
    private String firstName;

    @NotBlank(message = "This field is required.")
    @Size(max = 100, message = "Ensure this field has no more than 100 characters.")
    private String lastName;

    private String fullName;

    @Email(message = "Enter a valid email address.")
    private String email;

    @Size(max = 20, message = "Ensure this field has no more than 20 characters.")
    private String phone;

    private String address;

    @Size(max = 100, message = "Ensure this field has no more than 100 characters.")
    private String city;

    @Size(max = 100, message = "Ensure this field has no more than 100 characters.")
    private String state;

    @Size(max = 20, message = "Ensure this field has no more than 20 characters.")
    private String postalCode;

    @Size(max = 100, message = "Ensure this field has no more than 100 characters.")
    private String country;

    private LocalDate dateOfBirth;

    @Size(max = 100, message = "Ensure this field has no more than 100 characters.")
    private String occupation;

    @Size(max = 200, message = "Ensure this field has no more than 200 characters.")
    private String company;

    @JsonProperty("is_active")
    private Boolean active;

    private String createdBy;
    private String createdByName;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

}
