package dk.lawoffice.intranet.userservice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "This field is required.")
    private String email;

    @NotBlank(message = "This field is required.")
    private String password;

}
