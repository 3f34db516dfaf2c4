package dk.lawoffice.intranet.userservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a successful login: a short-lived access token, a long-lived refresh token and
 * the authenticated user.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    private String access;
    private String refresh;
    private UserDTO user;

}
