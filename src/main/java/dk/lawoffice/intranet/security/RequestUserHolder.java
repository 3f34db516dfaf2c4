package dk.lawoffice.intranet.security;

import jakarta.enterprise.context.RequestScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import lombok.Getter;
import lombok.Setter;

import java.util.HashSet;
import java.util.Set;

/**
 * The authenticated caller of the current request, resolved from the bearer token by
 * {@link RequestUserFilter}. Services receive the user uuid from here and scope every
 * query to it.
 */
@Getter
@Setter
@RequestScoped
public class RequestUserHolder {

    private String userUuid;
    private String email = "anonymous";
    private Set<String> roles = new HashSet<>();

    public boolean isAuthenticated() {
        return userUuid != null;
    }

    public boolean isAdmin() {
        return roles.contains(Roles.ADMIN);
    }

    public String requireUserUuid() {
        if (userUuid == null) {
            throw new WebApplicationException("Authentication credentials were not provided.", Response.Status.UNAUTHORIZED);
        }
        return userUuid;
    }
}
