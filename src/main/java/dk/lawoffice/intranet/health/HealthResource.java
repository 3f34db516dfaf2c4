package dk.lawoffice.intranet.health;

import jakarta.annotation.security.PermitAll;
import jakarta.enterprise.context.RequestScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated probe for load balancers. The MicroProfile checks live under {@code /q/health}.
 */
@Tag(name = "health")
@Path("/health")
@RequestScoped
@PermitAll
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    static final String SERVICE_NAME = "lawyer-office-management-api";

    @ConfigProperty(name = "lawoffice.version", defaultValue = "1.0.0")
    String version;

    @GET
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        body.put("version", version);
        return body;
    }
}
