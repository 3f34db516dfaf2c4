package dk.lawoffice.intranet.health;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

@Liveness
@ApplicationScoped
public class CustomHealthCheck implements HealthCheck {

    @ConfigProperty(name = "lawoffice.version", defaultValue = "1.0.0")
    String version;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named(HealthResource.SERVICE_NAME)
                .up()
                .withData("version", version)
                .build();
    }
}
