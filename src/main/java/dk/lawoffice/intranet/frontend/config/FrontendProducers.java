package dk.lawoffice.intranet.frontend.config;

import dk.lawoffice.intranet.frontend.client.ApiClientFactory;
import dk.lawoffice.intranet.frontend.format.StatusPalette;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;

@ApplicationScoped
public class FrontendProducers {

    @Inject
    FrontendConfig config;

    @Produces
    @Singleton
    ApiClientFactory apiClientFactory() {
        return new ApiClientFactory(config.apiBaseUrl(), Duration.ofSeconds(config.timeout()));
    }

    @Produces
    @Singleton
    StatusPalette statusPalette() {
        return new StatusPalette(config.theme());
    }
}
