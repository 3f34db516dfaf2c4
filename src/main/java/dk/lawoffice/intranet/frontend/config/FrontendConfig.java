package dk.lawoffice.intranet.frontend.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;

/**
 * Settings of the front-end clients under {@code lawoffice.frontend}.
 */
@ConfigMapping(prefix = "lawoffice.frontend")
public interface FrontendConfig {

    @WithDefault("http://localhost:9093")
    String apiBaseUrl();

    /**
     * Connect and read timeout of API calls, in seconds.
     */
    @WithDefault("30")
    int timeout();

    String tokenFile();

    /**
     * Colours keyed by status value with dashes, e.g. {@code in-progress}, plus {@code primary}.
     */
    Map<String, String> theme();
}
