package dk.lawoffice.intranet.frontend.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.ws.rs.ext.ContextResolver;
import org.eclipse.microprofile.rest.client.RestClientBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds {@link LawOfficeApi} clients against one base URL. Each client gets its own
 * {@link TokenStore}, so a web request and the terminal client never share tokens.
 */
public class ApiClientFactory {

    private final URI baseUri;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public ApiClientFactory(String baseUrl, Duration timeout) {
        this.baseUri = URI.create(baseUrl);
        this.timeout = timeout;
        this.objectMapper = createObjectMapper();
    }

    public LawOfficeApi create(TokenStore tokenStore) {
        return RestClientBuilder.newBuilder()
                .baseUri(baseUri)
                .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .register(new BearerTokenFilter(tokenStore))
                .register(new ObjectMapperResolver(objectMapper))
                .register(ApiErrorMapper.class)
                .build(LawOfficeApi.class);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    static class ObjectMapperResolver implements ContextResolver<ObjectMapper> {

        private final ObjectMapper objectMapper;

        ObjectMapperResolver(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        public ObjectMapper getContext(Class<?> type) {
            return objectMapper;
        }
    }
}
