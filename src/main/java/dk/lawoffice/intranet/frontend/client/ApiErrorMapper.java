package dk.lawoffice.intranet.frontend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns error responses into {@link ApiException}. Understands both error shapes of the API:
 * {@code {"detail": "..."}} and {@code {"field": ["message", ...]}}.
 */
@JBossLog
public class ApiErrorMapper implements ResponseExceptionMapper<ApiException> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public boolean handles(int status, MultivaluedMap<String, Object> headers) {
        return status >= 400;
    }

    @Override
    public ApiException toThrowable(Response response) {
        String body = response.hasEntity() ? response.readEntity(String.class) : null;
        return parse(response.getStatus(), body);
    }

    static ApiException parse(int status, String body) {
        if (body == null || body.isBlank()) return new ApiException(status, null, null);
        JsonNode json;
        try {
            json = MAPPER.readTree(body);
        } catch (IOException e) {
            log.debugf("Non-JSON error body with status %d", status);
            return new ApiException(status, body, null);
        }
        if (json.hasNonNull("detail")) {
            return new ApiException(status, json.get("detail").asText(), null);
        }
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (json.isObject()) {
            json.fields().forEachRemaining(entry -> {
                List<String> messages = new ArrayList<>();
                if (entry.getValue().isArray()) {
                    entry.getValue().forEach(message -> messages.add(message.asText()));
                } else {
                    messages.add(entry.getValue().asText());
                }
                errors.put(entry.getKey(), messages);
            });
        }
        return new ApiException(status, null, errors);
    }
}
