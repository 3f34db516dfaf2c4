package dk.lawoffice.intranet.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dk.lawoffice.intranet.exceptions.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;

/**
 * Applies a PATCH body onto the current representation of a resource. Keys absent from the
 * body keep their current value; keys present with {@code null} are cleared.
 */
@ApplicationScoped
public class JsonPatcher {

    @Inject
    ObjectMapper objectMapper;

    public <T> T merge(T current, JsonNode patch) {
        if (patch == null || patch.isNull()) return current;
        if (!patch.isObject()) {
            throw ValidationException.nonField("Expected a JSON object.");
        }
        try {
            return objectMapper.readerForUpdating(current).readValue(patch);
        } catch (IOException e) {
            throw ValidationException.nonField("Invalid value: " + e.getMessage());
        }
    }
}
