package dk.lawoffice.intranet.exceptions;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised when a request payload fails validation. Carries the errors keyed by the
 * snake_case field name they belong to; errors spanning several fields use {@link #NON_FIELD_ERRORS}.
 */
@Getter
public class ValidationException extends RuntimeException {

    public static final String NON_FIELD_ERRORS = "non_field_errors";

    private final Map<String, List<String>> errors;

    public ValidationException(Map<String, List<String>> errors) {
        super("Validation failed: " + errors);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static ValidationException of(String field, String message) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
        return new ValidationException(errors);
    }

    public static ValidationException nonField(String message) {
        return of(NON_FIELD_ERRORS, message);
    }
}
