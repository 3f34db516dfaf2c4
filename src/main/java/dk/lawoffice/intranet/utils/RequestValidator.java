package dk.lawoffice.intranet.utils;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import dk.lawoffice.intranet.exceptions.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs Bean Validation on a request payload and reports violations keyed by their JSON
 * (snake_case) field name.
 */
@ApplicationScoped
public class RequestValidator {

    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE = new PropertyNamingStrategies.SnakeCaseStrategy();

    @Inject
    Validator validator;

    public <T> T validate(T payload) {
        if (payload == null) {
            throw ValidationException.nonField("Request body is required.");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (violations.isEmpty()) return payload;

        Map<String, List<String>> errors = new LinkedHashMap<>();
        violations.stream()
                .sorted((a, b) -> a.getPropertyPath().toString().compareTo(b.getPropertyPath().toString()))
                .forEach(violation -> errors
                        .computeIfAbsent(fieldName(violation), k -> new ArrayList<>())
                        .add(violation.getMessage()));
        throw new ValidationException(errors);
    }

    static String fieldName(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        if (path.isEmpty()) return ValidationException.NON_FIELD_ERRORS;
        StringBuilder result = new StringBuilder();
        for (String segment : path.split("\\.")) {
            if (result.length() > 0) result.append('.');
            int bracket = segment.indexOf('[');
            String name = bracket >= 0 ? segment.substring(0, bracket) : segment;
            result.append(SNAKE_CASE.translate(name));
            if (bracket >= 0) result.append(segment.substring(bracket));
        }
        return result.toString();
    }
}
