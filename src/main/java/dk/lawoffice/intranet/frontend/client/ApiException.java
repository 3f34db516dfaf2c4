package dk.lawoffice.intranet.frontend.client;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Non-2xx answer from the API, or a failure to reach it (status 0).
 */
@Getter
public class ApiException extends RuntimeException {

    private final int status;
    private final String detail;
    private final Map<String, List<String>> fieldErrors;

    public ApiException(int status, String detail, Map<String, List<String>> fieldErrors) {
        super("HTTP " + status + ": " + (detail != null ? detail : fieldErrors));
        this.status = status;
        this.detail = detail;
        this.fieldErrors = fieldErrors != null ? fieldErrors : Collections.emptyMap();
    }

    public ApiException(String detail, Throwable cause) {
        super(detail, cause);
        this.status = 0;
        this.detail = detail;
        this.fieldErrors = Collections.emptyMap();
    }

    public boolean isUnauthorized() {
        return status == 401;
    }

    /**
     * Text suitable for showing to the user: the detail, or the field errors as
     * {@code field: message} lines.
     */
    public String userMessage() {
        if (detail != null && !detail.isBlank()) return detail;
        if (fieldErrors.isEmpty()) return "Request failed with status " + status;
        return fieldErrors.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + String.join(" ", entry.getValue()))
                .collect(Collectors.joining("\n"));
    }
}
