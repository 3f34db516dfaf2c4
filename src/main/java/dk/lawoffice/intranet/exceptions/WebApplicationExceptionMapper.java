package dk.lawoffice.intranet.exceptions;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Renders {@link WebApplicationException}s thrown by resources and services as a JSON
 * {@code {"detail": ...}} body with the exception's status.
 */
@Provider
public class WebApplicationExceptionMapper implements ExceptionMapper<WebApplicationException> {

    @Override
    public Response toResponse(WebApplicationException exception) {
        Response original = exception.getResponse();
        if (original.hasEntity()) {
            return original;
        }
        String detail = exception.getMessage() != null ? exception.getMessage() : original.getStatusInfo().getReasonPhrase();
        Response.ResponseBuilder builder = Response.status(original.getStatus())
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(detail));
        original.getHeaders().forEach((name, values) -> {
            if (!"Content-Type".equalsIgnoreCase(name)) values.forEach(value -> builder.header(name, value));
        });
        return builder.build();
    }
}
