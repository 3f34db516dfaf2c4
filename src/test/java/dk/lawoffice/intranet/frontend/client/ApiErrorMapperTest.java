package dk.lawoffice.intranet.frontend.client;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorMapperTest {

    @Test
    void detailBody() {
        ApiException error = ApiErrorMapper.parse(404, "{\"detail\":\"Client not found: abc\"}");

        assertEquals(404, error.getStatus());
        assertEquals("Client not found: abc", error.userMessage());
        assertTrue(error.getFieldErrors().isEmpty());
    }

    @Test
    void fieldErrorBody() {
        ApiException error = ApiErrorMapper.parse(400,
                "{\"email\":[\"Enter a valid email address.\"],\"non_field_errors\":\"End time must be after start time.\"}");

        assertNull(error.getDetail());
        assertEquals(List.of("Enter a valid email address."), error.getFieldErrors().get("email"));
        assertEquals(List.of("End time must be after start time."), error.getFieldErrors().get("non_field_errors"));
        assertEquals("email: Enter a valid email address.\nnon_field_errors: End time must be after start time.", error.userMessage());
    }

    @Test
    void plainTextAndEmptyBodies() {
        assertEquals("Bad Gateway", ApiErrorMapper.parse(502, "Bad Gateway").userMessage());
        assertEquals("Request failed with status 500", ApiErrorMapper.parse(500, null).userMessage());
        assertTrue(ApiErrorMapper.parse(401, "").isUnauthorized());
    }
}
