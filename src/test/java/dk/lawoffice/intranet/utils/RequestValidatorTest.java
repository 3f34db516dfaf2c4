package dk.lawoffice.intranet.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.exceptions.ValidationException;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class RequestValidatorTest {

    @Inject
    RequestValidator validator;

    @Inject
    JsonPatcher patcher;

    @Inject
    ObjectMapper objectMapper;

    @Test
    void violationsAreKeyedBySnakeCaseField() {
        ClientDTO dto = ClientDTO.builder().firstName("Ada").postalCode("123456789012345678901").build();

        ValidationException error = assertThrows(ValidationException.class, () -> validator.validate(dto));

        assertEquals(List.of("This field is required."), error.getErrors().get("last_name"));
        assertEquals(List.of("Ensure this field has no more than 20 characters."), error.getErrors().get("postal_code"));
    }

    @Test
    void missingBodyIsANonFieldError() {
        ValidationException error = assertThrows(ValidationException.class, () -> validator.validate(null));

        assertTrue(error.getErrors().containsKey(ValidationException.NON_FIELD_ERRORS));
    }

    @Test
    void patchOnlyTouchesGivenFields() throws Exception {
        ClientDTO current = ClientDTO.builder().firstName("Ada").lastName("Byron").city("London").build();

        ClientDTO merged = patcher.merge(current, objectMapper.readTree("{\"last_name\":\"Lovelace\"}"));

        assertEquals("Ada", merged.getFirstName());
        assertEquals("Lovelace", merged.getLastName());
        assertEquals("London", merged.getCity());
    }

    @Test
    void patchMustBeAnObject() throws Exception {
        ClientDTO current = ClientDTO.builder().firstName("Ada").build();

        assertThrows(ValidationException.class, () -> patcher.merge(current, objectMapper.readTree("[1, 2]")));
    }
}
