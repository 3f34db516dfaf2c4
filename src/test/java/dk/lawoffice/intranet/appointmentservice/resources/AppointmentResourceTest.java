package dk.lawoffice.intranet.appointmentservice.resources;

import dk.lawoffice.intranet.TestAuth;
import dk.lawoffice.intranet.exceptions.ValidationException;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@QuarkusTest
@DisplayName("AppointmentResource")
class AppointmentResourceTest {

    private static Map<String, Object> appointment(String title, LocalDateTime start, LocalDateTime end) {
        Map<String, Object> body = new HashMap<>();
        body.put("title", title);
        body.put("start_time", start.toString());
        body.put("end_time", end.toString());
        body.put("location", "Office 2");
        return body;
    }

    private static String create(String token, Map<String, Object> body) {
        return given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(body)
                .when().post("/appointments")
                .then().statusCode(201)
                .extract().path("uuid");
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        void defaultsToScheduled() {
            LocalDateTime start = LocalDate.now().plusDays(3).atTime(10, 0);
            given().auth().oauth2(TestAuth.freshLawyer())
                    .contentType(ContentType.JSON)
                    .body(appointment("Intake", start, start.plusHours(1)))
                    .when().post("/appointments")
                    .then().statusCode(201)
                    .body("status", equalTo("scheduled"))
                    .body("status_display", equalTo("Scheduled"))
                    .body("user_name", equalTo("Test Lawyer"));
        }

        @Test
        void endBeforeStartIsANonFieldError() {
            LocalDateTime start = LocalDate.now().plusDays(3).atTime(10, 0);
            given().auth().oauth2(TestAuth.freshLawyer())
                    .contentType(ContentType.JSON)
                    .body(appointment("Backwards", start, start.minusMinutes(30)))
                    .when().post("/appointments")
                    .then().statusCode(400)
                    .body(ValidationException.NON_FIELD_ERRORS, hasItem("End time must be after start time."));
        }

        @Test
        void equalStartAndEndIsRejected() {
            LocalDateTime start = LocalDate.now().plusDays(3).atTime(10, 0);
            given().auth().oauth2(TestAuth.freshLawyer())
                    .contentType(ContentType.JSON)
                    .body(appointment("Instant", start, start))
                    .when().post("/appointments")
                    .then().statusCode(400);
        }

        @Test
        void overlappingAppointmentsAreAccepted() {
            String token = TestAuth.freshLawyer();
            LocalDateTime start = LocalDate.now().plusDays(4).atTime(14, 0);
            create(token, appointment("First", start, start.plusHours(1)));
            create(token, appointment("Second", start, start.plusHours(1)));

            given().auth().oauth2(token)
                    .when().get("/appointments")
                    .then().statusCode(200)
                    .body("count", equalTo(2));
        }

        @Test
        void patchCannotMoveEndBeforeStart() {
            String token = TestAuth.freshLawyer();
            LocalDateTime start = LocalDate.now().plusDays(5).atTime(9, 0);
            String uuid = create(token, appointment("Patchable", start, start.plusHours(1)));

            given().auth().oauth2(token)
                    .contentType(ContentType.JSON)
                    .body(Map.of("end_time", start.minusHours(1).toString()))
                    .when().patch("/appointments/{uuid}", uuid)
                    .then().statusCode(400)
                    .body(ValidationException.NON_FIELD_ERRORS, hasSize(1));
        }
    }

    @Nested
    @DisplayName("status actions")
    class StatusActions {

        @Test
        void confirmThenComplete() {
            String token = TestAuth.freshLawyer();
            LocalDateTime start = LocalDate.now().plusDays(2).atTime(11, 0);
            String uuid = create(token, appointment("Review", start, start.plusHours(1)));

            given().auth().oauth2(token)
                    .when().post("/appointments/{uuid}/confirm", uuid)
                    .then().statusCode(200)
                    .body("status", equalTo("appointment confirmed"));
            given().auth().oauth2(token)
                    .when().get("/appointments/{uuid}", uuid)
                    .then().body("status", equalTo("confirmed"));

            given().auth().oauth2(token)
                    .when().post("/appointments/{uuid}/complete", uuid)
                    .then().statusCode(200)
                    .body("status", equalTo("appointment completed"));

            given().auth().oauth2(token)
                    .queryParam("status", "completed")
                    .when().get("/appointments")
                    .then().body("count", equalTo(1));
        }

        @Test
        void anotherUsersAppointmentIsNotFound() {
            String owner = TestAuth.freshLawyer();
            LocalDateTime start = LocalDate.now().plusDays(2).atTime(15, 0);
            String uuid = create(owner, appointment("Private", start, start.plusHours(1)));

            given().auth().oauth2(TestAuth.freshLawyer())
                    .when().post("/appointments/{uuid}/cancel", uuid)
                    .then().statusCode(404);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void calendarNeedsBothBounds() {
            given().auth().oauth2(TestAuth.freshLawyer())
                    .queryParam("start", LocalDate.now().toString())
                    .when().get("/appointments/calendar")
                    .then().statusCode(400)
                    .body(ValidationException.NON_FIELD_ERRORS, hasItem("start and end parameters are required."));
        }

        @Test
        void calendarReturnsAppointmentsInRange() {
            String token = TestAuth.freshLawyer();
            LocalDate day = LocalDate.now().plusDays(10);
            create(token, appointment("In range", day.atTime(9, 0), day.atTime(10, 0)));
            create(token, appointment("Out of range", day.plusDays(5).atTime(9, 0), day.plusDays(5).atTime(10, 0)));

            given().auth().oauth2(token)
                    .queryParam("start", day.toString())
                    .queryParam("end", day.toString())
                    .when().get("/appointments/calendar")
                    .then().statusCode(200)
                    .body("title", contains("In range"));
        }

        @Test
        void upcomingAndStatsCountFutureAppointments() {
            String token = TestAuth.freshLawyer();
            LocalDateTime start = LocalDate.now().plusDays(1).atTime(9, 30);
            create(token, appointment("Tomorrow", start, start.plusHours(1)));

            given().auth().oauth2(token)
                    .when().get("/appointments/upcoming")
                    .then().statusCode(200)
                    .body("title", contains("Tomorrow"));

            given().auth().oauth2(token)
                    .when().get("/appointments/stats")
                    .then().statusCode(200)
                    .body("total", equalTo(1))
                    .body("upcoming", equalTo(1))
                    .body("completed", equalTo(0));
        }

        @Test
        void invalidDateFilterIsAFieldError() {
            given().auth().oauth2(TestAuth.freshLawyer())
                    .queryParam("start_date", "yesterday")
                    .when().get("/appointments")
                    .then().statusCode(400)
                    .body("start_date", hasSize(1));
        }
    }

    @Test
    @DisplayName("date-only upper bounds include the whole day")
    void parseBoundExtendsDateOnlyUpperBound() {
        assertEquals(LocalDate.of(2025, 3, 2).atStartOfDay(), AppointmentResource.parseBound("end_date", "2025-03-01", true));
        assertEquals(LocalDate.of(2025, 3, 1).atStartOfDay(), AppointmentResource.parseBound("start_date", "2025-03-01", false));
        assertEquals(LocalDateTime.of(2025, 3, 1, 9, 30), AppointmentResource.parseBound("start_date", "2025-03-01T09:30:00Z", false));
        assertThrows(ValidationException.class, () -> AppointmentResource.parseBound("start_date", "03/01/2025", false));
    }
}
