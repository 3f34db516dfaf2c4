package dk.lawoffice.intranet.dashboardservice.resources;

import dk.lawoffice.intranet.TestAuth;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@DisplayName("DashboardResource")
class DashboardResourceTest {

    @Test
    @DisplayName("overview reflects the caller's data and recorded activity")
    void overview() {
        String token = TestAuth.freshLawyer();
        TestAuth.createClient(token, "Dash", "Board");

        given().auth().oauth2(token)
                .when().get("/dashboard")
                .then().statusCode(200)
                .body("total_clients", equalTo(1))
                .body("new_clients_this_month", equalTo(1))
                .body("total_appointments", equalTo(0))
                .body("recent_clients.full_name", contains("Dash Board"))
                .body("recent_activities.activity_type", hasItem("client_created"))
                .body("user_info.full_name", equalTo("Test Lawyer"));
    }

    @Test
    @DisplayName("today's stats row is kept current")
    void statsHistory() {
        String token = TestAuth.freshLawyer();
        TestAuth.createClient(token, "Stat", "Row");

        given().auth().oauth2(token)
                .when().get("/dashboard/stats")
                .then().statusCode(200)
                .body("", hasSize(1))
                .body("[0].total_clients", equalTo(1));
    }

    @Test
    @DisplayName("activities can be logged manually")
    void logActivity() {
        String token = TestAuth.freshLawyer();

        given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of("activity_type", "case_updated", "description", "Reviewed the file"))
                .when().post("/dashboard/activities")
                .then().statusCode(201)
                .body("activity_type_display", equalTo("Case Updated"));

        given().auth().oauth2(token)
                .when().get("/dashboard/activities")
                .then().statusCode(200)
                .body("description", contains("Reviewed the file"));
    }

    @Test
    @DisplayName("chart windows are limited to a year")
    void chartDaysOutOfRange() {
        String token = TestAuth.freshLawyer();
        given().auth().oauth2(token)
                .queryParam("days", 0)
                .when().get("/dashboard/activity-chart")
                .then().statusCode(400)
                .body("days", hasSize(1));
        given().auth().oauth2(token)
                .queryParam("days", 366)
                .when().get("/dashboard/client-growth")
                .then().statusCode(400);
    }

    @Test
    @DisplayName("client growth counts today's new clients")
    void clientGrowth() {
        String token = TestAuth.freshLawyer();
        TestAuth.createClient(token, "Growth", "One");
        TestAuth.createClient(token, "Growth", "Two");

        given().auth().oauth2(token)
                .when().get("/dashboard/client-growth")
                .then().statusCode(200)
                .body("", hasSize(1))
                .body("[0].new_clients", equalTo(2));
    }

    @Test
    @DisplayName("profile patch ignores e-mail changes")
    void profilePatch() {
        String token = TestAuth.freshLawyer();
        String email = given().auth().oauth2(token).when().get("/dashboard/profile").then().extract().path("email");

        given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of("phone", "555-0100", "email", "changed@lawfirm.com"))
                .when().patch("/dashboard/profile")
                .then().statusCode(200)
                .body("phone", equalTo("555-0100"))
                .body("email", equalTo(email));
    }

    @Test
    @DisplayName("requires authentication")
    void anonymous() {
        given().when().get("/dashboard").then().statusCode(401);
    }
}
