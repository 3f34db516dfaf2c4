package dk.lawoffice.intranet.caseservice.resources;

import dk.lawoffice.intranet.TestAuth;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.ValidatableResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@DisplayName("CaseResource")
class CaseResourceTest {

    private static String createCase(String token, String clientuuid, String title) {
        return given()
                .auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of("client", clientuuid, "title", title))
                .when().post("/cases")
                .then().statusCode(201)
                .body("status", equalTo("open"))
                .body("closed_at", nullValue())
                .extract().path("uuid");
    }

    @Test
    @DisplayName("closing a case stamps closed_at")
    void closeStampsClosedAt() {
        String token = TestAuth.freshLawyer();
        String client = TestAuth.createClient(token, "Case", "Client");
        String uuid = createCase(token, client, "Contract dispute");

        given().auth().oauth2(token)
                .when().post("/cases/{uuid}/close", uuid)
                .then().statusCode(200)
                .body("status", equalTo("closed"))
                .body("status_display", equalTo("Closed"))
                .body("closed_at", notNullValue());
    }

    @Test
    @DisplayName("patching to closed stamps closed_at every time and reopening clears it")
    void patchToClosed() throws InterruptedException {
        String token = TestAuth.freshLawyer();
        String client = TestAuth.createClient(token, "Patch", "Client");
        String uuid = createCase(token, client, "Lease renewal");

        String firstClose = patchStatus(token, uuid, "closed")
                .body("closed_at", notNullValue())
                .extract().path("closed_at");

        Thread.sleep(50);

        patchStatus(token, uuid, "closed")
                .body("status", equalTo("closed"))
                .body("closed_at", allOf(notNullValue(), not(equalTo(firstClose))));

        patchStatus(token, uuid, "in_progress")
                .body("closed_at", nullValue());
    }

    private static ValidatableResponse patchStatus(String token, String uuid, String status) {
        return given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of("status", status))
                .when().patch("/cases/{uuid}", uuid)
                .then().statusCode(200)
                .body("status", equalTo(status));
    }

    @Test
    @DisplayName("assign_to_me twice leaves one assignment")
    void assignToMeIsIdempotent() {
        String token = TestAuth.freshLawyer();
        String client = TestAuth.createClient(token, "Assign", "Client");
        String uuid = createCase(token, client, "Estate planning");

        for (int i = 0; i < 2; i++) {
            given().auth().oauth2(token)
                    .when().post("/cases/{uuid}/assign_to_me", uuid)
                    .then().statusCode(200)
                    .body("status", equalTo("case assigned to you"));
        }

        given().auth().oauth2(token)
                .when().get("/cases/{uuid}", uuid)
                .then().statusCode(200)
                .body("assigned_to", hasSize(1))
                .body("assigned_to_names", contains("Test Lawyer"));
    }

    @Test
    @DisplayName("a case needs a client the caller owns")
    void clientMustBeOwned() {
        String owner = TestAuth.freshLawyer();
        String client = TestAuth.createClient(owner, "Foreign", "Client");

        given().auth().oauth2(TestAuth.freshLawyer())
                .contentType(ContentType.JSON)
                .body(Map.of("client", client, "title", "Not mine"))
                .when().post("/cases")
                .then().statusCode(400)
                .body("client", hasItem("Invalid pk \"" + client + "\" - object does not exist."));
    }

    @Test
    @DisplayName("notes are added and listed")
    void notes() {
        String token = TestAuth.freshLawyer();
        String client = TestAuth.createClient(token, "Note", "Client");
        String uuid = createCase(token, client, "Tenancy");

        given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of("content", "Called the landlord"))
                .when().post("/cases/{uuid}/add_note", uuid)
                .then().statusCode(201);

        given().auth().oauth2(token)
                .when().get("/cases/{uuid}/notes", uuid)
                .then().statusCode(200)
                .body("content", contains("Called the landlord"));
    }

    @Test
    @DisplayName("an unknown status filter is a field error")
    void invalidStatusFilter() {
        given().auth().oauth2(TestAuth.freshLawyer())
                .queryParam("status", "archived")
                .when().get("/cases")
                .then().statusCode(400)
                .body("status", hasSize(1));
    }
}
