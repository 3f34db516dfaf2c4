package dk.lawoffice.intranet.clientservice.resources;

import dk.lawoffice.intranet.TestAuth;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@DisplayName("ClientResource")
class ClientResourceTest {

    @Test
    @DisplayName("created client is returned with owner and derived full name")
    void createAndFetch() {
        String token = TestAuth.freshLawyer();
        String uuid = TestAuth.createClient(token, "Ada", "Lovelace");

        given()
                .auth().oauth2(token)
                .when().get("/clients/{uuid}", uuid)
                .then().statusCode(200)
                .body("full_name", equalTo("Ada Lovelace"))
                .body("is_active", equalTo(true))
                .body("created_by_name", equalTo("Test Lawyer"));
    }

    @Test
    @DisplayName("clients of another lawyer are invisible")
    void ownershipIsolation() {
        String owner = TestAuth.freshLawyer();
        String uuid = TestAuth.createClient(owner, "Private", "Person");
        String other = TestAuth.freshLawyer();

        given().auth().oauth2(other)
                .when().get("/clients/{uuid}", uuid)
                .then().statusCode(404);
        given().auth().oauth2(other)
                .contentType(ContentType.JSON)
                .body(Map.of("first_name", "Hijacked"))
                .when().patch("/clients/{uuid}", uuid)
                .then().statusCode(404);
        given().auth().oauth2(other)
                .when().delete("/clients/{uuid}", uuid)
                .then().statusCode(404);
        given().auth().oauth2(other)
                .when().get("/clients")
                .then().statusCode(200)
                .body("count", equalTo(0));
    }

    @Test
    @DisplayName("blank names are rejected per field")
    void validation() {
        given()
                .auth().oauth2(TestAuth.freshLawyer())
                .contentType(ContentType.JSON)
                .body(Map.of("first_name", "", "email", "not-an-email"))
                .when().post("/clients")
                .then().statusCode(400)
                .body("first_name", hasItem("This field is required."))
                .body("last_name", hasItem("This field is required."))
                .body("email", hasItem("Enter a valid email address."));
    }

    @Test
    @DisplayName("client e-mail is unique")
    void duplicateEmail() {
        String token = TestAuth.freshLawyer();
        String email = "client-" + UUID.randomUUID() + "@example.com";
        Map<String, Object> body = Map.of("first_name", "Dup", "last_name", "Licate", "email", email);
        given().auth().oauth2(token).contentType(ContentType.JSON).body(body)
                .when().post("/clients").then().statusCode(201);
        given().auth().oauth2(token).contentType(ContentType.JSON).body(body)
                .when().post("/clients").then().statusCode(400)
                .body("email", hasSize(1));
    }

    @Test
    @DisplayName("stats count active, inactive and top cities of the caller's clients")
    void stats() {
        String token = TestAuth.freshLawyer();
        TestAuth.createClient(token, "First", "Client");
        String second = TestAuth.createClient(token, "Second", "Client");

        given().auth().oauth2(token)
                .when().post("/clients/{uuid}/deactivate", second)
                .then().statusCode(200)
                .body("is_active", equalTo(false));

        given().auth().oauth2(token)
                .when().get("/clients/stats")
                .then().statusCode(200)
                .body("total_clients", equalTo(2))
                .body("active_clients", equalTo(1))
                .body("inactive_clients", equalTo(1))
                .body("new_clients_this_month", equalTo(2))
                .body("top_cities[0].city", equalTo("Boston"))
                .body("top_cities[0].count", equalTo(2));

        given().auth().oauth2(token)
                .queryParam("is_active", false)
                .when().get("/clients")
                .then().statusCode(200)
                .body("count", equalTo(1))
                .body("results[0].uuid", equalTo(second));
    }

    @Test
    @DisplayName("search matches name fragments case-insensitively")
    void search() {
        String token = TestAuth.freshLawyer();
        TestAuth.createClient(token, "Grace", "Hopper");
        TestAuth.createClient(token, "Alan", "Turing");

        given().auth().oauth2(token)
                .queryParam("search", "hop")
                .when().get("/clients")
                .then().statusCode(200)
                .body("count", equalTo(1))
                .body("results[0].last_name", equalTo("Hopper"));
    }

    @Test
    @DisplayName("seeded clients belong to John")
    void seededClients() {
        given().auth().oauth2(TestAuth.john())
                .queryParam("search", "Michael")
                .when().get("/clients")
                .then().statusCode(200)
                .body("results.full_name", hasItem("Michael Johnson"));
    }
}
