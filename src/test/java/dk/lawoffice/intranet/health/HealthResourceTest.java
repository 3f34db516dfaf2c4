package dk.lawoffice.intranet.health;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;

@QuarkusTest
class HealthResourceTest {

    @Test
    void healthIsPublic() {
        given()
                .when().get("/health")
                .then().statusCode(200)
                .body("status", equalTo("healthy"))
                .body("service", equalTo("lawyer-office-management-api"))
                .body("version", equalTo("1.0.0"));
    }

    @Test
    void responsesCarryCorsHeaders() {
        given()
                .when().get("/health")
                .then().statusCode(200)
                .header("Access-Control-Allow-Origin", equalTo("*"))
                .header("Access-Control-Allow-Methods", equalTo("GET, POST, PUT, PATCH, DELETE, OPTIONS"));
    }

    @Test
    void microprofileChecksAreUp() {
        given()
                .when().get("/q/health")
                .then().statusCode(200)
                .body("status", equalTo("UP"));
    }
}
