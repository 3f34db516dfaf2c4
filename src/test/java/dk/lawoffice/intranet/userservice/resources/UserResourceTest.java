package dk.lawoffice.intranet.userservice.resources;

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
@DisplayName("UserResource")
class UserResourceTest {

    private static String admin() {
        return TestAuth.login("admin@lawfirm.com", "admin123");
    }

    @Test
    @DisplayName("only administrators manage users")
    void nonAdminIsForbidden() {
        given().auth().oauth2(TestAuth.john())
                .when().get("/users")
                .then().statusCode(403);
    }

    @Test
    @DisplayName("administrators list, create and delete users")
    void adminLifecycle() {
        String token = admin();

        given().auth().oauth2(token)
                .when().get("/users")
                .then().statusCode(200)
                .body("results.email", hasItems(TestAuth.JOHN, TestAuth.JANE));

        String email = "clerk-" + UUID.randomUUID() + "@lawfirm.com";
        String uuid = given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of(
                        "email", email,
                        "password", "secret-pass-1",
                        "password_confirm", "secret-pass-1",
                        "first_name", "Office",
                        "last_name", "Clerk",
                        "user_type", "admin"))
                .when().post("/users")
                .then().statusCode(201)
                .body("user_type", equalTo("admin"))
                .extract().path("uuid");

        given().auth().oauth2(token)
                .when().delete("/users/{uuid}", uuid)
                .then().statusCode(204);

        given().auth().oauth2(token)
                .when().get("/users/{uuid}", uuid)
                .then().statusCode(404);
    }

    @Test
    @DisplayName("me resolves to the caller and other users are off limits")
    void selfOnlyForNonAdmins() {
        String john = TestAuth.john();

        given().auth().oauth2(john)
                .when().get("/users/me")
                .then().statusCode(200)
                .body("email", equalTo(TestAuth.JOHN));

        String adminUuid = given().auth().oauth2(admin())
                .when().get("/auth/profile")
                .then().statusCode(200)
                .extract().path("uuid");

        given().auth().oauth2(john)
                .when().get("/users/{uuid}", adminUuid)
                .then().statusCode(403);
    }

    @Test
    @DisplayName("pages carry next and previous links")
    void pagination() {
        given().auth().oauth2(admin())
                .queryParam("page_size", 1)
                .queryParam("page", 2)
                .when().get("/users")
                .then().statusCode(200)
                .body("results", hasSize(1))
                .body("next", containsString("page=3"))
                .body("previous", containsString("page=1"));
    }
}
