package dk.lawoffice.intranet;

import io.restassured.http.ContentType;

import java.util.Map;
import java.util.UUID;

import static io.restassured.RestAssured.given;

/**
 * Logs users in against the running test instance. The seeded accounts are available because
 * the test profile enables the sample data.
 */
public final class TestAuth {

    public static final String JOHN = "john.doe@lawfirm.com";
    public static final String JANE = "jane.smith@lawfirm.com";
    public static final String SEED_PASSWORD = "password123";
    public static final String FRESH_PASSWORD = "secret-pass-1";

    private TestAuth() {
    }

    public static String login(String email, String password) {
        return given()
                .contentType(ContentType.JSON)
                .body(Map.of("email", email, "password", password))
                .when().post("/auth/login")
                .then().statusCode(200)
                .extract().path("access");
    }

    public static String john() {
        return login(JOHN, SEED_PASSWORD);
    }

    public static String jane() {
        return login(JANE, SEED_PASSWORD);
    }

    /**
     * Registers a lawyer with no data of its own and returns its access token.
     */
    public static String freshLawyer() {
        String email = "lawyer-" + UUID.randomUUID() + "@lawfirm.com";
        registerLawyer(email);
        return login(email, FRESH_PASSWORD);
    }

    public static void registerLawyer(String email) {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                        "email", email,
                        "password", FRESH_PASSWORD,
                        "password_confirm", FRESH_PASSWORD,
                        "first_name", "Test",
                        "last_name", "Lawyer",
                        "user_type", "lawyer"))
                .when().post("/auth/register")
                .then().statusCode(201);
    }

    public static String createClient(String token, String firstName, String lastName) {
        return given()
                .auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of("first_name", firstName, "last_name", lastName, "city", "Boston"))
                .when().post("/clients")
                .then().statusCode(201)
                .extract().path("uuid");
    }
}
