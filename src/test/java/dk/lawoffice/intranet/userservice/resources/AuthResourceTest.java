package dk.lawoffice.intranet.userservice.resources;

import dk.lawoffice.intranet.TestAuth;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@DisplayName("AuthResource")
class AuthResourceTest {

    @Nested
    @DisplayName("POST /auth/login")
    class Login {

        @Test
        void seededLawyerReceivesBothTokensAndProfile() {
            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("email", TestAuth.JOHN, "password", TestAuth.SEED_PASSWORD))
                    .when().post("/auth/login")
                    .then().statusCode(200)
                    .body("access", not(emptyOrNullString()))
                    .body("refresh", not(emptyOrNullString()))
                    .body("user.email", equalTo(TestAuth.JOHN))
                    .body("user.user_type", equalTo("lawyer"))
                    .body("user.full_name", equalTo("John Doe"));
        }

        @Test
        void wrongPasswordIsUnauthorized() {
            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("email", TestAuth.JOHN, "password", "not-the-password"))
                    .when().post("/auth/login")
                    .then().statusCode(401)
                    .body("detail", not(emptyOrNullString()));
        }

        @Test
        void missingFieldsAreReportedPerField() {
            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("email", TestAuth.JOHN))
                    .when().post("/auth/login")
                    .then().statusCode(400)
                    .body("password", hasItem("This field is required."));
        }
    }

    @Nested
    @DisplayName("token lifecycle")
    class Tokens {

        @Test
        void refreshVerifyAndLogoutRevokesRefreshToken() {
            Response login = given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("email", TestAuth.JANE, "password", TestAuth.SEED_PASSWORD))
                    .when().post("/auth/login");
            String refresh = login.path("refresh");
            String access = login.path("access");

            String renewed = given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("refresh", refresh))
                    .when().post("/auth/token/refresh")
                    .then().statusCode(200)
                    .body("access", not(emptyOrNullString()))
                    .extract().path("access");

            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("token", renewed))
                    .when().post("/auth/token/verify")
                    .then().statusCode(200);

            given()
                    .auth().oauth2(access)
                    .contentType(ContentType.JSON)
                    .body(Map.of("refresh", refresh))
                    .when().post("/auth/logout")
                    .then().statusCode(204);

            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("refresh", refresh))
                    .when().post("/auth/token/refresh")
                    .then().statusCode(401);
        }

        @Test
        void accessTokenIsNotAcceptedAsRefreshToken() {
            String access = TestAuth.john();
            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("refresh", access))
                    .when().post("/auth/token/refresh")
                    .then().statusCode(401);
        }

        @Test
        void refreshTokenIsNotAcceptedAsBearerCredentials() {
            String refresh = given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("email", TestAuth.JOHN, "password", TestAuth.SEED_PASSWORD))
                    .when().post("/auth/login")
                    .then().statusCode(200)
                    .extract().path("refresh");

            given()
                    .auth().oauth2(refresh)
                    .when().get("/clients")
                    .then().statusCode(401);

            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("token", refresh))
                    .when().post("/auth/token/verify")
                    .then().statusCode(401);
        }

        @Test
        void garbageTokenFailsVerification() {
            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("token", "not.a.jwt"))
                    .when().post("/auth/token/verify")
                    .then().statusCode(401);
        }
    }

    @Nested
    @DisplayName("POST /auth/register")
    class Register {

        @Test
        void administratorsCannotSelfRegister() {
            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of(
                            "email", "boss-" + UUID.randomUUID() + "@lawfirm.com",
                            "password", "secret-pass-1",
                            "password_confirm", "secret-pass-1",
                            "first_name", "Big",
                            "last_name", "Boss",
                            "user_type", "admin"))
                    .when().post("/auth/register")
                    .then().statusCode(400)
                    .body("user_type", hasSize(1));
        }

        @Test
        void mismatchingPasswordsAreRejected() {
            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of(
                            "email", "typo-" + UUID.randomUUID() + "@lawfirm.com",
                            "password", "secret-pass-1",
                            "password_confirm", "secret-pass-2",
                            "first_name", "Ty",
                            "last_name", "Po"))
                    .when().post("/auth/register")
                    .then().statusCode(400)
                    .body("password", hasItem("Password fields didn't match."));
        }

        @Test
        void duplicateEmailIsRejected() {
            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of(
                            "email", TestAuth.JOHN,
                            "password", "secret-pass-1",
                            "password_confirm", "secret-pass-1",
                            "first_name", "John",
                            "last_name", "Again"))
                    .when().post("/auth/register")
                    .then().statusCode(400)
                    .body("email", hasSize(1));
        }
    }

    @Nested
    @DisplayName("GET /auth/profile")
    class Profile {

        @Test
        void requiresBearerToken() {
            given()
                    .when().get("/auth/profile")
                    .then().statusCode(401);
        }

        @Test
        void returnsCallerProfile() {
            given()
                    .auth().oauth2(TestAuth.jane())
                    .when().get("/auth/profile")
                    .then().statusCode(200)
                    .body("email", equalTo(TestAuth.JANE))
                    .body("user_type", equalTo("paralegal"))
                    .body("user_type_display", equalTo("Paralegal"));
        }
    }

    @Nested
    @DisplayName("PUT /auth/change-password")
    class ChangePassword {

        @Test
        void wrongOldPasswordIsReportedOnOldPassword() {
            given()
                    .auth().oauth2(TestAuth.freshLawyer())
                    .contentType(ContentType.JSON)
                    .body(Map.of("old_password", "not-my-password", "new_password", "another-pass-2"))
                    .when().put("/auth/change-password")
                    .then().statusCode(400)
                    .body("old_password", contains("Wrong password."));
        }

        @Test
        void shortNewPasswordIsRejected() {
            given()
                    .auth().oauth2(TestAuth.freshLawyer())
                    .contentType(ContentType.JSON)
                    .body(Map.of("old_password", TestAuth.FRESH_PASSWORD, "new_password", "short"))
                    .when().put("/auth/change-password")
                    .then().statusCode(400)
                    .body("new_password", hasSize(1));
        }

        @Test
        void newPasswordReplacesTheOldOne() {
            String email = "mover-" + UUID.randomUUID() + "@lawfirm.com";
            TestAuth.registerLawyer(email);

            given()
                    .auth().oauth2(TestAuth.login(email, TestAuth.FRESH_PASSWORD))
                    .contentType(ContentType.JSON)
                    .body(Map.of("old_password", TestAuth.FRESH_PASSWORD, "new_password", "another-pass-2"))
                    .when().put("/auth/change-password")
                    .then().statusCode(200)
                    .body("message", equalTo("Password updated successfully"));

            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("email", email, "password", TestAuth.FRESH_PASSWORD))
                    .when().post("/auth/login")
                    .then().statusCode(401);

            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("email", email, "password", "another-pass-2"))
                    .when().post("/auth/login")
                    .then().statusCode(200)
                    .body("user.email", equalTo(email));
        }
    }
}
