package dk.lawoffice.intranet.frontend.web;

import dk.lawoffice.intranet.TestAuth;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@DisplayName("WebUiResource")
class WebUiResourceTest {

    private static Response login(String email, String password) {
        return given()
                .redirects().follow(false)
                .contentType(ContentType.URLENC)
                .formParam("email", email)
                .formParam("password", password)
                .when().post("/web/login");
    }

    @Test
    @DisplayName("pages without a session redirect to the login form")
    void anonymousRedirect() {
        given()
                .redirects().follow(false)
                .when().get("/web/clients")
                .then().statusCode(303)
                .header("Location", endsWith("/web/login"));

        given()
                .when().get("/web/login")
                .then().statusCode(200)
                .contentType(containsString("text/html"))
                .body(containsString("name=\"password\""));
    }

    @Test
    @DisplayName("a form login sets the session cookies and renders the dashboard")
    void loginAndBrowse() {
        Response login = login(TestAuth.JOHN, TestAuth.SEED_PASSWORD);
        login.then().statusCode(303)
                .header("Location", endsWith("/web/dashboard"))
                .cookie(WebSession.ACCESS_COOKIE, not(emptyOrNullString()))
                .cookie(WebSession.REFRESH_COOKIE, not(emptyOrNullString()));

        String access = login.getCookie(WebSession.ACCESS_COOKIE);
        String refresh = login.getCookie(WebSession.REFRESH_COOKIE);

        given()
                .cookie(WebSession.ACCESS_COOKIE, access)
                .cookie(WebSession.REFRESH_COOKIE, refresh)
                .when().get("/web/dashboard")
                .then().statusCode(200)
                .body(containsString("Welcome, John"));

        given()
                .cookie(WebSession.ACCESS_COOKIE, access)
                .cookie(WebSession.REFRESH_COOKIE, refresh)
                .queryParam("q", "Sarah")
                .when().get("/web/clients")
                .then().statusCode(200)
                .body(containsString("Sarah Williams"))
                .body(not(containsString("Robert Brown")));
    }

    @Test
    @DisplayName("wrong credentials re-render the form with the server's message")
    void failedLogin() {
        login(TestAuth.JOHN, "wrong-password")
                .then().statusCode(200)
                .body(containsString("class=\"error\""))
                .body(containsString("value=\"" + TestAuth.JOHN + "\""));
    }

    @Test
    @DisplayName("a stale access token is refreshed transparently and the new one is returned as cookie")
    void staleAccessTokenIsRefreshed() {
        String refresh = login(TestAuth.JANE, TestAuth.SEED_PASSWORD).getCookie(WebSession.REFRESH_COOKIE);

        given()
                .cookie(WebSession.ACCESS_COOKIE, "expired.token.value")
                .cookie(WebSession.REFRESH_COOKIE, refresh)
                .when().get("/web/profile")
                .then().statusCode(200)
                .cookie(WebSession.ACCESS_COOKIE, not(equalTo("expired.token.value")))
                .body(containsString(TestAuth.JANE));
    }

    @Test
    @DisplayName("a revoked refresh token ends the web session")
    void revokedSession() {
        given()
                .redirects().follow(false)
                .cookie(WebSession.ACCESS_COOKIE, "expired.token.value")
                .cookie(WebSession.REFRESH_COOKIE, "revoked.refresh.value")
                .when().get("/web/billing")
                .then().statusCode(303)
                .header("Location", endsWith("/web/login"));
    }
}
