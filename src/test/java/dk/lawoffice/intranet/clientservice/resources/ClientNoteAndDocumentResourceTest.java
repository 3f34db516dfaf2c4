package dk.lawoffice.intranet.clientservice.resources;

import dk.lawoffice.intranet.TestAuth;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@DisplayName("client notes and documents")
class ClientNoteAndDocumentResourceTest {

    @Test
    @DisplayName("notes are listed newest first and summarised")
    void notes() {
        String token = TestAuth.freshLawyer();
        String client = TestAuth.createClient(token, "Noted", "Client");

        for (String title : new String[]{"Intake", "Follow-up"}) {
            given().auth().oauth2(token)
                    .contentType(ContentType.JSON)
                    .body(Map.of("title", title, "content", title + " details"))
                    .when().post("/clients/{client}/notes", client)
                    .then().statusCode(201)
                    .body("client", equalTo(client));
        }

        given().auth().oauth2(token)
                .when().get("/clients/{client}/notes", client)
                .then().statusCode(200)
                .body("count", equalTo(2));

        given().auth().oauth2(token)
                .when().get("/clients/{uuid}/notes_summary", client)
                .then().statusCode(200)
                .body("total_notes", equalTo(2))
                .body("client_name", equalTo("Noted Client"))
                .body("recent_notes", hasSize(2));
    }

    @Test
    @DisplayName("notes of a foreign client are not found")
    void foreignNotes() {
        String client = TestAuth.createClient(TestAuth.freshLawyer(), "Hidden", "Client");

        given().auth().oauth2(TestAuth.freshLawyer())
                .when().get("/clients/{client}/notes", client)
                .then().statusCode(404);
    }

    @Test
    @DisplayName("uploaded documents can be downloaded and deleted")
    void documents() {
        String token = TestAuth.freshLawyer();
        String client = TestAuth.createClient(token, "Paper", "Trail");
        byte[] content = "signed engagement letter".getBytes(StandardCharsets.UTF_8);

        String uuid = given().auth().oauth2(token)
                .multiPart("document", "engagement.txt", content, "text/plain")
                .multiPart("title", "Engagement letter")
                .multiPart("document_type", "contract")
                .when().post("/clients/{client}/documents", client)
                .then().statusCode(201)
                .body("title", equalTo("Engagement letter"))
                .body("filename", equalTo("engagement.txt"))
                .body("size_bytes", equalTo(content.length))
                .extract().path("uuid");

        given().auth().oauth2(token)
                .when().get("/clients/{client}/documents/{uuid}/download", client, uuid)
                .then().statusCode(200)
                .header("Content-Disposition", containsString("engagement.txt"))
                .body(equalTo("signed engagement letter"));

        given().auth().oauth2(token)
                .when().delete("/clients/{client}/documents/{uuid}", client, uuid)
                .then().statusCode(204);

        given().auth().oauth2(token)
                .when().get("/clients/{client}/documents", client)
                .then().statusCode(200)
                .body("count", equalTo(0));
    }

    @Test
    @DisplayName("an upload without a file part is rejected")
    void uploadWithoutFile() {
        String token = TestAuth.freshLawyer();
        String client = TestAuth.createClient(token, "No", "File");

        given().auth().oauth2(token)
                .multiPart("title", "Nothing attached")
                .when().post("/clients/{client}/documents", client)
                .then().statusCode(400);
    }
}
