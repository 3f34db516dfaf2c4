package dk.lawoffice.intranet.invoiceservice.resources;

import dk.lawoffice.intranet.TestAuth;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.config.JsonConfig;
import io.restassured.config.RestAssuredConfig;
import io.restassured.http.ContentType;
import io.restassured.path.json.config.JsonPathConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@DisplayName("InvoiceResource")
class InvoiceResourceTest {

    private static final RestAssuredConfig DECIMALS = RestAssuredConfig.config()
            .jsonConfig(JsonConfig.jsonConfig().numberReturnType(JsonPathConfig.NumberReturnType.BIG_DECIMAL));

    private String token;
    private String client;

    @BeforeEach
    void setUp() {
        token = TestAuth.freshLawyer();
        client = TestAuth.createClient(token, "Billed", "Client");
    }

    private Map<String, Object> invoice(List<Map<String, Object>> items) {
        Map<String, Object> body = new HashMap<>();
        body.put("client", client);
        body.put("issue_date", LocalDate.of(2025, 1, 10).toString());
        body.put("items", items);
        return body;
    }

    private static Map<String, Object> item(String description, String quantity, String unitPrice, String taxRate) {
        Map<String, Object> item = new HashMap<>();
        item.put("description", description);
        item.put("quantity", new BigDecimal(quantity));
        item.put("unit_price", new BigDecimal(unitPrice));
        item.put("tax_rate", new BigDecimal(taxRate));
        return item;
    }

    private String create(Map<String, Object> body) {
        return given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(body)
                .when().post("/billing/invoices")
                .then().statusCode(201)
                .extract().path("uuid");
    }

    @Test
    @DisplayName("totals are computed from the items")
    void totalsFromItems() {
        Map<String, Object> body = invoice(List.of(
                item("Consultation", "2", "150.00", "25"),
                item("Filing fee", "1", "99.99", "0")));
        body.put("total", new BigDecimal("1.00"));

        String uuid = create(body);

        given().config(DECIMALS).auth().oauth2(token)
                .when().get("/billing/invoices/{uuid}", uuid)
                .then().statusCode(200)
                .body("subtotal", comparesEqualTo(new BigDecimal("399.99")))
                .body("tax_amount", comparesEqualTo(new BigDecimal("75.00")))
                .body("total", comparesEqualTo(new BigDecimal("474.99")))
                .body("items", hasSize(2))
                .body("items[0].description", equalTo("Consultation"))
                .body("items[0].amount", comparesEqualTo(new BigDecimal("375.00")))
                .body("status", equalTo("draft"))
                .body("invoice_number", startsWith("INV-"))
                .body("due_date", equalTo("2025-02-09"))
                .body("client_name", equalTo("Billed Client"));
    }

    @Test
    @DisplayName("a due date before the issue date is rejected")
    void dueBeforeIssue() {
        Map<String, Object> body = invoice(List.of(item("Advice", "1", "10", "0")));
        body.put("due_date", "2025-01-01");

        given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(body)
                .when().post("/billing/invoices")
                .then().statusCode(400)
                .body("due_date", hasSize(1));
    }

    @Test
    @DisplayName("invoice numbers are unique")
    void duplicateNumber() {
        Map<String, Object> body = invoice(List.of(item("Advice", "1", "10", "0")));
        body.put("invoice_number", "INV-TEST-" + System.nanoTime());
        create(body);

        given().auth().oauth2(token)
                .contentType(ContentType.JSON)
                .body(body)
                .when().post("/billing/invoices")
                .then().statusCode(400)
                .body("invoice_number", hasSize(1));
    }

    @Test
    @DisplayName("send_to_client then mark_as_paid stamps paid_at")
    void lifecycle() {
        String uuid = create(invoice(List.of(item("Retainer", "1", "500", "0"))));

        given().auth().oauth2(token)
                .when().post("/billing/invoices/{uuid}/send_to_client", uuid)
                .then().statusCode(200)
                .body("status", equalTo("invoice sent to client"));

        given().auth().oauth2(token)
                .when().post("/billing/invoices/{uuid}/mark_as_paid", uuid)
                .then().statusCode(200)
                .body("status", equalTo("paid"))
                .body("paid_at", notNullValue());

        given().auth().oauth2(token)
                .queryParam("status", "paid")
                .when().get("/billing/invoices")
                .then().statusCode(200)
                .body("count", equalTo(1));
    }

    @Test
    @DisplayName("invoices of another lawyer are invisible")
    void ownership() {
        String uuid = create(invoice(List.of(item("Retainer", "1", "500", "0"))));

        given().auth().oauth2(TestAuth.freshLawyer())
                .when().get("/billing/invoices/{uuid}", uuid)
                .then().statusCode(404);
    }

    @Test
    @DisplayName("deleting the client removes its invoices")
    void clientDeletionCascades() {
        String uuid = create(invoice(List.of(item("Retainer", "1", "500", "0"))));

        given().auth().oauth2(token)
                .when().delete("/clients/{uuid}", client)
                .then().statusCode(204);

        given().auth().oauth2(token)
                .when().get("/billing/invoices/{uuid}", uuid)
                .then().statusCode(404);
    }
}
