package com.restdis.api;

import com.restdis.support.InMemoryBackingStore;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyOrNullString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;

@QuarkusTest
class CommandResourceTest {

    private static final String ADMIN = "Bearer test-token";

    @Inject
    InMemoryBackingStore store;

    @Test
    void requestWithoutTokenIsUnauthorized() {
        given()
                .body("[\"ECHO\",\"a\"]")
                .when()
                .post("/")
                .then()
                .statusCode(401)
                .body("error", equalTo("Unauthorized"));

        given()
                .when()
                .get("/get/a")
                .then()
                .statusCode(401)
                .body("error", equalTo("Unauthorized"));
    }

    @Test
    void unknownTokenIsUnauthorized() {
        given()
                .header("Authorization", "Bearer wrong")
                .body("[\"PING\"]")
                .when()
                .post("/")
                .then()
                .statusCode(401)
                .body("error", equalTo("Unauthorized"));
    }

    @Test
    void echoReturnsResult() {
        given()
                .header("Authorization", ADMIN)
                .contentType(ContentType.JSON)
                .body("[\"ECHO\",\"a\"]")
                .when()
                .post("/")
                .then()
                .statusCode(200)
                .contentType(ContentType.JSON)
                .body("result", equalTo("a"));
    }

    @Test
    void storeErrorIsBadRequest() {
        given()
                .header("Authorization", ADMIN)
                .body("[\"ECHO\"]")
                .when()
                .post("/")
                .then()
                .statusCode(400)
                .body("error", equalTo("ERR wrong number of arguments for 'echo' command"));
    }

    @Test
    void malformedBodyIsBadRequest() {
        given()
                .header("Authorization", ADMIN)
                .body("{\"not\":\"an array\"}")
                .when()
                .post("/")
                .then()
                .statusCode(400)
                .body("error", equalTo("ERR failed to parse command"));

        given()
                .header("Authorization", ADMIN)
                .body("[]")
                .when()
                .post("/")
                .then()
                .statusCode(400)
                .body("error", equalTo("ERR empty command"));
    }

    @Test
    void pathCommandCombinesBodyAndQuery() {
        given()
                .header("Authorization", ADMIN)
                .body("v")
                .when()
                .post("/set/path-key?EX=10")
                .then()
                .statusCode(200)
                .body("result", equalTo("OK"));

        assertEquals("v", store.get("path-key"));
        assertEquals(10L, store.ttl("path-key"));

        given()
                .queryParam("_token", "test-token")
                .when()
                .get("/get/path-key/")
                .then()
                .statusCode(200)
                .body("result", equalTo("v"));
    }

    @Test
    void missingKeyReturnsNullResult() {
        given()
                .header("Authorization", ADMIN)
                .when()
                .get("/get/never-written")
                .then()
                .statusCode(200)
                .body("result", nullValue());
    }

    @Test
    void pipelineKeepsGoingAfterFailure() {
        given()
                .header("Authorization", ADMIN)
                .body("[[\"SET\",\"pipe-a\",\"1\"],[\"HGETALL\",\"pipe-a\"],[\"GET\",\"pipe-a\"]]")
                .when()
                .post("/pipeline")
                .then()
                .statusCode(200)
                .body("$", hasSize(3))
                .body("[0].result", equalTo("OK"))
                .body("[1].error", startsWith("WRONGTYPE"))
                .body("[2].result", equalTo("1"));
    }

    @Test
    void emptyPipelineIsBadRequest() {
        given()
                .header("Authorization", ADMIN)
                .body("[]")
                .when()
                .post("/pipeline")
                .then()
                .statusCode(400)
                .body("error", equalTo("ERR empty pipeline request"));
    }

    @Test
    void restTokenAuthenticatesAsUser() {
        given()
                .header("Authorization", ADMIN)
                .body("[\"ACL\",\"RESTTOKEN\",\"user\",\"wrongpass\"]")
                .when()
                .post("/")
                .then()
                .statusCode(400)
                .body("error", startsWith("WRONGPASS"));

        String token = given()
                .header("Authorization", ADMIN)
                .body("[\"ACL\",\"RESTTOKEN\",\"user\",\"pwd\"]")
                .when()
                .post("/")
                .then()
                .statusCode(200)
                .body("result", not(emptyOrNullString()))
                .extract()
                .path("result");

        given()
                .header("Authorization", "Bearer " + token)
                .body("[\"ACL\",\"WHOAMI\"]")
                .when()
                .post("/")
                .then()
                .statusCode(200)
                .body("result", equalTo("user"));
    }

    @Test
    void restTokenRequiresUserAndPassword() {
        given()
                .header("Authorization", ADMIN)
                .when()
                .post("/acl/resttoken/user")
                .then()
                .statusCode(400)
                .body("error", equalTo("ERR invalid syntax. Usage: ACL RESTTOKEN username password"));
    }

    @Test
    void otherMethodsAreNotAllowed() {
        given()
                .header("Authorization", ADMIN)
                .when()
                .delete("/del/a")
                .then()
                .statusCode(405);

        given()
                .header("Authorization", ADMIN)
                .body("[\"PING\"]")
                .when()
                .put("/")
                .then()
                .statusCode(405);
    }
}
