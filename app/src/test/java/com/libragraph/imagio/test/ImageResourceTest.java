package com.libragraph.imagio.test;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class ImageResourceTest {

    private static String uniqueCategory() {
        return "cat-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String upload(String category, byte[] body) {
        return given()
                .contentType("application/octet-stream")
                .body(body)
                .when().put("/api/images/" + category)
                .then()
                .statusCode(200)
                .extract().path("uuid");
    }

    @Test
    void uploadRegistersRecordWithSniffedMime() {
        String category = uniqueCategory();

        String uuid = given()
                .contentType("application/octet-stream")
                .body(TestImageData.jpeg(64, 48))
                .when().put("/api/images/" + category)
                .then()
                .statusCode(200)
                .body("category", is(category))
                .body("mime", is("image/jpeg"))
                .body("uuid", notNullValue())
                .body("createdAt", notNullValue())
                .extract().path("uuid");

        given()
                .when().get("/api/image/" + uuid)
                .then()
                .statusCode(200)
                .body("uuid", is(uuid))
                .body("mime", is("image/jpeg"));
    }

    @Test
    void multipartUploadTakesFirstFilePart() {
        String category = uniqueCategory();
        byte[] png = TestImageData.rgbaPng(40, 30);

        String uuid = given()
                .multiPart("image", "photo.png", png, "application/octet-stream")
                .when().put("/api/images/" + category)
                .then()
                .statusCode(200)
                .body("category", is(category))
                .body("mime", is("image/png"))
                .extract().path("uuid");

        byte[] original = given()
                .when().get("/" + uuid + "/original")
                .then()
                .statusCode(200)
                .extract().asByteArray();
        assertThat(original).isEqualTo(png);
    }

    @Test
    void multipartUploadWithoutFilePartIsBadRequest() {
        given()
                .multiPart("note", "not a file")
                .when().put("/api/images/" + uniqueCategory())
                .then()
                .statusCode(400);
    }

    @Test
    void uploadOfNonImageIsBadRequest() {
        given()
                .contentType("application/octet-stream")
                .body("just some text".getBytes())
                .when().put("/api/images/" + uniqueCategory())
                .then()
                .statusCode(400)
                .body("error", containsString("Unsupported"));
    }

    @Test
    void uploadToInvalidCategoryIsBadRequest() {
        given()
                .contentType("application/octet-stream")
                .body(TestImageData.jpeg(8, 8))
                .when().put("/api/images/.hidden")
                .then()
                .statusCode(400);
    }

    @Test
    void unknownUuidIsNotFound() {
        given()
                .when().get("/api/image/" + UUID.randomUUID())
                .then()
                .statusCode(404)
                .body("status", is(404));
    }

    @Test
    void listPagesThroughCategory() {
        String category = uniqueCategory();
        for (int i = 0; i < 3; i++) {
            upload(category, TestImageData.jpeg(16 + i, 16));
        }
        upload(uniqueCategory(), TestImageData.jpeg(16, 16));

        List<String> all = given()
                .when().get("/api/images/" + category + "/10/0")
                .then()
                .statusCode(200)
                .body("size()", is(3))
                .extract().jsonPath().getList("uuid", String.class);

        List<String> page = given()
                .when().get("/api/images/" + category + "/2/1")
                .then()
                .statusCode(200)
                .extract().jsonPath().getList("uuid", String.class);

        assertThat(page).containsExactlyElementsOf(all.subList(1, 3));
    }

    @Test
    void deleteRemovesRecordThenReportsNotFound() {
        String uuid = upload(uniqueCategory(), TestImageData.jpeg(32, 32));

        given().when().delete("/api/image/" + uuid).then().statusCode(204);

        given().when().get("/api/image/" + uuid).then().statusCode(404);
        given().when().get("/" + uuid + "/original").then().statusCode(404);
        given().when().delete("/api/image/" + uuid).then().statusCode(404);
    }
}
