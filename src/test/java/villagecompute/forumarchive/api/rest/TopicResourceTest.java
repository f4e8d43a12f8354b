/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;

/**
 * Tests for {@link TopicResource}.
 */
@QuarkusTest
class TopicResourceTest {

    @Test
    void testListAllTopicsNewestFirst() {
        given().when().get("/api/v1/topics").then().statusCode(200).body("total", equalTo(4))
                .body("items.topic_id", contains(12, 11, 10, 100));
    }

    @Test
    void testListSortedByRatingAscending() {
        given().queryParam("sort_by", "rating").queryParam("order", "asc").when().get("/api/v1/topics").then()
                .statusCode(200).body("items.topic_id", contains(11, 10, 100, 12));
    }

    @Test
    void testLastPostSortPutsMissingLast() {
        given().queryParam("sort_by", "last_post").when().get("/api/v1/topics").then().statusCode(200)
                .body("items.topic_id", contains(10, 100, 11, 12));
    }

    @Test
    void testTopicDetail() {
        given().when().get("/api/v1/topics/10").then().statusCode(200).body("topic_id", equalTo(10))
                .body("title", equalTo("Hello World")).body("slug", equalTo("10-hello-world"))
                .body("author_id", equalTo(7)).body("category_id", equalTo(2))
                .body("created", equalTo("2019-02-01T08:30:00Z")).body("last_post", equalTo("2019-02-03T11:00:00Z"))
                .body("content", equalTo("First **announcement**."))
                .body("content_html", containsString("<strong>announcement</strong>"));
    }

    @Test
    void testTopicDetailAcceptsSlugForms() {
        given().when().get("/api/v1/topics/100/welcome-to-the-forum").then().statusCode(200)
                .body("pinned", equalTo(true)).body("tags", contains("welcome", "rules"));
        given().when().get("/api/v1/topics/100-welcome-to-the-forum").then().statusCode(200)
                .body("topic_id", equalTo(100));
    }

    @Test
    void testTopicWithoutLastPost() {
        given().when().get("/api/v1/topics/11").then().statusCode(200).body("last_post", nullValue())
                .body("created", equalTo("2019-03-01T00:00:00Z"));
    }

    @Test
    void testUnknownTopicIs404() {
        given().when().get("/api/v1/topics/999").then().statusCode(404).body("error", containsString("999"));
        given().when().get("/api/v1/topics/abc").then().statusCode(404);
    }

    @Test
    void testNonNumericPageIs400() {
        given().queryParam("page", "two").when().get("/api/v1/topics").then().statusCode(400)
                .body("field", equalTo("page"));
    }
}
