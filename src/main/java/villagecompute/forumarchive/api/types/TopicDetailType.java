/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.forumarchive.data.models.Topic;

import java.time.Instant;
import java.util.List;

/**
 * API type for a single topic, including the raw Markdown body and its rendered HTML.
 */
@Schema(
        description = "Archived topic with body")
public record TopicDetailType(@JsonProperty("topic_id") long topicId, String title, String slug,
        @JsonProperty("author_id") long authorId, @JsonProperty("category_id") long categoryId, Instant created,
        @Schema(
                nullable = true) @JsonProperty("last_post") Instant lastPost,
        @JsonProperty("view_count") long viewCount, long rating, @JsonProperty("post_count") int postCount,
        boolean deleted, boolean locked, boolean pinned, List<String> tags,

        @Schema(
                description = "Topic body as Markdown") String content,

        @Schema(
                description = "Topic body rendered to HTML") @JsonProperty("content_html") String contentHtml) {

    public static TopicDetailType from(Topic topic) {
        return new TopicDetailType(topic.id(), topic.title(), topic.slug(), topic.authorId(), topic.categoryId(),
                topic.created(), topic.lastPost(), topic.viewCount(), topic.rating(), topic.postCount(),
                topic.deleted(), topic.locked(), topic.pinned(), topic.tags(), topic.body(), topic.bodyHtml());
    }
}
