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
 * API type representing a topic in listings and search results. Omits the body.
 *
 * @param topicId
 *            topic id from the export
 * @param title
 *            topic title
 * @param slug
 *            URL-friendly identifier taken from the file name
 * @param authorId
 *            author user id
 * @param categoryId
 *            owning category id
 * @param created
 *            creation timestamp
 * @param lastPost
 *            last reply timestamp (nullable)
 * @param viewCount
 *            view count at export time
 * @param rating
 *            vote score at export time
 * @param postCount
 *            number of posts including the first
 * @param deleted
 *            soft-deleted on the source forum
 * @param locked
 *            closed for replies on the source forum
 * @param pinned
 *            pinned on the source forum
 * @param tags
 *            topic tags
 */
@Schema(
        description = "Archived topic without its body")
public record TopicSummaryType(@Schema(
        description = "Topic id",
        example = "1234",
        required = true) @JsonProperty("topic_id") long topicId,

        @Schema(
                description = "Topic title",
                example = "Welcome to the forum",
                required = true) String title,

        @Schema(
                description = "URL-friendly identifier",
                example = "welcome-to-the-forum") String slug,

        @Schema(
                description = "Author user id") @JsonProperty("author_id") long authorId,

        @Schema(
                description = "Owning category id") @JsonProperty("category_id") long categoryId,

        @Schema(
                description = "Creation timestamp",
                example = "2019-03-14T09:26:53Z",
                required = true) Instant created,

        @Schema(
                description = "Last reply timestamp",
                nullable = true) @JsonProperty("last_post") Instant lastPost,

        @Schema(
                description = "View count") @JsonProperty("view_count") long viewCount,

        @Schema(
                description = "Vote score") long rating,

        @Schema(
                description = "Posts in the topic") @JsonProperty("post_count") int postCount,

        boolean deleted, boolean locked, boolean pinned, List<String> tags) {

    public static TopicSummaryType from(Topic topic) {
        return new TopicSummaryType(topic.id(), topic.title(), topic.slug(), topic.authorId(), topic.categoryId(),
                topic.created(), topic.lastPost(), topic.viewCount(), topic.rating(), topic.postCount(),
                topic.deleted(), topic.locked(), topic.pinned(), topic.tags());
    }
}
