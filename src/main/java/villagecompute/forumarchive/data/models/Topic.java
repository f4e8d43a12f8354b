/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.data.models;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * A forum topic read from a {@code <id>-<slug>.md} file.
 *
 * <p>
 * {@code body} holds the raw Markdown and {@code bodyHtml} its rendering, produced once at load time.
 *
 * @param id
 *            unique topic id
 * @param title
 *            topic title (the only field indexed for search)
 * @param slug
 *            file name stem
 * @param authorId
 *            id of the original author
 * @param categoryId
 *            id of the category the topic belongs to directly
 * @param created
 *            creation timestamp
 * @param lastPost
 *            timestamp of the last reply (nullable)
 * @param viewCount
 *            number of views
 * @param rating
 *            vote balance
 * @param postCount
 *            number of posts in the thread
 * @param deleted
 *            soft-deleted flag exported by the board
 * @param locked
 *            locked flag
 * @param pinned
 *            pinned flag
 * @param tags
 *            topic tags
 * @param body
 *            raw Markdown body
 * @param bodyHtml
 *            rendered HTML body
 * @param source
 *            file the topic was read from ({@code null} for topics built in memory)
 */
public record Topic(long id, String title, String slug, long authorId, long categoryId, Instant created,
        Instant lastPost, long viewCount, long rating, int postCount, boolean deleted, boolean locked, boolean pinned,
        List<String> tags, String body, String bodyHtml, Path source) {

    public Topic {
        tags = tags == null ? List.of() : List.copyOf(tags);
        body = body == null ? "" : body;
        bodyHtml = bodyHtml == null ? "" : bodyHtml;
    }
}
