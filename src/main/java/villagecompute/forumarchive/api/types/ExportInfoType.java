/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.forumarchive.data.models.ExportInfo;

/**
 * API type for the totals recorded by the exporter.
 */
@Schema(
        description = "Totals recorded when the archive was exported")
public record ExportInfoType(@JsonProperty("total_users") long totalUsers,
        @JsonProperty("total_categories") long totalCategories, @JsonProperty("total_topics") long totalTopics,
        @JsonProperty("total_posts") long totalPosts) {

    public static ExportInfoType from(ExportInfo info) {
        return new ExportInfoType(info.totalUsers(), info.totalCategories(), info.totalTopics(), info.totalPosts());
    }
}
