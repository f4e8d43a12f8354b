/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.forumarchive.data.models.Category;
import villagecompute.forumarchive.services.ArchiveSnapshot;

import java.util.List;

/**
 * API type for a single category page: the category itself, its direct subcategories and the breadcrumb from its
 * root.
 */
@Schema(
        description = "Category with subcategories and breadcrumb path")
public record CategoryDetailType(long id, String name, String slug, @JsonProperty("parent_cid") long parentCid,
        @Schema(
                nullable = true) String icon,
        @Schema(
                nullable = true) String bgColor,
        @Schema(
                nullable = true) String color,
        int order, boolean disabled, @JsonProperty("is_subcategory") boolean isSubcategory,
        @JsonProperty("topic_count") int topicCount, @JsonProperty("post_count") int postCount,

        @Schema(
                description = "Category description",
                nullable = true) String description,

        @Schema(
                description = "Direct subcategories in display order") List<CategorySummaryType> subcategories,

        @Schema(
                description = "Breadcrumb from the root category down to this one, inclusive") List<CategorySummaryType> path) {

    public static CategoryDetailType from(Category category, ArchiveSnapshot snapshot) {
        CategorySummaryType summary = CategorySummaryType.from(category, snapshot);
        return new CategoryDetailType(summary.id(), summary.name(), summary.slug(), summary.parentCid(),
                summary.icon(), summary.bgColor(), summary.color(), summary.order(), summary.disabled(),
                summary.isSubcategory(), summary.topicCount(), summary.postCount(), category.description(),
                CategorySummaryType.from(snapshot.getChildren(category.id()), snapshot),
                CategorySummaryType.from(snapshot.getCategoryPath(category.id()), snapshot));
    }
}
