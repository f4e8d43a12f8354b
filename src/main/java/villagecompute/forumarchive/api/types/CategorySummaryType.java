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
 * API type representing a category in listings.
 *
 * @param id
 *            category id from the export
 * @param name
 *            display name
 * @param slug
 *            URL-friendly identifier
 * @param parentCid
 *            parent category id, 0 for root categories
 * @param icon
 *            icon name from the source forum (nullable)
 * @param bgColor
 *            background color (nullable)
 * @param color
 *            foreground color (nullable)
 * @param order
 *            display order within the parent
 * @param disabled
 *            whether the category was disabled on the source forum
 * @param isSubcategory
 *            true when the category has a parent
 * @param topicCount
 *            number of topics directly in this category
 * @param postCount
 *            post count reported by the export
 */
@Schema(
        description = "Archived forum category")
public record CategorySummaryType(@Schema(
        description = "Category id",
        example = "20",
        required = true) long id,

        @Schema(
                description = "Display name",
                example = "Announcements",
                required = true) String name,

        @Schema(
                description = "URL-friendly identifier",
                example = "announcements",
                required = true) String slug,

        @Schema(
                description = "Parent category id, 0 for root categories",
                example = "0") @JsonProperty("parent_cid") long parentCid,

        @Schema(
                description = "Icon name",
                nullable = true) String icon,

        @Schema(
                description = "Background color",
                example = "#86C1B9",
                nullable = true) String bgColor,

        @Schema(
                description = "Foreground color",
                example = "#ffffff",
                nullable = true) String color,

        @Schema(
                description = "Display order within the parent") int order,

        @Schema(
                description = "Whether the category was disabled") boolean disabled,

        @Schema(
                description = "True when the category has a parent") @JsonProperty("is_subcategory") boolean isSubcategory,

        @Schema(
                description = "Number of topics directly in this category") @JsonProperty("topic_count") int topicCount,

        @Schema(
                description = "Post count reported by the export") @JsonProperty("post_count") int postCount) {

    /**
     * Converts a category to its API type, counting topics in the given snapshot.
     */
    public static CategorySummaryType from(Category category, ArchiveSnapshot snapshot) {
        return new CategorySummaryType(category.id(), category.name(), category.slug(),
                category.parentId() == null ? 0L : category.parentId(), category.icon(), category.bgColor(),
                category.color(), category.order(), category.disabled(), category.isSubcategory(),
                snapshot.topicCount(category.id()), category.postCount());
    }

    public static List<CategorySummaryType> from(List<Category> categories, ArchiveSnapshot snapshot) {
        return categories.stream().map(category -> from(category, snapshot)).toList();
    }
}
