/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.forumarchive.data.models.Category;
import villagecompute.forumarchive.data.models.CategoryNode;

import java.util.List;

/**
 * API type for one node of the nested category tree.
 */
@Schema(
        description = "Category with its nested children")
public record CategoryTreeType(long id, String name, String slug, @JsonProperty("parent_cid") long parentCid,
        @Schema(
                nullable = true) String icon,
        @Schema(
                nullable = true) String bgColor,
        @Schema(
                nullable = true) String color,
        int order, boolean disabled, @JsonProperty("is_subcategory") boolean isSubcategory,
        @JsonProperty("topic_count") int topicCount, @JsonProperty("post_count") int postCount,
        List<CategoryTreeType> children) {

    public static CategoryTreeType from(CategoryNode node) {
        Category category = node.category();
        return new CategoryTreeType(category.id(), category.name(), category.slug(),
                category.parentId() == null ? 0L : category.parentId(), category.icon(), category.bgColor(),
                category.color(), category.order(), category.disabled(), category.isSubcategory(), node.topicCount(),
                category.postCount(), from(node.children()));
    }

    public static List<CategoryTreeType> from(List<CategoryNode> nodes) {
        return nodes.stream().map(CategoryTreeType::from).toList();
    }
}
