/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.data.models;

import java.util.List;

/**
 * Nested view of a category and its descendants, materialized on demand from the id-based tree index.
 *
 * @param category
 *            the category
 * @param topicCount
 *            number of topics directly in this category
 * @param children
 *            child nodes in tree order
 */
public record CategoryNode(Category category, int topicCount, List<CategoryNode> children) {

    public CategoryNode {
        children = List.copyOf(children);
    }
}
