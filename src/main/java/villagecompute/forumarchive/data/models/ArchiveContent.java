/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.data.models;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import villagecompute.forumarchive.exceptions.CategoryCycleException;
import villagecompute.forumarchive.exceptions.DanglingReferenceException;
import villagecompute.forumarchive.exceptions.DuplicateIdException;

/**
 * Fully materialized output of one archive load: export totals plus every category and topic, in the order they
 * were encountered on disk.
 *
 * <p>
 * Encounter order matters: it becomes the order of root and child categories in the store.
 *
 * @param exportInfo
 *            exporter totals ({@link ExportInfo#EMPTY} when the archive has none)
 * @param categories
 *            categories in traversal order
 * @param topics
 *            topics in traversal order
 */
public record ArchiveContent(ExportInfo exportInfo, List<Category> categories, List<Topic> topics) {

    public ArchiveContent {
        exportInfo = exportInfo == null ? ExportInfo.EMPTY : exportInfo;
        categories = List.copyOf(categories);
        topics = List.copyOf(topics);
    }

    public static ArchiveContent empty() {
        return new ArchiveContent(ExportInfo.EMPTY, List.of(), List.of());
    }

    /**
     * Checks identity and referential integrity of the content.
     *
     * <p>
     * Checks, in order:
     * <ol>
     * <li>category ids are unique</li>
     * <li>topic ids are unique</li>
     * <li>every non-null {@code parentId} resolves to a category</li>
     * <li>the parent relation is acyclic</li>
     * <li>every topic's {@code categoryId} resolves to a category</li>
     * </ol>
     *
     * @return this content, for chaining
     * @throws DuplicateIdException
     *             on a repeated category or topic id
     * @throws DanglingReferenceException
     *             on an unresolved parent or category reference
     * @throws CategoryCycleException
     *             when a category is its own ancestor
     */
    public ArchiveContent validate() {
        Map<Long, Category> categoriesById = new HashMap<>();
        for (Category category : categories) {
            Category previous = categoriesById.putIfAbsent(category.id(), category);
            if (previous != null) {
                throw new DuplicateIdException("category", category.id(), previous.source(), category.source());
            }
        }

        Map<Long, Topic> topicsById = new HashMap<>();
        for (Topic topic : topics) {
            Topic previous = topicsById.putIfAbsent(topic.id(), topic);
            if (previous != null) {
                throw new DuplicateIdException("topic", topic.id(), previous.source(), topic.source());
            }
        }

        for (Category category : categories) {
            Long parentId = category.parentId();
            if (parentId != null && !categoriesById.containsKey(parentId)) {
                throw new DanglingReferenceException(
                        "Category " + category.id() + " references unknown parent category " + parentId, parentId,
                        category.source());
            }
        }

        Set<Long> acyclic = new HashSet<>();
        for (Category category : categories) {
            Set<Long> chain = new HashSet<>();
            Category current = category;
            while (current != null && !acyclic.contains(current.id())) {
                if (!chain.add(current.id())) {
                    throw new CategoryCycleException(current.id(), current.source());
                }
                current = current.parentId() == null ? null : categoriesById.get(current.parentId());
            }
            acyclic.addAll(chain);
        }

        for (Topic topic : topics) {
            if (!categoriesById.containsKey(topic.categoryId())) {
                throw new DanglingReferenceException(
                        "Topic " + topic.id() + " references unknown category " + topic.categoryId(),
                        topic.categoryId(), topic.source());
            }
        }
        return this;
    }
}
