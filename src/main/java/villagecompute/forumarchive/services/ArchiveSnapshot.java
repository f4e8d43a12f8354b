/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

import villagecompute.forumarchive.data.models.ArchiveContent;
import villagecompute.forumarchive.data.models.Category;
import villagecompute.forumarchive.data.models.CategoryNode;
import villagecompute.forumarchive.data.models.ExportInfo;
import villagecompute.forumarchive.data.models.Topic;
import villagecompute.forumarchive.exceptions.ResourceNotFoundException;

/**
 * Immutable, fully indexed view of one archive load. This is the data store queried by every request.
 *
 * <p>
 * <b>Indices</b> (built once in {@link #build}, never mutated):
 * <ul>
 * <li>{@code categoriesById} - id to category, in traversal order</li>
 * <li>{@code topicsById} - id to topic, in traversal order</li>
 * <li>{@code categoryTree} - parent id to ordered child ids; root categories sit under {@link #ROOT_KEY}</li>
 * <li>{@code categoryTopics} - category id to ids of topics directly in it</li>
 * <li>{@link TopicSearchIndex} over topic titles, co-published with the rest</li>
 * </ul>
 *
 * <p>
 * Hierarchy is stored as id references only; {@link Category} holds its parent id and nothing else.
 *
 * <p>
 * <b>Thread safety:</b> all state is final and unmodifiable once the constructor returns, so a published snapshot is
 * safe to read from any number of threads without locking. A reload builds a new snapshot and swaps the reference
 * (see {@link ArchiveStoreService}).
 */
public final class ArchiveSnapshot {

    /** Synthetic parent key for root categories. Category ids are always positive. */
    public static final long ROOT_KEY = 0L;

    private final ExportInfo exportInfo;
    private final Map<Long, Category> categoriesById;
    private final Map<Long, Topic> topicsById;
    private final Map<Long, List<Long>> categoryTree;
    private final Map<Long, List<Long>> categoryTopics;
    private final TopicSearchIndex searchIndex;
    private final Instant loadedAt;

    private ArchiveSnapshot(ExportInfo exportInfo, Map<Long, Category> categoriesById, Map<Long, Topic> topicsById,
            Map<Long, List<Long>> categoryTree, Map<Long, List<Long>> categoryTopics, TopicSearchIndex searchIndex,
            Instant loadedAt) {
        this.exportInfo = exportInfo;
        this.categoriesById = categoriesById;
        this.topicsById = topicsById;
        this.categoryTree = categoryTree;
        this.categoryTopics = categoryTopics;
        this.searchIndex = searchIndex;
        this.loadedAt = loadedAt;
    }

    /**
     * Validates the content and builds every index.
     *
     * @param content
     *            loader output or an in-memory fixture
     * @param loadedAt
     *            timestamp reported by {@link #stats()}
     * @return the new snapshot
     * @throws villagecompute.forumarchive.exceptions.ArchiveLoadException
     *             when the content has duplicate ids, dangling references or a cyclic hierarchy
     */
    public static ArchiveSnapshot build(ArchiveContent content, Instant loadedAt) {
        return index(content.validate(), loadedAt);
    }

    /**
     * Reads the archive under {@code dataRoot} and builds every index. The loader has already validated what it
     * returns, so the content is indexed as is.
     *
     * @param dataRoot
     *            archive root directory
     * @param loadedAt
     *            timestamp reported by {@link #stats()}
     * @return the new snapshot
     * @throws villagecompute.forumarchive.exceptions.ArchiveLoadException
     *             naming the offending file or id
     */
    public static ArchiveSnapshot load(Path dataRoot, Instant loadedAt) {
        return index(new ArchiveContentLoader().load(dataRoot), loadedAt);
    }

    private static ArchiveSnapshot index(ArchiveContent content, Instant loadedAt) {
        Map<Long, Category> categoriesById = new LinkedHashMap<>();
        Map<Long, List<Long>> tree = new LinkedHashMap<>();
        for (Category category : content.categories()) {
            categoriesById.put(category.id(), category);
            long parentKey = category.parentId() == null ? ROOT_KEY : category.parentId();
            tree.computeIfAbsent(parentKey, key -> new ArrayList<>()).add(category.id());
        }

        Map<Long, Topic> topicsById = new LinkedHashMap<>();
        Map<Long, List<Long>> categoryTopics = new LinkedHashMap<>();
        for (Topic topic : content.topics()) {
            topicsById.put(topic.id(), topic);
            categoryTopics.computeIfAbsent(topic.categoryId(), key -> new ArrayList<>()).add(topic.id());
        }

        return new ArchiveSnapshot(content.exportInfo(), Collections.unmodifiableMap(categoriesById),
                Collections.unmodifiableMap(topicsById), freeze(tree), freeze(categoryTopics),
                TopicSearchIndex.build(topicsById.values()), loadedAt);
    }

    /**
     * @return a snapshot with no categories and no topics
     */
    public static ArchiveSnapshot empty(Instant loadedAt) {
        return build(ArchiveContent.empty(), loadedAt);
    }

    public Optional<Category> getCategory(long id) {
        return Optional.ofNullable(categoriesById.get(id));
    }

    /**
     * @return root categories in traversal order
     */
    public List<Category> getRootCategories() {
        return resolveCategories(categoryTree.getOrDefault(ROOT_KEY, List.of()));
    }

    /**
     * @return direct children in traversal order, empty for unknown ids and leaf categories
     */
    public List<Category> getChildren(long categoryId) {
        return resolveCategories(categoryTree.getOrDefault(categoryId, List.of()));
    }

    /**
     * Breadcrumb path from the root category down to {@code categoryId}, inclusive.
     *
     * @throws ResourceNotFoundException
     *             when the category does not exist
     */
    public List<Category> getCategoryPath(long categoryId) {
        Category current = categoriesById.get(categoryId);
        if (current == null) {
            throw new ResourceNotFoundException("Category", categoryId);
        }
        Deque<Category> path = new ArrayDeque<>();
        while (current != null) {
            path.addFirst(current);
            current = current.parentId() == null ? null : categoriesById.get(current.parentId());
        }
        return List.copyOf(path);
    }

    /**
     * Topic ids of a category.
     *
     * <p>
     * Non-recursive: topics directly in the category, in traversal order. Recursive: depth-first pre-order over the
     * sub-tree, the category's own topics first and then each child's in tree order. No de-duplication is needed since
     * a topic belongs to exactly one category.
     *
     * @return topic ids, empty for unknown categories
     */
    public List<Long> getTopicsInCategory(long categoryId, boolean recursive) {
        if (!recursive) {
            return categoryTopics.getOrDefault(categoryId, List.of());
        }
        if (!categoriesById.containsKey(categoryId)) {
            return List.of();
        }
        List<Long> result = new ArrayList<>();
        Deque<Long> stack = new ArrayDeque<>();
        stack.push(categoryId);
        while (!stack.isEmpty()) {
            long current = stack.pop();
            result.addAll(categoryTopics.getOrDefault(current, List.of()));
            List<Long> children = categoryTree.getOrDefault(current, List.of());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return number of topics directly in the category
     */
    public int topicCount(long categoryId) {
        return categoryTopics.getOrDefault(categoryId, List.of()).size();
    }

    public Optional<Topic> getTopic(long id) {
        return Optional.ofNullable(topicsById.get(id));
    }

    /**
     * @return every topic in traversal order; callers page the result
     */
    public List<Topic> allTopics() {
        return List.copyOf(topicsById.values());
    }

    /**
     * @return ids of every topic in traversal order
     */
    public List<Long> allTopicIds() {
        return List.copyOf(topicsById.keySet());
    }

    /**
     * Keyword search over titles. See {@link TopicSearchIndex} for matching rules.
     */
    public SortedSet<Long> search(String query) {
        return searchIndex.search(query);
    }

    /**
     * Nested category tree from the roots down, with direct topic counts.
     */
    public List<CategoryNode> getCategoryTree() {
        return buildNodes(categoryTree.getOrDefault(ROOT_KEY, List.of()));
    }

    public ExportInfo getExportInfo() {
        return exportInfo;
    }

    public Stats stats() {
        return new Stats(categoriesById.size(), topicsById.size(), loadedAt);
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    private List<CategoryNode> buildNodes(List<Long> ids) {
        List<CategoryNode> nodes = new ArrayList<>(ids.size());
        for (long id : ids) {
            nodes.add(new CategoryNode(categoriesById.get(id), topicCount(id),
                    buildNodes(categoryTree.getOrDefault(id, List.of()))));
        }
        return nodes;
    }

    private List<Category> resolveCategories(List<Long> ids) {
        List<Category> result = new ArrayList<>(ids.size());
        for (long id : ids) {
            result.add(categoriesById.get(id));
        }
        return Collections.unmodifiableList(result);
    }

    private static Map<Long, List<Long>> freeze(Map<Long, List<Long>> index) {
        Map<Long, List<Long>> frozen = new LinkedHashMap<>();
        index.forEach((key, ids) -> frozen.put(key, List.copyOf(ids)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Counts for info and health reporting.
     *
     * @param categories
     *            number of loaded categories
     * @param topics
     *            number of loaded topics
     * @param loadedAt
     *            when the snapshot was built
     */
    public record Stats(int categories, int topics, Instant loadedAt) {
    }
}
