/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.forumarchive.ArchiveTestFixtures.FIXTURE_ARCHIVE;
import static villagecompute.forumarchive.ArchiveTestFixtures.LOADED_AT;
import static villagecompute.forumarchive.ArchiveTestFixtures.category;
import static villagecompute.forumarchive.ArchiveTestFixtures.content;
import static villagecompute.forumarchive.ArchiveTestFixtures.topic;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.forumarchive.data.models.Category;
import villagecompute.forumarchive.data.models.CategoryNode;
import villagecompute.forumarchive.data.models.ExportInfo;
import villagecompute.forumarchive.exceptions.DuplicateIdException;
import villagecompute.forumarchive.exceptions.ResourceNotFoundException;

/**
 * Tests for {@link ArchiveSnapshot} lookups over a small hand-built hierarchy:
 *
 * <pre>
 * 1 General
 *   2 Announcements
 *     4 Releases
 * 3 Off Topic
 * </pre>
 */
class ArchiveSnapshotTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    private ArchiveSnapshot snapshot;

    @BeforeEach
    void setUp() {
        snapshot = ArchiveSnapshot.build(content(
                List.of(category(1, "General", null), category(2, "Announcements", 1L), category(3, "Off Topic", null),
                        category(4, "Releases", 2L)),
                List.of(topic(10, "Hello World", 2, T0), topic(11, "Second post", 2, T0.plusSeconds(60)),
                        topic(12, "Random chatter", 3, T0), topic(13, "Version one", 4, T0),
                        topic(14, "Welcome", 1, T0))),
                LOADED_AT);
    }

    @Test
    void testRootCategoriesInTraversalOrder() {
        assertEquals(List.of(1L, 3L), ids(snapshot.getRootCategories()));
    }

    @Test
    void testChildren() {
        assertEquals(List.of(2L), ids(snapshot.getChildren(1)));
        assertEquals(List.of(4L), ids(snapshot.getChildren(2)));
        assertTrue(snapshot.getChildren(4).isEmpty());
        assertTrue(snapshot.getChildren(999).isEmpty());
    }

    @Test
    void testCategoryPathFromRoot() {
        assertEquals(List.of(1L, 2L, 4L), ids(snapshot.getCategoryPath(4)));
        assertEquals(List.of(3L), ids(snapshot.getCategoryPath(3)));
    }

    @Test
    void testCategoryPathForUnknownIdThrows() {
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> snapshot.getCategoryPath(999));
        assertEquals(999, e.getId());
    }

    @Test
    void testDirectTopicsInLoadOrder() {
        assertEquals(List.of(10L, 11L), snapshot.getTopicsInCategory(2, false));
        assertEquals(List.of(14L), snapshot.getTopicsInCategory(1, false));
        assertTrue(snapshot.getTopicsInCategory(999, false).isEmpty());
        assertTrue(snapshot.getTopicsInCategory(999, true).isEmpty());
    }

    @Test
    void testRecursiveTopicsArePreOrder() {
        assertEquals(List.of(14L, 10L, 11L, 13L), snapshot.getTopicsInCategory(1, true));
    }

    @Test
    void testTopicCounts() {
        assertEquals(2, snapshot.topicCount(2));
        assertEquals(1, snapshot.topicCount(1));
        assertEquals(0, snapshot.topicCount(999));
    }

    @Test
    void testLookupsByIdAreOptional() {
        assertEquals("Hello World", snapshot.getTopic(10).orElseThrow().title());
        assertTrue(snapshot.getTopic(999).isEmpty());
        assertEquals("Announcements", snapshot.getCategory(2).orElseThrow().name());
        assertTrue(snapshot.getCategory(999).isEmpty());
    }

    @Test
    void testEveryTopicReachableFromItsCategory() {
        for (long id : snapshot.allTopicIds()) {
            long categoryId = snapshot.getTopic(id).orElseThrow().categoryId();
            assertTrue(snapshot.getTopicsInCategory(categoryId, false).contains(id));
        }
    }

    @Test
    void testRecursiveListingContainsDirectListing() {
        for (long id = 1; id <= 4; id++) {
            assertTrue(snapshot.getTopicsInCategory(id, true).containsAll(snapshot.getTopicsInCategory(id, false)));
        }
    }

    @Test
    void testSearchDelegatesToIndex() {
        assertEquals(Set.of(10L), snapshot.search("hello"));
        assertTrue(snapshot.search("missing").isEmpty());
    }

    @Test
    void testCategoryTree() {
        List<CategoryNode> tree = snapshot.getCategoryTree();

        assertEquals(2, tree.size());
        CategoryNode general = tree.get(0);
        assertEquals(1, general.category().id());
        assertEquals(1, general.topicCount());
        assertEquals(4, general.children().get(0).children().get(0).category().id());
        assertTrue(tree.get(1).children().isEmpty());
    }

    @Test
    void testStats() {
        ArchiveSnapshot.Stats stats = snapshot.stats();

        assertEquals(4, stats.categories());
        assertEquals(5, stats.topics());
        assertEquals(LOADED_AT, stats.loadedAt());
    }

    @Test
    void testEmptySnapshot() {
        ArchiveSnapshot empty = ArchiveSnapshot.empty(LOADED_AT);

        assertTrue(empty.getRootCategories().isEmpty());
        assertTrue(empty.allTopics().isEmpty());
        assertTrue(empty.search("anything").isEmpty());
        assertEquals(ExportInfo.EMPTY, empty.getExportInfo());
    }

    @Test
    void testBuildRejectsInvalidContent() {
        assertThrows(DuplicateIdException.class,
                () -> ArchiveSnapshot.build(
                        content(List.of(category(1, "A", null)), List.of(topic(5, "x", 1, T0), topic(5, "y", 1, T0))),
                        LOADED_AT));
    }

    @Test
    void testFixtureArchiveEndToEnd() {
        ArchiveSnapshot fixture = ArchiveSnapshot.load(FIXTURE_ARCHIVE, LOADED_AT);

        assertEquals(List.of(1L, 3L), ids(fixture.getRootCategories()));
        assertEquals(List.of(1L, 2L), ids(fixture.getCategoryPath(2)));
        assertEquals(List.of(100L, 10L, 11L), fixture.getTopicsInCategory(1, true));
        assertEquals(Set.of(10L, 11L), fixture.search("hello"));
        assertEquals(Set.of(10L), fixture.search("HELLO world"));
        assertEquals(Set.of(12L), fixture.search("release notes"));
        assertTrue(fixture.getTopic(12).orElseThrow().bodyHtml().contains("<table>"));
    }

    @Test
    void testLoadMatchesBuildOverLoaderOutput() {
        ArchiveSnapshot loaded = ArchiveSnapshot.load(FIXTURE_ARCHIVE, LOADED_AT);
        ArchiveSnapshot built = ArchiveSnapshot.build(new ArchiveContentLoader().load(FIXTURE_ARCHIVE), LOADED_AT);

        assertEquals(built.stats(), loaded.stats());
        assertEquals(built.getCategoryTree(), loaded.getCategoryTree());
        assertEquals(built.getTopicsInCategory(1, true), loaded.getTopicsInCategory(1, true));
    }

    private static List<Long> ids(List<Category> categories) {
        return categories.stream().map(Category::id).toList();
    }
}
