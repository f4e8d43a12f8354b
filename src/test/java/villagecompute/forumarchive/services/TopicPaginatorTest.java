/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.forumarchive.ArchiveTestFixtures.LOADED_AT;
import static villagecompute.forumarchive.ArchiveTestFixtures.category;
import static villagecompute.forumarchive.ArchiveTestFixtures.content;
import static villagecompute.forumarchive.ArchiveTestFixtures.topic;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.forumarchive.data.models.Topic;
import villagecompute.forumarchive.exceptions.ValidationException;

/**
 * Tests for {@link TopicPaginator}, {@link TopicPageRequest} and the sort keys.
 */
class TopicPaginatorTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    private ArchiveSnapshot snapshot;

    @BeforeEach
    void setUp() {
        List<Topic> topics = new ArrayList<>();
        for (int i = 1; i <= 45; i++) {
            topics.add(topic(i, "Topic " + i, 1, T0.plusSeconds(i)));
        }
        snapshot = ArchiveSnapshot.build(content(List.of(category(1, "General", null)), topics), LOADED_AT);
    }

    @Test
    void testDefaultsAreNewestFirstFirstPage() {
        PageResult<Topic> page = TopicPaginator.paginate(snapshot, snapshot.allTopicIds(),
                TopicPageRequest.defaults());

        assertEquals(20, page.items().size());
        assertEquals(45, page.total());
        assertEquals(3, page.totalPages());
        assertEquals(45, page.items().get(0).id());
        assertTrue(page.hasMore());
    }

    @Test
    void testLastPartialPage() {
        PageResult<Topic> page = TopicPaginator.paginate(snapshot, snapshot.allTopicIds(),
                new TopicPageRequest(TopicSortKey.CREATED, SortOrder.ASC, 3, 20));

        assertEquals(5, page.items().size());
        assertEquals(41, page.items().get(0).id());
        assertFalse(page.hasMore());
    }

    @Test
    void testPagePastEndIsEmptyWithTotal() {
        PageResult<Topic> page = TopicPaginator.paginate(snapshot, snapshot.allTopicIds(),
                new TopicPageRequest(TopicSortKey.CREATED, SortOrder.ASC, 10, 20));

        assertTrue(page.items().isEmpty());
        assertEquals(45, page.total());
        assertEquals(3, page.totalPages());
    }

    @Test
    void testEmptyCandidatesHaveOnePage() {
        PageResult<Topic> page = TopicPaginator.paginate(snapshot, List.of(), TopicPageRequest.defaults());

        assertEquals(0, page.total());
        assertEquals(1, page.totalPages());
    }

    @Test
    void testUnknownIdsAreDropped() {
        PageResult<Topic> page = TopicPaginator.paginate(snapshot, List.of(1L, 999L, 2L),
                TopicPageRequest.defaults());

        assertEquals(2, page.total());
        assertEquals(List.of(2L, 1L), page.items().stream().map(Topic::id).toList());
    }

    @Test
    void testMissingLastPostSortsLastInBothDirections() {
        List<Topic> topics = List.of(topic(1, "a", 1, T0, null, 0, 0), topic(2, "b", 1, T0, T0.plusSeconds(5), 0, 0),
                topic(3, "c", 1, T0, T0.plusSeconds(9), 0, 0));

        assertEquals(List.of(3L, 2L, 1L), ids(TopicPaginator.paginate(topics,
                new TopicPageRequest(TopicSortKey.LAST_POST, SortOrder.DESC, 1, 20))));
        assertEquals(List.of(2L, 3L, 1L), ids(TopicPaginator.paginate(topics,
                new TopicPageRequest(TopicSortKey.LAST_POST, SortOrder.ASC, 1, 20))));
    }

    @Test
    void testTiesBreakByAscendingId() {
        List<Topic> topics = List.of(topic(3, "c", 1, T0, null, 10, 0), topic(1, "a", 1, T0, null, 10, 0),
                topic(2, "b", 1, T0, null, 20, 0));

        assertEquals(List.of(2L, 1L, 3L), ids(TopicPaginator.paginate(topics,
                new TopicPageRequest(TopicSortKey.VIEW_COUNT, SortOrder.DESC, 1, 20))));
    }

    @Test
    void testPageSizeBounds() {
        assertEquals(1, TopicPageRequest.fromParameters("created", "desc", 1, 1).pageSize());
        assertEquals(100, TopicPageRequest.fromParameters("created", "desc", 1, 100).pageSize());

        ValidationException zero = assertThrows(ValidationException.class,
                () -> TopicPageRequest.fromParameters("created", "desc", 1, 0));
        assertEquals("page_size", zero.getField());
        assertEquals("1..100", zero.getAllowed());
        assertThrows(ValidationException.class, () -> TopicPageRequest.fromParameters("created", "desc", 1, 101));
    }

    @Test
    void testPageMustBePositive() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> TopicPageRequest.fromParameters("created", "desc", 0, 20));
        assertEquals("page", e.getField());
    }

    @Test
    void testUnknownSortKeyAndOrder() {
        ValidationException sort = assertThrows(ValidationException.class,
                () -> TopicPageRequest.fromParameters("title", "desc", 1, 20));
        assertEquals("sort_by", sort.getField());
        assertTrue(sort.getAllowed().contains("view_count"));

        ValidationException order = assertThrows(ValidationException.class,
                () -> TopicPageRequest.fromParameters("created", "sideways", 1, 20));
        assertEquals("order", order.getField());
    }

    @Test
    void testFromQueryParsesNumbers() {
        TopicPageRequest request = TopicPageRequest.fromQuery("RATING", "ASC", "2", " 50 ");

        assertEquals(TopicSortKey.RATING, request.sortBy());
        assertEquals(SortOrder.ASC, request.order());
        assertEquals(50, request.offset());

        assertEquals("page", assertThrows(ValidationException.class,
                () -> TopicPageRequest.fromQuery("created", "desc", "two", "20")).getField());
    }

    private static List<Long> ids(PageResult<Topic> page) {
        return page.items().stream().map(Topic::id).toList();
    }
}
