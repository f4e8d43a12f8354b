/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static villagecompute.forumarchive.ArchiveTestFixtures.LOADED_AT;
import static villagecompute.forumarchive.ArchiveTestFixtures.categoryYaml;
import static villagecompute.forumarchive.ArchiveTestFixtures.topicMarkdown;
import static villagecompute.forumarchive.ArchiveTestFixtures.write;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.forumarchive.config.ArchiveConfig;
import villagecompute.forumarchive.exceptions.ArchiveNotReadyException;
import villagecompute.forumarchive.exceptions.MalformedTopicException;
import villagecompute.forumarchive.observability.ArchiveMetrics;

/**
 * Unit tests for {@link ArchiveStoreService} publication semantics.
 */
class ArchiveStoreServiceTest {

    @Mock
    ArchiveConfig config;

    @Mock
    ArchiveMetrics metrics;

    @InjectMocks
    ArchiveStoreService service;

    @TempDir
    Path root;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(config.dataPath()).thenReturn(root);
        write(root, "1-a/_category.yml", categoryYaml(1, "A"));
        write(root, "1-a/10-first.md", topicMarkdown(10, "First", 1, "2020-01-01"));
    }

    @Test
    void testNotReadyBeforeFirstLoad() {
        assertFalse(service.isReady());
        assertThrows(ArchiveNotReadyException.class, () -> service.current());
    }

    @Test
    void testInitPublishesSnapshot() {
        service.init();

        assertTrue(service.isReady());
        assertEquals(1, service.current().stats().topics());
        verify(metrics).recordPublished(any(ArchiveSnapshot.class), any(Duration.class));
    }

    @Test
    void testReloadSwapsWholeSnapshot() {
        service.init();
        ArchiveSnapshot before = service.current();
        write(root, "1-a/11-second.md", topicMarkdown(11, "Second", 1, "2020-01-02"));

        ArchiveSnapshot after = service.reload();

        assertSame(after, service.current());
        assertNotSame(before, after);
        assertEquals(1, before.stats().topics(), "old snapshot is never mutated");
        assertEquals(2, after.stats().topics());
    }

    @Test
    void testFailedReloadKeepsPreviousSnapshot() {
        service.init();
        ArchiveSnapshot before = service.current();
        write(root, "1-a/12-broken.md", "---\ntopic_id: 12\n---\n");

        assertThrows(MalformedTopicException.class, () -> service.reload());

        assertSame(before, service.current());
        verify(metrics).recordLoadFailure();
    }

    @Test
    void testFailedFirstLoadLeavesServiceNotReady() {
        write(root, "1-a/12-broken.md", "no front matter");

        assertThrows(MalformedTopicException.class, () -> service.init());

        assertFalse(service.isReady());
        verify(metrics, never()).recordPublished(any(), any());
    }

    @Test
    void testReplaceInstallsGivenSnapshot() {
        ArchiveSnapshot empty = ArchiveSnapshot.empty(LOADED_AT);

        service.replace(empty);

        assertSame(empty, service.current());
        verify(metrics).recordPublished(any(ArchiveSnapshot.class), isNull());
    }

    @Test
    void testReplaceAndReloadLastPublishWins() {
        service.init();
        ArchiveSnapshot empty = ArchiveSnapshot.empty(LOADED_AT);

        service.replace(empty);
        assertEquals(0, service.current().stats().topics());

        ArchiveSnapshot reloaded = service.reload();
        assertSame(reloaded, service.current());
        assertEquals(1, service.current().stats().topics());

        service.replace(empty);
        assertSame(empty, service.current());
    }

    @Test
    void testConcurrentReplaceAndReloadLeaveAWholeSnapshot() throws Exception {
        service.init();
        ArchiveSnapshot empty = ArchiveSnapshot.empty(LOADED_AT);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(executor.submit(() -> service.replace(empty)));
                futures.add(executor.submit(() -> service.reload()));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        ArchiveSnapshot published = service.current();
        assertTrue(published == empty || published.stats().topics() == 1);
    }

    @Test
    void testShutdownReleasesSnapshot() {
        service.init();

        service.shutdown();

        assertFalse(service.isReady());
    }
}
