/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.forumarchive.ArchiveTestFixtures;
import villagecompute.forumarchive.services.ArchiveSnapshot;

/**
 * Tests for {@link ArchiveMetrics} against an in-memory registry.
 */
class ArchiveMetricsTest {

    private SimpleMeterRegistry registry;
    private ArchiveMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ArchiveMetrics();
        metrics.registry = registry;
        metrics.registerMetrics();
    }

    @Test
    void testPublishedSnapshotUpdatesGaugesAndTimer() {
        ArchiveSnapshot snapshot = ArchiveSnapshot.build(ArchiveTestFixtures.content(
                List.of(ArchiveTestFixtures.category(1, "A", null), ArchiveTestFixtures.category(2, "B", 1L)),
                List.of(ArchiveTestFixtures.topic(10, "x", 2, ArchiveTestFixtures.LOADED_AT))),
                ArchiveTestFixtures.LOADED_AT);

        metrics.recordPublished(snapshot, Duration.ofMillis(250));

        assertEquals(2.0, registry.get("archive_categories_loaded").gauge().value());
        assertEquals(1.0, registry.get("archive_topics_loaded").gauge().value());
        assertEquals(1, registry.get("archive_load_duration").timer().count());
        assertEquals(1.0, registry.get("archive_loads_total").tag("result", "success").counter().count());
    }

    @Test
    void testInstalledSnapshotDoesNotCountAsLoad() {
        metrics.recordPublished(ArchiveSnapshot.empty(ArchiveTestFixtures.LOADED_AT), null);

        assertEquals(0, registry.get("archive_load_duration").timer().count());
        assertEquals(0.0, registry.get("archive_loads_total").tag("result", "success").counter().count());
    }

    @Test
    void testFailuresAndSearchesAreCounted() {
        metrics.recordLoadFailure();
        metrics.recordSearch();
        metrics.recordSearch();

        assertEquals(1.0, registry.get("archive_loads_total").tag("result", "failure").counter().count());
        assertEquals(2.0, registry.get("archive_search_queries_total").counter().count());
    }
}
