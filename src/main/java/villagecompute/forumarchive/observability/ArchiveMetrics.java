/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.observability;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.forumarchive.services.ArchiveSnapshot;

/**
 * Registers archive metrics with Micrometer.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code archive_categories_loaded}, {@code archive_topics_loaded} - size of the published
 * snapshot</li>
 * <li><b>Timers:</b> {@code archive_load_duration} - wall time of successful loads</li>
 * <li><b>Counters:</b> {@code archive_loads_total{result}} - load attempts by outcome ({@code success},
 * {@code failure})</li>
 * <li><b>Counters:</b> {@code archive_search_queries_total} - search requests served</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class ArchiveMetrics {

    private static final Logger LOG = Logger.getLogger(ArchiveMetrics.class);

    @Inject
    MeterRegistry registry;

    private final AtomicLong categoriesLoaded = new AtomicLong();
    private final AtomicLong topicsLoaded = new AtomicLong();

    private Timer loadTimer;
    private Counter loadSuccesses;
    private Counter loadFailures;
    private Counter searchQueries;

    @PostConstruct
    void registerMetrics() {
        Gauge.builder("archive_categories_loaded", categoriesLoaded, AtomicLong::get)
                .description("Categories in the published archive snapshot").register(registry);
        Gauge.builder("archive_topics_loaded", topicsLoaded, AtomicLong::get)
                .description("Topics in the published archive snapshot").register(registry);
        loadTimer = Timer.builder("archive_load_duration").description("Time to load and index the archive")
                .register(registry);
        loadSuccesses = Counter.builder("archive_loads_total").tag("result", "success")
                .description("Archive load attempts").register(registry);
        loadFailures = Counter.builder("archive_loads_total").tag("result", "failure")
                .description("Archive load attempts").register(registry);
        searchQueries = Counter.builder("archive_search_queries_total").description("Title searches served")
                .register(registry);
        LOG.debug("Registered archive metrics");
    }

    /**
     * Records a published snapshot.
     *
     * @param snapshot
     *            the snapshot now being served
     * @param duration
     *            load time, {@code null} when the snapshot was installed rather than loaded
     */
    public void recordPublished(ArchiveSnapshot snapshot, Duration duration) {
        ArchiveSnapshot.Stats stats = snapshot.stats();
        categoriesLoaded.set(stats.categories());
        topicsLoaded.set(stats.topics());
        if (duration != null) {
            loadTimer.record(duration);
            loadSuccesses.increment();
        }
    }

    public void recordLoadFailure() {
        loadFailures.increment();
    }

    public void recordSearch() {
        searchQueries.increment();
    }
}
