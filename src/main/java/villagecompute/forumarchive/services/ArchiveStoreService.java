/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import io.quarkus.runtime.Startup;
import villagecompute.forumarchive.config.ArchiveConfig;
import villagecompute.forumarchive.exceptions.ArchiveNotReadyException;
import villagecompute.forumarchive.observability.ArchiveMetrics;
import villagecompute.forumarchive.observability.LoggingConfig;

/**
 * Owns the archive snapshot served to readers.
 *
 * <p>
 * The archive is loaded once at startup; a failed startup load stops the application. Later calls to
 * {@link #reload()} build a complete new snapshot off to the side and publish it with a single reference swap, so a
 * request sees either the old archive or the new one, never a mix. A failed reload leaves the previous snapshot in
 * place. {@link #reload()}, {@link #replace(ArchiveSnapshot)} and shutdown publish under the same monitor, so the
 * last call to finish is the one readers see.
 *
 * <p>
 * Readers should call {@link #current()} once per request and work from that snapshot.
 */
@ApplicationScoped
@Startup
public class ArchiveStoreService {

    private static final Logger LOG = Logger.getLogger(ArchiveStoreService.class);

    @Inject
    ArchiveConfig config;

    @Inject
    ArchiveMetrics metrics;

    private final AtomicReference<ArchiveSnapshot> snapshot = new AtomicReference<>();

    @PostConstruct
    void init() {
        reload();
    }

    /**
     * Returns the published snapshot.
     *
     * @throws ArchiveNotReadyException
     *             if no snapshot has been published yet
     */
    public ArchiveSnapshot current() {
        ArchiveSnapshot published = snapshot.get();
        if (published == null) {
            throw new ArchiveNotReadyException();
        }
        return published;
    }

    public boolean isReady() {
        return snapshot.get() != null;
    }

    /**
     * Loads the configured archive root and publishes it.
     *
     * @return the newly published snapshot
     * @throws villagecompute.forumarchive.exceptions.ArchiveLoadException
     *             if the archive cannot be loaded; the previous snapshot stays published
     */
    public synchronized ArchiveSnapshot reload() {
        Path root = config.dataPath();
        LoggingConfig.setLoadRoot(root);
        long startNanos = System.nanoTime();
        try {
            ArchiveSnapshot loaded = ArchiveSnapshot.load(root, Instant.now());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            snapshot.set(loaded);
            metrics.recordPublished(loaded, elapsed);
            ArchiveSnapshot.Stats stats = loaded.stats();
            LOG.infof("Published archive from %s: %d categories, %d topics in %d ms", root, stats.categories(),
                    stats.topics(), elapsed.toMillis());
            return loaded;
        } catch (RuntimeException e) {
            metrics.recordLoadFailure();
            LOG.errorf(e, "Archive load from %s failed; %s", root,
                    isReady() ? "keeping previously published snapshot" : "no snapshot available");
            throw e;
        } finally {
            LoggingConfig.clearLoadRoot();
        }
    }

    /**
     * Publishes an already built snapshot.
     *
     * @param replacement
     *            snapshot to serve from now on
     */
    public synchronized void replace(ArchiveSnapshot replacement) {
        Objects.requireNonNull(replacement, "replacement");
        snapshot.set(replacement);
        metrics.recordPublished(replacement, null);
        LOG.infof("Installed archive snapshot loaded at %s", replacement.getLoadedAt());
    }

    @PreDestroy
    synchronized void shutdown() {
        ArchiveSnapshot released = snapshot.getAndSet(null);
        if (released != null) {
            LOG.debugf("Released archive snapshot loaded at %s", released.getLoadedAt());
        }
    }
}
