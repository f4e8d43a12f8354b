/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.observability;

import java.nio.file.Path;
import java.time.Instant;

import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for archive logging.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code request_origin} - HTTP method and path of the request being served</li>
 * <li>{@code archive_loaded_at} - load timestamp of the snapshot the request reads from</li>
 * <li>{@code load_root} - archive root while a load is running</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> all methods operate on {@link MDC}, which is thread-local. Request handlers must call
 * {@link #clearMDC()} when done so reused worker threads do not carry stale fields.
 *
 * @see villagecompute.forumarchive.api.filters.RequestLoggingFilter
 */
public final class LoggingConfig {

    /** HTTP method and path, e.g. {@code GET /api/v1/topics}. */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    /** ISO-8601 load time of the snapshot serving the request. */
    public static final String MDC_ARCHIVE_LOADED_AT = "archive_loaded_at";

    /** Archive root directory, only present during a load. */
    public static final String MDC_LOAD_ROOT = "load_root";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    public static void setArchiveLoadedAt(Instant loadedAt) {
        if (loadedAt != null) {
            MDC.put(MDC_ARCHIVE_LOADED_AT, loadedAt.toString());
        }
    }

    public static void setLoadRoot(Path root) {
        if (root != null) {
            MDC.put(MDC_LOAD_ROOT, root.toString());
        }
    }

    public static void clearLoadRoot() {
        MDC.remove(MDC_LOAD_ROOT);
    }

    /**
     * Clears all archive MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_ARCHIVE_LOADED_AT);
        MDC.remove(MDC_LOAD_ROOT);
    }
}
