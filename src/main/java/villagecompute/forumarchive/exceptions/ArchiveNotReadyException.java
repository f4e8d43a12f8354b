/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

/**
 * Exception thrown when a read arrives before the first archive snapshot has been published. Mapped to HTTP 503.
 */
public class ArchiveNotReadyException extends RuntimeException {

    public ArchiveNotReadyException() {
        super("Archive has not finished loading");
    }
}
