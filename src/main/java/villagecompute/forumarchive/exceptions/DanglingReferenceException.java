/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

import java.nio.file.Path;

/**
 * Thrown when a category's {@code parent_cid} or a topic's {@code category_id} does not resolve to a loaded
 * category.
 */
public class DanglingReferenceException extends ArchiveLoadException {

    private final long offendingId;

    public DanglingReferenceException(String message, long offendingId, Path source) {
        super(message, source);
        this.offendingId = offendingId;
    }

    /**
     * @return the id that could not be resolved
     */
    public long getOffendingId() {
        return offendingId;
    }
}
