/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

import java.nio.file.Path;

/**
 * Thrown when two categories or two topics share an id.
 */
public class DuplicateIdException extends ArchiveLoadException {

    private final long duplicateId;

    public DuplicateIdException(String kind, long duplicateId, Path first, Path second) {
        super("Duplicate " + kind + " id " + duplicateId + " in " + describe(first) + " and " + describe(second),
                second);
        this.duplicateId = duplicateId;
    }

    public long getDuplicateId() {
        return duplicateId;
    }

    private static String describe(Path path) {
        return path == null ? "<in-memory>" : path.toString();
    }
}
