/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

import java.nio.file.Path;

/**
 * Base class for every failure that aborts an archive load.
 *
 * <p>
 * A load failure is fatal: the snapshot being built is discarded and never published. Subclasses identify the
 * offending file and/or id so the export can be fixed.
 *
 * <p>
 * Extends RuntimeException per project standards.
 */
public class ArchiveLoadException extends RuntimeException {

    private final Path source;

    public ArchiveLoadException(String message, Path source) {
        super(message);
        this.source = source;
    }

    public ArchiveLoadException(String message, Path source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * @return file or directory that caused the failure, or {@code null} when the failure is not tied to a file
     */
    public Path getSource() {
        return source;
    }
}
