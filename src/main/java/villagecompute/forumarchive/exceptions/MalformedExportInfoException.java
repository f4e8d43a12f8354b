/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

import java.nio.file.Path;

/**
 * Thrown when {@code _export.yml} exists but cannot be read. A missing file is not an error.
 */
public class MalformedExportInfoException extends ArchiveLoadException {

    public MalformedExportInfoException(Path source, String reason, Throwable cause) {
        super("Malformed export descriptor " + source + ": " + reason, source, cause);
    }
}
