/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

import java.nio.file.Path;

/**
 * Thrown when a {@code _category.yml} descriptor cannot be parsed or lacks a required field ({@code id},
 * {@code name}).
 */
public class MalformedCategoryException extends ArchiveLoadException {

    public MalformedCategoryException(Path source, String reason) {
        super("Malformed category descriptor " + source + ": " + reason, source);
    }

    public MalformedCategoryException(Path source, String reason, Throwable cause) {
        super("Malformed category descriptor " + source + ": " + reason, source, cause);
    }
}
