/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

import java.nio.file.Path;

/**
 * Thrown when a topic file has no parseable front-matter block or misses a required field ({@code topic_id},
 * {@code title}, {@code author_id}, {@code category_id}, {@code created}).
 */
public class MalformedTopicException extends ArchiveLoadException {

    public MalformedTopicException(Path source, String reason) {
        super("Malformed topic file " + source + ": " + reason, source);
    }

    public MalformedTopicException(Path source, String reason, Throwable cause) {
        super("Malformed topic file " + source + ": " + reason, source, cause);
    }
}
