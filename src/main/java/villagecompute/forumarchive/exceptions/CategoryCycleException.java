/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

import java.nio.file.Path;

/**
 * Thrown when explicit {@code parent_cid} values make the category hierarchy cyclic.
 */
public class CategoryCycleException extends ArchiveLoadException {

    private final long categoryId;

    public CategoryCycleException(long categoryId, Path source) {
        super("Category " + categoryId + " is its own ancestor", source);
        this.categoryId = categoryId;
    }

    public long getCategoryId() {
        return categoryId;
    }
}
