/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.util.List;

/**
 * One page of a sorted listing plus the size of the whole listing.
 *
 * @param items
 *            items on this page, empty past the last page
 * @param total
 *            number of items across all pages
 * @param page
 *            1-based page number that was requested
 * @param pageSize
 *            requested page size
 * @param <T>
 *            item type
 */
public record PageResult<T>(List<T> items, long total, int page, int pageSize) {

    public PageResult {
        items = List.copyOf(items);
    }

    /**
     * Total page count; an empty listing still has one (empty) page.
     */
    public int totalPages() {
        if (total == 0) {
            return 1;
        }
        return (int) ((total + pageSize - 1) / pageSize);
    }

    public boolean hasMore() {
        return (long) page * pageSize < total;
    }
}
