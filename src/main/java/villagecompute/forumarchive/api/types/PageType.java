/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.forumarchive.services.PageResult;

import java.util.List;
import java.util.function.Function;

/**
 * API type wrapping one page of a listing.
 *
 * @param items
 *            entries on this page
 * @param total
 *            entries across all pages
 * @param page
 *            1-based page number
 * @param pageSize
 *            requested page size
 * @param totalPages
 *            number of pages, at least 1
 */
@Schema(
        description = "One page of a paginated listing")
public record PageType<T>(List<T> items, long total, int page, @JsonProperty("page_size") int pageSize,
        @JsonProperty("total_pages") int totalPages) {

    public static <S, T> PageType<T> from(PageResult<S> result, Function<S, T> mapper) {
        return new PageType<>(result.items().stream().map(mapper).toList(), result.total(), result.page(),
                result.pageSize(), result.totalPages());
    }
}
