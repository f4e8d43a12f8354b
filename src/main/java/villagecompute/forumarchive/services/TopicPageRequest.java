/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import villagecompute.forumarchive.exceptions.ValidationException;

/**
 * Validated sort and paging parameters for a topic listing.
 *
 * <p>
 * Out-of-range values are rejected, never clamped, so a bad request fails with the field and allowed range instead of
 * quietly returning something else.
 *
 * @param sortBy
 *            sort key
 * @param order
 *            sort direction
 * @param page
 *            1-based page number
 * @param pageSize
 *            items per page, {@value #MIN_PAGE_SIZE}..{@value #MAX_PAGE_SIZE}
 */
public record TopicPageRequest(TopicSortKey sortBy, SortOrder order, int page, int pageSize) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MIN_PAGE_SIZE = 1;
    public static final int MAX_PAGE_SIZE = 100;

    public TopicPageRequest {
        if (sortBy == null) {
            throw new ValidationException("sort_by", null, TopicSortKey.allowedValues());
        }
        if (order == null) {
            throw new ValidationException("order", null, SortOrder.allowedValues());
        }
        if (page < DEFAULT_PAGE) {
            throw new ValidationException("page", page, ">= 1");
        }
        if (pageSize < MIN_PAGE_SIZE || pageSize > MAX_PAGE_SIZE) {
            throw new ValidationException("page_size", pageSize, MIN_PAGE_SIZE + ".." + MAX_PAGE_SIZE);
        }
    }

    /**
     * Defaults: newest first, first page of {@value #DEFAULT_PAGE_SIZE}.
     */
    public static TopicPageRequest defaults() {
        return new TopicPageRequest(TopicSortKey.CREATED, SortOrder.DESC, DEFAULT_PAGE, DEFAULT_PAGE_SIZE);
    }

    /**
     * Builds a request from raw query parameters.
     *
     * @throws ValidationException
     *             naming the first invalid parameter
     */
    public static TopicPageRequest fromParameters(String sortBy, String order, int page, int pageSize) {
        return new TopicPageRequest(TopicSortKey.fromParameter(sortBy), SortOrder.fromParameter(order), page,
                pageSize);
    }

    /**
     * Builds a request from unparsed query strings, rejecting non-numeric page values with the same
     * {@link ValidationException} as out-of-range ones.
     */
    public static TopicPageRequest fromQuery(String sortBy, String order, String page, String pageSize) {
        return fromParameters(sortBy, order, parseInt("page", page, ">= 1"),
                parseInt("page_size", pageSize, MIN_PAGE_SIZE + ".." + MAX_PAGE_SIZE));
    }

    private static int parseInt(String field, String raw, String allowed) {
        if (raw == null) {
            throw new ValidationException(field, null, allowed);
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new ValidationException(field, raw, allowed);
        }
    }

    /**
     * @return index of the first item of the page within the sorted candidates
     */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
