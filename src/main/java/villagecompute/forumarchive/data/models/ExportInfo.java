/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.data.models;

/**
 * Totals recorded by the board exporter in {@code _export.yml}.
 *
 * <p>
 * These are the exporter's own numbers, not counts of what was actually loaded. See
 * {@link villagecompute.forumarchive.services.ArchiveSnapshot#stats()} for the latter.
 */
public record ExportInfo(long totalUsers, long totalCategories, long totalTopics, long totalPosts) {

    public static final ExportInfo EMPTY = new ExportInfo(0, 0, 0, 0);
}
