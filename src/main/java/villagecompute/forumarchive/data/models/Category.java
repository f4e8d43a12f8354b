/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.data.models;

import java.nio.file.Path;

/**
 * A forum category read from a {@code _category.yml} descriptor.
 *
 * <p>
 * Parent/child links are stored as ids only. The hierarchy itself lives in the category tree index owned by
 * {@link villagecompute.forumarchive.services.ArchiveSnapshot}.
 *
 * @param id
 *            unique category id (always positive)
 * @param name
 *            display name
 * @param slug
 *            URL-friendly identifier
 * @param parentId
 *            parent category id, {@code null} for a root category
 * @param order
 *            display order hint exported by the board
 * @param disabled
 *            whether the category was disabled on the board
 * @param icon
 *            icon class name (nullable)
 * @param bgColor
 *            background color (nullable)
 * @param color
 *            foreground color (nullable)
 * @param postCount
 *            post count exported by the board
 * @param description
 *            category description (nullable)
 * @param source
 *            descriptor file the category was read from ({@code null} for categories built in memory)
 */
public record Category(long id, String name, String slug, Long parentId, int order, boolean disabled, String icon,
        String bgColor, String color, int postCount, String description, Path source) {

    /**
     * Creates a category with only the fields the store needs. Used by fixtures and tools that build archives in
     * memory.
     */
    public static Category of(long id, String name, String slug, Long parentId) {
        return new Category(id, name, slug, parentId, 0, false, null, null, null, 0, null, null);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isSubcategory() {
        return parentId != null;
    }
}
