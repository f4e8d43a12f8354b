/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.util;

import java.util.OptionalLong;

/**
 * Extracts the numeric id from the path segment used by category and topic URLs.
 *
 * <p>
 * Accepted forms:
 * <ul>
 * <li>{@code 20} - bare id</li>
 * <li>{@code 20/some-slug} - current form, slug is ignored</li>
 * <li>{@code 20-some-slug} - legacy form carried over from exported links</li>
 * </ul>
 */
public final class IdPathParser {

    private IdPathParser() {
        // Utility class - prevent instantiation
    }

    /**
     * @param path
     *            path segment after the collection prefix
     * @return the id, or empty when the leading token is not a positive number
     */
    public static OptionalLong parse(String path) {
        if (path == null || path.isEmpty()) {
            return OptionalLong.empty();
        }
        String token = path;
        int slash = token.indexOf('/');
        if (slash >= 0) {
            token = token.substring(0, slash);
        } else {
            int dash = token.indexOf('-');
            if (dash >= 0) {
                token = token.substring(0, dash);
            }
        }
        if (token.isEmpty() || token.length() > 18 || !token.chars().allMatch(Character::isDigit)) {
            return OptionalLong.empty();
        }
        long id = Long.parseLong(token);
        return id > 0 ? OptionalLong.of(id) : OptionalLong.empty();
    }
}
