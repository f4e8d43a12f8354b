/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

/**
 * Exception thrown when a requested category or topic does not exist in the published archive.
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found in REST resources. Lookups that can
 * legitimately miss return {@link java.util.Optional} instead; this exception is reserved for operations whose
 * contract requires an existing id (e.g. breadcrumb paths).
 */
public class ResourceNotFoundException extends RuntimeException {

    private final long id;

    public ResourceNotFoundException(String kind, long id) {
        super(kind + " not found: " + id);
        this.id = id;
    }

    public long getId() {
        return id;
    }
}
