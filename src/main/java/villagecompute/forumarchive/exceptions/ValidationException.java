/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.exceptions;

/**
 * Exception thrown when caller-supplied query parameters are out of range or unknown.
 *
 * <p>
 * Carries the offending field and a description of the allowed values so the request can be fixed. Extends
 * RuntimeException per project standards. Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    private final String field;
    private final String allowed;

    public ValidationException(String field, Object rejectedValue, String allowed) {
        super("Invalid value for '" + field + "': " + rejectedValue + " (allowed: " + allowed + ")");
        this.field = field;
        this.allowed = allowed;
    }

    public String getField() {
        return field;
    }

    public String getAllowed() {
        return allowed;
    }
}
