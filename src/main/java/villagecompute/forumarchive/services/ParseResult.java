/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.util.Objects;

/**
 * Outcome of parsing one archive file: either a value or the reason the file was rejected.
 *
 * @param value
 *            parsed value, {@code null} on failure
 * @param error
 *            failure reason, {@code null} on success
 * @param <T>
 *            parsed entity type
 */
public record ParseResult<T>(T value, String error) {

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> failure(String error) {
        return new ParseResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
