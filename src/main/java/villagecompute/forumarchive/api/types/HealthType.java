/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * API type for the health endpoint.
 *
 * @param status
 *            {@code UP} once an archive is published, {@code LOADING} before
 * @param categoriesLoaded
 *            categories in the published archive
 * @param topicsLoaded
 *            topics in the published archive
 * @param loadedAt
 *            when the published archive was loaded (nullable)
 */
@Schema(
        description = "Service health and archive size")
public record HealthType(@Schema(
        description = "UP or LOADING",
        example = "UP") String status,

        @JsonProperty("categories_loaded") int categoriesLoaded, @JsonProperty("topics_loaded") int topicsLoaded,

        @Schema(
                nullable = true) @JsonProperty("loaded_at") Instant loadedAt) {

    public static final String STATUS_UP = "UP";
    public static final String STATUS_LOADING = "LOADING";
}
