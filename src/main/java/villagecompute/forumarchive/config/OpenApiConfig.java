/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.config;

import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 configuration for the Forum Archive API.
 *
 * @see <a href="https://github.com/eclipse/microprofile-open-api">MicroProfile OpenAPI Spec</a>
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Forum Archive API",
                version = "1.0.0",
                description = """
                        Read-only access to an exported discussion-board archive.

                        ## Features
                        - **Categories**: root list, nested tree, detail with breadcrumb path
                        - **Topics**: paged listings per category or across the archive, full topic bodies
                        - **Search**: keyword search over topic titles (all words must match)

                        ## Paging
                        Listings accept `page` (1-based), `page_size` (1-100, default 20),
                        `sort_by` (created, last_post, view_count, rating) and `order` (asc, desc).
                        Invalid values are rejected with 400 and the allowed range.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Apache-2.0")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Archive",
                description = "Export metadata"),
                @Tag(
                        name = "Categories",
                        description = "Category hierarchy and per-category topic listings"),
                @Tag(
                        name = "Topics",
                        description = "Topic listings and detail"),
                @Tag(
                        name = "Search",
                        description = "Keyword search over topic titles"),
                @Tag(
                        name = "Health",
                        description = "Health checks and readiness probes")})
public class OpenApiConfig extends Application {
    // Configuration via annotations only - no programmatic setup needed
}
