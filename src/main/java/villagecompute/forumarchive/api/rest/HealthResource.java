/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.forumarchive.api.types.HealthType;
import villagecompute.forumarchive.services.ArchiveSnapshot;
import villagecompute.forumarchive.services.ArchiveStoreService;

@Path("/api/health")
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    @Inject
    ArchiveStoreService archiveStore;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Reports whether an archive is published and how much of it was loaded")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Archive published",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthType.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = HealthType.class)))})
    public Response health() {
        if (!archiveStore.isReady()) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new HealthType(HealthType.STATUS_LOADING, 0, 0, null)).build();
        }
        ArchiveSnapshot.Stats stats = archiveStore.current().stats();
        return Response.ok(new HealthType(HealthType.STATUS_UP, stats.categories(), stats.topics(), stats.loadedAt()))
                .build();
    }
}
