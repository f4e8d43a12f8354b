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
import villagecompute.forumarchive.api.types.ExportInfoType;
import villagecompute.forumarchive.exceptions.ArchiveNotReadyException;
import villagecompute.forumarchive.services.ArchiveStoreService;

@Path("/api/v1/info")
@Tag(
        name = "Archive",
        description = "Export metadata")
public class ArchiveInfoResource {

    @Inject
    ArchiveStoreService archiveStore;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Export totals",
            description = "Totals recorded by the exporter; all zeros when the archive has no export descriptor")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Export totals",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ExportInfoType.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading")})
    public Response info() {
        try {
            return Response.ok(ExportInfoType.from(archiveStore.current().getExportInfo())).build();
        } catch (ArchiveNotReadyException e) {
            return ArchiveResponses.notReady();
        }
    }
}
