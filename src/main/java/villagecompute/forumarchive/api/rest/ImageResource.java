/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.forumarchive.config.ArchiveConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.util.Locale;
import java.util.Map;

/**
 * Serves images referenced from topic bodies out of the configured images directory.
 *
 * <p>
 * Requests that resolve outside the images directory are answered with 404 exactly like missing files.
 */
@Path("/api/v1/images")
@Tag(
        name = "Images",
        description = "Static images referenced by topics")
public class ImageResource {

    private static final Logger LOG = Logger.getLogger(ImageResource.class);

    private static final Map<String, String> CONTENT_TYPES = Map.of("png", "image/png", "jpg", "image/jpeg", "jpeg",
            "image/jpeg", "gif", "image/gif", "webp", "image/webp", "svg", "image/svg+xml", "ico", "image/x-icon");

    @Inject
    ArchiveConfig config;

    @GET
    @Path("/{file}")
    @Operation(
            summary = "Get image",
            description = "Raw image file from the archive images directory")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Image bytes"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Image not found")})
    public Response image(@PathParam("file") String file) {
        java.nio.file.Path root = config.imagesPath().toAbsolutePath().normalize();
        java.nio.file.Path resolved;
        try {
            resolved = root.resolve(file).normalize();
        } catch (InvalidPathException e) {
            LOG.debugf("Rejected image path %s: %s", file, e.getMessage());
            return ArchiveResponses.notFound("Image not found: " + file);
        }
        if (!resolved.startsWith(root) || resolved.equals(root) || !Files.isRegularFile(resolved)) {
            return ArchiveResponses.notFound("Image not found: " + file);
        }
        try {
            return Response.ok(Files.readAllBytes(resolved), contentType(resolved)).build();
        } catch (IOException e) {
            LOG.errorf(e, "Failed to read image %s", resolved);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR).type(MediaType.APPLICATION_JSON)
                    .entity(new ArchiveResponses.ErrorResponse("Failed to read image")).build();
        }
    }

    private static String contentType(java.nio.file.Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return CONTENT_TYPES.getOrDefault(extension, MediaType.APPLICATION_OCTET_STREAM);
    }
}
