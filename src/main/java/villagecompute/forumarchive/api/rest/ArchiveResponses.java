/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.rest;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.forumarchive.exceptions.ValidationException;

/**
 * Error responses shared by the archive resources.
 */
final class ArchiveResponses {

    private ArchiveResponses() {
        // Utility class - prevent instantiation
    }

    static Response notFound(String message) {
        return Response.status(Response.Status.NOT_FOUND).type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message)).build();
    }

    static Response badRequest(ValidationException e) {
        return Response.status(Response.Status.BAD_REQUEST).type(MediaType.APPLICATION_JSON)
                .entity(new ValidationErrorResponse(e.getMessage(), e.getField(), e.getAllowed())).build();
    }

    static Response badRequest(String field, String message) {
        return Response.status(Response.Status.BAD_REQUEST).type(MediaType.APPLICATION_JSON)
                .entity(new ValidationErrorResponse(message, field, null)).build();
    }

    static Response notReady() {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE).type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse("Archive is still loading")).build();
    }

    record ErrorResponse(String error) {
    }

    record ValidationErrorResponse(String error, String field, String allowed) {
    }
}
