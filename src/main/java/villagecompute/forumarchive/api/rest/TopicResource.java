/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.forumarchive.api.types.PageType;
import villagecompute.forumarchive.api.types.TopicDetailType;
import villagecompute.forumarchive.api.types.TopicSummaryType;
import villagecompute.forumarchive.data.models.Topic;
import villagecompute.forumarchive.exceptions.ArchiveNotReadyException;
import villagecompute.forumarchive.exceptions.ValidationException;
import villagecompute.forumarchive.services.ArchiveSnapshot;
import villagecompute.forumarchive.services.ArchiveStoreService;
import villagecompute.forumarchive.services.TopicPageRequest;
import villagecompute.forumarchive.services.TopicPaginator;
import villagecompute.forumarchive.util.IdPathParser;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * REST API for archived topics.
 *
 * <p>
 * <b>Endpoints:</b>
 * <ul>
 * <li>{@code GET /api/v1/topics} - paged summaries across the whole archive</li>
 * <li>{@code GET /api/v1/topics/{id}[/{slug}]} - topic with Markdown and rendered HTML body</li>
 * </ul>
 */
@Path("/api/v1/topics")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Topics",
        description = "Topic listings and detail")
public class TopicResource {

    @Inject
    ArchiveStoreService archiveStore;

    @GET
    @Operation(
            summary = "List all topics",
            description = "Paged topic summaries across every category")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Page of topics"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid paging or sort parameter"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading")})
    public Response list(@QueryParam("page") @DefaultValue("1") String page,
            @QueryParam("page_size") @DefaultValue("20") String pageSize,
            @QueryParam("sort_by") @DefaultValue("created") String sortBy,
            @QueryParam("order") @DefaultValue("desc") String order) {
        try {
            TopicPageRequest request = TopicPageRequest.fromQuery(sortBy, order, page, pageSize);
            ArchiveSnapshot snapshot = archiveStore.current();
            return Response.ok(PageType.from(TopicPaginator.paginate(snapshot.allTopics(), request),
                    TopicSummaryType::from)).build();
        } catch (ValidationException e) {
            return ArchiveResponses.badRequest(e);
        } catch (ArchiveNotReadyException e) {
            return ArchiveResponses.notReady();
        }
    }

    @GET
    @Path("/{path}")
    @Operation(
            summary = "Get topic",
            description = "Topic with its Markdown body and rendered HTML")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Topic detail",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = TopicDetailType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Topic not found"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading")})
    public Response get(@PathParam("path") String path) {
        try {
            Optional<Topic> topic = lookup(archiveStore.current(), path);
            if (topic.isEmpty()) {
                return ArchiveResponses.notFound("Topic not found: " + path);
            }
            return Response.ok(TopicDetailType.from(topic.get())).build();
        } catch (ArchiveNotReadyException e) {
            return ArchiveResponses.notReady();
        }
    }

    @GET
    @Path("/{id}/{slug}")
    @Operation(
            summary = "Get topic by id and slug",
            description = "Same as the id-only form; the slug is ignored")
    public Response getWithSlug(@PathParam("id") String id, @PathParam("slug") String slug) {
        return get(id);
    }

    private static Optional<Topic> lookup(ArchiveSnapshot snapshot, String path) {
        OptionalLong id = IdPathParser.parse(path);
        return id.isPresent() ? snapshot.getTopic(id.getAsLong()) : Optional.empty();
    }
}
