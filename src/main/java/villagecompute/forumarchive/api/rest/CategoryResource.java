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
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.forumarchive.api.types.CategoryDetailType;
import villagecompute.forumarchive.api.types.CategorySummaryType;
import villagecompute.forumarchive.api.types.CategoryTreeType;
import villagecompute.forumarchive.api.types.PageType;
import villagecompute.forumarchive.api.types.TopicSummaryType;
import villagecompute.forumarchive.data.models.Category;
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
 * REST API for browsing the category hierarchy.
 *
 * <p>
 * <b>Endpoints:</b>
 * <ul>
 * <li>{@code GET /api/v1/categories} - root categories in display order</li>
 * <li>{@code GET /api/v1/categories/tree} - full nested tree</li>
 * <li>{@code GET /api/v1/categories/{id}[/{slug}]} - category detail with subcategories and breadcrumb</li>
 * <li>{@code GET /api/v1/categories/{id}[/{slug}]/topics} - paged topics of the category</li>
 * </ul>
 *
 * <p>
 * The id segment also accepts the legacy {@code 20-slug} form. The slug is never checked.
 */
@Path("/api/v1/categories")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Categories",
        description = "Category hierarchy and per-category topic listings")
public class CategoryResource {

    private static final Logger LOG = Logger.getLogger(CategoryResource.class);

    @Inject
    ArchiveStoreService archiveStore;

    @GET
    @Operation(
            summary = "List root categories",
            description = "Top-level categories in display order, with direct topic counts")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Root categories"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading")})
    public Response listRoots() {
        try {
            ArchiveSnapshot snapshot = archiveStore.current();
            return Response.ok(CategorySummaryType.from(snapshot.getRootCategories(), snapshot)).build();
        } catch (ArchiveNotReadyException e) {
            return ArchiveResponses.notReady();
        }
    }

    @GET
    @Path("/tree")
    @Operation(
            summary = "Category tree",
            description = "All categories nested under their parents")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Nested category tree"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading")})
    public Response tree() {
        try {
            return Response.ok(CategoryTreeType.from(archiveStore.current().getCategoryTree())).build();
        } catch (ArchiveNotReadyException e) {
            return ArchiveResponses.notReady();
        }
    }

    @GET
    @Path("/{path}")
    @Operation(
            summary = "Get category",
            description = "Category detail with direct subcategories and the breadcrumb from its root")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Category detail"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Category not found"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading")})
    public Response get(@Parameter(
            description = "Category id, optionally followed by -slug",
            example = "20") @PathParam("path") String path) {
        return detail(path);
    }

    @GET
    @Path("/{id}/{slug}")
    @Operation(
            summary = "Get category by id and slug",
            description = "Same as the id-only form; the slug is ignored")
    public Response getWithSlug(@PathParam("id") String id, @PathParam("slug") String slug) {
        return detail(id);
    }

    @GET
    @Path("/{path}/topics")
    @Operation(
            summary = "List topics in a category",
            description = "Paged topic summaries; with recursive=true includes topics of all descendant categories")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Page of topics"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid paging or sort parameter"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Category not found"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading")})
    public Response topics(@PathParam("path") String path, @QueryParam("page") @DefaultValue("1") String page,
            @QueryParam("page_size") @DefaultValue("20") String pageSize,
            @QueryParam("sort_by") @DefaultValue("created") String sortBy,
            @QueryParam("order") @DefaultValue("desc") String order,
            @QueryParam("recursive") @DefaultValue("false") boolean recursive) {
        return topicPage(path, page, pageSize, sortBy, order, recursive);
    }

    @GET
    @Path("/{id}/{slug}/topics")
    @Operation(
            summary = "List topics in a category by id and slug",
            description = "Same as the id-only form; the slug is ignored")
    public Response topicsWithSlug(@PathParam("id") String id, @PathParam("slug") String slug,
            @QueryParam("page") @DefaultValue("1") String page,
            @QueryParam("page_size") @DefaultValue("20") String pageSize,
            @QueryParam("sort_by") @DefaultValue("created") String sortBy,
            @QueryParam("order") @DefaultValue("desc") String order,
            @QueryParam("recursive") @DefaultValue("false") boolean recursive) {
        return topicPage(id, page, pageSize, sortBy, order, recursive);
    }

    private Response detail(String path) {
        try {
            ArchiveSnapshot snapshot = archiveStore.current();
            Optional<Category> category = lookup(snapshot, path);
            if (category.isEmpty()) {
                return ArchiveResponses.notFound("Category not found: " + path);
            }
            return Response.ok(CategoryDetailType.from(category.get(), snapshot)).build();
        } catch (ArchiveNotReadyException e) {
            return ArchiveResponses.notReady();
        }
    }

    private Response topicPage(String path, String page, String pageSize, String sortBy, String order,
            boolean recursive) {
        try {
            TopicPageRequest request = TopicPageRequest.fromQuery(sortBy, order, page, pageSize);
            ArchiveSnapshot snapshot = archiveStore.current();
            Optional<Category> category = lookup(snapshot, path);
            if (category.isEmpty()) {
                return ArchiveResponses.notFound("Category not found: " + path);
            }
            LOG.debugf("Listing topics of category %d (recursive=%s, %s)", Long.valueOf(category.get().id()), Boolean.valueOf(recursive),
                    request);
            return Response.ok(PageType.from(TopicPaginator.paginate(snapshot,
                    snapshot.getTopicsInCategory(category.get().id(), recursive), request), TopicSummaryType::from))
                    .build();
        } catch (ValidationException e) {
            return ArchiveResponses.badRequest(e);
        } catch (ArchiveNotReadyException e) {
            return ArchiveResponses.notReady();
        }
    }

    private static Optional<Category> lookup(ArchiveSnapshot snapshot, String path) {
        OptionalLong id = IdPathParser.parse(path);
        return id.isPresent() ? snapshot.getCategory(id.getAsLong()) : Optional.empty();
    }
}
