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
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.forumarchive.api.types.PageType;
import villagecompute.forumarchive.api.types.TopicSummaryType;
import villagecompute.forumarchive.data.models.Topic;
import villagecompute.forumarchive.exceptions.ArchiveNotReadyException;
import villagecompute.forumarchive.exceptions.ValidationException;
import villagecompute.forumarchive.observability.ArchiveMetrics;
import villagecompute.forumarchive.services.ArchiveSnapshot;
import villagecompute.forumarchive.services.ArchiveStoreService;
import villagecompute.forumarchive.services.PageResult;
import villagecompute.forumarchive.services.TopicPageRequest;
import villagecompute.forumarchive.services.TopicPaginator;

import java.util.SortedSet;

/**
 * REST API for keyword search over topic titles.
 *
 * <p>
 * <b>Query Parameters:</b>
 * <ul>
 * <li>{@code q} (required) - words to look for; every word must appear in the title</li>
 * <li>{@code page}, {@code page_size} (optional) - paging, defaults 1 and 20</li>
 * <li>{@code sort_by}, {@code order} (optional) - defaults to most viewed first</li>
 * </ul>
 *
 * <p>
 * Matching ignores case and punctuation. There is no relevance ranking; results are ordered by the requested sort key
 * like any other listing.
 */
@Path("/api/v1/search")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Search",
        description = "Keyword search over topic titles")
public class SearchResource {

    private static final Logger LOG = Logger.getLogger(SearchResource.class);

    @Inject
    ArchiveStoreService archiveStore;

    @Inject
    ArchiveMetrics metrics;

    @GET
    @Operation(
            summary = "Search topics",
            description = "Topics whose title contains every word of the query")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Page of matching topics"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Missing query or invalid paging parameter"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Archive still loading")})
    public Response search(@QueryParam("q") String query, @QueryParam("page") @DefaultValue("1") String page,
            @QueryParam("page_size") @DefaultValue("20") String pageSize,
            @QueryParam("sort_by") @DefaultValue("view_count") String sortBy,
            @QueryParam("order") @DefaultValue("desc") String order) {

        if (query == null || query.isBlank()) {
            return ArchiveResponses.badRequest("q", "Query parameter 'q' is required");
        }

        try {
            TopicPageRequest request = TopicPageRequest.fromQuery(sortBy, order, page, pageSize);
            ArchiveSnapshot snapshot = archiveStore.current();
            SortedSet<Long> matches = snapshot.search(query);
            metrics.recordSearch();
            LOG.debugf("Search for \"%s\" matched %d topics", query, matches.size());
            PageResult<Topic> result = TopicPaginator.paginate(snapshot, matches, request);
            return Response.ok(PageType.from(result, TopicSummaryType::from)).build();
        } catch (ValidationException e) {
            return ArchiveResponses.badRequest(e);
        } catch (ArchiveNotReadyException e) {
            return ArchiveResponses.notReady();
        }
    }
}
