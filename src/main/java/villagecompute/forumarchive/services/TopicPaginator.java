/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import villagecompute.forumarchive.data.models.Topic;

/**
 * Sorts and slices a candidate set of topic ids.
 *
 * <p>
 * Candidates come from the store ({@link ArchiveSnapshot#getTopicsInCategory}, {@link ArchiveSnapshot#allTopicIds})
 * or from search ({@link ArchiveSnapshot#search}). Ids that do not resolve in the snapshot are dropped before
 * counting. A page past the end is empty but still reports the correct total.
 */
public final class TopicPaginator {

    private TopicPaginator() {
        // Utility class - prevent instantiation
    }

    /**
     * @param snapshot
     *            snapshot the ids belong to
     * @param candidateIds
     *            ids to sort and page, any order
     * @param request
     *            validated sort and paging parameters
     * @return the requested page
     */
    public static PageResult<Topic> paginate(ArchiveSnapshot snapshot, Collection<Long> candidateIds,
            TopicPageRequest request) {
        List<Topic> topics = new ArrayList<>(candidateIds.size());
        for (Long id : candidateIds) {
            Optional<Topic> topic = snapshot.getTopic(id);
            topic.ifPresent(topics::add);
        }
        return paginate(topics, request);
    }

    /**
     * Sorts and slices already-resolved topics.
     */
    public static PageResult<Topic> paginate(List<Topic> topics, TopicPageRequest request) {
        List<Topic> sorted = new ArrayList<>(topics);
        sorted.sort(request.sortBy().comparator(request.order()));

        long offset = request.offset();
        if (offset >= sorted.size()) {
            return new PageResult<>(List.of(), sorted.size(), request.page(), request.pageSize());
        }
        int from = (int) offset;
        int to = Math.min(sorted.size(), from + request.pageSize());
        return new PageResult<>(sorted.subList(from, to), sorted.size(), request.page(), request.pageSize());
    }
}
