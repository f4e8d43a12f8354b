/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

import villagecompute.forumarchive.data.models.Topic;

/**
 * Inverted index over topic titles.
 *
 * <p>
 * <b>Normalization:</b> lowercase ({@link Locale#ROOT}), then split on every run of characters that are neither
 * letters nor digits, so {@code "DCS/Mission editor"} indexes as {@code dcs}, {@code mission}, {@code editor}.
 * Stop-words are kept; titles are short and precision matters more than recall.
 *
 * <p>
 * <b>Matching:</b> AND semantics. A topic matches when its title contains every query token, in any order. A token
 * missing from the index empties the result. A query with no tokens matches nothing. There is no relevance ranking:
 * results are a set of ids and callers sort and page them.
 *
 * <p>
 * Built once per snapshot and never mutated, so concurrent queries need no locking.
 */
public final class TopicSearchIndex {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]",
            Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<String, SortedSet<Long>> postings;

    private TopicSearchIndex(Map<String, SortedSet<Long>> postings) {
        this.postings = postings;
    }

    /**
     * Indexes the titles of the given topics.
     */
    public static TopicSearchIndex build(Collection<Topic> topics) {
        Map<String, SortedSet<Long>> postings = new HashMap<>();
        for (Topic topic : topics) {
            for (String token : tokenize(topic.title())) {
                postings.computeIfAbsent(token, key -> new TreeSet<>()).add(topic.id());
            }
        }
        Map<String, SortedSet<Long>> frozen = new HashMap<>();
        postings.forEach((token, ids) -> frozen.put(token, Collections.unmodifiableSortedSet(ids)));
        return new TopicSearchIndex(Collections.unmodifiableMap(frozen));
    }

    /**
     * Splits text into normalized tokens, exactly as titles are indexed.
     *
     * @param text
     *            raw text, may be {@code null}
     * @return tokens in order of appearance, duplicates kept
     */
    public static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        String normalized = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(normalized));
    }

    /**
     * Returns the ids of topics whose title contains every token of the query.
     *
     * @param query
     *            raw query text
     * @return matching topic ids in ascending order; empty for a blank query or when any token is unknown
     */
    public SortedSet<Long> search(String query) {
        List<String> tokens = tokenize(query);
        if (tokens.isEmpty()) {
            return Collections.emptySortedSet();
        }

        List<SortedSet<Long>> lists = new ArrayList<>();
        for (String token : new TreeSet<>(tokens)) {
            SortedSet<Long> ids = postings.get(token);
            if (ids == null) {
                return Collections.emptySortedSet();
            }
            lists.add(ids);
        }
        lists.sort(Comparator.comparingInt(SortedSet::size));

        SortedSet<Long> result = new TreeSet<>(lists.get(0));
        for (int i = 1; i < lists.size() && !result.isEmpty(); i++) {
            result.retainAll(lists.get(i));
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * @return number of distinct indexed tokens
     */
    public int tokenCount() {
        return postings.size();
    }
}
