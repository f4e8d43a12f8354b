/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Collectors;

import villagecompute.forumarchive.data.models.Topic;
import villagecompute.forumarchive.exceptions.ValidationException;

/**
 * Fields a topic listing can be sorted by.
 *
 * <p>
 * Every comparator places missing values (a topic without {@code last_post}) last in both directions and breaks ties
 * by ascending topic id, so repeated identical requests always page identically.
 */
public enum TopicSortKey {

    CREATED("created"), LAST_POST("last_post"), VIEW_COUNT("view_count"), RATING("rating");

    private final String parameter;

    TopicSortKey(String parameter) {
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    /**
     * Total order over topics for this key and direction.
     */
    public Comparator<Topic> comparator(SortOrder order) {
        Comparator<Topic> byKey = switch (this) {
            case CREATED -> Comparator.comparing(Topic::created, TopicSortKey.<Instant>directed(order));
            case LAST_POST -> Comparator.comparing(Topic::lastPost, TopicSortKey.<Instant>directed(order));
            case VIEW_COUNT -> Comparator.comparing(Topic::viewCount, TopicSortKey.<Long>directed(order));
            case RATING -> Comparator.comparing(Topic::rating, TopicSortKey.<Long>directed(order));
        };
        return byKey.thenComparingLong(Topic::id);
    }

    /**
     * @throws ValidationException
     *             for an unknown key
     */
    public static TopicSortKey fromParameter(String value) {
        for (TopicSortKey key : values()) {
            if (key.parameter.equals(value == null ? null : value.toLowerCase(Locale.ROOT))) {
                return key;
            }
        }
        throw new ValidationException("sort_by", value, allowedValues());
    }

    static String allowedValues() {
        return Arrays.stream(values()).map(TopicSortKey::parameter).collect(Collectors.joining(", "));
    }

    private static <T extends Comparable<? super T>> Comparator<T> directed(SortOrder order) {
        Comparator<T> natural = Comparator.naturalOrder();
        return Comparator.nullsLast(order == SortOrder.DESC ? natural.reversed() : natural);
    }
}
