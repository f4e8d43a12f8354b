/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.services;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import villagecompute.forumarchive.exceptions.ValidationException;

/**
 * Direction of a topic listing.
 */
public enum SortOrder {

    ASC("asc"), DESC("desc");

    private final String parameter;

    SortOrder(String parameter) {
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    /**
     * @throws ValidationException
     *             for anything other than {@code asc} or {@code desc}
     */
    public static SortOrder fromParameter(String value) {
        for (SortOrder order : values()) {
            if (order.parameter.equals(value == null ? null : value.toLowerCase(Locale.ROOT))) {
                return order;
            }
        }
        throw new ValidationException("order", value, allowedValues());
    }

    static String allowedValues() {
        return Arrays.stream(values()).map(SortOrder::parameter).collect(Collectors.joining(", "));
    }
}
