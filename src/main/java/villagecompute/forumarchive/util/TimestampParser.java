/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.forumarchive.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the timestamp spellings found in board exports.
 *
 * <p>
 * Accepted forms:
 * <ul>
 * <li>integer epoch milliseconds ({@code 1614592800000})</li>
 * <li>ISO-8601 with offset ({@code 2021-03-01T10:00:00Z}, {@code 2021-03-01T10:00:00+01:00})</li>
 * <li>local date-time with {@code T} or space separator, optional fraction ({@code 2021-03-01 10:00:00.123456})</li>
 * <li>date only ({@code 2021-03-01}, start of day)</li>
 * </ul>
 * Values without an offset are read as UTC. Impossible calendar dates and malformed separators are rejected.
 */
public final class TimestampParser {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d{1,15}");

    private static final int DATE_LENGTH = "uuuu-MM-dd".length();

    private static final DateTimeFormatter ISO_FORMAT = exportFormat('T');

    private static final DateTimeFormatter SPACED_FORMAT = exportFormat(' ');

    private TimestampParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a textual timestamp.
     *
     * @param text
     *            raw value, may be {@code null}
     * @return the instant, or empty when the text is blank or in none of the accepted forms
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        if (EPOCH_MILLIS.matcher(value).matches()) {
            return Optional.of(fromEpochMillis(Long.parseLong(value)));
        }

        DateTimeFormatter format = value.length() > DATE_LENGTH && value.charAt(DATE_LENGTH) == ' '
                ? SPACED_FORMAT
                : ISO_FORMAT;
        TemporalAccessor parsed;
        try {
            parsed = format.parseBest(value, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return Optional.of(offsetDateTime.toInstant());
        }
        if (parsed instanceof LocalDateTime localDateTime) {
            return Optional.of(localDateTime.toInstant(ZoneOffset.UTC));
        }
        return Optional.of(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC));
    }

    /**
     * Date, then optionally exactly one {@code separator}, a time and an offset. Calendar fields are resolved strictly,
     * so {@code 2021-02-30} is rejected instead of being moved to the last day of the month.
     */
    private static DateTimeFormatter exportFormat(char separator) {
        return new DateTimeFormatterBuilder()
                .append(DateTimeFormatter.ISO_LOCAL_DATE)
                .optionalStart()
                .appendLiteral(separator)
                .append(DateTimeFormatter.ISO_LOCAL_TIME)
                .optionalStart().appendOffsetId().optionalEnd()
                .optionalEnd()
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT)
                .withChronology(IsoChronology.INSTANCE);
    }

    /**
     * Converts an integral front-matter value holding epoch milliseconds.
     */
    public static Instant fromEpochMillis(long millis) {
        return Instant.ofEpochMilli(millis);
    }
}
