/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.textarchive.archive;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Timestamp formats used by the archive files.
 * <p>
 * Parsing tries the primary human format, then each fallback in order.
 * There is no default: text that matches none of them yields an empty result
 * and the caller reports the line as unparsed.
 */
public final class ArchiveTimestamps {

    /** {@code June 05 2024 at 14:30}, as written into prayer and registration files. */
    public static final DateTimeFormatter HUMAN = DateTimeFormatter.ofPattern("MMMM dd yyyy 'at' HH:mm", Locale.ENGLISH);

    /** {@code June 05 2024}, date headers of the monthly activity file. */
    public static final DateTimeFormatter HUMAN_DATE = DateTimeFormatter.ofPattern("MMMM dd yyyy", Locale.ENGLISH);

    /** {@code June 2024}, title line of monthly files. */
    public static final DateTimeFormatter MONTH_TITLE = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    /** {@code June 05, 2024 at 14:30}, title line of snapshots. */
    public static final DateTimeFormatter SNAPSHOT_TITLE = DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' HH:mm", Locale.ENGLISH);

    /** {@code 2024-06-05T14:30:12}, pipe-delimited logs. */
    public static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final DateTimeFormatter HUMAN_PARSE = lenient("MMMM d yyyy 'at' H:mm");

    private static final List<DateTimeFormatter> HUMAN_FALLBACKS = List.of(
            lenient("MMMM d, yyyy 'at' H:mm"),
            lenient("MMM d yyyy 'at' H:mm"),
            lenient("yyyy-MM-dd HH:mm"));

    private static final DateTimeFormatter DATE_PARSE = lenient("MMMM d yyyy");

    private ArchiveTimestamps() {
    }

    private static DateTimeFormatter lenient(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    public static String formatHuman(LocalDateTime value) {
        return HUMAN.format(value);
    }

    public static String formatIso(LocalDateTime value) {
        return ISO.format(value.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Parses a human timestamp, falling back to the alternative human layouts and
     * finally to ISO. Human layouts carry minute precision.
     */
    public static Optional<ArchiveTimestamp> parseHuman(String text) {
        String trimmed = text.trim();
        Optional<LocalDateTime> primary = tryParse(HUMAN_PARSE, trimmed);
        if (primary.isPresent()) {
            return primary.map(ArchiveTimestamp::ofMinute);
        }
        for (DateTimeFormatter fallback : HUMAN_FALLBACKS) {
            Optional<LocalDateTime> parsed = tryParse(fallback, trimmed);
            if (parsed.isPresent()) {
                return parsed.map(ArchiveTimestamp::ofMinute);
            }
        }
        return parseIso(trimmed);
    }

    /**
     * Parses an ISO local date-time. Fractional seconds are accepted and dropped.
     */
    public static Optional<ArchiveTimestamp> parseIso(String text) {
        return tryParse(DateTimeFormatter.ISO_LOCAL_DATE_TIME, text.trim()).map(ArchiveTimestamp::ofSecond);
    }

    /** Parses a date header such as {@code June 05 2024}. */
    public static Optional<LocalDate> parseDate(String text) {
        try {
            return Optional.of(LocalDate.parse(text.trim(), DATE_PARSE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> tryParse(DateTimeFormatter formatter, String text) {
        try {
            return Optional.of(LocalDateTime.parse(text, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
