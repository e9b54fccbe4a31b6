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
package dev.mars.textarchive.archive.grammar;

import dev.mars.textarchive.archive.ArchiveEvent;
import dev.mars.textarchive.archive.ArchiveTimestamp;
import dev.mars.textarchive.archive.ArchiveTimestamps;
import dev.mars.textarchive.archive.EntityType;
import dev.mars.textarchive.archive.ParsedEvent;
import dev.mars.textarchive.archive.PartitionKey;
import dev.mars.textarchive.archive.TimestampPrecision;
import dev.mars.textarchive.archive.UnparsedLine;
import dev.mars.textarchive.store.CanonicalRecord;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Monthly site-wide activity feed. Entries carry only a time of day; the date comes
 * from the most recent date header.
 *
 * <pre>
 * Activity for June 2024
 *
 *
 * June 15 2024
 * 14:30 - alice submitted prayer 42 (healing)
 * 14:35 - bob prayed for prayer 42
 * </pre>
 */
public final class SiteActivityGrammar implements ArchiveGrammar {

    public static final SiteActivityGrammar INSTANCE = new SiteActivityGrammar();

    /** Entity id of activity that concerns no particular prayer. */
    public static final String SITE = "site";

    private static final String TITLE_PREFIX = "Activity for ";
    private static final Pattern ENTRY = Pattern.compile("^(\\d{1,2}:\\d{2}) - (\\S+) (.+?)(?: \\(([^()]*)\\))?$");
    private static final Pattern PRAYER_REF = Pattern.compile("\\bprayer (\\w+)");

    private SiteActivityGrammar() {
    }

    @Override
    public LineParser newParser() {
        return new Parser();
    }

    @Override
    public TimestampPrecision precision() {
        return TimestampPrecision.MINUTE;
    }

    @Override
    public String header(PartitionKey key) {
        return TITLE_PREFIX + ArchiveTimestamps.MONTH_TITLE.format(key.at()) + "\n\n";
    }

    @Override
    public boolean readsExistingContent() {
        return true;
    }

    /**
     * Adds a date header before the entry unless the file already has one for that day.
     */
    @Override
    public String formatAppend(CanonicalRecord record, String existingContent) {
        String date = ArchiveTimestamps.HUMAN_DATE.format(record.occurredAt());
        boolean hasHeader = existingContent.contains("\n" + date + "\n") || existingContent.endsWith(date + "\n");
        StringBuilder sb = new StringBuilder();
        if (!hasHeader) {
            sb.append('\n').append(date).append('\n');
        }
        sb.append(String.format("%02d:%02d", record.occurredAt().getHour(), record.occurredAt().getMinute()))
                .append(" - ").append(record.actor())
                .append(' ').append(record.action().replace('\n', ' '));
        String tag = record.field("detail");
        if (tag != null && !tag.isBlank()) {
            sb.append(" (").append(tag.replace('(', '[').replace(')', ']')).append(')');
        }
        return sb.append('\n').toString();
    }

    /** Entity id for an activity text: the referenced prayer, or {@link #SITE}. */
    public static String entityFor(String action) {
        Matcher m = PRAYER_REF.matcher(action);
        return m.find() ? m.group(1) : SITE;
    }

    private static final class Parser implements LineParser {

        private LocalDate currentDate;

        @Override
        public void accept(int lineNumber, String line, Consumer<ArchiveEvent> out) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(TITLE_PREFIX)) {
                return;
            }
            Optional<LocalDate> date = ArchiveTimestamps.parseDate(trimmed);
            if (date.isPresent()) {
                currentDate = date.get();
                return;
            }
            Matcher m = ENTRY.matcher(trimmed);
            if (!m.matches()) {
                out.accept(new UnparsedLine(lineNumber, line, "not an activity entry"));
                return;
            }
            if (currentDate == null) {
                out.accept(new UnparsedLine(lineNumber, line, "entry before any date header"));
                return;
            }
            LocalTime time;
            try {
                time = LocalTime.parse(m.group(1).length() == 4 ? "0" + m.group(1) : m.group(1));
            } catch (DateTimeParseException e) {
                out.accept(new UnparsedLine(lineNumber, line, "unparseable time"));
                return;
            }
            String action = m.group(3);
            Map<String, String> fields = new HashMap<>();
            fields.put("detail", m.group(4));
            out.accept(new ParsedEvent(EntityType.ACTIVITY_LOG, lineNumber,
                    ArchiveTimestamp.ofMinute(currentDate.atTime(time)),
                    entityFor(action), m.group(2), action, fields));
        }
    }
}
