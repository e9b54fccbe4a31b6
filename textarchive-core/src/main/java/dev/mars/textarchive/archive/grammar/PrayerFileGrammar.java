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

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One file per prayer: a header block, the request text, an optional generated
 * prayer and an append-only activity section.
 *
 * <pre>
 * Prayer 42 by alice
 * Submitted June 15 2024 at 14:30
 * Project: healing
 * Audience: everyone
 *
 * Please pray for my family.
 *
 * Generated Prayer:
 * Lord, we lift up ...
 *
 * Activity:
 * June 15 2024 at 14:35 - bob prayed this prayer
 * June 20 2024 at 09:02 - alice added testimony: all is well
 * </pre>
 *
 * Parsing yields one {@code PRAYER} event, then for each activity line the rows given by
 * {@link PrayerActivity#project}, all on that line's number.
 */
public final class PrayerFileGrammar implements ArchiveGrammar {

    public static final PrayerFileGrammar INSTANCE = new PrayerFileGrammar();

    static final String ACTIVITY_HEADER = "Activity:";
    static final String GENERATED_HEADER = "Generated Prayer:";

    private static final Pattern TITLE = Pattern.compile("^Prayer (\\S+) by (.+)$");
    private static final Pattern ACTIVITY = Pattern.compile("^(.+?) - (\\S+) (.+)$");
    // A free-text line that would read as a section marker, with any escapes already applied.
    private static final Pattern MARKER_LIKE = Pattern.compile("^\\s*\\\\*(Activity:|Generated Prayer:)\\s*$");

    private PrayerFileGrammar() {
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
        return "";
    }

    @Override
    public boolean appendCreatesFile() {
        return false;
    }

    /**
     * Formats one activity line. The record's action is the verb, its {@code detail}
     * field the optional detail.
     */
    @Override
    public String formatAppend(CanonicalRecord record, String existingContent) {
        if (record.actor().isBlank() || record.actor().chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Activity actor must be a single word: '" + record.actor() + "'");
        }
        return ArchiveTimestamps.formatHuman(record.occurredAt())
                + " - " + record.actor()
                + " " + PrayerActivity.phrase(record.action(), singleLine(record.field("detail")))
                + "\n";
    }

    @Override
    public String render(PartitionKey key, List<CanonicalRecord> records, LocalDateTime now) {
        if (records.size() != 1 || records.get(0).type() != EntityType.PRAYER) {
            throw new IllegalArgumentException("A prayer file holds exactly one prayer");
        }
        CanonicalRecord prayer = records.get(0);
        StringBuilder sb = new StringBuilder();
        sb.append("Prayer ").append(prayer.entityId()).append(" by ").append(prayer.actor()).append('\n');
        sb.append("Submitted ").append(ArchiveTimestamps.formatHuman(prayer.occurredAt())).append('\n');
        if (prayer.field("project_tag") != null) {
            sb.append("Project: ").append(singleLine(prayer.field("project_tag"))).append('\n');
        }
        if (prayer.field("target_audience") != null) {
            sb.append("Audience: ").append(singleLine(prayer.field("target_audience"))).append('\n');
        }
        sb.append('\n');
        sb.append(escapeMarkers(prayer.fields().getOrDefault("text", ""))).append('\n');
        sb.append('\n');
        if (prayer.field("generated_prayer") != null) {
            sb.append(GENERATED_HEADER).append('\n');
            sb.append(escapeMarkers(prayer.field("generated_prayer"))).append('\n');
            sb.append('\n');
        }
        sb.append(ACTIVITY_HEADER).append('\n');
        return sb.toString();
    }

    /**
     * Prefixes a backslash to each line that reads as a section marker, so free text
     * cannot end the body early. {@link #unescapeMarker} strips exactly one.
     */
    static String escapeMarkers(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (MARKER_LIKE.matcher(lines[i]).matches()) {
                int indent = lines[i].length() - lines[i].stripLeading().length();
                lines[i] = lines[i].substring(0, indent) + "\\" + lines[i].substring(indent);
            }
        }
        return String.join("\n", lines);
    }

    static String unescapeMarker(String line) {
        String stripped = line.stripLeading();
        if (stripped.startsWith("\\") && MARKER_LIKE.matcher(line).matches()) {
            return line.substring(0, line.length() - stripped.length()) + stripped.substring(1);
        }
        return line;
    }

    private static String singleLine(String value) {
        return value == null ? null : value.replace('\r', ' ').replace('\n', ' ');
    }

    // ========================================================================
    // Parser
    // ========================================================================

    private enum Section { HEADER, BODY, GENERATED, ACTIVITY }

    private static final class Parser implements LineParser {

        private Section section = Section.HEADER;
        private String prayerId;
        private String author;
        private ArchiveTimestamp submitted;
        private final Map<String, String> fields = new HashMap<>();
        private final List<String> body = new ArrayList<>();
        private final List<String> generated = new ArrayList<>();
        private boolean emitted;
        private int headerLine = 1;

        @Override
        public void accept(int lineNumber, String line, Consumer<ArchiveEvent> out) {
            if (section != Section.ACTIVITY && line.trim().equals(ACTIVITY_HEADER)) {
                emitPrayer(out);
                section = Section.ACTIVITY;
                return;
            }
            switch (section) {
                case HEADER -> header(lineNumber, line, out);
                case BODY -> {
                    if (line.trim().equals(GENERATED_HEADER)) {
                        section = Section.GENERATED;
                    } else {
                        body.add(unescapeMarker(line));
                    }
                }
                case GENERATED -> generated.add(unescapeMarker(line));
                case ACTIVITY -> activity(lineNumber, line, out);
            }
        }

        @Override
        public void finish(Consumer<ArchiveEvent> out) {
            emitPrayer(out);
        }

        private void header(int lineNumber, String line, Consumer<ArchiveEvent> out) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                if (prayerId != null) {
                    section = Section.BODY;
                }
                return;
            }
            Matcher title = TITLE.matcher(trimmed);
            if (prayerId == null && title.matches()) {
                prayerId = title.group(1);
                author = title.group(2).trim();
                headerLine = lineNumber;
            } else if (trimmed.startsWith("Submitted ")) {
                Optional<ArchiveTimestamp> ts = ArchiveTimestamps.parseHuman(trimmed.substring("Submitted ".length()));
                if (ts.isPresent()) {
                    submitted = ts.get();
                } else {
                    out.accept(new UnparsedLine(lineNumber, line, "unparseable submission time"));
                }
            } else if (trimmed.startsWith("Project: ")) {
                fields.put("project_tag", trimmed.substring("Project: ".length()));
            } else if (trimmed.startsWith("Audience: ")) {
                fields.put("target_audience", trimmed.substring("Audience: ".length()));
            } else {
                out.accept(new UnparsedLine(lineNumber, line, "unexpected prayer header line"));
            }
        }

        private void activity(int lineNumber, String line, Consumer<ArchiveEvent> out) {
            if (line.isBlank()) {
                return;
            }
            if (prayerId == null) {
                out.accept(new UnparsedLine(lineNumber, line, "activity without a prayer header"));
                return;
            }
            Matcher m = ACTIVITY.matcher(line.trim());
            if (!m.matches()) {
                out.accept(new UnparsedLine(lineNumber, line, "not an activity line"));
                return;
            }
            Optional<ArchiveTimestamp> ts = ArchiveTimestamps.parseHuman(m.group(1));
            if (ts.isEmpty()) {
                out.accept(new UnparsedLine(lineNumber, line, "unparseable timestamp"));
                return;
            }
            String[] verbAndDetail = PrayerActivity.parsePhrase(m.group(3).trim());
            for (PrayerActivity.Projection p : PrayerActivity.project(
                    verbAndDetail[0], verbAndDetail[1], ts.get().value().toLocalDate())) {
                out.accept(new ParsedEvent(p.type(), lineNumber, ts.get(), prayerId, m.group(2), p.action(), p.fields()));
            }
        }

        private void emitPrayer(Consumer<ArchiveEvent> out) {
            if (emitted) {
                return;
            }
            emitted = true;
            if (prayerId == null) {
                out.accept(new UnparsedLine(headerLine, "", "missing 'Prayer <id> by <author>' header"));
                return;
            }
            if (submitted == null) {
                out.accept(new UnparsedLine(headerLine, "Prayer " + prayerId, "missing submission time"));
                return;
            }
            Map<String, String> all = new HashMap<>(fields);
            all.put("text", joinTrimmed(body));
            String gen = joinTrimmed(generated);
            if (!gen.isEmpty()) {
                all.put("generated_prayer", gen);
            }
            out.accept(new ParsedEvent(EntityType.PRAYER, headerLine, submitted, prayerId, author, "submitted", all));
        }

        private static String joinTrimmed(List<String> lines) {
            int from = 0;
            int to = lines.size();
            while (from < to && lines.get(from).isBlank()) {
                from++;
            }
            while (to > from && lines.get(to - 1).isBlank()) {
                to--;
            }
            return String.join("\n", lines.subList(from, to));
        }
    }
}
