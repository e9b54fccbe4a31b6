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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Monthly user registration log.
 *
 * <pre>
 * User Registrations for June 2024
 *
 * June 15 2024 at 14:30 - alice joined directly
 * June 16 2024 at 09:12 - bob joined on invitation from alice
 * </pre>
 */
public final class RegistrationGrammar implements ArchiveGrammar {

    public static final RegistrationGrammar INSTANCE = new RegistrationGrammar();

    public static final String ACTION = "registered";
    public static final String DIRECT = "direct";
    public static final String INVITE = "invite";

    private static final String TITLE_PREFIX = "User Registrations for ";
    private static final Pattern LINE = Pattern.compile("^(.+?) - (.+) joined (?:directly|on invitation from (.+))$");

    private RegistrationGrammar() {
    }

    @Override
    public LineParser newParser() {
        return (lineNumber, line, out) -> parseLine(lineNumber, line, out);
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
    public String formatAppend(CanonicalRecord record, String existingContent) {
        String invitedBy = record.field("invited_by");
        String how = invitedBy == null || invitedBy.isBlank()
                ? "joined directly"
                : "joined on invitation from " + invitedBy.trim();
        return ArchiveTimestamps.formatHuman(record.occurredAt()) + " - " + record.entityId() + " " + how + "\n";
    }

    private static void parseLine(int lineNumber, String line, Consumer<ArchiveEvent> out) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith(TITLE_PREFIX)) {
            return;
        }
        Matcher m = LINE.matcher(trimmed);
        if (!m.matches()) {
            out.accept(new UnparsedLine(lineNumber, line, "not a registration line"));
            return;
        }
        Optional<ArchiveTimestamp> ts = ArchiveTimestamps.parseHuman(m.group(1));
        if (ts.isEmpty()) {
            out.accept(new UnparsedLine(lineNumber, line, "unparseable timestamp"));
            return;
        }
        String name = m.group(2).trim();
        Map<String, String> fields = new HashMap<>();
        if (m.group(3) != null) {
            fields.put("invited_by", m.group(3).trim());
            fields.put(CanonicalRecord.REGISTRATION_TYPE, INVITE);
        } else {
            fields.put(CanonicalRecord.REGISTRATION_TYPE, DIRECT);
        }
        out.accept(new ParsedEvent(EntityType.USER, lineNumber, ts.get(), name, name, ACTION, fields));
    }
}
