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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Pipe-delimited logs and snapshots with a {@code Format:} header.
 * <p>
 * <b>Logs</b> are monthly and append-only:
 * <pre>
 * Authentication Requests for June 2024
 * Format: timestamp|user_id|device_info|ip_address|status|details
 *
 * 2024-06-15T14:30:12|alice|Firefox|10.0.0.1|pending|login
 * </pre>
 * <b>Snapshots</b> (sessions, invite tokens, role definitions) are rendered as a whole and replaced atomically.
 * <p>
 * Each column plays one role: occurrence time, entity id, actor, action, or a business
 * field. A column may be both entity id and actor. A '|' inside a value is written as '_'.
 * Blank lines, titles, section labels and count footers are structural and skipped;
 * any other line that does not split into the declared columns is reported as unparsed.
 */
public final class PipeDelimitedGrammar implements ArchiveGrammar {

    enum Role { OCCURRED_AT, ENTITY, ACTOR, ENTITY_AND_ACTOR, ACTION, FIELD, FLAG }

    record Column(String header, Role role, String field) {
    }

    enum Snapshot { NONE, SESSIONS, INVITE_TOKENS, ROLES }

    // ========================================================================
    // Layouts
    // ========================================================================

    public static final PipeDelimitedGrammar ROLE_ASSIGNMENTS = log(EntityType.ROLE_ASSIGNMENT, "Role Assignments")
            .occurredAt("timestamp").actor("user_id").entity("role_name").action("action")
            .field("granted_by").field("expires_at").field("details").build();

    public static final PipeDelimitedGrammar AUTH_REQUESTS = log(EntityType.AUTH_REQUEST, "Authentication Requests")
            .occurredAt("timestamp").entityAndActor("user_id").field("device_info").field("ip_address")
            .action("status").field("details").build();

    public static final PipeDelimitedGrammar AUTH_APPROVALS = log(EntityType.AUTH_APPROVAL, "Authentication Approvals")
            .occurredAt("timestamp").entity("auth_request_id").actor("approver_user_id").action("action")
            .field("details").build();

    public static final PipeDelimitedGrammar SECURITY_EVENTS = log(EntityType.SECURITY_EVENT, "Security Events")
            .occurredAt("timestamp").action("event_type").entityAndActor("user_id").field("ip_address")
            .field("user_agent").field("details").build();

    public static final PipeDelimitedGrammar NOTIFICATIONS = log(EntityType.NOTIFICATION, "Notification Events")
            .occurredAt("timestamp").actor("user_id").entity("auth_request_id").field("notification_type")
            .action("action").field("details").build();

    public static final PipeDelimitedGrammar INVITE_USAGE = log(EntityType.INVITE_USAGE, "Invite Token Usage")
            .occurredAt("timestamp").entity("token").actor("used_by_user").field("created_by_user", "created_by")
            .action("action").build();

    public static final PipeDelimitedGrammar MARKS = log(EntityType.INTERACTION_MARK, "Prayer Marks")
            .occurredAt("timestamp").entity("prayer_id").actor("user_id").constantAction("prayed").build();

    public static final PipeDelimitedGrammar ATTRIBUTES = log(EntityType.INTERACTION_ATTRIBUTE, "Prayer Attributes")
            .occurredAt("timestamp").entity("prayer_id").action("attribute_name").field("attribute_value")
            .actor("user_id").build();

    public static final PipeDelimitedGrammar SESSIONS = snapshot(EntityType.SESSION, Snapshot.SESSIONS)
            .entity("session_id").actor("user_id").occurredAt("created_at").field("expires_at")
            .field("device_info").field("ip_address").flag("is_fully_authenticated", "fully_authenticated")
            .constantAction("active").build();

    public static final PipeDelimitedGrammar INVITE_TOKENS = snapshot(EntityType.INVITE_TOKEN, Snapshot.INVITE_TOKENS)
            .entity("token").actor("created_by_user").field("expires_at").flag("used", "used")
            .field("used_by_user_id", "used_by").occurredAt("created_at")
            .constantAction("issued").build();

    // Definitions written before roles had a recorded creator carry an empty created_by
    public static final PipeDelimitedGrammar ROLES = snapshot(EntityType.ROLE, Snapshot.ROLES)
            .entity("role_name").field("description").field("permissions_json", "permissions")
            .flag("is_system_role", "is_system_role").actor("created_by").defaultActor("system")
            .occurredAt("created_at").constantAction("defined").build();

    private static final Pattern COUNT_FOOTER = Pattern.compile("^[A-Za-z ]+: \\d+$");

    private final EntityType type;
    private final String title;
    private final Snapshot snapshot;
    private final List<Column> columns;
    private final String constantAction;
    private final String defaultActor;

    private PipeDelimitedGrammar(Builder b) {
        this.type = b.type;
        this.title = b.title;
        this.snapshot = b.snapshot;
        this.columns = List.copyOf(b.columns);
        this.constantAction = b.constantAction;
        this.defaultActor = b.defaultActor;
    }

    public EntityType type() {
        return type;
    }

    /** The {@code Format:} line content. */
    public String formatLine() {
        List<String> headers = new ArrayList<>();
        for (Column c : columns) {
            headers.add(c.header());
        }
        return String.join("|", headers);
    }

    @Override
    public LineParser newParser() {
        return new Parser();
    }

    @Override
    public TimestampPrecision precision() {
        return TimestampPrecision.SECOND;
    }

    @Override
    public String header(PartitionKey key) {
        if (snapshot != Snapshot.NONE) {
            return "";
        }
        return title + " for " + ArchiveTimestamps.MONTH_TITLE.format(key.at()) + "\n"
                + "Format: " + formatLine() + "\n\n";
    }

    @Override
    public String formatAppend(CanonicalRecord record, String existingContent) {
        if (snapshot != Snapshot.NONE) {
            throw new UnsupportedOperationException(type + " archives are snapshots");
        }
        return formatRecord(record) + "\n";
    }

    @Override
    public String render(PartitionKey key, List<CanonicalRecord> records, LocalDateTime now) {
        List<String> lines = new ArrayList<>();
        switch (snapshot) {
            case SESSIONS -> {
                lines.add("Session Snapshot for " + ArchiveTimestamps.SNAPSHOT_TITLE.format(now));
                lines.add("Format: " + formatLine());
                lines.add("");
                for (CanonicalRecord r : records) {
                    lines.add(formatRecord(r));
                }
                lines.add("");
                lines.add("Total active sessions: " + records.size());
            }
            case INVITE_TOKENS -> {
                List<CanonicalRecord> active = new ArrayList<>();
                List<CanonicalRecord> inactive = new ArrayList<>();
                for (CanonicalRecord r : records) {
                    (isActiveToken(r, now) ? active : inactive).add(r);
                }
                lines.add("Active Invite Tokens - Updated " + ArchiveTimestamps.SNAPSHOT_TITLE.format(now));
                lines.add("Format: " + formatLine());
                lines.add("");
                lines.add("ACTIVE TOKENS:");
                active.forEach(r -> lines.add(formatRecord(r)));
                lines.add("");
                lines.add("RECENTLY EXPIRED TOKENS:");
                inactive.forEach(r -> lines.add(formatRecord(r)));
                lines.add("");
                lines.add("Active tokens: " + active.size());
                lines.add("Total tokens: " + records.size());
            }
            case ROLES -> {
                lines.add("Role Definitions - Updated " + ArchiveTimestamps.SNAPSHOT_TITLE.format(now));
                lines.add("Format: " + formatLine());
                lines.add("");
                for (CanonicalRecord r : records) {
                    lines.add(formatRecord(r));
                }
                lines.add("");
                lines.add("Total roles: " + records.size());
            }
            case NONE -> throw new UnsupportedOperationException(type + " archives are append-only");
        }
        return String.join("\n", lines) + "\n";
    }

    /** Unused and not yet expired. */
    static boolean isActiveToken(CanonicalRecord token, LocalDateTime now) {
        if (Boolean.parseBoolean(token.field("used"))) {
            return false;
        }
        String expires = token.field("expires_at");
        if (expires == null) {
            return true;
        }
        Optional<ArchiveTimestamp> at = ArchiveTimestamps.parseIso(expires);
        return at.isEmpty() || at.get().value().isAfter(now);
    }

    String formatRecord(CanonicalRecord record) {
        List<String> values = new ArrayList<>(columns.size());
        for (Column c : columns) {
            String value = switch (c.role()) {
                case OCCURRED_AT -> ArchiveTimestamps.formatIso(record.occurredAt());
                case ENTITY, ENTITY_AND_ACTOR -> record.entityId();
                case ACTOR -> record.actor();
                case ACTION -> record.action();
                case FIELD, FLAG -> record.field(c.field());
            };
            values.add(sanitize(value));
        }
        return String.join("|", values);
    }

    private static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('|', '_').replace('\n', ' ').replace('\r', ' ');
    }

    // ========================================================================
    // Parser
    // ========================================================================

    private final class Parser implements LineParser {

        private boolean seenTitle;

        @Override
        public void accept(int lineNumber, String line, Consumer<ArchiveEvent> out) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                return;
            }
            if (!trimmed.contains("|")) {
                if (isStructural(trimmed)) {
                    seenTitle = true;
                    return;
                }
                out.accept(new UnparsedLine(lineNumber, line, "not a record"));
                return;
            }
            if (trimmed.startsWith("Format:")) {
                seenTitle = true;
                return;
            }

            String[] parts = trimmed.split("\\|", -1);
            if (parts.length != columns.size()) {
                out.accept(new UnparsedLine(lineNumber, line,
                        "expected " + columns.size() + " columns, found " + parts.length));
                return;
            }

            ArchiveTimestamp timestamp = null;
            String entity = null;
            String actor = null;
            String action = constantAction;
            Map<String, String> fields = new HashMap<>();
            for (int i = 0; i < parts.length; i++) {
                Column c = columns.get(i);
                String value = parts[i].trim();
                switch (c.role()) {
                    case OCCURRED_AT -> {
                        Optional<ArchiveTimestamp> ts = value.isEmpty()
                                ? Optional.empty()
                                : ArchiveTimestamps.parseIso(value).or(() -> ArchiveTimestamps.parseHuman(value));
                        if (ts.isEmpty()) {
                            out.accept(new UnparsedLine(lineNumber, line, "unparseable " + c.header()));
                            return;
                        }
                        timestamp = ts.get();
                    }
                    case ENTITY -> entity = value;
                    case ACTOR -> actor = value;
                    case ENTITY_AND_ACTOR -> {
                        entity = value;
                        actor = value;
                    }
                    case ACTION -> action = value;
                    case FIELD -> fields.put(c.field(), value.isEmpty() ? null : value);
                    case FLAG -> fields.put(c.field(), value.isEmpty() ? null : value.toLowerCase(Locale.ROOT));
                }
            }
            if ((actor == null || actor.isEmpty()) && defaultActor != null) {
                actor = defaultActor;
            }
            if (entity == null || entity.isEmpty()) {
                out.accept(new UnparsedLine(lineNumber, line, "missing entity id"));
                return;
            }
            if (actor == null || actor.isEmpty() || action == null || action.isEmpty()) {
                out.accept(new UnparsedLine(lineNumber, line, "missing actor or action"));
                return;
            }
            out.accept(new ParsedEvent(type, lineNumber, timestamp, entity, actor, action, fields));
        }

        private boolean isStructural(String trimmed) {
            if (!seenTitle) {
                return true;
            }
            return trimmed.startsWith("Format:")
                    || trimmed.endsWith(":")
                    || COUNT_FOOTER.matcher(trimmed).matches();
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    private static Builder log(EntityType type, String title) {
        return new Builder(type, title, Snapshot.NONE);
    }

    private static Builder snapshot(EntityType type, Snapshot kind) {
        return new Builder(type, null, kind);
    }

    private static final class Builder {
        private final EntityType type;
        private final String title;
        private final Snapshot snapshot;
        private final List<Column> columns = new ArrayList<>();
        private String constantAction;
        private String defaultActor;

        private Builder(EntityType type, String title, Snapshot snapshot) {
            this.type = type;
            this.title = title;
            this.snapshot = snapshot;
        }

        Builder occurredAt(String header) {
            columns.add(new Column(header, Role.OCCURRED_AT, null));
            return this;
        }

        Builder entity(String header) {
            columns.add(new Column(header, Role.ENTITY, null));
            return this;
        }

        Builder actor(String header) {
            columns.add(new Column(header, Role.ACTOR, null));
            return this;
        }

        Builder entityAndActor(String header) {
            columns.add(new Column(header, Role.ENTITY_AND_ACTOR, null));
            return this;
        }

        Builder action(String header) {
            columns.add(new Column(header, Role.ACTION, null));
            return this;
        }

        Builder field(String header) {
            return field(header, header);
        }

        Builder field(String header, String field) {
            columns.add(new Column(header, Role.FIELD, field));
            return this;
        }

        Builder flag(String header, String field) {
            columns.add(new Column(header, Role.FLAG, field));
            return this;
        }

        Builder constantAction(String action) {
            this.constantAction = action;
            return this;
        }

        /** Actor used when the actor column is empty. */
        Builder defaultActor(String actor) {
            this.defaultActor = actor;
            return this;
        }

        PipeDelimitedGrammar build() {
            return new PipeDelimitedGrammar(this);
        }
    }
}
