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

import dev.mars.textarchive.archive.grammar.ArchiveGrammar;
import dev.mars.textarchive.archive.grammar.PipeDelimitedGrammar;
import dev.mars.textarchive.archive.grammar.PrayerFileGrammar;
import dev.mars.textarchive.archive.grammar.RegistrationGrammar;
import dev.mars.textarchive.archive.grammar.SiteActivityGrammar;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Every kind of entity that is archived and recovered.
 * <p>
 * Each constant carries everything the writer, reader, recovery and validation
 * need to handle it:
 * <ul>
 *   <li><b>Layout:</b> a path template relative to the archive root. Tokens
 *       {@code {yyyy} {MM} {dd} {HHmm} {seq}} are filled from a {@link PartitionKey};
 *       the same template, turned into a regex, finds existing partitions.</li>
 *   <li><b>Grammar:</b> how lines are written and parsed.</li>
 *   <li><b>Store projection:</b> table, business columns and whether rows are keyed
 *       by entity id alone or by the full natural key.</li>
 *   <li><b>Dependencies:</b> which types must be recovered first.</li>
 * </ul>
 */
public enum EntityType {

    USER("users/{yyyy}_{MM}_users.txt", Partitioning.MONTHLY,
            "users", true, false, List.of("invited_by", "registration_type")),

    ROLE("roles/role_definitions.txt", Partitioning.SINGLE,
            "roles", true, false, List.of("description", "permissions", "is_system_role")),

    ROLE_ASSIGNMENT("roles/{yyyy}_{MM}_role_assignments.txt", Partitioning.MONTHLY,
            "role_assignments", false, true, List.of("granted_by", "expires_at", "details")),

    PRAYER("prayers/{yyyy}/{MM}/{yyyy}_{MM}_{dd}_prayer_at_{HHmm}{seq}.txt", Partitioning.PER_INSTANCE,
            "prayers", true, true, List.of("text", "generated_prayer", "project_tag", "target_audience")),

    INTERACTION_MARK("prayers/marks/{yyyy}_{MM}_marks.txt", Partitioning.MONTHLY,
            "interaction_marks", false, true, List.of()),

    INTERACTION_ATTRIBUTE("prayers/attributes/{yyyy}_{MM}_attributes.txt", Partitioning.MONTHLY,
            "interaction_attributes", false, true, List.of("attribute_value")),

    ACTIVITY_LOG("activity/activity_{yyyy}_{MM}.txt", Partitioning.MONTHLY,
            "activity_log", false, false, List.of("detail")),

    AUTH_REQUEST("auth/{yyyy}_{MM}_auth_requests.txt", Partitioning.MONTHLY,
            "auth_requests", false, true, List.of("device_info", "ip_address", "details")),

    AUTH_APPROVAL("auth/{yyyy}_{MM}_auth_approvals.txt", Partitioning.MONTHLY,
            "auth_approvals", false, false, List.of("details")),

    SESSION("auth/{yyyy}_{MM}_{dd}_sessions_snapshot.txt", Partitioning.DAILY,
            "sessions", true, true, List.of("expires_at", "device_info", "ip_address", "fully_authenticated")),

    INVITE_TOKEN("system/invite_tokens.txt", Partitioning.SINGLE,
            "invite_tokens", true, true, List.of("expires_at", "used", "used_by")),

    INVITE_USAGE("system/{yyyy}_{MM}_invite_usage.txt", Partitioning.MONTHLY,
            "invite_usage", false, false, List.of("created_by")),

    SECURITY_EVENT("auth/{yyyy}_{MM}_security_events.txt", Partitioning.MONTHLY,
            "security_events", false, false, List.of("ip_address", "user_agent", "details")),

    NOTIFICATION("auth/notifications/{yyyy}_{MM}_notifications.txt", Partitioning.MONTHLY,
            "notifications", false, false, List.of("notification_type", "details"));

    private final String pathTemplate;
    private final Partitioning partitioning;
    private final String table;
    private final boolean entityKeyed;
    private final boolean actorIsUser;
    private final List<String> columns;
    private final Pattern pathPattern;

    EntityType(String pathTemplate, Partitioning partitioning, String table,
               boolean entityKeyed, boolean actorIsUser, List<String> columns) {
        this.pathTemplate = pathTemplate;
        this.partitioning = partitioning;
        this.table = table;
        this.entityKeyed = entityKeyed;
        this.actorIsUser = actorIsUser;
        this.columns = columns;
        this.pathPattern = Pattern.compile(toRegex(pathTemplate));
    }

    public Partitioning partitioning() {
        return partitioning;
    }

    /** Relational table holding this type's canonical rows. */
    public String table() {
        return table;
    }

    /** Business columns beyond the common ones, in table order. */
    public List<String> columns() {
        return columns;
    }

    /**
     * True when a row is identified by entity id alone (users, prayers, sessions,
     * invite tokens). Event types are identified by the full natural key.
     */
    public boolean entityKeyed() {
        return entityKeyed;
    }

    /** True when the actor column is a foreign key to {@code users}. */
    public boolean actorReferencesUser() {
        return actorIsUser;
    }

    /** Only users may be created as placeholders for forward references. */
    public boolean supportsPlaceholders() {
        return this == USER;
    }

    /** The archive directory scanned for this type's partitions. */
    public String baseDirectory() {
        int firstToken = pathTemplate.indexOf('{');
        String fixed = firstToken < 0 ? pathTemplate : pathTemplate.substring(0, firstToken);
        int slash = fixed.lastIndexOf('/');
        return slash < 0 ? "" : fixed.substring(0, slash);
    }

    /**
     * Relative path (forward slashes) of the partition named by {@code key}.
     */
    public String relativePath(PartitionKey key) {
        LocalDateTime at = key.at();
        if (at == null && partitioning != Partitioning.SINGLE) {
            throw new IllegalArgumentException(this + " needs a dated partition key");
        }
        Matcher m = Tokens.PATTERN.matcher(pathTemplate);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = switch (m.group(1)) {
                case "yyyy" -> String.format("%04d", at.getYear());
                case "MM" -> String.format("%02d", at.getMonthValue());
                case "dd" -> String.format("%02d", at.getDayOfMonth());
                case "HHmm" -> String.format("%02d%02d", at.getHour(), at.getMinute());
                case "seq" -> key.sequence() > 1 ? "_" + key.sequence() : "";
                default -> throw new IllegalStateException(m.group(1));
            };
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Whether a relative path (forward slashes) names one of this type's partitions. */
    public boolean isPartition(String relativePath) {
        return pathPattern.matcher(relativePath).matches();
    }

    /**
     * Types whose rows must exist before this type's rows are recovered.
     */
    public Set<EntityType> dependencies() {
        return switch (this) {
            case USER, ROLE -> EnumSet.noneOf(EntityType.class);
            case ROLE_ASSIGNMENT -> EnumSet.of(USER, ROLE);
            case PRAYER, INVITE_TOKEN, AUTH_REQUEST, SESSION, SECURITY_EVENT -> EnumSet.of(USER);
            case INVITE_USAGE -> EnumSet.of(USER, INVITE_TOKEN);
            case INTERACTION_MARK, INTERACTION_ATTRIBUTE, ACTIVITY_LOG -> EnumSet.of(PRAYER);
            case AUTH_APPROVAL, NOTIFICATION -> EnumSet.of(AUTH_REQUEST);
        };
    }

    /** The grammar reading and writing this type's files. */
    public ArchiveGrammar grammar() {
        return switch (this) {
            case USER -> RegistrationGrammar.INSTANCE;
            case ROLE -> PipeDelimitedGrammar.ROLES;
            case ROLE_ASSIGNMENT -> PipeDelimitedGrammar.ROLE_ASSIGNMENTS;
            case PRAYER -> PrayerFileGrammar.INSTANCE;
            case ACTIVITY_LOG -> SiteActivityGrammar.INSTANCE;
            case INTERACTION_MARK -> PipeDelimitedGrammar.MARKS;
            case INTERACTION_ATTRIBUTE -> PipeDelimitedGrammar.ATTRIBUTES;
            case AUTH_REQUEST -> PipeDelimitedGrammar.AUTH_REQUESTS;
            case AUTH_APPROVAL -> PipeDelimitedGrammar.AUTH_APPROVALS;
            case SESSION -> PipeDelimitedGrammar.SESSIONS;
            case INVITE_TOKEN -> PipeDelimitedGrammar.INVITE_TOKENS;
            case INVITE_USAGE -> PipeDelimitedGrammar.INVITE_USAGE;
            case SECURITY_EVENT -> PipeDelimitedGrammar.SECURITY_EVENTS;
            case NOTIFICATION -> PipeDelimitedGrammar.NOTIFICATIONS;
        };
    }

    private static String toRegex(String template) {
        Matcher m = Tokens.PATTERN.matcher(template);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            sb.append(Pattern.quote(template.substring(last, m.start())));
            sb.append(switch (m.group(1)) {
                case "yyyy", "HHmm" -> "\\d{4}";
                case "MM", "dd" -> "\\d{2}";
                case "seq" -> "(?:_\\d+)?";
                default -> throw new IllegalStateException(m.group(1));
            });
            last = m.end();
        }
        sb.append(Pattern.quote(template.substring(last)));
        return sb.toString();
    }

    // Enum constants initialize before other static fields, so the pattern lives in a holder.
    private static final class Tokens {
        static final Pattern PATTERN = Pattern.compile("\\{(yyyy|MM|dd|HHmm|seq)}");
    }
}
