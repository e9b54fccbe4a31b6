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
package dev.mars.textarchive.service;

import dev.mars.textarchive.ArchiveConfig;
import dev.mars.textarchive.archive.ArchiveTimestamps;
import dev.mars.textarchive.archive.ArchiveWriter;
import dev.mars.textarchive.archive.EntityType;
import dev.mars.textarchive.archive.PartitionKey;
import dev.mars.textarchive.archive.grammar.PrayerActivity;
import dev.mars.textarchive.archive.grammar.RegistrationGrammar;
import dev.mars.textarchive.store.CanonicalRecord;
import dev.mars.textarchive.store.CanonicalStore;
import dev.mars.textarchive.store.NaturalKey;
import dev.mars.textarchive.store.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * The normal write path: every mutation is archived first and only then stored, with
 * the archive path on the stored row.
 * <p>
 * <b>Ordering Guarantees:</b>
 * <ul>
 *   <li>If the archive write fails the store is not touched and the exception
 *       propagates.</li>
 *   <li>A stored row always names an archive file that already contains its record.</li>
 *   <li>Timestamps are truncated to the precision of the archive they go to, so a store
 *       rebuilt from the archive equals the one written here.</li>
 * </ul>
 * With archiving disabled in {@link ArchiveConfig} rows are stored without an archive
 * path.
 */
public final class ArchiveFirstService {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveFirstService.class);

    private static final Pattern SINGLE_WORD = Pattern.compile("\\S+");
    private static final Pattern VERB = Pattern.compile("[A-Za-z][A-Za-z_ ]*");

    /** A session as listed in the daily session snapshot. */
    public record Session(String sessionId, String userName, LocalDateTime createdAt, LocalDateTime expiresAt,
                          String deviceInfo, String ipAddress, boolean fullyAuthenticated) {
    }

    /** A role as listed in the role definitions snapshot. */
    public record Role(String name, String description, String permissionsJson, boolean systemRole,
                       String createdBy, LocalDateTime createdAt) {
    }

    /** An invite token as listed in the invite-token snapshot. */
    public record InviteToken(String token, String createdBy, LocalDateTime createdAt, LocalDateTime expiresAt,
                              boolean used, String usedBy) {
    }

    private final ArchiveConfig config;
    private final ArchiveWriter writer;
    private final CanonicalStore store;
    private final Clock clock;
    private final Supplier<String> prayerIds;

    public ArchiveFirstService(ArchiveConfig config, ArchiveWriter writer, CanonicalStore store, Clock clock) {
        this(config, writer, store, clock, () -> UUID.randomUUID().toString().replace("-", "").substring(0, 12));
    }

    public ArchiveFirstService(ArchiveConfig config, ArchiveWriter writer, CanonicalStore store, Clock clock,
                               Supplier<String> prayerIds) {
        this.config = config;
        this.writer = writer;
        this.store = store;
        this.clock = clock;
        this.prayerIds = prayerIds;
        if (!config.enabled()) {
            LOG.warn("Archiving DISABLED: rows are stored without an archive and cannot be recovered");
        }
    }

    // ========================================================================
    // Users and prayers
    // ========================================================================

    /**
     * Registers a user, directly or on invitation. A placeholder row left by recovery is
     * replaced.
     *
     * @throws IllegalStateException if the user is already registered
     */
    public CanonicalRecord registerUser(String userName, String invitedBy) {
        requireWord("user name", userName);
        LocalDateTime now = now(EntityType.USER);
        if (store.find(NaturalKey.entity(EntityType.USER, userName))
                .filter(existing -> !existing.record().isPlaceholder()).isPresent()) {
            throw new IllegalStateException("User already registered: " + userName);
        }
        boolean invited = invitedBy != null && !invitedBy.isBlank();
        Map<String, String> fields = new HashMap<>();
        fields.put("invited_by", invited ? invitedBy.trim() : null);
        fields.put(CanonicalRecord.REGISTRATION_TYPE, invited ? RegistrationGrammar.INVITE : RegistrationGrammar.DIRECT);
        CanonicalRecord user = CanonicalRecord.of(EntityType.USER, userName, RegistrationGrammar.ACTION, userName, now, fields);
        return archiveAndStore(EntityType.USER, PartitionKey.containing(now), user);
    }

    /**
     * Creates the prayer's own archive file, stores the prayer, then logs the submission
     * to the site activity feed.
     *
     * @return the stored prayer; its entity id is the new prayer id
     */
    public CanonicalRecord submitPrayer(String author, String text, String generatedPrayer,
                                        String projectTag, String targetAudience) {
        requireWord("author", author);
        Objects.requireNonNull(text, "text");
        LocalDateTime now = now(EntityType.PRAYER);
        String prayerId = prayerIds.get();
        Map<String, String> fields = new HashMap<>();
        fields.put("text", text.strip());
        fields.put("generated_prayer", blankToNull(generatedPrayer));
        fields.put("project_tag", blankToNull(oneLine(projectTag)));
        fields.put("target_audience", blankToNull(oneLine(targetAudience)));
        CanonicalRecord prayer = CanonicalRecord.of(EntityType.PRAYER, prayerId, "submitted", author, now, fields);

        String path = null;
        if (config.enabled()) {
            PartitionKey key = writer.newInstanceKey(EntityType.PRAYER, now);
            path = relative(writer.snapshot(EntityType.PRAYER, key, List.of(prayer)));
        }
        CanonicalRecord stored = prayer.withArchivePath(path);
        store.upsert(stored, false);
        LOG.info("Prayer {} submitted by {}", prayerId, author);

        String tagText = blankToNull(oneLine(projectTag));
        Map<String, String> tag = new HashMap<>();
        tag.put("detail", tagText == null ? null : tagText.replace('(', '[').replace(')', ']'));
        CanonicalRecord activity = CanonicalRecord.of(EntityType.ACTIVITY_LOG, prayerId,
                "submitted prayer " + prayerId, author, now, tag);
        archiveAndStore(EntityType.ACTIVITY_LOG, PartitionKey.containing(now), activity);
        return stored;
    }

    /**
     * Appends an activity line to the prayer's file and stores its projections: an
     * activity log row, plus a mark or attribute rows for the verbs
     * {@link PrayerActivity} knows. A prayer stored before archiving existed gets its
     * file created first.
     *
     * @return the stored rows
     * @throws IllegalArgumentException if the prayer does not exist
     */
    public List<CanonicalRecord> recordPrayerActivity(String prayerId, String actor, String verb, String detail) {
        requireWord("actor", actor);
        if (verb == null || !VERB.matcher(verb).matches()) {
            throw new IllegalArgumentException("Invalid activity verb: '" + verb + "'");
        }
        StoredRecord prayer = store.find(NaturalKey.entity(EntityType.PRAYER, prayerId))
                .orElseThrow(() -> new IllegalArgumentException("Unknown prayer: " + prayerId));

        LocalDateTime now = now(EntityType.PRAYER);
        String kept = PrayerActivity.ofVerb(verb).filter(a -> a != PrayerActivity.TESTIMONY).isPresent()
                ? null : blankToNull(oneLine(detail));
        List<PrayerActivity.Projection> projections = PrayerActivity.project(verb, kept, now.toLocalDate());

        String path = null;
        if (config.enabled()) {
            path = prayer.record().archivePath();
            if (path == null) {
                path = backfillPrayerArchive(prayer);
            }
            PrayerActivity.Projection line = projections.get(0);
            writer.append(EntityType.PRAYER, path,
                    CanonicalRecord.of(line.type(), prayerId, line.action(), actor, now, line.fields()));
        }

        List<CanonicalRecord> rows = new ArrayList<>(projections.size());
        for (PrayerActivity.Projection p : projections) {
            CanonicalRecord row = new CanonicalRecord(p.type(), prayerId, p.action(), actor, now, p.fields(), path);
            store.upsert(row, false);
            rows.add(row);
        }
        LOG.debug("{} {} prayer {}", actor, verb, prayerId);
        return rows;
    }

    private String backfillPrayerArchive(StoredRecord prayer) {
        CanonicalRecord record = prayer.record();
        PartitionKey key = writer.newInstanceKey(EntityType.PRAYER, record.occurredAt());
        String path = relative(writer.snapshot(EntityType.PRAYER, key, List.of(record)));
        store.updateArchivePath(EntityType.PRAYER, prayer.id(), path);
        LOG.info("Created archive {} for legacy prayer {}", path, record.entityId());
        return path;
    }

    // ========================================================================
    // Roles
    // ========================================================================

    /**
     * Rewrites the role definitions file with {@code roles}, the complete set, and
     * stores each role.
     *
     * @return the snapshot path relative to the archive root, or null with archiving disabled
     */
    public String snapshotRoles(List<Role> roles) {
        List<CanonicalRecord> records = new ArrayList<>(roles.size());
        for (Role r : roles) {
            requireWord("role name", r.name());
            String creator = blankToNull(r.createdBy());
            Map<String, String> fields = new HashMap<>();
            fields.put("description", blankToNull(oneLine(r.description())));
            fields.put("permissions", r.permissionsJson() == null ? "[]" : oneLine(r.permissionsJson()));
            fields.put("is_system_role", Boolean.toString(r.systemRole()));
            LocalDateTime createdAt = r.createdAt() == null ? now(EntityType.ROLE) : r.createdAt();
            records.add(CanonicalRecord.of(EntityType.ROLE, r.name(), "defined",
                    creator == null ? CanonicalRecord.SYSTEM_ACTOR : creator, createdAt, fields));
        }
        return snapshotAndStore(EntityType.ROLE, PartitionKey.single(), records);
    }

    /**
     * Archives and stores the default roles when no role has been archived yet. Default
     * roles that recovery created without an archive get their archive path here.
     *
     * @return the snapshot path, or null if roles were already archived or archiving is disabled
     */
    public String ensureDefaultRoles() {
        List<StoredRecord> existing = store.findAll(EntityType.ROLE);
        if (!existing.stream().allMatch(r -> r.record().isDefaultRole())) {
            return null;
        }
        List<Role> defaults = new ArrayList<>();
        for (CanonicalRecord r : CanonicalRecord.defaultRoles(now(EntityType.ROLE))) {
            defaults.add(new Role(r.entityId(), r.field("description"), r.field("permissions"), true,
                    null, r.occurredAt()));
        }
        LOG.info("Creating default roles {}", defaults.stream().map(Role::name).toList());
        return snapshotRoles(defaults);
    }

    /**
     * Logs a role being granted to or revoked from a user.
     *
     * @throws IllegalArgumentException if the role is not defined
     */
    public CanonicalRecord recordRoleAssignment(String userName, String roleName, String action,
                                                String grantedBy, LocalDateTime expiresAt, String details) {
        requireWord("user name", userName);
        requireWord("role name", roleName);
        requireWord("action", action);
        if (store.find(NaturalKey.entity(EntityType.ROLE, roleName)).isEmpty()) {
            throw new IllegalArgumentException("Unknown role: " + roleName);
        }
        LocalDateTime now = now(EntityType.ROLE_ASSIGNMENT);
        Map<String, String> fields = new HashMap<>();
        fields.put("granted_by", blankToNull(grantedBy));
        fields.put("expires_at", expiresAt == null ? null : ArchiveTimestamps.formatIso(expiresAt));
        fields.put("details", details);
        return archiveAndStore(EntityType.ROLE_ASSIGNMENT, PartitionKey.containing(now),
                CanonicalRecord.of(EntityType.ROLE_ASSIGNMENT, roleName, action, userName, now, fields));
    }

    // ========================================================================
    // Authentication and invites
    // ========================================================================

    public CanonicalRecord recordAuthRequest(String userName, String deviceInfo, String ipAddress,
                                             String status, String details) {
        requireWord("user name", userName);
        LocalDateTime now = now(EntityType.AUTH_REQUEST);
        Map<String, String> fields = new HashMap<>();
        fields.put("device_info", deviceInfo);
        fields.put("ip_address", ipAddress);
        fields.put("details", details);
        return archiveAndStore(EntityType.AUTH_REQUEST, PartitionKey.containing(now),
                CanonicalRecord.of(EntityType.AUTH_REQUEST, userName, status, userName, now, fields));
    }

    public CanonicalRecord recordAuthApproval(String authRequestId, String approver, String action, String details) {
        LocalDateTime now = now(EntityType.AUTH_APPROVAL);
        Map<String, String> fields = new HashMap<>();
        fields.put("details", details);
        return archiveAndStore(EntityType.AUTH_APPROVAL, PartitionKey.containing(now),
                CanonicalRecord.of(EntityType.AUTH_APPROVAL, authRequestId, action, approver, now, fields));
    }

    public CanonicalRecord recordSecurityEvent(String userName, String eventType, String ipAddress,
                                               String userAgent, String details) {
        LocalDateTime now = now(EntityType.SECURITY_EVENT);
        Map<String, String> fields = new HashMap<>();
        fields.put("ip_address", ipAddress);
        fields.put("user_agent", userAgent);
        fields.put("details", details);
        return archiveAndStore(EntityType.SECURITY_EVENT, PartitionKey.containing(now),
                CanonicalRecord.of(EntityType.SECURITY_EVENT, userName, eventType, userName, now, fields));
    }

    public CanonicalRecord recordNotification(String userName, String authRequestId, String notificationType,
                                              String action, String details) {
        LocalDateTime now = now(EntityType.NOTIFICATION);
        Map<String, String> fields = new HashMap<>();
        fields.put("notification_type", notificationType);
        fields.put("details", details);
        return archiveAndStore(EntityType.NOTIFICATION, PartitionKey.containing(now),
                CanonicalRecord.of(EntityType.NOTIFICATION, authRequestId, action, userName, now, fields));
    }

    public CanonicalRecord recordInviteUsage(String token, String usedBy, String createdBy, String action) {
        LocalDateTime now = now(EntityType.INVITE_USAGE);
        Map<String, String> fields = new HashMap<>();
        fields.put("created_by", createdBy);
        return archiveAndStore(EntityType.INVITE_USAGE, PartitionKey.containing(now),
                CanonicalRecord.of(EntityType.INVITE_USAGE, token, action, usedBy, now, fields));
    }

    /**
     * Writes today's session snapshot with {@code sessions}, replacing an earlier one
     * from the same day, and stores each session.
     *
     * @return the snapshot path relative to the archive root, or null with archiving disabled
     */
    public String snapshotSessions(List<Session> sessions) {
        List<CanonicalRecord> records = new ArrayList<>(sessions.size());
        for (Session s : sessions) {
            requireWord("user name", s.userName());
            Map<String, String> fields = new HashMap<>();
            fields.put("expires_at", s.expiresAt() == null ? null : ArchiveTimestamps.formatIso(s.expiresAt()));
            fields.put("device_info", s.deviceInfo());
            fields.put("ip_address", s.ipAddress());
            fields.put("fully_authenticated", Boolean.toString(s.fullyAuthenticated()));
            records.add(CanonicalRecord.of(EntityType.SESSION, s.sessionId(), "active", s.userName(),
                    s.createdAt(), fields));
        }
        return snapshotAndStore(EntityType.SESSION, PartitionKey.day(LocalDate.now(clock)), records);
    }

    /**
     * Rewrites the invite-token file with {@code tokens} and stores each token.
     *
     * @return the snapshot path relative to the archive root, or null with archiving disabled
     */
    public String snapshotInviteTokens(List<InviteToken> tokens) {
        List<CanonicalRecord> records = new ArrayList<>(tokens.size());
        for (InviteToken t : tokens) {
            requireWord("creator", t.createdBy());
            Map<String, String> fields = new HashMap<>();
            fields.put("expires_at", t.expiresAt() == null ? null : ArchiveTimestamps.formatIso(t.expiresAt()));
            fields.put("used", Boolean.toString(t.used()));
            fields.put("used_by", blankToNull(t.usedBy()));
            records.add(CanonicalRecord.of(EntityType.INVITE_TOKEN, t.token(), "issued", t.createdBy(),
                    t.createdAt(), fields));
        }
        return snapshotAndStore(EntityType.INVITE_TOKEN, PartitionKey.single(), records);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private CanonicalRecord archiveAndStore(EntityType fileType, PartitionKey key, CanonicalRecord record) {
        CanonicalRecord stored = config.enabled()
                ? record.withArchivePath(relative(writer.append(fileType, key, record)))
                : record;
        store.upsert(stored, false);
        LOG.debug("Stored {} {} ({})", stored.type(), stored.naturalKey(), stored.archivePath());
        return stored;
    }

    private String snapshotAndStore(EntityType type, PartitionKey key, List<CanonicalRecord> records) {
        String path = config.enabled() ? relative(writer.snapshot(type, key, records)) : null;
        for (CanonicalRecord record : records) {
            store.upsert(record.withArchivePath(path), true);
        }
        LOG.info("Stored {} {} rows from snapshot {}", records.size(), type, path);
        return path;
    }

    private LocalDateTime now(EntityType fileType) {
        return fileType.grammar().precision().truncate(LocalDateTime.now(clock));
    }

    private String relative(Path path) {
        return writer.layout().relativize(path);
    }

    private static void requireWord(String what, String value) {
        if (value == null || !SINGLE_WORD.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + value + "' (must be one word)");
        }
    }

    private static String oneLine(String value) {
        return value == null ? null : value.replace('\r', ' ').replace('\n', ' ').strip();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
