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
import dev.mars.textarchive.ArchiveException;
import dev.mars.textarchive.MutableClock;
import dev.mars.textarchive.TestDatabase;
import dev.mars.textarchive.archive.ArchiveEvent;
import dev.mars.textarchive.archive.ArchiveReader;
import dev.mars.textarchive.archive.ArchiveWriter;
import dev.mars.textarchive.archive.EntityType;
import dev.mars.textarchive.archive.ParsedEvent;
import dev.mars.textarchive.archive.UnparsedLine;
import dev.mars.textarchive.store.CanonicalRecord;
import dev.mars.textarchive.store.JdbcCanonicalStore;
import dev.mars.textarchive.store.NaturalKey;
import dev.mars.textarchive.store.StoredRecord;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ArchiveFirstService: archive first, then store.
 */
class ArchiveFirstServiceTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 6, 15, 14, 30, 12);

    @TempDir
    Path tempDir;

    private Path archiveDir;
    private MutableClock clock;
    private JdbcCanonicalStore store;

    @BeforeEach
    void setUp() {
        archiveDir = tempDir.resolve("archive");
        clock = new MutableClock(START);
        store = new JdbcCanonicalStore(TestDatabase.migrated(config(true)));
    }

    private ArchiveConfig config(boolean enabled) {
        return ArchiveConfig.builder().archiveDir(archiveDir).enabled(enabled).syncEnabled(false).build();
    }

    private ArchiveFirstService service(boolean enabled) {
        ArchiveConfig config = config(enabled);
        return new ArchiveFirstService(config, new ArchiveWriter(config, clock), store, clock, () -> "p1");
    }

    private String read(String relativePath) throws Exception {
        return Files.readString(archiveDir.resolve(relativePath));
    }

    // ========================================================================
    // Users
    // ========================================================================

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Registration is archived then stored with its path")
        void testRegister() throws Exception {
            CanonicalRecord alice = service(true).registerUser("alice", null);

            assertEquals("users/2024_06_users.txt", alice.archivePath());
            assertEquals(LocalDateTime.of(2024, 6, 15, 14, 30), alice.occurredAt());
            assertTrue(read(alice.archivePath()).contains("alice joined directly"));
            assertEquals(alice.archivePath(),
                    store.find(NaturalKey.entity(EntityType.USER, "alice")).orElseThrow().record().archivePath());
        }

        @Test
        @DisplayName("Invitation is recorded in the archive line and the row")
        void testInvited() throws Exception {
            ArchiveFirstService service = service(true);
            service.registerUser("alice", null);
            CanonicalRecord bob = service.registerUser("bob", "alice");

            assertEquals("invite", bob.field(CanonicalRecord.REGISTRATION_TYPE));
            assertTrue(read(bob.archivePath()).contains("bob joined on invitation from alice"));
        }

        @Test
        @DisplayName("Duplicate or multi-word names are refused")
        void testRefused() {
            ArchiveFirstService service = service(true);
            service.registerUser("alice", null);

            assertThrows(IllegalStateException.class, () -> service.registerUser("alice", null));
            assertThrows(IllegalArgumentException.class, () -> service.registerUser("two words", null));
            assertEquals(1, store.count(EntityType.USER));
        }

        @Test
        @DisplayName("Archive failure leaves the store untouched")
        void testArchiveFailure() throws Exception {
            Files.createDirectories(archiveDir);
            Files.writeString(archiveDir.resolve("users"), "not a directory");

            assertThrows(ArchiveException.class, () -> service(true).registerUser("alice", null));
            assertEquals(0, store.count(EntityType.USER));
        }

        @Test
        @DisplayName("With archiving disabled rows are stored without a path")
        void testDisabled() {
            CanonicalRecord alice = service(false).registerUser("alice", null);

            assertNull(alice.archivePath());
            assertEquals(1, store.count(EntityType.USER));
            assertFalse(Files.exists(archiveDir.resolve("users")));
        }
    }

    // ========================================================================
    // Prayers
    // ========================================================================

    @Nested
    @DisplayName("Prayers")
    class Prayers {

        @Test
        @DisplayName("Submission creates the prayer file and a site activity entry")
        void testSubmit() throws Exception {
            ArchiveFirstService service = service(true);
            service.registerUser("alice", null);

            CanonicalRecord prayer = service.submitPrayer("alice", "For rain.", null, "Harvest (2024)", " ");

            assertEquals("p1", prayer.entityId());
            assertTrue(prayer.archivePath().startsWith("prayers/2024/06/"));
            assertTrue(read(prayer.archivePath()).contains("For rain."));
            assertNull(prayer.field("target_audience"));
            StoredRecord log = store.findAll(EntityType.ACTIVITY_LOG).get(0);
            assertEquals("submitted prayer p1", log.record().action());
            assertEquals("Harvest [2024]", log.record().field("detail"));
            assertEquals("activity/activity_2024_06.txt", log.record().archivePath());
            assertTrue(read(log.record().archivePath()).contains("alice submitted prayer p1"));
        }

        @Test
        @DisplayName("Request text with section-marker lines reads back unchanged")
        void testMarkerLikeText() {
            ArchiveFirstService service = service(true);
            service.registerUser("alice", null);
            String text = "My list:\nActivity:\nwalk daily";

            CanonicalRecord prayer = service.submitPrayer("alice", text, null, null, null);
            service.recordPrayerActivity("p1", "alice", "prayed", null);

            ArchiveReader reader = new ArchiveReader(config(true));
            List<ArchiveEvent> events = reader.parse(EntityType.PRAYER, archiveDir.resolve(prayer.archivePath())).toList();
            assertTrue(events.stream().noneMatch(e -> e instanceof UnparsedLine), events::toString);
            ParsedEvent parsed = (ParsedEvent) events.get(0);
            assertEquals(EntityType.PRAYER, parsed.type());
            assertEquals(text, parsed.fields().get("text"));
            assertTrue(events.stream().anyMatch(e -> e instanceof ParsedEvent p && p.type() == EntityType.INTERACTION_MARK));
        }

        @Test
        @DisplayName("Activities are appended to the prayer file and projected")
        void testActivity() throws Exception {
            ArchiveFirstService service = service(true);
            service.registerUser("alice", null);
            service.registerUser("bob", null);
            String path = service.submitPrayer("alice", "For rain.", null, null, null).archivePath();
            clock.advance(Duration.ofMinutes(1));

            List<CanonicalRecord> prayed = service.recordPrayerActivity("p1", "bob", "prayed", "ignored");
            List<CanonicalRecord> answered = service.recordPrayerActivity("p1", "alice", "answered", null);

            assertEquals(List.of(EntityType.ACTIVITY_LOG, EntityType.INTERACTION_MARK),
                    prayed.stream().map(CanonicalRecord::type).toList());
            assertNull(prayed.get(0).field("detail"));
            assertEquals(3, answered.size());
            assertEquals("2024-06-15", answered.get(2).field("attribute_value"));
            String content = read(path);
            assertTrue(content.contains("bob prayed this prayer"));
            assertTrue(content.contains("alice marked this prayer as answered"));
            assertEquals(1, store.count(EntityType.INTERACTION_MARK));
            assertEquals(2, store.count(EntityType.INTERACTION_ATTRIBUTE));
            assertTrue(store.findAll(EntityType.INTERACTION_MARK).stream()
                    .allMatch(r -> path.equals(r.record().archivePath())));
        }

        @Test
        @DisplayName("Prayer stored before archiving gets its file on first activity")
        void testLegacyPrayerBackfill() throws Exception {
            ArchiveFirstService service = service(true);
            service.registerUser("alice", null);
            store.upsert(CanonicalRecord.of(EntityType.PRAYER, "legacy1", "submitted", "alice",
                    START.minusDays(30), Map.of("text", "Old prayer")), false);

            service.recordPrayerActivity("legacy1", "alice", "testimony", "Answered at last");

            String path = store.find(NaturalKey.entity(EntityType.PRAYER, "legacy1")).orElseThrow()
                    .record().archivePath();
            assertNotNull(path);
            assertTrue(path.startsWith("prayers/2024/05/"));
            String content = read(path);
            assertTrue(content.contains("Old prayer"));
            assertTrue(content.contains("added testimony: Answered at last"));
        }

        @Test
        @DisplayName("Unknown prayer or invalid verb is refused")
        void testRefused() {
            ArchiveFirstService service = service(true);
            service.registerUser("alice", null);

            assertThrows(IllegalArgumentException.class,
                    () -> service.recordPrayerActivity("nope", "alice", "prayed", null));
            assertThrows(IllegalArgumentException.class,
                    () -> service.recordPrayerActivity("nope", "alice", "1337", null));
        }
    }

    // ========================================================================
    // Snapshots
    // ========================================================================

    @Test
    @DisplayName("Session snapshot replaces the day's file and keeps earlier rows")
    void testSessionSnapshots() throws Exception {
        ArchiveFirstService service = service(true);
        service.registerUser("alice", null);

        String first = service.snapshotSessions(List.of(new ArchiveFirstService.Session(
                "sess-one", "alice", START, START.plusDays(1), "Phone", "10.0.0.1", true)));
        clock.advance(Duration.ofHours(1));
        String second = service.snapshotSessions(List.of(new ArchiveFirstService.Session(
                "sess-two", "alice", START.plusHours(1), START.plusDays(1), "Laptop", "10.0.0.2", false)));

        assertEquals("auth/2024_06_15_sessions_snapshot.txt", first);
        assertEquals(first, second);
        assertTrue(read(second).contains("sess-two"));
        assertFalse(read(second).contains("sess-one"));
        assertEquals(2, store.count(EntityType.SESSION));
    }

    @Test
    @DisplayName("Invite tokens are written to the single token file")
    void testInviteTokens() throws Exception {
        ArchiveFirstService service = service(true);
        service.registerUser("alice", null);

        String path = service.snapshotInviteTokens(List.of(new ArchiveFirstService.InviteToken(
                "tok1", "alice", START, START.plusDays(7), false, null)));

        assertEquals("system/invite_tokens.txt", path);
        assertTrue(read(path).contains("tok1"));
        assertEquals(1, store.count(EntityType.INVITE_TOKEN));
    }

    // ========================================================================
    // Roles
    // ========================================================================

    @Nested
    @DisplayName("Roles")
    class Roles {

        @Test
        @DisplayName("Default roles are archived once")
        void testDefaultRoles() throws Exception {
            ArchiveFirstService service = service(true);

            String path = service.ensureDefaultRoles();

            assertEquals("roles/role_definitions.txt", path);
            String content = read(path);
            assertTrue(content.contains("Format: role_name|description|permissions_json|is_system_role|created_by|created_at"));
            assertTrue(content.contains("admin|System administrator with full access|[\"*\"]|true|system|2024-06-15T14:30:12"));
            assertTrue(content.contains("Total roles: 2"));
            assertEquals(2, store.count(EntityType.ROLE));
            assertTrue(store.findAll(EntityType.ROLE).stream().allMatch(r -> path.equals(r.record().archivePath())));

            assertNull(service.ensureDefaultRoles());
        }

        @Test
        @DisplayName("Default roles stored without an archive get one")
        void testUnarchivedDefaultsArchived() {
            CanonicalRecord.defaultRoles(START).forEach(r -> store.upsert(r, false));
            assertTrue(store.findAll(EntityType.ROLE).stream().allMatch(r -> r.record().isDefaultRole()));

            assertEquals("roles/role_definitions.txt", service(true).ensureDefaultRoles());

            assertTrue(store.findAll(EntityType.ROLE).stream().noneMatch(r -> r.record().isDefaultRole()));
            assertEquals(2, store.count(EntityType.ROLE));
        }

        @Test
        @DisplayName("Role assignments go to the monthly assignment log")
        void testAssignment() throws Exception {
            ArchiveFirstService service = service(true);
            service.registerUser("alice", null);
            service.ensureDefaultRoles();

            CanonicalRecord granted = service.recordRoleAssignment("alice", "admin", "granted", "system",
                    null, "first user");

            assertEquals("roles/2024_06_role_assignments.txt", granted.archivePath());
            assertTrue(read(granted.archivePath())
                    .contains("2024-06-15T14:30:12|alice|admin|granted|system||first user"));
            assertEquals(1, store.count(EntityType.ROLE_ASSIGNMENT));
            assertThrows(IllegalArgumentException.class,
                    () -> service.recordRoleAssignment("alice", "owner", "granted", "system", null, null));
        }
    }
}
