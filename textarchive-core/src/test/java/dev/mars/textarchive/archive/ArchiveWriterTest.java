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

import dev.mars.textarchive.ArchiveConfig;
import dev.mars.textarchive.store.CanonicalRecord;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ArchiveWriter: append framing, atomic replacement, per-instance naming and
 * concurrent appenders.
 */
class ArchiveWriterTest {

    private static final LocalDateTime JUNE_15 = LocalDateTime.of(2024, 6, 15, 14, 30);

    @TempDir
    Path tempDir;

    private ArchiveWriter writer;

    @BeforeEach
    void setUp() {
        ArchiveConfig config = ArchiveConfig.builder().archiveDir(tempDir).syncEnabled(false).build();
        writer = new ArchiveWriter(config, Clock.fixed(JUNE_15.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    private static CanonicalRecord registration(String name, LocalDateTime at) {
        return CanonicalRecord.of(EntityType.USER, name, "registered", name, at, Map.of("registration_type", "direct"));
    }

    private static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    // ========================================================================
    // Append
    // ========================================================================

    @Nested
    @DisplayName("Append")
    class Append {

        @Test
        @DisplayName("First append writes the header, later appends only their line")
        void testHeaderOnce() throws IOException {
            Path path = writer.append(EntityType.USER, PartitionKey.containing(JUNE_15), registration("alice", JUNE_15));
            writer.append(EntityType.USER, PartitionKey.containing(JUNE_15), registration("bob", JUNE_15.plusMinutes(5)));

            assertEquals(tempDir.resolve("users/2024_06_users.txt"), path);
            assertEquals("""
                    User Registrations for June 2024

                    June 15 2024 at 14:30 - alice joined directly
                    June 15 2024 at 14:35 - bob joined directly
                    """, read(path));
        }

        @Test
        @DisplayName("A file without a trailing newline gets one before the new line")
        void testMissingTrailingNewline() throws IOException {
            Path path = tempDir.resolve("users/2024_06_users.txt");
            Files.createDirectories(path.getParent());
            Files.writeString(path, "User Registrations for June 2024\n\nJune 15 2024 at 14:30 - alice joined directly");

            writer.append(EntityType.USER, PartitionKey.containing(JUNE_15), registration("bob", JUNE_15));

            assertTrue(read(path).endsWith("alice joined directly\nJune 15 2024 at 14:30 - bob joined directly\n"));
        }

        @Test
        @DisplayName("Appending activity to a missing prayer file fails")
        void testMissingPrayerFile() {
            CanonicalRecord activity = CanonicalRecord.of(EntityType.ACTIVITY_LOG, "p1", "prayed", "bob", JUNE_15, Map.of());
            assertThrows(ArchiveIOException.class,
                    () -> writer.append(EntityType.PRAYER, PartitionKey.instance(JUNE_15, 1), activity));
        }

        @Test
        @DisplayName("Append by relative path rejects a path of another type")
        void testWrongPartitionType() {
            assertThrows(IllegalArgumentException.class,
                    () -> writer.append(EntityType.PRAYER, "users/2024_06_users.txt", registration("x", JUNE_15)));
        }

        @Test
        @DisplayName("Site activity adds a date header only once per day")
        void testSiteActivityDateHeaders() throws IOException {
            CanonicalRecord first = CanonicalRecord.of(EntityType.ACTIVITY_LOG, "p1", "submitted prayer p1", "alice",
                    JUNE_15, Map.of("detail", "healing"));
            CanonicalRecord second = CanonicalRecord.of(EntityType.ACTIVITY_LOG, "site", "joined the site", "bob",
                    JUNE_15.plusMinutes(1), Map.of());
            Path path = writer.append(EntityType.ACTIVITY_LOG, PartitionKey.containing(JUNE_15), first);
            writer.append(EntityType.ACTIVITY_LOG, PartitionKey.containing(JUNE_15), second);

            String content = read(path);
            assertEquals(1, content.split("June 15 2024\n", -1).length - 1);
            assertTrue(content.contains("14:30 - alice submitted prayer p1 (healing)\n"));
            assertTrue(content.contains("14:31 - bob joined the site\n"));
        }
    }

    // ========================================================================
    // Whole-file writes
    // ========================================================================

    @Nested
    @DisplayName("Create Or Replace")
    class CreateOrReplace {

        @Test
        @DisplayName("Replacement leaves no temporary file")
        void testReplace() throws IOException {
            PartitionKey key = PartitionKey.single();
            writer.createOrReplace(EntityType.INVITE_TOKEN, key, "old\n");
            Path path = writer.createOrReplace(EntityType.INVITE_TOKEN, key, "new\n");

            assertEquals("new\n", read(path));
            assertFalse(Files.exists(path.resolveSibling(path.getFileName() + ".tmp")));
        }

        @Test
        @DisplayName("Crash before rename leaves the previous content intact")
        void testCrashBeforeRename() throws IOException {
            PartitionKey key = PartitionKey.single();
            Path path = writer.createOrReplace(EntityType.INVITE_TOKEN, key, "previous\n");

            writer.setRenameHook(tmp -> {
                assertTrue(Files.exists(tmp));
                throw new IOException("simulated crash");
            });

            assertThrows(ArchiveIOException.class,
                    () -> writer.createOrReplace(EntityType.INVITE_TOKEN, key, "half-written\n"));
            assertEquals("previous\n", read(path));
            assertFalse(Files.exists(path.resolveSibling(path.getFileName() + ".tmp")));
        }

        @Test
        @DisplayName("Snapshot renders with the grammar and the writer clock")
        void testSnapshot() throws IOException {
            CanonicalRecord session = CanonicalRecord.of(EntityType.SESSION, "s1", "active", "alice", JUNE_15,
                    Map.of("fully_authenticated", "true"));
            Path path = writer.snapshot(EntityType.SESSION, PartitionKey.day(JUNE_15.toLocalDate()), List.of(session));

            assertEquals(tempDir.resolve("auth/2024_06_15_sessions_snapshot.txt"), path);
            String content = read(path);
            assertTrue(content.startsWith("Session Snapshot for June 15, 2024 at 14:30\n"));
            assertTrue(content.contains("Total active sessions: 1"));
        }
    }

    // ========================================================================
    // Per-instance naming
    // ========================================================================

    @Nested
    @DisplayName("Instance Keys")
    class InstanceKeys {

        @Test
        @DisplayName("Same-minute prayers get _2 and _3 suffixes")
        void testConflictCounter() {
            PartitionKey first = writer.newInstanceKey(EntityType.PRAYER, JUNE_15);
            PartitionKey second = writer.newInstanceKey(EntityType.PRAYER, JUNE_15);
            PartitionKey third = writer.newInstanceKey(EntityType.PRAYER, JUNE_15);

            assertEquals("prayers/2024/06/2024_06_15_prayer_at_1430.txt", EntityType.PRAYER.relativePath(first));
            assertEquals("prayers/2024/06/2024_06_15_prayer_at_1430_2.txt", EntityType.PRAYER.relativePath(second));
            assertEquals("prayers/2024/06/2024_06_15_prayer_at_1430_3.txt", EntityType.PRAYER.relativePath(third));
        }

        @Test
        @DisplayName("Existing files are skipped")
        void testSkipsExisting() {
            PartitionKey key = writer.newInstanceKey(EntityType.PRAYER, JUNE_15);
            writer.createOrReplace(EntityType.PRAYER, key, "Prayer p1 by alice\n");

            PartitionKey next = writer.newInstanceKey(EntityType.PRAYER, JUNE_15);
            assertEquals(2, next.sequence());
        }

        @Test
        @DisplayName("Monthly types have no instance keys")
        void testRejectsMonthly() {
            assertThrows(IllegalArgumentException.class, () -> writer.newInstanceKey(EntityType.USER, JUNE_15));
        }
    }

    // ========================================================================
    // Concurrency
    // ========================================================================

    @Test
    @DisplayName("Concurrent appenders never interleave lines")
    void testConcurrentAppenders() throws Exception {
        int threads = 8;
        int perThread = 25;
        CyclicBarrier start = new CyclicBarrier(threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String user = "user" + t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        writer.append(EntityType.AUTH_REQUEST, PartitionKey.containing(JUNE_15),
                                CanonicalRecord.of(EntityType.AUTH_REQUEST, user, "pending", user,
                                        JUNE_15.plusSeconds(i), Map.of("details", "attempt " + i)));
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        ArchiveReader reader = new ArchiveReader(writer.layout());
        Path path = tempDir.resolve("auth/2024_06_auth_requests.txt");
        List<ArchiveEvent> events = reader.parse(EntityType.AUTH_REQUEST, path).toList();

        assertEquals(threads * perThread, events.size());
        assertTrue(events.stream().allMatch(e -> e instanceof ParsedEvent));
        assertEquals(0, reader.unparsedLineCount());
        assertEquals(1, read(path).split("Format:", -1).length - 1, "header written exactly once");
    }
}
