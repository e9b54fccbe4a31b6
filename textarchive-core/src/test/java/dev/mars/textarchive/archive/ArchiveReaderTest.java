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

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ArchiveReader: parsing real-looking files, unparsed lines, partition order.
 */
class ArchiveReaderTest {

    @TempDir
    Path tempDir;

    private ArchiveReader reader;

    @BeforeEach
    void setUp() {
        reader = new ArchiveReader(new ArchiveLayout(tempDir));
    }

    private Path write(String relative, String content) throws IOException {
        Path path = tempDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    @Test
    @DisplayName("A bad timestamp between two valid lines yields one unparsed line")
    void testUnparsedBetweenValid() throws IOException {
        Path path = write("users/2024_06_users.txt", """
                User Registrations for June 2024

                June 15 2024 at 14:30 - alice joined directly
                Juneteenth 99 2024 at 25:99 - mallory joined directly
                June 16 2024 at 09:05 - bob joined on invitation from alice
                """);

        List<ArchiveEvent> events = reader.parse(EntityType.USER, path).toList();

        assertEquals(3, events.size());
        ParsedEvent alice = assertInstanceOf(ParsedEvent.class, events.get(0));
        UnparsedLine bad = assertInstanceOf(UnparsedLine.class, events.get(1));
        ParsedEvent bob = assertInstanceOf(ParsedEvent.class, events.get(2));

        assertEquals("alice", alice.entityId());
        assertEquals(LocalDateTime.of(2024, 6, 15, 14, 30), alice.timestamp().value());
        assertEquals(TimestampPrecision.MINUTE, alice.timestamp().precision());
        assertEquals(4, bad.lineNumber());
        assertEquals("unparseable timestamp", bad.reason());
        assertEquals("alice", bob.fields().get("invited_by"));
        assertEquals("invite", bob.fields().get("registration_type"));
        assertEquals(1, reader.unparsedLineCount());
    }

    @Test
    @DisplayName("Fallback timestamp formats are accepted")
    void testFallbackFormats() throws IOException {
        Path path = write("users/2024_07_users.txt", """
                User Registrations for July 2024

                July 1, 2024 at 8:05 - carol joined directly
                Jul 2 2024 at 10:00 - dave joined directly
                2024-07-03 11:15 - erin joined directly
                """);

        List<ArchiveEvent> events = reader.parse(EntityType.USER, path).toList();

        assertEquals(3, events.size());
        assertTrue(events.stream().allMatch(e -> e instanceof ParsedEvent));
        assertEquals(LocalDateTime.of(2024, 7, 1, 8, 5), ((ParsedEvent) events.get(0)).timestamp().value());
        assertEquals(0, reader.unparsedLineCount());
    }

    @Test
    @DisplayName("Parsing is restartable: each iteration re-reads the file")
    void testRestartable() throws IOException {
        Path path = write("users/2024_06_users.txt", """
                User Registrations for June 2024

                June 15 2024 at 14:30 - alice joined directly
                """);
        ParsedArchive archive = reader.parse(EntityType.USER, path);

        assertEquals(1, archive.toList().size());
        Files.writeString(path, "June 15 2024 at 14:31 - bob joined directly\n",
                StandardCharsets.UTF_8, java.nio.file.StandardOpenOption.APPEND);
        assertEquals(2, archive.toList().size());
    }

    @Test
    @DisplayName("A cursor closed mid-file releases it and yields nothing more")
    void testCursorClosedEarly() throws IOException {
        Path path = write("users/2024_06_users.txt", """
                User Registrations for June 2024

                June 15 2024 at 14:30 - alice joined directly
                June 15 2024 at 14:31 - bob joined directly
                June 15 2024 at 14:32 - carol joined directly
                """);

        ParsedArchive.Cursor cursor = reader.parse(EntityType.USER, path).open();
        ParsedEvent first;
        try (cursor) {
            first = assertInstanceOf(ParsedEvent.class, cursor.next());
            assertTrue(cursor.hasNext());
        }

        assertEquals("alice", first.entityId());
        assertFalse(cursor.hasNext());
        assertThrows(java.util.NoSuchElementException.class, cursor::next);
        assertDoesNotThrow(cursor::close);
    }

    @Test
    @DisplayName("A failure in the loop body still closes the cursor")
    void testCursorClosedOnFailure() throws IOException {
        Path path = write("users/2024_06_users.txt", """
                User Registrations for June 2024

                June 15 2024 at 14:30 - alice joined directly
                June 15 2024 at 14:31 - bob joined directly
                """);
        ParsedArchive archive = reader.parse(EntityType.USER, path);
        ParsedArchive.Cursor[] opened = new ParsedArchive.Cursor[1];

        assertThrows(IllegalStateException.class, () -> {
            try (ParsedArchive.Cursor cursor = archive.open()) {
                opened[0] = cursor;
                cursor.next();
                throw new IllegalStateException("store rejected the row");
            }
        });

        assertFalse(opened[0].hasNext());
        assertEquals(2, archive.toList().size());
    }

    @Test
    @DisplayName("Malformed UTF-8 does not abort parsing")
    void testMalformedBytes() throws IOException {
        Path path = tempDir.resolve("users/2024_06_users.txt");
        Files.createDirectories(path.getParent());
        byte[] good = "June 15 2024 at 14:30 - alice joined directly\n".getBytes(StandardCharsets.UTF_8);
        byte[] bad = {(byte) 0xC3, (byte) 0x28, '\n'};
        byte[] content = new byte[good.length + bad.length];
        System.arraycopy(good, 0, content, 0, good.length);
        System.arraycopy(bad, 0, content, good.length, bad.length);
        Files.write(path, content);

        List<ArchiveEvent> events = reader.parse(EntityType.USER, path).toList();

        assertInstanceOf(ParsedEvent.class, events.get(0));
        assertInstanceOf(UnparsedLine.class, events.get(1));
    }

    @Test
    @DisplayName("Missing file raises ArchiveIOException")
    void testMissingFile() {
        assertThrows(ArchiveIOException.class,
                () -> reader.parse(EntityType.USER, tempDir.resolve("users/2030_01_users.txt")));
    }

    @Test
    @DisplayName("Partitions are listed in date order and foreign files are ignored")
    void testPartitions() throws IOException {
        write("users/2024_10_users.txt", "");
        write("users/2024_02_users.txt", "");
        write("users/notes.txt", "");
        write("users/2024_02_users.txt.tmp", "");
        write("prayers/2024/06/2024_06_15_prayer_at_1430_2.txt", "");
        write("prayers/2024/06/2024_06_15_prayer_at_1430.txt", "");
        write("prayers/marks/2024_06_marks.txt", "");

        assertEquals(List.of("users/2024_02_users.txt", "users/2024_10_users.txt"),
                reader.partitions(EntityType.USER).stream().map(reader.layout()::relativize).toList());
        assertEquals(List.of("prayers/2024/06/2024_06_15_prayer_at_1430.txt",
                        "prayers/2024/06/2024_06_15_prayer_at_1430_2.txt"),
                reader.partitions(EntityType.PRAYER).stream().map(reader.layout()::relativize).toList());
        assertEquals(1, reader.partitions(EntityType.INTERACTION_MARK).size());
    }
}
