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
import dev.mars.textarchive.archive.EntityType;
import dev.mars.textarchive.archive.ParsedEvent;
import dev.mars.textarchive.archive.PartitionKey;
import dev.mars.textarchive.archive.TimestampPrecision;
import dev.mars.textarchive.archive.UnparsedLine;
import dev.mars.textarchive.store.CanonicalRecord;
import org.junit.jupiter.api.*;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static dev.mars.textarchive.archive.grammar.PrayerFileGrammarTest.parse;
import static org.junit.jupiter.api.Assertions.*;

class PipeDelimitedGrammarTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 15, 14, 30, 12);

    private static CanonicalRecord token(String token, boolean used, LocalDateTime expires) {
        Map<String, String> fields = new HashMap<>();
        fields.put("used", Boolean.toString(used));
        fields.put("expires_at", expires.toString());
        return CanonicalRecord.of(EntityType.INVITE_TOKEN, token, "issued", "alice", NOW.minusDays(1), fields);
    }

    @Test
    @DisplayName("Auth request log: header, format line and second-precision records")
    void testAuthRequestLog() {
        PipeDelimitedGrammar grammar = PipeDelimitedGrammar.AUTH_REQUESTS;
        CanonicalRecord request = CanonicalRecord.of(EntityType.AUTH_REQUEST, "bob", "pending", "bob", NOW,
                Map.of("device_info", "Firefox | Linux", "ip_address", "192.0.2.1"));

        String content = grammar.header(PartitionKey.containing(NOW)) + grammar.formatAppend(request, "");
        assertTrue(content.startsWith("Authentication Requests for June 2024\nFormat: timestamp|user_id|"));

        List<ArchiveEvent> events = parse(grammar, content);
        assertEquals(1, events.size());
        ParsedEvent event = (ParsedEvent) events.get(0);
        assertEquals(NOW, event.timestamp().value());
        assertEquals(TimestampPrecision.SECOND, event.timestamp().precision());
        assertEquals("bob", event.entityId());
        assertEquals("bob", event.actor());
        assertEquals("pending", event.action());
        assertEquals("Firefox _ Linux", event.fields().get("device_info"));
        assertNull(event.fields().get("details"));
    }

    @Test
    @DisplayName("Wrong column count and bad timestamp are unparsed")
    void testMalformedRecords() {
        String content = """
                Security Events for June 2024
                Format: timestamp|event_type|user_id|ip_address|user_agent|details

                2024-06-15T14:30:00|login_failed|bob|192.0.2.1|curl|bad password
                2024-06-15T14:31:00|login_failed|bob
                yesterday|login_failed|bob|192.0.2.1|curl|bad password
                """;

        List<ArchiveEvent> events = parse(PipeDelimitedGrammar.SECURITY_EVENTS, content);

        assertEquals(3, events.size());
        assertInstanceOf(ParsedEvent.class, events.get(0));
        assertTrue(((UnparsedLine) events.get(1)).reason().startsWith("expected 6 columns"));
        assertEquals(6, ((UnparsedLine) events.get(2)).lineNumber());
    }

    @Test
    @DisplayName("Invite token snapshot splits active and expired tokens and skips footers when parsed")
    void testInviteTokenSnapshot() {
        List<CanonicalRecord> tokens = List.of(
                token("t-active", false, NOW.plusDays(7)),
                token("t-used", true, NOW.plusDays(7)),
                token("t-expired", false, NOW.minusHours(1)));

        String content = PipeDelimitedGrammar.INVITE_TOKENS.render(PartitionKey.single(), tokens, NOW);

        int active = content.indexOf("ACTIVE TOKENS:");
        int expired = content.indexOf("RECENTLY EXPIRED TOKENS:");
        assertTrue(active >= 0 && expired > active);
        assertTrue(content.indexOf("t-active") < expired);
        assertTrue(content.indexOf("t-used") > expired);
        assertTrue(content.indexOf("t-expired") > expired);
        assertTrue(content.contains("Active tokens: 1\nTotal tokens: 3\n"));

        List<ArchiveEvent> events = parse(PipeDelimitedGrammar.INVITE_TOKENS, content);
        assertEquals(3, events.size());
        assertTrue(events.stream().allMatch(e -> e instanceof ParsedEvent p && p.action().equals("issued")));
        assertEquals("true", ((ParsedEvent) events.get(1)).fields().get("used"));
    }

    @Test
    @DisplayName("Session snapshot lists every session and a total")
    void testSessionSnapshot() {
        Map<String, String> fields = Map.of("fully_authenticated", "true", "device_info", "Safari");
        List<CanonicalRecord> sessions = List.of(
                CanonicalRecord.of(EntityType.SESSION, "s1", "active", "alice", NOW, fields),
                CanonicalRecord.of(EntityType.SESSION, "s2", "active", "bob", NOW, fields));

        String content = PipeDelimitedGrammar.SESSIONS.render(PartitionKey.day(NOW.toLocalDate()), sessions, NOW);
        assertTrue(content.endsWith("Total active sessions: 2\n"));

        List<ArchiveEvent> events = parse(PipeDelimitedGrammar.SESSIONS, content);
        assertEquals(List.of("s1", "s2"), events.stream().map(e -> ((ParsedEvent) e).entityId()).toList());
        assertEquals("true", ((ParsedEvent) events.get(0)).fields().get("fully_authenticated"));
    }

    @Test
    @DisplayName("Append-only logs cannot be rendered as snapshots")
    void testLogRender() {
        assertThrows(UnsupportedOperationException.class,
                () -> PipeDelimitedGrammar.MARKS.render(PartitionKey.containing(NOW), List.of(), NOW));
    }

    @Test
    @DisplayName("Role definitions render as a snapshot; an empty creator reads as system")
    void testRoleDefinitions() {
        CanonicalRecord editor = CanonicalRecord.of(EntityType.ROLE, "editor", "defined", "alice", NOW,
                Map.of("description", "Edits | moderates", "permissions", "[\"read\", \"edit\"]",
                        "is_system_role", "false"));
        String content = PipeDelimitedGrammar.ROLES.render(PartitionKey.single(), List.of(editor), NOW)
                + "user|Standard user|[\"read\"]|True||2024-01-02T03:04:05\n";

        assertTrue(content.startsWith("Role Definitions - Updated June 15, 2024 at 14:30\n"));
        List<ArchiveEvent> events = parse(PipeDelimitedGrammar.ROLES, content);

        assertEquals(2, events.size(), events::toString);
        ParsedEvent parsedEditor = (ParsedEvent) events.get(0);
        assertEquals("editor", parsedEditor.entityId());
        assertEquals("alice", parsedEditor.actor());
        assertEquals("defined", parsedEditor.action());
        assertEquals("Edits _ moderates", parsedEditor.fields().get("description"));
        assertEquals("[\"read\", \"edit\"]", parsedEditor.fields().get("permissions"));
        ParsedEvent legacy = (ParsedEvent) events.get(1);
        assertEquals("system", legacy.actor());
        assertEquals("true", legacy.fields().get("is_system_role"));
    }
}
