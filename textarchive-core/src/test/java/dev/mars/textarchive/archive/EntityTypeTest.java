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

import java.time.LocalDateTime;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EntityType path templates and dependencies.
 */
class EntityTypeTest {

    private static final LocalDateTime AT = LocalDateTime.of(2024, 6, 15, 14, 30);

    @Test
    @DisplayName("Every type initializes and recognises its own partition path")
    void testEveryTypeRoundTripsItsPath() {
        for (EntityType type : EntityType.values()) {
            PartitionKey key = switch (type.partitioning()) {
                case SINGLE -> PartitionKey.single();
                case PER_INSTANCE -> PartitionKey.instance(AT, 2);
                default -> PartitionKey.containing(AT);
            };
            String path = type.relativePath(key);
            assertTrue(type.isPartition(path), type + " " + path);
            assertTrue(path.startsWith(type.baseDirectory() + "/"), type + " " + path);
            assertNotNull(type.grammar(), type.toString());
        }
    }

    @Test
    @DisplayName("Path tokens are filled from the partition key")
    void testRelativePaths() {
        assertEquals("users/2024_06_users.txt", EntityType.USER.relativePath(PartitionKey.month(YearMonth.of(2024, 6))));
        assertEquals("prayers/2024/06/2024_06_15_prayer_at_1430_2.txt",
                EntityType.PRAYER.relativePath(PartitionKey.instance(AT, 2)));
        assertEquals("prayers/2024/06/2024_06_15_prayer_at_1430.txt",
                EntityType.PRAYER.relativePath(PartitionKey.instance(AT, 1)));
        assertEquals("roles/role_definitions.txt", EntityType.ROLE.relativePath(PartitionKey.single()));
        assertEquals("roles/2024_06_role_assignments.txt",
                EntityType.ROLE_ASSIGNMENT.relativePath(PartitionKey.containing(AT)));
        assertThrows(IllegalArgumentException.class, () -> EntityType.USER.relativePath(PartitionKey.single()));
    }

    @Test
    @DisplayName("Types sharing a directory do not claim each other's files")
    void testSharedDirectories() {
        assertFalse(EntityType.ROLE.isPartition("roles/2024_06_role_assignments.txt"));
        assertFalse(EntityType.ROLE_ASSIGNMENT.isPartition("roles/role_definitions.txt"));
        assertFalse(EntityType.AUTH_REQUEST.isPartition("auth/2024_06_auth_approvals.txt"));
        assertTrue(EntityType.SESSION.isPartition("auth/2024_06_15_sessions_snapshot.txt"));
    }

    @Test
    @DisplayName("Role assignments depend on users and roles")
    void testDependencies() {
        assertTrue(EntityType.USER.dependencies().isEmpty());
        assertTrue(EntityType.ROLE.dependencies().isEmpty());
        assertEquals(java.util.Set.of(EntityType.USER, EntityType.ROLE), EntityType.ROLE_ASSIGNMENT.dependencies());
    }
}
