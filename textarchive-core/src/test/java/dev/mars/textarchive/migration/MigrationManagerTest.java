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
package dev.mars.textarchive.migration;

import dev.mars.textarchive.ArchiveConfig;
import dev.mars.textarchive.ExclusiveFileLock;
import dev.mars.textarchive.TestDatabase;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MigrationManager against an in-memory H2 database.
 */
class MigrationManagerTest {

    @TempDir
    Path tempDir;

    private JdbcDataSource ds;
    private ArchiveConfig config;

    private static final SchemaVersion A = SchemaVersion.builder("A")
            .up("CREATE TABLE alpha (id INT PRIMARY KEY, name VARCHAR(20))")
            .down("DROP TABLE alpha")
            .build();

    private static final SchemaVersion B = SchemaVersion.builder("B")
            .up("ALTER TABLE alpha ADD COLUMN note VARCHAR(50); CREATE INDEX idx_alpha_note ON alpha (note)")
            .down("DROP INDEX idx_alpha_note; ALTER TABLE alpha DROP COLUMN note")
            .dependsOn("A")
            .build();

    @BeforeEach
    void setUp() {
        ds = TestDatabase.empty();
        config = ArchiveConfig.builder()
                .archiveDir(tempDir)
                .lockTimeout(Duration.ofMillis(300))
                .build();
    }

    private MigrationManager manager(SchemaVersion... versions) {
        return new MigrationManager(ds, MigrationCatalog.of(versions), config);
    }

    private void execute(String sql) throws SQLException {
        try (Connection conn = ds.getConnection(); Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    private long queryLong(String sql) throws SQLException {
        try (Connection conn = ds.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private SchemaSnapshot schema() throws SQLException {
        try (Connection conn = ds.getConnection()) {
            return SchemaInspector.inspect(conn);
        }
    }

    // ========================================================================
    // Apply ordering
    // ========================================================================

    @Nested
    @DisplayName("Apply")
    class Apply {

        @Test
        @DisplayName("Bundled versions apply on startup and 007 is current")
        void testBundledStartup() throws Exception {
            MigrationManager manager = new MigrationManager(ds, MigrationCatalog.fromClasspath(), config);

            MigrationStatus status = manager.migrateOnStartup();

            assertEquals(StartupDecision.SERVE, status.decision());
            assertEquals(Optional.of("007_role_tables"), manager.currentVersion());
            assertTrue(manager.pendingVersions().isEmpty());
            assertTrue(schema().hasColumn("sessions", "archive_path"));
            assertTrue(schema().hasIndex("idx_activity_log_natural_key"));
            assertTrue(schema().hasColumn("role_assignments", "granted_by"));

            assertEquals(StartupDecision.SERVE, manager.migrateOnStartup().decision());
        }

        @Test
        @DisplayName("Dependent before its dependency is refused, then both apply in order")
        void testDependencyOrdering() {
            MigrationManager manager = manager(A, B);

            DependencyException e = assertThrows(DependencyException.class, () -> manager.apply("B"));
            assertEquals(java.util.Set.of("A"), e.blocking());
            assertEquals(MigrationState.PENDING, manager.status().states().get("B"));

            manager.apply("A");
            manager.apply("B");

            assertEquals(Optional.of("B"), manager.currentVersion());
            assertEquals(List.of(), manager.pendingVersions());
        }

        @Test
        @DisplayName("Applying an applied version is a no-op")
        void testApplyTwice() throws Exception {
            MigrationManager manager = manager(A);
            manager.apply("A");
            manager.apply("A");
            assertEquals(1, queryLong("SELECT COUNT(*) FROM schema_migrations WHERE status = 'APPLIED'"));
        }

        @Test
        @DisplayName("Data-changing statements are rejected before anything runs")
        void testStructuralOnly() throws Exception {
            SchemaVersion bad = SchemaVersion.builder("bad")
                    .up("CREATE TABLE purge_me (id INT); DELETE FROM purge_me")
                    .down("DROP TABLE purge_me")
                    .build();
            MigrationManager manager = manager(bad);

            MigrationException e = assertThrows(MigrationException.class, () -> manager.apply("bad"));
            assertTrue(e.getMessage().contains("DELETE"));
            assertFalse(schema().hasTable("purge_me"));
            assertEquals(MigrationState.PENDING, manager.status().states().get("bad"));
        }

        @Test
        @DisplayName("A failing forward script is reverted and the version can be retried")
        void testForwardFailureReverted() throws Exception {
            SchemaVersion broken = SchemaVersion.builder("broken")
                    .up("CREATE TABLE half (id INT); CREATE TABLE half (id INT)")
                    .down("DROP TABLE half")
                    .build();
            MigrationManager manager = manager(broken);

            MigrationException e = assertThrows(MigrationException.class, () -> manager.apply("broken"));
            assertFalse(e.failClosed());
            assertFalse(schema().hasTable("half"));
            assertEquals(MigrationState.ROLLED_BACK, manager.status().states().get("broken"));
            assertEquals(List.of("broken"), manager.pendingVersions());
        }
    }

    // ========================================================================
    // Rollback
    // ========================================================================

    @Nested
    @DisplayName("Rollback")
    class Rollback {

        @Test
        @DisplayName("Rollback restores the previous structure and keeps data")
        void testRollbackRestoresStructure() throws Exception {
            MigrationManager manager = manager(A, B);
            manager.apply("A");
            execute("INSERT INTO alpha (id, name) VALUES (1, 'one')");
            SchemaSnapshot before = schema();

            manager.apply("B");
            assertTrue(schema().hasColumn("alpha", "note"));
            manager.rollback("B");

            assertEquals(before.tables(), schema().tables());
            assertEquals(before.columns(), schema().columns());
            assertEquals(before.indexes(), schema().indexes());
            assertEquals(1, queryLong("SELECT COUNT(*) FROM alpha WHERE name = 'one'"));
            assertEquals(Optional.of("A"), manager.currentVersion());
            assertEquals(List.of("B"), manager.pendingVersions());
        }

        @Test
        @DisplayName("Rollback with an applied dependent is refused")
        void testRollbackWithDependent() {
            MigrationManager manager = manager(A, B);
            manager.apply("A");
            manager.apply("B");

            DependencyException e = assertThrows(DependencyException.class, () -> manager.rollback("A"));
            assertEquals(java.util.Set.of("B"), e.blocking());
            assertEquals(MigrationState.APPLIED, manager.status().states().get("A"));
        }

        @Test
        @DisplayName("Rollback of an unapplied version is refused")
        void testRollbackUnapplied() {
            assertThrows(MigrationException.class, () -> manager(A).rollback("A"));
        }

        @Test
        @DisplayName("A failing reverse script leaves the schema fail-closed")
        void testRollbackFailureFailsClosed() {
            SchemaVersion badDown = SchemaVersion.builder("badDown")
                    .up("CREATE TABLE stuck (id INT)")
                    .down("THIS IS NOT SQL")
                    .build();
            MigrationManager manager = manager(badDown, A);
            manager.apply("badDown");

            MigrationException e = assertThrows(MigrationException.class, () -> manager.rollback("badDown"));
            assertTrue(e.failClosed());
            assertTrue(manager.status().failClosed());

            MigrationException refused = assertThrows(MigrationException.class, () -> manager.apply("A"));
            assertTrue(refused.failClosed());
            assertEquals(StartupDecision.BLOCKED, manager.migrateOnStartup().decision());
        }
    }

    // ========================================================================
    // Interrupted versions
    // ========================================================================

    @Nested
    @DisplayName("Interrupted")
    class Interrupted {

        private final SchemaVersion twoTables = SchemaVersion.builder("two")
                .up("CREATE TABLE t_one (id INT); CREATE TABLE t_two (id INT)")
                .down("DROP TABLE t_two; DROP TABLE t_one")
                .build();

        private MigrationManager stuckIn(MigrationState state) throws SQLException {
            MigrationManager manager = manager(twoTables);
            manager.status();
            execute("INSERT INTO schema_migrations (migration_id, status) VALUES ('two', '" + state + "')");
            return manager;
        }

        @Test
        @DisplayName("APPLYING with every effect present is marked applied")
        void testAllEffectsPresent() throws Exception {
            MigrationManager manager = stuckIn(MigrationState.APPLYING);
            execute("CREATE TABLE t_one (id INT)");
            execute("CREATE TABLE t_two (id INT)");

            assertEquals(List.of("two"), manager.recoverInterrupted());

            assertEquals(MigrationState.APPLIED, manager.status().states().get("two"));
            assertEquals(Optional.of("two"), manager.currentVersion());
        }

        @Test
        @DisplayName("APPLYING with no effect present is marked rolled back")
        void testNoEffectsPresent() throws Exception {
            MigrationManager manager = stuckIn(MigrationState.APPLYING);

            manager.recoverInterrupted();

            assertEquals(MigrationState.ROLLED_BACK, manager.status().states().get("two"));
            assertEquals(List.of("two"), manager.pendingVersions());
        }

        @Test
        @DisplayName("APPLYING with partial effects is reverted")
        void testPartialEffects() throws Exception {
            MigrationManager manager = stuckIn(MigrationState.APPLYING);
            execute("CREATE TABLE t_one (id INT)");

            manager.recoverInterrupted();

            assertFalse(schema().hasTable("t_one"));
            assertEquals(MigrationState.ROLLED_BACK, manager.status().states().get("two"));
        }

        @Nested
        @DisplayName("Forward scripts that drop objects")
        class Drops {

            private final SchemaVersion dropLegacy = SchemaVersion.builder("drop")
                    .up("ALTER TABLE beta DROP COLUMN legacy; CREATE INDEX idx_beta_id ON beta (id)")
                    .down("DROP INDEX idx_beta_id; ALTER TABLE beta ADD COLUMN legacy VARCHAR(20)")
                    .build();

            private MigrationManager stuckApplying() throws SQLException {
                execute("CREATE TABLE beta (id INT, legacy VARCHAR(20))");
                MigrationManager manager = manager(dropLegacy);
                manager.status();
                execute("INSERT INTO schema_migrations (migration_id, status) VALUES ('drop', 'APPLYING')");
                return manager;
            }

            @Test
            @DisplayName("A completed drop counts as applied and is not re-run")
            void testCompletedDropIsApplied() throws Exception {
                MigrationManager manager = stuckApplying();
                execute("ALTER TABLE beta DROP COLUMN legacy");
                execute("CREATE INDEX idx_beta_id ON beta (id)");

                manager.recoverInterrupted();

                assertEquals(MigrationState.APPLIED, manager.status().states().get("drop"));
                MigrationStatus status = manager.migrateOnStartup();
                assertEquals(StartupDecision.SERVE, status.decision());
                assertFalse(schema().hasColumn("beta", "legacy"));
                assertTrue(schema().hasIndex("idx_beta_id"));
            }

            @Test
            @DisplayName("A drop that never ran is rolled back, then applied on startup")
            void testDropNotStarted() throws Exception {
                MigrationManager manager = stuckApplying();

                manager.recoverInterrupted();

                assertEquals(MigrationState.ROLLED_BACK, manager.status().states().get("drop"));
                assertEquals(StartupDecision.SERVE, manager.migrateOnStartup().decision());
                assertFalse(schema().hasColumn("beta", "legacy"));
            }

            @Test
            @DisplayName("A drop done without the rest is reverted by re-adding the column")
            void testPartialDropReverted() throws Exception {
                MigrationManager manager = stuckApplying();
                execute("ALTER TABLE beta DROP COLUMN legacy");

                manager.recoverInterrupted();

                assertEquals(MigrationState.ROLLED_BACK, manager.status().states().get("drop"));
                assertTrue(schema().hasColumn("beta", "legacy"));
                assertFalse(schema().hasIndex("idx_beta_id"));
            }
        }

        @Test
        @DisplayName("Interrupted rollback is finished on recovery")
        void testRollingBack() throws Exception {
            MigrationManager manager = stuckIn(MigrationState.ROLLING_BACK);
            execute("CREATE TABLE t_one (id INT)");

            manager.recoverInterrupted();

            assertFalse(schema().hasTable("t_one"));
            assertEquals(MigrationState.PENDING, manager.status().states().get("two"));
        }

        @Test
        @DisplayName("Apply refuses an interrupted version; startup recovers then applies it")
        void testStartupRecovers() throws Exception {
            MigrationManager manager = stuckIn(MigrationState.VALIDATING);
            assertThrows(MigrationException.class, () -> manager.apply("two"));

            MigrationStatus status = manager.migrateOnStartup();

            assertEquals(StartupDecision.SERVE, status.decision());
            assertEquals(MigrationState.APPLIED, status.states().get("two"));
            assertTrue(schema().hasTable("t_two"));
        }
    }

    // ========================================================================
    // Data migrations
    // ========================================================================

    @Nested
    @DisplayName("Data migrations")
    class DataMigrations {

        @BeforeEach
        void applyBundledSchema() {
            new MigrationManager(ds, MigrationCatalog.fromClasspath(), config).migrateOnStartup();
        }

        private void seedSessions() throws SQLException {
            execute("INSERT INTO users (entity_id, action, actor, occurred_at) "
                    + "VALUES ('alice', 'registered', 'alice', TIMESTAMP '2024-06-15 14:30:00')");
            execute("INSERT INTO sessions (entity_id, action, actor, occurred_at) "
                    + "VALUES ('s1', 'active', 'alice', TIMESTAMP '2024-06-15 14:30:00')");
            execute("INSERT INTO sessions (entity_id, action, actor, occurred_at) "
                    + "VALUES ('s2', 'active', 'alice', TIMESTAMP '2024-06-15 14:31:00')");
        }

        @Test
        @DisplayName("A data migration that would end sessions is rolled back")
        void testSessionLossRolledBack() throws Exception {
            seedSessions();
            MigrationManager manager = new MigrationManager(ds, MigrationCatalog.fromClasspath(), config);

            MigrationException e = assertThrows(MigrationException.class, () -> manager.runDataMigration(conn -> {
                try (Statement st = conn.createStatement()) {
                    st.executeUpdate("UPDATE users SET registration_type = 'direct'");
                    st.executeUpdate("DELETE FROM sessions WHERE entity_id = 's1'");
                }
            }));

            assertTrue(e.getMessage().contains("1 active sessions"));
            assertEquals(2, queryLong("SELECT COUNT(*) FROM sessions"));
            assertEquals(0, queryLong("SELECT COUNT(*) FROM users WHERE registration_type IS NOT NULL"));
        }

        @Test
        @DisplayName("A data migration that keeps sessions is committed")
        void testCommitted() throws Exception {
            seedSessions();
            MigrationManager manager = new MigrationManager(ds, MigrationCatalog.fromClasspath(), config);

            manager.runDataMigration(conn -> {
                try (Statement st = conn.createStatement()) {
                    st.executeUpdate("UPDATE sessions SET fully_authenticated = 'true'");
                }
            });

            assertEquals(2, queryLong("SELECT COUNT(*) FROM sessions WHERE fully_authenticated = 'true'"));
        }

        @Test
        @DisplayName("A failing data migration is rolled back and rethrown")
        void testFailureRolledBack() throws Exception {
            seedSessions();
            MigrationManager manager = new MigrationManager(ds, MigrationCatalog.fromClasspath(), config);

            assertThrows(MigrationException.class, () -> manager.runDataMigration(conn -> {
                try (Statement st = conn.createStatement()) {
                    st.executeUpdate("UPDATE users SET invited_by = 'bob'");
                    st.executeUpdate("UPDATE no_such_table SET x = 1");
                }
            }));

            assertEquals(0, queryLong("SELECT COUNT(*) FROM users WHERE invited_by IS NOT NULL"));
        }
    }

    // ========================================================================
    // Startup decisions
    // ========================================================================

    @Nested
    @DisplayName("Startup")
    class Startup {

        @Test
        @DisplayName("A version flagged for maintenance blocks startup and nothing is applied")
        void testMaintenanceBlocks() {
            SchemaVersion heavy = SchemaVersion.builder("heavy")
                    .up("CREATE TABLE heavy (id INT)")
                    .down("DROP TABLE heavy")
                    .requiresMaintenanceMode(true)
                    .build();
            MigrationManager manager = manager(A, heavy);

            MigrationStatus status = manager.migrateOnStartup();

            assertEquals(StartupDecision.BLOCKED, status.decision());
            assertTrue(status.message().contains("heavy"));
            assertEquals(List.of("A", "heavy"), manager.pendingVersions());
        }

        @Test
        @DisplayName("Estimate above the threshold needs maintenance")
        void testEstimateThreshold() throws Exception {
            SchemaVersion slow = SchemaVersion.builder("slow")
                    .up("ALTER TABLE alpha ADD COLUMN extra INT")
                    .down("ALTER TABLE alpha DROP COLUMN extra")
                    .dependsOn("A")
                    .estimatedDurationSeconds(20)
                    .affectedTables("alpha")
                    .build();
            MigrationManager manager = manager(A, slow);
            manager.apply("A");

            assertEquals(20, manager.estimateDurationSeconds("slow"));
            assertFalse(manager.requiresMaintenanceMode("slow"));

            execute("INSERT INTO alpha (id) SELECT X FROM SYSTEM_RANGE(1, 10001)");

            assertEquals(40, manager.estimateDurationSeconds("slow"));
            assertTrue(manager.requiresMaintenanceMode("slow"));
        }

        @Test
        @DisplayName("Edited scripts are reported as checksum mismatches")
        void testChecksumMismatch() {
            manager(A).apply("A");
            SchemaVersion edited = SchemaVersion.builder("A")
                    .up("CREATE TABLE alpha (id INT PRIMARY KEY, name VARCHAR(40))")
                    .down("DROP TABLE alpha")
                    .build();
            MigrationManager manager = manager(edited);

            assertEquals(List.of("A"), manager.verifyChecksums());
            assertEquals(StartupDecision.SERVE, manager.migrateOnStartup().decision());
        }

        @Test
        @DisplayName("Lock held elsewhere degrades startup instead of failing it")
        void testLockTimeoutDegrades() throws Exception {
            MigrationManager manager = manager(A);
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                try (ExclusiveFileLock ignored = ExclusiveFileLock.acquire(config.migrationLockFile(), Duration.ofSeconds(1))) {
                    held.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            holder.start();
            assertTrue(held.await(5, TimeUnit.SECONDS));

            try {
                MigrationStatus status = manager.migrateOnStartup();
                assertEquals(StartupDecision.SERVE_DEGRADED, status.decision());
                assertEquals(List.of("A"), status.pending());
            } finally {
                release.countDown();
                holder.join(5000);
            }
        }
    }
}
