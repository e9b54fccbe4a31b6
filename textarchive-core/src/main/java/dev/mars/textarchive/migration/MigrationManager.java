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
import dev.mars.textarchive.ArchiveException;
import dev.mars.textarchive.ExclusiveFileLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Versions and applies schema changes with locking, crash recovery and rollback.
 * <p>
 * <b>Safety Properties:</b>
 * <ul>
 *   <li><b>Exclusive:</b> every mutating operation holds an exclusive lock on the configured
 *       migration lock file; waiting longer than the lock timeout raises
 *       {@link dev.mars.textarchive.LockTimeoutException}.</li>
 *   <li><b>Ordered:</b> a version applies only after all its dependencies; a version rolls
 *       back only when no applied version depends on it ({@link DependencyException}).</li>
 *   <li><b>Crash-visible:</b> {@code APPLYING} / {@code ROLLING_BACK} is committed to
 *       {@code schema_migrations} before any DDL runs. {@link #recoverInterrupted()} then
 *       inspects the live schema instead of re-running the forward script.</li>
 *   <li><b>Self-reverting:</b> a forward script that fails is reverted statement by
 *       statement, skipping objects that were never created.</li>
 *   <li><b>Fail-closed:</b> if reverting fails the version is marked
 *       {@code ROLLBACK_FAILED} and every later operation refuses to run.</li>
 *   <li><b>Structural only:</b> forward scripts may not change data; see
 *       {@link #runDataMigration(DataMigration)}.</li>
 * </ul>
 *
 * <pre>
 * MigrationManager migrations = new MigrationManager(dataSource, MigrationCatalog.fromClasspath(), config);
 * MigrationStatus status = migrations.migrateOnStartup();
 * if (status.decision() == StartupDecision.BLOCKED) {
 *     // enter maintenance mode
 * }
 * </pre>
 */
public final class MigrationManager {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationManager.class);

    static final String TABLE = "schema_migrations";

    /** Row-count thresholds that scale a declared duration estimate. */
    private static final long LARGE_TABLE_ROWS = 10_000;
    private static final long HUGE_TABLE_ROWS = 100_000;

    private final DataSource dataSource;
    private final MigrationCatalog catalog;
    private final ArchiveConfig config;
    private final Clock clock;

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private record Row(String id, MigrationState state, String checksum, long applySeq) {
    }

    public MigrationManager(DataSource dataSource, MigrationCatalog catalog, ArchiveConfig config) {
        this(dataSource, catalog, config, Clock.systemDefaultZone());
    }

    public MigrationManager(DataSource dataSource, MigrationCatalog catalog, ArchiveConfig config, Clock clock) {
        this.dataSource = dataSource;
        this.catalog = catalog;
        this.config = config;
        this.clock = clock;
    }

    public MigrationCatalog catalog() {
        return catalog;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /** Versions not yet applied, in apply order. */
    public List<String> pendingVersions() {
        return unlocked(this::pending);
    }

    /** The most recently applied version. */
    public Optional<String> currentVersion() {
        return unlocked(conn -> current(readRows(conn)));
    }

    public MigrationStatus status() {
        return unlocked(this::status);
    }

    /**
     * Applied versions whose scripts no longer match the checksum recorded when they
     * were applied.
     */
    public List<String> verifyChecksums() {
        return status().checksumMismatch();
    }

    /**
     * Whether applying {@code versionId} needs maintenance mode: declared so, or its
     * estimated duration exceeds the configured threshold.
     */
    public boolean requiresMaintenanceMode(String versionId) {
        SchemaVersion v = catalog.get(versionId);
        return unlocked(conn -> requiresMaintenanceMode(conn, v));
    }

    /**
     * Declared duration scaled by the current size of the affected tables:
     * doubled above 10,000 rows, tripled above 100,000.
     */
    public long estimateDurationSeconds(String versionId) {
        SchemaVersion v = catalog.get(versionId);
        return unlocked(conn -> estimate(conn, v));
    }

    // ========================================================================
    // Operations
    // ========================================================================

    /**
     * Applies one version. Applying an already applied version does nothing.
     *
     * @throws DependencyException if a dependency is not applied
     * @throws MigrationException  if validation or the forward script fails (the version
     *                             is then reverted), or the schema is fail-closed
     */
    public void apply(String versionId) {
        locked(conn -> {
            requireOpen(conn);
            applyLocked(conn, versionId);
            return null;
        });
    }

    /**
     * Reverts one applied version with its reverse script.
     *
     * @throws DependencyException if an applied version depends on it
     * @throws MigrationException  if it is not applied, or the reverse script fails (the
     *                             schema is then fail-closed)
     */
    public void rollback(String versionId) {
        locked(conn -> {
            requireOpen(conn);
            rollbackLocked(conn, versionId);
            return null;
        });
    }

    /**
     * Resolves versions left mid-operation by a crash. For a version stuck in
     * {@code APPLYING}: all of its effects visible marks it applied, none visible marks it
     * rolled back, and a partial state is reverted. The forward script is never re-run.
     *
     * @return ids of the versions resolved
     */
    public List<String> recoverInterrupted() {
        return locked(conn -> {
            requireOpen(conn);
            return recoverLocked(conn);
        });
    }

    /**
     * Runs a data transformation under the migration lock in one transaction.
     *
     * @throws MigrationException if it fails or would reduce the number of sessions; the
     *                            transaction is rolled back in both cases
     */
    public void runDataMigration(DataMigration migration) {
        locked(conn -> {
            requireOpen(conn);
            SchemaSnapshot schema = SchemaInspector.inspect(conn);
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                long sessionsBefore = SchemaInspector.rowCount(conn, schema, "sessions");
                migration.migrate(conn);
                long sessionsAfter = SchemaInspector.rowCount(conn, schema, "sessions");
                if (sessionsAfter < sessionsBefore) {
                    conn.rollback();
                    throw new MigrationException("Data migration " + migration.name() + " would end "
                            + (sessionsBefore - sessionsAfter) + " active sessions; rolled back");
                }
                conn.commit();
                LOG.info("Data migration {} committed", migration.name());
                return null;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                LOG.error("Data migration {} rolled back: {}", migration.name(), e.getMessage());
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        });
    }

    /**
     * Startup entry point: recovers interrupted versions, then applies everything pending
     * unless a pending version needs maintenance mode.
     * <p>
     * Never throws. The returned {@link MigrationStatus#decision()} tells the caller whether
     * to serve ({@code SERVE}), serve with a warning ({@code SERVE_DEGRADED}) or not serve
     * at all ({@code BLOCKED}: maintenance mode needed, or fail-closed).
     */
    public MigrationStatus migrateOnStartup() {
        try {
            return locked(conn -> {
                MigrationStatus before = status(conn);
                if (before.failClosed()) {
                    LOG.error("Schema is fail-closed after a failed rollback; refusing to start");
                    return before.withDecision(StartupDecision.BLOCKED, "fail-closed: manual repair required");
                }
                if (!before.checksumMismatch().isEmpty()) {
                    LOG.warn("Applied schema versions changed since they were applied: {}", before.checksumMismatch());
                }
                List<String> recovered = recoverLocked(conn);
                if (!recovered.isEmpty()) {
                    LOG.warn("Recovered interrupted schema versions: {}", recovered);
                }

                List<String> pending = pending(conn);
                if (pending.isEmpty()) {
                    MigrationStatus current = status(conn);
                    LOG.info("Schema is current at {}", current.currentVersion().orElse("(empty)"));
                    return current.withDecision(StartupDecision.SERVE, "schema current");
                }

                List<String> needMaintenance = new ArrayList<>();
                for (String id : pending) {
                    if (requiresMaintenanceMode(conn, catalog.get(id))) {
                        needMaintenance.add(id);
                    }
                }
                if (!needMaintenance.isEmpty()) {
                    LOG.warn("Pending schema versions need maintenance mode, applying none: {}", needMaintenance);
                    return status(conn).withDecision(StartupDecision.BLOCKED,
                            "maintenance mode required for " + needMaintenance);
                }

                for (String id : pending) {
                    applyLocked(conn, id);
                }
                LOG.info("Applied {} schema versions on startup", pending.size());
                return status(conn).withDecision(StartupDecision.SERVE, "applied " + pending);
            });
        } catch (MigrationException e) {
            if (e.failClosed()) {
                LOG.error("Startup migration left the schema fail-closed: {}", e.getMessage(), e);
                return safeStatus().withDecision(StartupDecision.BLOCKED, e.getMessage());
            }
            LOG.warn("Startup migration failed, serving degraded: {}", e.getMessage());
            return safeStatus().withDecision(StartupDecision.SERVE_DEGRADED, e.getMessage());
        } catch (ArchiveException e) {
            LOG.warn("Startup migration did not run, serving degraded: {}", e.getMessage());
            return safeStatus().withDecision(StartupDecision.SERVE_DEGRADED, e.getMessage());
        }
    }

    // ========================================================================
    // Locked implementations
    // ========================================================================

    private void applyLocked(Connection conn, String versionId) throws SQLException {
        SchemaVersion v = catalog.get(versionId);
        Map<String, Row> rows = readRows(conn);
        MigrationState state = stateOf(rows, versionId);
        if (state == MigrationState.APPLIED) {
            LOG.info("Schema version {} already applied", versionId);
            return;
        }
        if (state.isInterrupted()) {
            throw new MigrationException("Schema version " + versionId + " was interrupted while "
                    + state + "; run recoverInterrupted() first");
        }
        Set<String> missing = v.dependsOn().stream()
                .filter(dep -> stateOf(rows, dep) != MigrationState.APPLIED)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!missing.isEmpty()) {
            throw new DependencyException(versionId, missing,
                    "Schema version " + versionId + " requires unapplied versions " + missing);
        }

        setState(conn, versionId, MigrationState.VALIDATING);
        List<String> statements = SqlScript.statements(v.upSql());
        try {
            SqlScript.requireStructural(versionId, statements);
        } catch (MigrationException e) {
            setState(conn, versionId, MigrationState.PENDING);
            LOG.error("Schema version {} rejected: {}", versionId, e.getMessage());
            throw e;
        }

        setState(conn, versionId, MigrationState.APPLYING);
        LOG.info("Applying schema version {}: {}", versionId, v.description());
        long start = System.nanoTime();
        try (Statement st = conn.createStatement()) {
            for (String sql : statements) {
                LOG.debug("  {}", SqlScript.abbreviate(sql));
                st.execute(sql);
            }
        } catch (SQLException e) {
            LOG.error("Schema version {} failed, reverting: {}", versionId, e.getMessage());
            revertAfterFailure(conn, v, e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        markApplied(conn, v, elapsedMs);
        LOG.info("Schema version {} applied in {} ms", versionId, elapsedMs);
    }

    private void revertAfterFailure(Connection conn, SchemaVersion v, SQLException cause) throws SQLException {
        try {
            revertVisible(conn, v);
        } catch (SQLException rollbackFailure) {
            setState(conn, v.id(), MigrationState.ROLLBACK_FAILED);
            rollbackFailure.addSuppressed(cause);
            LOG.error("Reverting schema version {} failed; schema is fail-closed", v.id(), rollbackFailure);
            throw new MigrationException("Schema version " + v.id() + " failed and could not be reverted: "
                    + rollbackFailure.getMessage(), rollbackFailure, true);
        }
        setState(conn, v.id(), MigrationState.ROLLED_BACK);
        throw new MigrationException("Schema version " + v.id() + " failed and was reverted: " + cause.getMessage(), cause);
    }

    private void rollbackLocked(Connection conn, String versionId) throws SQLException {
        catalog.get(versionId);
        Map<String, Row> rows = readRows(conn);
        MigrationState state = stateOf(rows, versionId);
        if (state != MigrationState.APPLIED) {
            throw new MigrationException("Schema version " + versionId + " is not applied (" + state + ")");
        }
        Set<String> appliedDependents = catalog.dependentsOf(versionId).stream()
                .filter(dep -> stateOf(rows, dep) == MigrationState.APPLIED)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!appliedDependents.isEmpty()) {
            throw new DependencyException(versionId, appliedDependents,
                    "Schema version " + versionId + " is required by applied versions " + appliedDependents);
        }

        setState(conn, versionId, MigrationState.ROLLING_BACK);
        LOG.info("Rolling back schema version {}", versionId);
        try {
            revertVisible(conn, catalog.get(versionId));
        } catch (SQLException e) {
            setState(conn, versionId, MigrationState.ROLLBACK_FAILED);
            LOG.error("Rollback of schema version {} failed; schema is fail-closed", versionId, e);
            throw new MigrationException("Rollback of " + versionId + " failed: " + e.getMessage(), e, true);
        }
        setState(conn, versionId, MigrationState.PENDING);
        LOG.info("Schema version {} rolled back", versionId);
    }

    private List<String> recoverLocked(Connection conn) throws SQLException {
        List<String> recovered = new ArrayList<>();
        for (Row row : readRows(conn).values()) {
            if (!row.state().isInterrupted()) {
                continue;
            }
            Optional<SchemaVersion> found = catalog.find(row.id());
            if (found.isEmpty()) {
                LOG.warn("Interrupted schema version {} is not in the catalog; leaving it {}", row.id(), row.state());
                continue;
            }
            SchemaVersion v = found.get();
            switch (row.state()) {
                case VALIDATING -> setState(conn, v.id(), MigrationState.PENDING);
                case APPLYING -> recoverApplying(conn, v);
                case ROLLING_BACK -> {
                    try {
                        revertVisible(conn, v);
                    } catch (SQLException e) {
                        setState(conn, v.id(), MigrationState.ROLLBACK_FAILED);
                        throw new MigrationException("Resuming rollback of " + v.id() + " failed", e, true);
                    }
                    setState(conn, v.id(), MigrationState.PENDING);
                }
                default -> throw new IllegalStateException(row.state().toString());
            }
            LOG.info("Recovered schema version {} from {} to {}", v.id(), row.state(), stateOf(readRows(conn), v.id()));
            recovered.add(v.id());
        }
        return recovered;
    }

    private void recoverApplying(Connection conn, SchemaVersion v) throws SQLException {
        List<SchemaEffect> effects = new ArrayList<>();
        for (String sql : SqlScript.statements(v.upSql())) {
            SchemaEffect.of(sql).ifPresent(effects::add);
        }
        if (effects.isEmpty()) {
            throw new MigrationException("Cannot tell how far " + v.id()
                    + " got: its forward script has no recognisable schema effects", null, true);
        }
        SchemaSnapshot schema = SchemaInspector.inspect(conn);
        long visible = effects.stream().filter(e -> e.appliedIn(schema)).count();
        if (visible == effects.size()) {
            LOG.info("All {} effects of {} are in place; marking applied", visible, v.id());
            markApplied(conn, v, 0);
        } else if (visible == 0) {
            LOG.info("No effects of {} are in place; marking rolled back", v.id());
            setState(conn, v.id(), MigrationState.ROLLED_BACK);
        } else {
            LOG.warn("{} of {} effects of {} are in place; reverting them", visible, effects.size(), v.id());
            try {
                revertVisible(conn, v);
            } catch (SQLException e) {
                setState(conn, v.id(), MigrationState.ROLLBACK_FAILED);
                throw new MigrationException("Reverting partial " + v.id() + " failed", e, true);
            }
            setState(conn, v.id(), MigrationState.ROLLED_BACK);
        }
    }

    /**
     * Runs the reverse script, skipping statements whose result is already in place:
     * drops of absent objects and creates of present ones. Statements without a
     * recognisable target always run.
     */
    private static void revertVisible(Connection conn, SchemaVersion v) throws SQLException {
        SchemaSnapshot schema = SchemaInspector.inspect(conn);
        try (Statement st = conn.createStatement()) {
            for (String sql : SqlScript.statements(v.downSql())) {
                Optional<SchemaEffect> effect = SchemaEffect.of(sql);
                if (effect.isPresent() && effect.get().appliedIn(schema)) {
                    LOG.debug("  skip (already in place): {}", SqlScript.abbreviate(sql));
                    continue;
                }
                LOG.debug("  {}", SqlScript.abbreviate(sql));
                st.execute(sql);
                schema = SchemaInspector.inspect(conn);
            }
        }
    }

    private void requireOpen(Connection conn) throws SQLException {
        Set<String> failed = readRows(conn).values().stream()
                .filter(r -> r.state() == MigrationState.ROLLBACK_FAILED)
                .map(Row::id)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!failed.isEmpty()) {
            throw new MigrationException("Schema is fail-closed: rollback failed for " + failed
                    + "; repair the schema and the " + TABLE + " table manually", null, true);
        }
    }

    private boolean requiresMaintenanceMode(Connection conn, SchemaVersion v) throws SQLException {
        return v.requiresMaintenanceMode() || estimate(conn, v) > config.maintenanceThresholdSeconds();
    }

    private static long estimate(Connection conn, SchemaVersion v) throws SQLException {
        SchemaSnapshot schema = SchemaInspector.inspect(conn);
        long rows = 0;
        for (String table : v.affectedTables()) {
            rows += SchemaInspector.rowCount(conn, schema, table);
        }
        int factor = rows > HUGE_TABLE_ROWS ? 3 : rows > LARGE_TABLE_ROWS ? 2 : 1;
        return (long) v.estimatedDurationSeconds() * factor;
    }

    // ========================================================================
    // Bookkeeping
    // ========================================================================

    private List<String> pending(Connection conn) throws SQLException {
        Map<String, Row> rows = readRows(conn);
        List<String> pending = new ArrayList<>();
        for (SchemaVersion v : catalog.topologicalOrder()) {
            if (stateOf(rows, v.id()).isPending()) {
                pending.add(v.id());
            }
        }
        return pending;
    }

    private MigrationStatus status(Connection conn) throws SQLException {
        Map<String, Row> rows = readRows(conn);
        Map<String, MigrationState> states = new LinkedHashMap<>();
        List<String> pending = new ArrayList<>();
        List<String> mismatch = new ArrayList<>();
        for (SchemaVersion v : catalog.topologicalOrder()) {
            MigrationState state = stateOf(rows, v.id());
            states.put(v.id(), state);
            if (state.isPending()) {
                pending.add(v.id());
            }
            Row row = rows.get(v.id());
            if (state == MigrationState.APPLIED && row.checksum() != null && !row.checksum().equals(v.checksum())) {
                mismatch.add(v.id());
            }
        }
        boolean failClosed = rows.values().stream().anyMatch(r -> r.state() == MigrationState.ROLLBACK_FAILED);
        Optional<String> current = current(rows);
        String message = "current=" + current.orElse("(empty)") + ", pending=" + pending.size()
                + (failClosed ? ", FAIL-CLOSED" : "");
        return new MigrationStatus(current, states, pending, mismatch, failClosed, null, message);
    }

    private MigrationStatus safeStatus() {
        try {
            return status();
        } catch (ArchiveException e) {
            LOG.warn("Cannot read migration status: {}", e.getMessage());
            return new MigrationStatus(Optional.empty(), Map.of(), List.of(), List.of(), false, null, e.getMessage());
        }
    }

    private static Optional<String> current(Map<String, Row> rows) {
        return rows.values().stream()
                .filter(r -> r.state() == MigrationState.APPLIED)
                .max((a, b) -> Long.compare(a.applySeq(), b.applySeq()))
                .map(Row::id);
    }

    private static MigrationState stateOf(Map<String, Row> rows, String id) {
        Row row = rows.get(id);
        return row == null ? MigrationState.PENDING : row.state();
    }

    private static void ensureBookkeeping(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                    + "migration_id VARCHAR(255) PRIMARY KEY, "
                    + "status VARCHAR(32) NOT NULL, "
                    + "checksum VARCHAR(64), "
                    + "applied_at TIMESTAMP, "
                    + "apply_seq BIGINT, "
                    + "execution_time_ms BIGINT)");
        }
    }

    private static Map<String, Row> readRows(Connection conn) throws SQLException {
        Map<String, Row> rows = new HashMap<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT migration_id, status, checksum, apply_seq FROM " + TABLE)) {
            while (rs.next()) {
                String id = rs.getString(1);
                rows.put(id, new Row(id, MigrationState.valueOf(rs.getString(2)), rs.getString(3), rs.getLong(4)));
            }
        }
        return rows;
    }

    private static void setState(Connection conn, String id, MigrationState state) throws SQLException {
        try (PreparedStatement update = conn.prepareStatement(
                "UPDATE " + TABLE + " SET status = ? WHERE migration_id = ?")) {
            update.setString(1, state.name());
            update.setString(2, id);
            if (update.executeUpdate() > 0) {
                return;
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO " + TABLE + " (migration_id, status) VALUES (?, ?)")) {
            insert.setString(1, id);
            insert.setString(2, state.name());
            insert.executeUpdate();
        }
    }

    private void markApplied(Connection conn, SchemaVersion v, long elapsedMs) throws SQLException {
        long seq;
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(apply_seq), 0) FROM " + TABLE)) {
            rs.next();
            seq = rs.getLong(1) + 1;
        }
        setState(conn, v.id(), MigrationState.APPLIED);
        try (PreparedStatement ps = conn.prepareStatement("UPDATE " + TABLE
                + " SET checksum = ?, applied_at = ?, apply_seq = ?, execution_time_ms = ? WHERE migration_id = ?")) {
            ps.setString(1, v.checksum());
            ps.setObject(2, LocalDateTime.now(clock));
            ps.setLong(3, seq);
            ps.setLong(4, elapsedMs);
            ps.setString(5, v.id());
            ps.executeUpdate();
        }
    }

    // ========================================================================
    // Connection and lock handling
    // ========================================================================

    private <T> T unlocked(SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            ensureBookkeeping(conn);
            return work.run(conn);
        } catch (SQLException e) {
            throw new MigrationException("Migration bookkeeping query failed: " + e.getMessage(), e);
        }
    }

    private <T> T locked(SqlWork<T> work) {
        try (ExclusiveFileLock lock = ExclusiveFileLock.acquire(config.migrationLockFile(), config.lockTimeout());
             Connection conn = dataSource.getConnection()) {
            LOG.debug("Holding migration lock {}", lock.path());
            ensureBookkeeping(conn);
            return work.run(conn);
        } catch (SQLException e) {
            throw new MigrationException("Migration failed: " + e.getMessage(), e);
        }
    }
}
