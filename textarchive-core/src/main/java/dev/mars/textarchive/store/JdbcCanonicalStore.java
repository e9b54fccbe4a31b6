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
package dev.mars.textarchive.store;

import dev.mars.textarchive.archive.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CanonicalStore} over plain JDBC.
 * <p>
 * Every entity type maps to one table with the common columns
 * {@code id, entity_id, action, actor, occurred_at, archive_path} followed by the
 * type's business columns (see {@link EntityType#columns()}). Each upsert runs in its
 * own transaction: the lookup and the write see the same state.
 */
public final class JdbcCanonicalStore implements CanonicalStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcCanonicalStore.class);

    private static final String COMMON_COLUMNS = "id, entity_id, action, actor, occurred_at, archive_path";

    private final DataSource dataSource;

    public JdbcCanonicalStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    public DataSource dataSource() {
        return dataSource;
    }

    @Override
    public Optional<StoredRecord> find(NaturalKey key) {
        try (Connection conn = dataSource.getConnection()) {
            return find(conn, key);
        } catch (SQLException e) {
            throw new StoreException("Lookup failed for " + key, e);
        }
    }

    @Override
    public UpsertResult upsert(CanonicalRecord record, boolean updateExisting) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                UpsertResult result = upsert(conn, record, updateExisting);
                conn.commit();
                LOG.trace("{} {}", result, record.naturalKey());
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new ConstraintViolationException(record, e);
            }
            throw new StoreException("Upsert failed for " + record.naturalKey(), e);
        }
    }

    @Override
    public List<StoredRecord> findAll(EntityType type) {
        String sql = "SELECT " + selectList(type) + " FROM " + type.table() + " ORDER BY id";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<StoredRecord> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(read(type, rs));
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException("Cannot read " + type.table(), e);
        }
    }

    @Override
    public long count(EntityType type) {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + type.table())) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new StoreException("Cannot count " + type.table(), e);
        }
    }

    @Override
    public boolean updateArchivePath(EntityType type, long id, String archivePath) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "UPDATE " + type.table() + " SET archive_path = ? WHERE id = ?")) {
            ps.setString(1, archivePath);
            ps.setLong(2, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Cannot set archive path of " + type.table() + "#" + id, e);
        }
    }

    @Override
    public int deleteAll(EntityType type) {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            int deleted = st.executeUpdate("DELETE FROM " + type.table());
            LOG.info("Deleted {} rows from {}", deleted, type.table());
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Cannot clear " + type.table(), e);
        }
    }

    // ========================================================================
    // Upsert
    // ========================================================================

    private UpsertResult upsert(Connection conn, CanonicalRecord record, boolean updateExisting) throws SQLException {
        Optional<StoredRecord> found = find(conn, record.naturalKey());
        if (found.isEmpty()) {
            insert(conn, record);
            return UpsertResult.INSERTED;
        }
        StoredRecord stored = found.get();
        CanonicalRecord existing = stored.record();

        if (record.isPlaceholder()) {
            return UpsertResult.UNCHANGED;
        }
        if (existing.isPlaceholder() || (updateExisting && differs(existing, record))) {
            String path = record.archivePath() != null ? record.archivePath() : existing.archivePath();
            LocalDateTime occurredAt = sameMinute(existing.occurredAt(), record.occurredAt())
                    ? existing.occurredAt()
                    : record.occurredAt();
            update(conn, stored.id(), record, occurredAt, path);
            return UpsertResult.UPDATED;
        }
        if (existing.archivePath() == null && record.archivePath() != null) {
            updateArchivePath(conn, record.type(), stored.id(), record.archivePath());
            return UpsertResult.UPDATED;
        }
        return UpsertResult.UNCHANGED;
    }

    private static boolean differs(CanonicalRecord existing, CanonicalRecord record) {
        return !existing.fields().equals(record.fields())
                || !existing.action().equals(record.action())
                || !existing.actor().equals(record.actor())
                || !sameMinute(existing.occurredAt(), record.occurredAt())
                || (record.archivePath() != null && !record.archivePath().equals(existing.archivePath()));
    }

    private static boolean sameMinute(LocalDateTime a, LocalDateTime b) {
        return a.truncatedTo(ChronoUnit.MINUTES).equals(b.truncatedTo(ChronoUnit.MINUTES));
    }

    private static void insert(Connection conn, CanonicalRecord record) throws SQLException {
        EntityType type = record.type();
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(type.table())
                .append(" (entity_id, action, actor, occurred_at, archive_path");
        for (String column : type.columns()) {
            sql.append(", ").append(column);
        }
        sql.append(") VALUES (?, ?, ?, ?, ?");
        sql.append(", ?".repeat(type.columns().size())).append(')');

        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            ps.setString(1, record.entityId());
            ps.setString(2, record.action());
            ps.setString(3, record.actor());
            ps.setObject(4, record.occurredAt());
            ps.setString(5, record.archivePath());
            int i = 6;
            for (String column : type.columns()) {
                ps.setString(i++, record.field(column));
            }
            ps.executeUpdate();
        }
    }

    private static void update(Connection conn, long id, CanonicalRecord record,
                               LocalDateTime occurredAt, String archivePath) throws SQLException {
        EntityType type = record.type();
        StringBuilder sql = new StringBuilder("UPDATE ").append(type.table())
                .append(" SET action = ?, actor = ?, occurred_at = ?, archive_path = ?");
        for (String column : type.columns()) {
            sql.append(", ").append(column).append(" = ?");
        }
        sql.append(" WHERE id = ?");

        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            ps.setString(1, record.action());
            ps.setString(2, record.actor());
            ps.setObject(3, occurredAt);
            ps.setString(4, archivePath);
            int i = 5;
            for (String column : type.columns()) {
                ps.setString(i++, record.field(column));
            }
            ps.setLong(i, id);
            ps.executeUpdate();
        }
    }

    private static void updateArchivePath(Connection conn, EntityType type, long id, String path) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE " + type.table() + " SET archive_path = ? WHERE id = ?")) {
            ps.setString(1, path);
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    private static Optional<StoredRecord> find(Connection conn, NaturalKey key) throws SQLException {
        EntityType type = key.type();
        String sql = "SELECT " + selectList(type) + " FROM " + type.table()
                + (key.entityOnly()
                ? " WHERE entity_id = ?"
                : " WHERE entity_id = ? AND action = ? AND actor = ? AND occurred_at >= ? AND occurred_at < ?")
                + " ORDER BY id";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.entityId());
            if (!key.entityOnly()) {
                ps.setString(2, key.action());
                ps.setString(3, key.actor());
                ps.setObject(4, key.minute());
                ps.setObject(5, key.minute().plusMinutes(1));
            }
            ps.setMaxRows(1);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(type, rs)) : Optional.empty();
            }
        }
    }

    private static String selectList(EntityType type) {
        StringBuilder sb = new StringBuilder(COMMON_COLUMNS);
        for (String column : type.columns()) {
            sb.append(", ").append(column);
        }
        return sb.toString();
    }

    private static StoredRecord read(EntityType type, ResultSet rs) throws SQLException {
        Map<String, String> fields = new HashMap<>();
        for (String column : type.columns()) {
            fields.put(column, rs.getString(column));
        }
        CanonicalRecord record = new CanonicalRecord(
                type,
                rs.getString("entity_id"),
                rs.getString("action"),
                rs.getString("actor"),
                rs.getObject("occurred_at", LocalDateTime.class),
                fields,
                rs.getString("archive_path"));
        return new StoredRecord(rs.getLong("id"), record);
    }

    static boolean isConstraintViolation(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("23")) {
                return true;
            }
        }
        return false;
    }
}
