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

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the current schema through JDBC {@link DatabaseMetaData}, limited to the
 * connection's own schema.
 */
public final class SchemaInspector {

    private SchemaInspector() {
    }

    public static SchemaSnapshot inspect(Connection conn) throws SQLException {
        DatabaseMetaData md = conn.getMetaData();
        String catalog = conn.getCatalog();
        String schema = conn.getSchema();

        Set<String> tables = new HashSet<>();
        Map<String, String> actualNames = new HashMap<>();
        try (ResultSet rs = md.getTables(catalog, schema, "%", null)) {
            while (rs.next()) {
                String type = rs.getString("TABLE_TYPE");
                if ("TABLE".equalsIgnoreCase(type) || "BASE TABLE".equalsIgnoreCase(type)) {
                    String name = rs.getString("TABLE_NAME");
                    tables.add(name.toLowerCase(Locale.ROOT));
                    actualNames.put(name.toLowerCase(Locale.ROOT), name);
                }
            }
        }

        Map<String, Set<String>> columns = new HashMap<>();
        try (ResultSet rs = md.getColumns(catalog, schema, "%", "%")) {
            while (rs.next()) {
                String table = rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT);
                if (tables.contains(table)) {
                    columns.computeIfAbsent(table, t -> new HashSet<>())
                            .add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
            }
        }

        Set<String> indexes = new HashSet<>();
        for (String table : actualNames.values()) {
            try (ResultSet rs = md.getIndexInfo(catalog, schema, table, false, true)) {
                while (rs.next()) {
                    String index = rs.getString("INDEX_NAME");
                    if (index != null) {
                        indexes.add(index.toLowerCase(Locale.ROOT));
                    }
                }
            }
        }
        return new SchemaSnapshot(tables, columns, indexes);
    }

    /** Row count of {@code table}, or 0 when it does not exist. */
    public static long rowCount(Connection conn, SchemaSnapshot schema, String table) throws SQLException {
        if (!schema.hasTable(table)) {
            return 0;
        }
        try (var st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
