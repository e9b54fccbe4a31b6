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

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tables, columns and indexes of a schema at one point in time. All names are lower case.
 *
 * @param columns columns by table name
 */
public record SchemaSnapshot(Set<String> tables, Map<String, Set<String>> columns, Set<String> indexes) {

    public SchemaSnapshot {
        tables = Set.copyOf(tables);
        columns = Map.copyOf(columns);
        indexes = Set.copyOf(indexes);
    }

    public boolean hasTable(String table) {
        return tables.contains(table.toLowerCase(Locale.ROOT));
    }

    public boolean hasColumn(String table, String column) {
        Set<String> cols = columns.get(table.toLowerCase(Locale.ROOT));
        return cols != null && cols.contains(column.toLowerCase(Locale.ROOT));
    }

    public boolean hasIndex(String index) {
        return indexes.contains(index.toLowerCase(Locale.ROOT));
    }
}
