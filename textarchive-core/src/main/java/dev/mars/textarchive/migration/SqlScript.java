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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits migration scripts into statements and checks forward scripts are structural.
 * <p>
 * Statements end with {@code ;}. Line comments ({@code --}) are dropped. Semicolons inside
 * string literals are not supported; schema scripts do not need them.
 */
final class SqlScript {

    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\r\\n]*");

    private static final List<String> FORBIDDEN_PREFIXES = List.of(
            "DELETE", "TRUNCATE", "UPDATE", "INSERT", "MERGE", "DROP TABLE");

    private SqlScript() {
    }

    static List<String> statements(String script) {
        String stripped = LINE_COMMENT.matcher(script).replaceAll("");
        List<String> statements = new ArrayList<>();
        for (String part : stripped.split(";")) {
            String sql = part.strip();
            if (!sql.isEmpty()) {
                statements.add(sql);
            }
        }
        return statements;
    }

    /**
     * Rejects statements that change or remove data. Data transformations run through
     * {@link MigrationManager#runDataMigration} instead.
     *
     * @throws MigrationException naming the first offending statement
     */
    static void requireStructural(String versionId, List<String> statements) {
        for (String sql : statements) {
            String normalized = sql.replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
            for (String prefix : FORBIDDEN_PREFIXES) {
                if (normalized.startsWith(prefix + " ") || normalized.equals(prefix)) {
                    throw new MigrationException("Schema version " + versionId
                            + " contains a non-structural statement (" + prefix + "): " + abbreviate(sql));
                }
            }
        }
    }

    static String abbreviate(String sql) {
        String oneLine = sql.replaceAll("\\s+", " ");
        return oneLine.length() <= 80 ? oneLine : oneLine.substring(0, 77) + "...";
    }
}
