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
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The schema object a DDL statement creates or drops, recognised from its text.
 * Used to tell how far an interrupted migration got.
 *
 * @param creates true for CREATE and ADD statements, false for DROP statements
 */
record SchemaEffect(Kind kind, String table, String name, boolean creates) {

    enum Kind { TABLE, COLUMN, INDEX }

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern CREATE_TABLE = Pattern.compile(
            "^CREATE\\s+TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?(\\w+).*", FLAGS);
    private static final Pattern DROP_TABLE = Pattern.compile(
            "^DROP\\s+TABLE\\s+(?:IF\\s+EXISTS\\s+)?(\\w+).*", FLAGS);
    private static final Pattern ADD_COLUMN = Pattern.compile(
            "^ALTER\\s+TABLE\\s+(\\w+)\\s+ADD\\s+(?:COLUMN\\s+)?(?:IF\\s+NOT\\s+EXISTS\\s+)?(\\w+).*", FLAGS);
    private static final Pattern DROP_COLUMN = Pattern.compile(
            "^ALTER\\s+TABLE\\s+(\\w+)\\s+DROP\\s+(?:COLUMN\\s+)?(?:IF\\s+EXISTS\\s+)?(\\w+).*", FLAGS);
    private static final Pattern CREATE_INDEX = Pattern.compile(
            "^CREATE\\s+(?:UNIQUE\\s+)?INDEX\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?(\\w+)\\s+ON\\s+(\\w+).*", FLAGS);
    private static final Pattern DROP_INDEX = Pattern.compile(
            "^DROP\\s+INDEX\\s+(?:IF\\s+EXISTS\\s+)?(\\w+).*", FLAGS);

    private static final Set<String> NOT_COLUMNS = Set.of("constraint", "primary", "foreign", "unique", "check");

    /**
     * The object {@code sql} creates or drops, if the statement is one of the recognised
     * forms. {@code ALTER TABLE ... ADD CONSTRAINT} and other statements yield empty.
     */
    static Optional<SchemaEffect> of(String sql) {
        String s = sql.strip();
        Matcher m;
        if ((m = CREATE_TABLE.matcher(s)).matches()) {
            return Optional.of(new SchemaEffect(Kind.TABLE, lower(m.group(1)), lower(m.group(1)), true));
        }
        if ((m = DROP_TABLE.matcher(s)).matches()) {
            return Optional.of(new SchemaEffect(Kind.TABLE, lower(m.group(1)), lower(m.group(1)), false));
        }
        if ((m = ADD_COLUMN.matcher(s)).matches()) {
            return column(m, true);
        }
        if ((m = DROP_COLUMN.matcher(s)).matches()) {
            return column(m, false);
        }
        if ((m = CREATE_INDEX.matcher(s)).matches()) {
            return Optional.of(new SchemaEffect(Kind.INDEX, lower(m.group(2)), lower(m.group(1)), true));
        }
        if ((m = DROP_INDEX.matcher(s)).matches()) {
            return Optional.of(new SchemaEffect(Kind.INDEX, null, lower(m.group(1)), false));
        }
        return Optional.empty();
    }

    private static Optional<SchemaEffect> column(Matcher m, boolean creates) {
        String column = lower(m.group(2));
        if (NOT_COLUMNS.contains(column)) {
            return Optional.empty();
        }
        return Optional.of(new SchemaEffect(Kind.COLUMN, lower(m.group(1)), column, creates));
    }

    /** Whether the target object exists in {@code schema}. */
    boolean presentIn(SchemaSnapshot schema) {
        return switch (kind) {
            case TABLE -> schema.hasTable(name);
            case COLUMN -> schema.hasColumn(table, name);
            case INDEX -> schema.hasIndex(name);
        };
    }

    /**
     * Whether {@code schema} already shows this statement's result: the object exists
     * after a create, and is gone after a drop.
     */
    boolean appliedIn(SchemaSnapshot schema) {
        return presentIn(schema) == creates;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
