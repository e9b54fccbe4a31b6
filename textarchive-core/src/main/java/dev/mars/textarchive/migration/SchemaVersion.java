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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One structural change to the relational schema.
 *
 * @param id                       unique, sortable identifier such as {@code 005_archive_path_columns}
 * @param upSql                    forward script; structural statements only
 * @param downSql                  reverse script
 * @param dependsOn                versions that must be applied first
 * @param requiresMaintenanceMode  declared need to stop serving while applying
 * @param estimatedDurationSeconds declared duration on an empty database
 * @param affectedTables           tables whose row counts scale the estimate
 */
public record SchemaVersion(
        String id,
        String description,
        String upSql,
        String downSql,
        Set<String> dependsOn,
        boolean requiresMaintenanceMode,
        int estimatedDurationSeconds,
        List<String> affectedTables) {

    public SchemaVersion {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(upSql, "upSql");
        description = description == null ? "" : description;
        downSql = downSql == null ? "" : downSql;
        dependsOn = Set.copyOf(dependsOn == null ? Set.of() : dependsOn);
        affectedTables = List.copyOf(affectedTables == null ? List.of() : affectedTables);
        if (dependsOn.contains(id)) {
            throw new IllegalArgumentException(id + " depends on itself");
        }
    }

    /**
     * SHA-256 over both scripts and the metadata, hex encoded. Recorded at apply time;
     * a different value later means the version was edited after it was applied.
     */
    public String checksum() {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            String canonical = upSql
                    + "\n-- down\n" + downSql
                    + "\n-- meta\n" + description
                    + "|" + new TreeSet<>(dependsOn)
                    + "|" + requiresMaintenanceMode
                    + "|" + estimatedDurationSeconds
                    + "|" + affectedTables;
            return HexFormat.of().formatHex(sha.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Programmatic construction, mainly for tests and embedded catalogs.
     */
    public static final class Builder {
        private final String id;
        private String description = "";
        private String upSql = "";
        private String downSql = "";
        private final Set<String> dependsOn = new LinkedHashSet<>();
        private boolean requiresMaintenanceMode;
        private int estimatedDurationSeconds = 1;
        private final List<String> affectedTables = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder up(String sql) {
            this.upSql = sql;
            return this;
        }

        public Builder down(String sql) {
            this.downSql = sql;
            return this;
        }

        public Builder dependsOn(String... ids) {
            this.dependsOn.addAll(List.of(ids));
            return this;
        }

        public Builder requiresMaintenanceMode(boolean flag) {
            this.requiresMaintenanceMode = flag;
            return this;
        }

        public Builder estimatedDurationSeconds(int seconds) {
            this.estimatedDurationSeconds = seconds;
            return this;
        }

        public Builder affectedTables(String... tables) {
            this.affectedTables.addAll(List.of(tables));
            return this;
        }

        public SchemaVersion build() {
            return new SchemaVersion(id, description, upSql, downSql, dependsOn,
                    requiresMaintenanceMode, estimatedDurationSeconds, affectedTables);
        }
    }
}
