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

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Relational projection of one archived entity or event.
 *
 * @param type        entity type, selects the table
 * @param entityId    the entity the row is about (user name, prayer id, session id ...)
 * @param action      what happened; for entity-keyed types a fixed verb such as {@code registered}
 * @param actor       who did it; for user-referencing types a user name
 * @param occurredAt  when it happened, at second precision
 * @param fields      business columns by column name; absent means NULL
 * @param archivePath archive file holding the record, relative to the archive root; null for
 *                    legacy rows and placeholders
 */
public record CanonicalRecord(
        EntityType type,
        String entityId,
        String action,
        String actor,
        LocalDateTime occurredAt,
        Map<String, String> fields,
        String archivePath) {

    public static final String REGISTRATION_TYPE = "registration_type";
    public static final String PLACEHOLDER = "placeholder";
    public static final String SYSTEM_ACTOR = "system";

    public CanonicalRecord {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(occurredAt, "occurredAt");
        occurredAt = occurredAt.truncatedTo(ChronoUnit.SECONDS);
        Map<String, String> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (v != null) {
                    copy.put(k, v);
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public static CanonicalRecord of(EntityType type, String entityId, String action, String actor,
                                     LocalDateTime occurredAt, Map<String, String> fields) {
        return new CanonicalRecord(type, entityId, action, actor, occurredAt, fields, null);
    }

    /**
     * A stand-in user row for a reference seen before the user's registration.
     * Replaced in place when the registration is recovered.
     */
    public static CanonicalRecord placeholderUser(String userName, LocalDateTime seenAt) {
        return of(EntityType.USER, userName, "registered", userName, seenAt,
                Map.of(REGISTRATION_TYPE, PLACEHOLDER));
    }

    /**
     * The {@code admin} and {@code user} roles created when no role definitions were
     * ever archived.
     */
    public static List<CanonicalRecord> defaultRoles(LocalDateTime at) {
        return List.of(
                systemRole("admin", "System administrator with full access", "[\"*\"]", at),
                systemRole("user", "Standard user with basic permissions", "[\"read\", \"write_own\", \"pray\"]", at));
    }

    private static CanonicalRecord systemRole(String name, String description, String permissions, LocalDateTime at) {
        return of(EntityType.ROLE, name, "defined", SYSTEM_ACTOR, at,
                Map.of("description", description, "permissions", permissions, "is_system_role", "true"));
    }

    public String field(String name) {
        return fields.get(name);
    }

    public boolean isPlaceholder() {
        return type == EntityType.USER && PLACEHOLDER.equals(fields.get(REGISTRATION_TYPE));
    }

    /** A system role created by recovery rather than read from an archive. */
    public boolean isDefaultRole() {
        return type == EntityType.ROLE && archivePath == null && SYSTEM_ACTOR.equals(actor)
                && "true".equals(fields.get("is_system_role"));
    }

    public NaturalKey naturalKey() {
        return NaturalKey.of(this);
    }

    public CanonicalRecord withArchivePath(String path) {
        return new CanonicalRecord(type, entityId, action, actor, occurredAt, fields, path);
    }
}
