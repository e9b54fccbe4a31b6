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

/**
 * Identity used to match archived records against stored rows without surrogate ids.
 * <p>
 * Entity-keyed types use {@code (type, entityId)}. Event types add action, actor and the
 * occurrence time truncated to the minute, so a minute-precision archive line matches
 * a second-precision row written for the same event.
 *
 * @param minute start of the minute the event occurred in; null for entity-keyed types
 */
public record NaturalKey(EntityType type, String entityId, String action, String actor, LocalDateTime minute) {

    public static NaturalKey of(CanonicalRecord record) {
        if (record.type().entityKeyed()) {
            return new NaturalKey(record.type(), record.entityId(), null, null, null);
        }
        return new NaturalKey(record.type(), record.entityId(), record.action(), record.actor(),
                record.occurredAt().truncatedTo(ChronoUnit.MINUTES));
    }

    /** Key of an entity-keyed row. */
    public static NaturalKey entity(EntityType type, String entityId) {
        if (!type.entityKeyed()) {
            throw new IllegalArgumentException(type + " rows are keyed by event, not entity");
        }
        return new NaturalKey(type, entityId, null, null, null);
    }

    public boolean entityOnly() {
        return minute == null;
    }

    @Override
    public String toString() {
        return entityOnly()
                ? type + "[" + entityId + "]"
                : type + "[" + entityId + ", " + action + ", " + actor + ", " + minute + "]";
    }
}
