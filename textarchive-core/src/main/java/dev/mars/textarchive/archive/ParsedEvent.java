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
package dev.mars.textarchive.archive;

import dev.mars.textarchive.store.CanonicalRecord;

import java.util.Map;

/**
 * A successfully parsed archive line (or block, for prayer headers).
 *
 * @param type       projection target; may differ from the file's type, e.g. a prayer file
 *                   yields marks and attributes from its activity section
 * @param lineNumber line the event starts on
 * @param timestamp  when it happened, with the precision it was written at
 */
public record ParsedEvent(
        EntityType type,
        int lineNumber,
        ArchiveTimestamp timestamp,
        String entityId,
        String actor,
        String action,
        Map<String, String> fields) implements ArchiveEvent {

    public ParsedEvent {
        fields = fields == null ? Map.of() : fields;
    }

    /** Free-text detail, for activity entries. */
    public String detail() {
        return fields.get("detail");
    }

    public CanonicalRecord toRecord(String archivePath) {
        return new CanonicalRecord(type, entityId, action, actor, timestamp.value(), fields, archivePath);
    }
}
