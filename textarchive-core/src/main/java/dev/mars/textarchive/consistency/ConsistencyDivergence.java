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
package dev.mars.textarchive.consistency;

import dev.mars.textarchive.archive.EntityType;

/**
 * One difference between archive and store.
 *
 * @param kind        what is wrong
 * @param type        table the difference concerns
 * @param key         natural key (archive side) or row id (store side)
 * @param archivePath archive file involved, relative to the root; null for rows without one
 * @param lineNumber  archive line, or 0 for store-side differences
 */
public record ConsistencyDivergence(Kind kind, EntityType type, String key, String archivePath, int lineNumber) {

    public enum Kind {
        /** An archived record with no matching row. */
        MISSING_CANONICAL_ROW,
        /** A row with no archive path. */
        MISSING_ARCHIVE_PATH,
        /** A row whose archive path names no existing file. */
        UNRESOLVED_ARCHIVE_PATH
    }

    @Override
    public String toString() {
        return kind + " " + key + (archivePath == null ? "" : " @ " + archivePath
                + (lineNumber > 0 ? ":" + lineNumber : ""));
    }
}
