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
package dev.mars.textarchive.archive.grammar;

import dev.mars.textarchive.archive.PartitionKey;
import dev.mars.textarchive.archive.TimestampPrecision;
import dev.mars.textarchive.store.CanonicalRecord;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Text format of one kind of archive file, both directions.
 * <p>
 * Writing is split into the header of a new file, the text appended for one record,
 * and (for files replaced as a whole) a full rendering. Reading goes through a fresh
 * {@link LineParser} per pass over a file.
 */
public interface ArchiveGrammar {

    /** A parser positioned before the first line. */
    LineParser newParser();

    /** Precision of the timestamps this grammar writes. */
    TimestampPrecision precision();

    /** Header written when an append creates the file; empty when there is none. */
    String header(PartitionKey key);

    /**
     * Text appended for {@code record}, ending with a line separator.
     *
     * @param existingContent current file content when {@link #readsExistingContent()}, else empty
     */
    String formatAppend(CanonicalRecord record, String existingContent);

    /** Whether {@link #formatAppend} needs the current file content. */
    default boolean readsExistingContent() {
        return false;
    }

    /** Whether an append may create the file. Files that start with a full rendering may not. */
    default boolean appendCreatesFile() {
        return true;
    }

    /**
     * Full file content for files created or replaced as a whole.
     *
     * @param now rendering time, shown in snapshot titles
     */
    default String render(PartitionKey key, List<CanonicalRecord> records, LocalDateTime now) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " files are append-only");
    }
}
