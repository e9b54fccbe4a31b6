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

import java.util.List;
import java.util.Optional;

/**
 * Access to the relational store, the rebuildable projection of the archive.
 * <p>
 * All matching is by {@link NaturalKey}. Rows are never duplicated by replaying the
 * same archive record.
 */
public interface CanonicalStore {

    /** The row matching {@code key}, if any. Event keys match anywhere within their minute. */
    Optional<StoredRecord> find(NaturalKey key);

    /**
     * Inserts {@code record} unless a row with its natural key exists.
     * <p>
     * An existing row is changed only when:
     * <ul>
     *   <li>it is a placeholder user and {@code record} is the real registration,</li>
     *   <li>it has no archive path and {@code record} has one,</li>
     *   <li>{@code updateExisting} is set and its fields differ.</li>
     * </ul>
     * The stored occurrence time is kept when it falls in the same minute as the record's.
     *
     * @throws ConstraintViolationException if an integrity constraint rejects the write
     */
    UpsertResult upsert(CanonicalRecord record, boolean updateExisting);

    /** All rows of {@code type} in id order. */
    List<StoredRecord> findAll(EntityType type);

    long count(EntityType type);

    /** Sets the archive path of one row. */
    boolean updateArchivePath(EntityType type, long id, String archivePath);

    /** Deletes every row of {@code type}. */
    int deleteAll(EntityType type);
}
