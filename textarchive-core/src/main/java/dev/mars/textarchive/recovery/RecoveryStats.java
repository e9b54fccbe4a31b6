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
package dev.mars.textarchive.recovery;

import dev.mars.textarchive.archive.EntityType;
import dev.mars.textarchive.archive.UnparsedLine;
import dev.mars.textarchive.store.UpsertResult;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Mutable counters shared by the workers of one run.
 */
final class RecoveryStats {

    private static final int PARTITIONS = 0;
    private static final int PARSED = 1;
    private static final int INSERTED = 2;
    private static final int UPDATED = 3;
    private static final int UNCHANGED = 4;
    private static final int UNPARSED = 5;
    private static final int PLACEHOLDERS = 6;

    private final Map<EntityType, AtomicLongArray> counters = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<RecoveryReport.UnparsedEntry> unparsed = new ConcurrentLinkedQueue<>();
    private final AtomicInteger skipped = new AtomicInteger();

    void partition(EntityType type) {
        add(type, PARTITIONS);
    }

    void skippedPartition() {
        skipped.incrementAndGet();
    }

    void parsed(EntityType type) {
        add(type, PARSED);
    }

    void unparsed(EntityType fileType, String archivePath, UnparsedLine line) {
        add(fileType, UNPARSED);
        unparsed.add(new RecoveryReport.UnparsedEntry(archivePath, line));
    }

    void placeholder(EntityType type) {
        add(type, PLACEHOLDERS);
    }

    void upserted(EntityType type, UpsertResult result) {
        add(type, switch (result) {
            case INSERTED -> INSERTED;
            case UPDATED -> UPDATED;
            case UNCHANGED -> UNCHANGED;
        });
    }

    int skippedPartitions() {
        return skipped.get();
    }

    Map<EntityType, RecoveryReport.TypeCounts> counts() {
        Map<EntityType, RecoveryReport.TypeCounts> out = new EnumMap<>(EntityType.class);
        counters.forEach((type, c) -> out.put(type, new RecoveryReport.TypeCounts(
                c.get(PARTITIONS), c.get(PARSED), c.get(INSERTED), c.get(UPDATED), c.get(UNCHANGED),
                c.get(UNPARSED), c.get(PLACEHOLDERS))));
        return out;
    }

    List<RecoveryReport.UnparsedEntry> unparsed() {
        return List.copyOf(unparsed);
    }

    private void add(EntityType type, int slot) {
        counters.computeIfAbsent(type, t -> new AtomicLongArray(7)).incrementAndGet(slot);
    }
}
