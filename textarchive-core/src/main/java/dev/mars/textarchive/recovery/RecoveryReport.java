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
import dev.mars.textarchive.consistency.DivergenceReport;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one recovery run.
 *
 * @param counts            per-type counters; a type appears once any event of it was parsed
 * @param unparsed          every skipped line with the file it came from
 * @param divergence        validation result per type; empty for dry runs and cancelled runs
 * @param skippedPartitions partitions already done according to the checkpoint
 * @param dryRun            whether the store was left untouched
 * @param cancelled         whether the run stopped on {@link RecoveryOrchestrator#cancel()}
 * @param elapsed           wall-clock time
 */
public record RecoveryReport(
        Map<EntityType, TypeCounts> counts,
        List<UnparsedEntry> unparsed,
        Map<EntityType, DivergenceReport> divergence,
        int skippedPartitions,
        boolean dryRun,
        boolean cancelled,
        Duration elapsed) {

    /**
     * Counters of one entity type.
     *
     * @param partitions   archive files of this type replayed
     * @param parsed       events parsed whose projection is this type
     * @param inserted     rows created
     * @param updated      rows changed
     * @param unchanged    events that matched an existing row
     * @param unparsed     lines skipped in this type's files
     * @param placeholders placeholder users created while replaying this type
     */
    public record TypeCounts(long partitions, long parsed, long inserted, long updated, long unchanged,
                             long unparsed, long placeholders) {

        public static final TypeCounts ZERO = new TypeCounts(0, 0, 0, 0, 0, 0, 0);
    }

    /** A skipped line and its file, relative to the archive root. */
    public record UnparsedEntry(String archivePath, UnparsedLine line) {
    }

    public RecoveryReport {
        counts = byType(counts);
        unparsed = List.copyOf(unparsed);
        divergence = byType(divergence);
    }

    private static <V> Map<EntityType, V> byType(Map<EntityType, V> source) {
        Map<EntityType, V> copy = new EnumMap<>(EntityType.class);
        copy.putAll(source);
        return Collections.unmodifiableMap(copy);
    }

    public TypeCounts counts(EntityType type) {
        return counts.getOrDefault(type, TypeCounts.ZERO);
    }

    public long totalParsed() {
        return counts.values().stream().mapToLong(TypeCounts::parsed).sum();
    }

    public long totalInserted() {
        return counts.values().stream().mapToLong(TypeCounts::inserted).sum();
    }

    public boolean isConsistent() {
        return divergence.values().stream().allMatch(DivergenceReport::isConsistent);
    }
}
