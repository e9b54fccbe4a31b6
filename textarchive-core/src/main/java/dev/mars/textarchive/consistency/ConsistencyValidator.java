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

import dev.mars.textarchive.archive.ArchiveLayout;
import dev.mars.textarchive.archive.ArchiveReader;
import dev.mars.textarchive.archive.EntityType;
import dev.mars.textarchive.archive.ParsedArchive;
import dev.mars.textarchive.archive.ParsedEvent;
import dev.mars.textarchive.store.CanonicalRecord;
import dev.mars.textarchive.store.CanonicalStore;
import dev.mars.textarchive.store.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares archive files with the store.
 * <p>
 * Validation only reports; it never changes either side. The one repair action,
 * {@link #backfillArchivePaths(EntityType)}, has to be invoked explicitly.
 */
public final class ConsistencyValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ConsistencyValidator.class);

    private final ArchiveReader reader;
    private final CanonicalStore store;

    public ConsistencyValidator(ArchiveReader reader, CanonicalStore store) {
        this.reader = reader;
        this.store = store;
    }

    /**
     * Checks every record parsed from {@code type}'s archive files against the store, and
     * every row of {@code type}'s table for a resolvable archive path. Placeholder users
     * and default roles are not expected to have one.
     */
    public DivergenceReport validate(EntityType type) {
        ArchiveLayout layout = reader.layout();
        List<ConsistencyDivergence> divergences = new ArrayList<>();
        long archived = 0;

        for (Path partition : reader.partitions(type)) {
            String rel = layout.relativize(partition);
            try (ParsedArchive.Cursor events = reader.parse(type, partition).open()) {
                while (events.hasNext()) {
                    if (!(events.next() instanceof ParsedEvent parsed)) {
                        continue;
                    }
                    archived++;
                    CanonicalRecord record = parsed.toRecord(rel);
                    if (store.find(record.naturalKey()).isEmpty()) {
                        divergences.add(new ConsistencyDivergence(ConsistencyDivergence.Kind.MISSING_CANONICAL_ROW,
                                parsed.type(), record.naturalKey().toString(), rel, parsed.lineNumber()));
                    }
                }
            }
        }

        List<StoredRecord> rows = store.findAll(type);
        for (StoredRecord row : rows) {
            String path = row.record().archivePath();
            if (path == null) {
                if (!row.record().isPlaceholder() && !row.record().isDefaultRole()) {
                    divergences.add(new ConsistencyDivergence(ConsistencyDivergence.Kind.MISSING_ARCHIVE_PATH,
                            type, "id=" + row.id(), null, 0));
                }
            } else if (!resolves(layout, path)) {
                divergences.add(new ConsistencyDivergence(ConsistencyDivergence.Kind.UNRESOLVED_ARCHIVE_PATH,
                        type, "id=" + row.id(), path, 0));
            }
        }

        DivergenceReport report = new DivergenceReport(type, archived, rows.size(), divergences);
        if (report.isConsistent()) {
            LOG.debug("{} consistent: {} archived records, {} rows", type, archived, rows.size());
        } else {
            LOG.warn("{} diverges: {} differences ({} archived records, {} rows)",
                    type, divergences.size(), archived, rows.size());
            divergences.forEach(d -> LOG.debug("  {}", d));
        }
        return report;
    }

    /** Validates every entity type. */
    public Map<EntityType, DivergenceReport> validateAll() {
        Map<EntityType, DivergenceReport> reports = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            reports.put(type, validate(type));
        }
        return reports;
    }

    public StoreSnapshot snapshot() {
        Map<EntityType, Long> counts = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            counts.put(type, store.count(type));
        }
        return new StoreSnapshot(counts);
    }

    /**
     * Sets the archive path of rows that lack one, from the archive files of
     * {@code type} that contain their record.
     *
     * @return rows updated
     */
    public int backfillArchivePaths(EntityType type) {
        ArchiveLayout layout = reader.layout();
        int updated = 0;
        for (Path partition : reader.partitions(type)) {
            String rel = layout.relativize(partition);
            try (ParsedArchive.Cursor events = reader.parse(type, partition).open()) {
                while (events.hasNext()) {
                    if (!(events.next() instanceof ParsedEvent parsed)) {
                        continue;
                    }
                    Optional<StoredRecord> row = store.find(parsed.toRecord(rel).naturalKey());
                    if (row.isPresent() && row.get().record().archivePath() == null && !row.get().record().isPlaceholder()
                            && store.updateArchivePath(parsed.type(), row.get().id(), rel)) {
                        updated++;
                    }
                }
            }
        }
        LOG.info("Backfilled archive paths of {} rows from {} archives", updated, type);
        return updated;
    }

    private static boolean resolves(ArchiveLayout layout, String path) {
        try {
            return Files.isRegularFile(layout.resolve(path));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
