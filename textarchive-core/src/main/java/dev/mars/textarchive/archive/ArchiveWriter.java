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

import dev.mars.textarchive.ArchiveConfig;
import dev.mars.textarchive.DurableFiles;
import dev.mars.textarchive.ExclusiveFileLock;
import dev.mars.textarchive.archive.grammar.ArchiveGrammar;
import dev.mars.textarchive.store.CanonicalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durably writes entity state to the partitioned text archive.
 * <p>
 * <b>Durability Guarantees:</b>
 * <ul>
 *   <li><b>Whole files</b> ({@link #createOrReplace}, {@link #snapshot}) are written to
 *       {@code <file>.tmp}, fsynced, renamed over the target with {@code ATOMIC_MOVE} and
 *       the directory is fsynced. A crash leaves either the old file or the new one.</li>
 *   <li><b>Appends</b> take an exclusive lock on the target (in-process and OS level), write
 *       the header if the file is new, write the record text in one call, force it to disk
 *       and release. Concurrent appenders to one file never interleave within a line.</li>
 *   <li>A method that returns has made its write durable (unless sync is disabled).
 *       Any filesystem failure raises {@link ArchiveIOException}.</li>
 * </ul>
 * <p>
 * Appends to different files never block each other. Whole-file writes to the same
 * partition are not serialized here; callers do that.
 *
 * @see ArchiveReader
 */
public final class ArchiveWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveWriter.class);

    private final ArchiveConfig config;
    private final ArchiveLayout layout;
    private final Clock clock;
    private final boolean syncEnabled;

    /** Per-instance paths handed out by {@link #newInstanceKey} but not yet created. */
    private final Set<String> reserved = ConcurrentHashMap.newKeySet();

    private volatile DurableFiles.RenameHook renameHook = DurableFiles.RenameHook.NONE;

    public ArchiveWriter(ArchiveConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public ArchiveWriter(ArchiveConfig config, Clock clock) {
        this.config = config;
        this.layout = new ArchiveLayout(config.archiveDir());
        this.clock = clock;
        this.syncEnabled = config.syncEnabled();

        LOG.info("ArchiveWriter initialized: root={}, syncEnabled={}", layout.root(), syncEnabled);
        if (!syncEnabled) {
            LOG.warn("ArchiveWriter created with fsync DISABLED. Do NOT use in production!");
        }
    }

    public ArchiveLayout layout() {
        return layout;
    }

    /** Test hook run after the temp file is durable and before the rename. */
    void setRenameHook(DurableFiles.RenameHook hook) {
        this.renameHook = hook == null ? DurableFiles.RenameHook.NONE : hook;
    }

    // ========================================================================
    // Append
    // ========================================================================

    /**
     * Appends one record to the partition of {@code fileType} named by {@code key}.
     * <p>
     * The record's own type may differ from {@code fileType}: prayer activity is appended
     * to the prayer's file.
     *
     * @return the absolute path written
     * @throws ArchiveIOException if the file cannot be written, or must exist and does not
     * @throws dev.mars.textarchive.LockTimeoutException if the file stays locked past the timeout
     */
    public Path append(EntityType fileType, PartitionKey key, CanonicalRecord record) {
        Path target = layout.resolve(fileType, key);
        if (!fileType.grammar().appendCreatesFile() && !Files.isRegularFile(target)) {
            LOG.error("Cannot append {} to missing archive {}", record.action(), target);
            throw new ArchiveIOException("Archive file not found: " + target);
        }
        return appendTo(fileType, target, key, record);
    }

    /**
     * Appends one record to an existing partition named by its path relative to the
     * archive root, such as the stored archive path of a prayer.
     *
     * @throws IllegalArgumentException if the path is not a partition of {@code fileType}
     * @throws ArchiveIOException       if the file does not exist or cannot be written
     */
    public Path append(EntityType fileType, String relativePath, CanonicalRecord record) {
        if (!fileType.isPartition(relativePath)) {
            throw new IllegalArgumentException(relativePath + " is not a " + fileType + " archive");
        }
        Path target = layout.resolve(relativePath);
        if (!Files.isRegularFile(target)) {
            LOG.error("Cannot append {} to missing archive {}", record.action(), target);
            throw new ArchiveIOException("Archive file not found: " + target);
        }
        return appendTo(fileType, target, PartitionKey.containing(record.occurredAt()), record);
    }

    private Path appendTo(EntityType fileType, Path target, PartitionKey key, CanonicalRecord record) {
        ArchiveGrammar grammar = fileType.grammar();
        try (ExclusiveFileLock lock = ExclusiveFileLock.acquire(target, config.lockTimeout())) {
            FileChannel ch = lock.channel();
            long size = ch.size();

            StringBuilder text = new StringBuilder();
            String existing = "";
            if (size == 0) {
                text.append(grammar.header(key));
            } else {
                if (grammar.readsExistingContent()) {
                    existing = readAll(ch, size);
                }
                if (lastByte(ch, size) != '\n') {
                    text.append('\n');
                }
            }
            text.append(grammar.formatAppend(record, existing));

            ByteBuffer buf = ByteBuffer.wrap(text.toString().getBytes(StandardCharsets.UTF_8));
            long position = size;
            while (buf.hasRemaining()) {
                position += ch.write(buf, position);
            }
            if (syncEnabled) {
                ch.force(true);
                if (size == 0) {
                    DurableFiles.syncDirectory(target.getParent());
                }
            }
            LOG.debug("Appended {} {} to {}", record.type(), record.action(), layout.relativize(target));
            return target;
        } catch (IOException e) {
            LOG.error("Failed to append to archive {}: {}", target, e.getMessage(), e);
            throw new ArchiveIOException("Failed to append to " + target, e);
        }
    }

    // ========================================================================
    // Whole-file writes
    // ========================================================================

    /**
     * Atomically creates or replaces a partition with {@code content}.
     *
     * @return the absolute path written
     */
    public Path createOrReplace(EntityType type, PartitionKey key, String content) {
        Path target = layout.resolve(type, key);
        String relative = layout.relativize(target);
        try {
            DurableFiles.replaceAtomically(target, content.getBytes(StandardCharsets.UTF_8), syncEnabled, renameHook);
            LOG.debug("Wrote {} ({} chars)", relative, content.length());
            return target;
        } catch (IOException e) {
            LOG.error("Failed to write archive {}: {}", target, e.getMessage(), e);
            deleteTemp(target);
            throw new ArchiveIOException("Failed to write " + target, e);
        } finally {
            reserved.remove(relative);
        }
    }

    /**
     * Renders {@code records} with the type's grammar and replaces the partition.
     * Used for per-instance files and full-state snapshots.
     */
    public Path snapshot(EntityType type, PartitionKey key, List<CanonicalRecord> records) {
        String content = type.grammar().render(key, records, LocalDateTime.now(clock));
        Path path = createOrReplace(type, key, content);
        LOG.info("Wrote {} snapshot with {} records: {}", type, records.size(), layout.relativize(path));
        return path;
    }

    /**
     * Picks the first free per-instance file name for an entity created at {@code createdAt}.
     * Names already handed out and not yet written are skipped, so concurrent creators in
     * the same minute get {@code _2}, {@code _3} ... suffixes.
     */
    public synchronized PartitionKey newInstanceKey(EntityType type, LocalDateTime createdAt) {
        if (type.partitioning() != Partitioning.PER_INSTANCE) {
            throw new IllegalArgumentException(type + " is not partitioned per instance");
        }
        PartitionKey key = PartitionKey.instance(createdAt, 1);
        while (true) {
            String relative = type.relativePath(key);
            if (!Files.exists(layout.resolve(relative)) && reserved.add(relative)) {
                return key;
            }
            key = key.withSequence(key.sequence() + 1);
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static String readAll(FileChannel ch, long size) throws IOException {
        if (size > Integer.MAX_VALUE) {
            throw new IOException("Archive file too large to scan: " + size + " bytes");
        }
        ByteBuffer buf = ByteBuffer.allocate((int) size);
        long position = 0;
        while (buf.hasRemaining()) {
            int n = ch.read(buf, position);
            if (n < 0) {
                break;
            }
            position += n;
        }
        return new String(buf.array(), 0, buf.position(), StandardCharsets.UTF_8);
    }

    private static byte lastByte(FileChannel ch, long size) throws IOException {
        ByteBuffer one = ByteBuffer.allocate(1);
        ch.read(one, size - 1);
        return one.get(0);
    }

    private void deleteTemp(Path target) {
        Path tmp = target.resolveSibling(target.getFileName() + DurableFiles.TMP_SUFFIX);
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
