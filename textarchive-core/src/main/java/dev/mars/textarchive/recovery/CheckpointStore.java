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

import dev.mars.textarchive.DurableFiles;
import dev.mars.textarchive.archive.ArchiveIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persists {@link RecoveryCheckpoint} as a small text file, replaced atomically on
 * every save:
 * <pre>
 * # textarchive recovery checkpoint
 * failed=prayers/2024/06/2024_06_15_prayer_at_1430.txt
 * done=users/2024_06_users.txt
 * </pre>
 */
public final class CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointStore.class);

    private static final String HEADER = "# textarchive recovery checkpoint";
    private static final String DONE = "done=";
    private static final String FAILED = "failed=";

    private final Path file;
    private final boolean sync;

    public CheckpointStore(Path file, boolean sync) {
        this.file = file;
        this.sync = sync;
    }

    public Path file() {
        return file;
    }

    public synchronized Optional<RecoveryCheckpoint> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Set<String> done = new LinkedHashSet<>();
            String failed = null;
            for (String line : lines) {
                if (line.startsWith(DONE)) {
                    done.add(line.substring(DONE.length()));
                } else if (line.startsWith(FAILED)) {
                    failed = line.substring(FAILED.length());
                } else if (!line.isBlank() && !line.startsWith("#")) {
                    LOG.warn("Ignoring unrecognised checkpoint line: {}", line);
                }
            }
            LOG.info("Loaded recovery checkpoint {}: {} partitions done, failed={}", file, done.size(), failed);
            return Optional.of(new RecoveryCheckpoint(done, failed));
        } catch (IOException e) {
            throw new ArchiveIOException("Cannot read recovery checkpoint " + file, e);
        }
    }

    public synchronized void save(RecoveryCheckpoint checkpoint) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        if (checkpoint.failedPartition() != null) {
            sb.append(FAILED).append(checkpoint.failedPartition()).append('\n');
        }
        for (String partition : checkpoint.completed()) {
            sb.append(DONE).append(partition).append('\n');
        }
        try {
            DurableFiles.replaceAtomically(file, sb.toString().getBytes(StandardCharsets.UTF_8),
                    sync, DurableFiles.RenameHook.NONE);
        } catch (IOException e) {
            throw new ArchiveIOException("Cannot write recovery checkpoint " + file, e);
        }
        LOG.trace("Checkpoint saved: {} partitions done", checkpoint.completed().size());
    }

    public synchronized void delete() {
        try {
            if (Files.deleteIfExists(file)) {
                LOG.debug("Deleted recovery checkpoint {}", file);
            }
        } catch (IOException e) {
            throw new ArchiveIOException("Cannot delete recovery checkpoint " + file, e);
        }
    }
}
