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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Parses archive files into typed event sequences.
 * <p>
 * Parsing has no side effects on the archive. The only state kept is a running count
 * of unparsed lines across all files read through this reader.
 */
public final class ArchiveReader {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveReader.class);

    private final ArchiveLayout layout;
    private final AtomicLong unparsedLines = new AtomicLong();

    public ArchiveReader(ArchiveConfig config) {
        this(new ArchiveLayout(config.archiveDir()));
    }

    public ArchiveReader(ArchiveLayout layout) {
        this.layout = layout;
    }

    public ArchiveLayout layout() {
        return layout;
    }

    /**
     * Events of one file, parsed with {@code type}'s grammar.
     *
     * @throws ArchiveIOException if the file does not exist
     */
    public ParsedArchive parse(EntityType type, Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ArchiveIOException("Archive file not found: " + path);
        }
        LOG.debug("Parsing {} archive {}", type, path);
        return new ParsedArchive(type, path, unparsedLines);
    }

    /** Existing partitions of {@code type}, oldest first. */
    public List<Path> partitions(EntityType type) {
        return layout.partitions(type);
    }

    /** Unparsed lines seen so far. A file iterated twice counts twice. */
    public long unparsedLineCount() {
        return unparsedLines.get();
    }
}
