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

import dev.mars.textarchive.archive.grammar.LineParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The events of one archive file.
 * <p>
 * Lazy: lines are read only as the iterator advances. Restartable: every call to
 * {@link #iterator()} re-opens the file and parses it from the first line, so the
 * same instance can be walked by recovery and again by validation.
 * <p>
 * A cursor closes the file when it is exhausted. Callers whose loop body can throw
 * should use {@link #open()} in a try-with-resources block so the file is closed on
 * every path.
 */
public final class ParsedArchive implements Iterable<ArchiveEvent> {

    private final EntityType type;
    private final Path path;
    private final AtomicLong unparsedCounter;

    ParsedArchive(EntityType type, Path path, AtomicLong unparsedCounter) {
        this.type = type;
        this.path = path;
        this.unparsedCounter = unparsedCounter;
    }

    public EntityType type() {
        return type;
    }

    public Path path() {
        return path;
    }

    @Override
    public Iterator<ArchiveEvent> iterator() {
        return new Cursor();
    }

    /** Opens the file for one pass. Closing the cursor releases the file early. */
    public Cursor open() {
        return new Cursor();
    }

    /** Reads the whole file. */
    public List<ArchiveEvent> toList() {
        List<ArchiveEvent> events = new ArrayList<>();
        try (Cursor cursor = open()) {
            cursor.forEachRemaining(events::add);
        }
        return events;
    }

    /** One pass over the file. */
    public final class Cursor implements Iterator<ArchiveEvent>, AutoCloseable {

        private final ArrayDeque<ArchiveEvent> pending = new ArrayDeque<>();
        private final LineParser parser = type.grammar().newParser();
        private BufferedReader reader;
        private int lineNumber;
        private boolean done;
        private boolean closed;

        private Cursor() {
            try {
                // Malformed bytes decode to U+FFFD instead of aborting the pass
                reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new ArchiveIOException("Cannot open archive " + path, e);
            }
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !done) {
                advance();
            }
            return !pending.isEmpty();
        }

        @Override
        public ArchiveEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private void advance() {
            try {
                String line = reader.readLine();
                if (line == null) {
                    done = true;
                    reader.close();
                    parser.finish(this::emit);
                    return;
                }
                lineNumber++;
                parser.accept(lineNumber, line, this::emit);
            } catch (IOException e) {
                close();
                throw new ArchiveIOException("Failed reading " + path + " at line " + (lineNumber + 1), e);
            }
        }

        private void emit(ArchiveEvent event) {
            if (event instanceof UnparsedLine) {
                unparsedCounter.incrementAndGet();
            }
            pending.add(event);
        }

        /** Idempotent. A closed cursor yields no further events. */
        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            done = true;
            pending.clear();
            try {
                reader.close();
            } catch (IOException e) {
                throw new ArchiveIOException("Cannot close archive " + path, e);
            }
        }
    }
}
