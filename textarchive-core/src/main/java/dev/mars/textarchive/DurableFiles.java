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
package dev.mars.textarchive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Durable file primitives shared by the archive writer and the recovery checkpoint.
 * <p>
 * {@link #replaceAtomically} follows the temp-file protocol:
 * <ol>
 *   <li>write {@code <target>.tmp} and fsync it</li>
 *   <li>rename it over the target with {@code ATOMIC_MOVE}</li>
 *   <li>fsync the parent directory so the rename itself survives a crash</li>
 * </ol>
 * A reader therefore sees either the previous file or the complete new one.
 */
public final class DurableFiles {

    private static final Logger LOG = LoggerFactory.getLogger(DurableFiles.class);

    /** Suffix of the temporary file written before the rename. */
    public static final String TMP_SUFFIX = ".tmp";

    /**
     * Invoked between fsync of the temporary file and the rename. Lets tests
     * simulate a crash at the point where only the temporary file exists.
     */
    @FunctionalInterface
    public interface RenameHook {
        RenameHook NONE = tmp -> { };

        void beforeRename(Path tmp) throws IOException;
    }

    private DurableFiles() {
    }

    /**
     * Atomically replaces {@code target} with {@code content}.
     *
     * @param target the file to create or replace
     * @param content full new content
     * @param sync whether to fsync file and directory
     * @param hook called after the temp file is durable, before rename
     */
    public static void replaceAtomically(Path target, byte[] content, boolean sync, RenameHook hook) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);

        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            writeFully(ch, ByteBuffer.wrap(content));
            if (sync) {
                ch.force(true);
            }
        }

        hook.beforeRename(tmp);

        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.trace("Atomic rename: {} -> {}", tmp, target);

        if (sync) {
            syncDirectory(parent);
        }
    }

    /**
     * Writes the whole buffer at the current channel position.
     */
    public static void writeFully(FileChannel ch, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            ch.write(buf);
        }
    }

    /**
     * Fsyncs a directory so renames and creations inside it are durable.
     * Not supported on Windows, where it is skipped.
     */
    public static void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
