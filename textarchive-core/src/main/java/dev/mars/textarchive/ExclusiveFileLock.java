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
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock on a file, held both inside this JVM and at the OS level.
 * <p>
 * <b>Two layers:</b>
 * <ul>
 *   <li>A per-path {@link ReentrantLock} serializes threads of this process. OS advisory
 *       locks are held per JVM, so two threads could otherwise both "own" the file.</li>
 *   <li>A {@link FileLock} on the channel excludes other processes.</li>
 * </ul>
 * Both layers are acquired with one deadline. On expiry a {@link LockTimeoutException}
 * is raised and nothing is held.
 * <p>
 * The channel is opened for read and write without truncation, so the lock holder
 * may append through {@link #channel()}.
 *
 * <pre>
 * try (ExclusiveFileLock lock = ExclusiveFileLock.acquire(path, Duration.ofSeconds(5))) {
 *     lock.channel().write(buffer, lock.channel().size());
 * }
 * </pre>
 */
public final class ExclusiveFileLock implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExclusiveFileLock.class);

    private static final long RETRY_INTERVAL_MS = 10;

    // Entries live while some thread holds or waits for the path
    private static final ConcurrentHashMap<Path, LocalLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private static final class LocalLock {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    private final Path path;
    private final LocalLock localLock;
    private final FileChannel channel;
    private final FileLock fileLock;

    private ExclusiveFileLock(Path path, LocalLock localLock, FileChannel channel, FileLock fileLock) {
        this.path = path;
        this.localLock = localLock;
        this.channel = channel;
        this.fileLock = fileLock;
    }

    /**
     * Acquires the lock, creating the file and its parent directories if necessary.
     *
     * @param path    the file to lock
     * @param timeout maximum wait for both lock layers
     * @return the held lock; close it to release
     * @throws LockTimeoutException if the deadline passes
     * @throws ArchiveException     if the file cannot be opened
     */
    public static ExclusiveFileLock acquire(Path path, Duration timeout) {
        Path key = path.toAbsolutePath().normalize();
        long deadline = System.nanoTime() + timeout.toNanos();
        LocalLock local = LOCAL_LOCKS.compute(key, (k, existing) -> {
            LocalLock entry = existing != null ? existing : new LocalLock();
            entry.users++;
            return entry;
        });

        try {
            if (!local.lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                release(key, local, false);
                LOG.warn("Lock wait expired inside this process: {}", key);
                throw new LockTimeoutException(key, timeout);
            }
        } catch (InterruptedException e) {
            release(key, local, false);
            Thread.currentThread().interrupt();
            throw new ArchiveException("Interrupted while waiting for lock on " + key, e);
        }

        FileChannel channel = null;
        try {
            Path parent = key.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(key,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);

            while (true) {
                FileLock fileLock;
                try {
                    fileLock = channel.tryLock();
                } catch (OverlappingFileLockException e) {
                    // Another channel of this JVM holds it outside the local lock registry
                    fileLock = null;
                }
                if (fileLock != null) {
                    LOG.trace("Exclusive lock acquired: {}", key);
                    return new ExclusiveFileLock(key, local, channel, fileLock);
                }
                if (System.nanoTime() >= deadline) {
                    LOG.warn("Lock wait expired, another process holds {}", key);
                    throw new LockTimeoutException(key, timeout);
                }
                Thread.sleep(RETRY_INTERVAL_MS);
            }
        } catch (IOException e) {
            closeQuietly(channel);
            release(key, local, true);
            throw new ArchiveException("Cannot open lock file " + key, e);
        } catch (InterruptedException e) {
            closeQuietly(channel);
            release(key, local, true);
            Thread.currentThread().interrupt();
            throw new ArchiveException("Interrupted while waiting for lock on " + key, e);
        } catch (RuntimeException e) {
            closeQuietly(channel);
            release(key, local, true);
            throw e;
        }
    }

    /** Drops this thread's use of the in-process lock; the entry goes when nobody uses it. */
    private static void release(Path key, LocalLock local, boolean held) {
        if (held) {
            local.lock.unlock();
        }
        LOCAL_LOCKS.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    /** Paths with an in-process lock entry. */
    static int trackedPaths() {
        return LOCAL_LOCKS.size();
    }

    /** The locked file. */
    public Path path() {
        return path;
    }

    /** Read/write channel on the locked file, valid until {@link #close()}. */
    public FileChannel channel() {
        return channel;
    }

    @Override
    public void close() {
        try {
            if (fileLock.isValid()) {
                fileLock.release();
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock on {}: {}", path, e.getMessage());
        } finally {
            closeQuietly(channel);
            release(path, localLock, true);
            LOG.trace("Exclusive lock released: {}", path);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null || !channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }
}
