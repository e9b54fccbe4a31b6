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

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExclusiveFileLockTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Acquire creates the file and its parent directories")
    void testCreatesFile() {
        Path lockFile = tempDir.resolve("a/b/.lock");
        try (ExclusiveFileLock lock = ExclusiveFileLock.acquire(lockFile, Duration.ofSeconds(1))) {
            assertTrue(Files.exists(lockFile));
            assertTrue(lock.channel().isOpen());
        }
    }

    @Test
    @DisplayName("Lock held by another thread times out with LockTimeoutException")
    void testTimeout() throws Exception {
        Path lockFile = tempDir.resolve(".lock");
        int before = ExclusiveFileLock.trackedPaths();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> {
            try (ExclusiveFileLock ignored = ExclusiveFileLock.acquire(lockFile, Duration.ofSeconds(1))) {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));

        try {
            LockTimeoutException e = assertThrows(LockTimeoutException.class,
                    () -> ExclusiveFileLock.acquire(lockFile, Duration.ofMillis(100)));
            assertEquals(lockFile.toAbsolutePath().normalize(), e.lockPath());
            assertEquals(before + 1, ExclusiveFileLock.trackedPaths());
        } finally {
            release.countDown();
            holder.join(5000);
        }
    }

    @Test
    @DisplayName("Lock can be re-acquired after release")
    void testReacquire() {
        Path lockFile = tempDir.resolve(".lock");
        ExclusiveFileLock.acquire(lockFile, Duration.ofSeconds(1)).close();
        try (ExclusiveFileLock again = ExclusiveFileLock.acquire(lockFile, Duration.ofMillis(100))) {
            assertEquals(lockFile.toAbsolutePath().normalize(), again.path());
        }
    }

    @Test
    @DisplayName("Released locks leave no in-process entry behind")
    void testEntriesDropped() {
        int before = ExclusiveFileLock.trackedPaths();
        for (int i = 0; i < 50; i++) {
            Path file = tempDir.resolve("prayers/p" + i + ".txt");
            try (ExclusiveFileLock ignored = ExclusiveFileLock.acquire(file, Duration.ofSeconds(1))) {
                assertEquals(before + 1, ExclusiveFileLock.trackedPaths());
            }
        }
        assertEquals(before, ExclusiveFileLock.trackedPaths());
    }
}
