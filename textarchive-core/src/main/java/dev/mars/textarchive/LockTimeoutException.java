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

import java.nio.file.Path;
import java.time.Duration;

/**
 * Thrown when an exclusive lock could not be acquired within the configured timeout.
 */
public class LockTimeoutException extends ArchiveException {

    private final Path lockPath;

    public LockTimeoutException(Path lockPath, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms waiting for lock on " + lockPath);
        this.lockPath = lockPath;
    }

    public Path lockPath() {
        return lockPath;
    }
}
