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
package dev.mars.textarchive.migration;

import dev.mars.textarchive.ArchiveException;

/**
 * A schema migration failed.
 * <p>
 * When {@link #failClosed()} is true the schema is in an unknown state (a rollback failed)
 * and no further migration or startup may proceed until an operator intervenes.
 */
public class MigrationException extends ArchiveException {

    private final boolean failClosed;

    public MigrationException(String message) {
        this(message, null, false);
    }

    public MigrationException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public MigrationException(String message, Throwable cause, boolean failClosed) {
        super(message, cause);
        this.failClosed = failClosed;
    }

    public boolean failClosed() {
        return failClosed;
    }
}
