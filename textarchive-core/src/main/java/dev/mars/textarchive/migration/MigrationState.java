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

/**
 * Lifecycle of one schema version.
 * <pre>
 * PENDING -&gt; VALIDATING -&gt; APPLYING -&gt; APPLIED
 *                           APPLYING -&gt; ROLLED_BACK
 * APPLIED -&gt; ROLLING_BACK -&gt; PENDING
 * any rollback -&gt; ROLLBACK_FAILED   (fail-closed)
 * </pre>
 * {@code APPLYING} and {@code ROLLING_BACK} are committed before any DDL runs, so a
 * crash mid-way is visible at the next start.
 */
public enum MigrationState {
    PENDING,
    VALIDATING,
    APPLYING,
    APPLIED,
    ROLLING_BACK,
    ROLLED_BACK,
    ROLLBACK_FAILED;

    /** Versions in these states may be applied. */
    public boolean isPending() {
        return this == PENDING || this == ROLLED_BACK;
    }

    /** A crash left the version mid-operation. */
    public boolean isInterrupted() {
        return this == VALIDATING || this == APPLYING || this == ROLLING_BACK;
    }
}
