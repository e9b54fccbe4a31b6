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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of migration bookkeeping.
 *
 * @param currentVersion   most recently applied version, empty on a fresh database
 * @param states           state of every catalogued version, in apply order
 * @param pending          versions that may still be applied, in apply order
 * @param checksumMismatch applied versions whose scripts changed since they were applied
 * @param failClosed       a rollback failed; nothing may proceed
 * @param decision         startup outcome, when produced by {@code migrateOnStartup}
 * @param message          human-readable summary
 */
public record MigrationStatus(
        Optional<String> currentVersion,
        Map<String, MigrationState> states,
        List<String> pending,
        List<String> checksumMismatch,
        boolean failClosed,
        StartupDecision decision,
        String message) {

    public MigrationStatus withDecision(StartupDecision decision, String message) {
        return new MigrationStatus(currentVersion, states, pending, checksumMismatch, failClosed, decision, message);
    }
}
