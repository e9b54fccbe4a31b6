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

import dev.mars.textarchive.ArchiveConfig;

/**
 * Per-run recovery settings.
 *
 * @param updateExisting overwrite existing rows whose fields differ from the archive
 * @param dryRun         parse and count only; neither the store nor the checkpoint is touched
 * @param parallelism    entity types recovered concurrently within one stage
 */
public record RecoveryOptions(boolean updateExisting, boolean dryRun, int parallelism) {

    public RecoveryOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        }
    }

    public static RecoveryOptions defaults(ArchiveConfig config) {
        return new RecoveryOptions(false, false, config.recoveryParallelism());
    }

    public RecoveryOptions withUpdateExisting(boolean flag) {
        return new RecoveryOptions(flag, dryRun, parallelism);
    }

    public RecoveryOptions withDryRun(boolean flag) {
        return new RecoveryOptions(updateExisting, flag, parallelism);
    }

    public RecoveryOptions withParallelism(int threads) {
        return new RecoveryOptions(updateExisting, dryRun, threads);
    }
}
