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

import dev.mars.textarchive.archive.EntityType;

/**
 * Observable progress of a recovery run.
 *
 * @param phase     lifecycle phase
 * @param type      type being (or last) recovered; null before the first partition
 * @param partition archive path relative to the root; null before the first partition
 * @param cause     failure cause when {@link Phase#FAILED}
 */
public record RecoveryState(Phase phase, EntityType type, String partition, Throwable cause) {

    public enum Phase {
        NOT_STARTED,
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    public static final RecoveryState NOT_STARTED = new RecoveryState(Phase.NOT_STARTED, null, null, null);

    static RecoveryState running(EntityType type, String partition) {
        return new RecoveryState(Phase.RUNNING, type, partition, null);
    }

    static RecoveryState failed(EntityType type, String partition, Throwable cause) {
        return new RecoveryState(Phase.FAILED, type, partition, cause);
    }

    RecoveryState withPhase(Phase next) {
        return new RecoveryState(next, type, partition, null);
    }
}
