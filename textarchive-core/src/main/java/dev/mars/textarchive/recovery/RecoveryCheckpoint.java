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

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Progress marker of an interrupted recovery.
 *
 * @param completed       partitions fully replayed, relative to the archive root
 * @param failedPartition partition that stopped the last run, or null
 */
public record RecoveryCheckpoint(Set<String> completed, String failedPartition) {

    public RecoveryCheckpoint {
        completed = Collections.unmodifiableSet(new TreeSet<>(completed));
    }

    public static RecoveryCheckpoint empty() {
        return new RecoveryCheckpoint(Set.of(), null);
    }

    public boolean isCompleted(String partition) {
        return completed.contains(partition);
    }
}
