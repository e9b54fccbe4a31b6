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
package dev.mars.textarchive.consistency;

import dev.mars.textarchive.archive.EntityType;

import java.util.List;

/**
 * Result of validating one entity type.
 *
 * @param type           the validated type (its archive files and its table)
 * @param archiveRecords parsed records found in the type's archive files
 * @param canonicalRows  rows in the type's table
 * @param divergences    every difference found
 */
public record DivergenceReport(EntityType type, long archiveRecords, long canonicalRows,
                               List<ConsistencyDivergence> divergences) {

    public DivergenceReport {
        divergences = List.copyOf(divergences);
    }

    public boolean isConsistent() {
        return divergences.isEmpty();
    }

    public long count(ConsistencyDivergence.Kind kind) {
        return divergences.stream().filter(d -> d.kind() == kind).count();
    }
}
