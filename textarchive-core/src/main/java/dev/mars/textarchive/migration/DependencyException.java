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

import java.util.Set;

/**
 * A schema version was applied before its dependencies, rolled back while dependents are
 * applied, or the dependency graph itself is broken (unknown id, cycle).
 */
public class DependencyException extends ArchiveException {

    private final String versionId;
    private final Set<String> blocking;

    public DependencyException(String versionId, Set<String> blocking, String message) {
        super(message);
        this.versionId = versionId;
        this.blocking = Set.copyOf(blocking);
    }

    public String versionId() {
        return versionId;
    }

    /** The versions that prevented the operation. */
    public Set<String> blocking() {
        return blocking;
    }
}
