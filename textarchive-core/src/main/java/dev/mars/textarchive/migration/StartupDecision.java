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
 * What the process should do after {@link MigrationManager#migrateOnStartup()}.
 */
public enum StartupDecision {
    /** Schema is current; serve normally. */
    SERVE,
    /** Migrations failed but the schema is intact; serve and alert. */
    SERVE_DEGRADED,
    /** Maintenance mode is required or the schema is fail-closed; do not serve. */
    BLOCKED
}
