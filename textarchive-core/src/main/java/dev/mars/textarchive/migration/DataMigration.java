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

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A data transformation, kept apart from structural schema versions.
 * <p>
 * Runs under the migration lock in a single transaction. The transaction is rolled back
 * if the number of sessions would shrink, so a data migration never logs users out.
 */
@FunctionalInterface
public interface DataMigration {

    /**
     * @param conn connection with auto-commit off; do not commit or close it
     */
    void migrate(Connection conn) throws SQLException;

    default String name() {
        return getClass().getSimpleName();
    }
}
