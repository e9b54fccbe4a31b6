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
package dev.mars.textarchive.archive;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Resolution at which an archived timestamp was recorded.
 */
public enum TimestampPrecision {

    /** Human-readable archive lines ({@code June 15 2024 at 14:30}). */
    MINUTE(ChronoUnit.MINUTES),

    /** ISO timestamps in pipe-delimited logs. */
    SECOND(ChronoUnit.SECONDS);

    private final ChronoUnit unit;

    TimestampPrecision(ChronoUnit unit) {
        this.unit = unit;
    }

    public LocalDateTime truncate(LocalDateTime value) {
        return value.truncatedTo(unit);
    }

    public ChronoUnit unit() {
        return unit;
    }
}
