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
import java.util.Objects;

/**
 * A timestamp read from an archive together with the precision it was written at.
 *
 * @param value     the parsed value, already truncated to {@code precision}
 * @param precision resolution of the source text
 */
public record ArchiveTimestamp(LocalDateTime value, TimestampPrecision precision) {

    public ArchiveTimestamp {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(precision, "precision");
        value = precision.truncate(value);
    }

    public static ArchiveTimestamp ofMinute(LocalDateTime value) {
        return new ArchiveTimestamp(value, TimestampPrecision.MINUTE);
    }

    public static ArchiveTimestamp ofSecond(LocalDateTime value) {
        return new ArchiveTimestamp(value, TimestampPrecision.SECOND);
    }

    /**
     * Whether a stored value denotes the same instant at this timestamp's precision.
     * A minute-precision archive value matches any stored second within that minute.
     */
    public boolean matches(LocalDateTime stored) {
        return stored != null && precision.truncate(stored).equals(value);
    }
}
