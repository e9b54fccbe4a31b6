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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;

/**
 * Identifies one archive file of an entity type.
 *
 * @param at       the instant the partition is named after; null for single-file types
 * @param sequence conflict counter for per-instance files; 1 means no suffix
 */
public record PartitionKey(LocalDateTime at, int sequence) {

    private static final PartitionKey SINGLE = new PartitionKey(null, 1);

    public PartitionKey {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1: " + sequence);
        }
    }

    public static PartitionKey month(YearMonth month) {
        return new PartitionKey(month.atDay(1).atStartOfDay(), 1);
    }

    public static PartitionKey day(LocalDate day) {
        return new PartitionKey(day.atStartOfDay(), 1);
    }

    public static PartitionKey instance(LocalDateTime createdAt, int sequence) {
        return new PartitionKey(createdAt, sequence);
    }

    /** The partition containing {@code at}, whatever the partitioning. */
    public static PartitionKey containing(LocalDateTime at) {
        return new PartitionKey(at, 1);
    }

    public static PartitionKey single() {
        return SINGLE;
    }

    public PartitionKey withSequence(int next) {
        return new PartitionKey(at, next);
    }
}
