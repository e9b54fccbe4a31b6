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

/**
 * How the records of one entity type are spread over archive files.
 */
public enum Partitioning {
    /** One file per entity instance, e.g. one file per prayer. */
    PER_INSTANCE,
    /** One append-only file per calendar month. */
    MONTHLY,
    /** One snapshot file per day. */
    DAILY,
    /** A single file, replaced as a whole. */
    SINGLE
}
