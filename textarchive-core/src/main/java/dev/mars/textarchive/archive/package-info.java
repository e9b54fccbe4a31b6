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
/**
 * Human-readable text archive: the durable source of truth for every record.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.textarchive.archive.ArchiveWriter} - Appends and atomic snapshot replaces</li>
 *   <li>{@link dev.mars.textarchive.archive.ArchiveReader} - Tolerant, restartable parsing</li>
 *   <li>{@link dev.mars.textarchive.archive.EntityType} - File family, partitioning and grammar per record type</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Archive first:</b> A record reaches the store only after its archive write is durable</li>
 *   <li><b>Never fatal:</b> A malformed line is reported and skipped, never aborts a file</li>
 *   <li><b>One writer per file:</b> Appends to a file are serialized across threads and processes</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * archive/
 *  ├─ users/2024_06_users.txt                       // monthly registrations
 *  ├─ prayers/2024/06/2024_06_15_prayer_at_1430.txt  // one file per prayer, activity appended
 *  ├─ activity/activity_2024_06.txt                 // site activity, grouped by date
 *  ├─ auth/2024_06_15_sessions_snapshot.txt         // daily snapshot (atomic replace)
 *  ├─ auth/2024_06_auth_requests.txt                // pipe-delimited monthly logs
 *  └─ system/invite_tokens.txt                      // single snapshot (atomic replace)
 * </pre>
 */
package dev.mars.textarchive.archive;
