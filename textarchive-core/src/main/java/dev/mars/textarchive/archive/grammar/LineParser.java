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
package dev.mars.textarchive.archive.grammar;

import dev.mars.textarchive.archive.ArchiveEvent;

import java.util.function.Consumer;

/**
 * Stateful, single-pass parser fed one line at a time.
 */
public interface LineParser {

    /**
     * @param lineNumber 1-based
     * @param line       the line without its terminator
     * @param out        receives zero or more events
     */
    void accept(int lineNumber, String line, Consumer<ArchiveEvent> out);

    /** Called once after the last line. */
    default void finish(Consumer<ArchiveEvent> out) {
    }
}
