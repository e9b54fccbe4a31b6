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
package dev.mars.textarchive.store;

/**
 * A write was rejected by an integrity constraint, typically a foreign key to a
 * user that does not exist yet.
 */
public class ConstraintViolationException extends StoreException {

    private final CanonicalRecord record;

    public ConstraintViolationException(CanonicalRecord record, Throwable cause) {
        super("Constraint violation writing " + record.naturalKey() + ": " + cause.getMessage(), cause);
        this.record = record;
    }

    /** The record whose write was rejected. */
    public CanonicalRecord record() {
        return record;
    }
}
