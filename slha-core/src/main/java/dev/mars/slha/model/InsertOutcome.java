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
package dev.mars.slha.model;

/**
 * Result of inserting a record into an order-preserving, unique-keyed container.
 * <p>
 * Duplicates are an expected condition in hand-edited files, so they are
 * reported through this value rather than an exception. The first record
 * always wins.
 */
public enum InsertOutcome {

    /** The record was new and has been appended. */
    INSERTED,

    /** A record with the same key already exists; the new one was dropped. */
    DUPLICATE_IGNORED
}
