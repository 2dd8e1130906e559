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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named block of parameters.
 * <p>
 * Entries are kept in the order they were inserted, which is also the order
 * they are written back. Keys are unique; inserting an existing key leaves the
 * first entry in place.
 */
public final class Block {

    private final String name;
    private final String description;
    private final StringBuilder comments = new StringBuilder();
    private final Map<EntryKey, BlockEntry> entries = new LinkedHashMap<>();

    /**
     * @param name        block name as written after the {@code BLOCK} keyword
     * @param description inline comment of the header line, empty if none
     */
    public Block(String name, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    /**
     * Comment lines that followed the header, each with its {@code #} marker
     * and a trailing newline.
     */
    public String comments() {
        return comments.toString();
    }

    public void appendComment(String line) {
        comments.append(line).append('\n');
    }

    /**
     * Appends an entry unless its key is already present.
     */
    public InsertOutcome addEntry(BlockEntry entry) {
        if (entries.containsKey(entry.key())) {
            return InsertOutcome.DUPLICATE_IGNORED;
        }
        entries.put(entry.key(), entry);
        return InsertOutcome.INSERTED;
    }

    public Optional<BlockEntry> entry(EntryKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    /** Read-only, insertion-ordered view of the entries. */
    public Map<EntryKey, BlockEntry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Block{name=" + name + ", entries=" + entries.size() + '}';
    }
}
