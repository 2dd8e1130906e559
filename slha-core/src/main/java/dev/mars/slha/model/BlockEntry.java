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

import java.util.Objects;

/**
 * A single record inside a {@link Block}.
 * <p>
 * The value is held as the original text token rather than a number, so an
 * untouched entry is written back exactly as it was read. The column count of
 * the source record is kept because a one-column record (a bare flag) has no
 * separate value field and must be written without one.
 */
public final class BlockEntry {

    private final EntryKey key;
    private String value;
    private final String description;
    private final int columns;

    /**
     * @param key         the entry key
     * @param value       the raw value token
     * @param description the inline comment, empty if none
     * @param columns     number of data columns in the source record
     */
    public BlockEntry(EntryKey key, String value, String description, int columns) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
        this.description = description == null ? "" : description;
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be >= 1, got " + columns);
        }
        this.columns = columns;
    }

    public EntryKey key() {
        return key;
    }

    public String value() {
        return value;
    }

    public String description() {
        return description;
    }

    public int columns() {
        return columns;
    }

    /** Whether the value column is written out. */
    public boolean hasValueColumn() {
        return columns > 1;
    }

    void value(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return "BlockEntry{key=" + key + ", value=" + value + ", columns=" + columns + '}';
    }
}
