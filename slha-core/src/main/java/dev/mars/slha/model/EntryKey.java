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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Key of a {@link BlockEntry}.
 * <p>
 * A key is one of three shapes, identified by its {@link Tag}:
 * <ul>
 *   <li>{@link Tag#INT} - a single integer index ({@code 3 10})</li>
 *   <li>{@link Tag#STRING} - a single token that is not an integer</li>
 *   <li>{@link Tag#TUPLE} - an ordered list of scalar keys ({@code 1 3 0.5})</li>
 * </ul>
 * <p>
 * Equality is structural and tag-sensitive: {@code of(3)} is not equal to
 * {@code of("3")}, and an integer tuple {@code (1, 3)} is not equal to the
 * string tuple {@code ("1", "3")}. Lookups never coerce between shapes, so a
 * caller must ask with the same shape the reader stored.
 * <p>
 * The three nested records are the only implementations; code that needs to
 * tell them apart switches on {@link #tag()}.
 */
public interface EntryKey {

    /** Discriminator for the three key shapes. */
    enum Tag { INT, STRING, TUPLE }

    /**
     * @return the shape of this key
     */
    Tag tag();

    static EntryKey of(int value) {
        return new IntKey(value);
    }

    static EntryKey of(String value) {
        return new StringKey(value);
    }

    /**
     * Creates a tuple of integer keys, e.g. a matrix index {@code (1, 3)}.
     */
    static EntryKey tuple(int... values) {
        List<EntryKey> parts = new ArrayList<>(values.length);
        for (int value : values) {
            parts.add(new IntKey(value));
        }
        return new TupleKey(parts);
    }

    /**
     * Creates a tuple of string keys.
     */
    static EntryKey tuple(String... values) {
        List<EntryKey> parts = new ArrayList<>(values.length);
        for (String value : values) {
            parts.add(new StringKey(value));
        }
        return new TupleKey(parts);
    }

    /**
     * Parses a single token: an {@link IntKey} if the token is an integer,
     * otherwise a {@link StringKey} holding the token unchanged.
     */
    static EntryKey parse(String token) {
        Integer value = parseInteger(token);
        return value != null ? new IntKey(value) : new StringKey(token);
    }

    /**
     * Parses the tokens of a three-column record. The result holds integers
     * only if every token is an integer, otherwise it holds the raw strings.
     */
    static EntryKey parseTuple(List<String> tokens) {
        List<EntryKey> parts = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            Integer value = parseInteger(token);
            if (value == null) {
                return stringTuple(tokens);
            }
            parts.add(new IntKey(value));
        }
        return new TupleKey(parts);
    }

    /**
     * Builds a tuple of raw string keys without attempting integer parsing.
     */
    static EntryKey stringTuple(List<String> tokens) {
        List<EntryKey> parts = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            parts.add(new StringKey(token));
        }
        return new TupleKey(parts);
    }

    private static Integer parseInteger(String token) {
        try {
            return Integer.valueOf(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Single integer key.
     *
     * @param value the index
     */
    record IntKey(int value) implements EntryKey {
        @Override
        public Tag tag() {
            return Tag.INT;
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    /**
     * Single non-integer key, kept as written.
     *
     * @param value the raw token
     */
    record StringKey(String value) implements EntryKey {
        public StringKey {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Tag tag() {
            return Tag.STRING;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * Ordered tuple of scalar keys.
     *
     * @param parts the elements; each is an {@link IntKey} or a {@link StringKey}
     */
    record TupleKey(List<EntryKey> parts) implements EntryKey {
        public TupleKey {
            parts = List.copyOf(parts);
            for (EntryKey part : parts) {
                if (part.tag() == Tag.TUPLE) {
                    throw new IllegalArgumentException("Tuple keys cannot be nested: " + part);
                }
            }
        }

        @Override
        public Tag tag() {
            return Tag.TUPLE;
        }

        @Override
        public String toString() {
            return parts.stream().map(EntryKey::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
