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
package dev.mars.slha.io;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Destination of {@link SlhaWriter#write}.
 * <p>
 * A {@link Kind#FILE} target is <b>owned</b>: the writer opens it, truncates it
 * and closes it. The two standard streams are <b>borrowed</b>: the writer
 * flushes them but never closes them. The stream is looked up when the write
 * happens, so a replaced {@code System.out} is honoured.
 *
 * @param kind the kind of target
 * @param path the file to write; {@code null} unless {@code kind} is FILE
 */
public record OutputTarget(Kind kind, Path path) {

    public enum Kind { FILE, STDOUT, STDERR }

    public static final OutputTarget STDOUT = new OutputTarget(Kind.STDOUT, null);
    public static final OutputTarget STDERR = new OutputTarget(Kind.STDERR, null);

    public OutputTarget {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.FILE && path == null) {
            throw new IllegalArgumentException("A FILE target needs a path");
        }
        if (kind != Kind.FILE && path != null) {
            throw new IllegalArgumentException(kind + " target cannot have a path");
        }
    }

    public static OutputTarget file(Path path) {
        return new OutputTarget(Kind.FILE, path);
    }

    public static OutputTarget file(String path) {
        return file(Path.of(path));
    }

    /**
     * Whether the writer owns, and must close, the underlying resource.
     */
    public boolean owned() {
        return kind == Kind.FILE;
    }

    /**
     * The borrowed standard stream.
     *
     * @throws IllegalStateException for a FILE target
     */
    PrintStream stream() {
        switch (kind) {
            case STDOUT:
                return System.out;
            case STDERR:
                return System.err;
            default:
                throw new IllegalStateException("FILE target has no standard stream");
        }
    }

    @Override
    public String toString() {
        return owned() ? path.toString() : "<" + kind.name().toLowerCase() + ">";
    }
}
