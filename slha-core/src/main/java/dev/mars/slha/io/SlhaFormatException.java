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

/**
 * Fatal format error: the input cannot be read as SLHA.
 * <p>
 * Only a malformed {@code DECAY} header raises this. Every other irregularity
 * (duplicates, short decay lines) is logged and skipped.
 */
public class SlhaFormatException extends SlhaException {

    private final int lineNumber;

    public SlhaFormatException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public SlhaFormatException(int lineNumber, String message, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    /** 1-based line number of the offending line. */
    public int lineNumber() {
        return lineNumber;
    }
}
