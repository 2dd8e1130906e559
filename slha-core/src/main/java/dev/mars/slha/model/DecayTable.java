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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Total width and decay channels of a single particle.
 * <p>
 * Channels are keyed by their ordered daughter list: {@code (-5, 1000005)} and
 * {@code (1000005, -5)} are different channels.
 */
public final class DecayTable {

    private final int pid;
    private final double width;
    private final String description;
    private final StringBuilder comments = new StringBuilder();
    private final Map<List<Integer>, DecayMode> modes = new LinkedHashMap<>();

    public DecayTable(int pid, double width, String description) {
        this.pid = pid;
        this.width = width;
        this.description = description == null ? "" : description;
    }

    public int pid() {
        return pid;
    }

    /** Total width in GeV. */
    public double width() {
        return width;
    }

    public String description() {
        return description;
    }

    public String comments() {
        return comments.toString();
    }

    public void appendComment(String line) {
        comments.append(line).append('\n');
    }

    public InsertOutcome addMode(DecayMode mode) {
        if (modes.containsKey(mode.daughters())) {
            return InsertOutcome.DUPLICATE_IGNORED;
        }
        modes.put(mode.daughters(), mode);
        return InsertOutcome.INSERTED;
    }

    public Optional<DecayMode> mode(List<Integer> daughters) {
        return Optional.ofNullable(modes.get(daughters));
    }

    /** Read-only, insertion-ordered view of the channels. */
    public Map<List<Integer>, DecayMode> modes() {
        return Collections.unmodifiableMap(modes);
    }

    @Override
    public String toString() {
        return "DecayTable{pid=" + pid + ", width=" + width + ", modes=" + modes.size() + '}';
    }
}
