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

import java.util.List;

/**
 * One decay channel of a {@link DecayTable}.
 *
 * @param daughters      ordered daughter PIDs; this list is the lookup key
 * @param nBody          number of daughters as declared in the file
 * @param branchingRatio fraction of decays through this channel
 * @param description    the inline comment, empty if none
 */
public record DecayMode(List<Integer> daughters, int nBody, double branchingRatio, String description) {

    public DecayMode {
        daughters = List.copyOf(daughters);
        description = description == null ? "" : description;
    }

    public DecayMode(List<Integer> daughters, int nBody, double branchingRatio) {
        this(daughters, nBody, branchingRatio, "");
    }
}
