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
import java.util.OptionalInt;

/**
 * Table of commonly used particle IDs.
 * <p>
 * The standard table combines three groups:
 * <ul>
 *   <li>Standard Model quarks, leptons and gauge bosons</li>
 *   <li>Higgs sector ({@code h}, {@code H0}, {@code A0}, {@code H+})</li>
 *   <li>MSSM superpartners, prefixed with {@code ~}</li>
 * </ul>
 * Names are case-sensitive: {@code "Z"} is the Z boson, {@code "z"} is unknown.
 */
public final class ParticleIds implements ParticleResolver {

    public static final Map<String, Integer> STANDARD_MODEL;
    public static final Map<String, Integer> HIGGS;
    public static final Map<String, Integer> MSSM;

    static {
        Map<String, Integer> sm = new LinkedHashMap<>();
        sm.put("d", 1);
        sm.put("u", 2);
        sm.put("s", 3);
        sm.put("c", 4);
        sm.put("b", 5);
        sm.put("t", 6);
        sm.put("e", 11);
        sm.put("ve", 12);
        sm.put("mu", 13);
        sm.put("vm", 14);
        sm.put("tau", 15);
        sm.put("vt", 16);
        sm.put("g", 21);
        sm.put("a", 22);
        sm.put("Z", 23);
        sm.put("W", 24);
        STANDARD_MODEL = Collections.unmodifiableMap(sm);

        Map<String, Integer> higgs = new LinkedHashMap<>();
        higgs.put("h", 25);
        higgs.put("H0", 35);
        higgs.put("A0", 36);
        higgs.put("H+", 37);
        HIGGS = Collections.unmodifiableMap(higgs);

        Map<String, Integer> mssm = new LinkedHashMap<>();
        mssm.put("~dL", 1000001);
        mssm.put("~uL", 1000002);
        mssm.put("~sL", 1000003);
        mssm.put("~cL", 1000004);
        mssm.put("~b1", 1000005);
        mssm.put("~t1", 1000006);
        mssm.put("~eL", 1000011);
        mssm.put("~ve", 1000012);
        mssm.put("~muL", 1000013);
        mssm.put("~vmu", 1000014);
        mssm.put("~tau1", 1000015);
        mssm.put("~vt", 1000016);
        mssm.put("~dR", 2000001);
        mssm.put("~uR", 2000002);
        mssm.put("~sR", 2000003);
        mssm.put("~cR", 2000004);
        mssm.put("~b2", 2000005);
        mssm.put("~t2", 2000006);
        mssm.put("~eR", 2000011);
        mssm.put("~veR", 2000012);
        mssm.put("~muR", 2000013);
        mssm.put("~vmuR", 2000014);
        mssm.put("~tau2", 2000015);
        mssm.put("~vtR", 2000016);
        mssm.put("~g", 1000021);
        mssm.put("~N1", 1000022);
        mssm.put("~N2", 1000023);
        mssm.put("~C1", 1000024);
        mssm.put("~N3", 1000025);
        mssm.put("~N4", 1000035);
        mssm.put("~C2", 1000037);
        mssm.put("~G", 1000039);
        MSSM = Collections.unmodifiableMap(mssm);
    }

    private static final ParticleIds STANDARD = new ParticleIds(merge(STANDARD_MODEL, HIGGS, MSSM));

    private final Map<String, Integer> ids;

    private ParticleIds(Map<String, Integer> ids) {
        this.ids = Collections.unmodifiableMap(new LinkedHashMap<>(ids));
    }

    /** The combined Standard Model, Higgs and MSSM table. */
    public static ParticleIds standard() {
        return STANDARD;
    }

    /** A table backed by the given names. */
    public static ParticleIds of(Map<String, Integer> ids) {
        return new ParticleIds(Objects.requireNonNull(ids, "ids"));
    }

    @Override
    public OptionalInt resolve(String name) {
        Integer pid = ids.get(name);
        return pid == null ? OptionalInt.empty() : OptionalInt.of(pid);
    }

    /**
     * Reverse lookup. Returns the first name registered for the ID.
     */
    public Optional<String> nameOf(int pid) {
        for (Map.Entry<String, Integer> e : ids.entrySet()) {
            if (e.getValue() == pid) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    public Map<String, Integer> asMap() {
        return ids;
    }

    @SafeVarargs
    private static Map<String, Integer> merge(Map<String, Integer>... groups) {
        Map<String, Integer> all = new LinkedHashMap<>();
        for (Map<String, Integer> group : groups) {
            all.putAll(group);
        }
        return all;
    }
}
