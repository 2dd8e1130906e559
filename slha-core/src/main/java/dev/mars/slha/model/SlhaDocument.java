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

import dev.mars.slha.io.OutputTarget;
import dev.mars.slha.io.SlhaConfig;
import dev.mars.slha.io.SlhaWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

/**
 * In-memory SLHA document: a comment preamble, blocks and decay tables.
 * <p>
 * Blocks are keyed by name and decay tables by particle ID. Both maps keep
 * insertion order, which is the order used when the document is written.
 * <p>
 * <b>Lookups never throw.</b> A missing block, key or particle is logged and
 * reported as an empty {@link Optional} (or {@link SetResult#NOT_FOUND}) so
 * that a batch of edits can carry on past a single bad reference.
 * <p>
 * <b>Thread Safety:</b> none. Callers sharing a document must serialize
 * access themselves.
 *
 * <pre>{@code
 * SlhaDocument slha = new SlhaReader().read(Path.of("spectrum.slha"));
 * slha.getValue("MINPAR", 3);                 // Optional["1.00000000E+01"]
 * slha.setValue("MINPAR", 3, 20);             // SetResult.UPDATED
 * slha.getWidth("~g");                        // same as getWidth(1000021)
 * slha.write(OutputTarget.file(Path.of("new.slha")));
 * }</pre>
 */
public final class SlhaDocument {

    private static final Logger LOG = LoggerFactory.getLogger(SlhaDocument.class);

    private final StringBuilder preamble = new StringBuilder();
    private final Map<String, Block> blocks = new LinkedHashMap<>();
    private final Map<Integer, DecayTable> decays = new LinkedHashMap<>();
    private final ParticleResolver particles;
    private final SlhaConfig config;

    /**
     * Creates an empty document that resolves particle names with
     * {@link ParticleIds#standard()}.
     */
    public SlhaDocument() {
        this(ParticleIds.standard());
    }

    /**
     * Creates an empty document written with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     */
    public SlhaDocument(ParticleResolver particles) {
        this(particles, SlhaConfig.load());
    }

    /**
     * @param particles name table for the name-based accessors
     * @param config    configuration used by {@link #write(OutputTarget)};
     *                  a reader passes its own so the file is written back
     *                  in the charset it was read with
     */
    public SlhaDocument(ParticleResolver particles, SlhaConfig config) {
        this.particles = Objects.requireNonNull(particles, "particles");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Configuration used when this document writes itself. */
    public SlhaConfig config() {
        return config;
    }

    // ========================================================================
    // Structure
    // ========================================================================

    /** Leading comment lines, each newline-terminated. */
    public String preamble() {
        return preamble.toString();
    }

    public void appendPreamble(String line) {
        preamble.append(line).append('\n');
    }

    public InsertOutcome addBlock(Block block) {
        if (blocks.containsKey(block.name())) {
            return InsertOutcome.DUPLICATE_IGNORED;
        }
        blocks.put(block.name(), block);
        return InsertOutcome.INSERTED;
    }

    public InsertOutcome addDecay(DecayTable decay) {
        if (decays.containsKey(decay.pid())) {
            return InsertOutcome.DUPLICATE_IGNORED;
        }
        decays.put(decay.pid(), decay);
        return InsertOutcome.INSERTED;
    }

    /** Block names in insertion order. */
    public Set<String> blocks() {
        return Collections.unmodifiableSet(blocks.keySet());
    }

    /** Particle IDs with a decay table, in insertion order. */
    public Set<Integer> decays() {
        return Collections.unmodifiableSet(decays.keySet());
    }

    /** The block record itself, without logging when absent. */
    public Optional<Block> block(String name) {
        return Optional.ofNullable(blocks.get(name));
    }

    /** The decay table record itself, without logging when absent. */
    public Optional<DecayTable> decayTable(int pid) {
        return Optional.ofNullable(decays.get(pid));
    }

    /** All blocks in insertion order. */
    public Iterable<Block> blockRecords() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    /** All decay tables in insertion order. */
    public Iterable<DecayTable> decayRecords() {
        return Collections.unmodifiableCollection(decays.values());
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    /**
     * Finds the first block, in insertion order, whose name starts with the
     * prefix. Useful for blocks carrying a scale, e.g. {@code "YU Q= 4.6E+02"}.
     */
    public Optional<String> findBlock(String prefix) {
        for (String name : blocks.keySet()) {
            if (name.startsWith(prefix)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public Optional<Map<EntryKey, BlockEntry>> getBlock(String name) {
        Block block = blocks.get(name);
        if (block == null) {
            LOG.warn("No block named '{}'", name);
            return Optional.empty();
        }
        return Optional.of(block.entries());
    }

    public Optional<String> getBlockText(String name) {
        Block block = blocks.get(name);
        if (block == null) {
            LOG.warn("No block named '{}'", name);
            return Optional.empty();
        }
        return Optional.of(SlhaWriter.blockText(block));
    }

    /**
     * Returns the raw value token of an entry.
     * <p>
     * The key must have the shape the reader stored: {@code EntryKey.of(3)}
     * does not find an entry stored under {@code EntryKey.of("3")}.
     */
    public Optional<String> getValue(String block, EntryKey key) {
        Optional<BlockEntry> entry = findEntry(block, key);
        return entry.map(BlockEntry::value);
    }

    public Optional<String> getValue(String block, int key) {
        return getValue(block, EntryKey.of(key));
    }

    /**
     * Overwrites the value of an existing entry with {@code String.valueOf(value)}.
     * Nothing is created: an unknown block or key leaves the document untouched.
     *
     * @return {@link SetResult#UPDATED}, or {@link SetResult#NOT_FOUND}
     */
    public SetResult setValue(String block, EntryKey key, Object value) {
        Objects.requireNonNull(value, "value");
        Optional<BlockEntry> entry = findEntry(block, key);
        if (entry.isEmpty()) {
            return SetResult.NOT_FOUND;
        }
        String text = String.valueOf(value);
        LOG.debug("Setting {}[{}] = {} (was {})", block, key, text, entry.get().value());
        entry.get().value(text);
        return SetResult.UPDATED;
    }

    public SetResult setValue(String block, int key, Object value) {
        return setValue(block, EntryKey.of(key), value);
    }

    private Optional<BlockEntry> findEntry(String block, EntryKey key) {
        Block b = blocks.get(block);
        Optional<BlockEntry> entry = b == null ? Optional.empty() : b.entry(key);
        if (entry.isEmpty()) {
            LOG.warn("No parameter '{}' in block '{}'", key, block);
        }
        return entry;
    }

    // ========================================================================
    // Decays
    // ========================================================================

    public Optional<Map<List<Integer>, DecayMode>> getDecay(int pid) {
        return findDecay(pid).map(DecayTable::modes);
    }

    public Optional<Map<List<Integer>, DecayMode>> getDecay(String particle) {
        return findDecay(particle).map(DecayTable::modes);
    }

    public Optional<String> getDecayText(int pid) {
        return findDecay(pid).map(SlhaWriter::decayText);
    }

    public Optional<String> getDecayText(String particle) {
        return findDecay(particle).map(SlhaWriter::decayText);
    }

    /** Total width of the particle in GeV. */
    public OptionalDouble getWidth(int pid) {
        return toWidth(findDecay(pid));
    }

    public OptionalDouble getWidth(String particle) {
        return toWidth(findDecay(particle));
    }

    /**
     * Branching ratio of one decay channel.
     * <p>
     * Returns {@code 0.0} when the channel is not listed. An unknown particle
     * also yields {@code 0.0}; callers that need to tell the two apart should
     * check {@link #decays()} first.
     *
     * @param daughters ordered daughter IDs, e.g. {@code List.of(-5, 1000005)}
     */
    public double getBranchingRatio(int pid, List<Integer> daughters) {
        DecayTable decay = decays.get(pid);
        return branchingRatio(decay, pid, daughters);
    }

    public double getBranchingRatio(int pid, int... daughters) {
        return getBranchingRatio(pid, toList(daughters));
    }

    public double getBranchingRatio(String particle, List<Integer> daughters) {
        OptionalInt pid = resolve(particle);
        if (pid.isEmpty()) {
            return 0.0;
        }
        return getBranchingRatio(pid.getAsInt(), daughters);
    }

    public double getBranchingRatio(String particle, int... daughters) {
        return getBranchingRatio(particle, toList(daughters));
    }

    private static double branchingRatio(DecayTable decay, int pid, List<Integer> daughters) {
        if (decay == null) {
            return 0.0;
        }
        Optional<DecayMode> mode = decay.mode(daughters);
        if (mode.isEmpty()) {
            LOG.debug("Decay mode {} -> {} not found", pid, daughters);
            return 0.0;
        }
        return mode.get().branchingRatio();
    }

    private Optional<DecayTable> findDecay(int pid) {
        DecayTable decay = decays.get(pid);
        if (decay == null) {
            LOG.warn("No decays for particle '{}'", pid);
        }
        return Optional.ofNullable(decay);
    }

    private Optional<DecayTable> findDecay(String particle) {
        OptionalInt pid = resolve(particle);
        if (pid.isEmpty()) {
            return Optional.empty();
        }
        return findDecay(pid.getAsInt());
    }

    private OptionalInt resolve(String particle) {
        OptionalInt pid = particles.resolve(particle);
        if (pid.isEmpty()) {
            LOG.warn("Particle '{}' is unknown", particle);
        }
        return pid;
    }

    private static OptionalDouble toWidth(Optional<DecayTable> decay) {
        return decay.isPresent() ? OptionalDouble.of(decay.get().width()) : OptionalDouble.empty();
    }

    private static List<Integer> toList(int[] values) {
        Integer[] boxed = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return List.of(boxed);
    }

    // ========================================================================
    // Output
    // ========================================================================

    /**
     * Writes the document with {@link #config()}.
     *
     * @see SlhaWriter#write(SlhaDocument, OutputTarget)
     */
    public void write(OutputTarget target) {
        new SlhaWriter(config).write(this, target);
    }

    public void write(Path path) {
        write(OutputTarget.file(path));
    }

    @Override
    public String toString() {
        return "SlhaDocument{blocks=" + blocks.size() + ", decays=" + decays.size() + '}';
    }
}
