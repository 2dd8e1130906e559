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

import dev.mars.slha.model.Block;
import dev.mars.slha.model.BlockEntry;
import dev.mars.slha.model.DecayMode;
import dev.mars.slha.model.DecayTable;
import dev.mars.slha.model.EntryKey;
import dev.mars.slha.model.InsertOutcome;
import dev.mars.slha.model.ParticleIds;
import dev.mars.slha.model.ParticleResolver;
import dev.mars.slha.model.SlhaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads SLHA text into an {@link SlhaDocument}.
 * <p>
 * The reader makes a single forward pass. Each trimmed line is classified by
 * its first token and by the section the reader is currently in:
 * <pre>
 *   # ...               comment: preamble, or comments of the current block/decay
 *   BLOCK name # desc   starts a block
 *   DECAY pid width     starts a decay table
 *   k [k [k ...]] value entry of the current block
 *   br n d1 d2 [...]    channel of the current decay table
 * </pre>
 * <p>
 * <b>Key shape</b> of a block entry depends on its column count:
 * <ul>
 *   <li>1-2 columns: the first token, as an integer if it parses</li>
 *   <li>3 columns: a tuple of the first two tokens, integers if both parse</li>
 *   <li>4+ columns: a tuple of all but the last token, always strings</li>
 * </ul>
 * The last token is the value. A one-column record is its own value.
 * <p>
 * <b>Duplicates</b> (block names, decay PIDs, entry keys, channels) are logged
 * and dropped; the first record wins. Entries following a duplicate block
 * header are added to the first block of that name, and likewise for decay
 * tables.
 * <p>
 * <b>Errors:</b> a {@code DECAY} header without a parseable PID and width
 * aborts the read with {@link SlhaFormatException}. Decay channel lines with
 * fewer than four tokens are skipped silently.
 */
public final class SlhaReader {

    private static final Logger LOG = LoggerFactory.getLogger(SlhaReader.class);

    private static final String COMMENT = "#";
    private static final String BLOCK_KEYWORD = "block";
    private static final String DECAY_KEYWORD = "decay";

    /** Decay channel: BR, N-body count and at least two daughters. */
    private static final int MIN_DECAY_COLUMNS = 4;

    private static final String[] NO_TOKENS = new String[0];

    private enum Section { NONE, BLOCK, DECAY }

    private final SlhaConfig config;
    private final ParticleResolver particles;

    /**
     * Creates a reader with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     */
    public SlhaReader() {
        this(SlhaConfig.load());
    }

    public SlhaReader(SlhaConfig config) {
        this(config, ParticleIds.standard());
    }

    /**
     * @param config    reader configuration
     * @param particles name table handed to every document this reader creates
     */
    public SlhaReader(SlhaConfig config, ParticleResolver particles) {
        this.config = config;
        this.particles = particles;
    }

    public SlhaConfig config() {
        return config;
    }

    /**
     * Reads an SLHA file.
     *
     * @throws SlhaFormatException if a decay header is malformed
     * @throws SlhaException       if the file cannot be read or is too large
     */
    public SlhaDocument read(Path path) {
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            LOG.error("Cannot read SLHA file {}: {}", path, e.getMessage(), e);
            throw new SlhaException("Cannot read SLHA file " + path, e);
        }
        if (size > config.maxFileSizeBytes()) {
            LOG.error("SLHA file too large: {} bytes (max: {})", size, config.maxFileSizeBytes());
            throw new SlhaException("SLHA file too large: " + path + " is " + size +
                    " bytes (max: " + config.maxFileSizeBytes() + ")");
        }

        LOG.debug("Reading SLHA file {} ({} bytes, charset {})", path, size, config.charset());
        try (BufferedReader in = Files.newBufferedReader(path, config.charset())) {
            SlhaDocument document = parse(in);
            LOG.info("Read {} from {}", document, path);
            return document;
        } catch (IOException e) {
            LOG.error("Failed to read SLHA file {}: {}", path, e.getMessage(), e);
            throw new SlhaException("Failed to read SLHA file " + path, e);
        }
    }

    /**
     * Parses SLHA text held in memory.
     */
    public SlhaDocument parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new SlhaException("Unexpected I/O error reading a string", e);
        }
    }

    /**
     * Parses SLHA text from a reader. The reader is not closed.
     */
    public SlhaDocument parse(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        Parse state = new Parse(new SlhaDocument(particles, config));
        String line;
        while ((line = in.readLine()) != null) {
            state.accept(line);
        }
        return state.document;
    }

    /**
     * Per-read parser state. Tracks the current section and the record that
     * entries are added to.
     */
    private final class Parse {
        private final SlhaDocument document;
        private Section section = Section.NONE;
        private Block block;
        private DecayTable decay;
        private int lineNumber;

        Parse(SlhaDocument document) {
            this.document = document;
        }

        void accept(String rawLine) {
            lineNumber++;
            String line = rawLine.strip();

            if (line.startsWith(COMMENT)) {
                acceptComment(line);
                return;
            }

            int marker = line.indexOf(COMMENT);
            String data = marker < 0 ? line : line.substring(0, marker);
            String description = marker < 0 ? "" : line.substring(marker + 1).strip();
            String[] tokens = split(data);

            if (tokens.length > 0 && tokens[0].equalsIgnoreCase(BLOCK_KEYWORD)) {
                startBlock(data, tokens[0], description);
            } else if (tokens.length > 0 && tokens[0].equalsIgnoreCase(DECAY_KEYWORD)) {
                startDecay(tokens, description);
            } else if (section == Section.BLOCK) {
                acceptEntry(tokens, description);
            } else if (section == Section.DECAY) {
                acceptMode(tokens, description);
            } else if (tokens.length > 0) {
                LOG.debug("Ignoring line {} outside any block: {}", lineNumber, line);
            }
        }

        private void acceptComment(String line) {
            switch (section) {
                case BLOCK:
                    block.appendComment(line);
                    break;
                case DECAY:
                    decay.appendComment(line);
                    break;
                default:
                    document.appendPreamble(line);
                    break;
            }
        }

        private void startBlock(String data, String keyword, String description) {
            section = Section.BLOCK;
            String trimmed = data.strip();
            String name = trimmed.substring(keyword.length()).strip();
            if (name.isEmpty()) {
                LOG.warn("Block header without a name on line {}", lineNumber);
            }

            InsertOutcome outcome = document.addBlock(new Block(name, description));
            if (outcome == InsertOutcome.DUPLICATE_IGNORED) {
                duplicate("Multiple '{}' blocks (line {}). Only first will be kept!", name, lineNumber);
            }
            block = document.block(name).orElseThrow();
            LOG.trace("BLOCK {} on line {}", name, lineNumber);
        }

        private void startDecay(String[] tokens, String description) {
            section = Section.DECAY;
            if (tokens.length < 3) {
                LOG.error("Malformed DECAY header on line {}: expected PID and width", lineNumber);
                throw new SlhaFormatException(lineNumber, "DECAY header needs a particle ID and a width");
            }

            int pid;
            double width;
            try {
                pid = Integer.parseInt(tokens[1]);
                width = NumberText.parseDouble(tokens[2]);
            } catch (NumberFormatException e) {
                LOG.error("Malformed DECAY header on line {}: {}", lineNumber, e.getMessage());
                throw new SlhaFormatException(lineNumber,
                        "DECAY header has invalid particle ID or width: " + String.join(" ", tokens), e);
            }

            InsertOutcome outcome = document.addDecay(new DecayTable(pid, width, description));
            if (outcome == InsertOutcome.DUPLICATE_IGNORED) {
                duplicate("Multiple decay tables for {} (line {}). Only first will be kept!", pid, lineNumber);
            }
            decay = document.decayTable(pid).orElseThrow();
            LOG.trace("DECAY {} width={} on line {}", pid, width, lineNumber);
        }

        private void acceptEntry(String[] tokens, String description) {
            int columns = tokens.length;
            if (columns == 0) {
                return;
            }

            EntryKey key;
            if (columns <= 2) {
                key = EntryKey.parse(tokens[0]);
            } else if (columns == 3) {
                key = EntryKey.parseTuple(Arrays.asList(tokens[0], tokens[1]));
            } else {
                key = EntryKey.stringTuple(Arrays.asList(tokens).subList(0, columns - 1));
            }
            String value = tokens[columns - 1];

            InsertOutcome outcome = block.addEntry(new BlockEntry(key, value, description, columns));
            if (outcome == InsertOutcome.DUPLICATE_IGNORED) {
                duplicate("Repeat entry {} in block {} (line {}). Only first will be kept!",
                        key, block.name(), lineNumber);
            }
        }

        private void acceptMode(String[] tokens, String description) {
            if (tokens.length < MIN_DECAY_COLUMNS) {
                return;
            }

            DecayMode mode;
            try {
                double branchingRatio = NumberText.parseDouble(tokens[0]);
                int nBody = Integer.parseInt(tokens[1]);
                List<Integer> daughters = new ArrayList<>(tokens.length - 2);
                for (int i = 2; i < tokens.length; i++) {
                    daughters.add(Integer.parseInt(tokens[i]));
                }
                mode = new DecayMode(daughters, nBody, branchingRatio, description);
            } catch (NumberFormatException e) {
                LOG.warn("Skipping unparseable decay channel for {} on line {}: {}",
                        decay.pid(), lineNumber, e.getMessage());
                return;
            }

            InsertOutcome outcome = decay.addMode(mode);
            if (outcome == InsertOutcome.DUPLICATE_IGNORED) {
                duplicate("Repeat channel {} in decay table for {} (line {}). Only first will be kept!",
                        mode.daughters(), decay.pid(), lineNumber);
            }
        }

        private void duplicate(String format, Object... args) {
            if (config.warnOnDuplicates()) {
                LOG.warn(format, args);
            } else {
                LOG.debug(format, args);
            }
        }
    }

    private static String[] split(String data) {
        String trimmed = data.strip();
        return trimmed.isEmpty() ? NO_TOKENS : trimmed.split("\\s+");
    }
}
