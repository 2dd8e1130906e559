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
import dev.mars.slha.model.SlhaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an {@link SlhaDocument} in the fixed SLHA column layout.
 * <p>
 * <b>Layout:</b>
 * <pre>
 * BLOCK MINPAR    # Input parameters
 *   3    1.00000000E+01      # tanb
 * BLOCK NMIX    # Neutralino mixing matrix
 *   1   3   1.46433995E-01      # N_13
 * DECAY   1000021    5.50675438          # gluino decays
 *   0.107955244          2   1000005        -5    # BR(~g -> ~b_1 bb)
 * </pre>
 * Scalar keys are padded to 3 characters and tuple elements to 2, each
 * followed by two spaces. Values and branching ratios are padded to 16,
 * the decay PID to 8 and the width to 16. Daughter IDs are right-aligned in 8.
 * <p>
 * <b>N-body column:</b> a channel line is written as BR, N-body count
 * (right-aligned in 4), then the daughters, rather than BR followed directly
 * by the daughters. The reader takes the second token as the N-body count, so
 * a line without it would read back with its first daughter lost and a
 * two-body channel would be skipped as too short.
 * The value column is omitted for entries read from a one-column record.
 * A document is written as its preamble, then each block followed by its
 * comments, then each decay table followed by its comments.
 * <p>
 * <b>Resources:</b> a file target is opened, truncated and closed on every
 * exit path. {@link OutputTarget#STDOUT} and {@link OutputTarget#STDERR} are
 * flushed and never closed.
 */
public final class SlhaWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SlhaWriter.class);

    private static final String NEWLINE = "\n";
    private static final String INDENT = "  ";
    private static final String SEPARATOR = "  ";
    private static final String DESCRIPTION_PREFIX = "    # ";

    private final SlhaConfig config;

    /**
     * Creates a writer with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     */
    public SlhaWriter() {
        this(SlhaConfig.load());
    }

    public SlhaWriter(SlhaConfig config) {
        this.config = config;
    }

    public SlhaConfig config() {
        return config;
    }

    // ========================================================================
    // Document output
    // ========================================================================

    /**
     * Writes the document to a file or standard stream.
     *
     * @throws SlhaException if the file cannot be written
     */
    public void write(SlhaDocument document, OutputTarget target) {
        if (target.owned()) {
            writeFile(document, target.path());
        } else {
            writeStream(document, target);
        }
    }

    public void write(SlhaDocument document, Path path) {
        write(document, OutputTarget.file(path));
    }

    /**
     * Appends the full document text.
     */
    public void write(SlhaDocument document, Appendable out) throws IOException {
        out.append(document.preamble()).append(NEWLINE);

        for (Block block : document.blockRecords()) {
            out.append(blockText(block)).append(NEWLINE);
            out.append(block.comments()).append(NEWLINE);
        }

        for (DecayTable decay : document.decayRecords()) {
            out.append(decayText(decay)).append(NEWLINE);
            out.append(decay.comments()).append(NEWLINE);
        }
    }

    /**
     * Renders the full document text.
     */
    public String toText(SlhaDocument document) {
        StringBuilder sb = new StringBuilder();
        try {
            write(document, sb);
        } catch (IOException e) {
            throw new SlhaException("Unexpected I/O error writing to a string", e);
        }
        return sb.toString();
    }

    private void writeFile(SlhaDocument document, Path path) {
        LOG.debug("Writing {} to {}", document, path);
        try (Writer out = Files.newBufferedWriter(path, config.charset())) {
            write(document, out);
        } catch (IOException e) {
            LOG.error("Failed to write SLHA file {}: {}", path, e.getMessage(), e);
            throw new SlhaException("Failed to write SLHA file " + path, e);
        }
        LOG.info("Wrote {} to {}", document, path);
    }

    private void writeStream(SlhaDocument document, OutputTarget target) {
        PrintStream stream = target.stream();
        // Not closed: closing the wrapper would close the borrowed stream
        Writer out = new OutputStreamWriter(stream, config.charset());
        try {
            write(document, out);
            out.flush();
        } catch (IOException e) {
            LOG.error("Failed to write SLHA document to {}: {}", target, e.getMessage(), e);
            throw new SlhaException("Failed to write SLHA document to " + target, e);
        }
        LOG.debug("Wrote {} to {}", document, target);
    }

    // ========================================================================
    // Record layout
    // ========================================================================

    /**
     * Renders a block header and its entries, without trailing newline or
     * comment lines.
     */
    public static String blockText(Block block) {
        StringBuilder sb = new StringBuilder("BLOCK ").append(block.name());
        appendDescription(sb, block.description());

        for (BlockEntry entry : block.entries().values()) {
            sb.append(NEWLINE).append(INDENT);
            appendKey(sb, entry.key());
            if (entry.hasValueColumn()) {
                sb.append(String.format("%-16s", entry.value()));
            }
            appendDescription(sb, entry.description());
        }
        return sb.toString();
    }

    /**
     * Renders a decay header and its channels, without trailing newline or
     * comment lines.
     */
    public static String decayText(DecayTable decay) {
        StringBuilder sb = new StringBuilder(String.format("DECAY   %-8s   %-16s",
                decay.pid(), NumberText.formatDouble(decay.width())));
        appendDescription(sb, decay.description());

        for (DecayMode mode : decay.modes().values()) {
            sb.append(NEWLINE).append(INDENT)
                    .append(String.format("%-16s", NumberText.formatDouble(mode.branchingRatio())))
                    .append(SEPARATOR).append(String.format("%4s", mode.nBody()));
            for (int daughter : mode.daughters()) {
                sb.append(SEPARATOR).append(String.format("%8s", daughter));
            }
            appendDescription(sb, mode.description());
        }
        return sb.toString();
    }

    private static void appendKey(StringBuilder sb, EntryKey key) {
        switch (key.tag()) {
            case INT:
            case STRING:
                sb.append(String.format("%-3s", key)).append(SEPARATOR);
                break;
            case TUPLE:
                for (EntryKey part : ((EntryKey.TupleKey) key).parts()) {
                    sb.append(String.format("%-2s", part)).append(SEPARATOR);
                }
                break;
            default:
                throw new IllegalStateException("Unknown key tag: " + key.tag());
        }
    }

    private static void appendDescription(StringBuilder sb, String description) {
        if (!description.isEmpty()) {
            sb.append(DESCRIPTION_PREFIX).append(description);
        }
    }
}
