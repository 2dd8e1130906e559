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
package dev.mars.slha.demo;

import dev.mars.slha.io.OutputTarget;
import dev.mars.slha.io.SlhaConfig;
import dev.mars.slha.io.SlhaReader;
import dev.mars.slha.io.SlhaWriter;
import dev.mars.slha.model.EntryKey;
import dev.mars.slha.model.SlhaDocument;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Path;
import java.util.OptionalDouble;

/**
 * Demo entry point for the SLHA reader and writer.
 * <p>
 * This demonstrates a typical edit session:
 * <ul>
 *   <li>Reading a file and listing its blocks</li>
 *   <li>Getting and setting a scalar parameter ({@code MINPAR 3})</li>
 *   <li>Getting and setting a matrix parameter ({@code NMIX (1,3)})</li>
 *   <li>Printing a whole block</li>
 *   <li>Querying widths by particle ID and by name</li>
 *   <li>Querying a branching ratio and printing a decay table</li>
 *   <li>Writing the modified document</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl slha-demo -am
 *
 * # Run against the bundled sample, modified document to stdout
 * java -jar slha-demo/target/slha-demo-1.0-SNAPSHOT.jar
 *
 * # Run against your own file and write the result
 * java -jar slha-demo/target/slha-demo-1.0-SNAPSHOT.jar spectrum.slha new.slha
 *
 * # Run with system properties
 * java -Dslha.warnOnDuplicates=false -jar slha-demo/target/slha-demo-1.0-SNAPSHOT.jar spectrum.slha
 * </pre>
 *
 * @see SlhaConfig
 */
public class SlhaEditDemo {

    static final String SAMPLE_RESOURCE = "sample.slha";

    public static void main(String[] args) throws Exception {
        Path input = args.length > 0 && !args[0].isBlank() ? Path.of(args[0]) : null;
        OutputTarget output = args.length > 1 && !args[1].isBlank()
                ? OutputTarget.file(args[1])
                : OutputTarget.STDOUT;

        run(input, output);
    }

    /**
     * Runs the edit session.
     *
     * @param input  the file to read, or null for the bundled sample
     * @param output where the modified document is written; when this is
     *               stdout the walkthrough is printed to stderr instead
     * @return the modified document
     */
    static SlhaDocument run(Path input, OutputTarget output) throws IOException {
        // Keep stdout for the document when it is the output target
        PrintStream console = output.kind() == OutputTarget.Kind.STDOUT ? System.err : System.out;

        console.println("+---------------------------------------+");
        console.println("|           SLHA Edit Demo              |");
        console.println("+---------------------------------------+");
        console.println();

        SlhaConfig config = SlhaConfig.load();
        console.println("Configuration: " + config);
        console.println();

        // Read an SLHA file
        SlhaReader reader = new SlhaReader(config);
        SlhaDocument slha = input != null ? reader.read(input) : readSample(reader);
        console.println("[OK] Read " + slha + " from " + (input != null ? input : SAMPLE_RESOURCE));

        // List of blocks
        console.println("[OK] Blocks: " + slha.blocks());

        // Get and set parameters
        console.println("\n  MINPAR 3 = " + slha.getValue("MINPAR", 3).orElse("(missing)"));
        console.println("  setValue(MINPAR, 3, 10) -> " + slha.setValue("MINPAR", 3, 10));
        console.println("  MINPAR 3 = " + slha.getValue("MINPAR", 3).orElse("(missing)"));

        // Get and set matrix parameters
        EntryKey n13 = EntryKey.tuple(1, 3);
        console.println("\n  NMIX (1,3) = " + slha.getValue("NMIX", n13).orElse("(missing)"));
        console.println("  setValue(NMIX, (1,3), 0.5) -> " + slha.setValue("NMIX", n13, 0.5));
        console.println("  NMIX (1,3) = " + slha.getValue("NMIX", n13).orElse("(missing)"));

        // Get entire block
        console.println();
        console.println(slha.getBlockText("SMINPUTS").orElse("(no SMINPUTS block)"));

        // Get decay width, by ID and by name
        console.println("\n  width(1000021) = " + formatWidth(slha.getWidth(1000021)));
        console.println("  width(~g)      = " + formatWidth(slha.getWidth("~g")));

        // Get BR
        console.println("  BR(~g -> -5 1000005) = " + slha.getBranchingRatio(1000021, -5, 1000005));

        // Get all decay modes
        console.println();
        console.println(slha.getDecayText(1000021).orElse("(no decay table for 1000021)"));

        // Write modified slha file
        console.println("\n[OK] Writing modified document to " + output);
        console.println();
        new SlhaWriter(config).write(slha, output);

        console.println("\n+---------------------------------------+");
        console.println("|  SLHA demo complete!                  |");
        console.println("+---------------------------------------+");
        return slha;
    }

    private static SlhaDocument readSample(SlhaReader reader) throws IOException {
        try (InputStream in = SlhaEditDemo.class.getClassLoader().getResourceAsStream(SAMPLE_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled resource not found: " + SAMPLE_RESOURCE);
            }
            try (Reader text = new InputStreamReader(in, reader.config().charset())) {
                return reader.parse(text);
            }
        }
    }

    private static String formatWidth(OptionalDouble width) {
        return width.isPresent() ? width.getAsDouble() + " GeV" : "(none)";
    }
}
