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
package dev.mars.slha;

import dev.mars.slha.io.OutputTarget;
import dev.mars.slha.io.SlhaConfig;
import dev.mars.slha.io.SlhaException;
import dev.mars.slha.io.SlhaReader;
import dev.mars.slha.io.SlhaWriter;
import dev.mars.slha.model.SlhaDocument;

import java.nio.file.Path;

/**
 * Command line entry point: reads an SLHA file and writes it back in the
 * normalized column layout.
 * <pre>
 * java -cp slha-core.jar dev.mars.slha.Main spectrum.slha             # to stdout
 * java -cp slha-core.jar dev.mars.slha.Main spectrum.slha clean.slha  # to a file
 * </pre>
 * Exit codes: 0 on success, 1 on a usage error, 2 if the input cannot be read
 * or the output cannot be written.
 */
public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 2 || args[0].isBlank()) {
            System.err.println("Usage: Main <input.slha> [output.slha]");
            return EXIT_USAGE;
        }

        SlhaConfig config = SlhaConfig.load();
        OutputTarget target = args.length == 2 ? OutputTarget.file(args[1]) : OutputTarget.STDOUT;

        try {
            SlhaDocument document = new SlhaReader(config).read(Path.of(args[0]));
            new SlhaWriter(config).write(document, target);
            if (target.owned()) {
                System.err.println("Wrote " + document.blocks().size() + " blocks and " +
                        document.decays().size() + " decay tables to " + target);
            }
            return EXIT_OK;
        } catch (SlhaException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
