package io.arqsim.command.common;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared CSV output file option with force overwrite flag.
 */
public class OutputFileOption {

    /**
     * Immutable output file specification with force-overwrite flag.
     *
     * @param path  the output file path (never null)
     * @param force whether to force overwrite if file exists
     */
    public record OutputFile(Path path, boolean force) {

        public OutputFile {
            if (path == null) {
                throw new IllegalArgumentException("Output path cannot be null");
            }
        }

        public OutputFile(Path path) {
            this(path, false);
        }

        /**
         * Checks if the output file exists and force is not set.
         */
        public boolean existsWithoutForce() {
            return Files.exists(path) && !force;
        }

        @Override
        public String toString() {
            if (force) {
                return path + " (force)";
            }
            return path.toString();
        }
    }

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "CSV file to write results to"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    /**
     * Checks whether an output file was given.
     */
    public boolean isSpecified() {
        return outputPath != null;
    }

    /**
     * Gets the OutputFile record constructed from the options.
     *
     * @throws IllegalStateException if no output file was given
     */
    public OutputFile getOutputFile() {
        if (outputPath == null) {
            throw new IllegalStateException("No output file specified");
        }
        return new OutputFile(outputPath, force);
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public boolean isForce() {
        return force;
    }

    /**
     * Validates the output file, checking for existence without force flag.
     * Does nothing when no output file was given.
     */
    public void validate() {
        if (isSpecified() && getOutputFile().existsWithoutForce()) {
            throw new IllegalStateException(
                "Output file already exists: " + outputPath + ". Use --force to overwrite."
            );
        }
    }

    @Override
    public String toString() {
        return isSpecified() ? getOutputFile().toString() : "(none)";
    }
}
