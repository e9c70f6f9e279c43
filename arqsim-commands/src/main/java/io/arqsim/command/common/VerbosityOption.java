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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags that adjust the
 * log level of the {@code io.arqsim} loggers.
 */
public class VerbosityOption {

    /** Root of the loggers whose level the flags adjust. */
    public static final String LOGGER_ROOT = "io.arqsim";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }

    /**
     * Level implied by the flags: DEBUG when verbose, ERROR when quiet, otherwise INFO.
     */
    public Level level() {
        if (verbose) {
            return Level.DEBUG;
        }
        return quiet ? Level.ERROR : Level.INFO;
    }

    /**
     * Validates the flags and applies {@link #level()} to the {@code io.arqsim} loggers.
     */
    public void apply() {
        validate();
        Configurator.setLevel(LOGGER_ROOT, level());
    }
}
