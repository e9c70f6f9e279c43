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

/**
 * Worker pool sizing for commands that run independent simulations concurrently.
 * Without {@code -p} or {@code --threads} simulations run one at a time. The pool
 * never has more workers than there are simulations to run.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Run simulations in parallel on all but one CPU core"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of simulation workers (overrides --parallel)"
    )
    private Integer explicitThreads;

    /**
     * @throws IllegalStateException if {@code --threads} is not positive
     */
    public void validate() {
        if (explicitThreads != null && explicitThreads <= 0) {
            throw new IllegalStateException("--threads must be positive, got " + explicitThreads);
        }
    }

    /**
     * Workers asked for on the command line, before any grid is known.
     *
     * @return the requested worker count, at least 1
     */
    public int requestedThreads() {
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        }
        return parallel ? Math.max(1, availableCores() - 1) : 1;
    }

    /**
     * Workers for a grid of independent simulations.
     *
     * @param simulations number of simulations in the grid
     * @return {@code min(requestedThreads(), simulations)}, at least 1
     */
    public int workersFor(long simulations) {
        return (int) Math.max(1, Math.min(requestedThreads(), simulations));
    }

    /**
     * @return true if more workers were requested than there are cores
     */
    public boolean exceedsAvailableCores() {
        return explicitThreads != null && explicitThreads >= availableCores();
    }

    private static int availableCores() {
        return Runtime.getRuntime().availableProcessors();
    }
}
