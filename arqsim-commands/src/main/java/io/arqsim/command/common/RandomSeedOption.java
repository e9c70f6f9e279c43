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

/// Seed for the channel randomness of one command invocation.
///
/// The base seed is resolved once, so every run of an invocation derives from the
/// same value even when no seed was given. Run `r` of a repeated configuration uses
/// `base + r`: every configuration in a sweep sees the same sequence of channels.
public class RandomSeedOption {

    @CommandLine.Option(
        names = {"-s", "--seed"},
        paramLabel = "SEED",
        description = "Seed of run 0; run r uses SEED + r (default: current time)"
    )
    private Long seed;

    private Long resolved;

    /// @return the base seed, fixed on first use
    public synchronized long baseSeed() {
        if (resolved == null) {
            resolved = seed != null ? seed : System.currentTimeMillis();
        }
        return resolved;
    }

    /// @param run zero-based run index
    /// @return the seed of that run
    public long seedForRun(int run) {
        return seedForRun(baseSeed(), run);
    }

    /// Seed of run `run` when run 0 uses `baseSeed`.
    ///
    /// @param baseSeed seed of run 0
    /// @param run zero-based run index
    /// @return the seed of that run
    public static long seedForRun(long baseSeed, int run) {
        if (run < 0) {
            throw new IllegalArgumentException("Run index must not be negative, got " + run);
        }
        return baseSeed + run;
    }

    /// @return true when the seed came from the command line, so the runs can be repeated
    public boolean isReproducible() {
        return seed != null;
    }

    @Override
    public String toString() {
        return isReproducible() ? String.valueOf(baseSeed()) : baseSeed() + " (time-based)";
    }
}
