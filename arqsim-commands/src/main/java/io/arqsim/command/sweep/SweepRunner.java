package io.arqsim.command.sweep;

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

import io.arqsim.command.common.RandomSeedOption;
import io.arqsim.core.channel.ErrorModelKind;
import io.arqsim.core.config.LinkParameters;
import io.arqsim.core.simulation.ArqSimulator;
import io.arqsim.core.simulation.SimulationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/// Runs the closed-form simulation over a grid of window sizes and frame payloads.
///
/// Every (window, payload, run) point is an independent task on a fixed thread pool
/// of at most `threads` workers, and never more workers than points. Run `r` uses
/// {@link RandomSeedOption#seedForRun(long, int)}, so every configuration sees the
/// same channel randomness and results do not depend on the thread count. Rows come back in grid
/// order: windows outermost, then payloads, then runs.
public class SweepRunner {

    private static final Logger logger = LogManager.getLogger(SweepRunner.class);

    private final LinkParameters parameters;
    private final ErrorModelKind errorModelKind;
    private final long baseSeed;
    private final int threads;

    /// @param parameters link parameters shared by every run
    /// @param errorModelKind channel error model
    /// @param baseSeed seed of run 0
    /// @param threads maximum worker thread count
    public SweepRunner(LinkParameters parameters, ErrorModelKind errorModelKind, long baseSeed, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive, got " + threads);
        }
        this.parameters = parameters;
        this.errorModelKind = errorModelKind;
        this.baseSeed = baseSeed;
        this.threads = threads;
    }

    /// Runs the grid.
    ///
    /// @param windows window sizes
    /// @param payloads frame payloads in bytes
    /// @param runs runs per configuration
    /// @return one row per run, in grid order
    /// @throws InterruptedException if interrupted while waiting for workers
    public List<SweepRow> run(List<Long> windows, List<Long> payloads, int runs) throws InterruptedException {
        if (runs <= 0) {
            throw new IllegalArgumentException("Run count must be positive, got " + runs);
        }
        int total = windows.size() * payloads.size() * runs;
        if (total == 0) {
            return List.of();
        }
        int workers = Math.min(threads, total);
        AtomicInteger completed = new AtomicInteger();
        logger.info("sweeping {} windows x {} payloads x {} runs = {} simulations on {} threads",
            windows.size(), payloads.size(), runs, total, workers);

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<SweepRow>> futures = new ArrayList<>(total);
            for (long window : windows) {
                for (long payload : payloads) {
                    for (int run = 0; run < runs; run++) {
                        int runIndex = run;
                        long seed = RandomSeedOption.seedForRun(baseSeed, run);
                        futures.add(executor.submit(() -> {
                            SimulationResult result = new ArqSimulator(parameters, errorModelKind, seed)
                                .simulateArq(window, payload);
                            int done = completed.incrementAndGet();
                            logger.debug("[{}/{}] run {} {}", done, total, runIndex, result);
                            if (done % Math.max(1, total / 10) == 0 || done == total) {
                                logger.info("progress {}/{} simulations", done, total);
                            }
                            return new SweepRow(runIndex, seed, result);
                        }));
                    }
                }
            }

            List<SweepRow> rows = new ArrayList<>(total);
            for (Future<SweepRow> future : futures) {
                try {
                    rows.add(future.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new IllegalStateException("Simulation failed", cause);
                }
            }
            return rows;
        } finally {
            executor.shutdownNow();
        }
    }

    /// Groups rows by configuration and averages each group, keeping grid order.
    ///
    /// @param rows rows in grid order
    /// @return one summary per configuration
    public static List<RunSummary> summarize(List<SweepRow> rows) {
        List<RunSummary> summaries = new ArrayList<>();
        List<SimulationResult> group = new ArrayList<>();
        for (SweepRow row : rows) {
            SimulationResult result = row.result();
            if (!group.isEmpty()) {
                SimulationResult head = group.get(0);
                if (head.windowSize() != result.windowSize() || head.framePayload() != result.framePayload()) {
                    summaries.add(RunSummary.of(group));
                    group = new ArrayList<>();
                }
            }
            group.add(result);
        }
        if (!group.isEmpty()) {
            summaries.add(RunSummary.of(group));
        }
        return summaries;
    }
}
