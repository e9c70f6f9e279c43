package io.arqsim.command.subcommands;

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

import io.arqsim.command.common.ErrorModelOption;
import io.arqsim.command.common.LinkConfigOption;
import io.arqsim.command.common.OutputFileOption;
import io.arqsim.command.common.ParallelExecutionOption;
import io.arqsim.command.common.RandomSeedOption;
import io.arqsim.command.common.VerbosityOption;
import io.arqsim.command.sweep.RunSummary;
import io.arqsim.command.sweep.SweepCsvWriter;
import io.arqsim.command.sweep.SweepRow;
import io.arqsim.command.sweep.SweepRunner;
import io.arqsim.core.config.LinkParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/// Sweeps the closed-form simulation over window sizes and frame payloads and writes
/// every run to CSV.
///
/// Columns: `window_size,frame_payload,run,goodput_mbps,retransmissions,time_seconds`.
@CommandLine.Command(name = "sweep",
    description = "Sweep window sizes and frame payloads, writing every run to CSV")
public class CMD_arqsim_sweep implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_arqsim_sweep.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"--windows"}, split = ",", defaultValue = "2,4,8,16,32,64",
        description = "Comma separated window sizes (default: ${DEFAULT-VALUE})")
    private List<Long> windows;

    @CommandLine.Option(names = {"--payloads"}, split = ",", defaultValue = "128,256,512,1024,2048,4096",
        description = "Comma separated frame payloads in bytes (default: ${DEFAULT-VALUE})")
    private List<Long> payloads;

    @CommandLine.Option(names = {"--runs"}, defaultValue = "5",
        description = "Runs per configuration with consecutive seeds (default: ${DEFAULT-VALUE})")
    private int runs = 5;

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private LinkConfigOption linkConfigOption = new LinkConfigOption();

    @CommandLine.Mixin
    private ErrorModelOption errorModelOption = new ErrorModelOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private void validateArguments() {
        if (!outputFileOption.isSpecified()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: --output is required for a sweep");
        }
        if (windows.isEmpty() || windows.stream().anyMatch(w -> w <= 0)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: window sizes must be positive");
        }
        if (payloads.isEmpty() || payloads.stream().anyMatch(l -> l <= 0)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: frame payloads must be positive");
        }
        if (runs <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: runs must be positive");
        }
        try {
            parallelExecutionOption.validate();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }
    }

    @Override
    public Integer call() {
        verbosityOption.apply();
        validateArguments();

        try {
            outputFileOption.validate();
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_FILE_EXISTS;
        }

        if (parallelExecutionOption.exceedsAvailableCores()) {
            logger.warn("Specified thread count ({}) >= available cores ({}). This may cause contention.",
                parallelExecutionOption.requestedThreads(), Runtime.getRuntime().availableProcessors());
        }

        try {
            LinkParameters parameters = linkConfigOption.resolve();
            long seed = randomSeedOption.baseSeed();
            long simulations = (long) windows.size() * payloads.size() * runs;
            SweepRunner runner = new SweepRunner(parameters, errorModelOption.getErrorModel(), seed,
                parallelExecutionOption.workersFor(simulations));

            List<SweepRow> rows = runner.run(windows, payloads, runs);
            for (RunSummary summary : SweepRunner.summarize(rows)) {
                logger.info("{}", summary);
            }

            SweepCsvWriter.write(outputFileOption.getOutputPath(), rows);
            logger.info("wrote {} rows to {} (seed {})", rows.size(), outputFileOption.getOutputPath(), randomSeedOption);
            return EXIT_SUCCESS;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("sweep interrupted");
            return EXIT_ERROR;
        } catch (IOException | RuntimeException e) {
            logger.error("sweep failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
