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
import io.arqsim.command.common.RandomSeedOption;
import io.arqsim.command.common.VerbosityOption;
import io.arqsim.command.sweep.RunSummary;
import io.arqsim.command.sweep.SweepCsvWriter;
import io.arqsim.command.sweep.SweepRow;
import io.arqsim.core.config.LinkParameters;
import io.arqsim.core.simulation.ArqSimulator;
import io.arqsim.core.simulation.SimulationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Runs the closed-form Selective-Repeat simulation for one window size and frame payload.
///
/// Run `r` of `--runs` uses seed `seed + r`. Each run is logged, followed by the mean
/// over all runs; with `-o` every run is also written as a CSV row.
@CommandLine.Command(name = "simulate",
    description = "Run the closed-form ARQ simulation for one window size and frame payload")
public class CMD_arqsim_simulate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_arqsim_simulate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-w", "--window-size"}, required = true,
        description = "Sender window size in frames")
    private long windowSize;

    @CommandLine.Option(names = {"-l", "--frame-payload"}, required = true,
        description = "Payload bytes per frame")
    private long framePayload;

    @CommandLine.Option(names = {"--runs"}, defaultValue = "1",
        description = "Number of runs with consecutive seeds (default: ${DEFAULT-VALUE})")
    private int runs = 1;

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private LinkConfigOption linkConfigOption = new LinkConfigOption();

    @CommandLine.Mixin
    private ErrorModelOption errorModelOption = new ErrorModelOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        verbosityOption.apply();
        if (windowSize <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: window size must be positive");
        }
        if (framePayload <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: frame payload must be positive");
        }
        if (runs <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: runs must be positive");
        }

        try {
            outputFileOption.validate();
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_FILE_EXISTS;
        }

        try {
            LinkParameters parameters = linkConfigOption.resolve();
            logger.info("simulating W={} L={} over {} bytes, {} run(s), seed {}, {} error model",
                windowSize, framePayload, parameters.fileSizeBytes(), runs, randomSeedOption,
                errorModelOption.getErrorModel());

            List<SweepRow> rows = new ArrayList<>(runs);
            List<SimulationResult> results = new ArrayList<>(runs);
            for (int run = 0; run < runs; run++) {
                long seed = randomSeedOption.seedForRun(run);
                ArqSimulator simulator = new ArqSimulator(parameters, errorModelOption.getErrorModel(), seed);
                SimulationResult result = simulator.simulateArq(windowSize, framePayload);
                logger.info("run {}: {}", run, result);
                rows.add(new SweepRow(run, seed, result));
                results.add(result);
            }
            logger.info("mean: {}", RunSummary.of(results));

            if (outputFileOption.isSpecified()) {
                SweepCsvWriter.write(outputFileOption.getOutputPath(), rows);
                logger.info("wrote {} rows to {}", rows.size(), outputFileOption.getOutputPath());
            }
            return EXIT_SUCCESS;
        } catch (IOException | IllegalArgumentException e) {
            logger.error("simulation failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
