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
import io.arqsim.command.common.RandomSeedOption;
import io.arqsim.command.common.VerbosityOption;
import io.arqsim.core.config.LinkParameters;
import io.arqsim.core.simulation.ArqSimulator;
import io.arqsim.core.simulation.TransferReport;
import io.arqsim.core.simulation.TransferSimulation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.Callable;

/// Transfers a payload end to end over the event-driven Selective-Repeat link.
///
/// The payload is either random bytes drawn from the seed or the contents of a file.
/// Exits with 0 only when the receiver got the exact payload within the time budget.
@CommandLine.Command(name = "transfer",
    description = "Transfer a payload end to end over the event-driven ARQ link")
public class CMD_arqsim_transfer implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_arqsim_transfer.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_INCOMPLETE = 1;
    private static final int EXIT_ERROR = 2;

    /// Either a generated payload size or an input file
    static class PayloadSource {
        @CommandLine.Option(names = {"--payload-size"}, description = "Bytes of random payload to transfer")
        Integer payloadSize;

        @CommandLine.Option(names = {"--input"}, description = "File whose contents are transferred")
        Path input;
    }

    @CommandLine.Option(names = {"-w", "--window-size"}, required = true,
        description = "Sender window size in frames")
    private long windowSize;

    @CommandLine.Option(names = {"--frame-size"}, required = true,
        description = "Payload bytes per data frame")
    private int frameSize;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private PayloadSource payloadSource;

    @CommandLine.Option(names = {"--time-budget"},
        description = "Simulated seconds before an unfinished transfer is abandoned (default: 3600)")
    private double timeBudget = TransferSimulation.DEFAULT_TIME_BUDGET;

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private LinkConfigOption linkConfigOption = new LinkConfigOption();

    @CommandLine.Mixin
    private ErrorModelOption errorModelOption = new ErrorModelOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private byte[] loadPayload(long seed) throws IOException {
        if (payloadSource.input != null) {
            if (!Files.isRegularFile(payloadSource.input)) {
                throw new IOException("Input file not found: " + payloadSource.input);
            }
            return Files.readAllBytes(payloadSource.input);
        }
        if (payloadSource.payloadSize < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: payload size cannot be negative");
        }
        byte[] data = new byte[payloadSource.payloadSize];
        new Random(seed).nextBytes(data);
        return data;
    }

    @Override
    public Integer call() {
        verbosityOption.apply();
        if (windowSize <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: window size must be positive");
        }
        if (frameSize <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: frame size must be positive");
        }
        if (!(timeBudget > 0)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: time budget must be positive");
        }

        try {
            LinkParameters parameters = linkConfigOption.resolve();
            long seed = randomSeedOption.baseSeed();
            byte[] payload = loadPayload(seed);
            logger.info("transferring {} bytes, W={} frame={} seed {} {} error model",
                payload.length, windowSize, frameSize, seed, errorModelOption.getErrorModel());

            ArqSimulator simulator = new ArqSimulator(parameters, errorModelOption.getErrorModel(), seed, timeBudget);
            TransferReport report = simulator.transfer(windowSize, frameSize, payload);

            logger.info("completed={} intact={} delivered={} bytes time={}s goodput={} Mbps",
                report.completed(), report.payloadIntact(), report.bytesDelivered(),
                String.format("%.4f", report.completionTime()), String.format("%.4f", report.goodputMbps()));
            logger.info("data frames sent={} retransmissions={} (timeout {}, reject {}) corrupted={} dropped={}",
                report.dataFramesSent(), report.retransmissions(), report.timeoutRetransmissions(),
                report.nakRetransmissions(), report.corruptedFrames(), report.receiverDroppedFrames());
            logger.info("utilization={} efficiency={} retransmission rate={} average rtt={}s",
                String.format("%.4f", report.utilization()), String.format("%.4f", report.efficiency()),
                String.format("%.4f", report.retransmissionRate()), String.format("%.6f", report.averageRtt()));

            return report.completed() && report.payloadIntact() ? EXIT_SUCCESS : EXIT_INCOMPLETE;
        } catch (IOException | IllegalArgumentException e) {
            logger.error("transfer failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
