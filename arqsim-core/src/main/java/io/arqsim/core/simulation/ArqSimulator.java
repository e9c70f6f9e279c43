package io.arqsim.core.simulation;

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

import io.arqsim.core.channel.ErrorModelKind;
import io.arqsim.core.config.LinkParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point used by the command line and by sweep workers.
 *
 * <p>Holds one immutable parameter set, an error model choice and a seed. Each
 * call builds fresh simulation state, so one instance may serve concurrent callers
 * and repeated calls with the same arguments give the same result.</p>
 */
public class ArqSimulator {

    private static final Logger logger = LogManager.getLogger(ArqSimulator.class);

    private final LinkParameters parameters;
    private final ErrorModelKind errorModelKind;
    private final long seed;
    private final double timeBudget;

    public ArqSimulator(LinkParameters parameters, ErrorModelKind errorModelKind, long seed) {
        this(parameters, errorModelKind, seed, TransferSimulation.DEFAULT_TIME_BUDGET);
    }

    /**
     * @param parameters link parameters
     * @param errorModelKind channel error model for both directions
     * @param seed seed for channel randomness
     * @param timeBudget simulated seconds after which a transfer is abandoned
     */
    public ArqSimulator(LinkParameters parameters, ErrorModelKind errorModelKind, long seed, double timeBudget) {
        this.parameters = parameters;
        this.errorModelKind = errorModelKind;
        this.seed = seed;
        this.timeBudget = timeBudget;
    }

    /**
     * Runs the closed-form simulation of a file of {@link LinkParameters#fileSizeBytes()} bytes.
     *
     * @param windowSize sender window size
     * @param framePayload payload bytes per frame
     * @return goodput, retransmissions and completion time
     */
    public SimulationResult simulateArq(long windowSize, long framePayload) {
        return new ClosedFormSimulation(parameters, errorModelKind, seed).simulate(windowSize, framePayload);
    }

    /**
     * Transfers a payload end to end and returns the report.
     *
     * @param windowSize sender window size
     * @param frameSize payload bytes per data frame
     * @param payload bytes to transfer
     * @return the transfer report
     */
    public TransferReport transfer(long windowSize, int frameSize, byte[] payload) {
        return new TransferSimulation(parameters, errorModelKind, seed)
            .withTimeBudget(timeBudget)
            .run(windowSize, frameSize, payload);
    }

    /**
     * Transfers a payload end to end and logs the outcome.
     *
     * @param windowSize sender window size
     * @param frameSize payload bytes per data frame
     * @param payload bytes to transfer
     */
    public void runTransfer(long windowSize, int frameSize, byte[] payload) {
        TransferReport report = transfer(windowSize, frameSize, payload);
        if (report.completed() && report.payloadIntact()) {
            logger.info("transfer W={} frame={} delivered {} bytes in {}s, goodput {} Mbps, utilization {},"
                    + " {} retransmissions, average rtt {}s",
                windowSize, frameSize, report.bytesDelivered(),
                String.format("%.4f", report.completionTime()),
                String.format("%.4f", report.goodputMbps()),
                String.format("%.4f", report.utilization()),
                report.retransmissions(),
                String.format("%.6f", report.averageRtt()));
        } else {
            logger.warn("transfer W={} frame={} incomplete: {} of {} bytes, intact={}",
                windowSize, frameSize, report.bytesDelivered(), report.payloadBytes(), report.payloadIntact());
        }
    }

    public LinkParameters getParameters() {
        return parameters;
    }

    public ErrorModelKind getErrorModelKind() {
        return errorModelKind;
    }

    public long getSeed() {
        return seed;
    }
}
