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

import io.arqsim.core.channel.ChannelErrorModel;
import io.arqsim.core.channel.ErrorModelKind;
import io.arqsim.core.config.LinkParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Random;

/// Fast Selective-Repeat simulation over a virtual clock, without an event queue.
///
/// The sender walks its window, putting every sequence number that is neither in
/// flight nor acknowledged on the wire back to back. Each frame's fate is decided
/// at send time: it succeeds only if the data frame crosses the forward channel
/// intact and its acknowledgment crosses the reverse channel intact. The outcome
/// becomes known one timeout after the send. Successes are retired; failures count
/// as retransmissions and are sent again on the next pass. When nothing can be
/// sent, the clock jumps to the next pending outcome.
///
/// Timeout: `(roundTripDelay + frameTransmissionTime) * closedFormTimeoutMargin`.
/// Delays are deterministic here, so the timeout only needs a thin margin.
///
/// The result is deterministic for a given seed.
public class ClosedFormSimulation {

    private static final Logger logger = LogManager.getLogger(ClosedFormSimulation.class);

    private final LinkParameters parameters;
    private final ErrorModelKind errorModelKind;
    private final long seed;

    /// @param parameters link parameters, including the file size
    /// @param errorModelKind channel error model to use in both directions
    /// @param seed seed for both channels' randomness
    public ClosedFormSimulation(LinkParameters parameters, ErrorModelKind errorModelKind, long seed) {
        this.parameters = parameters;
        this.errorModelKind = errorModelKind;
        this.seed = seed;
    }

    private record Outcome(double knownAt, boolean success) {
    }

    /// Runs one simulation.
    ///
    /// @param windowSize sender window size
    /// @param framePayload payload bytes per frame
    /// @return goodput, retransmissions and completion time
    public SimulationResult simulate(long windowSize, long framePayload) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got " + windowSize);
        }
        if (framePayload <= 0) {
            throw new IllegalArgumentException("Frame payload must be positive, got " + framePayload);
        }

        long fileSize = parameters.fileSizeBytes();
        long numFrames = (fileSize + framePayload - 1) / framePayload;
        if (numFrames > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many frames for one run: " + numFrames);
        }

        long frameBits = framePayload * 8 + parameters.frameOverheadBits();
        long ackBits = parameters.frameOverheadBits();
        double frameTime = parameters.transmissionTime(frameBits);
        double timeout = (parameters.roundTripDelay() + frameTime) * parameters.closedFormTimeoutMargin();

        Random random = new Random(seed);
        ChannelErrorModel forward = errorModelKind.create(parameters, new Random(random.nextLong()));
        ChannelErrorModel reverse = errorModelKind.create(parameters, new Random(random.nextLong()));

        Map<Long, Outcome> inFlight = new HashMap<>();
        BitSet acked = new BitSet((int) numFrames);
        long base = 0;
        long retransmissions = 0;
        long framesSent = 0;
        double clock = 0.0;

        logger.debug("closed form W={} L={} frames={} timeout={}", windowSize, framePayload, numFrames, timeout);

        while (base < numFrames) {
            long windowEnd = Math.min(numFrames, base + windowSize);
            boolean sent = false;

            for (long seq = base; seq < windowEnd; seq++) {
                if (inFlight.containsKey(seq) || acked.get((int) seq)) {
                    continue;
                }
                boolean success = !forward.transmit(frameBits).corrupted()
                    && !reverse.transmit(ackBits).corrupted();
                inFlight.put(seq, new Outcome(clock + timeout, success));
                clock += frameTime;
                framesSent++;
                sent = true;
            }

            if (!sent) {
                double next = Double.POSITIVE_INFINITY;
                for (Outcome outcome : inFlight.values()) {
                    next = Math.min(next, outcome.knownAt());
                }
                clock = Math.max(clock, next);
            }

            Iterator<Map.Entry<Long, Outcome>> it = inFlight.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Long, Outcome> entry = it.next();
                if (entry.getValue().knownAt() > clock) {
                    continue;
                }
                if (entry.getValue().success()) {
                    acked.set(entry.getKey().intValue());
                } else {
                    retransmissions++;
                }
                it.remove();
            }

            while (base < numFrames && acked.get((int) base)) {
                base++;
            }
        }

        double goodput = fileSize * 8.0 / clock;
        SimulationResult result = new SimulationResult(windowSize, framePayload, goodput, retransmissions, clock,
            framesSent, framesSent * frameBits, goodput / parameters.bitRate());
        logger.debug("closed form result {}", result);
        return result;
    }
}
