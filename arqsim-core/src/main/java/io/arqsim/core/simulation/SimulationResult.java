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

import java.util.Locale;

/// Outcome of one closed-form simulation run.
///
/// @param windowSize sender window size
/// @param framePayload payload bytes per frame
/// @param goodput delivered payload bits per simulated second
/// @param retransmissions frames sent again after a failed attempt
/// @param time simulated seconds to deliver the whole file
/// @param framesSent data frame transmissions, first sends and retransmissions
/// @param bitsSent bits those transmissions put on the forward channel, overhead included
/// @param utilization goodput over the link bit rate
public record SimulationResult(
    long windowSize,
    long framePayload,
    double goodput,
    long retransmissions,
    double time,
    long framesSent,
    long bitsSent,
    double utilization
) {

    /// @return goodput in megabits per second
    public double goodputMbps() {
        return goodput / 1_000_000.0;
    }

    /// @return all data bits sent per simulated second
    public double throughput() {
        return time > 0 ? bitsSent / time : 0.0;
    }

    /// @return goodput over throughput, in [0, 1]
    public double efficiency() {
        double throughput = throughput();
        return throughput > 0 ? goodput / throughput : 0.0;
    }

    /// @return share of data frame transmissions that were retransmissions
    public double retransmissionRate() {
        return framesSent > 0 ? (double) retransmissions / framesSent : 0.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "W=%d L=%d goodput=%.4f Mbps utilization=%.4f efficiency=%.4f retransmissions=%d rate=%.4f time=%.3fs",
            windowSize, framePayload, goodputMbps(), utilization, efficiency(), retransmissions,
            retransmissionRate(), time);
    }
}
