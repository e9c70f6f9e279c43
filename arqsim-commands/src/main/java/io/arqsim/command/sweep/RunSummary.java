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

import io.arqsim.core.simulation.SimulationResult;

import java.util.List;
import java.util.Locale;

/// Mean outcome over the runs of one (window, payload) configuration.
///
/// @param windowSize sender window size
/// @param framePayload payload bytes per frame
/// @param runs number of runs averaged
/// @param meanGoodputMbps mean goodput in megabits per second
/// @param minGoodputMbps lowest goodput of any run
/// @param maxGoodputMbps highest goodput of any run
/// @param meanRetransmissions mean retransmission count
/// @param meanTime mean completion time in seconds
/// @param meanUtilization mean goodput over the link bit rate
public record RunSummary(
    long windowSize,
    long framePayload,
    int runs,
    double meanGoodputMbps,
    double minGoodputMbps,
    double maxGoodputMbps,
    double meanRetransmissions,
    double meanTime,
    double meanUtilization
) {

    /// Averages the results of one configuration.
    ///
    /// @param results results sharing window size and payload
    /// @return the summary
    /// @throws IllegalArgumentException if there are no results
    public static RunSummary of(List<SimulationResult> results) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarize zero runs");
        }
        double goodput = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double retransmissions = 0;
        double time = 0;
        double utilization = 0;
        for (SimulationResult result : results) {
            goodput += result.goodputMbps();
            min = Math.min(min, result.goodputMbps());
            max = Math.max(max, result.goodputMbps());
            retransmissions += result.retransmissions();
            time += result.time();
            utilization += result.utilization();
        }
        int n = results.size();
        SimulationResult first = results.get(0);
        return new RunSummary(first.windowSize(), first.framePayload(), n,
            goodput / n, min, max, retransmissions / n, time / n, utilization / n);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "W=%d L=%d runs=%d goodput=%.4f Mbps [%.4f, %.4f] utilization=%.4f retransmissions=%.1f time=%.3fs",
            windowSize, framePayload, runs, meanGoodputMbps, minGoodputMbps, maxGoodputMbps,
            meanUtilization, meanRetransmissions, meanTime);
    }
}
