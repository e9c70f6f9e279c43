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

/// Summary of one end-to-end transfer.
///
/// @param windowSize sender window size
/// @param frameSize payload bytes per frame
/// @param payloadBytes size of the payload offered for transfer
/// @param completed whether the receiver got the whole payload within the time budget
/// @param payloadIntact whether the bytes received equal the bytes sent
/// @param bytesDelivered bytes released to the receiving upper layer
/// @param completionTime simulated time at which the last byte was delivered, or the time reached when stopped
/// @param dataFramesSent data frame transmissions including retransmissions
/// @param dataBitsSent bits those transmissions put on the forward channel, overhead included
/// @param timeoutRetransmissions retransmissions caused by timers
/// @param nakRetransmissions retransmissions caused by selective rejects
/// @param corruptedFrames frames damaged on either channel
/// @param receiverDroppedFrames frames dropped on a full receive buffer
/// @param eventsProcessed event loop actions run
/// @param averageRtt mean round trip from a frame's last transmission to its RR, or 0 without samples
/// @param linkBitRate forward channel bit rate, the ceiling for goodput
public record TransferReport(
    long windowSize,
    int frameSize,
    long payloadBytes,
    boolean completed,
    boolean payloadIntact,
    long bytesDelivered,
    double completionTime,
    long dataFramesSent,
    long dataBitsSent,
    long timeoutRetransmissions,
    long nakRetransmissions,
    long corruptedFrames,
    long receiverDroppedFrames,
    long eventsProcessed,
    double averageRtt,
    double linkBitRate
) {

    /// @return all retransmissions
    public long retransmissions() {
        return timeoutRetransmissions + nakRetransmissions;
    }

    /// @return delivered payload bits per simulated second
    public double goodput() {
        return completionTime > 0 ? bytesDelivered * 8.0 / completionTime : 0.0;
    }

    /// @return goodput in megabits per second
    public double goodputMbps() {
        return goodput() / 1_000_000.0;
    }

    /// @return all data bits sent per simulated second
    public double throughput() {
        return completionTime > 0 ? dataBitsSent / completionTime : 0.0;
    }

    /// @return goodput over throughput, in [0, 1]
    public double efficiency() {
        double throughput = throughput();
        return throughput > 0 ? goodput() / throughput : 0.0;
    }

    /// @return share of data frame transmissions that were retransmissions
    public double retransmissionRate() {
        return dataFramesSent > 0 ? (double) retransmissions() / dataFramesSent : 0.0;
    }

    /// @return goodput over the link bit rate
    public double utilization() {
        return linkBitRate > 0 ? goodput() / linkBitRate : 0.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "W=%d frame=%d completed=%s intact=%s delivered=%d/%d time=%.4fs goodput=%.4f Mbps"
                + " utilization=%.4f efficiency=%.4f retransmissions=%d (timeout=%d nak=%d rate=%.4f)"
                + " avgRtt=%.6fs corrupted=%d dropped=%d",
            windowSize, frameSize, completed, payloadIntact, bytesDelivered, payloadBytes, completionTime,
            goodputMbps(), utilization(), efficiency(), retransmissions(), timeoutRetransmissions,
            nakRetransmissions, retransmissionRate(), averageRtt, corruptedFrames, receiverDroppedFrames);
    }
}
