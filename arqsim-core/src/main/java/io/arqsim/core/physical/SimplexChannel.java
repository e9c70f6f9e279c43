package io.arqsim.core.physical;

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
import io.arqsim.core.channel.ChannelStatistics;
import io.arqsim.core.channel.TransmissionOutcome;
import io.arqsim.core.config.LinkParameters;
import io.arqsim.core.events.EventLoop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/// One-directional transmission medium.
///
/// A send runs the frame's bits through the channel's error model, which owns
/// the Markov state of this direction, and schedules the arrival on the
/// {@link EventLoop} at
/// `now + size / bitRate + pathDelay + processingDelay`. When the arrival
/// fires, the frame (or {@link Frame#corrupted()}) is appended to an unbounded
/// delivery queue read by the single consumer at the far end.
///
/// Sends may come from several threads; they are serialized so that no two
/// frames interleave their bit consumption.
public class SimplexChannel {

    private static final Logger logger = LogManager.getLogger(SimplexChannel.class);

    private final String name;
    private final EventLoop eventLoop;
    private final ChannelErrorModel errorModel;
    private final LinkParameters parameters;
    private final double pathDelay;

    private final ReentrantLock sendLock = new ReentrantLock();
    private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
    private final AtomicLong framesSent = new AtomicLong();
    private final AtomicLong framesCorrupted = new AtomicLong();

    /// Creates a channel.
    ///
    /// @param name label used in logs
    /// @param eventLoop loop on which arrivals are scheduled
    /// @param errorModel error model owning this direction's channel state
    /// @param parameters link parameters
    /// @param pathDelay propagation delay of this direction, seconds
    public SimplexChannel(String name, EventLoop eventLoop, ChannelErrorModel errorModel,
                          LinkParameters parameters, double pathDelay) {
        if (pathDelay < 0) {
            throw new IllegalArgumentException("Path delay cannot be negative: " + pathDelay);
        }
        this.name = name;
        this.eventLoop = eventLoop;
        this.errorModel = errorModel;
        this.parameters = parameters;
        this.pathDelay = pathDelay;
    }

    /// Sender-to-receiver channel using the forward path delay.
    /// @param eventLoop loop on which arrivals are scheduled
    /// @param errorModel error model for this direction
    /// @param parameters link parameters
    /// @return a forward channel
    public static SimplexChannel forward(EventLoop eventLoop, ChannelErrorModel errorModel,
                                         LinkParameters parameters) {
        return new SimplexChannel("forward", eventLoop, errorModel, parameters, parameters.forwardPathDelay());
    }

    /// Receiver-to-sender channel using the reverse path delay.
    /// @param eventLoop loop on which arrivals are scheduled
    /// @param errorModel error model for this direction
    /// @param parameters link parameters
    /// @return a reverse channel
    public static SimplexChannel reverse(EventLoop eventLoop, ChannelErrorModel errorModel,
                                         LinkParameters parameters) {
        return new SimplexChannel("reverse", eventLoop, errorModel, parameters, parameters.reversePathDelay());
    }

    /// Transmits a frame.
    ///
    /// @param currentTime simulation time at which transmission starts
    /// @param frame the frame; never {@link Frame#corrupted()}
    /// @return transmission duration and round trip estimate for this frame
    /// @throws IllegalStateException if the frame is the corrupted marker
    public SendReceipt send(double currentTime, Frame frame) {
        long sizeBits = frame.sizeBits(parameters.frameOverheadBits());

        TransmissionOutcome outcome;
        sendLock.lock();
        try {
            outcome = errorModel.transmit(sizeBits);
        } finally {
            sendLock.unlock();
        }

        double propagation = parameters.transmissionTime(sizeBits);
        double arrival = currentTime + propagation + pathDelay + parameters.processingDelay();
        Frame delivered = outcome.corrupted() ? Frame.corrupted() : frame;

        framesSent.incrementAndGet();
        if (outcome.corrupted()) {
            framesCorrupted.incrementAndGet();
        }
        logger.trace("{} send {} at {} arrives {} corrupted={} state={}",
            name, frame, currentTime, arrival, outcome.corrupted(), outcome.finalState());

        eventLoop.schedule(arrival, time -> deliveries.add(new Delivery(time, delivered)));

        double rtt = propagation + parameters.roundTripDelay()
            + parameters.transmissionTime(parameters.frameOverheadBits());
        return new SendReceipt(propagation, rtt);
    }

    /// Waits for the next delivered frame.
    ///
    /// @return the delivery
    /// @throws InterruptedException if interrupted while waiting
    public Delivery receive() throws InterruptedException {
        return deliveries.take();
    }

    /// Takes the next delivered frame if one is queued.
    ///
    /// @return the delivery, or null when nothing has arrived
    public Delivery poll() {
        return deliveries.poll();
    }

    /// @return deliveries queued and not yet taken
    public int backlog() {
        return deliveries.size();
    }

    public String getName() {
        return name;
    }

    public long getFramesSent() {
        return framesSent.get();
    }

    public long getFramesCorrupted() {
        return framesCorrupted.get();
    }

    /// Counters of the underlying error model.
    /// @return error model statistics
    public ChannelStatistics getChannelStatistics() {
        sendLock.lock();
        try {
            return errorModel.statistics();
        } finally {
            sendLock.unlock();
        }
    }
}
