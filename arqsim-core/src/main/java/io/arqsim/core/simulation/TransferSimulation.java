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
import io.arqsim.core.events.EventLoop;
import io.arqsim.core.link.ReceiveOutcome;
import io.arqsim.core.link.SimplexLink;
import io.arqsim.core.physical.Delivery;
import io.arqsim.core.physical.Frame;
import io.arqsim.core.physical.SimplexChannel;
import io.arqsim.core.transport.TransportReceiver;
import io.arqsim.core.transport.TransportSender;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.Random;

/// End-to-end transfer of a payload over a Selective-Repeat link driven by an {@link EventLoop}.
///
/// The driver wires a forward and a reverse {@link SimplexChannel} into a
/// {@link SimplexLink} and repeats three steps:
/// 1. fill the sender window with new segments, back to back on the sender's own clock
/// 2. take every queued delivery from both channels and handle it at its arrival time
/// 3. when no delivery is waiting, fire the next event
///
/// Deliveries are always handled before the next event fires, so acknowledgments,
/// rejects and timers act in simulated time order. The run ends once the receiver
/// holds the whole payload and the sender has nothing in flight, or when the next
/// event lies beyond the time budget.
///
/// The driver steps the loop itself and reads the channels with
/// {@link SimplexChannel#poll()}. For a loop that runs on its own thread, hand it
/// to an {@link io.arqsim.core.events.EventPump} and read each channel with the
/// blocking {@link SimplexChannel#receive()} instead.
public class TransferSimulation {

    private static final Logger logger = LogManager.getLogger(TransferSimulation.class);

    /// Default simulated time budget, seconds
    public static final double DEFAULT_TIME_BUDGET = 3600.0;

    private final LinkParameters parameters;
    private final ErrorModelKind errorModelKind;
    private final long seed;
    private double timeBudget = DEFAULT_TIME_BUDGET;

    /// @param parameters link parameters
    /// @param errorModelKind channel error model used in both directions
    /// @param seed seed for both channels' randomness
    public TransferSimulation(LinkParameters parameters, ErrorModelKind errorModelKind, long seed) {
        this.parameters = parameters;
        this.errorModelKind = errorModelKind;
        this.seed = seed;
    }

    /// Sets the simulated time after which an unfinished transfer is abandoned.
    ///
    /// @param seconds simulated seconds
    /// @return this simulation for method chaining
    public TransferSimulation withTimeBudget(double seconds) {
        if (!(seconds > 0)) {
            throw new IllegalArgumentException("Time budget must be positive, got " + seconds);
        }
        this.timeBudget = seconds;
        return this;
    }

    /// Transfers a payload.
    ///
    /// @param windowSize sender window size
    /// @param frameSize payload bytes per data frame
    /// @param payload the bytes to transfer
    /// @return what happened
    public TransferReport run(long windowSize, int frameSize, byte[] payload) {
        if (frameSize <= 0) {
            throw new IllegalArgumentException("Frame size must be positive, got " + frameSize);
        }

        EventLoop eventLoop = new EventLoop();
        Random random = new Random(seed);
        SimplexChannel forward = SimplexChannel.forward(eventLoop,
            errorModelKind.create(parameters, new Random(random.nextLong())), parameters);
        SimplexChannel reverse = SimplexChannel.reverse(eventLoop,
            errorModelKind.create(parameters, new Random(random.nextLong())), parameters);
        SimplexLink link = new SimplexLink(forward, reverse, eventLoop, parameters, windowSize);

        TransportSender transportSender = new TransportSender(payload, frameSize);
        TransportReceiver transportReceiver = new TransportReceiver(payload.length);

        logger.debug("transfer W={} frame={} payload={} segments={} error model={}",
            windowSize, frameSize, payload.length, transportSender.totalSegments(), errorModelKind);

        double sendClock = 0.0;
        double completionTime = transportReceiver.isComplete() ? 0.0 : Double.NaN;
        long events = 0;
        boolean timedOut = false;

        while (!(transportReceiver.isComplete() && link.isDrained())) {
            sendClock = Math.max(sendClock, eventLoop.now());
            while (transportSender.hasData() && link.canSend()) {
                OptionalDouble duration = link.sendData(sendClock, transportSender.nextSegment());
                sendClock += duration.orElseThrow();
            }

            boolean handled = false;
            Delivery delivery;
            while ((delivery = reverse.poll()) != null) {
                handleControl(link, delivery);
                handled = true;
            }
            while ((delivery = forward.poll()) != null) {
                handleData(link, transportReceiver, delivery);
                if (Double.isNaN(completionTime) && transportReceiver.isComplete()) {
                    completionTime = delivery.arrivalTime();
                    logger.debug("payload complete at {}", completionTime);
                }
                handled = true;
            }
            if (handled) {
                continue;
            }

            if (eventLoop.pendingCount() == 0) {
                logger.warn("transfer stalled with no pending events at {}", eventLoop.now());
                break;
            }
            if (eventLoop.peekTime() > timeBudget) {
                timedOut = true;
                break;
            }
            if (eventLoop.advance()) {
                events++;
            }
        }

        boolean completed = transportReceiver.isComplete();
        byte[] received = transportReceiver.getData();
        if (!completed) {
            completionTime = eventLoop.now();
        }
        if (timedOut) {
            logger.warn("transfer W={} frame={} stopped at the {}s time budget with {} of {} bytes",
                windowSize, frameSize, timeBudget, received.length, payload.length);
        }

        return new TransferReport(
            windowSize,
            frameSize,
            payload.length,
            completed,
            Arrays.equals(received, payload),
            received.length,
            completionTime,
            link.getDataFramesSent(),
            link.getDataBitsSent(),
            link.getTimeoutRetransmissions(),
            link.getNakRetransmissions(),
            forward.getFramesCorrupted() + reverse.getFramesCorrupted(),
            link.getReceiverDroppedFrames(),
            events,
            link.getAverageRtt(),
            parameters.bitRate()
        );
    }

    private void handleControl(SimplexLink link, Delivery delivery) {
        Frame frame = delivery.frame();
        switch (frame.getKind()) {
            case RR:
                link.handleAck(delivery.arrivalTime(), frame.getSeq());
                break;
            case SREJ:
                link.handleNak(delivery.arrivalTime(), frame.getSeq());
                break;
            case CORRUPTED:
                break;
            default:
                logger.debug("data frame {} on the reverse channel ignored", frame);
        }
    }

    private void handleData(SimplexLink link, TransportReceiver transportReceiver, Delivery delivery) {
        Frame frame = delivery.frame();
        long seq = frame.isCorrupted() ? -1 : frame.getSeq();
        ReceiveOutcome outcome = link.receiveFrame(seq, frame);
        transportReceiver.accept(outcome.delivered());
        outcome.response().ifPresent(response -> {
            if (response.getKind() == Frame.Kind.RR) {
                link.sendAck(delivery.arrivalTime(), response.getSeq());
            } else {
                link.sendNak(delivery.arrivalTime(), response.getSeq());
            }
        });
    }
}
