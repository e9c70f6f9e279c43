package io.arqsim.core.link;

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

import io.arqsim.core.config.LinkParameters;
import io.arqsim.core.events.EventLoop;
import io.arqsim.core.physical.Frame;
import io.arqsim.core.physical.SendReceipt;
import io.arqsim.core.physical.SimplexChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.locks.ReentrantLock;

/// Selective-Repeat link between one sender and one receiver.
///
/// Data frames travel on the forward channel, RR and SREJ frames on the reverse
/// channel. Sender and receiver state each sit behind their own lock, held for
/// one logical operation and never across a channel send.
///
/// Every frame in flight has one retransmission timer on the {@link EventLoop}.
/// An acknowledgment cancels it. When it fires for a frame that is still in flight,
/// the frame is retransmitted and a new timer is scheduled at
/// `fire time + timeoutMultiplier * round trip estimate`; each firing schedules
/// at most one successor, so long runs never nest. A timer that fires after its
/// frame was acknowledged does nothing.
///
/// A selective reject retransmits the named frame immediately and restarts its
/// timer, unless the frame already went out within its round trip estimate. In that
/// case the reject was caused by frames sent before the retransmission could have
/// arrived and is ignored.
///
/// Each RR for a frame still in flight yields one round trip sample: its arrival
/// time minus the frame's most recent transmission.
public class SimplexLink {

    private static final Logger logger = LogManager.getLogger(SimplexLink.class);

    private final Sender sender;
    private final ReentrantLock senderLock = new ReentrantLock();
    private final Receiver receiver;
    private final ReentrantLock receiverLock = new ReentrantLock();

    private final SimplexChannel forwardChannel;
    private final SimplexChannel reverseChannel;
    private final EventLoop eventLoop;
    private final LinkParameters parameters;

    private final AtomicLong dataFramesSent = new AtomicLong();
    private final AtomicLong timeoutRetransmissions = new AtomicLong();
    private final AtomicLong nakRetransmissions = new AtomicLong();
    private final AtomicLong suppressedNaks = new AtomicLong();
    private final AtomicLong dataBitsSent = new AtomicLong();
    private final AtomicLong rttSamples = new AtomicLong();
    private final DoubleAdder rttTotal = new DoubleAdder();

    /// Creates a link.
    ///
    /// @param forwardChannel channel carrying data frames
    /// @param reverseChannel channel carrying RR and SREJ frames
    /// @param eventLoop loop on which timers are scheduled
    /// @param parameters link parameters
    /// @param windowSize sender window size
    public SimplexLink(SimplexChannel forwardChannel, SimplexChannel reverseChannel, EventLoop eventLoop,
                       LinkParameters parameters, long windowSize) {
        this.sender = new Sender(windowSize);
        this.receiver = new Receiver(parameters.receiverBufferBytes());
        this.forwardChannel = forwardChannel;
        this.reverseChannel = reverseChannel;
        this.eventLoop = eventLoop;
        this.parameters = parameters;
    }

    /// Sends a new data frame if the window has room.
    ///
    /// @param currentTime simulation time at which transmission starts
    /// @param data the payload
    /// @return the frame's transmission duration, or empty when the window is full
    public OptionalDouble sendData(double currentTime, byte[] data) {
        long seq;
        senderLock.lock();
        try {
            if (!sender.canSend()) {
                return OptionalDouble.empty();
            }
            seq = sender.sendFrame(data);
            sender.markTransmitted(seq, currentTime);
        } finally {
            senderLock.unlock();
        }

        logger.trace("sending {} ({} bytes) at {}", seq, data.length, currentTime);
        SendReceipt receipt = forwardChannel.send(currentTime, Frame.data(seq, data));
        countDataFrame(data);
        armTimer(seq, currentTime, receipt.roundTripEstimate());
        return OptionalDouble.of(receipt.propagationDuration());
    }

    /// Passes a frame from the forward channel to the receiver.
    ///
    /// @param seq the frame's sequence number, ignored for corrupted frames
    /// @param frame the frame as delivered
    /// @return the response and delivered payloads
    public ReceiveOutcome receiveFrame(long seq, Frame frame) {
        receiverLock.lock();
        try {
            return receiver.receiveFrame(seq, frame);
        } finally {
            receiverLock.unlock();
        }
    }

    /// Handles an RR at the sender: samples the round trip, cancels the frame's
    /// timer and slides the window.
    ///
    /// @param currentTime simulation time of the acknowledgment's arrival
    /// @param seq acknowledged sequence number
    public void handleAck(double currentTime, long seq) {
        OptionalLong timer;
        double sentAt = Double.NEGATIVE_INFINITY;
        senderLock.lock();
        try {
            if (sender.isOutstanding(seq)) {
                sentAt = sender.lastTransmitted(seq);
            }
            timer = sender.removeTimer(seq);
            sender.handleAck(seq);
        } finally {
            senderLock.unlock();
        }
        timer.ifPresent(eventLoop::cancel);
        if (sentAt != Double.NEGATIVE_INFINITY) {
            rttTotal.add(currentTime - sentAt);
            rttSamples.incrementAndGet();
        }
    }

    /// Handles an SREJ at the sender.
    ///
    /// @param currentTime simulation time of the reject's arrival
    /// @param seq rejected sequence number
    /// @return true if the frame was retransmitted
    public boolean handleNak(double currentTime, long seq) {
        byte[] data;
        senderLock.lock();
        try {
            Optional<byte[]> stored = sender.handleNak(seq);
            if (stored.isEmpty()) {
                return false;
            }
            data = stored.get();
            double since = currentTime - sender.lastTransmitted(seq);
            if (since < roundTripEstimate(data.length)) {
                suppressedNaks.incrementAndGet();
                logger.trace("nak {} ignored, retransmitted {} ago", seq, since);
                return false;
            }
            sender.markTransmitted(seq, currentTime);
        } finally {
            senderLock.unlock();
        }

        logger.trace("nak {} retransmitting at {}", seq, currentTime);
        SendReceipt receipt = forwardChannel.send(currentTime, Frame.data(seq, data));
        countDataFrame(data);
        nakRetransmissions.incrementAndGet();
        armTimer(seq, currentTime, receipt.roundTripEstimate());
        return true;
    }

    /// Sends an RR on the reverse channel.
    /// @param currentTime simulation time
    /// @param seq acknowledged sequence number
    public void sendAck(double currentTime, long seq) {
        reverseChannel.send(currentTime, Frame.rr(seq));
    }

    /// Sends an SREJ on the reverse channel.
    /// @param currentTime simulation time
    /// @param seq oldest missing sequence number
    public void sendNak(double currentTime, long seq) {
        reverseChannel.send(currentTime, Frame.srej(seq));
    }

    /// @return true if the sender window has room
    public boolean canSend() {
        senderLock.lock();
        try {
            return sender.canSend();
        } finally {
            senderLock.unlock();
        }
    }

    /// @return true when every frame sent so far has been acknowledged
    public boolean isDrained() {
        senderLock.lock();
        try {
            return sender.outstanding() == 0;
        } finally {
            senderLock.unlock();
        }
    }

    /// @return the sender's window base
    public long getSendBase() {
        senderLock.lock();
        try {
            return sender.getBase();
        } finally {
            senderLock.unlock();
        }
    }

    /// @return the next sequence number the sender will assign
    public long getNextSeq() {
        senderLock.lock();
        try {
            return sender.getNextSeq();
        } finally {
            senderLock.unlock();
        }
    }

    /// @return number of armed retransmission timers
    public int getActiveTimers() {
        senderLock.lock();
        try {
            return sender.activeTimers();
        } finally {
            senderLock.unlock();
        }
    }

    /// @return the receiver's next expected sequence number
    public long getReceiveBase() {
        receiverLock.lock();
        try {
            return receiver.getBase();
        } finally {
            receiverLock.unlock();
        }
    }

    /// @return frames the receiver dropped on a full buffer
    public long getReceiverDroppedFrames() {
        receiverLock.lock();
        try {
            return receiver.getDroppedFrames();
        } finally {
            receiverLock.unlock();
        }
    }

    /// @return data frame transmissions, first sends and retransmissions
    public long getDataFramesSent() {
        return dataFramesSent.get();
    }

    /// @return bits put on the forward channel by data frames, overhead included
    public long getDataBitsSent() {
        return dataBitsSent.get();
    }

    /// @return number of round trip samples taken
    public long getRttSamples() {
        return rttSamples.get();
    }

    /// @return mean of the round trip samples, or 0 when there are none
    public double getAverageRtt() {
        long samples = rttSamples.get();
        return samples == 0 ? 0.0 : rttTotal.sum() / samples;
    }

    /// @return retransmissions caused by timers and by selective rejects
    public long getRetransmissions() {
        return timeoutRetransmissions.get() + nakRetransmissions.get();
    }

    public long getTimeoutRetransmissions() {
        return timeoutRetransmissions.get();
    }

    public long getNakRetransmissions() {
        return nakRetransmissions.get();
    }

    public long getSuppressedNaks() {
        return suppressedNaks.get();
    }

    public SimplexChannel getForwardChannel() {
        return forwardChannel;
    }

    public SimplexChannel getReverseChannel() {
        return reverseChannel;
    }

    private double roundTripEstimate(int payloadBytes) {
        long overhead = parameters.frameOverheadBits();
        return parameters.transmissionTime(payloadBytes * 8L + overhead)
            + parameters.roundTripDelay()
            + parameters.transmissionTime(overhead);
    }

    private void countDataFrame(byte[] data) {
        dataFramesSent.incrementAndGet();
        dataBitsSent.addAndGet(data.length * 8L + parameters.frameOverheadBits());
    }

    private void armTimer(long seq, double from, double roundTrip) {
        double deadline = from + parameters.timeoutMultiplier() * roundTrip;
        long timerId = eventLoop.schedule(deadline, time -> onTimeout(seq, time));

        boolean outstanding;
        OptionalLong replaced = OptionalLong.empty();
        senderLock.lock();
        try {
            outstanding = sender.isOutstanding(seq);
            if (outstanding) {
                replaced = sender.putTimer(seq, timerId);
            }
        } finally {
            senderLock.unlock();
        }

        if (!outstanding) {
            // acknowledged while the timer was being set up
            eventLoop.cancel(timerId);
        }
        replaced.ifPresent(eventLoop::cancel);
        logger.trace("timer {} for {} at {}", timerId, seq, deadline);
    }

    private void onTimeout(long seq, double time) {
        byte[] data;
        senderLock.lock();
        try {
            Optional<byte[]> stored = sender.frameForTimeout(seq);
            if (stored.isEmpty()) {
                return;
            }
            data = stored.get();
            sender.removeTimer(seq);
            sender.markTransmitted(seq, time);
        } finally {
            senderLock.unlock();
        }

        logger.trace("timeout {} retransmitting at {}", seq, time);
        SendReceipt receipt = forwardChannel.send(time, Frame.data(seq, data));
        countDataFrame(data);
        timeoutRetransmissions.incrementAndGet();
        armTimer(seq, time, receipt.roundTripEstimate());
    }
}
