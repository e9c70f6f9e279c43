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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/// Sliding-window state of the Selective-Repeat sender.
///
/// Each sequence number is unsent (at or above {@code nextSeq}), in flight (held in
/// the retransmission store), or acknowledged and retired. The window invariant
/// {@code base <= nextSeq <= base + windowSize} holds after every operation, and
/// {@code base} is the smallest sequence number still in flight, or {@code nextSeq}
/// when nothing is.
///
/// Not thread safe. {@link SimplexLink} guards an instance with its own lock.
public class Sender {

    private static final Logger logger = LogManager.getLogger(Sender.class);

    private final long windowSize;
    private long base;
    private long nextSeq;
    private final Map<Long, byte[]> sentFrames = new HashMap<>();
    private final Map<Long, Long> timers = new HashMap<>();
    private final Map<Long, Double> lastTransmitted = new HashMap<>();

    /// Creates a sender with an empty window.
    /// @param windowSize maximum number of frames in flight
    public Sender(long windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /// Sliding-window admission test.
    /// @return true if another frame fits in the window
    public boolean canSend() {
        return nextSeq < base + windowSize;
    }

    /// Assigns the next sequence number to a payload and keeps it for retransmission.
    ///
    /// Callers check {@link #canSend()} first; this method does not enforce the window.
    ///
    /// @param data the payload
    /// @return the assigned sequence number
    public long sendFrame(byte[] data) {
        long seq = nextSeq;
        sentFrames.put(seq, data);
        nextSeq++;
        return seq;
    }

    /// Retires an acknowledged frame and slides the window.
    ///
    /// Acknowledging a frame above {@code base} only retires it; {@code base} moves once
    /// the base frame itself is acknowledged, skipping every already-retired
    /// sequence number in one pass. Unknown or repeated sequence numbers are ignored.
    ///
    /// @param seq the acknowledged sequence number
    public void handleAck(long seq) {
        logger.trace("ack {} base {}", seq, base);
        if (sentFrames.remove(seq) != null) {
            lastTransmitted.remove(seq);
            while (base < nextSeq && !sentFrames.containsKey(base)) {
                base++;
            }
        }
    }

    /// Looks up a frame named by a selective reject. Does not change any state.
    ///
    /// @param seq the rejected sequence number
    /// @return the payload if the frame is still in flight
    public Optional<byte[]> handleNak(long seq) {
        return Optional.ofNullable(sentFrames.get(seq));
    }

    /// Looks up a frame whose retransmission timer fired.
    ///
    /// @param seq the sequence number
    /// @return the payload if the frame is still in flight
    public Optional<byte[]> frameForTimeout(long seq) {
        return Optional.ofNullable(sentFrames.get(seq));
    }

    /// @param seq a sequence number
    /// @return true if the frame was sent and not yet acknowledged
    public boolean isOutstanding(long seq) {
        return sentFrames.containsKey(seq);
    }

    /// Records the event id of the timer guarding a frame.
    ///
    /// @param seq sequence number
    /// @param eventId timer event id
    /// @return the id of the timer it replaces, if any
    public OptionalLong putTimer(long seq, long eventId) {
        Long previous = timers.put(seq, eventId);
        return previous == null ? OptionalLong.empty() : OptionalLong.of(previous);
    }

    /// Forgets the timer guarding a frame.
    ///
    /// @param seq sequence number
    /// @return the removed timer's event id, if any
    public OptionalLong removeTimer(long seq) {
        Long previous = timers.remove(seq);
        return previous == null ? OptionalLong.empty() : OptionalLong.of(previous);
    }

    /// @param seq sequence number
    /// @return the id of the timer guarding the frame, if any
    public OptionalLong timerFor(long seq) {
        Long id = timers.get(seq);
        return id == null ? OptionalLong.empty() : OptionalLong.of(id);
    }

    /// Notes when a frame last went onto the wire.
    /// @param seq sequence number
    /// @param time simulation time
    public void markTransmitted(long seq, double time) {
        lastTransmitted.put(seq, time);
    }

    /// @param seq sequence number
    /// @return last transmission time, or negative infinity if unknown
    public double lastTransmitted(long seq) {
        return lastTransmitted.getOrDefault(seq, Double.NEGATIVE_INFINITY);
    }

    public long getBase() {
        return base;
    }

    public long getNextSeq() {
        return nextSeq;
    }

    public long getWindowSize() {
        return windowSize;
    }

    /// @return number of frames in flight
    public int outstanding() {
        return sentFrames.size();
    }

    /// @return number of armed timers
    public int activeTimers() {
        return timers.size();
    }
}
