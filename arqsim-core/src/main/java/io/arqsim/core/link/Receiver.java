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

import io.arqsim.core.physical.Frame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Out-of-order tolerant Selective-Repeat receiver.
///
/// Frames above {@code base} are buffered while the total buffered payload stays
/// within {@code maxBufferSize}; a frame that would exceed it is dropped and left to
/// the sender's timeout. Buffered frames are released as soon as the gap below them
/// is filled.
///
/// Not thread safe. {@link SimplexLink} guards an instance with its own lock.
public class Receiver {

    private static final Logger logger = LogManager.getLogger(Receiver.class);

    private long base;
    private final Map<Long, byte[]> buffer = new HashMap<>();
    private long bufferSize;
    private final long maxBufferSize;
    private long droppedFrames;

    /// Creates a receiver expecting sequence number zero.
    /// @param maxBufferSize cap on buffered out-of-order payload bytes
    public Receiver(long maxBufferSize) {
        if (maxBufferSize <= 0) {
            throw new IllegalArgumentException("Receive buffer size must be positive, got " + maxBufferSize);
        }
        this.maxBufferSize = maxBufferSize;
    }

    /// Handles one frame from the forward channel.
    ///
    /// @param seq the frame's sequence number, ignored for corrupted frames
    /// @param frame the frame as delivered
    /// @return the response to send back and the payloads released in order
    public ReceiveOutcome receiveFrame(long seq, Frame frame) {
        switch (frame.getKind()) {
            case CORRUPTED:
                // recovery is left to the sender's timeout
                return ReceiveOutcome.silent();
            case DATA:
                return receiveData(seq, frame.getPayload());
            default:
                logger.debug("control frame {} on the data path ignored", frame);
                return ReceiveOutcome.silent();
        }
    }

    private ReceiveOutcome receiveData(long seq, byte[] payload) {
        if (seq == base) {
            List<byte[]> delivered = new ArrayList<>();
            delivered.add(payload);
            base++;
            byte[] next;
            while ((next = buffer.remove(base)) != null) {
                bufferSize -= next.length;
                delivered.add(next);
                base++;
            }
            logger.trace("in order {} delivered {} base now {}", seq, delivered.size(), base);
            return new ReceiveOutcome(Optional.of(Frame.rr(seq)), delivered);
        }

        if (seq > base) {
            if (!buffer.containsKey(seq)) {
                if (bufferSize + payload.length <= maxBufferSize) {
                    buffer.put(seq, payload);
                    bufferSize += payload.length;
                } else {
                    droppedFrames++;
                    logger.trace("buffer full, dropped {} ({} of {} bytes used)", seq, bufferSize, maxBufferSize);
                }
            }
            return new ReceiveOutcome(Optional.of(Frame.srej(base)), List.of());
        }

        // already delivered; acknowledge again so the sender can retire it
        return new ReceiveOutcome(Optional.of(Frame.rr(seq)), List.of());
    }

    /// @return next expected sequence number
    public long getBase() {
        return base;
    }

    /// @return bytes held in the out-of-order buffer
    public long getBufferSize() {
        return bufferSize;
    }

    public long getMaxBufferSize() {
        return maxBufferSize;
    }

    /// @return number of frames held in the out-of-order buffer
    public int bufferedFrames() {
        return buffer.size();
    }

    /// @return frames dropped because the buffer was full
    public long getDroppedFrames() {
        return droppedFrames;
    }
}
