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

import java.util.Arrays;
import java.util.Objects;

/// A link-layer frame as it travels over a {@link SimplexChannel}.
///
/// Four kinds exist:
/// - {@link Kind#RR} positive acknowledgment of a sequence number
/// - {@link Kind#SREJ} selective reject naming the next expected sequence number
/// - {@link Kind#DATA} a payload with its sequence number
/// - {@link Kind#CORRUPTED} what the receiving end sees when the channel damaged a frame
///
/// A corrupted frame is a receive-side outcome only. It has no sequence number and
/// no size, and it can never be handed to a channel for transmission.
public final class Frame {

    private static final byte[] NO_PAYLOAD = new byte[0];
    private static final Frame CORRUPTED = new Frame(Kind.CORRUPTED, -1, NO_PAYLOAD);

    /// Frame kinds
    public enum Kind {
        RR,
        SREJ,
        DATA,
        CORRUPTED
    }

    private final Kind kind;
    private final long seq;
    private final byte[] payload;

    private Frame(Kind kind, long seq, byte[] payload) {
        this.kind = kind;
        this.seq = seq;
        this.payload = payload;
    }

    /// @param seq acknowledged sequence number
    /// @return an RR frame
    public static Frame rr(long seq) {
        return new Frame(Kind.RR, seq, NO_PAYLOAD);
    }

    /// @param seq oldest sequence number the receiver is still missing
    /// @return an SREJ frame
    public static Frame srej(long seq) {
        return new Frame(Kind.SREJ, seq, NO_PAYLOAD);
    }

    /// The payload array is held, not copied; callers must not modify it afterwards.
    ///
    /// @param seq sequence number of the payload
    /// @param payload the data carried
    /// @return a DATA frame
    public static Frame data(long seq, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new Frame(Kind.DATA, seq, payload);
    }

    /// @return the shared corrupted marker
    public static Frame corrupted() {
        return CORRUPTED;
    }

    public Kind getKind() {
        return kind;
    }

    /// @return the sequence number
    /// @throws IllegalStateException for a corrupted frame
    public long getSeq() {
        if (kind == Kind.CORRUPTED) {
            throw new IllegalStateException("A corrupted frame carries no sequence number");
        }
        return seq;
    }

    /// @return the payload, empty for control frames
    public byte[] getPayload() {
        return payload;
    }

    public boolean isCorrupted() {
        return kind == Kind.CORRUPTED;
    }

    /// Size of the frame on the wire.
    ///
    /// @param overheadBits header bits added to every frame
    /// @return size in bits
    /// @throws IllegalStateException for a corrupted frame, which is never transmitted
    public long sizeBits(long overheadBits) {
        switch (kind) {
            case RR:
            case SREJ:
                return overheadBits;
            case DATA:
                return payload.length * 8L + overheadBits;
            default:
                throw new IllegalStateException("A corrupted frame is never transmitted and has no size");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Frame frame = (Frame) o;
        return seq == frame.seq && kind == frame.kind && Arrays.equals(payload, frame.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(kind, seq) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        switch (kind) {
            case DATA:
                return "Data(" + seq + ", " + payload.length + " bytes)";
            case CORRUPTED:
                return "Corrupted";
            default:
                return kind + "(" + seq + ")";
        }
    }
}
