package io.arqsim.core.transport;

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

/// Cuts a payload into frame-sized segments, in order.
///
/// Every segment but the last is exactly {@code segmentSize} bytes long.
public class TransportSender {

    private final byte[] data;
    private final int segmentSize;
    private int offset;

    /// @param data the payload to send
    /// @param segmentSize maximum bytes per segment
    public TransportSender(byte[] data, int segmentSize) {
        if (segmentSize <= 0) {
            throw new IllegalArgumentException("Segment size must be positive, got " + segmentSize);
        }
        this.data = data;
        this.segmentSize = segmentSize;
    }

    /// @return true while part of the payload is still unsent
    public boolean hasData() {
        return offset < data.length;
    }

    /// Takes the next segment.
    /// @return the segment, or null when the payload is exhausted
    public byte[] nextSegment() {
        if (!hasData()) {
            return null;
        }
        int end = Math.min(data.length, offset + segmentSize);
        byte[] segment = Arrays.copyOfRange(data, offset, end);
        offset = end;
        return segment;
    }

    /// @return number of segments the whole payload splits into
    public long totalSegments() {
        return (data.length + (long) segmentSize - 1) / segmentSize;
    }

    /// @return bytes handed out so far
    public int getOffset() {
        return offset;
    }

    public int getTotalBytes() {
        return data.length;
    }
}
