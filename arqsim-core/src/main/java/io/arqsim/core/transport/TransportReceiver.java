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

import java.io.ByteArrayOutputStream;
import java.util.List;

/// Reassembles delivered segments into the received payload.
///
/// The link layer delivers segments in sequence order, so reassembly is an append.
public class TransportReceiver {

    private final ByteArrayOutputStream received;
    private final long expectedBytes;
    private long segments;

    /// @param expectedBytes size of the payload being transferred
    public TransportReceiver(long expectedBytes) {
        if (expectedBytes < 0 || expectedBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Expected payload size out of range: " + expectedBytes);
        }
        this.expectedBytes = expectedBytes;
        this.received = new ByteArrayOutputStream((int) expectedBytes);
    }

    /// @param delivered segments released by the link layer, in order
    public void accept(List<byte[]> delivered) {
        for (byte[] segment : delivered) {
            received.write(segment, 0, segment.length);
            segments++;
        }
    }

    /// @return bytes received so far
    public long getReceivedBytes() {
        return received.size();
    }

    /// @return segments received so far
    public long getSegments() {
        return segments;
    }

    /// @return true once the whole payload has arrived
    public boolean isComplete() {
        return received.size() >= expectedBytes;
    }

    /// @return fraction of the payload received, in [0, 1]
    public double progress() {
        return expectedBytes == 0 ? 1.0 : Math.min(1.0, (double) received.size() / expectedBytes);
    }

    /// @return a copy of the bytes received so far
    public byte[] getData() {
        return received.toByteArray();
    }
}
