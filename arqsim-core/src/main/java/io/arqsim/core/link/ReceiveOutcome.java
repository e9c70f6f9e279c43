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

import java.util.List;
import java.util.Optional;

/// What the receiver does with one incoming frame.
///
/// @param response the RR or SREJ to send back, if any
/// @param delivered payloads released to the upper layer, in sequence order
public record ReceiveOutcome(Optional<Frame> response, List<byte[]> delivered) {

    private static final ReceiveOutcome SILENT = new ReceiveOutcome(Optional.empty(), List.of());

    /// @return the outcome with no response and no delivery
    public static ReceiveOutcome silent() {
        return SILENT;
    }

    /// @return total bytes delivered
    public long deliveredBytes() {
        long total = 0;
        for (byte[] payload : delivered) {
            total += payload.length;
        }
        return total;
    }
}
