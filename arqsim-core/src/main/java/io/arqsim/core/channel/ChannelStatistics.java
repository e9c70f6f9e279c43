package io.arqsim.core.channel;

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

/// Snapshot of what an error model has seen so far.
///
/// @param frames spans transmitted
/// @param corruptedFrames spans with at least one bit error
/// @param totalBits bits transmitted
/// @param goodStateBits bits transmitted while in the good state
/// @param badStateBits bits transmitted while in the bad state
public record ChannelStatistics(
    long frames,
    long corruptedFrames,
    long totalBits,
    long goodStateBits,
    long badStateBits
) {

    /// Fraction of transmitted bits spent in the bad state.
    /// @return a value in [0, 1], zero before any traffic
    public double badStateFraction() {
        return totalBits == 0 ? 0.0 : (double) badStateBits / totalBits;
    }

    /// Fraction of frames that were corrupted.
    /// @return a value in [0, 1], zero before any traffic
    public double frameErrorRate() {
        return frames == 0 ? 0.0 : (double) corruptedFrames / frames;
    }
}
