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

/// Decides whether a span of bits survives the channel.
///
/// An implementation owns the Markov state of one channel direction. Each call
/// to {@link #transmit(long)} consumes the given number of bits starting in the
/// current state and leaves the model in the state reached after the last bit.
/// Implementations are not thread safe; the owning channel serializes calls.
///
/// Two forms exist with the same statistical contract:
/// - {@link BitLoopErrorModel} samples every bit and serves as the reference
/// - {@link JumpAheadErrorModel} samples run lengths and is the fast path
public interface ChannelErrorModel {

    /// Transmits a span of bits.
    ///
    /// @param bits span length, at least one bit
    /// @return whether the span was corrupted, and the state after it
    /// @throws IllegalArgumentException if bits is not positive
    TransmissionOutcome transmit(long bits);

    /// @return the current Markov state
    MarkovState state();

    /// @return counters accumulated since construction
    ChannelStatistics statistics();
}
