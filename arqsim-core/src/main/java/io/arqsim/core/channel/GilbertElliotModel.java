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

import io.arqsim.core.config.LinkParameters;

import java.util.Random;

/// Shared state and bookkeeping for the Gilbert-Elliot error models.
///
/// Subclasses implement {@link #transmitBits(long)}; this class validates the
/// span length and keeps the frame, bit and state-occupancy counters.
public abstract class GilbertElliotModel implements ChannelErrorModel {

    protected final LinkParameters parameters;
    protected final Random random;
    protected MarkovState state = MarkovState.GOOD;

    private long frames;
    private long corruptedFrames;
    private long goodStateBits;
    private long badStateBits;

    /// Creates a model in the good state.
    ///
    /// @param parameters error rates and transition probabilities
    /// @param random source of uniform draws
    protected GilbertElliotModel(LinkParameters parameters, Random random) {
        this.parameters = parameters;
        this.random = random;
    }

    @Override
    public final TransmissionOutcome transmit(long bits) {
        if (bits <= 0) {
            throw new IllegalArgumentException("A transmission spans at least one bit, got " + bits);
        }
        boolean corrupted = transmitBits(bits);
        frames++;
        if (corrupted) {
            corruptedFrames++;
        }
        return new TransmissionOutcome(corrupted, state);
    }

    /// Consumes the bits, updating {@link #state} as transitions happen.
    ///
    /// @param bits span length, already validated
    /// @return whether any bit was corrupted
    protected abstract boolean transmitBits(long bits);

    /// Charges bits to the occupancy counter of the given state.
    ///
    /// @param inState state the bits were sent in
    /// @param bits number of bits
    protected void recordOccupancy(MarkovState inState, long bits) {
        if (inState == MarkovState.GOOD) {
            goodStateBits += bits;
        } else {
            badStateBits += bits;
        }
    }

    @Override
    public MarkovState state() {
        return state;
    }

    @Override
    public ChannelStatistics statistics() {
        return new ChannelStatistics(frames, corruptedFrames, goodStateBits + badStateBits,
            goodStateBits, badStateBits);
    }
}
