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

/// Gilbert-Elliot model evaluated one bit at a time.
///
/// Every bit takes two independent uniform draws. The first marks the frame
/// corrupted when it falls below the current state's bit error rate. The second
/// moves the chain to the other state for the next bit when it falls below the
/// current state's transition probability. Sharing one draw between the two
/// decisions would tie every bit error to a state change. Draws continue after
/// the first error so that the state process stays correct for the following
/// frames.
///
/// This is the accuracy baseline for {@link JumpAheadErrorModel}; it costs
/// O(bits) per frame.
public class BitLoopErrorModel extends GilbertElliotModel {

    /// Creates a bit-loop model in the good state.
    /// @param parameters error rates and transition probabilities
    /// @param random source of uniform draws
    public BitLoopErrorModel(LinkParameters parameters, Random random) {
        super(parameters, random);
    }

    @Override
    protected boolean transmitBits(long bits) {
        boolean corrupted = false;
        double ber = state.bitErrorRate(parameters);
        double transition = state.transitionProbability(parameters);
        long runStart = 0;

        for (long bit = 0; bit < bits; bit++) {
            if (random.nextDouble() < ber) {
                corrupted = true;
            }
            if (random.nextDouble() < transition) {
                recordOccupancy(state, bit + 1 - runStart);
                runStart = bit + 1;
                state = state.flip();
                ber = state.bitErrorRate(parameters);
                transition = state.transitionProbability(parameters);
            }
        }
        recordOccupancy(state, bits - runStart);
        return corrupted;
    }
}
