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

/// Gilbert-Elliot model that jumps from one state transition to the next.
///
/// The number of bits left in the current state is geometric in the state's
/// outward transition probability p and is drawn by inverse CDF:
/// `floor(ln(r) / ln(1 - p)) + 1` for uniform r in (0, 1).
///
/// A frame is consumed in chunks of `min(remaining frame bits, bits until
/// transition)`. Each chunk of k bits is corrupted with probability
/// `1 - (1 - ber)^k`, decided by one draw. After the first corrupted chunk no
/// further corruption draws are taken, but the transition bookkeeping continues.
/// The cost is O(chunks) per frame instead of O(bits).
public class JumpAheadErrorModel extends GilbertElliotModel {

    private long bitsUntilTransition;

    /// Creates a jump-ahead model in the good state with a freshly sampled gap.
    /// @param parameters error rates and transition probabilities
    /// @param random source of uniform draws
    public JumpAheadErrorModel(LinkParameters parameters, Random random) {
        super(parameters, random);
        this.bitsUntilTransition = sampleGap(state.transitionProbability(parameters));
    }

    @Override
    protected boolean transmitBits(long bits) {
        boolean corrupted = false;
        long remaining = bits;

        while (remaining > 0) {
            long chunk = Math.min(remaining, bitsUntilTransition);

            if (!corrupted) {
                double ber = state.bitErrorRate(parameters);
                double pClean = Math.pow(1.0 - ber, chunk);
                if (random.nextDouble() < 1.0 - pClean) {
                    corrupted = true;
                }
            }

            recordOccupancy(state, chunk);
            remaining -= chunk;
            bitsUntilTransition -= chunk;

            if (bitsUntilTransition <= 0) {
                state = state.flip();
                bitsUntilTransition = sampleGap(state.transitionProbability(parameters));
            }
        }
        return corrupted;
    }

    /// Bits left before the chain changes state.
    /// @return a positive bit count
    public long bitsUntilTransition() {
        return bitsUntilTransition;
    }

    private long sampleGap(double p) {
        return geometricGap(uniformOpen(), p);
    }

    // nextDouble() is in [0, 1); ln(0) would be -infinity
    private double uniformOpen() {
        double r;
        do {
            r = random.nextDouble();
        } while (r == 0.0);
        return r;
    }

    /// Inverse CDF of the geometric distribution on {1, 2, ...}.
    ///
    /// @param r uniform draw in (0, 1)
    /// @param p per-trial success probability in (0, 1)
    /// @return number of trials up to and including the first success
    static long geometricGap(double r, double p) {
        return (long) Math.floor(Math.log(r) / Math.log(1.0 - p)) + 1;
    }
}
