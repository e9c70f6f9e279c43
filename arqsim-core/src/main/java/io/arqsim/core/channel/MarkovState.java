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

/// Two states of the Gilbert-Elliot channel.
public enum MarkovState {
    GOOD,
    BAD;

    /// Bit error rate while the channel is in this state.
    /// @param parameters the link parameters
    /// @return per-bit error probability
    public double bitErrorRate(LinkParameters parameters) {
        return this == GOOD ? parameters.goodStateBer() : parameters.badStateBer();
    }

    /// Per-bit probability of leaving this state.
    /// @param parameters the link parameters
    /// @return outward transition probability
    public double transitionProbability(LinkParameters parameters) {
        return this == GOOD ? parameters.goodToBadProbability() : parameters.badToGoodProbability();
    }

    /// @return the other state
    public MarkovState flip() {
        return this == GOOD ? BAD : GOOD;
    }
}
