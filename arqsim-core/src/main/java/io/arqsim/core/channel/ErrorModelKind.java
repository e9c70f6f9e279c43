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

/// Selects a {@link ChannelErrorModel} implementation.
public enum ErrorModelKind {
    /// One random draw per bit
    BIT_LOOP,
    /// One random draw per run of bits between state transitions
    JUMP_AHEAD;

    /// Creates a model of this kind starting in the good state.
    ///
    /// @param parameters error rates and transition probabilities
    /// @param random source of randomness, owned by the model from now on
    /// @return a new error model
    public ChannelErrorModel create(LinkParameters parameters, Random random) {
        switch (this) {
            case BIT_LOOP:
                return new BitLoopErrorModel(parameters, random);
            case JUMP_AHEAD:
                return new JumpAheadErrorModel(parameters, random);
            default:
                throw new IllegalStateException("Unknown error model kind: " + this);
        }
    }
}
