package io.arqsim.core.simulation;

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

import io.arqsim.core.channel.ErrorModelKind;
import io.arqsim.core.config.LinkParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("ClosedFormSimulation")
class ClosedFormSimulationTest {

    private static final LinkParameters SMALL = LinkParameters.defaults().withFileSizeBytes(100_000);

    @Test
    @DisplayName("should be deterministic for a fixed seed")
    void shouldBeDeterministic() {
        SimulationResult a = new ClosedFormSimulation(SMALL, ErrorModelKind.JUMP_AHEAD, 7).simulate(8, 1024);
        SimulationResult b = new ClosedFormSimulation(SMALL, ErrorModelKind.JUMP_AHEAD, 7).simulate(8, 1024);
        assertThat(a).isEqualTo(b);
    }

    @ParameterizedTest
    @CsvSource({
        "1, 128",
        "8, 1024",
        "64, 512",
        "16, 256"
    })
    @DisplayName("should report goodput between zero and the bit rate")
    void shouldStayWithinBounds(long window, long payload) {
        SimulationResult result = new ClosedFormSimulation(SMALL, ErrorModelKind.JUMP_AHEAD, 11).simulate(window, payload);

        assertThat(result.windowSize()).isEqualTo(window);
        assertThat(result.framePayload()).isEqualTo(payload);
        assertThat(result.goodput()).isPositive().isLessThanOrEqualTo(SMALL.bitRate());
        assertThat(result.time()).isPositive();
        assertThat(result.retransmissions()).isNotNegative();
        assertThat(result.framesSent()).isGreaterThan(result.retransmissions());
        assertThat(result.retransmissionRate()).isBetween(0.0, 1.0);
        assertThat(result.utilization()).isPositive().isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("should need no retransmissions on an error-free channel")
    void shouldNotRetransmitWithoutErrors() {
        LinkParameters clean = SMALL.withBitErrorRates(0, 0);
        SimulationResult result = new ClosedFormSimulation(clean, ErrorModelKind.BIT_LOOP, 1).simulate(1, 10_000);

        double frameTime = clean.transmissionTime(10_000 * 8 + clean.frameOverheadBits());
        double timeout = (clean.roundTripDelay() + frameTime) * clean.closedFormTimeoutMargin();

        assertThat(result.retransmissions()).isZero();
        // stop-and-wait over ten frames
        assertThat(result.time()).isCloseTo(10 * timeout, within(1e-9));

        assertThat(result.framesSent()).isEqualTo(10);
        assertThat(result.bitsSent()).isEqualTo(10 * (10_000 * 8 + clean.frameOverheadBits()));
        assertThat(result.retransmissionRate()).isZero();
        assertThat(result.utilization()).isCloseTo(result.goodput() / clean.bitRate(), within(1e-12));
        assertThat(result.efficiency()).isCloseTo(80_000.0 / (80_000 + clean.frameOverheadBits()), within(1e-9));
    }

    @Test
    @DisplayName("should gain goodput from a larger window on a clean channel")
    void shouldScaleWithWindow() {
        LinkParameters clean = SMALL.withBitErrorRates(0, 0);
        ClosedFormSimulation simulation = new ClosedFormSimulation(clean, ErrorModelKind.JUMP_AHEAD, 1);
        assertThat(simulation.simulate(16, 1024).goodput()).isGreaterThan(simulation.simulate(1, 1024).goodput());
    }

    @Test
    @DisplayName("should reject invalid arguments")
    void shouldRejectInvalidArguments() {
        ClosedFormSimulation simulation = new ClosedFormSimulation(SMALL, ErrorModelKind.JUMP_AHEAD, 1);
        assertThatThrownBy(() -> simulation.simulate(0, 128)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> simulation.simulate(4, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
