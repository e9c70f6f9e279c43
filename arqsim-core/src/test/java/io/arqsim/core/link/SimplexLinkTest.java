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

import io.arqsim.core.channel.ErrorModelKind;
import io.arqsim.core.config.LinkParameters;
import io.arqsim.core.events.EventLoop;
import io.arqsim.core.physical.Delivery;
import io.arqsim.core.physical.Frame;
import io.arqsim.core.physical.SimplexChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("SimplexLink")
class SimplexLinkTest {

    private static final LinkParameters CLEAN = LinkParameters.defaults().withBitErrorRates(0, 0);

    private EventLoop loop;
    private SimplexLink link;

    @BeforeEach
    void setUp() {
        loop = new EventLoop();
        link = newLink(4);
    }

    private SimplexLink newLink(long windowSize) {
        SimplexChannel forward = SimplexChannel.forward(loop,
            ErrorModelKind.JUMP_AHEAD.create(CLEAN, new Random(1)), CLEAN);
        SimplexChannel reverse = SimplexChannel.reverse(loop,
            ErrorModelKind.JUMP_AHEAD.create(CLEAN, new Random(2)), CLEAN);
        return new SimplexLink(forward, reverse, loop, CLEAN, windowSize);
    }

    @Nested
    @DisplayName("Sending")
    class Sending {

        @Test
        @DisplayName("should report the transmission duration and arm one timer per frame")
        void shouldArmTimers() {
            assertThat(link.sendData(0.0, new byte[1000])).hasValue(8192 / 10_000_000.0);
            assertThat(link.sendData(0.001, new byte[1000])).isPresent();

            assertThat(link.getActiveTimers()).isEqualTo(2);
            assertThat(link.getNextSeq()).isEqualTo(2);
            assertThat(link.getDataFramesSent()).isEqualTo(2);
            assertThat(loop.pendingCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should refuse to send when the window is full")
        void shouldRefuseWhenFull() {
            SimplexLink small = newLink(2);
            assertThat(small.sendData(0.0, new byte[1])).isPresent();
            assertThat(small.sendData(0.0, new byte[1])).isPresent();
            assertThat(small.canSend()).isFalse();
            assertThat(small.sendData(0.0, new byte[1])).isEmpty();
            assertThat(small.getDataFramesSent()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Timers")
    class Timers {

        @Test
        @DisplayName("should cancel the timer when the frame is acknowledged")
        void shouldCancelOnAck() {
            link.sendData(0.0, new byte[100]);
            link.handleAck(0.05, 0);

            assertThat(link.getActiveTimers()).isZero();
            assertThat(link.isDrained()).isTrue();
            assertThat(link.getSendBase()).isEqualTo(1);

            while (loop.pendingCount() > 0) {
                loop.advance();
            }
            assertThat(link.getRetransmissions()).isZero();
            assertThat(link.getForwardChannel().backlog()).isEqualTo(1);
        }

        @Test
        @DisplayName("should retransmit and re-arm when the timer fires")
        void shouldRetransmitOnTimeout() {
            link.sendData(0.0, new byte[1000]);
            double rtt = 8192 / 10_000_000.0 + CLEAN.roundTripDelay() + 192 / 10_000_000.0;

            assertThat(loop.advance()).isTrue();
            assertThat(loop.now()).isCloseTo(0.0428192, within(1e-9));
            assertThat(loop.advance()).isTrue();
            assertThat(loop.now()).isCloseTo(2.5 * rtt, within(1e-9));

            assertThat(link.getTimeoutRetransmissions()).isEqualTo(1);
            assertThat(link.getDataFramesSent()).isEqualTo(2);
            assertThat(link.getActiveTimers()).isEqualTo(1);
            assertThat(loop.pendingCount()).isEqualTo(2);
            assertThat(loop.peekTime()).isCloseTo(2.5 * rtt + 0.0428192, within(1e-9));
        }

        @Test
        @DisplayName("should keep retransmitting until acknowledged")
        void shouldRetransmitRepeatedly() {
            link.sendData(0.0, new byte[10]);
            for (int i = 0; i < 20; i++) {
                loop.advance();
            }
            long retransmissions = link.getTimeoutRetransmissions();
            assertThat(retransmissions).isGreaterThanOrEqualTo(5);

            double lastSend = loop.now();
            link.handleAck(lastSend + 0.05, 0);
            while (loop.pendingCount() > 0) {
                loop.advance();
            }
            assertThat(link.getTimeoutRetransmissions()).isEqualTo(retransmissions);
            assertThat(link.getActiveTimers()).isZero();
        }
    }

    @Nested
    @DisplayName("Selective reject")
    class SelectiveReject {

        @Test
        @DisplayName("should ignore a reject that arrives within the round trip of the last transmission")
        void shouldSuppressEarlyReject() {
            link.sendData(0.0, new byte[100]);

            assertThat(link.handleNak(0.01, 0)).isFalse();
            assertThat(link.getSuppressedNaks()).isEqualTo(1);
            assertThat(link.getNakRetransmissions()).isZero();
        }

        @Test
        @DisplayName("should retransmit a frame rejected after its round trip")
        void shouldRetransmitRejectedFrame() {
            link.sendData(0.0, new byte[100]);

            assertThat(link.handleNak(0.1, 0)).isTrue();
            assertThat(link.getNakRetransmissions()).isEqualTo(1);
            assertThat(link.getDataFramesSent()).isEqualTo(2);
            assertThat(link.getActiveTimers()).isEqualTo(1);

            assertThat(link.handleNak(0.11, 0)).isFalse();
        }

        @Test
        @DisplayName("should ignore a reject for a frame no longer outstanding")
        void shouldIgnoreRejectForAckedFrame() {
            link.sendData(0.0, new byte[100]);
            link.handleAck(0.05, 0);
            assertThat(link.handleNak(1.0, 0)).isFalse();
            assertThat(link.getSuppressedNaks()).isZero();
        }
    }

    @Test
    @DisplayName("should carry a frame end to end and return its acknowledgment")
    void shouldCompleteRoundTrip() {
        link.sendData(0.0, new byte[]{9, 8, 7});
        loop.advance();

        Delivery data = link.getForwardChannel().poll();
        ReceiveOutcome outcome = link.receiveFrame(data.frame().getSeq(), data.frame());
        assertThat(outcome.delivered()).containsExactly(new byte[]{9, 8, 7});
        assertThat(link.getReceiveBase()).isEqualTo(1);

        link.sendAck(data.arrivalTime(), outcome.response().orElseThrow().getSeq());
        loop.advance();
        Delivery ack = link.getReverseChannel().poll();
        assertThat(ack.frame()).isEqualTo(Frame.rr(0));

        link.handleAck(ack.arrivalTime(), ack.frame().getSeq());
        assertThat(link.isDrained()).isTrue();
        assertThat(link.getReceiverDroppedFrames()).isZero();
        assertThat(link.getRttSamples()).isEqualTo(1);
        assertThat(link.getAverageRtt()).isCloseTo(ack.arrivalTime(), within(1e-12));
        assertThat(link.getDataBitsSent()).isEqualTo(3 * 8 + CLEAN.frameOverheadBits());
    }

    @Nested
    @DisplayName("Round trip samples")
    class RoundTrip {

        @Test
        @DisplayName("should measure from the most recent transmission")
        void shouldSampleFromLastTransmission() {
            link.sendData(0.0, new byte[100]);
            link.sendData(0.001, new byte[100]);

            link.handleAck(0.05, 0);
            link.handleAck(0.071, 1);

            assertThat(link.getRttSamples()).isEqualTo(2);
            assertThat(link.getAverageRtt()).isCloseTo(0.06, within(1e-12));
        }

        @Test
        @DisplayName("should not sample duplicate or unknown acknowledgments")
        void shouldIgnoreDuplicates() {
            assertThat(link.getAverageRtt()).isZero();

            link.sendData(0.0, new byte[100]);
            link.handleAck(0.05, 0);
            link.handleAck(0.09, 0);
            link.handleAck(0.09, 7);

            assertThat(link.getRttSamples()).isEqualTo(1);
            assertThat(link.getAverageRtt()).isCloseTo(0.05, within(1e-12));
        }

        @Test
        @DisplayName("should count retransmitted bits")
        void shouldCountRetransmittedBits() {
            link.sendData(0.0, new byte[100]);
            link.handleNak(0.1, 0);

            assertThat(link.getDataBitsSent()).isEqualTo(2 * (800 + CLEAN.frameOverheadBits()));
        }
    }
}
