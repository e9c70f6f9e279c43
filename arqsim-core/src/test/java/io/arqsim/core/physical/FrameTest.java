package io.arqsim.core.physical;

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("Frame")
class FrameTest {

    private static final long OVERHEAD = 192;

    @Test
    @DisplayName("control frames should cost exactly the overhead")
    void controlFramesCostOverhead() {
        assertThat(Frame.rr(3).sizeBits(OVERHEAD)).isEqualTo(192);
        assertThat(Frame.srej(3).sizeBits(OVERHEAD)).isEqualTo(192);
    }

    @Test
    @DisplayName("data frames should cost payload bits plus overhead")
    void dataFramesCostPayloadPlusOverhead() {
        assertThat(Frame.data(0, new byte[1000]).sizeBits(OVERHEAD)).isEqualTo(8192);
        assertThat(Frame.data(0, new byte[0]).sizeBits(OVERHEAD)).isEqualTo(192);
    }

    @Test
    @DisplayName("the corrupted marker should have no size and no sequence number")
    void corruptedHasNoSize() {
        Frame corrupted = Frame.corrupted();
        assertThat(corrupted.isCorrupted()).isTrue();
        assertThat(corrupted.getKind()).isEqualTo(Frame.Kind.CORRUPTED);
        assertThatThrownBy(() -> corrupted.sizeBits(OVERHEAD)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(corrupted::getSeq).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should compare by kind, sequence number and payload content")
    void shouldCompareByValue() {
        assertThat(Frame.data(1, new byte[]{1, 2})).isEqualTo(Frame.data(1, new byte[]{1, 2}));
        assertThat(Frame.data(1, new byte[]{1, 2})).isNotEqualTo(Frame.data(2, new byte[]{1, 2}));
        assertThat(Frame.rr(1)).isNotEqualTo(Frame.srej(1));
        assertThat(Frame.rr(4).toString()).isEqualTo("RR(4)");
    }
}
