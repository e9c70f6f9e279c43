package io.arqsim.core.events;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("EventPump")
class EventPumpTest {

    @Test
    @DisplayName("should drain events scheduled before and after start")
    void shouldDrainEvents() throws InterruptedException {
        EventLoop loop = new EventLoop();
        List<Double> fired = Collections.synchronizedList(new ArrayList<>());
        loop.schedule(2.0, fired::add);
        loop.schedule(1.0, fired::add);

        try (EventPump pump = new EventPump(loop).start()) {
            assertThat(pump.awaitIdle(Duration.ofSeconds(5))).isTrue();
            loop.schedule(3.0, fired::add);
            assertThat(pump.awaitIdle(Duration.ofSeconds(5))).isTrue();
            assertThat(pump.getFiredEvents()).isEqualTo(3);
        }

        assertThat(fired).containsExactly(1.0, 2.0, 3.0);
        assertThat(loop.now()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("should rethrow a failing action from awaitIdle")
    void shouldSurfaceFailures() {
        EventLoop loop = new EventLoop();
        loop.schedule(1.0, t -> {
            throw new IllegalStateException("action failed");
        });
        loop.schedule(2.0, t -> { });

        try (EventPump pump = new EventPump(loop, Duration.ofMillis(1)).start()) {
            assertThatThrownBy(() -> pump.awaitIdle(Duration.ofSeconds(5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("action failed");
        }
    }
}
