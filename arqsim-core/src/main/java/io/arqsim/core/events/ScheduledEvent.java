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

import java.util.Objects;

/// An action queued in the {@link EventLoop}.
///
/// Events sort by scheduled time first and then by identifier, so two events
/// scheduled for the same instant fire in the order they were scheduled.
final class ScheduledEvent implements Comparable<ScheduledEvent> {

    private final double time;
    private final long id;
    private final SimulationAction action;

    ScheduledEvent(double time, long id, SimulationAction action) {
        this.time = time;
        this.id = id;
        this.action = action;
    }

    double getTime() {
        return time;
    }

    long getId() {
        return id;
    }

    SimulationAction getAction() {
        return action;
    }

    @Override
    public int compareTo(ScheduledEvent other) {
        int timeComparison = Double.compare(this.time, other.time);
        if (timeComparison != 0) {
            return timeComparison;
        }
        return Long.compare(this.id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScheduledEvent that = (ScheduledEvent) o;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("ScheduledEvent[id=%d, time=%.6f]", id, time);
    }
}
