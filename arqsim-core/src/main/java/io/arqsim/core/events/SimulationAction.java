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

/// A deferred computation owned by the {@link EventLoop} until it fires.
///
/// The action receives the simulation time at which it was scheduled, which is
/// also the value of {@link EventLoop#now()} while it runs.
@FunctionalInterface
public interface SimulationAction {

    /// Runs the action.
    ///
    /// @param time the scheduled simulation time of the firing event
    void fire(double time);
}
