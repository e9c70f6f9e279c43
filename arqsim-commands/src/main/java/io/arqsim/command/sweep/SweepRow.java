package io.arqsim.command.sweep;

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

import io.arqsim.core.simulation.SimulationResult;

/// One closed-form run of a sweep.
///
/// @param run zero-based run index within its configuration
/// @param seed seed the run used
/// @param result the run's outcome
public record SweepRow(int run, long seed, SimulationResult result) {
}
