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

/// A frame handed out of a {@link SimplexChannel} at its arrival time.
///
/// @param arrivalTime simulation time at which the frame reached the far end
/// @param frame the frame as received, possibly {@link Frame#corrupted()}
public record Delivery(double arrivalTime, Frame frame) {
}
