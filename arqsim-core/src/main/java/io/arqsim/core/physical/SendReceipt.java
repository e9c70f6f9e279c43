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

/// Timing returned by {@link SimplexChannel#send(double, Frame)}.
///
/// @param propagationDuration time to clock the frame onto the wire, seconds
/// @param roundTripEstimate time until the frame's acknowledgment is expected back, seconds
public record SendReceipt(double propagationDuration, double roundTripEstimate) {
}
