package io.arqsim.core.config;

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

/**
 * Immutable physical-layer and protocol constants for one simulation.
 *
 * <p>Every component receives its parameters at construction, so simulations
 * with different parameters can run side by side in one JVM.</p>
 *
 * <p>Frame overhead is expressed in bytes and applies to every frame kind:
 * acknowledgments cost exactly the overhead, data frames cost the payload plus
 * the overhead.</p>
 *
 * @param bitRate channel bit rate in bits per second
 * @param forwardPathDelay propagation delay sender to receiver, seconds
 * @param reversePathDelay propagation delay receiver to sender, seconds
 * @param processingDelay per-frame processing delay, seconds
 * @param frameOverheadBytes header bytes carried by every frame
 * @param receiverBufferBytes cap on out-of-order bytes held by the receiver
 * @param goodStateBer bit error rate in the good state
 * @param badStateBer bit error rate in the bad state
 * @param goodToBadProbability per-bit probability of leaving the good state
 * @param badToGoodProbability per-bit probability of leaving the bad state
 * @param timeoutMultiplier retransmission timeout as a multiple of the round trip estimate
 * @param closedFormTimeoutMargin timeout margin used by the closed-form simulation
 * @param fileSizeBytes payload size transferred by the closed-form simulation
 */
public record LinkParameters(
    double bitRate,
    double forwardPathDelay,
    double reversePathDelay,
    double processingDelay,
    int frameOverheadBytes,
    int receiverBufferBytes,
    double goodStateBer,
    double badStateBer,
    double goodToBadProbability,
    double badToGoodProbability,
    double timeoutMultiplier,
    double closedFormTimeoutMargin,
    long fileSizeBytes
) {

    public static final double DEFAULT_BIT_RATE = 10_000_000.0;
    public static final double DEFAULT_FORWARD_PATH_DELAY = 0.040;
    public static final double DEFAULT_REVERSE_PATH_DELAY = 0.010;
    public static final double DEFAULT_PROCESSING_DELAY = 0.002;
    public static final int DEFAULT_FRAME_OVERHEAD_BYTES = 24;
    public static final int DEFAULT_RECEIVER_BUFFER_BYTES = 256 * 1024;
    public static final double DEFAULT_GOOD_STATE_BER = 1e-6;
    public static final double DEFAULT_BAD_STATE_BER = 5e-3;
    public static final double DEFAULT_GOOD_TO_BAD = 0.002;
    public static final double DEFAULT_BAD_TO_GOOD = 0.05;
    public static final double DEFAULT_TIMEOUT_MULTIPLIER = 2.5;
    public static final double DEFAULT_CLOSED_FORM_TIMEOUT_MARGIN = 1.005;
    public static final long DEFAULT_FILE_SIZE_BYTES = 1_000_000L;

    /**
     * Compact constructor with validation.
     */
    public LinkParameters {
        requirePositive("bitRate", bitRate);
        requireNonNegative("forwardPathDelay", forwardPathDelay);
        requireNonNegative("reversePathDelay", reversePathDelay);
        requireNonNegative("processingDelay", processingDelay);
        if (frameOverheadBytes <= 0) {
            throw new IllegalArgumentException("frameOverheadBytes must be positive, got " + frameOverheadBytes);
        }
        if (receiverBufferBytes <= 0) {
            throw new IllegalArgumentException("receiverBufferBytes must be positive, got " + receiverBufferBytes);
        }
        requireProbability("goodStateBer", goodStateBer);
        requireProbability("badStateBer", badStateBer);
        requireTransition("goodToBadProbability", goodToBadProbability);
        requireTransition("badToGoodProbability", badToGoodProbability);
        requirePositive("timeoutMultiplier", timeoutMultiplier);
        requirePositive("closedFormTimeoutMargin", closedFormTimeoutMargin);
        if (fileSizeBytes <= 0) {
            throw new IllegalArgumentException("fileSizeBytes must be positive, got " + fileSizeBytes);
        }
    }

    /**
     * The reference parameter set: 10 Mbps, 40 ms forward, 10 ms reverse, 2 ms processing,
     * 24 byte frame overhead and a 256 KiB receive buffer.
     */
    public static LinkParameters defaults() {
        return new LinkParameters(
            DEFAULT_BIT_RATE,
            DEFAULT_FORWARD_PATH_DELAY,
            DEFAULT_REVERSE_PATH_DELAY,
            DEFAULT_PROCESSING_DELAY,
            DEFAULT_FRAME_OVERHEAD_BYTES,
            DEFAULT_RECEIVER_BUFFER_BYTES,
            DEFAULT_GOOD_STATE_BER,
            DEFAULT_BAD_STATE_BER,
            DEFAULT_GOOD_TO_BAD,
            DEFAULT_BAD_TO_GOOD,
            DEFAULT_TIMEOUT_MULTIPLIER,
            DEFAULT_CLOSED_FORM_TIMEOUT_MARGIN,
            DEFAULT_FILE_SIZE_BYTES
        );
    }

    /** Header size in bits. */
    public long frameOverheadBits() {
        return frameOverheadBytes * 8L;
    }

    /** Propagation and processing for a frame and its acknowledgment, excluding transmission time. */
    public double roundTripDelay() {
        return forwardPathDelay + reversePathDelay + 2 * processingDelay;
    }

    /** Time to clock the given number of bits onto the wire. */
    public double transmissionTime(long bits) {
        return bits / bitRate;
    }

    /** Copy with a different receive buffer cap. */
    public LinkParameters withReceiverBufferBytes(int bytes) {
        return new LinkParameters(bitRate, forwardPathDelay, reversePathDelay, processingDelay,
            frameOverheadBytes, bytes, goodStateBer, badStateBer, goodToBadProbability,
            badToGoodProbability, timeoutMultiplier, closedFormTimeoutMargin, fileSizeBytes);
    }

    /** Copy with a different closed-form file size. */
    public LinkParameters withFileSizeBytes(long bytes) {
        return new LinkParameters(bitRate, forwardPathDelay, reversePathDelay, processingDelay,
            frameOverheadBytes, receiverBufferBytes, goodStateBer, badStateBer, goodToBadProbability,
            badToGoodProbability, timeoutMultiplier, closedFormTimeoutMargin, bytes);
    }

    /** Copy with different error rates, for example an error-free channel in tests. */
    public LinkParameters withBitErrorRates(double goodBer, double badBer) {
        return new LinkParameters(bitRate, forwardPathDelay, reversePathDelay, processingDelay,
            frameOverheadBytes, receiverBufferBytes, goodBer, badBer, goodToBadProbability,
            badToGoodProbability, timeoutMultiplier, closedFormTimeoutMargin, fileSizeBytes);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be positive and finite, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be non-negative and finite, got " + value);
        }
    }

    private static void requireProbability(String name, double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }

    // The geometric gap sampler needs ln(1-p) finite and non-zero.
    private static void requireTransition(String name, double value) {
        if (!(value > 0 && value < 1)) {
            throw new IllegalArgumentException(name + " must be within (0, 1), got " + value);
        }
    }
}
