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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable overlay for {@link LinkParameters}.
 *
 * <h2>Purpose</h2>
 *
 * <p>Every field is optional. Fields left out of the document keep the
 * {@link LinkParameters#defaults() reference values}, so a configuration file only
 * names what it changes.</p>
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "bit_rate": 10000000,
 *   "forward_path_delay": 0.040,
 *   "reverse_path_delay": 0.010,
 *   "processing_delay": 0.002,
 *   "frame_overhead_bytes": 24,
 *   "receiver_buffer_bytes": 262144,
 *   "good_state_ber": 1e-6,
 *   "bad_state_ber": 5e-3,
 *   "p_good_to_bad": 0.002,
 *   "p_bad_to_good": 0.05,
 *   "timeout_multiplier": 2.5,
 *   "closed_form_timeout_margin": 1.005,
 *   "file_size_bytes": 1000000
 * }
 * }</pre>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * LinkParameters params = LinkConfig.load(Path.of("link.json")).toParameters();
 * }</pre>
 */
public class LinkConfig {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    @SerializedName("bit_rate")
    private Double bitRate;

    @SerializedName("forward_path_delay")
    private Double forwardPathDelay;

    @SerializedName("reverse_path_delay")
    private Double reversePathDelay;

    @SerializedName("processing_delay")
    private Double processingDelay;

    @SerializedName("frame_overhead_bytes")
    private Integer frameOverheadBytes;

    @SerializedName("receiver_buffer_bytes")
    private Integer receiverBufferBytes;

    @SerializedName("good_state_ber")
    private Double goodStateBer;

    @SerializedName("bad_state_ber")
    private Double badStateBer;

    @SerializedName("p_good_to_bad")
    private Double goodToBadProbability;

    @SerializedName("p_bad_to_good")
    private Double badToGoodProbability;

    @SerializedName("timeout_multiplier")
    private Double timeoutMultiplier;

    @SerializedName("closed_form_timeout_margin")
    private Double closedFormTimeoutMargin;

    @SerializedName("file_size_bytes")
    private Long fileSizeBytes;

    public LinkConfig() {
    }

    /**
     * Captures every value of a parameter set.
     *
     * @param parameters the parameters to capture
     * @return a fully populated config
     */
    public static LinkConfig from(LinkParameters parameters) {
        LinkConfig config = new LinkConfig();
        config.bitRate = parameters.bitRate();
        config.forwardPathDelay = parameters.forwardPathDelay();
        config.reversePathDelay = parameters.reversePathDelay();
        config.processingDelay = parameters.processingDelay();
        config.frameOverheadBytes = parameters.frameOverheadBytes();
        config.receiverBufferBytes = parameters.receiverBufferBytes();
        config.goodStateBer = parameters.goodStateBer();
        config.badStateBer = parameters.badStateBer();
        config.goodToBadProbability = parameters.goodToBadProbability();
        config.badToGoodProbability = parameters.badToGoodProbability();
        config.timeoutMultiplier = parameters.timeoutMultiplier();
        config.closedFormTimeoutMargin = parameters.closedFormTimeoutMargin();
        config.fileSizeBytes = parameters.fileSizeBytes();
        return config;
    }

    /**
     * Resolves this overlay against the reference values.
     *
     * @return validated parameters
     * @throws IllegalArgumentException if a resolved value is out of range
     */
    public LinkParameters toParameters() {
        LinkParameters d = LinkParameters.defaults();
        return new LinkParameters(
            bitRate != null ? bitRate : d.bitRate(),
            forwardPathDelay != null ? forwardPathDelay : d.forwardPathDelay(),
            reversePathDelay != null ? reversePathDelay : d.reversePathDelay(),
            processingDelay != null ? processingDelay : d.processingDelay(),
            frameOverheadBytes != null ? frameOverheadBytes : d.frameOverheadBytes(),
            receiverBufferBytes != null ? receiverBufferBytes : d.receiverBufferBytes(),
            goodStateBer != null ? goodStateBer : d.goodStateBer(),
            badStateBer != null ? badStateBer : d.badStateBer(),
            goodToBadProbability != null ? goodToBadProbability : d.goodToBadProbability(),
            badToGoodProbability != null ? badToGoodProbability : d.badToGoodProbability(),
            timeoutMultiplier != null ? timeoutMultiplier : d.timeoutMultiplier(),
            closedFormTimeoutMargin != null ? closedFormTimeoutMargin : d.closedFormTimeoutMargin(),
            fileSizeBytes != null ? fileSizeBytes : d.fileSizeBytes()
        );
    }

    /**
     * Reads a config document.
     *
     * @param reader source of JSON text
     * @return the parsed config, empty when the document is empty
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public static LinkConfig load(Reader reader) {
        try {
            LinkConfig config = GSON.fromJson(reader, LinkConfig.class);
            return config != null ? config : new LinkConfig();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed link config: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a config file.
     *
     * @param path the JSON file
     * @return the parsed config
     * @throws IOException if the file cannot be read
     */
    public static LinkConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader);
        }
    }

    /**
     * Writes this config as JSON.
     *
     * @param writer destination
     */
    public void save(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Writes this config to a file, replacing it if present.
     *
     * @param path destination file
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            save(writer);
        }
    }

    public Double getBitRate() {
        return bitRate;
    }

    public void setBitRate(Double bitRate) {
        this.bitRate = bitRate;
    }

    public Double getForwardPathDelay() {
        return forwardPathDelay;
    }

    public void setForwardPathDelay(Double forwardPathDelay) {
        this.forwardPathDelay = forwardPathDelay;
    }

    public Double getReversePathDelay() {
        return reversePathDelay;
    }

    public void setReversePathDelay(Double reversePathDelay) {
        this.reversePathDelay = reversePathDelay;
    }

    public Double getProcessingDelay() {
        return processingDelay;
    }

    public void setProcessingDelay(Double processingDelay) {
        this.processingDelay = processingDelay;
    }

    public Integer getFrameOverheadBytes() {
        return frameOverheadBytes;
    }

    public void setFrameOverheadBytes(Integer frameOverheadBytes) {
        this.frameOverheadBytes = frameOverheadBytes;
    }

    public Integer getReceiverBufferBytes() {
        return receiverBufferBytes;
    }

    public void setReceiverBufferBytes(Integer receiverBufferBytes) {
        this.receiverBufferBytes = receiverBufferBytes;
    }

    public Double getGoodStateBer() {
        return goodStateBer;
    }

    public void setGoodStateBer(Double goodStateBer) {
        this.goodStateBer = goodStateBer;
    }

    public Double getBadStateBer() {
        return badStateBer;
    }

    public void setBadStateBer(Double badStateBer) {
        this.badStateBer = badStateBer;
    }

    public Double getGoodToBadProbability() {
        return goodToBadProbability;
    }

    public void setGoodToBadProbability(Double goodToBadProbability) {
        this.goodToBadProbability = goodToBadProbability;
    }

    public Double getBadToGoodProbability() {
        return badToGoodProbability;
    }

    public void setBadToGoodProbability(Double badToGoodProbability) {
        this.badToGoodProbability = badToGoodProbability;
    }

    public Double getTimeoutMultiplier() {
        return timeoutMultiplier;
    }

    public void setTimeoutMultiplier(Double timeoutMultiplier) {
        this.timeoutMultiplier = timeoutMultiplier;
    }

    public Double getClosedFormTimeoutMargin() {
        return closedFormTimeoutMargin;
    }

    public void setClosedFormTimeoutMargin(Double closedFormTimeoutMargin) {
        this.closedFormTimeoutMargin = closedFormTimeoutMargin;
    }

    public Long getFileSizeBytes() {
        return fileSizeBytes;
    }

    public void setFileSizeBytes(Long fileSizeBytes) {
        this.fileSizeBytes = fileSizeBytes;
    }
}
