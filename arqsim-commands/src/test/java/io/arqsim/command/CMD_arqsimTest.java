package io.arqsim.command;

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

import io.arqsim.command.sweep.SweepCsvWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("arqsim command line")
class CMD_arqsimTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("simulate should write one CSV row per run")
    void simulateShouldWriteRows() throws IOException {
        Path csv = tempDir.resolve("single.csv");

        int exitCode = CMD_arqsim.commandLine().execute("simulate", "-w", "8", "-l", "512", "--runs", "2",
            "--seed", "5", "--file-size", "20000", "-o", csv.toString());

        assertThat(exitCode).isZero();
        List<String> lines = Files.readAllLines(csv);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo(SweepCsvWriter.HEADER);
        assertThat(lines.get(1)).startsWith("8,512,0,");
        assertThat(lines.get(2)).startsWith("8,512,1,");
    }

    @Test
    @DisplayName("simulate should refuse to overwrite without --force")
    void simulateShouldRefuseOverwrite() throws IOException {
        Path csv = Files.writeString(tempDir.resolve("existing.csv"), "keep");

        int exitCode = CMD_arqsim.commandLine().execute("simulate", "-w", "2", "-l", "128",
            "--file-size", "2000", "-o", csv.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.readString(csv)).isEqualTo("keep");
    }

    @Test
    @DisplayName("sweep should write the whole grid")
    void sweepShouldWriteGrid() throws IOException {
        Path csv = tempDir.resolve("sweep.csv");

        int exitCode = CMD_arqsim.commandLine().execute("sweep", "--windows", "2,4", "--payloads", "128,256",
            "--runs", "2", "--seed", "1", "--threads", "2", "--file-size", "10000", "-o", csv.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(csv)).hasSize(1 + 2 * 2 * 2);
    }

    @Test
    @DisplayName("sweep should reject a non-positive thread count")
    void sweepShouldRejectZeroThreads() {
        Path csv = tempDir.resolve("zero.csv");

        int exitCode = CMD_arqsim.commandLine().execute("sweep", "--windows", "2", "--payloads", "128",
            "--runs", "1", "--threads", "0", "-o", csv.toString());

        assertThat(exitCode).isNotZero();
        assertThat(csv).doesNotExist();
    }

    @Test
    @DisplayName("sweep should require an output file")
    void sweepShouldRequireOutput() {
        int exitCode = CMD_arqsim.commandLine().execute("sweep", "--windows", "2", "--payloads", "128");
        assertThat(exitCode).isNotZero();
    }

    @Test
    @DisplayName("transfer should deliver a generated payload")
    void transferShouldDeliverPayload() {
        int exitCode = CMD_arqsim.commandLine().execute("transfer", "-w", "8", "--frame-size", "512",
            "--payload-size", "20000", "--seed", "3", "--error-model", "bit-loop");
        assertThat(exitCode).isZero();
    }

    @Test
    @DisplayName("transfer should deliver a file's contents")
    void transferShouldDeliverFile() throws IOException {
        Path input = Files.write(tempDir.resolve("payload.bin"), new byte[5000]);

        int exitCode = CMD_arqsim.commandLine().execute("transfer", "-w", "4", "--frame-size", "1000",
            "--input", input.toString(), "--seed", "9");
        assertThat(exitCode).isZero();
    }

    @Test
    @DisplayName("transfer should report an incomplete transfer")
    void transferShouldReportIncomplete() throws IOException {
        Path config = Files.writeString(tempDir.resolve("dead.json"),
            "{\"good_state_ber\": 1.0, \"bad_state_ber\": 1.0}");

        int exitCode = CMD_arqsim.commandLine().execute("transfer", "-w", "4", "--frame-size", "1000",
            "--payload-size", "5000", "--seed", "1", "--time-budget", "1", "--config", config.toString());
        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @DisplayName("transfer should require exactly one payload source")
    void transferShouldRequirePayloadSource() {
        assertThat(CMD_arqsim.commandLine().execute("transfer", "-w", "4", "--frame-size", "1000")).isNotZero();
    }
}
