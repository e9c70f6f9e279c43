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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("SweepCsvWriter")
class SweepCsvWriterTest {

    private static final SweepRow ROW = new SweepRow(2, 44L,
        new SimulationResult(8, 1024, 3_250_000.0, 17, 2.5, 117, 117 * 8384L, 0.325));

    @Test
    @DisplayName("should format a row in header order")
    void shouldFormatRow() {
        assertThat(SweepCsvWriter.format(ROW)).isEqualTo("8,1024,2,3.250000,17,2.500000");
    }

    @Test
    @DisplayName("should write the header before the rows")
    void shouldWriteHeaderFirst() throws IOException {
        StringWriter writer = new StringWriter();
        SweepCsvWriter.write(writer, List.of(ROW, ROW));

        String[] lines = writer.toString().split("\n");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo("window_size,frame_payload,run,goodput_mbps,retransmissions,time_seconds");
        assertThat(lines[1].split(",")).hasSize(6);
    }

    @Test
    @DisplayName("should create missing parent directories")
    void shouldCreateParents(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("results/nested/sweep.csv");
        SweepCsvWriter.write(file, List.of(ROW));

        assertThat(Files.readAllLines(file)).containsExactly(SweepCsvWriter.HEADER, "8,1024,2,3.250000,17,2.500000");
    }
}
