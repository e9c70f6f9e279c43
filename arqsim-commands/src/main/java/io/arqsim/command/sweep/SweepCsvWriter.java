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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/// Writes sweep rows as CSV, one line per run.
///
/// Numbers are formatted with {@link Locale#ROOT} so the output does not depend on
/// the platform locale.
public final class SweepCsvWriter {

    /// Column header line
    public static final String HEADER = "window_size,frame_payload,run,goodput_mbps,retransmissions,time_seconds";

    private SweepCsvWriter() {
    }

    /// Formats one row without a line terminator.
    ///
    /// @param row the row
    /// @return the CSV line
    public static String format(SweepRow row) {
        SimulationResult r = row.result();
        return String.format(Locale.ROOT, "%d,%d,%d,%.6f,%d,%.6f",
            r.windowSize(), r.framePayload(), row.run(), r.goodputMbps(), r.retransmissions(), r.time());
    }

    /// Writes a header and all rows.
    ///
    /// @param writer destination
    /// @param rows rows in output order
    /// @throws IOException if writing fails
    public static void write(Writer writer, List<SweepRow> rows) throws IOException {
        writer.write(HEADER);
        writer.write('\n');
        for (SweepRow row : rows) {
            writer.write(format(row));
            writer.write('\n');
        }
    }

    /// Writes a header and all rows to a file, creating parent directories and
    /// replacing the file if it exists.
    ///
    /// @param path destination file
    /// @param rows rows in output order
    /// @throws IOException if the file cannot be written
    public static void write(Path path, List<SweepRow> rows) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path)) {
            write(writer, rows);
        }
    }
}
