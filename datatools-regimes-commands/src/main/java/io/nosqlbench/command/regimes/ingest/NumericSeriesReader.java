package io.nosqlbench.command.regimes.ingest;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Reads a plain series file: one number per line, in arrival order.
///
/// Blank lines and lines starting with `#` are ignored. Since the file carries no
/// dates, every point is dated {@link LocalDate#EPOCH}. The series is keyed by the path
/// as given, so equally named files in different directories stay distinct.
public class NumericSeriesReader {

    /// @throws IOException if the file cannot be read or a line is not a number
    public TimedSeries read(Path file) throws IOException {
        List<Double> values = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                try {
                    values.add(Double.parseDouble(trimmed));
                } catch (NumberFormatException e) {
                    throw new IOException(file + ":" + lineNumber + ": not a number: " + trimmed, e);
                }
            }
        }
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return new TimedSeries(SeriesKey.ofFile(file.toString()),
            Collections.nCopies(array.length, LocalDate.EPOCH), array);
    }
}
