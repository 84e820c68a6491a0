package io.nosqlbench.command.regimes.common;

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

import io.nosqlbench.command.regimes.ingest.CtestTimelineReader;
import io.nosqlbench.command.regimes.ingest.NumericSeriesReader;
import io.nosqlbench.command.regimes.ingest.SeriesKey;
import io.nosqlbench.command.regimes.ingest.TimedSeries;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Shared series input options.
 * Files ending in {@code .json} are read as ctest result files; anything else as a
 * plain list of numbers.
 */
public class SeriesInputOption {

    @CommandLine.Parameters(
        arity = "1..*",
        paramLabel = "FILE",
        description = "ctest JSON result files, or plain files with one value per line"
    )
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(
        names = {"--case"},
        description = "Test case to extract from ctest files (repeatable, default: all)"
    )
    private List<String> cases = new ArrayList<>();

    @CommandLine.Option(
        names = {"--np"},
        description = "Process count to extract from ctest files (default: all)"
    )
    private Integer processes;

    @CommandLine.Option(
        names = {"--timer"},
        description = "Timer to extract from ctest files (repeatable, default: all)"
    )
    private List<String> timers = new ArrayList<>();

    @CommandLine.Option(
        names = {"--log-transform"},
        description = "Analyze the natural logarithm of each value"
    )
    private boolean logTransform = false;

    /**
     * Validates that every input file exists and is named once.
     *
     * @throws CommandLine.ParameterException if a file is missing or repeated
     */
    public void validate(CommandLine commandLine) {
        Set<Path> seen = new HashSet<>();
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                throw new CommandLine.ParameterException(commandLine, "Error: input file not found: " + file);
            }
            if (!seen.add(file.toAbsolutePath().normalize())) {
                throw new CommandLine.ParameterException(commandLine, "Error: input file given twice: " + file);
            }
        }
    }

    /**
     * Reads every series named by the options.
     *
     * @return series by key, in key order
     * @throws IOException if a file cannot be read or parsed
     * @throws IllegalArgumentException if two inputs yield the same series key
     */
    public Map<SeriesKey, TimedSeries> readSeries() throws IOException {
        List<Path> ctestFiles = new ArrayList<>();
        Map<SeriesKey, TimedSeries> series = new TreeMap<>();
        NumericSeriesReader numericReader = new NumericSeriesReader();
        for (Path file : files) {
            if (file.toString().toLowerCase().endsWith(".json")) {
                ctestFiles.add(file);
            } else {
                TimedSeries timed = numericReader.read(file);
                putUnique(series, timed.key(), timed);
            }
        }
        if (!ctestFiles.isEmpty()) {
            Set<String> caseFilter = new LinkedHashSet<>(cases);
            Set<String> timerFilter = new LinkedHashSet<>(timers);
            new CtestTimelineReader().readAll(ctestFiles, caseFilter, processes, timerFilter)
                .forEach((key, timed) -> putUnique(series, key, timed));
        }
        return series;
    }

    private static void putUnique(Map<SeriesKey, TimedSeries> series, SeriesKey key, TimedSeries timed) {
        if (series.putIfAbsent(key, timed) != null) {
            throw new IllegalArgumentException("Error: more than one input yields series " + key);
        }
    }

    /**
     * Values to analyze for one series, transformed if requested.
     */
    public double[] analysisValues(TimedSeries series) {
        double[] values = series.values().clone();
        if (logTransform) {
            for (int i = 0; i < values.length; i++) {
                values[i] = Math.log(values[i]);
            }
        }
        return values;
    }
}
