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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/// Reads timer measurements out of ctest result files.
///
/// ## Input format
///
/// Each file is one JSON object of test records keyed by run name:
///
/// ```json
/// {
///   "ant-2-20km_ml_ls_np384": {
///     "case": "ant-2-20km_ml_ls",
///     "np": 384,
///     "passed": true,
///     "date": 20200115,
///     "timers": { "Albany Total Time:": 512.3, "NOX Total Linear Solve:": 201.7 }
///   }
/// }
/// ```
///
/// Dates are `yyyyMMdd`, as number or string. Failed runs are ignored. A passed run
/// that lacks a requested timer is skipped with a warning. Series come out sorted
/// by date, one per (case, np, timer).
public class CtestTimelineReader {

    private static final Logger logger = LogManager.getLogger(CtestTimelineReader.class);

    private final boolean warnOnMissingTimer;

    public CtestTimelineReader() {
        this(true);
    }

    /// @param warnOnMissingTimer whether to log passed runs that lack a requested timer
    public CtestTimelineReader(boolean warnOnMissingTimer) {
        this.warnOnMissingTimer = warnOnMissingTimer;
    }

    /// Extracts one series.
    ///
    /// @param files ctest result files
    /// @param caseName test case to extract
    /// @param processes process count to extract
    /// @param timer timer to extract
    /// @return the dated series, possibly empty
    /// @throws IOException if a file cannot be read or is not a JSON object of records
    public TimedSeries read(List<Path> files, String caseName, int processes, String timer) throws IOException {
        SeriesKey key = new SeriesKey(caseName, processes, timer);
        Map<SeriesKey, TimedSeries> all = readAll(files, Set.of(caseName), processes, Set.of(timer));
        return all.getOrDefault(key, new TimedSeries.Builder(key).build());
    }

    /// Extracts every series matching the filters.
    ///
    /// @param files ctest result files
    /// @param cases case names to keep, or empty for all
    /// @param processes process count to keep, or null for all
    /// @param timers timer names to keep, or empty for all
    /// @return series by key, in key order
    /// @throws IOException if a file cannot be read or is not a JSON object of records
    public Map<SeriesKey, TimedSeries> readAll(List<Path> files, Set<String> cases, Integer processes,
                                               Set<String> timers) throws IOException {
        Map<SeriesKey, TimedSeries.Builder> builders = new TreeMap<>();
        for (Path file : files) {
            JsonObject records = parse(file);
            for (Map.Entry<String, JsonElement> entry : records.entrySet()) {
                if (!entry.getValue().isJsonObject()) {
                    logger.warn("{} in {} is not a test record, skipping", entry.getKey(), file);
                    continue;
                }
                collect(file, entry.getKey(), entry.getValue().getAsJsonObject(),
                    cases, processes, timers, builders);
            }
        }
        Map<SeriesKey, TimedSeries> series = new TreeMap<>();
        builders.forEach((key, builder) -> series.put(key, builder.build()));
        return series;
    }

    private void collect(Path file, String name, JsonObject record, Set<String> cases, Integer processes,
                         Set<String> timers, Map<SeriesKey, TimedSeries.Builder> builders) {
        String caseName = stringField(record, "case");
        if (caseName == null || (!cases.isEmpty() && !cases.contains(caseName))) {
            return;
        }
        JsonElement npField = record.get("np");
        JsonElement passedField = record.get("passed");
        if (!isNumber(npField) || !isBoolean(passedField)) {
            logger.warn("{} in {} has no usable np or passed field, skipping", name, file);
            return;
        }
        int np = npField.getAsInt();
        if (processes != null && np != processes) {
            return;
        }
        if (!passedField.getAsBoolean()) {
            return;
        }

        LocalDate date = parseDate(record.get("date"));
        if (date == null) {
            logger.warn("{} in {} has no usable date, skipping", name, file);
            return;
        }
        JsonObject recordTimers = record.has("timers") && record.get("timers").isJsonObject()
            ? record.getAsJsonObject("timers")
            : new JsonObject();

        if (timers.isEmpty()) {
            for (Map.Entry<String, JsonElement> timer : recordTimers.entrySet()) {
                add(builders, new SeriesKey(caseName, np, timer.getKey()), date, timer.getValue());
            }
            return;
        }
        for (String timer : timers) {
            if (recordTimers.has(timer)) {
                add(builders, new SeriesKey(caseName, np, timer), date, recordTimers.get(timer));
            } else if (warnOnMissingTimer) {
                logger.warn("{} not found in {}, {}", timer, name, file);
            }
        }
    }

    private static void add(Map<SeriesKey, TimedSeries.Builder> builders, SeriesKey key,
                            LocalDate date, JsonElement value) {
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            logger.warn("timer {} on {} is not numeric, skipping", key.timer(), date);
            return;
        }
        builders.computeIfAbsent(key, TimedSeries.Builder::new).add(date, value.getAsDouble());
    }

    private static JsonObject parse(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new IOException(file + " is not a JSON object of test records");
            }
            return root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("malformed ctest file " + file + ": " + e.getMessage(), e);
        }
    }

    private static boolean isNumber(JsonElement value) {
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber();
    }

    private static boolean isBoolean(JsonElement value) {
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean();
    }

    private static String stringField(JsonObject record, String field) {
        JsonElement value = record.get(field);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    static LocalDate parseDate(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        try {
            return LocalDate.parse(value.getAsString(), DateTimeFormatter.BASIC_ISO_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
