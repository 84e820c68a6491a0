package io.nosqlbench.command.regimes.subcommands;

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

import io.nosqlbench.command.regimes.common.DetectorConfigOption;
import io.nosqlbench.command.regimes.common.ParallelExecutionOption;
import io.nosqlbench.command.regimes.common.SeriesInputOption;
import io.nosqlbench.command.regimes.ingest.SeriesKey;
import io.nosqlbench.command.regimes.ingest.TimedSeries;
import io.nosqlbench.regimes.RegimesGsonConfig;
import io.nosqlbench.regimes.batch.ParallelSeriesAnalyzer;
import io.nosqlbench.regimes.batch.RegimeAnalysisException;
import io.nosqlbench.regimes.config.DetectorConfig;
import io.nosqlbench.regimes.verdict.VerdictResult;
import io.nosqlbench.regimes.verdict.VerdictStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Check whether the newest observation of each series shows a regression
///
/// Each series gets one of three verdicts:
///
/// - `PASS`: no significant shift in the regression direction
/// - `WARN`: the newest window holds a significant candidate that has not yet been
///   confirmed by enough consecutive scans
/// - `FAIL`: the candidate is confirmed
///
/// Series too short to test pass with a cold-start marker. The exit code is 1 when any
/// series fails, or when any warns and `--strict` is given.
@CommandLine.Command(name = "check",
    description = "Check the newest observation of each series for a performance regression")
public class CMD_regimes_check implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_regimes_check.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_REGRESSION = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private SeriesInputOption seriesInputOption = new SeriesInputOption();

    @CommandLine.Mixin
    private DetectorConfigOption detectorConfigOption = new DetectorConfigOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Option(names = {"--strict"},
        description = "Treat WARN verdicts as failures for the exit code")
    private boolean strict = false;

    @CommandLine.Option(names = {"--json"},
        description = "Write verdicts as JSON instead of a table")
    private boolean json = false;

    @CommandLine.Option(names = {"--only-attention"},
        description = "List only series whose verdict is WARN or FAIL")
    private boolean onlyAttention = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        DetectorConfig config;
        Map<SeriesKey, TimedSeries> series;
        try {
            seriesInputOption.validate(spec.commandLine());
            config = detectorConfigOption.toConfig();
            series = seriesInputOption.readSeries();
        } catch (CommandLine.ParameterException | IllegalArgumentException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Error reading input: " + e.getMessage(), e);
            return EXIT_ERROR;
        }

        if (series.isEmpty()) {
            logger.warn("No series matched the given case, process and timer filters");
            return EXIT_SUCCESS;
        }

        Map<SeriesKey, double[]> values = new LinkedHashMap<>();
        series.forEach((key, timed) -> values.put(key, seriesInputOption.analysisValues(timed)));

        Map<SeriesKey, VerdictResult> verdicts;
        try (ParallelSeriesAnalyzer analyzer = parallelExecutionOption.createAnalyzer()) {
            verdicts = analyzer.checkAll(values, config);
        } catch (RegimeAnalysisException e) {
            logger.error("Error checking " + e.getSeriesKey() + ": " + e.getMessage(), e);
            return EXIT_ERROR;
        }

        Map<VerdictStatus, Integer> counts = new EnumMap<>(VerdictStatus.class);
        for (VerdictResult verdict : verdicts.values()) {
            counts.merge(verdict.status(), 1, Integer::sum);
        }

        if (json) {
            printJson(series, verdicts);
        } else {
            printTable(series, verdicts);
            System.out.printf("%d series: %d pass, %d warn, %d fail%n",
                verdicts.size(),
                counts.getOrDefault(VerdictStatus.PASS, 0),
                counts.getOrDefault(VerdictStatus.WARN, 0),
                counts.getOrDefault(VerdictStatus.FAIL, 0));
        }

        if (counts.getOrDefault(VerdictStatus.FAIL, 0) > 0) {
            return EXIT_REGRESSION;
        }
        if (strict && counts.getOrDefault(VerdictStatus.WARN, 0) > 0) {
            return EXIT_REGRESSION;
        }
        return EXIT_SUCCESS;
    }

    private void printTable(Map<SeriesKey, TimedSeries> series, Map<SeriesKey, VerdictResult> verdicts) {
        System.out.printf("%-6s %-40s %14s %14s %14s  %s%n",
            "STATUS", "SERIES", "LATEST", "REGIME MEAN", "REGIME STD", "REGIME SINCE");
        for (Map.Entry<SeriesKey, VerdictResult> entry : verdicts.entrySet()) {
            VerdictResult verdict = entry.getValue();
            if (onlyAttention && !verdict.status().needsAttention()) {
                continue;
            }
            TimedSeries timed = series.get(entry.getKey());
            String status = verdict.coldStart() ? "PASS*" : verdict.status().name();
            System.out.printf("%-6s %-40s %14.6g %14.6g %14.6g  %s%n",
                status,
                entry.getKey(),
                verdict.latestValue(),
                verdict.recentMean(),
                verdict.recentStd(),
                regimeSince(timed, verdict));
        }
    }

    private void printJson(Map<SeriesKey, TimedSeries> series, Map<SeriesKey, VerdictResult> verdicts) {
        List<Map<String, Object>> documents = new ArrayList<>();
        for (Map.Entry<SeriesKey, VerdictResult> entry : verdicts.entrySet()) {
            VerdictResult verdict = entry.getValue();
            if (onlyAttention && !verdict.status().needsAttention()) {
                continue;
            }
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("case", entry.getKey().caseName());
            document.put("processes", entry.getKey().processes());
            document.put("timer", entry.getKey().timer());
            document.put("status", verdict.status().name());
            document.put("cold_start", verdict.coldStart());
            document.put("latest", verdict.latestValue());
            document.put("regime_mean", verdict.recentMean());
            document.put("regime_std", verdict.recentStd());
            document.put("regime_start", verdict.lastChangepoint());
            document.put("regime_since", regimeSince(series.get(entry.getKey()), verdict));
            document.put("candidates", verdict.regressionCandidates().asMap());
            documents.add(document);
        }
        System.out.println(RegimesGsonConfig.gson().toJson(documents));
    }

    private static String regimeSince(TimedSeries timed, VerdictResult verdict) {
        if (timed == null || timed.isEmpty()) {
            return "-";
        }
        return timed.pointLabel(verdict.lastChangepoint());
    }
}
