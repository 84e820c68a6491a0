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
import io.nosqlbench.regimes.detect.CusumDetector;
import io.nosqlbench.regimes.detect.DetectionResult;
import io.nosqlbench.regimes.detect.SequentialDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// List the changepoints of each series
///
/// For every series this prints where each regime starts, and the observation at
/// which the shift was confirmed. The default detector is the sequential robust
/// shift test; `--method cusum` uses the CUSUM detector instead.
@CommandLine.Command(name = "detect",
    description = "Detect level shifts (changepoints) in performance time series")
public class CMD_regimes_detect implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_regimes_detect.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    /// Available detectors.
    public enum Method {
        SEQUENTIAL,
        CUSUM
    }

    /// Changepoints of one series, in the form both detectors report.
    private record Detection(List<Integer> changepoints, List<Integer> detectionPoints) {
    }

    @CommandLine.Mixin
    private SeriesInputOption seriesInputOption = new SeriesInputOption();

    @CommandLine.Mixin
    private DetectorConfigOption detectorConfigOption = new DetectorConfigOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Option(names = {"-m", "--method"},
        description = "Detector: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "SEQUENTIAL")
    private Method method = Method.SEQUENTIAL;

    @CommandLine.Option(names = {"--cusum-threshold"},
        description = "Decision threshold for the CUSUM detector (default: ${DEFAULT-VALUE})",
        defaultValue = "" + CusumDetector.DEFAULT_THRESHOLD)
    private double cusumThreshold = CusumDetector.DEFAULT_THRESHOLD;

    @CommandLine.Option(names = {"--json"},
        description = "Write changepoints as JSON instead of text")
    private boolean json = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        DetectorConfig config;
        Map<SeriesKey, TimedSeries> series;
        CusumDetector cusum;
        try {
            seriesInputOption.validate(spec.commandLine());
            config = detectorConfigOption.toConfig();
            cusum = new CusumDetector(CusumDetector.DEFAULT_STARTUP, cusumThreshold,
                CusumDetector.DEFAULT_MIN_SHIFT, CusumDetector.DEFAULT_MAX_INFLUENCE);
            series = seriesInputOption.readSeries();
        } catch (CommandLine.ParameterException | IllegalArgumentException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Error reading input: " + e.getMessage(), e);
            return EXIT_ERROR;
        }

        Map<SeriesKey, double[]> values = new LinkedHashMap<>();
        series.forEach((key, timed) -> values.put(key, seriesInputOption.analysisValues(timed)));

        Map<SeriesKey, Detection> detections;
        try (ParallelSeriesAnalyzer analyzer = parallelExecutionOption.createAnalyzer()) {
            if (method == Method.CUSUM) {
                detections = analyzer.analyzeAll(values, v -> {
                    CusumDetector.CusumResult result = cusum.detect(v);
                    return new Detection(result.changepoints(), result.detectionPoints());
                });
            } else {
                SequentialDetector detector = new SequentialDetector(config);
                detections = analyzer.analyzeAll(values, v -> {
                    DetectionResult result = detector.detect(v);
                    return new Detection(result.changepoints(), result.detectionPoints());
                });
            }
        } catch (RegimeAnalysisException e) {
            logger.error("Error analyzing " + e.getSeriesKey() + ": " + e.getMessage(), e);
            return EXIT_ERROR;
        }

        if (json) {
            printJson(series, detections);
        } else {
            printText(series, detections);
        }
        return EXIT_SUCCESS;
    }

    private void printText(Map<SeriesKey, TimedSeries> series, Map<SeriesKey, Detection> detections) {
        for (Map.Entry<SeriesKey, Detection> entry : detections.entrySet()) {
            TimedSeries timed = series.get(entry.getKey());
            Detection detection = entry.getValue();
            int shifts = detection.changepoints().size() - 1;
            System.out.printf("%s: %d observations, %d shift%s%n",
                entry.getKey(), timed.size(), shifts, shifts == 1 ? "" : "s");
            for (int r = 1; r < detection.changepoints().size(); r++) {
                int changepoint = detection.changepoints().get(r);
                int detectedAt = detection.detectionPoints().get(r);
                System.out.printf("  regime %d starts at %s (confirmed at %s)%n",
                    r, timed.pointLabel(changepoint), timed.pointLabel(detectedAt));
            }
        }
    }

    private void printJson(Map<SeriesKey, TimedSeries> series, Map<SeriesKey, Detection> detections) {
        List<Map<String, Object>> documents = new ArrayList<>();
        for (Map.Entry<SeriesKey, Detection> entry : detections.entrySet()) {
            TimedSeries timed = series.get(entry.getKey());
            Detection detection = entry.getValue();
            List<String> labels = new ArrayList<>();
            for (int changepoint : detection.changepoints()) {
                labels.add(timed.isEmpty() ? "#0" : timed.pointLabel(changepoint));
            }
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("case", entry.getKey().caseName());
            document.put("processes", entry.getKey().processes());
            document.put("timer", entry.getKey().timer());
            document.put("observations", timed.size());
            document.put("changepoints", detection.changepoints());
            document.put("detection_points", detection.detectionPoints());
            document.put("regime_starts", labels);
            documents.add(document);
        }
        System.out.println(RegimesGsonConfig.gson().toJson(documents));
    }
}
