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
import io.nosqlbench.regimes.detect.DetectionResult;
import io.nosqlbench.regimes.detect.SequentialDetector;
import io.nosqlbench.regimes.summary.Regime;
import io.nosqlbench.regimes.summary.RegimeBands;
import io.nosqlbench.regimes.summary.RegimeSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Write per-observation regime bands for plotting
///
/// Detects changepoints in each series, then emits a JSON document per series with the
/// regime mean, upper and lower bound at every observation, alongside the raw values
/// and their labels. Bounds follow `--band-mode`.
@CommandLine.Command(name = "bands",
    description = "Emit regime mean and bounds for every observation as JSON")
public class CMD_regimes_bands implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_regimes_bands.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private SeriesInputOption seriesInputOption = new SeriesInputOption();

    @CommandLine.Mixin
    private DetectorConfigOption detectorConfigOption = new DetectorConfigOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Option(names = {"-o", "--output"},
        description = "Write the JSON report to this file instead of standard output")
    private Path outputPath;

    @CommandLine.Option(names = {"-f", "--force"},
        description = "Overwrite the output file if it exists")
    private boolean force = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (outputPath != null && Files.exists(outputPath) && !force) {
            logger.error("Error: Output file already exists. Use --force to overwrite.");
            return EXIT_FILE_EXISTS;
        }

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

        Map<SeriesKey, double[]> values = new LinkedHashMap<>();
        series.forEach((key, timed) -> values.put(key, seriesInputOption.analysisValues(timed)));

        SequentialDetector detector = new SequentialDetector(config);
        RegimeSummary summary = new RegimeSummary(config);
        Map<SeriesKey, RegimeBands> bands;
        try (ParallelSeriesAnalyzer analyzer = parallelExecutionOption.createAnalyzer()) {
            bands = analyzer.analyzeAll(values, v -> {
                DetectionResult detection = detector.detect(v);
                return summary.summarize(v, detection.changepoints());
            });
        } catch (RegimeAnalysisException e) {
            logger.error("Error analyzing " + e.getSeriesKey() + ": " + e.getMessage(), e);
            return EXIT_ERROR;
        }

        List<Map<String, Object>> documents = new ArrayList<>();
        for (Map.Entry<SeriesKey, RegimeBands> entry : bands.entrySet()) {
            documents.add(toDocument(series.get(entry.getKey()), values.get(entry.getKey()), entry.getValue()));
        }
        String report = RegimesGsonConfig.gson().toJson(documents);

        if (outputPath == null) {
            System.out.println(report);
            return EXIT_SUCCESS;
        }
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
                writer.write(report);
            }
            logger.info("Wrote bands for {} series to {}", documents.size(), outputPath);
            return EXIT_SUCCESS;
        } catch (IOException e) {
            logger.error("Error writing " + outputPath + ": " + e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    private static Map<String, Object> toDocument(TimedSeries timed, double[] values, RegimeBands bands) {
        List<String> labels = new ArrayList<>(timed.size());
        for (int i = 0; i < timed.size(); i++) {
            labels.add(timed.pointLabel(i));
        }
        List<Map<String, Object>> regimes = new ArrayList<>();
        for (Regime regime : bands.regimes()) {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("start", regime.start());
            r.put("end", regime.end());
            r.put("mean", regime.mean());
            r.put("std", regime.stdDev());
            r.put("lower", regime.lower());
            r.put("upper", regime.upper());
            regimes.add(r);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("case", timed.key().caseName());
        document.put("processes", timed.key().processes());
        document.put("timer", timed.key().timer());
        document.put("labels", labels);
        document.put("values", values);
        document.put("mean", bands.mean());
        document.put("upper", bands.upper());
        document.put("lower", bands.lower());
        document.put("regimes", regimes);
        return document;
    }
}
