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

import io.nosqlbench.regimes.config.BandMode;
import io.nosqlbench.regimes.config.DetectorConfig;
import io.nosqlbench.regimes.config.RegressionDirection;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shared detector tuning options.
 * Options left unset keep the value from {@code --config}, or the built-in defaults
 * when no configuration file is given.
 */
public class DetectorConfigOption {

    @CommandLine.Option(
        names = {"--config"},
        description = "JSON detector configuration file; explicit options below override it"
    )
    private Path configFile;

    @CommandLine.Option(
        names = {"-a", "--alpha"},
        description = "Family-wise significance level for changepoint candidates (default: "
            + DetectorConfig.DEFAULT_ALPHA + ")"
    )
    private Double alpha;

    @CommandLine.Option(
        names = {"--min-agree"},
        description = "Consecutive scans that must agree before a changepoint is confirmed (default: "
            + DetectorConfig.DEFAULT_MIN_AGREE + ")"
    )
    private Integer minAgree;

    @CommandLine.Option(
        names = {"--num-test"},
        description = "Candidate splits tested per window (default: " + DetectorConfig.DEFAULT_NUM_TEST + ")"
    )
    private Integer numTest;

    @CommandLine.Option(
        names = {"--lookback"},
        description = "Maximum window length while no changepoint fires (default: "
            + DetectorConfig.DEFAULT_LOOKBACK + ")"
    )
    private Integer lookback;

    @CommandLine.Option(
        names = {"--trim"},
        description = "Maximum proportion of a sample removed as outliers (default: "
            + DetectorConfig.DEFAULT_TRIM_PROPORTION + ")"
    )
    private Double trimProportion;

    @CommandLine.Option(
        names = {"--outlier-threshold"},
        description = "Scaled deviation from the median below which points are never trimmed (default: "
            + DetectorConfig.DEFAULT_OUTLIER_THRESHOLD + ")"
    )
    private Double outlierThreshold;

    @CommandLine.Option(
        names = {"--band-mode"},
        description = "Regime bounds: ${COMPLETION-CANDIDATES} (default: FIXED)"
    )
    private BandMode bandMode;

    @CommandLine.Option(
        names = {"--band-alpha"},
        description = "Significance level of STD_ERROR bands (default: " + DetectorConfig.DEFAULT_BAND_ALPHA + ")"
    )
    private Double bandAlpha;

    @CommandLine.Option(
        names = {"--band-multiplier"},
        description = "Multiplier of the regime standard deviation for FIXED bands (default: "
            + DetectorConfig.DEFAULT_FIXED_BAND_MULTIPLIER + ")"
    )
    private Double bandMultiplier;

    @CommandLine.Option(
        names = {"--direction"},
        description = "Which level shift is a regression: ${COMPLETION-CANDIDATES} "
            + "(default: DOWNWARD; use UPWARD for timers)"
    )
    private RegressionDirection direction;

    /**
     * Builds the effective configuration.
     *
     * @return the validated configuration
     * @throws IOException if the configuration file cannot be read
     * @throws io.nosqlbench.regimes.config.InvalidConfigurationException if a value is out of range
     */
    public DetectorConfig toConfig() throws IOException {
        DetectorConfig base = configFile != null ? DetectorConfig.load(configFile) : DetectorConfig.defaults();
        DetectorConfig.Builder builder = base.toBuilder();
        if (alpha != null) builder.alpha(alpha);
        if (minAgree != null) builder.minAgree(minAgree);
        if (numTest != null) builder.numTest(numTest);
        if (lookback != null) builder.lookback(lookback);
        if (trimProportion != null) builder.trimProportion(trimProportion);
        if (outlierThreshold != null) builder.outlierThreshold(outlierThreshold);
        if (bandMode != null) builder.bandMode(bandMode);
        if (bandAlpha != null) builder.bandAlpha(bandAlpha);
        if (bandMultiplier != null) builder.fixedBandMultiplier(bandMultiplier);
        if (direction != null) builder.direction(direction);
        return builder.build();
    }
}
