package io.nosqlbench.regimes.config;

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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.regimes.RegimesGsonConfig;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Versioned, validated parameter set for one detection run.
 *
 * <h2>Purpose</h2>
 *
 * <p>Every tunable of the detection engine lives here instead of in method
 * defaults, so that a run can be reproduced from its configuration alone.
 * Instances are immutable once built; validation happens eagerly in
 * {@link Builder#build()} and after JSON loading, and the engine itself never
 * re-checks parameters.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "version": 1,
 *   "alpha": 1.0E-4,
 *   "min_agree": 3,
 *   "num_test": 5,
 *   "lookback": 30,
 *   "trim_proportion": 0.125,
 *   "outlier_threshold": 3.0,
 *   "band_mode": "FIXED",
 *   "band_alpha": 0.05,
 *   "fixed_band_multiplier": 2.0,
 *   "direction": "DOWNWARD"
 * }
 * }</pre>
 *
 * <p>Missing fields take the version 1 defaults.
 */
public final class DetectorConfig {

    /** Version of the parameter defaults below. */
    public static final int CONFIG_VERSION = 1;

    public static final double DEFAULT_ALPHA = 1e-4;
    public static final int DEFAULT_MIN_AGREE = 3;
    public static final int DEFAULT_NUM_TEST = 5;
    public static final int DEFAULT_LOOKBACK = 30;
    public static final double DEFAULT_TRIM_PROPORTION = 0.125;
    public static final double DEFAULT_OUTLIER_THRESHOLD = 3.0;
    public static final double DEFAULT_BAND_ALPHA = 0.05;
    public static final double DEFAULT_FIXED_BAND_MULTIPLIER = 2.0;

    private static final DetectorConfig DEFAULTS = builder().build();

    @SerializedName("version")
    private int version = CONFIG_VERSION;

    @SerializedName("alpha")
    private double alpha = DEFAULT_ALPHA;

    @SerializedName("min_agree")
    private int minAgree = DEFAULT_MIN_AGREE;

    @SerializedName("num_test")
    private int numTest = DEFAULT_NUM_TEST;

    @SerializedName("lookback")
    private int lookback = DEFAULT_LOOKBACK;

    @SerializedName("trim_proportion")
    private double trimProportion = DEFAULT_TRIM_PROPORTION;

    @SerializedName("outlier_threshold")
    private double outlierThreshold = DEFAULT_OUTLIER_THRESHOLD;

    @SerializedName("band_mode")
    private BandMode bandMode = BandMode.FIXED;

    @SerializedName("band_alpha")
    private double bandAlpha = DEFAULT_BAND_ALPHA;

    @SerializedName("fixed_band_multiplier")
    private double fixedBandMultiplier = DEFAULT_FIXED_BAND_MULTIPLIER;

    @SerializedName("direction")
    private RegressionDirection direction = RegressionDirection.DOWNWARD;

    /// Used by Gson, which overwrites only the fields present in the document.
    private DetectorConfig() {
    }

    /// @return the version 1 defaults
    public static DetectorConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder seeded with this configuration's values
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Loads and validates a configuration from a JSON file.
     *
     * @param path the JSON document
     * @return the validated configuration
     * @throws IOException if the file cannot be read
     * @throws InvalidConfigurationException if a parameter is out of range or the document is malformed
     */
    public static DetectorConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    /**
     * Parses and validates a configuration from JSON.
     *
     * @param reader source of a JSON document
     * @return the validated configuration
     * @throws InvalidConfigurationException if a parameter is out of range or the document is malformed
     */
    public static DetectorConfig fromJson(Reader reader) {
        DetectorConfig config;
        try {
            config = RegimesGsonConfig.gson().fromJson(reader, DetectorConfig.class);
        } catch (JsonParseException e) {
            throw new InvalidConfigurationException("json", e.getMessage());
        }
        if (config == null) {
            throw new InvalidConfigurationException("json", "empty configuration document");
        }
        config.validate();
        return config;
    }

    /**
     * Writes this configuration as JSON.
     *
     * @param path destination file
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            RegimesGsonConfig.gson().toJson(this, writer);
        }
    }

    private void validate() {
        if (version != CONFIG_VERSION) {
            throw new InvalidConfigurationException("version",
                "unsupported configuration version " + version + ", expected " + CONFIG_VERSION);
        }
        requireOpenUnit("alpha", alpha);
        if (minAgree < 1) {
            throw new InvalidConfigurationException("min_agree", "must be at least 1, got " + minAgree);
        }
        if (lookback < 3) {
            throw new InvalidConfigurationException("lookback", "must be at least 3, got " + lookback);
        }
        if (numTest < 1) {
            throw new InvalidConfigurationException("num_test", "must be at least 1, got " + numTest);
        }
        if (numTest >= lookback) {
            throw new InvalidConfigurationException("num_test",
                "must be smaller than the lookback window (" + lookback + "), got " + numTest);
        }
        if (!(trimProportion >= 0.0 && trimProportion < 1.0)) {
            throw new InvalidConfigurationException("trim_proportion", "must be in [0, 1), got " + trimProportion);
        }
        if (!(outlierThreshold > 0.0) || Double.isInfinite(outlierThreshold)) {
            throw new InvalidConfigurationException("outlier_threshold", "must be positive, got " + outlierThreshold);
        }
        // Gson leaves enum fields null for unknown constants
        if (bandMode == null) {
            throw new InvalidConfigurationException("band_mode", "unsupported or missing band mode");
        }
        requireOpenUnit("band_alpha", bandAlpha);
        if (!(fixedBandMultiplier > 0.0) || Double.isInfinite(fixedBandMultiplier)) {
            throw new InvalidConfigurationException("fixed_band_multiplier",
                "must be positive, got " + fixedBandMultiplier);
        }
        if (direction == null) {
            throw new InvalidConfigurationException("direction", "unsupported or missing regression direction");
        }
    }

    private static void requireOpenUnit(String name, double value) {
        if (!(value > 0.0 && value < 1.0)) {
            throw new InvalidConfigurationException(name, "must be in (0, 1), got " + value);
        }
    }

    public int version() {
        return version;
    }

    /// Family-wise significance level for changepoint candidates.
    public double alpha() {
        return alpha;
    }

    /// Number of consecutive scans that must nominate the same split.
    public int minAgree() {
        return minAgree;
    }

    /// Maximum number of candidate splits tested per window.
    public int numTest() {
        return numTest;
    }

    /// Maximum window length considered while no changepoint fires.
    public int lookback() {
        return lookback;
    }

    /// Maximum proportion of a sample that outlier trimming may remove.
    public double trimProportion() {
        return trimProportion;
    }

    /// Scaled deviation from the median below which a point is never trimmed.
    public double outlierThreshold() {
        return outlierThreshold;
    }

    public BandMode bandMode() {
        return bandMode;
    }

    /// Significance level for {@link BandMode#STD_ERROR} bands.
    public double bandAlpha() {
        return bandAlpha;
    }

    /// Width multiplier for {@link BandMode#FIXED} bands.
    public double fixedBandMultiplier() {
        return fixedBandMultiplier;
    }

    public RegressionDirection direction() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetectorConfig)) return false;
        DetectorConfig that = (DetectorConfig) o;
        return version == that.version
            && Double.compare(alpha, that.alpha) == 0
            && minAgree == that.minAgree
            && numTest == that.numTest
            && lookback == that.lookback
            && Double.compare(trimProportion, that.trimProportion) == 0
            && Double.compare(outlierThreshold, that.outlierThreshold) == 0
            && bandMode == that.bandMode
            && Double.compare(bandAlpha, that.bandAlpha) == 0
            && Double.compare(fixedBandMultiplier, that.fixedBandMultiplier) == 0
            && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, alpha, minAgree, numTest, lookback, trimProportion,
            outlierThreshold, bandMode, bandAlpha, fixedBandMultiplier, direction);
    }

    @Override
    public String toString() {
        return "DetectorConfig{v" + version
            + ", alpha=" + alpha
            + ", minAgree=" + minAgree
            + ", numTest=" + numTest
            + ", lookback=" + lookback
            + ", trim=" + trimProportion
            + ", outlierThreshold=" + outlierThreshold
            + ", bandMode=" + bandMode
            + ", bandAlpha=" + bandAlpha
            + ", fixedBandMultiplier=" + fixedBandMultiplier
            + ", direction=" + direction
            + '}';
    }

    /**
     * Builder for {@link DetectorConfig}. Unset values keep the version 1 defaults.
     */
    public static final class Builder {
        private final DetectorConfig config = new DetectorConfig();

        private Builder() {
        }

        private Builder(DetectorConfig source) {
            config.alpha = source.alpha;
            config.minAgree = source.minAgree;
            config.numTest = source.numTest;
            config.lookback = source.lookback;
            config.trimProportion = source.trimProportion;
            config.outlierThreshold = source.outlierThreshold;
            config.bandMode = source.bandMode;
            config.bandAlpha = source.bandAlpha;
            config.fixedBandMultiplier = source.fixedBandMultiplier;
            config.direction = source.direction;
        }

        public Builder alpha(double alpha) {
            config.alpha = alpha;
            return this;
        }

        public Builder minAgree(int minAgree) {
            config.minAgree = minAgree;
            return this;
        }

        public Builder numTest(int numTest) {
            config.numTest = numTest;
            return this;
        }

        public Builder lookback(int lookback) {
            config.lookback = lookback;
            return this;
        }

        public Builder trimProportion(double trimProportion) {
            config.trimProportion = trimProportion;
            return this;
        }

        public Builder outlierThreshold(double outlierThreshold) {
            config.outlierThreshold = outlierThreshold;
            return this;
        }

        public Builder bandMode(BandMode bandMode) {
            config.bandMode = bandMode;
            return this;
        }

        public Builder bandAlpha(double bandAlpha) {
            config.bandAlpha = bandAlpha;
            return this;
        }

        public Builder fixedBandMultiplier(double fixedBandMultiplier) {
            config.fixedBandMultiplier = fixedBandMultiplier;
            return this;
        }

        public Builder direction(RegressionDirection direction) {
            config.direction = direction;
            return this;
        }

        /**
         * Validates and returns a new configuration.
         *
         * @throws InvalidConfigurationException if any parameter is out of range
         */
        public DetectorConfig build() {
            DetectorConfig built = new DetectorConfig();
            built.alpha = config.alpha;
            built.minAgree = config.minAgree;
            built.numTest = config.numTest;
            built.lookback = config.lookback;
            built.trimProportion = config.trimProportion;
            built.outlierThreshold = config.outlierThreshold;
            built.bandMode = config.bandMode;
            built.bandAlpha = config.bandAlpha;
            built.fixedBandMultiplier = config.fixedBandMultiplier;
            built.direction = config.direction;
            built.validate();
            return built;
        }
    }
}
