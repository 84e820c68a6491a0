package io.nosqlbench.regimes.summary;

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
import io.nosqlbench.regimes.stats.RobustStatistics;
import io.nosqlbench.regimes.stats.ShiftTest;
import io.nosqlbench.regimes.stats.TrimPolicy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Robust mean and bounds of every regime delimited by a list of changepoints.
 *
 * <p>Regime {@code k} spans {@code [changepoints[k], changepoints[k+1])}; the last one
 * runs to the end of the series. Bounds follow the configured {@link BandMode}:
 * <ul>
 *   <li>{@link BandMode#FIXED}: {@code mean ± multiplier * std}</li>
 *   <li>{@link BandMode#STD_ERROR}: {@code mean ± t * std / sqrt(len)}, with {@code t}
 *       the two-sided Student-t critical value at the band significance level and
 *       {@code len - 1} degrees of freedom. A single-point regime has zero width.</li>
 * </ul>
 */
public final class RegimeSummary {

    private final BandMode bandMode;
    private final double bandAlpha;
    private final double fixedMultiplier;
    private final TrimPolicy policy;

    public RegimeSummary(DetectorConfig config) {
        this(config.bandMode(), config.bandAlpha(), config.fixedBandMultiplier(), TrimPolicy.of(config));
    }

    public RegimeSummary(BandMode bandMode, double bandAlpha, double fixedMultiplier, TrimPolicy policy) {
        this.bandMode = Objects.requireNonNull(bandMode, "bandMode cannot be null");
        this.bandAlpha = bandAlpha;
        this.fixedMultiplier = fixedMultiplier;
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    /**
     * Summarizes each regime of {@code series}.
     *
     * @param series observations, not modified
     * @param changepoints strictly increasing regime starts beginning with 0
     * @return band arrays as long as the series
     */
    public RegimeBands summarize(double[] series, List<Integer> changepoints) {
        Objects.requireNonNull(series, "series cannot be null");
        validateChangepoints(changepoints, series.length);

        int n = series.length;
        double[] mean = new double[n];
        double[] upper = new double[n];
        double[] lower = new double[n];
        List<Regime> regimes = new ArrayList<>(changepoints.size());

        for (int k = 0; k < changepoints.size(); k++) {
            int start = changepoints.get(k);
            int end = k + 1 < changepoints.size() ? changepoints.get(k + 1) : n;
            if (start >= end) {
                continue;
            }
            Regime regime = regime(series, start, end);
            regimes.add(regime);
            Arrays.fill(mean, start, end, regime.mean());
            Arrays.fill(upper, start, end, regime.upper());
            Arrays.fill(lower, start, end, regime.lower());
        }
        return new RegimeBands(mean, upper, lower, regimes);
    }

    /**
     * Summarizes {@code series[start, end)} as a single regime.
     */
    public Regime regime(double[] series, int start, int end) {
        RobustStatistics.Moments moments = RobustStatistics.moments(series, start, end, policy);
        double halfWidth = halfWidth(moments.stdDev(), end - start);
        return new Regime(start, end, moments.mean(), moments.stdDev(),
            moments.mean() - halfWidth, moments.mean() + halfWidth);
    }

    private double halfWidth(double std, int length) {
        if (bandMode == BandMode.FIXED) {
            return fixedMultiplier * std;
        }
        if (length < 2) {
            return 0.0;
        }
        // dof = length - 1 here, unlike the shift test's n - 2
        double critical = ShiftTest.inverseSurvival(bandAlpha / 2.0, length - 1);
        return critical * std / Math.sqrt(length);
    }

    private static void validateChangepoints(List<Integer> changepoints, int n) {
        Objects.requireNonNull(changepoints, "changepoints cannot be null");
        if (changepoints.isEmpty() || changepoints.get(0) != 0) {
            throw new IllegalArgumentException("changepoints must start with 0: " + changepoints);
        }
        for (int k = 1; k < changepoints.size(); k++) {
            int c = changepoints.get(k);
            if (c <= changepoints.get(k - 1) || c >= n) {
                throw new IllegalArgumentException(
                    "changepoints must increase strictly and stay below " + n + ": " + changepoints);
            }
        }
    }
}
