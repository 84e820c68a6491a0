package io.nosqlbench.regimes.detect;

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

import io.nosqlbench.regimes.stats.RobustStatistics;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Two-sided CUSUM changepoint detection with restart on detection.
 *
 * <p>An alternative to {@link SequentialDetector} that needs no vote history: each
 * step normalizes the current regime by its median and a blended standard
 * deviation estimate, accumulates upward and downward excursions beyond
 * {@code minShift} (each point contributing at most {@code maxInfluence}), and
 * signals once either accumulator reaches {@code threshold}. The changepoint is
 * then placed just after the last point where the statistic was still below a
 * quarter of the threshold, and accumulation restarts there.
 *
 * <p>The standard deviation estimate blends the previous regime's estimate
 * (weighted as {@value #PRIOR_WEIGHT} observations) with a robust estimate of the
 * current regime: the scaled MAD from five points on, the plain standard
 * deviation below that. The first {@code startup} points seed the initial estimate.
 */
public final class CusumDetector {

    private static final Logger logger = LogManager.getLogger(CusumDetector.class);

    public static final int DEFAULT_STARTUP = 10;
    public static final double DEFAULT_THRESHOLD = 6.0;
    public static final double DEFAULT_MIN_SHIFT = 0.5;
    public static final double DEFAULT_MAX_INFLUENCE = 4.0;

    /** Observations the previous regime's deviation estimate counts as. */
    public static final int PRIOR_WEIGHT = 5;

    private static final int ROBUST_MIN_POINTS = 5;
    private static final double STD_FLOOR = 1e-12;

    /**
     * @param changepoints first index of each regime, starting with 0
     * @param detectionPoints index at which each changepoint was signaled
     * @param stdEstimates the deviation estimate in effect at each index
     */
    public record CusumResult(List<Integer> changepoints, List<Integer> detectionPoints, double[] stdEstimates) {

        public CusumResult {
            changepoints = List.copyOf(changepoints);
            detectionPoints = List.copyOf(detectionPoints);
        }

        public int lastChangepoint() {
            return changepoints.get(changepoints.size() - 1);
        }
    }

    private final int startup;
    private final double threshold;
    private final double minShift;
    private final double maxInfluence;

    public CusumDetector() {
        this(DEFAULT_STARTUP, DEFAULT_THRESHOLD, DEFAULT_MIN_SHIFT, DEFAULT_MAX_INFLUENCE);
    }

    /**
     * @param startup leading points used for the initial deviation estimate
     * @param threshold CUSUM level that signals a change
     * @param minShift smallest normalized shift that accumulates
     * @param maxInfluence largest contribution of a single point
     */
    public CusumDetector(int startup, double threshold, double minShift, double maxInfluence) {
        if (startup < 2) {
            throw new IllegalArgumentException("startup must be at least 2, got " + startup);
        }
        if (!(threshold > 0.0)) {
            throw new IllegalArgumentException("threshold must be positive, got " + threshold);
        }
        if (!(minShift >= 0.0)) {
            throw new IllegalArgumentException("minShift must not be negative, got " + minShift);
        }
        if (!(maxInfluence > 0.0)) {
            throw new IllegalArgumentException("maxInfluence must be positive, got " + maxInfluence);
        }
        this.startup = startup;
        this.threshold = threshold;
        this.minShift = minShift;
        this.maxInfluence = maxInfluence;
    }

    /**
     * Detects changepoints in the series.
     *
     * @param series observations in arrival order, not modified
     * @return changepoints, detection points and deviation estimates; a single regime
     *         when the series is not longer than the startup period
     */
    public CusumResult detect(double[] series) {
        Objects.requireNonNull(series, "series cannot be null");
        int n = series.length;
        double[] stdEstimates = new double[n];
        List<Integer> changepoints = new ArrayList<>(List.of(0));
        List<Integer> detectionPoints = new ArrayList<>(List.of(0));
        if (n <= startup) {
            return new CusumResult(changepoints, detectionPoints, stdEstimates);
        }

        double initialStd = new StandardDeviation(false).evaluate(series, 0, startup);
        Arrays.fill(stdEstimates, 0, startup, initialStd);
        double priorStd = initialStd;

        int i = 0;
        int j = i + 1;
        while (j < n) {
            stdEstimates[j] = weightedStd(priorStd, series, i, j);
            double center = new Median().evaluate(series, i, j - i);
            double[] statistics = batchCusum(series, i, j, center, stdEstimates[j]);

            if (statistics[statistics.length - 1] >= threshold) {
                int regimeLength = lastIndexBelow(statistics, threshold / 4.0) + 1;
                i += regimeLength;
                changepoints.add(i);
                detectionPoints.add(j - 1);
                logger.debug("cusum changepoint at {} signaled at {}", i, j - 1);
                priorStd = stdEstimates[i - 1];
                j = i + 1;
            } else {
                j++;
            }
        }
        return new CusumResult(changepoints, detectionPoints, stdEstimates);
    }

    /**
     * CUSUM statistic after each point of {@code series[from, to)}, normalized by
     * {@code center} and {@code std}. The first entry is always 0.
     */
    double[] batchCusum(double[] series, int from, int to, double center, double std) {
        int m = to - from;
        double[] statistics = new double[m];
        double scale = std + STD_FLOOR;
        double upper = 0.0;
        double lower = 0.0;
        for (int k = 1; k < m; k++) {
            double z = (series[from + k] - center) / scale;
            upper = Math.max(0.0, Math.min(maxInfluence, z - minShift) + upper);
            lower = Math.max(0.0, Math.min(maxInfluence, -z - minShift) + lower);
            statistics[k] = Math.max(upper, lower);
        }
        return statistics;
    }

    /**
     * Blend of the prior estimate and a robust estimate of {@code series[from, to)}.
     */
    static double weightedStd(double priorStd, double[] series, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return priorStd;
        }
        double std = robustStd(series, from, to);
        return (PRIOR_WEIGHT * priorStd + n * std) / (PRIOR_WEIGHT + n);
    }

    static double robustStd(double[] series, int from, int to) {
        if (to - from < ROBUST_MIN_POINTS) {
            return new StandardDeviation(false).evaluate(series, from, to - from);
        }
        return RobustStatistics.scaledMad(Arrays.copyOfRange(series, from, to));
    }

    private static int lastIndexBelow(double[] statistics, double level) {
        for (int k = statistics.length - 1; k >= 0; k--) {
            if (statistics[k] < level) {
                return k;
            }
        }
        // statistics[0] is always 0
        return 0;
    }
}
