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

import io.nosqlbench.regimes.config.DetectorConfig;
import io.nosqlbench.regimes.stats.ShiftTest;
import io.nosqlbench.regimes.stats.TrimPolicy;

import java.util.Arrays;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Finds the statistically significant splits inside one window of a series.
 *
 * <h2>Procedure</h2>
 *
 * <ol>
 *   <li>Rank the interior splits {@code k} of the window by the size of the jump
 *       {@code |x[k] - x[k-1]|}, largest first, earlier index first on ties.</li>
 *   <li>Run the two-sample {@link ShiftTest} on the top {@code numTest} of them.</li>
 *   <li>Keep the splits whose statistic reaches the Bonferroni-corrected critical
 *       value {@code t.isf(alpha / (2 * numTest), m - 2)} for window length {@code m}.</li>
 * </ol>
 *
 * <p>Windows of two or fewer points yield an empty vote. The correction always
 * divides by the configured cap, also for windows with fewer interior splits.
 *
 * <p>Critical values are cached by degrees of freedom, so one scanner should serve a
 * whole detection run. Instances are not thread-safe.
 */
public final class CandidateScanner {

    private final double alpha;
    private final int numTest;
    private final TrimPolicy policy;
    private double[] criticalByDof = new double[0];

    public CandidateScanner(DetectorConfig config) {
        this(config.alpha(), config.numTest(), TrimPolicy.of(config));
    }

    /**
     * @param alpha family-wise significance level
     * @param numTest maximum number of splits tested per window
     * @param policy trimming used by the shift test
     */
    public CandidateScanner(double alpha, int numTest, TrimPolicy policy) {
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0, 1), got " + alpha);
        }
        if (numTest < 1) {
            throw new IllegalArgumentException("numTest must be positive, got " + numTest);
        }
        this.alpha = alpha;
        this.numTest = numTest;
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    /**
     * Scans {@code series[from, to)}.
     *
     * @param series the full series, not modified
     * @param from window start, inclusive
     * @param to window end, exclusive
     * @return significant splits keyed by absolute index
     */
    public CandidateVote scan(double[] series, int from, int to) {
        Objects.requireNonNull(series, "series cannot be null");
        if (from < 0 || to > series.length || from > to) {
            throw new IllegalArgumentException(
                "invalid window [" + from + ", " + to + ") for " + series.length + " values");
        }
        int m = to - from;
        if (m <= 2) {
            return CandidateVote.empty();
        }

        double critical = criticalValue(m - 2);
        TreeMap<Integer, Double> significant = new TreeMap<>();
        for (int split : rankSplits(series, from, to)) {
            double statistic = ShiftTest.twoSampleStatistic(series, from, split, to, policy);
            if (Math.abs(statistic) >= critical) {
                significant.put(split, statistic);
            }
        }
        return CandidateVote.of(significant);
    }

    /**
     * Scans a whole array as one window.
     */
    public CandidateVote scan(double[] window) {
        return scan(window, 0, window.length);
    }

    /**
     * Absolute split indices to test in {@code series[from, to)}, largest jump first.
     */
    int[] rankSplits(double[] series, int from, int to) {
        int interior = to - from - 1;
        Integer[] splits = new Integer[interior];
        for (int i = 0; i < interior; i++) {
            splits[i] = from + 1 + i;
        }
        Arrays.sort(splits, (a, b) -> {
            int byJump = Double.compare(
                Math.abs(series[b] - series[b - 1]), Math.abs(series[a] - series[a - 1]));
            return byJump != 0 ? byJump : Integer.compare(a, b);
        });
        int tested = Math.min(numTest, interior);
        int[] top = new int[tested];
        for (int i = 0; i < tested; i++) {
            top[i] = splits[i];
        }
        return top;
    }

    /**
     * Bonferroni-corrected two-sided critical value.
     *
     * @param degreesOfFreedom window length minus two
     */
    double criticalValue(int degreesOfFreedom) {
        if (degreesOfFreedom >= criticalByDof.length) {
            int oldLength = criticalByDof.length;
            criticalByDof = Arrays.copyOf(criticalByDof, Math.max(degreesOfFreedom + 1, oldLength * 2));
            Arrays.fill(criticalByDof, oldLength, criticalByDof.length, Double.NaN);
        }
        double critical = criticalByDof[degreesOfFreedom];
        if (Double.isNaN(critical)) {
            critical = ShiftTest.inverseSurvival(alpha / (2.0 * numTest), degreesOfFreedom);
            criticalByDof[degreesOfFreedom] = critical;
        }
        return critical;
    }

    public double getAlpha() {
        return alpha;
    }

    public int getNumTest() {
        return numTest;
    }
}
