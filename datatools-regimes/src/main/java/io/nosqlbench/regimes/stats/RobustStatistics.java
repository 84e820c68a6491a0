package io.nosqlbench.regimes.stats;

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

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outlier-resistant mean and standard deviation.
 *
 * <h2>Trimming rule</h2>
 *
 * <p>Each point is scored by its distance from the sample median, scaled by the
 * median absolute deviation (normal-consistent, with a small additive floor so
 * that constant samples score zero instead of dividing by zero). A point is
 * removed only if it is <em>both</em>:
 * <ul>
 *   <li>at or beyond {@link TrimPolicy#threshold()} scaled deviations, and</li>
 *   <li>among the {@code floor(n * proportion)} highest-scoring points.</li>
 * </ul>
 *
 * <p>So at most {@code floor(n * proportion)} points are ever removed, and a point
 * inside the threshold is never removed. Samples with fewer than
 * {@code ceil(1 / proportion)} points, or a zero proportion, are not trimmed.
 *
 * <p>Variances are sample (n - 1) variances; a single retained point has variance 0.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * RobustStatistics.Moments m = RobustStatistics.moments(series, 0, 20, TrimPolicy.DEFAULT);
 * double center = m.mean();
 * double spread = m.stdDev();
 * }</pre>
 */
public final class RobustStatistics {

    /** Scale making the MAD a consistent estimator of sigma for normal data. */
    public static final double MAD_SCALE = 1.4826;

    /** Added to the scaled MAD so constant samples never divide by zero. */
    public static final double MAD_FLOOR = 1e-12;

    public static final double DEFAULT_OUTLIER_THRESHOLD = 3.0;

    private RobustStatistics() {
        // Utility class
    }

    /**
     * Moments of the retained part of a sample.
     *
     * @param count size of the sample before trimming
     * @param retained number of points kept after trimming
     * @param mean mean of the retained points
     * @param variance sample variance of the retained points
     */
    public record Moments(int count, int retained, double mean, double variance) {

        public double stdDev() {
            return Math.sqrt(variance);
        }

        /// @return number of points removed by trimming
        public int removed() {
            return count - retained;
        }
    }

    /**
     * Trimmed moments of a whole sample.
     *
     * @param values the sample, not modified
     * @param policy trimming limits
     * @return moments of the retained points
     */
    public static Moments moments(double[] values, TrimPolicy policy) {
        Objects.requireNonNull(values, "values cannot be null");
        return moments(values, 0, values.length, policy);
    }

    /**
     * Trimmed moments of {@code values[from, to)}.
     *
     * @param values the series, not modified
     * @param from first index, inclusive
     * @param to last index, exclusive
     * @param policy trimming limits
     * @return moments of the retained points
     */
    public static Moments moments(double[] values, int from, int to, TrimPolicy policy) {
        double[] kept = trim(values, from, to, policy);
        return new Moments(to - from, kept.length, mean(kept), variance(kept));
    }

    /**
     * Untrimmed moments of {@code values[from, to)}.
     */
    public static Moments plainMoments(double[] values, int from, int to) {
        checkRange(values, from, to);
        int n = to - from;
        double mean = new Mean().evaluate(values, from, n);
        double variance = n > 1 ? new Variance().evaluate(values, from, n) : 0.0;
        return new Moments(n, n, mean, variance);
    }

    /**
     * Returns the points of {@code values[from, to)} that survive trimming, in their
     * original order.
     *
     * @param values the series, not modified
     * @param from first index, inclusive
     * @param to last index, exclusive
     * @param policy trimming limits
     * @return a new array holding the retained points
     * @throws IllegalArgumentException if the range is empty or out of bounds
     */
    public static double[] trim(double[] values, int from, int to, TrimPolicy policy) {
        checkRange(values, from, to);
        Objects.requireNonNull(policy, "policy cannot be null");
        int n = to - from;
        int maxRemovable = policy.maxRemovable(n);
        if (maxRemovable == 0) {
            return Arrays.copyOfRange(values, from, to);
        }

        double median = new Median().evaluate(values, from, n);
        double[] deviations = new double[n];
        for (int i = 0; i < n; i++) {
            deviations[i] = Math.abs(values[from + i] - median);
        }
        double scale = MAD_SCALE * new Median().evaluate(deviations) + MAD_FLOOR;

        // Most extreme first; equal deviations keep the earlier point ranked higher
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> {
            int byDeviation = Double.compare(deviations[b], deviations[a]);
            return byDeviation != 0 ? byDeviation : Integer.compare(a, b);
        });

        boolean[] removed = new boolean[n];
        int removedCount = 0;
        for (int rank = 0; rank < maxRemovable; rank++) {
            int i = order[rank];
            if (deviations[i] / scale < policy.threshold()) {
                break;
            }
            removed[i] = true;
            removedCount++;
        }

        double[] kept = new double[n - removedCount];
        int k = 0;
        for (int i = 0; i < n; i++) {
            if (!removed[i]) {
                kept[k++] = values[from + i];
            }
        }
        return kept;
    }

    /**
     * Median absolute deviation of a sample, scaled by {@link #MAD_SCALE}.
     *
     * @param values the sample, not modified
     * @return the scaled MAD, without the division floor
     */
    public static double scaledMad(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }
        double median = new Median().evaluate(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return MAD_SCALE * new Median().evaluate(deviations);
    }

    private static double mean(double[] kept) {
        return new Mean().evaluate(kept);
    }

    private static double variance(double[] kept) {
        return kept.length > 1 ? new Variance().evaluate(kept) : 0.0;
    }

    private static void checkRange(double[] values, int from, int to) {
        Objects.requireNonNull(values, "values cannot be null");
        if (from < 0 || to > values.length || from >= to) {
            throw new IllegalArgumentException(
                "invalid range [" + from + ", " + to + ") for " + values.length + " values");
        }
    }
}
