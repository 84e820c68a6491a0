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

import io.nosqlbench.regimes.config.DetectorConfig;

/// Limits applied when discarding outliers before computing moments.
///
/// @param proportion maximum fraction of a sample that may be removed, in [0, 1)
/// @param threshold scaled deviation from the median below which a point is always kept
public record TrimPolicy(double proportion, double threshold) {

    /// Keeps every point.
    public static final TrimPolicy NONE = new TrimPolicy(0.0, RobustStatistics.DEFAULT_OUTLIER_THRESHOLD);

    /// Removes at most one point in eight, and only beyond three scaled deviations.
    public static final TrimPolicy DEFAULT = new TrimPolicy(
        DetectorConfig.DEFAULT_TRIM_PROPORTION, DetectorConfig.DEFAULT_OUTLIER_THRESHOLD);

    public TrimPolicy {
        if (!(proportion >= 0.0 && proportion < 1.0)) {
            throw new IllegalArgumentException("proportion must be in [0, 1), got " + proportion);
        }
        if (!(threshold > 0.0)) {
            throw new IllegalArgumentException("threshold must be positive, got " + threshold);
        }
    }

    public static TrimPolicy of(DetectorConfig config) {
        return new TrimPolicy(config.trimProportion(), config.outlierThreshold());
    }

    /// @param n sample size
    /// @return true if a sample of this size is left untouched
    public boolean isIdentityFor(int n) {
        return proportion == 0.0 || n < Math.ceil(1.0 / proportion);
    }

    /// @param n sample size
    /// @return the most points trimming may remove from a sample of this size
    public int maxRemovable(int n) {
        return isIdentityFor(n) ? 0 : (int) Math.floor(n * proportion);
    }
}
