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

/// Which direction of level shift counts as a regression.
///
/// Shift statistics are signed as (mean before split) - (mean after split), so a
/// positive statistic means the level went down at the split.
public enum RegressionDirection {
    /// A drop in level is a regression (throughput, rates, scores).
    DOWNWARD,
    /// A rise in level is a regression (wall-clock timers, latencies).
    UPWARD;

    /// @param statistic signed shift statistic, left mean minus right mean
    /// @return true if a shift with this sign is a regression in this direction
    public boolean isRegression(double statistic) {
        return this == DOWNWARD ? statistic > 0.0d : statistic < 0.0d;
    }
}
