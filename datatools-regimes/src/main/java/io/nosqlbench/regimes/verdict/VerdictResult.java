package io.nosqlbench.regimes.verdict;

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

import io.nosqlbench.regimes.detect.CandidateVote;

import java.util.Objects;

/**
 * Verdict for one series.
 *
 * @param status pass, warn or fail
 * @param latestValue the newest observation, or {@code NaN} for an empty series
 * @param recentMean robust mean since the last known changepoint
 * @param recentStd robust standard deviation since the last known changepoint
 * @param coldStart true when there was too little history to test at all; the
 *                  status is then {@link VerdictStatus#PASS} but means "unknown", not "clean"
 * @param lastChangepoint start of the regime the newest observation was compared against
 * @param regressionCandidates significant splits in the regression direction from the newest scan
 */
public record VerdictResult(
    VerdictStatus status,
    double latestValue,
    double recentMean,
    double recentStd,
    boolean coldStart,
    int lastChangepoint,
    CandidateVote regressionCandidates
) {

    public VerdictResult {
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(regressionCandidates, "regressionCandidates cannot be null");
    }

    /// @return true only for a pass that rests on enough history to mean something
    public boolean isCleanPass() {
        return status == VerdictStatus.PASS && !coldStart;
    }
}
