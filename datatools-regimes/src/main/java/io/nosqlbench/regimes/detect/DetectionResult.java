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

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link SequentialDetector} run.
 *
 * @param changepoints first index of each regime, strictly increasing, always starting with 0
 * @param detectionPoints index at which each changepoint was confirmed, parallel to {@code changepoints}
 * @param votes the vote history at the end of the run, for callers that push further evidence
 */
public record DetectionResult(List<Integer> changepoints, List<Integer> detectionPoints, VoteConsensus votes) {

    public DetectionResult {
        changepoints = List.copyOf(Objects.requireNonNull(changepoints, "changepoints cannot be null"));
        detectionPoints = List.copyOf(Objects.requireNonNull(detectionPoints, "detectionPoints cannot be null"));
        Objects.requireNonNull(votes, "votes cannot be null");
        if (changepoints.isEmpty() || changepoints.get(0) != 0) {
            throw new IllegalArgumentException("changepoints must start with 0: " + changepoints);
        }
        if (changepoints.size() != detectionPoints.size()) {
            throw new IllegalArgumentException("changepoints and detectionPoints differ in length");
        }
    }

    /// @return the start of the most recent regime
    public int lastChangepoint() {
        return changepoints.get(changepoints.size() - 1);
    }

    /// @return number of changepoints found, not counting the implicit one at 0
    public int shiftCount() {
        return changepoints.size() - 1;
    }

    /// @return true if no changepoint beyond index 0 was confirmed
    public boolean isSingleRegime() {
        return changepoints.size() == 1;
    }

    /// @return confirmation delay of each changepoint, parallel to {@code changepoints}
    public int[] detectionLags() {
        int[] lags = new int[changepoints.size()];
        for (int i = 0; i < lags.length; i++) {
            lags[i] = detectionPoints.get(i) - changepoints.get(i);
        }
        return lags;
    }
}
