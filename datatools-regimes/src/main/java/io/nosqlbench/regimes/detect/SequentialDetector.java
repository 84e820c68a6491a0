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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Sequential changepoint detection with vote confirmation and backtracking.
 *
 * <h2>Algorithm</h2>
 *
 * <p>Starting with the regime at index 0, a window ending at {@code j} grows one
 * observation at a time. Each window is scanned by a {@link CandidateScanner} and
 * its significant splits pushed into a {@link VoteConsensus}. Once the last
 * {@code minAgree} scans agree on a split {@code c}, it is committed as a
 * changepoint detected at {@code j - 1}, the votes are cleared, and scanning
 * restarts from {@code c}. Windows never exceed {@code lookback} points. See
 * {@link DetectionStateMachine} for the transitions.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SequentialDetector detector = new SequentialDetector(DetectorConfig.defaults());
 * DetectionResult result = detector.detect(timings);
 * int currentRegimeStart = result.lastChangepoint();
 * }</pre>
 *
 * <p>Each call builds its own scanner and vote history, so one detector may serve
 * many threads, and repeated calls on the same input return the same result.
 */
public final class SequentialDetector {

    private static final Logger logger = LogManager.getLogger(SequentialDetector.class);

    private final DetectorConfig config;

    public SequentialDetector(DetectorConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Detects changepoints in the whole series.
     */
    public DetectionResult detect(double[] series) {
        Objects.requireNonNull(series, "series cannot be null");
        return detect(series, series.length);
    }

    /**
     * Detects changepoints in {@code series[0, length)}.
     *
     * @param series observations in arrival order, not modified
     * @param length number of leading observations to analyze
     * @return changepoints, detection points and the final vote history
     */
    public DetectionResult detect(double[] series, int length) {
        DetectionStateMachine machine = new DetectionStateMachine(
            series, length, config.lookback(),
            new CandidateScanner(config), new VoteConsensus(config.minAgree()));

        DetectionStateMachine.State state = machine.initial();
        while (!(state instanceof DetectionStateMachine.Finished)) {
            state = machine.step(state);
            if (state instanceof DetectionStateMachine.Committing committing) {
                logger.debug("changepoint at {} confirmed at {}",
                    committing.changepoint(), committing.detectionPoint());
            }
        }

        return new DetectionResult(machine.changepoints(), machine.detectionPoints(), machine.votes());
    }

    public DetectorConfig getConfig() {
        return config;
    }
}
