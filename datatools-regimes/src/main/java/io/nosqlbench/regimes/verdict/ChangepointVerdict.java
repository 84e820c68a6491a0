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

import io.nosqlbench.regimes.config.DetectorConfig;
import io.nosqlbench.regimes.config.RegressionDirection;
import io.nosqlbench.regimes.detect.CandidateScanner;
import io.nosqlbench.regimes.detect.CandidateVote;
import io.nosqlbench.regimes.detect.DetectionResult;
import io.nosqlbench.regimes.detect.SequentialDetector;
import io.nosqlbench.regimes.detect.VoteConsensus;
import io.nosqlbench.regimes.stats.RobustStatistics;
import io.nosqlbench.regimes.stats.TrimPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Decides whether the newest observation of a series shows a regression.
 *
 * <h2>Procedure</h2>
 *
 * <ol>
 *   <li>Run {@link SequentialDetector} on every observation but the newest, to learn
 *       where the current regime starts and what the recent votes were.</li>
 *   <li>Scan the current regime (capped at the lookback window) including the newest
 *       observation, and keep only the significant splits whose sign is a regression
 *       in the configured {@link RegressionDirection}.</li>
 *   <li>Push those into a copy of the detector's vote history:
 *       <ul>
 *         <li>consensus: {@link VerdictStatus#FAIL}</li>
 *         <li>no consensus but at least one candidate: {@link VerdictStatus#WARN}</li>
 *         <li>otherwise {@link VerdictStatus#PASS}</li>
 *       </ul>
 *   </li>
 * </ol>
 *
 * <p>A series of fewer than three observations cannot be tested; it passes with
 * {@link VerdictResult#coldStart()} set.
 */
public final class ChangepointVerdict {

    private static final Logger logger = LogManager.getLogger(ChangepointVerdict.class);

    /** Fewest observations that can produce anything but a cold-start pass. */
    public static final int MIN_OBSERVATIONS = 3;

    private final DetectorConfig config;
    private final SequentialDetector detector;

    public ChangepointVerdict(DetectorConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.detector = new SequentialDetector(config);
    }

    /**
     * Checks the newest observation of {@code series}.
     *
     * @param series observations in arrival order, the newest last; not modified
     * @return the verdict with recent statistics
     */
    public VerdictResult check(double[] series) {
        Objects.requireNonNull(series, "series cannot be null");
        int n = series.length;
        if (n < MIN_OBSERVATIONS) {
            return coldStart(series);
        }

        DetectionResult history = detector.detect(series, n - 1);
        int lastKnown = history.lastChangepoint();
        int from = Math.max(lastKnown, n - config.lookback());

        RegressionDirection direction = config.direction();
        CandidateVote regressions = new CandidateScanner(config)
            .scan(series, from, n)
            .filter(direction::isRegression);

        VoteConsensus votes = history.votes().copy();
        votes.push(regressions);

        VerdictStatus status;
        if (votes.result().isPresent()) {
            status = VerdictStatus.FAIL;
        } else if (!regressions.isEmpty()) {
            status = VerdictStatus.WARN;
        } else {
            status = VerdictStatus.PASS;
        }

        RobustStatistics.Moments recent = RobustStatistics.moments(series, lastKnown, n, TrimPolicy.of(config));
        logger.debug("verdict {} for {} observations, regime since {}, candidates {}",
            status, n, lastKnown, regressions);
        return new VerdictResult(status, series[n - 1], recent.mean(), recent.stdDev(),
            false, lastKnown, regressions);
    }

    private VerdictResult coldStart(double[] series) {
        int n = series.length;
        double latest = n > 0 ? series[n - 1] : Double.NaN;
        double mean = Double.NaN;
        double std = Double.NaN;
        if (n > 0) {
            RobustStatistics.Moments moments = RobustStatistics.plainMoments(series, 0, n);
            mean = moments.mean();
            std = moments.stdDev();
        }
        logger.debug("cold start: only {} observations", n);
        return new VerdictResult(VerdictStatus.PASS, latest, mean, std, true, 0, CandidateVote.empty());
    }

    public DetectorConfig getConfig() {
        return config;
    }
}
