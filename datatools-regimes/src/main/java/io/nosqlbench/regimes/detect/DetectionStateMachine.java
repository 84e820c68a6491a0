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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The restart-on-confirmation loop of {@link SequentialDetector}, as explicit states
 * and transitions.
 *
 * <h2>Transitions</h2>
 *
 * <pre>{@code
 * Scanning(i, j),  j > n               -> Finished
 * Scanning(i, j),  consensus on c      -> Committing(c, j - 1)
 * Scanning(i, j),  no consensus        -> Scanning(i, j + 1)
 * Committing(c, d)                     -> Scanning(c, c + 1)   (votes reset)
 * Finished                             -> Finished
 * }</pre>
 *
 * <p>While scanning, the window is {@code [max(i, j - lookback), j)}: the regime
 * start {@code i} stays put, but no more than {@code lookback} points are examined.
 * A commit moves the regime start to the changepoint and shrinks the window back
 * to it, so pre-change data never enters later tests.
 *
 * <p>{@link #onScan(Scanning, OptionalInt)} and {@link #afterCommit(Committing)} are
 * pure and can be checked without a series. A machine instance belongs to one run.
 */
public final class DetectionStateMachine {

    /** A point in the detection loop. */
    public sealed interface State permits Scanning, Committing, Finished {
    }

    /**
     * Examining the window ending before {@code end} within the regime starting at
     * {@code regimeStart}.
     */
    public record Scanning(int regimeStart, int end) implements State {

        /// @return first index of the examined window under the given lookback cap
        public int windowStart(int lookback) {
            return Math.max(regimeStart, end - lookback);
        }
    }

    /** A changepoint confirmed by the scan of the window ending at {@code detectionPoint}. */
    public record Committing(int changepoint, int detectionPoint) implements State {
    }

    /** The window has grown past the end of the series. */
    public record Finished() implements State {
    }

    private static final Finished FINISHED = new Finished();

    private final double[] series;
    private final int length;
    private final int lookback;
    private final CandidateScanner scanner;
    private final VoteConsensus votes;
    private final List<Integer> changepoints = new ArrayList<>();
    private final List<Integer> detectionPoints = new ArrayList<>();

    /**
     * @param series observations, not modified
     * @param length number of leading observations to analyze
     * @param lookback maximum window length
     * @param scanner candidate scanner for this run
     * @param votes vote history for this run
     */
    public DetectionStateMachine(double[] series, int length, int lookback,
                                 CandidateScanner scanner, VoteConsensus votes) {
        this.series = Objects.requireNonNull(series, "series cannot be null");
        if (length < 0 || length > series.length) {
            throw new IllegalArgumentException("length " + length + " outside [0, " + series.length + "]");
        }
        this.length = length;
        this.lookback = lookback;
        this.scanner = Objects.requireNonNull(scanner, "scanner cannot be null");
        this.votes = Objects.requireNonNull(votes, "votes cannot be null");
        changepoints.add(0);
        detectionPoints.add(0);
    }

    /// @return where the loop starts: scanning from index 0, or finished for series of two or fewer points
    public State initial() {
        return length <= 2 ? FINISHED : new Scanning(0, 1);
    }

    /**
     * Performs one transition.
     */
    public State step(State state) {
        if (state instanceof Scanning scanning) {
            if (scanning.end() > length) {
                return FINISHED;
            }
            int from = scanning.windowStart(lookback);
            votes.push(scanner.scan(series, from, scanning.end()));
            return onScan(scanning, votes.result());
        }
        if (state instanceof Committing committing) {
            changepoints.add(committing.changepoint());
            detectionPoints.add(committing.detectionPoint());
            votes.reset();
            return afterCommit(committing);
        }
        return FINISHED;
    }

    /**
     * Runs transitions until {@link Finished}.
     */
    public void run() {
        State state = initial();
        while (!(state instanceof Finished)) {
            state = step(state);
        }
    }

    /**
     * Next state after a scan of {@code scanning}'s window produced {@code consensus}.
     */
    public static State onScan(Scanning scanning, OptionalInt consensus) {
        if (consensus.isPresent()) {
            return new Committing(consensus.getAsInt(), scanning.end() - 1);
        }
        return new Scanning(scanning.regimeStart(), scanning.end() + 1);
    }

    /**
     * Next state once a changepoint is recorded: rescan from the changepoint.
     */
    public static State afterCommit(Committing committing) {
        return new Scanning(committing.changepoint(), committing.changepoint() + 1);
    }

    /// @return changepoints committed so far, starting with 0
    public List<Integer> changepoints() {
        return Collections.unmodifiableList(changepoints);
    }

    /// @return detection points parallel to {@link #changepoints()}
    public List<Integer> detectionPoints() {
        return Collections.unmodifiableList(detectionPoints);
    }

    public VoteConsensus votes() {
        return votes;
    }
}
