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

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.DoublePredicate;

/// The significant splits nominated by one scan of one window.
///
/// Maps an absolute split index (the first index of the would-be new regime) to its
/// signed shift statistic. Iteration is in ascending index order. Instances are
/// immutable.
public final class CandidateVote {

    private static final CandidateVote EMPTY = new CandidateVote(new TreeMap<>());

    private final NavigableMap<Integer, Double> statistics;

    private CandidateVote(NavigableMap<Integer, Double> statistics) {
        this.statistics = Collections.unmodifiableNavigableMap(statistics);
    }

    /// @return the vote that nominates nothing
    public static CandidateVote empty() {
        return EMPTY;
    }

    /// @param statistics split index to signed statistic, copied
    public static CandidateVote of(Map<Integer, Double> statistics) {
        Objects.requireNonNull(statistics, "statistics cannot be null");
        return statistics.isEmpty() ? EMPTY : new CandidateVote(new TreeMap<>(statistics));
    }

    /// A vote for the given indices, each with a unit statistic.
    public static CandidateVote ofIndices(int... indices) {
        TreeMap<Integer, Double> statistics = new TreeMap<>();
        for (int index : indices) {
            statistics.put(index, 1.0);
        }
        return of(statistics);
    }

    public boolean isEmpty() {
        return statistics.isEmpty();
    }

    public int size() {
        return statistics.size();
    }

    public boolean contains(int index) {
        return statistics.containsKey(index);
    }

    /// @return the statistic for the index, or {@code NaN} if it was not nominated
    public double statistic(int index) {
        Double value = statistics.get(index);
        return value != null ? value : Double.NaN;
    }

    /// @return the nominated indices, ascending
    public Set<Integer> indices() {
        return statistics.keySet();
    }

    public Map<Integer, Double> asMap() {
        return statistics;
    }

    /// @return a vote keeping only the candidates whose statistic passes the predicate
    public CandidateVote filter(DoublePredicate keep) {
        TreeMap<Integer, Double> kept = new TreeMap<>();
        statistics.forEach((index, statistic) -> {
            if (keep.test(statistic)) {
                kept.put(index, statistic);
            }
        });
        return of(kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateVote)) return false;
        return statistics.equals(((CandidateVote) o).statistics);
    }

    @Override
    public int hashCode() {
        return statistics.hashCode();
    }

    @Override
    public String toString() {
        return "CandidateVote" + statistics;
    }
}
