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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Sliding agreement over the last {@code minAgree} candidate votes.
 *
 * <p>The history is a ring of exactly {@code minAgree} slots. A new or reset
 * history holds empty votes, so no split can win before {@code minAgree} votes
 * naming it have been pushed. Each {@link #push(CandidateVote)} overwrites the
 * oldest slot.
 *
 * <p>{@link #result()} names the split present in every slot. If several are,
 * the one with the largest summed absolute statistic wins; an exact tie goes to
 * the smaller index.
 *
 * <p>Not thread-safe. A detection run owns its instance; {@link #copy()} hands out
 * an independent one.
 */
public final class VoteConsensus {

    private final CandidateVote[] slots;
    private int cursor;

    /**
     * @param minAgree number of consecutive votes that must agree, at least 1
     */
    public VoteConsensus(int minAgree) {
        if (minAgree < 1) {
            throw new IllegalArgumentException("minAgree must be at least 1, got " + minAgree);
        }
        this.slots = new CandidateVote[minAgree];
        reset();
    }

    private VoteConsensus(VoteConsensus source) {
        this.slots = source.slots.clone();
        this.cursor = source.cursor;
    }

    /**
     * Records a vote, evicting the oldest.
     */
    public void push(CandidateVote vote) {
        slots[cursor] = Objects.requireNonNull(vote, "vote cannot be null");
        cursor = (cursor + 1) % slots.length;
    }

    /**
     * @return the split every retained vote agrees on, or empty
     */
    public OptionalInt result() {
        CandidateVote newest = newest();
        boolean found = false;
        int best = 0;
        double bestWeight = Double.NEGATIVE_INFINITY;
        for (int index : newest.indices()) {
            double weight = 0.0;
            boolean unanimous = true;
            for (CandidateVote slot : slots) {
                if (!slot.contains(index)) {
                    unanimous = false;
                    break;
                }
                weight += Math.abs(slot.statistic(index));
            }
            // indices ascend, so a strict comparison keeps the smaller index on ties
            if (unanimous && weight > bestWeight) {
                found = true;
                best = index;
                bestWeight = weight;
            }
        }
        return found ? OptionalInt.of(best) : OptionalInt.empty();
    }

    /**
     * Clears every slot back to an empty vote.
     */
    public void reset() {
        Arrays.fill(slots, CandidateVote.empty());
        cursor = 0;
    }

    /// @return the number of slots, always {@code minAgree}
    public int size() {
        return slots.length;
    }

    /// @return an independent copy of this history
    public VoteConsensus copy() {
        return new VoteConsensus(this);
    }

    /// @return the retained votes, oldest first
    public List<CandidateVote> history() {
        List<CandidateVote> ordered = new ArrayList<>(slots.length);
        for (int i = 0; i < slots.length; i++) {
            ordered.add(slots[(cursor + i) % slots.length]);
        }
        return ordered;
    }

    private CandidateVote newest() {
        return slots[(cursor + slots.length - 1) % slots.length];
    }

    @Override
    public String toString() {
        return "VoteConsensus" + history();
    }
}
