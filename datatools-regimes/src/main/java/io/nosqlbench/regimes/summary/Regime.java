package io.nosqlbench.regimes.summary;

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

/**
 * One regime of a series and its bounds.
 *
 * @param start first index, inclusive
 * @param end last index, exclusive
 * @param mean robust mean of the regime
 * @param stdDev robust standard deviation of the regime
 * @param lower lower bound
 * @param upper upper bound
 */
public record Regime(int start, int end, double mean, double stdDev, double lower, double upper) {

    public int length() {
        return end - start;
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }
}
