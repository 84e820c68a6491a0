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

import java.util.List;
import java.util.Objects;

/**
 * Per-index regime bands, piecewise constant within each regime, one entry per
 * series index.
 *
 * @param mean regime mean at each index
 * @param upper upper bound at each index
 * @param lower lower bound at each index
 * @param regimes the regimes the arrays were filled from, in order
 */
public record RegimeBands(double[] mean, double[] upper, double[] lower, List<Regime> regimes) {

    public RegimeBands {
        Objects.requireNonNull(mean, "mean cannot be null");
        Objects.requireNonNull(upper, "upper cannot be null");
        Objects.requireNonNull(lower, "lower cannot be null");
        if (mean.length != upper.length || mean.length != lower.length) {
            throw new IllegalArgumentException("band arrays differ in length");
        }
        regimes = List.copyOf(regimes);
    }

    public int length() {
        return mean.length;
    }
}
