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

/// Outcome of checking the newest observation of a series for a regression.
public enum VerdictStatus {
    /// No regression candidate in the current regime.
    PASS,
    /// A regression candidate appeared but is not yet confirmed; it may be an outlier.
    WARN,
    /// Consecutive scans including the newest observation agree on a regression.
    FAIL;

    /// @return true for any status that needs a human to look at it
    public boolean needsAttention() {
        return this != PASS;
    }
}
