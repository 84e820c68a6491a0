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

/// # Changepoint Detection
///
/// A {@link io.nosqlbench.regimes.detect.CandidateScanner} nominates significant
/// splits of one window; a {@link io.nosqlbench.regimes.detect.VoteConsensus}
/// confirms a split once consecutive scans agree on it; the
/// {@link io.nosqlbench.regimes.detect.DetectionStateMachine} drives windows over a
/// series and backtracks to each confirmed split.
///
/// {@link io.nosqlbench.regimes.detect.CusumDetector} is an independent detector
/// with no vote history.
package io.nosqlbench.regimes.detect;
