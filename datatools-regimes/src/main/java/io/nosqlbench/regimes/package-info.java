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

/// # Regime Detection
///
/// This package and its children find level shifts (regimes) in recurring
/// performance measurements, such as a nightly benchmark timer, and decide whether
/// the newest measurement is a regression.
///
/// ## Data Flow
///
/// ```text
///  double[] series ──► detect ──► changepoints ──► summary ──► regime bands
///                         │
///                         └────► verdict ──► PASS / WARN / FAIL
/// ```
///
/// | Package | Role |
/// |---------|------|
/// | `config` | Validated, JSON-loadable detector parameters |
/// | `stats` | Trimmed moments and the two-sample shift test |
/// | `detect` | Candidate scans, vote consensus, sequential and CUSUM detectors |
/// | `summary` | Per-regime mean and bounds |
/// | `verdict` | Regression decision for the newest observation |
/// | `batch` | Parallel analysis of many independent series |
///
/// All analysis is a pure function of one series and a configuration, so series
/// can be processed concurrently without coordination.
package io.nosqlbench.regimes;
