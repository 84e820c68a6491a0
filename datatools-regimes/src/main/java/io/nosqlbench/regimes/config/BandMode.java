package io.nosqlbench.regimes.config;

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

/// How regime bounds are reported.
public enum BandMode {
    /// mean ± multiplier × std, describing the spread of observations in the regime
    FIXED,
    /// mean ± t_crit × std / sqrt(n), describing the uncertainty of the regime mean
    STD_ERROR
}
