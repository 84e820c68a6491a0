package io.nosqlbench.regimes;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Shared Gson configuration for regime detection documents.
///
/// ## Purpose
///
/// One configured [Gson] instance for everything this project reads or writes as JSON:
///
/// - [io.nosqlbench.regimes.config.DetectorConfig] files
/// - detection, verdict and regime band reports written by the command line tools
/// - ctest result files read by the ingestion layer
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable reports |
/// | HTML escaping | Disabled | Timer names keep their punctuation |
/// | Special floats | Allowed | NaN statistics survive a round trip |
///
/// The instance is thread-safe and shared.
public final class RegimesGsonConfig {

    private static final Gson INSTANCE = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    private RegimesGsonConfig() {
    }

    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }
}
