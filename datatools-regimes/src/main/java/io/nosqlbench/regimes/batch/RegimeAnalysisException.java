package io.nosqlbench.regimes.batch;

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

/// Thrown when a batch of series cannot be analyzed: a task failed, the batch ran out
/// of time, or the waiting thread was interrupted.
public class RegimeAnalysisException extends RuntimeException {

    private final String seriesKey;

    public RegimeAnalysisException(String seriesKey, String message, Throwable cause) {
        super(seriesKey != null ? "series '" + seriesKey + "': " + message : message, cause);
        this.seriesKey = seriesKey;
    }

    /// @return the key of the series being analyzed when the failure surfaced, or null
    public String getSeriesKey() {
        return seriesKey;
    }
}
