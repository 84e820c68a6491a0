package io.nosqlbench.command.regimes.common;

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

import io.nosqlbench.regimes.batch.ParallelSeriesAnalyzer;
import picocli.CommandLine;

import java.time.Duration;

/**
 * Shared parallel execution options.
 * Provides {@code --threads} and {@code --timeout} for commands that analyze many
 * series at once.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of worker threads (default: all available cores)"
    )
    private Integer explicitThreads;

    @CommandLine.Option(
        names = {"--timeout"},
        description = "Overall time budget in seconds for the analysis (default: none)"
    )
    private Long timeoutSeconds;

    /**
     * Gets the thread count to use.
     *
     * @return the explicit thread count, or one per available core
     */
    public int getThreadCount() {
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        }
        return ParallelSeriesAnalyzer.defaultParallelism();
    }

    /**
     * Creates an analyzer honoring these options. The caller closes it.
     */
    public ParallelSeriesAnalyzer createAnalyzer() {
        ParallelSeriesAnalyzer.Builder builder = ParallelSeriesAnalyzer.builder().parallelism(getThreadCount());
        if (timeoutSeconds != null && timeoutSeconds > 0) {
            builder.timeout(Duration.ofSeconds(timeoutSeconds));
        }
        return builder.build();
    }
}
