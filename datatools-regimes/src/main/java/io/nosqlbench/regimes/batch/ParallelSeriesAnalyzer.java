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

import io.nosqlbench.regimes.config.DetectorConfig;
import io.nosqlbench.regimes.detect.DetectionResult;
import io.nosqlbench.regimes.detect.SequentialDetector;
import io.nosqlbench.regimes.verdict.ChangepointVerdict;
import io.nosqlbench.regimes.verdict.VerdictResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Analyzes many independent series in parallel, one task per series.
 *
 * <h2>Model</h2>
 *
 * <p>Each task is a pure function of its own series and the shared, immutable
 * {@link DetectorConfig}: {@code (key, series, config) -> (key, result)}. Tasks share
 * no mutable state, so nothing is locked; results are collected in the iteration
 * order of the input map.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (ParallelSeriesAnalyzer analyzer = ParallelSeriesAnalyzer.builder()
 *         .parallelism(8)
 *         .timeout(Duration.ofMinutes(5))
 *         .build()) {
 *     Map<String, VerdictResult> verdicts = analyzer.checkAll(seriesByTimer, config);
 * }
 * }</pre>
 *
 * <p>A pool passed to the builder is borrowed and never shut down by this class.
 */
public final class ParallelSeriesAnalyzer implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ParallelSeriesAnalyzer.class);

    /**
     * Returns the default parallelism level: one worker per available processor.
     */
    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private final ForkJoinPool pool;
    private final boolean ownsPool;
    private final Duration timeout;

    private ParallelSeriesAnalyzer(ForkJoinPool pool, boolean ownsPool, Duration timeout) {
        this.pool = pool;
        this.ownsPool = ownsPool;
        this.timeout = timeout;
    }

    /**
     * Creates an analyzer with its own pool of {@link #defaultParallelism()} workers
     * and no time budget.
     */
    public ParallelSeriesAnalyzer() {
        this(new ForkJoinPool(defaultParallelism()), true, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs {@link SequentialDetector} on every series.
     */
    public <K> Map<K, DetectionResult> detectAll(Map<K, double[]> seriesByKey, DetectorConfig config) {
        SequentialDetector detector = new SequentialDetector(config);
        return analyzeAll(seriesByKey, detector::detect);
    }

    /**
     * Runs {@link ChangepointVerdict} on every series.
     */
    public <K> Map<K, VerdictResult> checkAll(Map<K, double[]> seriesByKey, DetectorConfig config) {
        ChangepointVerdict verdict = new ChangepointVerdict(config);
        return analyzeAll(seriesByKey, verdict::check);
    }

    /**
     * Applies {@code analysis} to every series in parallel.
     *
     * @param seriesByKey series to analyze, by key
     * @param analysis a side-effect-free function of one series
     * @return results keyed like the input, in input order
     * @throws RegimeAnalysisException if any task fails, the time budget runs out, or
     *                                 the calling thread is interrupted
     */
    public <K, R> Map<K, R> analyzeAll(Map<K, double[]> seriesByKey, Function<double[], R> analysis) {
        Objects.requireNonNull(seriesByKey, "seriesByKey cannot be null");
        Objects.requireNonNull(analysis, "analysis cannot be null");

        logger.info("analyzing {} series on {} workers", seriesByKey.size(), pool.getParallelism());
        long startNanos = System.nanoTime();
        long deadline = timeout != null ? startNanos + timeout.toNanos() : Long.MAX_VALUE;

        List<K> keys = new ArrayList<>(seriesByKey.size());
        List<ForkJoinTask<R>> tasks = new ArrayList<>(seriesByKey.size());
        for (Map.Entry<K, double[]> entry : seriesByKey.entrySet()) {
            double[] series = Objects.requireNonNull(entry.getValue(), "series for " + entry.getKey());
            keys.add(entry.getKey());
            tasks.add(pool.submit(() -> analysis.apply(series)));
        }

        Map<K, R> results = new LinkedHashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            K key = keys.get(i);
            try {
                results.put(key, await(tasks.get(i), deadline));
            } catch (ExecutionException e) {
                cancelFrom(tasks, i + 1);
                throw new RegimeAnalysisException(String.valueOf(key), "analysis failed", e.getCause());
            } catch (TimeoutException e) {
                cancelFrom(tasks, i);
                throw new RegimeAnalysisException(String.valueOf(key),
                    "time budget of " + timeout + " exhausted", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelFrom(tasks, i);
                throw new RegimeAnalysisException(String.valueOf(key), "interrupted while waiting", e);
            }
        }

        logger.info("analyzed {} series in {} ms", results.size(),
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return results;
    }

    private static <R> R await(ForkJoinTask<R> task, long deadline)
            throws ExecutionException, TimeoutException, InterruptedException {
        if (deadline == Long.MAX_VALUE) {
            return task.get();
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0 && !task.isDone()) {
            throw new TimeoutException();
        }
        return task.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
    }

    private static void cancelFrom(List<? extends ForkJoinTask<?>> tasks, int first) {
        for (int i = first; i < tasks.size(); i++) {
            tasks.get(i).cancel(true);
        }
    }

    /**
     * Returns the number of worker threads.
     */
    public int getParallelism() {
        return pool.getParallelism();
    }

    /**
     * Shuts down the pool if this analyzer owns it.
     */
    public void shutdown() {
        if (ownsPool && !pool.isShutdown()) {
            pool.shutdown();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Builder for custom ParallelSeriesAnalyzer configuration.
     */
    public static final class Builder {
        private int parallelism = defaultParallelism();
        private ForkJoinPool pool = null;
        private Duration timeout = null;

        private Builder() {
        }

        /**
         * Sets the number of worker threads.
         */
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Uses an existing ForkJoinPool.
         */
        public Builder pool(ForkJoinPool pool) {
            this.pool = pool;
            return this;
        }

        /**
         * Bounds the wall-clock time of each batch.
         */
        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Builds the analyzer.
         */
        public ParallelSeriesAnalyzer build() {
            ForkJoinPool effectivePool = pool != null ? pool : new ForkJoinPool(parallelism);
            return new ParallelSeriesAnalyzer(effectivePool, pool == null, timeout);
        }
    }
}
