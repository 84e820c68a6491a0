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

import io.nosqlbench.regimes.SeriesFixtures;
import io.nosqlbench.regimes.config.DetectorConfig;
import io.nosqlbench.regimes.detect.DetectionResult;
import io.nosqlbench.regimes.detect.SequentialDetector;
import io.nosqlbench.regimes.verdict.VerdictResult;
import io.nosqlbench.regimes.verdict.VerdictStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ForkJoinPool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class ParallelSeriesAnalyzerTest {

    private static Map<String, double[]> sampleSeries() {
        Map<String, double[]> series = new LinkedHashMap<>();
        series.put("flat", SeriesFixtures.flat(10.0, 40));
        series.put("step", SeriesFixtures.step(10.0, 20, 20.0, 20));
        series.put("drop", SeriesFixtures.step(20.0, 30, 10.0, 3));
        series.put("short", new double[]{1.0});
        return series;
    }

    @Test
    void testDetectAllMatchesSequentialRuns() {
        DetectorConfig config = DetectorConfig.defaults();
        Map<String, double[]> series = sampleSeries();

        Map<String, DetectionResult> results;
        try (ParallelSeriesAnalyzer analyzer = ParallelSeriesAnalyzer.builder().parallelism(3).build()) {
            results = analyzer.detectAll(series, config);
        }

        assertThat(results.keySet()).containsExactly("flat", "step", "drop", "short");
        SequentialDetector detector = new SequentialDetector(config);
        for (Map.Entry<String, double[]> entry : series.entrySet()) {
            assertEquals(detector.detect(entry.getValue()).changepoints(),
                results.get(entry.getKey()).changepoints(), entry.getKey());
        }
        assertEquals(List.of(0, 20), results.get("step").changepoints());
    }

    @Test
    void testCheckAll() {
        Map<String, VerdictResult> verdicts;
        try (ParallelSeriesAnalyzer analyzer = new ParallelSeriesAnalyzer()) {
            verdicts = analyzer.checkAll(sampleSeries(), DetectorConfig.defaults());
        }

        assertEquals(VerdictStatus.PASS, verdicts.get("flat").status());
        assertEquals(VerdictStatus.FAIL, verdicts.get("drop").status());
        assertTrue(verdicts.get("short").coldStart());
    }

    @Test
    void testFailureNamesTheSeries() {
        Map<String, double[]> series = sampleSeries();
        try (ParallelSeriesAnalyzer analyzer = ParallelSeriesAnalyzer.builder().parallelism(2).build()) {
            RegimeAnalysisException e = assertThrows(RegimeAnalysisException.class,
                () -> analyzer.analyzeAll(series, values -> {
                    if (values.length == 1) {
                        throw new IllegalStateException("too short");
                    }
                    return values.length;
                }));
            assertEquals("short", e.getSeriesKey());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }

    @Test
    void testTimeout() {
        Map<String, double[]> series = Map.of("slow", new double[]{1.0});
        try (ParallelSeriesAnalyzer analyzer = ParallelSeriesAnalyzer.builder()
            .parallelism(1)
            .timeout(Duration.ofMillis(100))
            .build()) {
            RegimeAnalysisException e = assertThrows(RegimeAnalysisException.class,
                () -> analyzer.analyzeAll(series, values -> {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                    }
                    return values.length;
                }));
            assertEquals("slow", e.getSeriesKey());
        }
    }

    @Test
    void testBorrowedPoolIsNotShutDown() {
        ForkJoinPool pool = new ForkJoinPool(2);
        try {
            try (ParallelSeriesAnalyzer analyzer = ParallelSeriesAnalyzer.builder().pool(pool).build()) {
                assertEquals(2, analyzer.getParallelism());
                analyzer.detectAll(Map.of("flat", SeriesFixtures.flat(1.0, 10)), DetectorConfig.defaults());
            }
            assertFalse(pool.isShutdown());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> ParallelSeriesAnalyzer.builder().parallelism(0));
        assertThrows(IllegalArgumentException.class, () -> ParallelSeriesAnalyzer.builder().timeout(Duration.ZERO));
        assertTrue(ParallelSeriesAnalyzer.defaultParallelism() >= 1);
    }
}
