package io.nosqlbench.regimes.detect;

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
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class SequentialDetectorTest {

    private final SequentialDetector detector = new SequentialDetector(DetectorConfig.defaults());

    @Test
    void testNoShiftNoChangepoint() {
        DetectionResult result = detector.detect(SeriesFixtures.flat(10.0, 60));

        assertEquals(List.of(0), result.changepoints());
        assertTrue(result.isSingleRegime());
        assertEquals(0, result.lastChangepoint());
    }

    @Test
    void testSingleShiftIsConfirmed() {
        DetectionResult result = detector.detect(SeriesFixtures.step(10.0, 20, 20.0, 20));

        assertEquals(List.of(0, 20), result.changepoints());
        assertEquals(List.of(0, 22), result.detectionPoints());
        assertArrayEquals(new int[]{0, 2}, result.detectionLags());
        assertEquals(1, result.shiftCount());
    }

    @Test
    void testIsolatedOutlierIsAbsorbed() {
        double[] series = SeriesFixtures.flat(10.0, 40);
        series[20] = 1000.0;

        DetectionResult result = detector.detect(series);

        assertEquals(List.of(0), result.changepoints());
    }

    @Test
    void testShiftAndReturn() {
        double[] series = SeriesFixtures.levels(new double[]{10.0, 20.0, 10.0}, new int[]{25, 25, 25});

        DetectionResult result = detector.detect(series);

        assertEquals(List.of(0, 25, 50), result.changepoints());
        assertEquals(List.of(0, 27, 52), result.detectionPoints());
    }

    @Test
    void testResultInvariants() {
        double[] series = SeriesFixtures.levels(
            new double[]{5.0, 9.0, 9.0, 2.0, 30.0}, new int[]{12, 40, 8, 33, 17});

        DetectionResult result = detector.detect(series);

        List<Integer> changepoints = result.changepoints();
        List<Integer> detections = result.detectionPoints();
        assertEquals(0, changepoints.get(0));
        assertEquals(changepoints.size(), detections.size());
        for (int k = 1; k < changepoints.size(); k++) {
            assertTrue(changepoints.get(k) > changepoints.get(k - 1));
            assertTrue(changepoints.get(k) < series.length);
            assertTrue(detections.get(k) >= changepoints.get(k));
            assertTrue(detections.get(k) < changepoints.get(k) + DetectorConfig.DEFAULT_LOOKBACK);
        }
        assertThat(changepoints).contains(12, 60, 93);
    }

    @Test
    void testRepeatedCallsAgree() {
        double[] series = SeriesFixtures.step(3.0, 30, 1.0, 30);
        double[] copy = series.clone();

        DetectionResult first = detector.detect(series);
        DetectionResult second = detector.detect(series);

        assertEquals(first.changepoints(), second.changepoints());
        assertEquals(first.detectionPoints(), second.detectionPoints());
        assertArrayEquals(copy, series, "input must not be modified");
    }

    @Test
    void testPrefixLengthMatchesTruncatedSeries() {
        double[] series = SeriesFixtures.levels(new double[]{10.0, 20.0, 10.0}, new int[]{25, 25, 25});

        DetectionResult prefix = detector.detect(series, 51);
        DetectionResult truncated = detector.detect(Arrays.copyOf(series, 51));

        assertEquals(truncated.changepoints(), prefix.changepoints());
        assertEquals(List.of(0, 25), prefix.changepoints());
    }

    @Test
    void testTinySeries() {
        assertEquals(List.of(0), detector.detect(new double[0]).changepoints());
        assertEquals(List.of(0), detector.detect(new double[]{1.0, 50.0}).changepoints());
    }

    @Test
    void testStricterVotingDelaysConfirmation() {
        SequentialDetector strict = new SequentialDetector(DetectorConfig.builder().minAgree(5).build());

        DetectionResult result = strict.detect(SeriesFixtures.step(10.0, 20, 20.0, 20));

        assertEquals(List.of(0, 20), result.changepoints());
        assertEquals(List.of(0, 24), result.detectionPoints());
    }

    @Test
    void testFalseAlarmRateUnderRandomNoise() {
        // Noise without a shift still trips the scanner on rare draws
        int seeds = 200;
        int falseAlarms = 0;
        for (int seed = 0; seed < seeds; seed++) {
            double[] series = SeriesFixtures.noisyLevels(
                new double[]{10.0, 10.0}, new int[]{30, 30}, 0.1, new Random(seed));
            if (!detector.detect(series).isSingleRegime()) {
                falseAlarms++;
            }
        }
        assertThat(falseAlarms).isLessThanOrEqualTo(seeds / 20);
    }

    @Test
    void testShiftFoundUnderRandomNoise() {
        for (int seed = 0; seed < 100; seed++) {
            double[] series = SeriesFixtures.noisyLevels(
                new double[]{10.0, 20.0}, new int[]{20, 20}, 0.1, new Random(seed));

            DetectionResult result = detector.detect(series);

            List<Integer> changepoints = result.changepoints();
            int found = -1;
            for (int k = 1; k < changepoints.size(); k++) {
                int c = changepoints.get(k);
                if (c >= 20 && c < 20 + DetectorConfig.DEFAULT_LOOKBACK) {
                    found = k;
                    break;
                }
            }
            assertTrue(found > 0, "seed " + seed + ": " + changepoints);
            assertTrue(result.detectionPoints().get(found) >= changepoints.get(found), "seed " + seed);
        }
    }
}
