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
import io.nosqlbench.regimes.stats.RobustStatistics;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CusumDetectorTest {

    private final CusumDetector detector = new CusumDetector();

    @Test
    void testStepIsDetected() {
        CusumDetector.CusumResult result = detector.detect(SeriesFixtures.step(10.0, 30, 20.0, 30));

        assertEquals(List.of(0, 30), result.changepoints());
        assertEquals(List.of(0, 31), result.detectionPoints());
        assertEquals(30, result.lastChangepoint());
        assertEquals(60, result.stdEstimates().length);
    }

    @Test
    void testFlatSeriesHasNoChangepoint() {
        assertEquals(List.of(0), detector.detect(SeriesFixtures.flat(10.0, 60)).changepoints());

        double[] constant = new double[40];
        Arrays.fill(constant, 3.0);
        assertEquals(List.of(0), detector.detect(constant).changepoints());
    }

    @Test
    void testShortSeriesIsOneRegime() {
        CusumDetector.CusumResult result = detector.detect(new double[]{1, 2, 100, 200, 300});

        assertEquals(List.of(0), result.changepoints());
        assertArrayEquals(new double[5], result.stdEstimates());
    }

    @Test
    void testBatchCusum() {
        double[] series = {0, 0, 0, 10, 10};

        double[] flat = detector.batchCusum(new double[]{2, 2, 2, 2}, 0, 4, 2.0, 1.0);
        double[] rising = detector.batchCusum(series, 0, 5, 0.0, 1.0);

        assertArrayEquals(new double[4], flat, 1e-12);
        assertEquals(0.0, rising[0]);
        assertEquals(0.0, rising[2], 1e-12);
        // each point contributes at most maxInfluence
        assertEquals(CusumDetector.DEFAULT_MAX_INFLUENCE, rising[3], 1e-12);
        assertEquals(2 * CusumDetector.DEFAULT_MAX_INFLUENCE, rising[4], 1e-12);
    }

    @Test
    void testDeviationEstimates() {
        assertEquals(1.0, CusumDetector.robustStd(new double[]{1, 3}, 0, 2), 1e-12);
        double[] wide = {1, 2, 3, 4, 100};
        assertEquals(RobustStatistics.scaledMad(wide), CusumDetector.robustStd(wide, 0, 5), 1e-12);

        assertEquals(0.7, CusumDetector.weightedStd(0.7, new double[]{5}, 0, 1), 1e-12);
        double blended = CusumDetector.weightedStd(2.0, new double[]{1, 3}, 0, 2);
        assertEquals((CusumDetector.PRIOR_WEIGHT * 2.0 + 2 * 1.0) / (CusumDetector.PRIOR_WEIGHT + 2), blended, 1e-12);
    }

    @Test
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new CusumDetector(1, 6.0, 0.5, 4.0));
        assertThrows(IllegalArgumentException.class, () -> new CusumDetector(10, 0.0, 0.5, 4.0));
        assertThrows(IllegalArgumentException.class, () -> new CusumDetector(10, 6.0, -1.0, 4.0));
        assertThrows(IllegalArgumentException.class, () -> new CusumDetector(10, 6.0, 0.5, 0.0));
    }
}
