package io.nosqlbench.regimes.stats;

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class RobustStatisticsTest {

    @Test
    void testUntrimmedMoments() {
        double[] values = {1, 2, 3, 4};
        RobustStatistics.Moments moments = RobustStatistics.moments(values, TrimPolicy.NONE);

        assertEquals(4, moments.count());
        assertEquals(4, moments.retained());
        assertEquals(2.5, moments.mean(), 1e-12);
        assertEquals(5.0 / 3.0, moments.variance(), 1e-12);  // Sample variance
        assertEquals(Math.sqrt(5.0 / 3.0), moments.stdDev(), 1e-12);
    }

    @Test
    void testSmallSampleIsNeverTrimmed() {
        // ceil(1 / 0.125) = 8, so seven points stay untouched even with an outlier
        double[] values = {1, 1, 1, 1, 1, 1, 100};
        RobustStatistics.Moments moments = RobustStatistics.moments(values, TrimPolicy.DEFAULT);

        assertEquals(0, moments.removed());
        assertEquals(106.0 / 7.0, moments.mean(), 1e-12);
    }

    @Test
    void testSingleOutlierRemoved() {
        double[] values = new double[16];
        for (int i = 0; i < 15; i++) {
            values[i] = i % 2 == 0 ? 10.0 : 11.0;
        }
        values[15] = 1000.0;

        RobustStatistics.Moments moments = RobustStatistics.moments(values, TrimPolicy.DEFAULT);

        assertEquals(16, moments.count());
        assertEquals(15, moments.retained());
        assertEquals(1, moments.removed());
        assertEquals(157.0 / 15.0, moments.mean(), 1e-12);
    }

    @Test
    void testModerateDeviationsAreKept() {
        // Everything within three scaled deviations of the median
        double[] values = {10, 11, 12, 10, 11, 12, 10, 11, 12, 10, 11, 12, 10, 11, 12, 10};
        RobustStatistics.Moments moments = RobustStatistics.moments(values, TrimPolicy.DEFAULT);

        assertEquals(0, moments.removed());
    }

    @Test
    void testConstantSeriesWithOutlier() {
        double[] values = {5, 5, 5, 5, 50, 5, 5, 5, 5};
        RobustStatistics.Moments moments = RobustStatistics.moments(values, TrimPolicy.DEFAULT);

        assertEquals(1, moments.removed());
        assertEquals(5.0, moments.mean(), 1e-12);
        assertEquals(0.0, moments.variance(), 1e-12);
    }

    @Test
    void testRemovalIsCappedByProportion() {
        // Two wild points but floor(16 * 0.125) = 2 allows both; with 0.1 only one goes
        double[] values = new double[16];
        for (int i = 0; i < 16; i++) {
            values[i] = 20.0 + (i % 2);
        }
        values[3] = 500.0;
        values[9] = -400.0;

        assertEquals(2, RobustStatistics.moments(values, TrimPolicy.DEFAULT).removed());
        assertEquals(1, RobustStatistics.moments(values, new TrimPolicy(0.1, 3.0)).removed());
    }

    @Test
    void testTrimKeepsOriginalOrder() {
        double[] values = {3, 1, 2, 1000, 2, 1, 3, 2, 1};
        double[] kept = RobustStatistics.trim(values, 0, values.length, TrimPolicy.DEFAULT);

        assertArrayEquals(new double[]{3, 1, 2, 2, 1, 3, 2, 1}, kept);
        assertEquals(1000.0, values[3], "input must not be modified");
    }

    @Test
    void testRangeMoments() {
        double[] values = {100, 100, 1, 2, 3, 100};
        RobustStatistics.Moments moments = RobustStatistics.moments(values, 2, 5, TrimPolicy.DEFAULT);

        assertEquals(3, moments.count());
        assertEquals(2.0, moments.mean(), 1e-12);
        assertEquals(1.0, moments.variance(), 1e-12);
    }

    @Test
    void testSingleValue() {
        RobustStatistics.Moments moments = RobustStatistics.plainMoments(new double[]{42}, 0, 1);

        assertEquals(42.0, moments.mean(), 1e-12);
        assertEquals(0.0, moments.variance(), 1e-12);
    }

    @Test
    void testInvalidRanges() {
        double[] values = {1, 2, 3};
        assertThrows(IllegalArgumentException.class, () -> RobustStatistics.moments(values, 1, 1, TrimPolicy.NONE));
        assertThrows(IllegalArgumentException.class, () -> RobustStatistics.moments(values, 0, 4, TrimPolicy.NONE));
        assertThrows(IllegalArgumentException.class, () -> RobustStatistics.moments(new double[0], TrimPolicy.NONE));
    }

    @Test
    void testScaledMad() {
        assertEquals(RobustStatistics.MAD_SCALE, RobustStatistics.scaledMad(new double[]{1, 2, 3, 4, 100}), 1e-12);
        assertEquals(0.0, RobustStatistics.scaledMad(new double[]{7, 7, 7}), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({
        "0.0,   1000, 0",
        "0.125, 7,    0",
        "0.125, 8,    1",
        "0.125, 31,   3",
        "0.25,  3,    0",
        "0.25,  4,    1",
        "0.5,   9,    4"
    })
    void testMaxRemovable(double proportion, int n, int expected) {
        TrimPolicy policy = new TrimPolicy(proportion, 3.0);

        assertEquals(expected, policy.maxRemovable(n));
        assertEquals(expected == 0, policy.isIdentityFor(n));
    }

    @Test
    void testTrimPolicyValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TrimPolicy(1.0, 3.0));
        assertThrows(IllegalArgumentException.class, () -> new TrimPolicy(0.1, 0.0));
    }
}
