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

import org.apache.commons.math3.distribution.TDistribution;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ShiftTestTest {

    @Test
    void testKnownTwoSampleStatistic() {
        double[] left = {1, 2, 3};
        double[] right = {4, 5, 6};

        ShiftTest.ShiftTestResult result = ShiftTest.twoSample(left, right, TrimPolicy.NONE);

        // pooled variance 1, sqrt(3 * 3 / 6) * (2 - 5)
        double expected = -3.0 * Math.sqrt(1.5) / Math.sqrt(1.0 + ShiftTest.VARIANCE_FLOOR);
        assertEquals(expected, result.statistic(), 1e-9);
        assertEquals(4, result.degreesOfFreedom());
        double expectedP = 2.0 * (1.0 - new TDistribution(4).cumulativeProbability(Math.abs(expected)));
        assertEquals(expectedP, result.pValue(), 1e-12);
    }

    @Test
    void testSignFollowsLeftMinusRight() {
        double[] high = {10, 11, 10, 11};
        double[] low = {5, 6, 5, 6};

        assertTrue(ShiftTest.twoSample(high, low, TrimPolicy.NONE).statistic() > 0);
        assertTrue(ShiftTest.twoSample(low, high, TrimPolicy.NONE).statistic() < 0);
    }

    @Test
    void testEqualMeansGiveZero() {
        double[] a = {1, 3, 1, 3};
        double[] b = {3, 1, 3, 1};
        ShiftTest.ShiftTestResult result = ShiftTest.twoSample(a, b, TrimPolicy.NONE);

        assertEquals(0.0, result.statistic(), 1e-12);
        assertEquals(1.0, result.pValue(), 1e-9);
    }

    @Test
    void testConstantSamplesUseVarianceFloor() {
        ShiftTest.ShiftTestResult result = ShiftTest.twoSample(
            new double[]{1, 1, 1}, new double[]{2, 2, 2}, TrimPolicy.NONE);

        assertTrue(Double.isFinite(result.statistic()));
        assertTrue(result.statistic() < -1e5);
        assertTrue(result.isSignificant(1e-6));
    }

    @Test
    void testTooFewPoints() {
        assertEquals(ShiftTest.ShiftTestResult.INSUFFICIENT_DATA,
            ShiftTest.twoSample(new double[]{1}, new double[]{2}, TrimPolicy.NONE));
        assertEquals(ShiftTest.ShiftTestResult.INSUFFICIENT_DATA,
            ShiftTest.oneSample(new double[]{1, 2}, TrimPolicy.NONE));
        assertEquals(0.0, ShiftTest.twoSampleStatistic(new double[]{1, 2}, 0, 1, 2, TrimPolicy.NONE));
        assertFalse(ShiftTest.ShiftTestResult.INSUFFICIENT_DATA.isSignificant(0.5));
    }

    @Test
    void testRangeFormMatchesArrayForm() {
        double[] series = {9, 9, 1, 2, 3, 7, 8, 9, 9};
        ShiftTest.ShiftTestResult fromRange = ShiftTest.twoSample(series, 2, 5, 8, TrimPolicy.DEFAULT);
        ShiftTest.ShiftTestResult fromArrays = ShiftTest.twoSample(
            new double[]{1, 2, 3}, new double[]{7, 8, 9}, TrimPolicy.DEFAULT);

        assertEquals(fromArrays.statistic(), fromRange.statistic(), 1e-12);
        assertEquals(fromArrays.pValue(), fromRange.pValue(), 1e-12);
        assertEquals(fromArrays.statistic(), ShiftTest.twoSampleStatistic(series, 2, 5, 8, TrimPolicy.DEFAULT), 1e-12);
    }

    @Test
    void testOneSample() {
        ShiftTest.ShiftTestResult result = ShiftTest.oneSample(new double[]{1, 2, 3, 4}, TrimPolicy.NONE);

        double expected = 2.5 / Math.sqrt((5.0 / 3.0) / 2.0 + ShiftTest.VARIANCE_FLOOR);
        assertEquals(expected, result.statistic(), 1e-9);
        assertEquals(2, result.degreesOfFreedom());
    }

    @Test
    void testCriticalValueRoundTrip() {
        double critical = ShiftTest.inverseSurvival(0.025, 10);

        assertEquals(0.05, ShiftTest.twoSidedPValue(critical, 10), 1e-6);
        assertEquals(2.228, critical, 1e-3);
        assertEquals(Double.POSITIVE_INFINITY, ShiftTest.inverseSurvival(0.025, 0));
        assertEquals(1.0, ShiftTest.twoSidedPValue(3.0, 0));
    }
}
