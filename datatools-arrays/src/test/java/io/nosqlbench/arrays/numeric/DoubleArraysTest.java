package io.nosqlbench.arrays.numeric;

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

import io.nosqlbench.arrays.LengthMismatchException;
import io.nosqlbench.arrays.ValueOutOfRangeException;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for DoubleArrays statistics and transforms
 */
@Tag("unit")
class DoubleArraysTest {

    private static final double[] CLASSIC = {2, 4, 4, 4, 5, 5, 7, 9};

    private static double[] randomValues(long seed, int size) {
        Random random = new Random(seed);
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = random.nextGaussian() * 10 + 3;
        }
        return values;
    }

    @Test
    void testMeanVarianceAndStandardDeviation() {
        assertEquals(5.0, DoubleArrays.mean(CLASSIC), 1e-9);
        assertEquals(4.0, DoubleArrays.variance(CLASSIC), 1e-9);
        assertEquals(2.0, DoubleArrays.standardDeviation(CLASSIC), 1e-9);
        assertEquals(7.0, DoubleArrays.range(CLASSIC), 1e-9);
    }

    @Test
    void testVarianceMatchesPopulationVariance() {
        double[] values = randomValues(11L, 500);
        assertEquals(new Variance(false).evaluate(values), DoubleArrays.variance(values), 1e-6);
    }

    @Test
    void testEmptyInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DoubleArrays.mean(new double[0]));
        assertThrows(IllegalArgumentException.class, () -> DoubleArrays.median(null));
        assertThrows(IllegalArgumentException.class, () -> DoubleArrays.percentile(new double[0], 50));
        assertThrows(IllegalArgumentException.class, () -> DoubleArrays.summarize(new double[0]));
    }

    @Test
    void testPercentileOfOddCount() {
        assertEquals(3.0, DoubleArrays.percentile(new double[]{1, 2, 3, 4, 5}, 50), 1e-9);
    }

    @Test
    void testPercentileInterpolates() {
        assertEquals(2.5, DoubleArrays.percentile(new double[]{4, 3, 2, 1}, 50), 1e-9);
        assertEquals(1.0, DoubleArrays.percentile(new double[]{4, 3, 2, 1}, 0), 1e-9);
        assertEquals(4.0, DoubleArrays.percentile(new double[]{4, 3, 2, 1}, 100), 1e-9);
    }

    @Test
    void testPercentileRangeCheck() {
        ValueOutOfRangeException ex = assertThrows(ValueOutOfRangeException.class,
            () -> DoubleArrays.percentile(new double[]{1, 2}, 100.5));
        assertEquals("percentile", ex.getParameter());
        assertThrows(ValueOutOfRangeException.class, () -> DoubleArrays.percentile(new double[]{1, 2}, -1));
    }

    @ParameterizedTest
    @ValueSource(doubles = {1, 10, 25, 33.3, 50, 75, 90, 99, 100})
    void testPercentileMatchesLinearInterpolationEstimator(double rank) {
        double[] values = randomValues(42L, 257);
        Percentile reference = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        assertEquals(reference.evaluate(values, rank), DoubleArrays.percentile(values, rank), 1e-9);
    }

    @Test
    void testMedianEqualsFiftiethPercentile() {
        for (int size = 1; size < 20; size++) {
            double[] values = randomValues(size, size);
            assertEquals(DoubleArrays.percentile(values, 50), DoubleArrays.median(values), 1e-9);
        }
    }

    @Test
    void testMedianDoesNotMutateInput() {
        double[] values = {3, 1, 2};
        assertEquals(2.0, DoubleArrays.median(values), 1e-9);
        assertArrayEquals(new double[]{3, 1, 2}, values);
    }

    @Test
    void testShapeStatistics() {
        assertEquals(0.0, DoubleArrays.skewness(new double[]{1, 2, 3, 4, 5}), 1e-9);
        assertEquals(-1.3, DoubleArrays.kurtosis(new double[]{1, 2, 3, 4, 5}), 1e-9);
        assertThat(DoubleArrays.skewness(new double[]{1, 1, 1, 2, 10})).isPositive();
        assertEquals(0.0, DoubleArrays.skewness(new double[]{7, 7, 7}), 1e-9);
        assertEquals(0.0, DoubleArrays.kurtosis(new double[]{7, 7, 7}), 1e-9);
    }

    @Test
    void testFindOutliersKeepsInputOrder() {
        assertArrayEquals(new double[]{100}, DoubleArrays.findOutliers(new double[]{1, 2, 3, 4, 5, 100}));
        assertArrayEquals(new double[]{-50, 100}, DoubleArrays.findOutliers(new double[]{-50, 1, 2, 3, 4, 5, 100}));
        assertEquals(0, DoubleArrays.findOutliers(new double[]{1, 2, 3}).length);
    }

    @Test
    void testNormalize() {
        assertArrayEquals(new double[]{0, 0.5, 1}, DoubleArrays.normalize(new double[]{2, 4, 6}), 1e-9);
        assertArrayEquals(new double[]{0, 0}, DoubleArrays.normalize(new double[]{3, 3}), 1e-9);
    }

    @Test
    void testStandardize() {
        double[] z = DoubleArrays.standardize(CLASSIC);
        assertEquals(-1.5, z[0], 1e-9);
        assertEquals(0.0, DoubleArrays.mean(z), 1e-9);
        assertEquals(1.0, DoubleArrays.standardDeviation(z), 1e-9);
        assertArrayEquals(new double[]{0, 0}, DoubleArrays.standardize(new double[]{5, 5}), 1e-9);
    }

    @Test
    void testCorrelation() {
        assertEquals(1.0, DoubleArrays.correlation(new double[]{1, 2, 3}, new double[]{2, 4, 6}), 1e-9);
        assertEquals(-1.0, DoubleArrays.correlation(new double[]{1, 2, 3}, new double[]{3, 2, 1}), 1e-9);
        assertEquals(0.0, DoubleArrays.correlation(new double[]{1, 1, 1}, new double[]{3, 2, 1}), 1e-9);
    }

    @Test
    void testCorrelationMatchesPearson() {
        double[] x = randomValues(5L, 100);
        double[] y = randomValues(6L, 100);
        for (int i = 0; i < y.length; i++) {
            y[i] += x[i] * 0.5;
        }
        assertEquals(new PearsonsCorrelation().correlation(x, y), DoubleArrays.correlation(x, y), 1e-9);
    }

    @Test
    void testCorrelationRequiresSameLength() {
        LengthMismatchException ex = assertThrows(LengthMismatchException.class,
            () -> DoubleArrays.correlation(new double[]{1, 2}, new double[]{1, 2, 3}));
        assertEquals("Arrays must have the same length, but were 2 and 3.", ex.getMessage());
    }

    @Test
    void testMovingAverageIsCentered() {
        assertArrayEquals(new double[]{1.5, 2, 3, 4, 4.5},
            DoubleArrays.movingAverage(new double[]{1, 2, 3, 4, 5}, 3), 1e-9);
        assertArrayEquals(new double[]{1, 2, 3},
            DoubleArrays.movingAverage(new double[]{1, 2, 3}, 1), 1e-9);
    }

    @Test
    void testMovingAverageWindowBounds() {
        assertThrows(ValueOutOfRangeException.class, () -> DoubleArrays.movingAverage(new double[]{1, 2}, 0));
        assertThrows(ValueOutOfRangeException.class, () -> DoubleArrays.movingAverage(new double[]{1, 2}, 3));
    }

    @Test
    void testRoundAllIsHalfEven() {
        assertArrayEquals(new double[]{2, 4, 1, Double.NaN},
            DoubleArrays.roundAll(new double[]{2.5, 3.5, 1.25, Double.NaN}, 0));
        assertArrayEquals(new double[]{1.2, Double.POSITIVE_INFINITY},
            DoubleArrays.roundAll(new double[]{1.25, Double.POSITIVE_INFINITY}, 1));
        assertThrows(ValueOutOfRangeException.class, () -> DoubleArrays.roundAll(new double[]{1}, 16));
    }

    @Test
    void testRoundAllUsesExactBinaryValue() {
        assertArrayEquals(new double[]{2.67, 1.0},
            DoubleArrays.roundAll(new double[]{2.675, 1.005}, 2));
        assertArrayEquals(new double[]{0.12, 0.38},
            DoubleArrays.roundAll(new double[]{0.125, 0.375}, 2));
    }

    @Test
    void testFiniteChecks() {
        double[] values = {1, Double.NaN, 2, Double.NEGATIVE_INFINITY};
        assertFalse(DoubleArrays.allFinite(values));
        assertTrue(DoubleArrays.allFinite(new double[]{1, 2}));
        assertArrayEquals(new double[]{1, 2}, DoubleArrays.removeNonFinite(values));
    }

    @Test
    void testCumulativeSumAndDiff() {
        assertArrayEquals(new double[]{1, 3, 6}, DoubleArrays.cumulativeSum(new double[]{1, 2, 3}), 1e-9);
        assertEquals(0, DoubleArrays.cumulativeSum(null).length);
        assertArrayEquals(new double[]{3, 5}, DoubleArrays.diff(new double[]{1, 4, 9}), 1e-9);
        assertEquals(0, DoubleArrays.diff(new double[]{1}).length);
    }

    @Test
    void testLocalExtremaReturnIndices() {
        assertArrayEquals(new int[]{1, 3}, DoubleArrays.localMaxima(new double[]{1, 3, 2, 5, 4}));
        assertArrayEquals(new int[]{1, 3}, DoubleArrays.localMinima(new double[]{3, 1, 2, 0, 4}));
        assertEquals(0, DoubleArrays.localMaxima(new double[]{1, 2, 2, 1}).length);
        assertEquals(0, DoubleArrays.localMinima(new double[]{1, 0}).length);
    }

    @Test
    void testSummarizeWithDefaults() {
        double[] values = {10, 9, 8, 7, 6, 5, 4, 3, 2, 1};
        DistributionSummary summary = DoubleArrays.summarize(values);

        assertEquals(10, summary.count());
        assertEquals(1.0, summary.min(), 1e-9);
        assertEquals(10.0, summary.max(), 1e-9);
        assertEquals(9.0, summary.range(), 1e-9);
        assertEquals(5.5, summary.mean(), 1e-9);
        assertEquals(8.25, summary.variance(), 1e-9);
        assertEquals(Math.sqrt(8.25), summary.stdDev(), 1e-9);
        assertEquals(0.0, summary.skewness(), 1e-9);
        assertEquals(DoubleArrays.kurtosis(values), summary.excessKurtosis(), 1e-9);
        assertEquals(5.5, summary.percentile(50), 1e-9);
        assertEquals(3.25, summary.q1(), 1e-9);
        assertEquals(7.75, summary.q3(), 1e-9);
        assertEquals(4.5, summary.iqr(), 1e-9);
        assertEquals(0, summary.outlierCount());
        assertArrayEquals(new double[]{1, 5, 25, 50, 75, 95, 99}, summary.percentileRanks(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> summary.percentile(33));
    }

    @Test
    void testSummarizeWithCustomConfig() {
        SummaryConfig config = new SummaryConfig(new double[]{10, 90}, 0.5);
        DistributionSummary summary = DoubleArrays.summarize(new double[]{1, 2, 3, 4, 5, 100}, config);

        assertEquals(1.0, summary.lowerFence(), 1e-9);
        assertEquals(6.0, summary.upperFence(), 1e-9);
        assertEquals(1, summary.outlierCount());
        assertArrayEquals(new double[]{10, 90}, summary.percentileRanks(), 1e-9);
        assertEquals(DoubleArrays.percentile(new double[]{1, 2, 3, 4, 5, 100}, 90), summary.percentile(90), 1e-9);
        assertThat(summary.toString()).contains("n=6").contains("outliers=1");
    }

    @Test
    void testSummarizeAgreesWithStandaloneStatistics() {
        double[] values = randomValues(99L, 1000);
        DistributionSummary summary = DoubleArrays.summarize(values);
        assertEquals(DoubleArrays.mean(values), summary.mean(), 1e-9);
        assertEquals(DoubleArrays.variance(values), summary.variance(), 1e-6);
        assertEquals(DoubleArrays.skewness(values), summary.skewness(), 1e-6);
        assertEquals(DoubleArrays.kurtosis(values), summary.excessKurtosis(), 1e-6);
        assertEquals(DoubleArrays.findOutliers(values).length, summary.outlierCount());
    }

    @Test
    void testSummarizeRejectsInvalidConfig() {
        SummaryConfig config = new SummaryConfig(new double[]{50, 120}, 1.5);
        assertThrows(ValueOutOfRangeException.class, () -> DoubleArrays.summarize(new double[]{1, 2}, config));
    }
}
