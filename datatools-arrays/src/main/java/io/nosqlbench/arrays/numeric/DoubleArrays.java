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

import io.nosqlbench.arrays.ArrayChecks;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Objects;

/// # DoubleArrays
///
/// Descriptive statistics and transforms over `double[]`.
///
/// ## Conventions
///
/// - Every statistic requires a non-null, non-empty array and throws
///   [IllegalArgumentException] otherwise.
/// - Variance, standard deviation, skewness and kurtosis use population
///   formulas (divide by `n`). Skewness and kurtosis are 0 when the standard
///   deviation is 0.
/// - Percentiles interpolate linearly between the two closest ranks at
///   position `p/100 * (n - 1)` of the sorted data.
/// - No method modifies its argument.
///
/// ## Usage
/// ```java
/// double[] latencies = {12.0, 15.5, 11.2, 98.0, 14.1};
/// double p95 = DoubleArrays.percentile(latencies, 95);
/// double[] spikes = DoubleArrays.findOutliers(latencies);  // [98.0]
/// ```
public final class DoubleArrays {

    private DoubleArrays() {} // Utility class

    public static double mean(double[] values) {
        ArrayChecks.requireNonEmpty(values, "values");
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /// Middle element of the sorted data; for an even count, the midpoint of
    /// the two central elements computed as `a + (b - a) / 2`.
    public static double median(double[] values) {
        double[] sorted = sortedCopy(values);
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[middle];
        }
        double a = sorted[middle - 1];
        double b = sorted[middle];
        return a + (b - a) / 2;
    }

    /// @param percentile rank in 0..100
    /// @return the linearly interpolated value at that rank
    /// @throws io.nosqlbench.arrays.ValueOutOfRangeException if the rank is outside 0..100
    public static double percentile(double[] values, double percentile) {
        double[] sorted = sortedCopy(values);
        ArrayChecks.requireInRange(percentile, 0, 100, "percentile");
        return percentileOfSorted(sorted, percentile);
    }

    static double percentileOfSorted(double[] sorted, double percentile) {
        double index = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    /// Population variance.
    public static double variance(double[] values) {
        double mean = mean(values);
        double m2 = 0;
        for (double v : values) {
            double diff = v - mean;
            m2 += diff * diff;
        }
        return m2 / values.length;
    }

    public static double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    /// @return max - min
    public static double range(double[] values) {
        ArrayChecks.requireNonEmpty(values, "values");
        double min = values[0];
        double max = values[0];
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        return max - min;
    }

    public static double skewness(double[] values) {
        double mean = mean(values);
        double stdDev = standardDeviation(values);
        if (stdDev == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            double z = (v - mean) / stdDev;
            sum += z * z * z;
        }
        return sum / values.length;
    }

    /// Excess kurtosis: the fourth standardized moment minus 3.
    public static double kurtosis(double[] values) {
        double mean = mean(values);
        double stdDev = standardDeviation(values);
        if (stdDev == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            double z = (v - mean) / stdDev;
            sum += z * z * z * z;
        }
        return sum / values.length - 3;
    }

    public static double[] findOutliers(double[] values) {
        return findOutliers(values, SummaryConfig.DEFAULT_OUTLIER_FACTOR);
    }

    /// Values below `q1 - factor * iqr` or above `q3 + factor * iqr`, in input order.
    public static double[] findOutliers(double[] values, double factor) {
        double[] sorted = sortedCopy(values);
        double q1 = percentileOfSorted(sorted, 25);
        double q3 = percentileOfSorted(sorted, 75);
        double iqr = q3 - q1;
        double lowerFence = q1 - factor * iqr;
        double upperFence = q3 + factor * iqr;
        return Arrays.stream(values).filter(v -> v < lowerFence || v > upperFence).toArray();
    }

    /// Min-max scaling into [0, 1]. An array of identical values maps to all zeros.
    public static double[] normalize(double[] values) {
        ArrayChecks.requireNonEmpty(values, "values");
        double min = Arrays.stream(values).min().orElseThrow();
        double range = range(values);
        double[] result = new double[values.length];
        if (range == 0) {
            return result;
        }
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - min) / range;
        }
        return result;
    }

    /// Z-scores. An array with zero standard deviation maps to all zeros.
    public static double[] standardize(double[] values) {
        double mean = mean(values);
        double stdDev = standardDeviation(values);
        double[] result = new double[values.length];
        if (stdDev == 0) {
            return result;
        }
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - mean) / stdDev;
        }
        return result;
    }

    /// Pearson correlation coefficient; 0 when either array has no variation.
    /// @throws io.nosqlbench.arrays.LengthMismatchException if the arrays differ in length
    public static double correlation(double[] first, double[] second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        ArrayChecks.requireSameLength(first.length, second.length);
        ArrayChecks.requireNonEmpty(first, "first");
        double meanFirst = mean(first);
        double meanSecond = mean(second);
        double numerator = 0;
        double sumSqFirst = 0;
        double sumSqSecond = 0;
        for (int i = 0; i < first.length; i++) {
            double dx = first[i] - meanFirst;
            double dy = second[i] - meanSecond;
            numerator += dx * dy;
            sumSqFirst += dx * dx;
            sumSqSecond += dy * dy;
        }
        double denominator = Math.sqrt(sumSqFirst * sumSqSecond);
        return denominator == 0 ? 0 : numerator / denominator;
    }

    /// Centered moving average. Each output averages the inputs within
    /// `window / 2` positions on either side, clipped at the array edges.
    /// @throws io.nosqlbench.arrays.ValueOutOfRangeException if window is outside 1..n
    public static double[] movingAverage(double[] values, int window) {
        ArrayChecks.requireNonEmpty(values, "values");
        ArrayChecks.requireInRange(window, 1, values.length, "window");
        int half = window / 2;
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(values.length - 1, i + half);
            double sum = 0;
            for (int j = start; j <= end; j++) {
                sum += values[j];
            }
            result[i] = sum / (end - start + 1);
        }
        return result;
    }

    /// Rounds half-to-even on the exact binary value of each element, so
    /// `2.675` (stored as 2.67499999...) rounds to `2.67`. NaN and infinities
    /// pass through.
    /// @param decimals places to keep, 0..15
    public static double[] roundAll(double[] values, int decimals) {
        Objects.requireNonNull(values, "values cannot be null");
        ArrayChecks.requireInRange(decimals, 0, 15, "decimals");
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            result[i] = Double.isFinite(v)
                ? new BigDecimal(v).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue()
                : v;
        }
        return result;
    }

    public static boolean allFinite(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    public static double[] removeNonFinite(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    /// Running totals; empty or null input gives an empty array.
    public static double[] cumulativeSum(double[] values) {
        if (values == null || values.length == 0) {
            return new double[0];
        }
        double[] result = new double[values.length];
        result[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            result[i] = result[i - 1] + values[i];
        }
        return result;
    }

    /// Differences between consecutive elements; fewer than two elements give an empty array.
    public static double[] diff(double[] values) {
        if (values == null || values.length < 2) {
            return new double[0];
        }
        double[] result = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            result[i - 1] = values[i] - values[i - 1];
        }
        return result;
    }

    /// @return indices strictly greater than both neighbours
    public static int[] localMaxima(double[] values) {
        if (values == null || values.length < 3) {
            return new int[0];
        }
        int[] found = new int[values.length];
        int count = 0;
        for (int i = 1; i < values.length - 1; i++) {
            if (values[i] > values[i - 1] && values[i] > values[i + 1]) {
                found[count++] = i;
            }
        }
        return Arrays.copyOf(found, count);
    }

    /// @return indices strictly less than both neighbours
    public static int[] localMinima(double[] values) {
        if (values == null || values.length < 3) {
            return new int[0];
        }
        int[] found = new int[values.length];
        int count = 0;
        for (int i = 1; i < values.length - 1; i++) {
            if (values[i] < values[i - 1] && values[i] < values[i + 1]) {
                found[count++] = i;
            }
        }
        return Arrays.copyOf(found, count);
    }

    public static DistributionSummary summarize(double[] values) {
        return summarize(values, SummaryConfig.defaults());
    }

    /// Computes every statistic of [DistributionSummary] in two passes over the data
    /// plus one sort.
    public static DistributionSummary summarize(double[] values, SummaryConfig config) {
        Objects.requireNonNull(config, "config cannot be null").validate();
        double[] sorted = sortedCopy(values);
        int count = sorted.length;

        // First pass: mean
        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }
        double mean = sum / count;

        // Second pass: central moments
        double m2 = 0;
        double m3 = 0;
        double m4 = 0;
        for (double v : sorted) {
            double diff = v - mean;
            double diff2 = diff * diff;
            m2 += diff2;
            m3 += diff2 * diff;
            m4 += diff2 * diff2;
        }
        double variance = m2 / count;
        double stdDev = Math.sqrt(variance);
        double skewness = 0;
        double excessKurtosis = 0;
        if (stdDev > 0) {
            skewness = (m3 / count) / (stdDev * stdDev * stdDev);
            excessKurtosis = (m4 / count) / (variance * variance) - 3;
        }

        double[] ranks = config.getPercentiles();
        double[] percentileValues = new double[ranks.length];
        for (int i = 0; i < ranks.length; i++) {
            percentileValues[i] = percentileOfSorted(sorted, ranks[i]);
        }

        double q1 = percentileOfSorted(sorted, 25);
        double q3 = percentileOfSorted(sorted, 75);
        double factor = config.getOutlierFactor();
        double lowerFence = q1 - factor * (q3 - q1);
        double upperFence = q3 + factor * (q3 - q1);
        int outliers = 0;
        for (double v : sorted) {
            if (v < lowerFence || v > upperFence) outliers++;
        }

        return new DistributionSummary(count, sorted[0], sorted[count - 1], mean, variance,
            skewness, excessKurtosis, ranks, percentileValues, q1, q3, factor, outliers);
    }

    private static double[] sortedCopy(double[] values) {
        double[] sorted = ArrayChecks.requireNonEmpty(values, "values").clone();
        Arrays.sort(sorted);
        return sorted;
    }
}
