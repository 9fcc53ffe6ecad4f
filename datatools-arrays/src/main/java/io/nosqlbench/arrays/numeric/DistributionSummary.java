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

import java.util.Arrays;

/**
 * Descriptive statistics of one array of doubles.
 *
 * <h2>Statistics Included</h2>
 *
 * <ul>
 *   <li><b>count</b> - number of observations</li>
 *   <li><b>min/max</b> - observed range</li>
 *   <li><b>mean</b> - arithmetic mean</li>
 *   <li><b>variance/stdDev</b> - population spread measures</li>
 *   <li><b>skewness</b> - asymmetry measure (0 = symmetric)</li>
 *   <li><b>excessKurtosis</b> - tail heaviness relative to a normal distribution (0 = normal)</li>
 *   <li><b>percentiles</b> - the ranks requested by the {@link SummaryConfig}</li>
 *   <li><b>q1/q3/iqr</b> - quartiles and the interquartile range</li>
 *   <li><b>fences</b> - {@code q1 - k*iqr} and {@code q3 + k*iqr}</li>
 *   <li><b>outlierCount</b> - observations outside the fences</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * DistributionSummary summary = DoubleArrays.summarize(values);
 * double p95 = summary.percentile(95);
 * }</pre>
 *
 * @see DoubleArrays#summarize(double[], SummaryConfig)
 */
public final class DistributionSummary {

    private final int count;
    private final double min;
    private final double max;
    private final double mean;
    private final double variance;
    private final double skewness;
    private final double excessKurtosis;
    private final double[] percentileRanks;
    private final double[] percentileValues;
    private final double q1;
    private final double q3;
    private final double outlierFactor;
    private final int outlierCount;

    DistributionSummary(int count, double min, double max, double mean, double variance,
                        double skewness, double excessKurtosis,
                        double[] percentileRanks, double[] percentileValues,
                        double q1, double q3, double outlierFactor, int outlierCount) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.variance = variance;
        this.skewness = skewness;
        this.excessKurtosis = excessKurtosis;
        this.percentileRanks = percentileRanks;
        this.percentileValues = percentileValues;
        this.q1 = q1;
        this.q3 = q3;
        this.outlierFactor = outlierFactor;
        this.outlierCount = outlierCount;
    }

    public int count() {
        return count;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    /**
     * Returns the range (max - min).
     */
    public double range() {
        return max - min;
    }

    public double mean() {
        return mean;
    }

    /**
     * Returns the population variance.
     */
    public double variance() {
        return variance;
    }

    /**
     * Returns the population standard deviation.
     */
    public double stdDev() {
        return Math.sqrt(variance);
    }

    public double skewness() {
        return skewness;
    }

    /**
     * Returns the excess kurtosis (raw kurtosis - 3).
     */
    public double excessKurtosis() {
        return excessKurtosis;
    }

    /**
     * Returns the configured percentile ranks, in configuration order.
     */
    public double[] percentileRanks() {
        return percentileRanks.clone();
    }

    /**
     * Returns the value at a configured percentile rank.
     *
     * @param rank one of the ranks in {@link #percentileRanks()}
     * @return the interpolated percentile value
     * @throws IllegalArgumentException if the rank was not configured
     */
    public double percentile(double rank) {
        for (int i = 0; i < percentileRanks.length; i++) {
            if (Double.compare(percentileRanks[i], rank) == 0) {
                return percentileValues[i];
            }
        }
        throw new IllegalArgumentException("percentile " + rank + " was not computed; configured ranks are "
            + Arrays.toString(percentileRanks));
    }

    public double q1() {
        return q1;
    }

    public double q3() {
        return q3;
    }

    public double iqr() {
        return q3 - q1;
    }

    public double lowerFence() {
        return q1 - outlierFactor * iqr();
    }

    public double upperFence() {
        return q3 + outlierFactor * iqr();
    }

    public int outlierCount() {
        return outlierCount;
    }

    @Override
    public String toString() {
        return String.format(
            "DistributionSummary[n=%d, range=[%.4f, %.4f], mean=%.4f, stdDev=%.4f, skew=%.4f, exkurt=%.4f, iqr=%.4f, outliers=%d]",
            count, min, max, mean, stdDev(), skewness, excessKurtosis, iqr(), outlierCount);
    }
}
