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
import io.nosqlbench.arrays.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Integer helpers: parity sums, primes, monotonicity, modes, and a
/// nearest-rank percentile.
///
/// Sums of `int` values use `int` arithmetic and wrap on overflow;
/// [#multiplyAll(int[])] and [#sumAbsoluteDifferences(int[])] accumulate in `long`.
public final class IntArrays {

    private IntArrays() {} // Utility class

    public static int sumEven(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        int sum = 0;
        for (int v : values) {
            if (v % 2 == 0) sum += v;
        }
        return sum;
    }

    public static int sumOdd(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        int sum = 0;
        for (int v : values) {
            if (v % 2 != 0) sum += v;
        }
        return sum;
    }

    /// @return the prime elements, in input order, duplicates kept
    public static int[] primes(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        return Arrays.stream(values).filter(IntArrays::isPrime).toArray();
    }

    static boolean isPrime(int number) {
        if (number < 2) return false;
        for (long i = 2; i * i <= number; i++) {
            if (number % i == 0) return false;
        }
        return true;
    }

    /// @throws IllegalArgumentException if there is no non-zero element
    public static double averageIgnoringZero(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        long sum = 0;
        int count = 0;
        for (int v : values) {
            if (v != 0) {
                sum += v;
                count++;
            }
        }
        if (count == 0) {
            throw new IllegalArgumentException("values contain no non-zero element");
        }
        return (double) sum / count;
    }

    /// Product of every element as a `long`; 1 for an empty array.
    public static long multiplyAll(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        long product = 1L;
        for (int v : values) {
            product *= v;
        }
        return product;
    }

    public static boolean isStrictlyIncreasing(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        for (int i = 1; i < values.length; i++) {
            if (values[i - 1] >= values[i]) return false;
        }
        return true;
    }

    public static boolean isStrictlyDecreasing(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        for (int i = 1; i < values.length; i++) {
            if (values[i - 1] <= values[i]) return false;
        }
        return true;
    }

    /// Distinct values ordered by descending frequency; equal frequencies keep
    /// first-seen order.
    public static int[] modes(int[] values) {
        Map<Integer, Integer> frequency = frequencyMap(values);
        return frequency.entrySet().stream()
            .sorted(Map.Entry.<Integer, Integer>comparingByValue().reversed())
            .mapToInt(Map.Entry::getKey)
            .toArray();
    }

    /// Nearest-rank percentile: the element at `ceil(p/100 * n) - 1` of the
    /// sorted data, with rank 0 mapping to the smallest element.
    ///
    /// **Sorts `values` in place.**
    ///
    /// @throws io.nosqlbench.arrays.ValueOutOfRangeException if p is outside 0..100
    public static int percentile(int[] values, double p) {
        ArrayChecks.requireNonEmpty(values, "values");
        ArrayChecks.requireInRange(p, 0, 100, "percentile");
        Arrays.sort(values);
        int index = (int) Math.ceil(p / 100.0 * values.length) - 1;
        return values[Math.max(0, index)];
    }

    public static int[] randomize(int[] values) {
        return randomize(values, RandomGenerators.fresh());
    }

    /// @return a shuffled copy
    public static int[] randomize(int[] values, UniformRandomProvider rng) {
        return RandomGenerators.shuffle(values, rng);
    }

    /// Sum of `|a[i] - a[j]|` over every pair `i < j`.
    public static long sumAbsoluteDifferences(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        long sum = 0;
        for (int i = 0; i < values.length; i++) {
            for (int j = i + 1; j < values.length; j++) {
                sum += Math.abs((long) values[i] - values[j]);
            }
        }
        return sum;
    }

    /// Occurrence count of each value, in first-seen order.
    public static Map<Integer, Integer> frequencyMap(int[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (int v : values) {
            counts.merge(v, 1, Integer::sum);
        }
        return counts;
    }

    public static double mean(int[] values) {
        ArrayChecks.requireNonEmpty(values, "values");
        long sum = 0;
        for (int v : values) {
            sum += v;
        }
        return (double) sum / values.length;
    }

    /// Population variance.
    public static double variance(int[] values) {
        double mean = mean(values);
        double m2 = 0;
        for (int v : values) {
            double diff = v - mean;
            m2 += diff * diff;
        }
        return m2 / values.length;
    }

    public static double standardDeviation(int[] values) {
        return Math.sqrt(variance(values));
    }
}
