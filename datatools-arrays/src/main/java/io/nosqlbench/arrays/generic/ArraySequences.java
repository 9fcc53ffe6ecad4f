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

package io.nosqlbench.arrays.generic;

import io.nosqlbench.arrays.ArrayChecks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/// # ArraySequences
///
/// Lazy sequences derived from an array. Each returned [Iterable] can be
/// iterated more than once, and every element it yields is a fresh array the
/// caller may keep or modify.
///
/// Permutations and subsets grow as `n!` and `2^n`. Nothing stops a caller
/// from asking for them on a large array; iteration simply never finishes in
/// practice. A warning is logged when the input is large enough for that to
/// matter.
public final class ArraySequences {

    private static final Logger logger = LogManager.getLogger(ArraySequences.class);

    static final int PERMUTATION_WARN_LENGTH = 10;
    static final int SUBSET_WARN_LENGTH = 24;

    private ArraySequences() {} // Utility class

    /// All orderings of the array, generated with Heap's algorithm. The first
    /// permutation is the input order. An empty array has exactly one
    /// permutation, the empty one.
    public static <T> Iterable<T[]> permutations(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        if (array.length > PERMUTATION_WARN_LENGTH) {
            logger.warn("enumerating permutations of {} elements yields {}! results", array.length, array.length);
        }
        T[] source = array.clone();
        return () -> new PermutationIterator<>(source);
    }

    /// All subsets of the array. Subset `i` holds element `j` exactly when bit
    /// `j` of `i` is set, so the first subset is empty and the last is the whole
    /// array.
    public static <T> Iterable<T[]> subsets(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        if (array.length > SUBSET_WARN_LENGTH) {
            logger.warn("enumerating subsets of {} elements yields 2^{} results", array.length, array.length);
        }
        T[] source = array.clone();
        return () -> new SubsetIterator<>(source);
    }

    /// Consecutive batches of `size` elements; the last batch may be shorter.
    /// @throws IllegalArgumentException if size is not positive
    public static <T> Iterable<T[]> batch(T[] array, int size) {
        Objects.requireNonNull(array, "array cannot be null");
        ArrayChecks.requirePositive(size, "batch size");
        T[] source = array.clone();
        return () -> new Iterator<>() {
            private int offset = 0;

            @Override
            public boolean hasNext() {
                return offset < source.length;
            }

            @Override
            public T[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int end = Math.min(offset + size, source.length);
                T[] batch = Arrays.copyOfRange(source, offset, end);
                offset = end;
                return batch;
            }
        };
    }

    /// Every window of `size` consecutive elements, advancing by one. Yields
    /// nothing when `size` exceeds the array length.
    /// @throws IllegalArgumentException if size is not positive
    public static <T> Iterable<T[]> slidingWindow(T[] array, int size) {
        Objects.requireNonNull(array, "array cannot be null");
        ArrayChecks.requirePositive(size, "window size");
        T[] source = array.clone();
        return () -> new Iterator<>() {
            private int start = 0;

            @Override
            public boolean hasNext() {
                return start + size <= source.length;
            }

            @Override
            public T[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T[] window = Arrays.copyOfRange(source, start, start + size);
                start++;
                return window;
            }
        };
    }

    /// Each adjacent pair `(a[i], a[i+1])`.
    public static <T> Iterable<Pair<T, T>> sequentialPairs(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        T[] source = array.clone();
        return () -> new Iterator<>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return index + 1 < source.length;
            }

            @Override
            public Pair<T, T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Pair<T, T> pair = Pair.of(source[index], source[index + 1]);
                index++;
                return pair;
            }
        };
    }

    /// Iterative Heap's algorithm. `counters[i]` is the loop counter of the
    /// recursive formulation at depth `i`.
    private static final class PermutationIterator<T> implements Iterator<T[]> {
        private final T[] working;
        private final int[] counters;
        private int depth = 1;
        private boolean first = true;
        private T[] pending;

        PermutationIterator(T[] source) {
            this.working = source.clone();
            this.counters = new int[source.length];
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (first) {
                first = false;
                pending = working.clone();
                return true;
            }
            while (depth < working.length) {
                if (counters[depth] < depth) {
                    int swapWith = (depth % 2 == 0) ? 0 : counters[depth];
                    T tmp = working[swapWith];
                    working[swapWith] = working[depth];
                    working[depth] = tmp;
                    counters[depth]++;
                    depth = 1;
                    pending = working.clone();
                    return true;
                }
                counters[depth] = 0;
                depth++;
            }
            return false;
        }

        @Override
        public T[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T[] result = pending;
            pending = null;
            return result;
        }
    }

    private static final class SubsetIterator<T> implements Iterator<T[]> {
        private final T[] source;
        private BigInteger mask = BigInteger.ZERO;

        SubsetIterator(T[] source) {
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            return mask.bitLength() <= source.length;
        }

        @Override
        public T[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T[] subset = GenericArrays.newArray(source, mask.bitCount());
            int position = 0;
            for (int j = 0; j < source.length; j++) {
                if (mask.testBit(j)) {
                    subset[position++] = source[j];
                }
            }
            mask = mask.add(BigInteger.ONE);
            return subset;
        }
    }
}
