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
import io.nosqlbench.arrays.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.UnaryOperator;

/// # GenericArrays
///
/// Structural operations over object arrays: insertion, removal, resizing,
/// rotation, slicing and chunking.
///
/// ## Mutation
/// Every method returns a new array and leaves its argument untouched, except
/// [#fill(Object[], Object)], which writes in place, and
/// [#safeSet(Object[], int, Object)], which writes in place when the index is
/// already inside the array.
///
/// ## Component types
/// Result arrays keep the runtime component type of the input, so a
/// `String[]` passed in comes back as a `String[]`.
///
/// ## Usage
/// ```java
/// Integer[] values = {1, 2, 3, 4, 5};
/// GenericArrays.rotateLeft(values, 2);   // [3, 4, 5, 1, 2]
/// GenericArrays.slice(values, 1, 4);     // [2, 3, 4]
/// GenericArrays.chunk(values, 2);        // [[1, 2], [3, 4], [5]]
/// ```
public final class GenericArrays {

    private GenericArrays() {} // Utility class

    /// Allocates an array with the same component type as `like`.
    /// @param like an array whose component type is reused
    /// @param length the length of the new array
    /// @return a new array of nulls
    @SuppressWarnings("unchecked")
    public static <T> T[] newArray(T[] like, int length) {
        return (T[]) Array.newInstance(like.getClass().getComponentType(), length);
    }

    public static <T> T[] removeNulls(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        return Arrays.stream(array).filter(Objects::nonNull).toArray(n -> newArray(array, n));
    }

    /// Appends a single item.
    public static <T> T[] add(T[] array, T item) {
        Objects.requireNonNull(array, "array cannot be null");
        T[] result = Arrays.copyOf(array, array.length + 1);
        result[array.length] = item;
        return result;
    }

    /// Appends all items in order.
    @SafeVarargs
    public static <T> T[] addAll(T[] array, T... items) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(items, "items cannot be null");
        T[] result = Arrays.copyOf(array, array.length + items.length);
        System.arraycopy(items, 0, result, array.length, items.length);
        return result;
    }

    /// @throws IndexOutOfBoundsException unless `0 <= index < array.length`
    public static <T> T[] removeAt(T[] array, int index) {
        Objects.requireNonNull(array, "array cannot be null");
        ArrayChecks.requireIndex(index, array.length);
        T[] result = newArray(array, array.length - 1);
        System.arraycopy(array, 0, result, 0, index);
        System.arraycopy(array, index + 1, result, index, array.length - index - 1);
        return result;
    }

    /// Inserts an item so that it ends up at `index`.
    /// @throws IndexOutOfBoundsException unless `0 <= index <= array.length`
    public static <T> T[] insertAt(T[] array, int index, T item) {
        Objects.requireNonNull(array, "array cannot be null");
        ArrayChecks.requireIndex(index, array.length + 1);
        T[] result = newArray(array, array.length + 1);
        System.arraycopy(array, 0, result, 0, index);
        result[index] = item;
        System.arraycopy(array, index, result, index + 1, array.length - index);
        return result;
    }

    /// Truncates, or pads with nulls, to `newSize`.
    public static <T> T[] resize(T[] array, int newSize) {
        Objects.requireNonNull(array, "array cannot be null");
        ArrayChecks.requireNonNegative(newSize, "newSize");
        return Arrays.copyOf(array, newSize);
    }

    /// @return the first element, or null for an empty array
    public static <T> T head(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        return array.length == 0 ? null : array[0];
    }

    /// @return all elements except the first; empty for an empty array
    public static <T> T[] tail(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        return array.length == 0 ? array.clone() : Arrays.copyOfRange(array, 1, array.length);
    }

    /// @return the first `n` elements, or all of them when `n` exceeds the length
    public static <T> T[] firstN(T[] array, int n) {
        Objects.requireNonNull(array, "array cannot be null");
        int count = Math.max(0, Math.min(n, array.length));
        return Arrays.copyOf(array, count);
    }

    /// @return the last `n` elements, or all of them when `n` exceeds the length
    public static <T> T[] lastN(T[] array, int n) {
        Objects.requireNonNull(array, "array cannot be null");
        int count = Math.max(0, Math.min(n, array.length));
        return Arrays.copyOfRange(array, array.length - count, array.length);
    }

    /// @return the element at `index`, or `defaultValue` when the index is outside the array
    public static <T> T safeGet(T[] array, int index, T defaultValue) {
        Objects.requireNonNull(array, "array cannot be null");
        return index >= 0 && index < array.length ? array[index] : defaultValue;
    }

    /// Sets `array[index]`, growing the array when needed.
    ///
    /// When `index` is inside the array the write happens in place and the same
    /// array is returned. Otherwise a copy of length `index + 1` is returned,
    /// with nulls between the old end and `index`.
    ///
    /// @throws IndexOutOfBoundsException if `index` is negative
    public static <T> T[] safeSet(T[] array, int index, T value) {
        Objects.requireNonNull(array, "array cannot be null");
        if (index < 0) {
            throw new IndexOutOfBoundsException("Index cannot be negative: " + index);
        }
        T[] target = index < array.length ? array : Arrays.copyOf(array, index + 1);
        target[index] = value;
        return target;
    }

    /// Replaces every element equal to `oldValue` (null-safe) with `newValue`.
    public static <T> T[] replaceAll(T[] array, T oldValue, T newValue) {
        Objects.requireNonNull(array, "array cannot be null");
        T[] result = array.clone();
        for (int i = 0; i < result.length; i++) {
            if (Objects.equals(result[i], oldValue)) {
                result[i] = newValue;
            }
        }
        return result;
    }

    /// Writes `value` into every slot of `array`, in place.
    public static <T> void fill(T[] array, T value) {
        Objects.requireNonNull(array, "array cannot be null");
        Arrays.fill(array, value);
    }

    public static <T> T[] reverse(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        T[] result = newArray(array, array.length);
        for (int i = 0; i < array.length; i++) {
            result[i] = array[array.length - 1 - i];
        }
        return result;
    }

    /// Rotates left by `positions`, taken modulo the length. A negative amount
    /// rotates right. Rotating an empty array returns an empty copy.
    public static <T> T[] rotateLeft(T[] array, int positions) {
        Objects.requireNonNull(array, "array cannot be null");
        int n = array.length;
        if (n == 0) {
            return array.clone();
        }
        int shift = Math.floorMod(positions, n);
        T[] result = newArray(array, n);
        System.arraycopy(array, shift, result, 0, n - shift);
        System.arraycopy(array, 0, result, n - shift, shift);
        return result;
    }

    /// Rotates right by `positions`, taken modulo the length. A negative amount
    /// rotates left. Rotating an empty array returns an empty copy.
    public static <T> T[] rotateRight(T[] array, int positions) {
        Objects.requireNonNull(array, "array cannot be null");
        if (array.length == 0) {
            return array.clone();
        }
        return rotateLeft(array, -Math.floorMod(positions, array.length));
    }

    /// Splits into consecutive chunks of `chunkSize`; the last chunk may be shorter.
    /// @throws IllegalArgumentException if `chunkSize` is not positive
    public static <T> T[][] chunk(T[] array, int chunkSize) {
        Objects.requireNonNull(array, "array cannot be null");
        ArrayChecks.requirePositive(chunkSize, "chunkSize");
        int count = (array.length + chunkSize - 1) / chunkSize;
        @SuppressWarnings("unchecked")
        T[][] chunks = (T[][]) Array.newInstance(array.getClass(), count);
        for (int c = 0; c < count; c++) {
            int from = c * chunkSize;
            chunks[c] = Arrays.copyOfRange(array, from, Math.min(from + chunkSize, array.length));
        }
        return chunks;
    }

    /// Returns `array[start..]`.
    /// @throws IndexOutOfBoundsException unless `0 <= start < array.length`
    public static <T> T[] slice(T[] array, int start) {
        Objects.requireNonNull(array, "array cannot be null");
        checkSliceStart(start, array.length);
        return Arrays.copyOfRange(array, start, array.length);
    }

    /// Returns the half-open range `array[start, end)`.
    /// @throws IndexOutOfBoundsException unless `0 <= start < array.length`, or if `end > array.length`
    /// @throws IllegalArgumentException if `end <= start`
    public static <T> T[] slice(T[] array, int start, int end) {
        Objects.requireNonNull(array, "array cannot be null");
        checkSliceStart(start, array.length);
        if (end <= start) {
            throw new IllegalArgumentException("End must be greater than start, but start=" + start + " and end=" + end);
        }
        if (end > array.length) {
            throw new IndexOutOfBoundsException("End " + end + " exceeds length " + array.length);
        }
        return Arrays.copyOfRange(array, start, end);
    }

    private static void checkSliceStart(int start, int length) {
        if (start < 0 || start >= length) {
            throw new IndexOutOfBoundsException("Start " + start + " out of bounds for length " + length);
        }
    }

    /// Concatenates the rows of a jagged array in order.
    public static <T> T[] flatten(T[][] arrays) {
        Objects.requireNonNull(arrays, "arrays cannot be null");
        int total = 0;
        for (T[] row : arrays) {
            total += row.length;
        }
        @SuppressWarnings("unchecked")
        T[] result = (T[]) Array.newInstance(arrays.getClass().getComponentType().getComponentType(), total);
        int offset = 0;
        for (T[] row : arrays) {
            System.arraycopy(row, 0, result, offset, row.length);
            offset += row.length;
        }
        return result;
    }

    /// Alternates elements of `first` and `second`, then appends whatever remains
    /// of the longer one.
    public static <T> T[] interleave(T[] first, T[] second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        T[] result = newArray(first, first.length + second.length);
        int i = 0, j = 0, k = 0;
        while (i < first.length && j < second.length) {
            result[k++] = first[i++];
            result[k++] = second[j++];
        }
        while (i < first.length) {
            result[k++] = first[i++];
        }
        while (j < second.length) {
            result[k++] = second[j++];
        }
        return result;
    }

    /// Merges two arrays which are each sorted by `comparator`. On ties the
    /// element from `first` comes first.
    public static <T> T[] merge(T[] first, T[] second, Comparator<? super T> comparator) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        Objects.requireNonNull(comparator, "comparator cannot be null");
        T[] result = newArray(first, first.length + second.length);
        int i = 0, j = 0, k = 0;
        while (i < first.length && j < second.length) {
            if (comparator.compare(first[i], second[j]) <= 0) {
                result[k++] = first[i++];
            } else {
                result[k++] = second[j++];
            }
        }
        while (i < first.length) {
            result[k++] = first[i++];
        }
        while (j < second.length) {
            result[k++] = second[j++];
        }
        return result;
    }

    /// Merges two naturally ordered arrays.
    public static <T extends Comparable<? super T>> T[] merge(T[] first, T[] second) {
        return merge(first, second, Comparator.naturalOrder());
    }

    /// Copies the array, passing every non-null element through `copier`.
    public static <T> T[] deepCopy(T[] array, UnaryOperator<T> copier) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(copier, "copier cannot be null");
        T[] result = newArray(array, array.length);
        for (int i = 0; i < array.length; i++) {
            result[i] = array[i] == null ? null : copier.apply(array[i]);
        }
        return result;
    }

    /// Returns a shuffled copy, drawing from a new generator.
    public static <T> T[] shuffle(T[] array) {
        return shuffle(array, RandomGenerators.fresh());
    }

    /// Returns a shuffled copy, drawing from `rng`.
    public static <T> T[] shuffle(T[] array, UniformRandomProvider rng) {
        return RandomGenerators.shuffle(array, rng);
    }

    /// Draws `sampleSize` elements without replacement, using a new generator.
    public static <T> T[] randomSample(T[] array, int sampleSize) {
        return randomSample(array, sampleSize, RandomGenerators.fresh());
    }

    /// Draws `sampleSize` elements without replacement; sizes above the length return every element.
    public static <T> T[] randomSample(T[] array, int sampleSize, UniformRandomProvider rng) {
        return RandomGenerators.sample(array, sampleSize, rng);
    }
}
