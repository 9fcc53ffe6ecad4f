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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/// # ArrayQueries
///
/// Read-only queries and element-wise mappings over object arrays. None of
/// these methods modify their arguments.
///
/// Equality is [Objects#equals(Object, Object)] throughout, so null elements
/// are allowed wherever an operation does not need to call into them.
/// Operations that return distinct values keep the order in which each value
/// first appears.
public final class ArrayQueries {

    private ArrayQueries() {} // Utility class

    public static <T> boolean isEmpty(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        return array.length == 0;
    }

    public static <T> boolean isNullOrEmpty(T[] array) {
        return array == null || array.length == 0;
    }

    /// @return true when the array holds exactly one distinct value; false for an empty array
    public static <T> boolean allEqual(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        if (array.length == 0) {
            return false;
        }
        for (T item : array) {
            if (!Objects.equals(item, array[0])) {
                return false;
            }
        }
        return true;
    }

    public static <T> boolean anyNull(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        for (T item : array) {
            if (item == null) {
                return true;
            }
        }
        return false;
    }

    /// @return true when no value occurs twice
    public static <T> boolean isUnique(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        Set<T> seen = new HashSet<>();
        for (T item : array) {
            if (!seen.add(item)) {
                return false;
            }
        }
        return true;
    }

    /// A null array or one of length 0 or 1 is a palindrome.
    public static <T> boolean isPalindrome(T[] array) {
        if (array == null || array.length <= 1) {
            return true;
        }
        for (int left = 0, right = array.length - 1; left < right; left++, right--) {
            if (!Objects.equals(array[left], array[right])) {
                return false;
            }
        }
        return true;
    }

    /// @return true when every element compares less than or equal to its successor
    public static <T> boolean isSorted(T[] array, Comparator<? super T> comparator) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(comparator, "comparator cannot be null");
        for (int i = 1; i < array.length; i++) {
            if (comparator.compare(array[i - 1], array[i]) > 0) {
                return false;
            }
        }
        return true;
    }

    public static <T extends Comparable<? super T>> boolean isSorted(T[] array) {
        return isSorted(array, Comparator.naturalOrder());
    }

    public static <T> boolean contains(T[] array, T item) {
        return indexOf(array, item) >= 0;
    }

    /// @return the first index holding `item`, or -1
    public static <T> int indexOf(T[] array, T item) {
        Objects.requireNonNull(array, "array cannot be null");
        for (int i = 0; i < array.length; i++) {
            if (Objects.equals(array[i], item)) {
                return i;
            }
        }
        return -1;
    }

    public static <T> int countOf(T[] array, T item) {
        Objects.requireNonNull(array, "array cannot be null");
        int count = 0;
        for (T element : array) {
            if (Objects.equals(element, item)) {
                count++;
            }
        }
        return count;
    }

    /// @return every index whose element satisfies `match`, ascending
    public static <T> int[] findIndices(T[] array, Predicate<? super T> match) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(match, "match cannot be null");
        int[] indices = new int[array.length];
        int count = 0;
        for (int i = 0; i < array.length; i++) {
            if (match.test(array[i])) {
                indices[count++] = i;
            }
        }
        return Arrays.copyOf(indices, count);
    }

    /// @return the first element satisfying `match`, or `defaultValue`
    public static <T> T findOrDefault(T[] array, Predicate<? super T> match, T defaultValue) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(match, "match cannot be null");
        for (T item : array) {
            if (match.test(item)) {
                return item;
            }
        }
        return defaultValue;
    }

    /// @return the first and last elements satisfying `match`; both null when nothing matches
    public static <T> Pair<T, T> findFirstAndLast(T[] array, Predicate<? super T> match) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(match, "match cannot be null");
        T first = null;
        T last = null;
        boolean found = false;
        for (T item : array) {
            if (match.test(item)) {
                if (!found) {
                    first = item;
                    found = true;
                }
                last = item;
            }
        }
        return Pair.of(first, last);
    }

    /// Classic bounded binary search over an array sorted by `comparator`.
    ///
    /// The array is not checked for sortedness; on unsorted input the result is
    /// unspecified.
    ///
    /// @return the index of an element comparing equal to `target`, or -1
    public static <T> int binarySearch(T[] array, T target, Comparator<? super T> comparator) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(comparator, "comparator cannot be null");
        int low = 0;
        int high = array.length - 1;
        while (low <= high) {
            int mid = low + (high - low) / 2;
            int comparison = comparator.compare(array[mid], target);
            if (comparison == 0) {
                return mid;
            }
            if (comparison < 0) {
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return -1;
    }

    public static <T extends Comparable<? super T>> int binarySearch(T[] array, T target) {
        return binarySearch(array, target, Comparator.naturalOrder());
    }

    /// @return the most frequent value; on ties, the one seen first
    /// @throws IllegalArgumentException if the array is null or empty
    public static <T> T mostCommon(T[] array) {
        ArrayChecks.requireNonEmpty(array, "array");
        Map<T, Integer> counts = frequency(array);
        T best = null;
        int bestCount = 0;
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /// Counts occurrences of each value, in first-seen order.
    public static <T> Map<T, Integer> frequency(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        Map<T, Integer> counts = new LinkedHashMap<>();
        for (T item : array) {
            counts.merge(item, 1, Integer::sum);
        }
        return counts;
    }

    /// A null key orders before every other key.
    /// @return the first element with the greatest key, or null for an empty array
    public static <T, K extends Comparable<? super K>> T maxBy(T[] array, Function<? super T, ? extends K> selector) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(selector, "selector cannot be null");
        Comparator<K> order = Comparator.nullsFirst(Comparator.<K>naturalOrder());
        T best = null;
        K bestKey = null;
        boolean found = false;
        for (T item : array) {
            K key = selector.apply(item);
            if (!found || order.compare(key, bestKey) > 0) {
                best = item;
                bestKey = key;
                found = true;
            }
        }
        return best;
    }

    /// A null key orders before every other key, so it wins here.
    /// @return the first element with the smallest key, or null for an empty array
    public static <T, K extends Comparable<? super K>> T minBy(T[] array, Function<? super T, ? extends K> selector) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(selector, "selector cannot be null");
        Comparator<K> order = Comparator.nullsFirst(Comparator.<K>naturalOrder());
        T best = null;
        K bestKey = null;
        boolean found = false;
        for (T item : array) {
            K key = selector.apply(item);
            if (!found || order.compare(key, bestKey) < 0) {
                best = item;
                bestKey = key;
                found = true;
            }
        }
        return best;
    }

    public static <T> T[] distinct(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        Set<T> seen = new LinkedHashSet<>(Arrays.asList(array));
        return seen.toArray(GenericArrays.newArray(array, seen.size()));
    }

    /// Same as [#distinct(Object[])].
    public static <T> T[] removeDuplicates(T[] array) {
        return distinct(array);
    }

    /// Keeps the first element for each distinct key.
    public static <T, K> T[] distinctBy(T[] array, Function<? super T, ? extends K> selector) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(selector, "selector cannot be null");
        Set<K> keys = new HashSet<>();
        List<T> kept = new ArrayList<>();
        for (T item : array) {
            if (keys.add(selector.apply(item))) {
                kept.add(item);
            }
        }
        return kept.toArray(GenericArrays.newArray(array, kept.size()));
    }

    /// @return each value occurring more than once, in first-seen order
    public static <T> T[] findDuplicates(T[] array) {
        Map<T, Integer> counts = frequency(array);
        List<T> duplicates = new ArrayList<>();
        counts.forEach((value, count) -> {
            if (count > 1) {
                duplicates.add(value);
            }
        });
        return duplicates.toArray(GenericArrays.newArray(array, duplicates.size()));
    }

    /// @return every index holding a value that occurs more than once
    public static <T> int[] findDuplicateIndices(T[] array) {
        Map<T, Integer> counts = frequency(array);
        return findIndices(array, item -> counts.get(item) > 1);
    }

    /// Values present in both arrays, distinct, in the order of `first`.
    public static <T> T[] intersect(T[] first, T[] second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        Set<T> other = new HashSet<>(Arrays.asList(second));
        Set<T> result = new LinkedHashSet<>();
        for (T item : first) {
            if (other.contains(item)) {
                result.add(item);
            }
        }
        return result.toArray(GenericArrays.newArray(first, result.size()));
    }

    /// Distinct values of `first` followed by the distinct values of `second` not already present.
    public static <T> T[] union(T[] first, T[] second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        Set<T> result = new LinkedHashSet<>(Arrays.asList(first));
        result.addAll(Arrays.asList(second));
        return result.toArray(GenericArrays.newArray(first, result.size()));
    }

    /// Distinct values of `first` that are absent from `second`.
    public static <T> T[] except(T[] first, T[] second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        Set<T> excluded = new HashSet<>(Arrays.asList(second));
        Set<T> result = new LinkedHashSet<>();
        for (T item : first) {
            if (!excluded.contains(item)) {
                result.add(item);
            }
        }
        return result.toArray(GenericArrays.newArray(first, result.size()));
    }

    public static <T> Partition<T> partition(T[] array, Predicate<? super T> predicate) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(predicate, "predicate cannot be null");
        List<T> matching = new ArrayList<>();
        List<T> nonMatching = new ArrayList<>();
        for (T item : array) {
            if (predicate.test(item)) {
                matching.add(item);
            } else {
                nonMatching.add(item);
            }
        }
        return new Partition<>(
            matching.toArray(GenericArrays.newArray(array, matching.size())),
            nonMatching.toArray(GenericArrays.newArray(array, nonMatching.size())));
    }

    /// @return the longest prefix whose elements all satisfy `predicate`
    public static <T> T[] takeWhile(T[] array, Predicate<? super T> predicate) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(predicate, "predicate cannot be null");
        int end = 0;
        while (end < array.length && predicate.test(array[end])) {
            end++;
        }
        return Arrays.copyOf(array, end);
    }

    /// @return the array without its longest prefix of elements satisfying `predicate`
    public static <T> T[] skipWhile(T[] array, Predicate<? super T> predicate) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(predicate, "predicate cannot be null");
        int start = 0;
        while (start < array.length && predicate.test(array[start])) {
            start++;
        }
        return Arrays.copyOfRange(array, start, array.length);
    }

    /// Splits the array before every element that satisfies `startsSegment`.
    /// A matching element at the very beginning does not produce an empty leading segment.
    ///
    /// ```java
    /// segment([1, 2, 0, 3, 0, 4], x -> x == 0)  // [[1, 2], [0, 3], [0, 4]]
    /// ```
    public static <T> List<T[]> segment(T[] array, Predicate<? super T> startsSegment) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(startsSegment, "startsSegment cannot be null");
        List<T[]> segments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < array.length; i++) {
            if (startsSegment.test(array[i]) && i > start) {
                segments.add(Arrays.copyOfRange(array, start, i));
                start = i;
            }
        }
        if (start < array.length) {
            segments.add(Arrays.copyOfRange(array, start, array.length));
        }
        return segments;
    }

    /// Groups runs of adjacent elements that share a key. Equal keys separated by
    /// a different key produce separate groups.
    ///
    /// @return one pair of (key, run) per run, in array order
    public static <T, K> List<Pair<K, T[]>> groupSequential(T[] array, Function<? super T, ? extends K> keySelector) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(keySelector, "keySelector cannot be null");
        List<Pair<K, T[]>> groups = new ArrayList<>();
        int start = 0;
        K currentKey = null;
        for (int i = 0; i < array.length; i++) {
            K key = keySelector.apply(array[i]);
            if (i == 0) {
                currentKey = key;
            } else if (!Objects.equals(key, currentKey)) {
                groups.add(Pair.of(currentKey, Arrays.copyOfRange(array, start, i)));
                start = i;
                currentKey = key;
            }
        }
        if (array.length > 0) {
            groups.add(Pair.of(currentKey, Arrays.copyOfRange(array, start, array.length)));
        }
        return groups;
    }

    /// Groups elements by key into an insertion-ordered map.
    public static <T, K> Map<K, List<T>> groupBy(T[] array, Function<? super T, ? extends K> keySelector) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(keySelector, "keySelector cannot be null");
        return Arrays.stream(array).collect(Collectors.groupingBy(keySelector, LinkedHashMap::new, Collectors.toList()));
    }

    /// Combines elements pairwise up to the length of the shorter array.
    public static <A, B, R> List<R> zipWith(A[] first, B[] second, BiFunction<? super A, ? super B, ? extends R> combiner) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        Objects.requireNonNull(combiner, "combiner cannot be null");
        int length = Math.min(first.length, second.length);
        List<R> result = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            result.add(combiner.apply(first[i], second[i]));
        }
        return result;
    }

    /// Maps every element into a new array built by `generator`.
    public static <T, R> R[] map(T[] array, Function<? super T, ? extends R> mapper, IntFunction<R[]> generator) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(mapper, "mapper cannot be null");
        R[] result = generator.apply(array.length);
        for (int i = 0; i < array.length; i++) {
            result[i] = mapper.apply(array[i]);
        }
        return result;
    }

    /// Maps every element together with its index.
    public static <T, R> List<R> mapIndexed(T[] array, IndexedFunction<? super T, ? extends R> mapper) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(mapper, "mapper cannot be null");
        List<R> result = new ArrayList<>(array.length);
        for (int i = 0; i < array.length; i++) {
            result.add(mapper.apply(array[i], i));
        }
        return result;
    }

    /// A function of an element and its index.
    @FunctionalInterface
    public interface IndexedFunction<T, R> {
        R apply(T item, int index);
    }

    public static <T> void forEach(T[] array, Consumer<? super T> action) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        for (T item : array) {
            action.accept(item);
        }
    }

    public static <T> void forEachIndexed(T[] array, BiConsumer<? super T, Integer> action) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        for (int i = 0; i < array.length; i++) {
            action.accept(array[i], i);
        }
    }

    /// Folds from the first element: `f(f(a0, a1), a2)...`
    /// @throws IllegalArgumentException if the array is null or empty
    public static <T> T foldLeft(T[] array, BinaryOperator<T> function) {
        ArrayChecks.requireNonEmpty(array, "array");
        Objects.requireNonNull(function, "function cannot be null");
        T accumulator = array[0];
        for (int i = 1; i < array.length; i++) {
            accumulator = function.apply(accumulator, array[i]);
        }
        return accumulator;
    }

    /// Folds from the last element, with the accumulator on the left:
    /// `f(f(an, an-1), an-2)...`
    /// @throws IllegalArgumentException if the array is null or empty
    public static <T> T foldRight(T[] array, BinaryOperator<T> function) {
        ArrayChecks.requireNonEmpty(array, "array");
        Objects.requireNonNull(function, "function cannot be null");
        T accumulator = array[array.length - 1];
        for (int i = array.length - 2; i >= 0; i--) {
            accumulator = function.apply(accumulator, array[i]);
        }
        return accumulator;
    }

    /// Sums a decimal key of every element; zero for an empty array.
    public static <T> BigDecimal sumBy(T[] array, Function<? super T, BigDecimal> selector) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(selector, "selector cannot be null");
        BigDecimal sum = BigDecimal.ZERO;
        for (T item : array) {
            sum = sum.add(selector.apply(item));
        }
        return sum;
    }

    /// @throws IllegalArgumentException if the array is null or empty
    public static <T> double averageBy(T[] array, ToDoubleFunction<? super T> selector) {
        ArrayChecks.requireNonEmpty(array, "array");
        Objects.requireNonNull(selector, "selector cannot be null");
        double sum = 0;
        for (T item : array) {
            sum += selector.applyAsDouble(item);
        }
        return sum / array.length;
    }

    /// @return an insertion-ordered set of the array's values
    public static <T> Set<T> toSet(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        return new LinkedHashSet<>(Arrays.asList(array));
    }

    /// @return an unmodifiable list view; later writes to the array show through it
    public static <T> List<T> asReadOnly(T[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        return Collections.unmodifiableList(Arrays.asList(array));
    }

    /// Joins [String#valueOf(Object)] of each element with `delimiter`.
    public static <T> String joinToString(T[] array, String delimiter) {
        Objects.requireNonNull(array, "array cannot be null");
        Objects.requireNonNull(delimiter, "delimiter cannot be null");
        return Arrays.stream(array).map(String::valueOf).collect(Collectors.joining(delimiter));
    }
}
