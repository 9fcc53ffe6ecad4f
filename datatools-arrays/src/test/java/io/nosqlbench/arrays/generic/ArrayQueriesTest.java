package io.nosqlbench.arrays.generic;

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

import io.nosqlbench.arrays.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/// Test class for [ArrayQueries]
@Tag("unit")
class ArrayQueriesTest {

    @Test
    void testEmptinessChecks() {
        assertTrue(ArrayQueries.isEmpty(new String[0]));
        assertFalse(ArrayQueries.isEmpty(new String[]{"a"}));
        assertTrue(ArrayQueries.isNullOrEmpty(null));
        assertThrows(NullPointerException.class, () -> ArrayQueries.isEmpty(null));
    }

    @Test
    void testAllEqual() {
        assertTrue(ArrayQueries.allEqual(new String[]{"x", "x", "x"}));
        assertFalse(ArrayQueries.allEqual(new String[]{"x", "y"}));
        assertFalse(ArrayQueries.allEqual(new String[0]));
        assertTrue(ArrayQueries.allEqual(new String[]{null, null}));
    }

    @Test
    void testAnyNullAndIsUnique() {
        assertTrue(ArrayQueries.anyNull(new String[]{"a", null}));
        assertFalse(ArrayQueries.anyNull(new String[]{"a"}));
        assertTrue(ArrayQueries.isUnique(new Integer[]{1, 2, 3}));
        assertFalse(ArrayQueries.isUnique(new Integer[]{1, 2, 1}));
    }

    @Test
    void testIsPalindrome() {
        assertTrue(ArrayQueries.isPalindrome(new Integer[]{1, 2, 1}));
        assertTrue(ArrayQueries.isPalindrome(new Integer[]{1, 2, 2, 1}));
        assertFalse(ArrayQueries.isPalindrome(new Integer[]{1, 2, 3}));
        assertTrue(ArrayQueries.isPalindrome(new Integer[0]));
        assertTrue(ArrayQueries.isPalindrome(null));
    }

    @Test
    void testIsSorted() {
        assertTrue(ArrayQueries.isSorted(new Integer[]{1, 1, 2, 5}));
        assertFalse(ArrayQueries.isSorted(new Integer[]{2, 1}));
        assertTrue(ArrayQueries.isSorted(new Integer[]{5, 3, 1}, Comparator.reverseOrder()));
    }

    @Test
    void testLookups() {
        String[] values = {"a", "b", null, "b"};
        assertTrue(ArrayQueries.contains(values, null));
        assertEquals(1, ArrayQueries.indexOf(values, "b"));
        assertEquals(-1, ArrayQueries.indexOf(values, "z"));
        assertEquals(2, ArrayQueries.countOf(values, "b"));
        assertArrayEquals(new int[]{1, 3}, ArrayQueries.findIndices(values, "b"::equals));
        assertEquals("b", ArrayQueries.findOrDefault(values, "b"::equals, "none"));
        assertEquals("none", ArrayQueries.findOrDefault(values, "q"::equals, "none"));
    }

    @Test
    void testFindFirstAndLast() {
        Integer[] values = {1, 4, 6, 7, 8};
        Pair<Integer, Integer> evens = ArrayQueries.findFirstAndLast(values, x -> x % 2 == 0);
        assertEquals(Pair.of(4, 8), evens);
        Pair<Integer, Integer> none = ArrayQueries.findFirstAndLast(values, x -> x > 100);
        assertNull(none.first());
        assertNull(none.second());
    }

    @Test
    void testBinarySearch() {
        Integer[] sorted = {1, 3, 5, 7, 9, 11};
        for (int i = 0; i < sorted.length; i++) {
            assertEquals(i, ArrayQueries.binarySearch(sorted, sorted[i]));
        }
        assertEquals(-1, ArrayQueries.binarySearch(sorted, 4));
        assertEquals(-1, ArrayQueries.binarySearch(new Integer[0], 4));
        Integer[] descending = {9, 5, 1};
        assertEquals(1, ArrayQueries.binarySearch(descending, 5, Comparator.reverseOrder()));
    }

    @Test
    void testBinarySearchAgreesWithLinearScan() {
        UniformRandomProvider rng = RandomGenerators.create(1234L);
        for (int trial = 0; trial < 200; trial++) {
            Integer[] sorted = new Integer[rng.nextInt(40)];
            for (int i = 0; i < sorted.length; i++) {
                sorted[i] = rng.nextInt(50);
            }
            Arrays.sort(sorted);
            int target = rng.nextInt(55);
            int found = ArrayQueries.binarySearch(sorted, target);
            if (ArrayQueries.indexOf(sorted, target) < 0) {
                assertEquals(-1, found);
            } else {
                assertEquals(target, sorted[found]);
            }
        }
    }

    @Test
    void testMostCommonPrefersFirstSeenOnTies() {
        assertEquals("b", ArrayQueries.mostCommon(new String[]{"a", "b", "b", "c"}));
        assertEquals("a", ArrayQueries.mostCommon(new String[]{"a", "b", "b", "a"}));
        assertThrows(IllegalArgumentException.class, () -> ArrayQueries.mostCommon(new String[0]));
    }

    @Test
    void testFrequencyKeepsFirstSeenOrder() {
        Map<String, Integer> frequency = ArrayQueries.frequency(new String[]{"c", "a", "c", "b"});
        assertThat(frequency).containsExactly(Map.entry("c", 2), Map.entry("a", 1), Map.entry("b", 1));
    }

    @Test
    void testMaxByAndMinBy() {
        String[] words = {"pear", "fig", "banana", "kiwi", "cherry"};
        assertEquals("banana", ArrayQueries.maxBy(words, String::length));
        assertEquals("fig", ArrayQueries.minBy(words, String::length));
        assertEquals("pear", ArrayQueries.minBy(new String[]{"pear", "kiwi"}, String::length));
        assertNull(ArrayQueries.maxBy(new String[0], String::length));
    }

    @Test
    void testMaxByAndMinByOrderNullKeysFirst() {
        String[] words = {"apple", "bean", "corn"};
        Function<String, String> nullForBean = s -> s.equals("bean") ? null : s;
        assertEquals("corn", ArrayQueries.maxBy(words, nullForBean));
        assertEquals("bean", ArrayQueries.minBy(words, nullForBean));

        Function<String, String> nullForApple = s -> s.equals("apple") ? null : s;
        assertEquals("corn", ArrayQueries.maxBy(words, nullForApple));
        assertEquals("apple", ArrayQueries.minBy(words, nullForApple));

        assertEquals("a", ArrayQueries.maxBy(new String[]{"a", "b"}, s -> s.equals("b") ? null : s));
        assertEquals("x", ArrayQueries.maxBy(new String[]{"x", "y"}, s -> (String) null));
    }

    @Test
    void testDistinctAndDuplicates() {
        Integer[] values = {3, 1, 3, 2, 1, 3};
        assertArrayEquals(new Integer[]{3, 1, 2}, ArrayQueries.distinct(values));
        assertArrayEquals(new Integer[]{3, 1, 2}, ArrayQueries.removeDuplicates(values));
        assertArrayEquals(new Integer[]{3, 1}, ArrayQueries.findDuplicates(values));
        assertArrayEquals(new int[]{0, 1, 2, 4, 5}, ArrayQueries.findDuplicateIndices(values));
        assertArrayEquals(new String[]{"apple", "banana"},
            ArrayQueries.distinctBy(new String[]{"apple", "avocado", "banana"}, s -> s.charAt(0)));
    }

    @Test
    void testSetOperations() {
        Integer[] first = {1, 2, 2, 3, 4};
        Integer[] second = {4, 3, 5};
        assertArrayEquals(new Integer[]{3, 4}, ArrayQueries.intersect(first, second));
        assertArrayEquals(new Integer[]{1, 2, 3, 4, 5}, ArrayQueries.union(first, second));
        assertArrayEquals(new Integer[]{1, 2}, ArrayQueries.except(first, second));
    }

    @Test
    void testPartition() {
        Partition<Integer> partition = ArrayQueries.partition(new Integer[]{1, 2, 3, 4, 5}, x -> x % 2 == 0);
        assertArrayEquals(new Integer[]{2, 4}, partition.matching());
        assertArrayEquals(new Integer[]{1, 3, 5}, partition.nonMatching());
    }

    @Test
    void testTakeWhileAndSkipWhile() {
        Integer[] values = {1, 2, 5, 1, 2};
        assertArrayEquals(new Integer[]{1, 2}, ArrayQueries.takeWhile(values, x -> x < 3));
        assertArrayEquals(new Integer[]{5, 1, 2}, ArrayQueries.skipWhile(values, x -> x < 3));
        assertEquals(0, ArrayQueries.takeWhile(values, x -> x > 10).length);
        assertEquals(0, ArrayQueries.skipWhile(values, x -> x < 10).length);
    }

    @Test
    void testSegmentStartsNewSegmentAtEachMatch() {
        List<Integer[]> segments = ArrayQueries.segment(new Integer[]{1, 2, 0, 3, 0, 4}, x -> x == 0);
        assertEquals(3, segments.size());
        assertArrayEquals(new Integer[]{1, 2}, segments.get(0));
        assertArrayEquals(new Integer[]{0, 3}, segments.get(1));
        assertArrayEquals(new Integer[]{0, 4}, segments.get(2));
    }

    @Test
    void testSegmentWithLeadingMatch() {
        List<Integer[]> segments = ArrayQueries.segment(new Integer[]{0, 1, 0}, x -> x == 0);
        assertEquals(2, segments.size());
        assertArrayEquals(new Integer[]{0, 1}, segments.get(0));
        assertArrayEquals(new Integer[]{0}, segments.get(1));
        assertTrue(ArrayQueries.segment(new Integer[0], x -> true).isEmpty());
    }

    @Test
    void testGroupSequentialSeparatesNonAdjacentRuns() {
        List<Pair<Boolean, Integer[]>> groups =
            ArrayQueries.groupSequential(new Integer[]{2, 4, 1, 6}, x -> x % 2 == 0);
        assertEquals(3, groups.size());
        assertEquals(true, groups.get(0).first());
        assertArrayEquals(new Integer[]{2, 4}, groups.get(0).second());
        assertEquals(false, groups.get(1).first());
        assertArrayEquals(new Integer[]{1}, groups.get(1).second());
        assertArrayEquals(new Integer[]{6}, groups.get(2).second());
    }

    @Test
    void testGroupBy() {
        Map<Integer, List<String>> byLength = ArrayQueries.groupBy(new String[]{"aa", "b", "cc", "d"}, String::length);
        assertThat(byLength.keySet()).containsExactly(2, 1);
        assertThat(byLength.get(2)).containsExactly("aa", "cc");
    }

    @Test
    void testZipWithTruncates() {
        List<String> zipped = ArrayQueries.zipWith(new Integer[]{1, 2, 3}, new String[]{"a", "b"}, (n, s) -> s + n);
        assertThat(zipped).containsExactly("a1", "b2");
    }

    @Test
    void testMapAndMapIndexed() {
        Integer[] lengths = ArrayQueries.map(new String[]{"a", "bbb"}, String::length, Integer[]::new);
        assertArrayEquals(new Integer[]{1, 3}, lengths);
        List<String> indexed = ArrayQueries.mapIndexed(new String[]{"x", "y"}, (item, index) -> index + item);
        assertThat(indexed).containsExactly("0x", "1y");
    }

    @Test
    void testForEachIndexed() {
        List<String> seen = new ArrayList<>();
        ArrayQueries.forEachIndexed(new String[]{"a", "b"}, (item, index) -> seen.add(item + index));
        assertThat(seen).containsExactly("a0", "b1");
        List<String> plain = new ArrayList<>();
        ArrayQueries.forEach(new String[]{"a", "b"}, plain::add);
        assertThat(plain).containsExactly("a", "b");
    }

    @Test
    void testFolds() {
        String[] letters = {"a", "b", "c"};
        assertEquals("abc", ArrayQueries.foldLeft(letters, String::concat));
        assertEquals("cba", ArrayQueries.foldRight(letters, String::concat));
        assertEquals(-8, ArrayQueries.foldLeft(new Integer[]{1, 2, 3, 4}, (a, b) -> a - b));
        assertThrows(IllegalArgumentException.class, () -> ArrayQueries.foldLeft(new String[0], String::concat));
    }

    @Test
    void testSumByAndAverageBy() {
        String[] prices = {"0.10", "0.20", "0.30"};
        assertEquals(new BigDecimal("0.60"), ArrayQueries.sumBy(prices, BigDecimal::new));
        assertEquals(BigDecimal.ZERO, ArrayQueries.sumBy(new String[0], BigDecimal::new));
        assertEquals(2.0, ArrayQueries.averageBy(new String[]{"a", "bbb"}, String::length), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> ArrayQueries.averageBy(new String[0], String::length));
    }

    @Test
    void testConversions() {
        assertThat(ArrayQueries.toSet(new Integer[]{3, 1, 3})).containsExactly(3, 1);
        Integer[] values = {1, 2};
        List<Integer> view = ArrayQueries.asReadOnly(values);
        assertThrows(UnsupportedOperationException.class, () -> view.set(0, 9));
        values[0] = 7;
        assertEquals(7, view.get(0));
        assertEquals("1, null, 3", ArrayQueries.joinToString(new Integer[]{1, null, 3}, ", "));
    }
}
