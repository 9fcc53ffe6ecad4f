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

package io.nosqlbench.arrays.text;

import io.nosqlbench.arrays.ArrayChecks;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// # StringArrays
///
/// Bulk string operations over `String[]`.
///
/// Element-wise transforms (`trimAll`, `toUpperCase`, `reverseEach`, ...) map
/// null elements to null. Queries that need the element content, such as
/// [#countOccurrences(String[], String)] or [#allOfLength(String[], int)],
/// treat a null element as not matching.
///
/// Case conversion uses [Locale#ROOT]. Sorting is ordinal, by UTF-16 code unit.
public final class StringArrays {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private StringArrays() {} // Utility class

    public static boolean anyNullOrEmpty(String[] array) {
        return anyMatch(array, s -> s == null || s.isEmpty());
    }

    public static boolean anyNullOrBlank(String[] array) {
        return anyMatch(array, s -> s == null || s.isBlank());
    }

    public static String[] trimAll(String[] array) {
        return mapEach(array, String::trim);
    }

    public static String[] removeNullOrEmpty(String[] array) {
        return filter(array, s -> s != null && !s.isEmpty());
    }

    public static String[] removeNullOrBlank(String[] array) {
        return filter(array, s -> s != null && !s.isBlank());
    }

    public static boolean hasDuplicates(String[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        Set<String> seen = new HashSet<>();
        for (String s : array) {
            if (!seen.add(s)) {
                return true;
            }
        }
        return false;
    }

    /// Joins with `separator`; null elements become empty strings.
    public static String join(String[] array, String separator) {
        Objects.requireNonNull(array, "array cannot be null");
        return Arrays.stream(array)
            .map(s -> s == null ? "" : s)
            .collect(Collectors.joining(separator));
    }

    /// Joins the non-null, non-empty elements with `separator`.
    public static String joinNonEmpty(String[] array, String separator) {
        return String.join(separator, removeNullOrEmpty(array));
    }

    public static String[] toUpperCase(String[] array) {
        return mapEach(array, s -> s.toUpperCase(Locale.ROOT));
    }

    public static String[] toLowerCase(String[] array) {
        return mapEach(array, s -> s.toLowerCase(Locale.ROOT));
    }

    public static String[] reverseEach(String[] array) {
        return mapEach(array, s -> new StringBuilder(s).reverse().toString());
    }

    /// Elements in which `regex` matches anywhere.
    public static String[] filterByPattern(String[] array, String regex) {
        Pattern pattern = Pattern.compile(regex);
        return filter(array, s -> s != null && pattern.matcher(s).find());
    }

    public static int countMatching(String[] array, String regex) {
        return filterByPattern(array, regex).length;
    }

    /// Total non-overlapping occurrences of `substring` across every element.
    /// `"aaaa"` contains `"aa"` twice.
    /// @throws IllegalArgumentException if substring is empty
    public static int countOccurrences(String[] array, String substring) {
        Objects.requireNonNull(array, "array cannot be null");
        if (substring == null || substring.isEmpty()) {
            throw new IllegalArgumentException("substring cannot be null or empty");
        }
        int total = 0;
        for (String s : array) {
            if (s == null) continue;
            int from = s.indexOf(substring);
            while (from >= 0) {
                total++;
                from = s.indexOf(substring, from + substring.length());
            }
        }
        return total;
    }

    public static String[] replaceInAll(String[] array, String target, String replacement) {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(replacement, "replacement cannot be null");
        return mapEach(array, s -> s.replace(target, replacement));
    }

    public static boolean allOfLength(String[] array, int length) {
        Objects.requireNonNull(array, "array cannot be null");
        for (String s : array) {
            if (s == null || s.length() != length) {
                return false;
            }
        }
        return true;
    }

    /// @return the first longest element, or null for an empty array
    public static String longest(String[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        String best = null;
        for (String s : array) {
            if (s != null && (best == null || s.length() > best.length())) {
                best = s;
            }
        }
        return best;
    }

    /// @return the first shortest element, or null for an empty array
    public static String shortest(String[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        String best = null;
        for (String s : array) {
            if (s != null && (best == null || s.length() < best.length())) {
                best = s;
            }
        }
        return best;
    }

    /// Sorted copy, nulls first.
    public static String[] sortAlphabetically(String[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        String[] sorted = array.clone();
        Arrays.sort(sorted, Comparator.nullsFirst(Comparator.naturalOrder()));
        return sorted;
    }

    public static boolean anyContains(String[] array, String substring) {
        Objects.requireNonNull(substring, "substring cannot be null");
        return anyMatch(array, s -> s != null && s.contains(substring));
    }

    public static boolean anyStartsWith(String[] array, String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        return anyMatch(array, s -> s != null && s.startsWith(prefix));
    }

    public static boolean anyEndsWith(String[] array, String suffix) {
        Objects.requireNonNull(suffix, "suffix cannot be null");
        return anyMatch(array, s -> s != null && s.endsWith(suffix));
    }

    /// Collapses every run of whitespace to one space. Leading and trailing runs
    /// are collapsed too, not removed.
    public static String[] normalizeWhitespace(String[] array) {
        return mapEach(array, s -> WHITESPACE_RUN.matcher(s).replaceAll(" "));
    }

    /// Upper-cases the first character and lower-cases the rest. Empty strings
    /// pass through.
    public static String[] capitalizeFirstLetter(String[] array) {
        return mapEach(array, s -> s.isEmpty()
            ? s
            : s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT));
    }

    /// Distinct elements in first-seen order.
    public static String[] unique(String[] array) {
        Objects.requireNonNull(array, "array cannot be null");
        return new LinkedHashSet<>(Arrays.asList(array)).toArray(new String[0]);
    }

    /// Left fold of the elements with `aggregator`.
    /// @throws IllegalArgumentException if the array is null or empty
    public static String aggregate(String[] array, BinaryOperator<String> aggregator) {
        ArrayChecks.requireNonEmpty(array, "array");
        Objects.requireNonNull(aggregator, "aggregator cannot be null");
        String result = array[0];
        for (int i = 1; i < array.length; i++) {
            result = aggregator.apply(result, array[i]);
        }
        return result;
    }

    private static boolean anyMatch(String[] array, Predicate<String> predicate) {
        Objects.requireNonNull(array, "array cannot be null");
        for (String s : array) {
            if (predicate.test(s)) {
                return true;
            }
        }
        return false;
    }

    private static String[] filter(String[] array, Predicate<String> predicate) {
        Objects.requireNonNull(array, "array cannot be null");
        return Arrays.stream(array).filter(predicate).toArray(String[]::new);
    }

    private static String[] mapEach(String[] array, UnaryOperator<String> function) {
        Objects.requireNonNull(array, "array cannot be null");
        String[] result = new String[array.length];
        for (int i = 0; i < array.length; i++) {
            result[i] = array[i] == null ? null : function.apply(array[i]);
        }
        return result;
    }
}
