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

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// # CharArrays
///
/// Classification, filtering and case operations over `char[]`.
///
/// ## Character classes
///
/// | Method | Test |
/// |--------|------|
/// | letters | [Character#isLetter(char)] |
/// | digits | [Character#isDigit(char)] |
/// | whitespace | [Character#isWhitespace(char)] or [Character#isSpaceChar(char)] |
/// | punctuation | one of the seven Unicode `P*` general categories |
/// | vowels | `aeiouAEIOU` only |
///
/// Whitespace includes no-break spaces, which [Character#isWhitespace(char)]
/// alone would miss.
public final class CharArrays {

    private static final String VOWELS = "aeiouAEIOU";

    private CharArrays() {} // Utility class

    public static String asString(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        return new String(chars);
    }

    public static int countVowels(char[] chars) {
        return count(chars, CharArrays::isVowel);
    }

    /// Letters that are not one of `aeiouAEIOU`.
    public static int countConsonants(char[] chars) {
        return count(chars, c -> Character.isLetter(c) && !isVowel(c));
    }

    public static int countDigits(char[] chars) {
        return count(chars, Character::isDigit);
    }

    public static int countLetters(char[] chars) {
        return count(chars, Character::isLetter);
    }

    public static int countUppercase(char[] chars) {
        return count(chars, Character::isUpperCase);
    }

    public static int countLowercase(char[] chars) {
        return count(chars, Character::isLowerCase);
    }

    public static int countWhitespace(char[] chars) {
        return count(chars, CharArrays::isWhitespace);
    }

    public static int countPunctuation(char[] chars) {
        return count(chars, CharArrays::isPunctuation);
    }

    public static char[] toUppercase(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        char[] result = new char[chars.length];
        for (int i = 0; i < chars.length; i++) {
            result[i] = Character.toUpperCase(chars[i]);
        }
        return result;
    }

    public static char[] toLowercase(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        char[] result = new char[chars.length];
        for (int i = 0; i < chars.length; i++) {
            result[i] = Character.toLowerCase(chars[i]);
        }
        return result;
    }

    public static char[] removeWhitespace(char[] chars) {
        return keep(chars, c -> !isWhitespace(c));
    }

    public static char[] keepLettersOnly(char[] chars) {
        return keep(chars, Character::isLetter);
    }

    public static char[] keepDigitsOnly(char[] chars) {
        return keep(chars, Character::isDigit);
    }

    public static char[] keepAlphanumericOnly(char[] chars) {
        return keep(chars, Character::isLetterOrDigit);
    }

    /// @return the most frequent character, the first seen on ties
    /// @throws IllegalArgumentException if the array is null or empty
    public static char mostFrequent(char[] chars) {
        ArrayChecks.requireNonEmpty(chars, "chars");
        Map<Character, Integer> counts = frequency(chars);
        char best = chars[0];
        int bestCount = 0;
        for (Map.Entry<Character, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /// Occurrence count of each character in first-seen order.
    public static Map<Character, Integer> frequency(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        Map<Character, Integer> counts = new LinkedHashMap<>();
        for (char c : chars) {
            counts.merge(c, 1, Integer::sum);
        }
        return counts;
    }

    /// A null array or one of length 0 or 1 is a palindrome.
    public static boolean isPalindrome(char[] chars) {
        if (chars == null || chars.length <= 1) {
            return true;
        }
        for (int left = 0, right = chars.length - 1; left < right; left++, right--) {
            if (chars[left] != chars[right]) {
                return false;
            }
        }
        return true;
    }

    public static char[] reverse(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        char[] result = new char[chars.length];
        for (int i = 0; i < chars.length; i++) {
            result[i] = chars[chars.length - 1 - i];
        }
        return result;
    }

    public static char[] rotateLeft(char[] chars, int positions) {
        Objects.requireNonNull(chars, "chars cannot be null");
        int n = chars.length;
        if (n == 0) {
            return new char[0];
        }
        int shift = Math.floorMod(positions, n);
        char[] result = new char[n];
        System.arraycopy(chars, shift, result, 0, n - shift);
        System.arraycopy(chars, 0, result, n - shift, shift);
        return result;
    }

    public static char[] rotateRight(char[] chars, int positions) {
        Objects.requireNonNull(chars, "chars cannot be null");
        if (chars.length == 0) {
            return new char[0];
        }
        return rotateLeft(chars, -Math.floorMod(positions, chars.length));
    }

    public static int[] findAllIndices(char[] chars, char target) {
        Objects.requireNonNull(chars, "chars cannot be null");
        int[] found = new int[chars.length];
        int count = 0;
        for (int i = 0; i < chars.length; i++) {
            if (chars[i] == target) {
                found[count++] = i;
            }
        }
        return Arrays.copyOf(found, count);
    }

    public static char[] replaceAll(char[] chars, char oldChar, char newChar) {
        Objects.requireNonNull(chars, "chars cannot be null");
        char[] result = chars.clone();
        for (int i = 0; i < result.length; i++) {
            if (result[i] == oldChar) {
                result[i] = newChar;
            }
        }
        return result;
    }

    /// Upper-cases the first character when it is a letter.
    public static char[] capitalizeFirst(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        char[] result = chars.clone();
        if (result.length > 0 && Character.isLetter(result[0])) {
            result[0] = Character.toUpperCase(result[0]);
        }
        return result;
    }

    /// Upper-cases the first letter after the start or after whitespace and
    /// lower-cases every other letter. Digits and punctuation are copied as-is
    /// and do not start a new word; a pending capital carries past them, so
    /// `"3rd"` becomes `"3Rd"`.
    public static char[] toTitleCase(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        char[] result = new char[chars.length];
        boolean capitalizeNext = true;
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (isWhitespace(c)) {
                result[i] = c;
                capitalizeNext = true;
            } else if (Character.isLetter(c)) {
                result[i] = capitalizeNext ? Character.toUpperCase(c) : Character.toLowerCase(c);
                capitalizeNext = false;
            } else {
                result[i] = c;
            }
        }
        return result;
    }

    /// Distinct characters in first-seen order.
    public static char[] removeDuplicates(char[] chars) {
        Map<Character, Integer> counts = frequency(chars);
        char[] result = new char[counts.size()];
        int i = 0;
        for (char c : counts.keySet()) {
            result[i++] = c;
        }
        return result;
    }

    public static boolean isAsciiOnly(char[] chars) {
        return count(chars, c -> c > 127) == 0;
    }

    public static byte[] encode(char[] chars, Charset charset) {
        Objects.requireNonNull(charset, "charset cannot be null");
        return asString(chars).getBytes(charset);
    }

    /// Sorted copy by UTF-16 code unit.
    public static char[] sortAlphabetically(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        char[] sorted = chars.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    /// Groups characters by [Character#getType(char)], for example
    /// [Character#UPPERCASE_LETTER] or [Character#DECIMAL_DIGIT_NUMBER]. Keys and
    /// the characters under each key keep first-seen order.
    public static Map<Integer, char[]> groupByUnicodeCategory(char[] chars) {
        Objects.requireNonNull(chars, "chars cannot be null");
        Map<Integer, StringBuilder> groups = new LinkedHashMap<>();
        for (char c : chars) {
            groups.computeIfAbsent(Character.getType(c), k -> new StringBuilder()).append(c);
        }
        Map<Integer, char[]> result = new LinkedHashMap<>();
        groups.forEach((type, builder) -> result.put(type, builder.toString().toCharArray()));
        return result;
    }

    static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }

    static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    static boolean isPunctuation(char c) {
        switch (Character.getType(c)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
                return true;
            default:
                return false;
        }
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }

    private static int count(char[] chars, CharPredicate predicate) {
        Objects.requireNonNull(chars, "chars cannot be null");
        int count = 0;
        for (char c : chars) {
            if (predicate.test(c)) {
                count++;
            }
        }
        return count;
    }

    private static char[] keep(char[] chars, CharPredicate predicate) {
        Objects.requireNonNull(chars, "chars cannot be null");
        StringBuilder kept = new StringBuilder(chars.length);
        for (char c : chars) {
            if (predicate.test(c)) {
                kept.append(c);
            }
        }
        return kept.toString().toCharArray();
    }
}
