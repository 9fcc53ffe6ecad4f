package io.nosqlbench.arrays.text;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/// Test class for [CharArrays]
@Tag("unit")
class CharArraysTest {

    private static final char[] SAMPLE = "Hello, World 42!".toCharArray();

    @Test
    void testCounters() {
        assertEquals(3, CharArrays.countVowels(SAMPLE));
        assertEquals(7, CharArrays.countConsonants(SAMPLE));
        assertEquals(2, CharArrays.countDigits(SAMPLE));
        assertEquals(10, CharArrays.countLetters(SAMPLE));
        assertEquals(2, CharArrays.countUppercase(SAMPLE));
        assertEquals(8, CharArrays.countLowercase(SAMPLE));
        assertEquals(2, CharArrays.countWhitespace(SAMPLE));
        assertEquals(2, CharArrays.countPunctuation(SAMPLE));
    }

    @Test
    void testWhitespaceIncludesNoBreakSpace() {
        char[] chars = {'a', '\u00A0', '\t', 'b'};
        assertEquals(2, CharArrays.countWhitespace(chars));
        assertArrayEquals(new char[]{'a', 'b'}, CharArrays.removeWhitespace(chars));
    }

    @Test
    void testPunctuationCategories() {
        assertEquals(6, CharArrays.countPunctuation("_-()«»".toCharArray()));
        assertEquals(0, CharArrays.countPunctuation("+$<".toCharArray()));
    }

    @Test
    void testCaseMapping() {
        assertArrayEquals("ABC1".toCharArray(), CharArrays.toUppercase("aBc1".toCharArray()));
        assertArrayEquals("abc1".toCharArray(), CharArrays.toLowercase("aBc1".toCharArray()));
    }

    @Test
    void testKeepFilters() {
        char[] chars = "a1 b2-c3".toCharArray();
        assertEquals("abc", CharArrays.asString(CharArrays.keepLettersOnly(chars)));
        assertEquals("123", CharArrays.asString(CharArrays.keepDigitsOnly(chars)));
        assertEquals("a1b2c3", CharArrays.asString(CharArrays.keepAlphanumericOnly(chars)));
    }

    @Test
    void testMostFrequentPrefersFirstSeen() {
        assertEquals('l', CharArrays.mostFrequent("hello".toCharArray()));
        assertEquals('a', CharArrays.mostFrequent("abab".toCharArray()));
        assertThrows(IllegalArgumentException.class, () -> CharArrays.mostFrequent(new char[0]));
    }

    @Test
    void testFrequency() {
        Map<Character, Integer> frequency = CharArrays.frequency("abca".toCharArray());
        assertThat(frequency).containsExactly(Map.entry('a', 2), Map.entry('b', 1), Map.entry('c', 1));
    }

    @Test
    void testPalindromeAndReverse() {
        assertTrue(CharArrays.isPalindrome("racecar".toCharArray()));
        assertFalse(CharArrays.isPalindrome("Racecar".toCharArray()));
        assertTrue(CharArrays.isPalindrome(null));
        assertArrayEquals("cba".toCharArray(), CharArrays.reverse("abc".toCharArray()));
    }

    @Test
    void testRotation() {
        char[] chars = "abcde".toCharArray();
        assertEquals("cdeab", CharArrays.asString(CharArrays.rotateLeft(chars, 2)));
        assertEquals("deabc", CharArrays.asString(CharArrays.rotateRight(chars, 2)));
        assertEquals("deabc", CharArrays.asString(CharArrays.rotateLeft(chars, -2)));
        assertEquals("abcde", CharArrays.asString(CharArrays.rotateRight(chars, 10)));
        assertEquals(0, CharArrays.rotateLeft(new char[0], 3).length);
    }

    @Test
    void testFindAndReplace() {
        assertArrayEquals(new int[]{1, 3, 5}, CharArrays.findAllIndices("banana".toCharArray(), 'a'));
        assertEquals(0, CharArrays.findAllIndices("banana".toCharArray(), 'z').length);
        char[] source = "banana".toCharArray();
        assertEquals("bonono", CharArrays.asString(CharArrays.replaceAll(source, 'a', 'o')));
        assertEquals("banana", CharArrays.asString(source));
    }

    @Test
    void testCapitalizeFirst() {
        assertEquals("Hello", CharArrays.asString(CharArrays.capitalizeFirst("hello".toCharArray())));
        assertEquals("1abc", CharArrays.asString(CharArrays.capitalizeFirst("1abc".toCharArray())));
    }

    @Test
    void testTitleCase() {
        assertEquals("Hello World", CharArrays.asString(CharArrays.toTitleCase("hELLO wORLD".toCharArray())));
        assertEquals("Don't Stop-now", CharArrays.asString(CharArrays.toTitleCase("don't stop-NOW".toCharArray())));
        assertEquals("3Rd Place", CharArrays.asString(CharArrays.toTitleCase("3rd place".toCharArray())));
    }

    @Test
    void testRemoveDuplicatesAndSort() {
        assertEquals("ban", CharArrays.asString(CharArrays.removeDuplicates("banana".toCharArray())));
        assertEquals("Baaann", CharArrays.asString(CharArrays.sortAlphabetically("banana".replace('b', 'B').toCharArray())));
        assertEquals("aaabnn", CharArrays.asString(CharArrays.sortAlphabetically("banana".toCharArray())));
    }

    @Test
    void testAsciiAndEncoding() {
        assertTrue(CharArrays.isAsciiOnly("plain".toCharArray()));
        assertFalse(CharArrays.isAsciiOnly("café".toCharArray()));
        assertArrayEquals(new byte[]{'c', 'a', 'f', (byte) 0xC3, (byte) 0xA9},
            CharArrays.encode("café".toCharArray(), StandardCharsets.UTF_8));
    }

    @Test
    void testGroupByUnicodeCategory() {
        Map<Integer, char[]> groups = CharArrays.groupByUnicodeCategory("aB1b".toCharArray());
        assertThat(groups.keySet()).containsExactly(
            (int) Character.LOWERCASE_LETTER, (int) Character.UPPERCASE_LETTER, (int) Character.DECIMAL_DIGIT_NUMBER);
        assertArrayEquals("ab".toCharArray(), groups.get((int) Character.LOWERCASE_LETTER));
    }
}
