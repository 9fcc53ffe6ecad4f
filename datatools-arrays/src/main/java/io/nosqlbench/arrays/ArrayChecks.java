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

package io.nosqlbench.arrays;

import java.util.Objects;

/// # ArrayChecks
///
/// Argument validation shared by every array helper in this library.
///
/// ## Failure kinds
///
/// | Check | Exception |
/// |-------|-----------|
/// | null or empty array | [IllegalArgumentException] |
/// | index outside bounds | [IndexOutOfBoundsException] |
/// | scalar outside bounds | [ValueOutOfRangeException] |
/// | paired arrays of different length | [LengthMismatchException] |
///
/// All checks throw immediately and return their argument on success, so they
/// can be used inline:
///
/// ```java
/// double[] sorted = ArrayChecks.requireNonEmpty(values, "values").clone();
/// ```
public final class ArrayChecks {

    private ArrayChecks() {} // Utility class

    public static <T> T[] requireNonEmpty(T[] array, String name) {
        if (array == null || array.length == 0) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return array;
    }

    public static double[] requireNonEmpty(double[] array, String name) {
        if (array == null || array.length == 0) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return array;
    }

    public static int[] requireNonEmpty(int[] array, String name) {
        if (array == null || array.length == 0) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return array;
    }

    public static byte[] requireNonEmpty(byte[] array, String name) {
        if (array == null || array.length == 0) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return array;
    }

    public static char[] requireNonEmpty(char[] array, String name) {
        if (array == null || array.length == 0) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return array;
    }

    /// Requires `0 <= index < length`.
    /// @param index the index to check
    /// @param length the length of the indexed array
    /// @return the index
    /// @throws IndexOutOfBoundsException if the index is outside the array
    public static int requireIndex(int index, int length) {
        return Objects.checkIndex(index, length);
    }

    /// Requires `min <= value <= max`.
    /// @throws ValueOutOfRangeException if the value is outside the closed range
    public static double requireInRange(double value, double min, double max, String name) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ValueOutOfRangeException(name, value, min, max);
        }
        return value;
    }

    /// Requires `min <= value <= max`.
    /// @throws ValueOutOfRangeException if the value is outside the closed range
    public static int requireInRange(int value, int min, int max, String name) {
        if (value < min || value > max) {
            throw new ValueOutOfRangeException(name, value, min, max);
        }
        return value;
    }

    public static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, but was " + value);
        }
        return value;
    }

    public static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " cannot be negative, but was " + value);
        }
        return value;
    }

    /// @throws LengthMismatchException if the lengths differ
    public static void requireSameLength(int leftLength, int rightLength) {
        if (leftLength != rightLength) {
            throw new LengthMismatchException(leftLength, rightLength);
        }
    }
}
