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

package io.nosqlbench.arrays.logical;

import io.nosqlbench.arrays.ArrayChecks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Counting, element-wise logic and run detection over `boolean[]`.
public final class BooleanArrays {

    private BooleanArrays() {} // Utility class

    public static int countTrue(boolean[] flags) {
        Objects.requireNonNull(flags, "flags cannot be null");
        int count = 0;
        for (boolean flag : flags) {
            if (flag) count++;
        }
        return count;
    }

    public static int countFalse(boolean[] flags) {
        return flags.length - countTrue(flags);
    }

    /// True for an empty array.
    public static boolean allTrue(boolean[] flags) {
        return countFalse(flags) == 0;
    }

    /// True for an empty array.
    public static boolean allFalse(boolean[] flags) {
        return countTrue(flags) == 0;
    }

    public static boolean anyTrue(boolean[] flags) {
        return firstTrueIndex(flags) >= 0;
    }

    public static boolean anyFalse(boolean[] flags) {
        return firstFalseIndex(flags) >= 0;
    }

    public static boolean[] invert(boolean[] flags) {
        Objects.requireNonNull(flags, "flags cannot be null");
        boolean[] result = new boolean[flags.length];
        for (int i = 0; i < flags.length; i++) {
            result[i] = !flags[i];
        }
        return result;
    }

    public static boolean[] and(boolean[] first, boolean[] second) {
        requirePair(first, second);
        boolean[] result = new boolean[first.length];
        for (int i = 0; i < first.length; i++) {
            result[i] = first[i] && second[i];
        }
        return result;
    }

    public static boolean[] or(boolean[] first, boolean[] second) {
        requirePair(first, second);
        boolean[] result = new boolean[first.length];
        for (int i = 0; i < first.length; i++) {
            result[i] = first[i] || second[i];
        }
        return result;
    }

    public static boolean[] xor(boolean[] first, boolean[] second) {
        requirePair(first, second);
        boolean[] result = new boolean[first.length];
        for (int i = 0; i < first.length; i++) {
            result[i] = first[i] ^ second[i];
        }
        return result;
    }

    public static int[] trueIndices(boolean[] flags) {
        return indicesOf(flags, true);
    }

    public static int[] falseIndices(boolean[] flags) {
        return indicesOf(flags, false);
    }

    /// @return share of true values, 0 to 100; 0 for a null or empty array
    public static double truePercentage(boolean[] flags) {
        if (flags == null || flags.length == 0) {
            return 0;
        }
        return (double) countTrue(flags) / flags.length * 100;
    }

    /// @return share of false values, 0 to 100; 0 for a null or empty array
    public static double falsePercentage(boolean[] flags) {
        if (flags == null || flags.length == 0) {
            return 0;
        }
        return (double) countFalse(flags) / flags.length * 100;
    }

    public static int firstTrueIndex(boolean[] flags) {
        return firstIndexOf(flags, true);
    }

    public static int lastTrueIndex(boolean[] flags) {
        return lastIndexOf(flags, true);
    }

    public static int firstFalseIndex(boolean[] flags) {
        return firstIndexOf(flags, false);
    }

    public static int lastFalseIndex(boolean[] flags) {
        return lastIndexOf(flags, false);
    }

    /// `{true, false, true}` becomes `"101"`.
    public static String toBinaryString(boolean[] flags) {
        Objects.requireNonNull(flags, "flags cannot be null");
        StringBuilder sb = new StringBuilder(flags.length);
        for (boolean flag : flags) {
            sb.append(flag ? '1' : '0');
        }
        return sb.toString();
    }

    public static int[] toIntArray(boolean[] flags) {
        Objects.requireNonNull(flags, "flags cannot be null");
        int[] result = new int[flags.length];
        for (int i = 0; i < flags.length; i++) {
            result[i] = flags[i] ? 1 : 0;
        }
        return result;
    }

    /// Every maximal run of true values, in order.
    public static List<Run> trueRuns(boolean[] flags) {
        return runsOf(flags, true);
    }

    /// Every maximal run of false values, in order.
    public static List<Run> falseRuns(boolean[] flags) {
        return runsOf(flags, false);
    }

    /// @return the first longest run of true values, or [Run#NONE]
    public static Run longestTrueRun(boolean[] flags) {
        return longest(trueRuns(flags));
    }

    /// @return the first longest run of false values, or [Run#NONE]
    public static Run longestFalseRun(boolean[] flags) {
        return longest(falseRuns(flags));
    }

    private static List<Run> runsOf(boolean[] flags, boolean value) {
        Objects.requireNonNull(flags, "flags cannot be null");
        List<Run> runs = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < flags.length; i++) {
            if (flags[i] == value) {
                if (start < 0) start = i;
            } else if (start >= 0) {
                runs.add(new Run(start, i - start));
                start = -1;
            }
        }
        if (start >= 0) {
            runs.add(new Run(start, flags.length - start));
        }
        return runs;
    }

    private static Run longest(List<Run> runs) {
        Run best = Run.NONE;
        for (Run run : runs) {
            if (run.length() > best.length()) {
                best = run;
            }
        }
        return best;
    }

    private static int[] indicesOf(boolean[] flags, boolean value) {
        Objects.requireNonNull(flags, "flags cannot be null");
        int[] found = new int[flags.length];
        int count = 0;
        for (int i = 0; i < flags.length; i++) {
            if (flags[i] == value) {
                found[count++] = i;
            }
        }
        return Arrays.copyOf(found, count);
    }

    private static int firstIndexOf(boolean[] flags, boolean value) {
        Objects.requireNonNull(flags, "flags cannot be null");
        for (int i = 0; i < flags.length; i++) {
            if (flags[i] == value) return i;
        }
        return -1;
    }

    private static int lastIndexOf(boolean[] flags, boolean value) {
        Objects.requireNonNull(flags, "flags cannot be null");
        for (int i = flags.length - 1; i >= 0; i--) {
            if (flags[i] == value) return i;
        }
        return -1;
    }

    private static void requirePair(boolean[] first, boolean[] second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        ArrayChecks.requireSameLength(first.length, second.length);
    }
}
