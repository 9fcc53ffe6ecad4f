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

/// Thrown when a bounded scalar parameter falls outside its documented range,
/// for example a percentile outside 0..100 or a bit shift outside 0..7.
///
/// This is an [IllegalArgumentException], so callers which only care that an
/// argument was rejected can keep catching that.
public class ValueOutOfRangeException extends IllegalArgumentException {

    /// The name of the rejected parameter.
    private final String parameter;
    /// The rejected value.
    private final double value;
    /// The lowest accepted value, inclusive.
    private final double min;
    /// The highest accepted value, inclusive.
    private final double max;

    /// Creates a new ValueOutOfRangeException.
    /// @param parameter The name of the rejected parameter
    /// @param value The rejected value
    /// @param min The lowest accepted value, inclusive
    /// @param max The highest accepted value, inclusive
    public ValueOutOfRangeException(String parameter, double value, double min, double max) {
        super(String.format("%s must be between %s and %s, but was %s",
            parameter, format(min), format(max), format(value)));
        this.parameter = parameter;
        this.value = value;
        this.min = min;
        this.max = max;
    }

    public String getParameter() {
        return parameter;
    }

    public double getValue() {
        return value;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /// Renders whole numbers without a trailing fraction so integer bounds read naturally.
    private static String format(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }
}
