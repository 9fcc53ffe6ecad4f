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

import java.util.Arrays;

/// The result of splitting an array by a predicate. Both arrays keep the
/// relative order of the input.
///
/// @param matching the elements for which the predicate held
/// @param nonMatching the remaining elements
/// @param <T> the element type
public record Partition<T>(T[] matching, T[] nonMatching) {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Partition<?> other)) return false;
        return Arrays.equals(matching, other.matching) && Arrays.equals(nonMatching, other.nonMatching);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(matching) + Arrays.hashCode(nonMatching);
    }

    @Override
    public String toString() {
        return "Partition{matching=" + Arrays.toString(matching)
            + ", nonMatching=" + Arrays.toString(nonMatching) + "}";
    }
}
