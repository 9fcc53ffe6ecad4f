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

/// A maximal stretch of equal values in a `boolean[]`.
///
/// @param start index of the first element of the run, or -1 for [#NONE]
/// @param length number of elements in the run
public record Run(int start, int length) {

    /// Returned when an array holds no run of the requested value.
    public static final Run NONE = new Run(-1, 0);

    /// @return the index just past the last element of the run
    public int end() {
        return start + length;
    }
}
