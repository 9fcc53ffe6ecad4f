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

/// Thrown when an operation over two arrays requires them to be the same length
/// and they are not.
public class LengthMismatchException extends IllegalArgumentException {

    private final int leftLength;
    private final int rightLength;

    public LengthMismatchException(int leftLength, int rightLength) {
        super(String.format("Arrays must have the same length, but were %d and %d.",
            leftLength, rightLength));
        this.leftLength = leftLength;
        this.rightLength = rightLength;
    }

    public int getLeftLength() {
        return leftLength;
    }

    public int getRightLength() {
        return rightLength;
    }
}
