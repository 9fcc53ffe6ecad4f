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

package io.nosqlbench.arrays.temporal;

import java.time.Month;
import java.util.Objects;

/// Meteorological seasons of the northern hemisphere, three whole months each.
public enum Season {
    /// December, January, February
    WINTER,
    /// March, April, May
    SPRING,
    /// June, July, August
    SUMMER,
    /// September, October, November
    AUTUMN;

    public static Season of(Month month) {
        Objects.requireNonNull(month, "month cannot be null");
        switch (month) {
            case DECEMBER:
            case JANUARY:
            case FEBRUARY:
                return WINTER;
            case MARCH:
            case APRIL:
            case MAY:
                return SPRING;
            case JUNE:
            case JULY:
            case AUGUST:
                return SUMMER;
            default:
                return AUTUMN;
        }
    }
}
