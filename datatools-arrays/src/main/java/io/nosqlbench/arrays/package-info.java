/// Stateless helpers over fixed-size arrays.
///
/// Each subpackage covers one element type or concern. This package holds the
/// argument checks and exceptions they share.
///
/// ## Subpackages
///
/// - `generic`: structural operations, queries and lazy sequences over `T[]`
/// - `numeric`: statistics over `double[]` and `int[]`
/// - `text`: `String[]` and `char[]` helpers
/// - `temporal`: `LocalDateTime[]` grouping and business days
/// - `binary`: encodings, digests and compression over `byte[]`
/// - `logical`: `boolean[]` logic and runs
/// - `identifier`: `UUID[]` formats, ordering and byte layouts
/// - `matrix`: rectangular `T[][]` grids
/// - `random`: seeded and unseeded random sources
package io.nosqlbench.arrays;

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
