/// Generic array operations.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.arrays.generic.GenericArrays}: copy-on-write structural edits
/// - {@link io.nosqlbench.arrays.generic.ArrayQueries}: predicates, lookups, set operations and folds
/// - {@link io.nosqlbench.arrays.generic.ArraySequences}: permutations, subsets and windows as lazy iterables
package io.nosqlbench.arrays.generic;

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
