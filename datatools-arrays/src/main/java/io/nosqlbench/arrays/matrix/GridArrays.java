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

package io.nosqlbench.arrays.matrix;

import io.nosqlbench.arrays.ArrayChecks;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/// # GridArrays
///
/// Operations over rectangular two-dimensional arrays `T[rows][columns]`.
///
/// Every row must have the same length; a ragged grid, or one with a null
/// row, is rejected with [IllegalArgumentException]. Traversal is row-major.
/// Result grids keep the runtime element type of the input.
///
/// ```java
/// Integer[][] grid = {{1, 2, 3}, {4, 5, 6}};
/// GridArrays.transpose(grid);        // {{1, 4}, {2, 5}, {3, 6}}
/// GridArrays.rotateClockwise(grid);  // {{4, 1}, {5, 2}, {6, 3}}
/// ```
public final class GridArrays {

    private GridArrays() {} // Utility class

    public static <T> int rows(T[][] grid) {
        return requireRectangular(grid).length;
    }

    public static <T> int columns(T[][] grid) {
        requireRectangular(grid);
        return grid.length == 0 ? 0 : grid[0].length;
    }

    /// Visits every cell in row-major order.
    public static <T> void forEach(T[][] grid, Consumer<? super T> action) {
        requireRectangular(grid);
        Objects.requireNonNull(action, "action cannot be null");
        for (T[] row : grid) {
            for (T item : row) {
                action.accept(item);
            }
        }
    }

    public static <T> T[][] transpose(T[][] grid) {
        int rows = rows(grid);
        int columns = columns(grid);
        T[][] result = newGrid(grid, columns, rows);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result[j][i] = grid[i][j];
            }
        }
        return result;
    }

    /// Row-major flattening.
    public static <T> T[] flatten(T[][] grid) {
        int rows = rows(grid);
        int columns = columns(grid);
        T[] result = newRow(grid, rows * columns);
        for (int i = 0; i < rows; i++) {
            System.arraycopy(grid[i], 0, result, i * columns, columns);
        }
        return result;
    }

    /// Copies the grid, passing each non-null cell through `copier`.
    public static <T> T[][] deepCopy(T[][] grid, UnaryOperator<T> copier) {
        int rows = rows(grid);
        int columns = columns(grid);
        Objects.requireNonNull(copier, "copier cannot be null");
        T[][] result = newGrid(grid, rows, columns);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                T item = grid[i][j];
                result[i][j] = item == null ? null : copier.apply(item);
            }
        }
        return result;
    }

    /// @return true when every cell equals the first
    /// @throws IllegalArgumentException if the grid has no cells
    public static <T> boolean allEqual(T[][] grid) {
        if (rows(grid) == 0 || columns(grid) == 0) {
            throw new IllegalArgumentException("grid cannot be empty");
        }
        T first = grid[0][0];
        for (T[] row : grid) {
            for (T item : row) {
                if (!Objects.equals(item, first)) {
                    return false;
                }
            }
        }
        return true;
    }

    public static <T> int countOf(T[][] grid, T item) {
        requireRectangular(grid);
        int count = 0;
        for (T[] row : grid) {
            for (T cell : row) {
                if (Objects.equals(cell, item)) count++;
            }
        }
        return count;
    }

    public static <T> boolean contains(T[][] grid, T item) {
        return findFirst(grid, cell -> Objects.equals(cell, item)).isPresent();
    }

    /// Overwrites every cell in place.
    public static <T> void fill(T[][] grid, T value) {
        requireRectangular(grid);
        for (T[] row : grid) {
            Arrays.fill(row, value);
        }
    }

    /// @return the first matching cell in row-major order
    public static <T> Optional<Cell> findFirst(T[][] grid, Predicate<? super T> match) {
        requireRectangular(grid);
        Objects.requireNonNull(match, "match cannot be null");
        for (int i = 0; i < grid.length; i++) {
            for (int j = 0; j < grid[i].length; j++) {
                if (match.test(grid[i][j])) {
                    return Optional.of(new Cell(i, j));
                }
            }
        }
        return Optional.empty();
    }

    /// @return a copy of row `index`
    public static <T> T[] row(T[][] grid, int index) {
        ArrayChecks.requireIndex(index, rows(grid));
        return grid[index].clone();
    }

    /// @return a copy of column `index`
    public static <T> T[] column(T[][] grid, int index) {
        int rows = rows(grid);
        ArrayChecks.requireIndex(index, columns(grid));
        T[] result = newRow(grid, rows);
        for (int i = 0; i < rows; i++) {
            result[i] = grid[i][index];
        }
        return result;
    }

    /// Rotates a quarter turn clockwise; an `r x c` grid becomes `c x r`.
    public static <T> T[][] rotateClockwise(T[][] grid) {
        int rows = rows(grid);
        int columns = columns(grid);
        T[][] result = newGrid(grid, columns, rows);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result[j][rows - 1 - i] = grid[i][j];
            }
        }
        return result;
    }

    /// Rotates a quarter turn counter-clockwise; an `r x c` grid becomes `c x r`.
    public static <T> T[][] rotateCounterClockwise(T[][] grid) {
        int rows = rows(grid);
        int columns = columns(grid);
        T[][] result = newGrid(grid, columns, rows);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result[columns - 1 - j][i] = grid[i][j];
            }
        }
        return result;
    }

    private static <T> T[][] requireRectangular(T[][] grid) {
        Objects.requireNonNull(grid, "grid cannot be null");
        for (int i = 0; i < grid.length; i++) {
            if (grid[i] == null) {
                throw new IllegalArgumentException("grid row " + i + " is null");
            }
            if (grid[i].length != grid[0].length) {
                throw new IllegalArgumentException("grid is not rectangular: row 0 has "
                    + grid[0].length + " columns but row " + i + " has " + grid[i].length);
            }
        }
        return grid;
    }

    @SuppressWarnings("unchecked")
    private static <T> T[][] newGrid(T[][] like, int rows, int columns) {
        Class<?> elementType = like.getClass().getComponentType().getComponentType();
        return (T[][]) Array.newInstance(elementType, rows, columns);
    }

    @SuppressWarnings("unchecked")
    private static <T> T[] newRow(T[][] like, int length) {
        Class<?> elementType = like.getClass().getComponentType().getComponentType();
        return (T[]) Array.newInstance(elementType, length);
    }
}
