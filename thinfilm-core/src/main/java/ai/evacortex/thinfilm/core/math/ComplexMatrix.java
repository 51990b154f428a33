/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.math;

import ai.evacortex.thinfilm.core.exceptions.DimensionMismatchException;
import ai.evacortex.thinfilm.core.exceptions.SingularMatrixException;
import ai.evacortex.thinfilm.core.exceptions.UnsupportedMatrixOperationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Small dense matrix of {@link Complex} entries, row-major and immutable.
 *
 * <p>Every arithmetic operator checks shapes before computing and throws
 * {@link DimensionMismatchException} on incompatible operands. {@link #determinant()} and
 * {@link #inverse()} are defined for 2×2 matrices only, which is all a single film layer needs.</p>
 */
public final class ComplexMatrix {

    private final Complex[][] cells;
    private final int rows;
    private final int columns;

    private ComplexMatrix(Complex[][] cells, int rows, int columns) {
        this.cells = cells;
        this.rows = rows;
        this.columns = columns;
    }

    /**
     * Copies {@code grid} into a new matrix. All rows must have the same length.
     */
    public static ComplexMatrix of(Complex[][] grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        if (grid.length == 0 || grid[0].length == 0) {
            throw new IllegalArgumentException("Matrix must have at least one row and one column");
        }
        int cols = grid[0].length;
        Complex[][] copy = new Complex[grid.length][];
        for (int i = 0; i < grid.length; i++) {
            if (grid[i].length != cols) {
                throw new IllegalArgumentException("Ragged row " + i + ": " + grid[i].length + " vs " + cols);
            }
            copy[i] = new Complex[cols];
            for (int j = 0; j < cols; j++) {
                copy[i][j] = Objects.requireNonNull(grid[i][j], "matrix cell must not be null");
            }
        }
        return new ComplexMatrix(copy, grid.length, cols);
    }

    public static ComplexMatrix of2x2(Complex m00, Complex m01, Complex m10, Complex m11) {
        return of(new Complex[][]{{m00, m01}, {m10, m11}});
    }

    public static ComplexMatrix zeros(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Invalid matrix shape " + rows + "x" + columns);
        }
        Complex[][] grid = new Complex[rows][columns];
        for (Complex[] row : grid) {
            Arrays.fill(row, Complex.ZERO);
        }
        return new ComplexMatrix(grid, rows, columns);
    }

    public static ComplexMatrix identity(int size) {
        Complex[][] grid = zeros(size, size).cells;
        for (int i = 0; i < size; i++) {
            grid[i][i] = Complex.ONE;
        }
        return new ComplexMatrix(grid, size, size);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public Complex get(int row, int column) {
        return cells[row][column];
    }

    public ComplexMatrix multiply(ComplexMatrix other) {
        if (this.columns != other.rows) {
            throw new DimensionMismatchException("multiplication", rows, columns, other.rows, other.columns);
        }
        Complex[][] result = new Complex[rows][other.columns];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < other.columns; j++) {
                Complex sum = Complex.ZERO;
                for (int k = 0; k < columns; k++) {
                    sum = sum.add(cells[i][k].multiply(other.cells[k][j]));
                }
                result[i][j] = sum;
            }
        }
        return new ComplexMatrix(result, rows, other.columns);
    }

    public Outcome<ComplexMatrix> tryMultiply(ComplexMatrix other) {
        return Outcome.attempt(() -> multiply(other));
    }

    public ComplexMatrix add(ComplexMatrix other) {
        requireSameShape("addition", other);
        Complex[][] result = new Complex[rows][columns];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result[i][j] = cells[i][j].add(other.cells[i][j]);
            }
        }
        return new ComplexMatrix(result, rows, columns);
    }

    public Outcome<ComplexMatrix> tryAdd(ComplexMatrix other) {
        return Outcome.attempt(() -> add(other));
    }

    public ComplexMatrix subtract(ComplexMatrix other) {
        requireSameShape("subtraction", other);
        Complex[][] result = new Complex[rows][columns];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result[i][j] = cells[i][j].subtract(other.cells[i][j]);
            }
        }
        return new ComplexMatrix(result, rows, columns);
    }

    public Outcome<ComplexMatrix> trySubtract(ComplexMatrix other) {
        return Outcome.attempt(() -> subtract(other));
    }

    public ComplexMatrix transpose() {
        Complex[][] result = new Complex[columns][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result[j][i] = cells[i][j];
            }
        }
        return new ComplexMatrix(result, columns, rows);
    }

    public Complex determinant() {
        requireTwoByTwo("Determinant");
        return cells[0][0].multiply(cells[1][1]).subtract(cells[0][1].multiply(cells[1][0]));
    }

    public Outcome<Complex> tryDeterminant() {
        return Outcome.attempt(this::determinant);
    }

    /**
     * Inverse of ⟦a b; c d⟧ as ⟦d/Δ, −b/Δ; −c/Δ, a/Δ⟧ with Δ = ad − bc.
     *
     * @throws UnsupportedMatrixOperationException if the matrix is not 2×2
     * @throws SingularMatrixException if {@code |Δ|² < 1e-15}
     */
    public ComplexMatrix inverse() {
        requireTwoByTwo("Matrix inversion");
        Complex det = determinant();
        if (det.absSquared() < Complex.SINGULARITY_EPSILON) {
            throw new SingularMatrixException("determinant " + det);
        }
        return of2x2(
                cells[1][1].divide(det), cells[0][1].divide(det).negate(),
                cells[1][0].divide(det).negate(), cells[0][0].divide(det));
    }

    public Outcome<ComplexMatrix> tryInverse() {
        return Outcome.attempt(this::inverse);
    }

    public boolean approximatelyEquals(ComplexMatrix other, double epsilon) {
        if (rows != other.rows || columns != other.columns) return false;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                if (!cells[i][j].approximatelyEquals(other.cells[i][j], epsilon)) return false;
            }
        }
        return true;
    }

    private void requireSameShape(String operation, ComplexMatrix other) {
        if (rows != other.rows || columns != other.columns) {
            throw new DimensionMismatchException(operation, rows, columns, other.rows, other.columns);
        }
    }

    private void requireTwoByTwo(String operation) {
        if (rows != 2 || columns != 2) {
            throw new UnsupportedMatrixOperationException(operation, rows, columns);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                sb.append(cells[i][j]).append('\t');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComplexMatrix)) return false;
        ComplexMatrix other = (ComplexMatrix) obj;
        return rows == other.rows && columns == other.columns && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }
}
