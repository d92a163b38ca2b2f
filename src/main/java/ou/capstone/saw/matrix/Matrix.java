package ou.capstone.saw.matrix;

import java.util.Arrays;

/**
 * Immutable rectangular table of doubles.
 *
 * The row and column counts are kept explicitly, so a matrix with no rows
 * (for example a transposed matrix with zero alternatives) still knows how
 * many columns it has. The meaning of rows and columns depends on the stage:
 * a decision matrix is criterion-major, a weighted matrix is alternative-major.
 */
public final class Matrix {
    private final int rows;
    private final int columns;
    private final double[][] values;

    private Matrix(final int rows, final int columns, final double[][] values) {
        this.rows = rows;
        this.columns = columns;
        this.values = values;
    }

    /**
     * Copies the given rows into a new matrix.
     *
     * @param values row arrays, all of the same length
     * @throws IllegalArgumentException if the rows are ragged
     */
    public static Matrix of(final double[]... values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        final int columns = values.length == 0 ? 0 : values[0].length;
        return of(columns, values);
    }

    /**
     * Copies the given rows into a new matrix with an explicit column count,
     * which is what keeps the column count of a matrix with zero rows.
     */
    public static Matrix of(final int columns, final double[]... values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (columns < 0) {
            throw new IllegalArgumentException("columns must not be negative");
        }
        final double[][] copy = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            if (values[r] == null || values[r].length != columns) {
                throw new IllegalArgumentException("Row " + r + " does not have " + columns + " columns");
            }
            copy[r] = values[r].clone();
        }
        return new Matrix(values.length, columns, copy);
    }

    /** Matrix of the given shape filled with zeroes. */
    public static Matrix empty(final int rows, final int columns) {
        return new Matrix(rows, columns, new double[rows][columns]);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public double get(final int row, final int column) {
        return values[row][column];
    }

    /** Returns a copy of one row. */
    public double[] row(final int row) {
        return values[row].clone();
    }

    /** Returns a deep copy of the underlying values. */
    public double[][] toArray() {
        final double[][] copy = new double[rows][];
        for (int r = 0; r < rows; r++) {
            copy[r] = values[r].clone();
        }
        return copy;
    }

    /** Rows become columns. */
    public Matrix transpose() {
        final double[][] flipped = new double[columns][rows];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                flipped[c][r] = values[r][c];
            }
        }
        return new Matrix(columns, rows, flipped);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Matrix)) {
            return false;
        }
        final Matrix other = (Matrix) o;
        return rows == other.rows && columns == other.columns
                && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "Matrix" + rows + "x" + columns + Arrays.deepToString(values);
    }
}
