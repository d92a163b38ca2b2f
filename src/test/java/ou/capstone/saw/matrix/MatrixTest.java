package ou.capstone.saw.matrix;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class MatrixTest {

    @Test
    void transposeSwapsRowsAndColumns() {
        Matrix m = Matrix.of(new double[] {10, 20, 30}, new double[] {5, 3, 1});

        Matrix t = new MatrixTransposer().transpose(m);

        assertEquals(3, t.rows());
        assertEquals(2, t.columns());
        assertArrayEquals(new double[] {20, 3}, t.row(1));
    }

    @Test
    void transposeTwiceGivesBackTheOriginal() {
        Matrix m = Matrix.of(new double[] {1, 2}, new double[] {3, 4}, new double[] {5, 6});
        Transposer transposer = new MatrixTransposer();

        assertEquals(m, transposer.transpose(transposer.transpose(m)));
    }

    @Test
    void emptyMatrixKeepsItsColumnCountThroughTranspose() {
        // two criteria, no alternatives
        Matrix m = Matrix.of(0, new double[0], new double[0]);

        Matrix t = m.transpose();

        assertEquals(0, t.rows());
        assertEquals(2, t.columns());
        assertEquals(m, t.transpose());
    }

    @Test
    void raggedRowsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Matrix.of(new double[] {1, 2}, new double[] {3}));
    }

    @Test
    void callersCannotMutateTheMatrix() {
        double[] row = {1, 2};
        Matrix m = Matrix.of(row);

        row[0] = 99;
        m.row(0)[1] = 99;
        m.toArray()[0][0] = 99;

        assertArrayEquals(new double[] {1, 2}, m.row(0));
    }
}
