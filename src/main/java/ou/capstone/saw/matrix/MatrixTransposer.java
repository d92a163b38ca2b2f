package ou.capstone.saw.matrix;

import java.util.Objects;

/** Default {@link Transposer}: a plain rows-to-columns flip. */
public final class MatrixTransposer implements Transposer {

    @Override
    public Matrix transpose(final Matrix matrix) {
        return Objects.requireNonNull(matrix, "matrix").transpose();
    }
}
