package ou.capstone.saw.matrix;

/** Turns a criterion-major matrix into an alternative-major one, and back. */
@FunctionalInterface
public interface Transposer {

    /**
     * Returns the transpose of the matrix. Applying it twice must give back
     * the original matrix.
     */
    Matrix transpose(Matrix matrix);
}
