package ou.capstone.saw.weight;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.saw.exceptions.DimensionMismatchException;
import ou.capstone.saw.matrix.Matrix;

/**
 * Multiplies every normalized value by the weight of its criterion column.
 */
public final class WeightingEngine {
    private static final Logger logger = LoggerFactory.getLogger(WeightingEngine.class);
    private static final double WEIGHT_SUM_TOLERANCE = 1e-9;

    /**
     * @param alternativeMajor normalized values, one row per alternative
     * @param weights one weight per criterion column
     * @return the weighted matrix, same shape as the input
     * @throws DimensionMismatchException if the weight count differs from the column count
     */
    public Matrix applyWeights(final Matrix alternativeMajor, final WeightVector weights)
            throws DimensionMismatchException {
        Objects.requireNonNull(alternativeMajor, "alternativeMajor");
        Objects.requireNonNull(weights, "weights");
        if (alternativeMajor.columns() != weights.size()) {
            throw new DimensionMismatchException("Weight count",
                    alternativeMajor.columns(), weights.size());
        }
        if (Math.abs(weights.sum() - 1.0) > WEIGHT_SUM_TOLERANCE) {
            logger.debug("Weights sum to {}, scores are not bounded by 1", weights.sum());
        }

        final double[][] out = new double[alternativeMajor.rows()][alternativeMajor.columns()];
        for (int a = 0; a < alternativeMajor.rows(); a++) {
            for (int c = 0; c < alternativeMajor.columns(); c++) {
                out[a][c] = alternativeMajor.get(a, c) * weights.get(c);
            }
        }
        return Matrix.of(alternativeMajor.columns(), out);
    }
}
