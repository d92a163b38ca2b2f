package ou.capstone.saw.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.saw.SawConfig;
import ou.capstone.saw.exceptions.NormalizationException;
import ou.capstone.saw.matrix.Matrix;

/**
 * Rescales each criterion row of a criterion-major decision matrix according
 * to the rule its {@link NormalizationPolicy} assigns, rounding every value
 * half-up to a fixed number of decimal places.
 */
public final class Normalizer {
    private static final Logger logger = LoggerFactory.getLogger(Normalizer.class);

    private final int scale;

    /** Rounds to {@link SawConfig#DEFAULT_SCALE} decimal places. */
    public Normalizer() {
        this(SawConfig.DEFAULT_SCALE);
    }

    public Normalizer(final int scale) {
        if (scale < 0) {
            throw new IllegalArgumentException("scale must not be negative: " + scale);
        }
        this.scale = scale;
    }

    public int getScale() {
        return scale;
    }

    /**
     * Normalizes with the pivot row benefit-style and all other rows cost-style.
     *
     * @throws IllegalArgumentException if the matrix is empty or the pivot is out of range
     * @throws NormalizationException if a divisor is zero
     */
    public Matrix normalize(final Matrix matrix, final int pivotIndex) throws NormalizationException {
        Objects.requireNonNull(matrix, "matrix");
        if (pivotIndex < 0 || pivotIndex >= matrix.rows()) {
            throw new IllegalArgumentException("pivotIndex " + pivotIndex
                    + " out of range for " + matrix.rows() + " criteria");
        }
        return normalize(matrix, new PivotNormalizationPolicy(pivotIndex));
    }

    /**
     * Normalizes every row with the rule chosen by the policy.
     *
     * @throws IllegalArgumentException if the matrix has no rows
     * @throws NormalizationException if a divisor is zero
     */
    public Matrix normalize(final Matrix matrix, final NormalizationPolicy policy) throws NormalizationException {
        Objects.requireNonNull(matrix, "matrix");
        Objects.requireNonNull(policy, "policy");
        if (matrix.rows() == 0) {
            throw new IllegalArgumentException("Decision matrix has no criteria");
        }

        final double[][] out = new double[matrix.rows()][];
        for (int c = 0; c < matrix.rows(); c++) {
            final NormalizationRule rule = Objects.requireNonNull(policy.ruleFor(c), "rule for criterion " + c);
            out[c] = normalizeRow(matrix.row(c), c, rule);
            logger.debug("Criterion {} normalized {}", c, rule);
        }
        return Matrix.of(matrix.columns(), out);
    }

    private double[] normalizeRow(final double[] row, final int criterion, final NormalizationRule rule)
            throws NormalizationException {
        final double[] result = new double[row.length];
        if (row.length == 0) {
            return result;
        }
        double min = row[0];
        double max = row[0];
        for (final double v : row) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        for (int a = 0; a < row.length; a++) {
            final double rescaled = rule.rescale(row[a], min, max, criterion, a);
            if (!Double.isFinite(rescaled)) {
                throw new NormalizationException(criterion, a, "result is not a finite number");
            }
            result[a] = round(rescaled);
        }
        return result;
    }

    double round(final double value) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
