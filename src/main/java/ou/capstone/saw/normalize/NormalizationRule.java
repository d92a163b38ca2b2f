package ou.capstone.saw.normalize;

import ou.capstone.saw.exceptions.NormalizationException;

/**
 * How one criterion row is rescaled.
 */
public enum NormalizationRule {

    /** value / max(row). Higher raw values are better. */
    BENEFIT_STYLE {
        @Override
        double rescale(final double value, final double min, final double max,
                       final int criterion, final int alternative) throws NormalizationException {
            if (max == 0.0) {
                throw new NormalizationException(criterion, alternative, "row maximum is zero");
            }
            return value / max;
        }
    },

    /** min(row) / value. Lower raw values are better. */
    COST_STYLE {
        @Override
        double rescale(final double value, final double min, final double max,
                       final int criterion, final int alternative) throws NormalizationException {
            if (value == 0.0) {
                throw new NormalizationException(criterion, alternative, "raw value is zero");
            }
            return min / value;
        }
    };

    abstract double rescale(double value, double min, double max,
                            int criterion, int alternative) throws NormalizationException;
}
