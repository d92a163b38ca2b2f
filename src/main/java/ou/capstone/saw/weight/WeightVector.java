package ou.capstone.saw.weight;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import ou.capstone.saw.exceptions.DimensionMismatchException;

/**
 * Ordered criterion weights. Position {@code j} is the weight of criterion
 * column {@code j} of the alternative-major matrix.
 */
public final class WeightVector {
    private final double[] weights;

    private WeightVector(final double[] weights) {
        this.weights = weights;
    }

    public static WeightVector of(final double... weights) {
        if (weights == null) {
            throw new IllegalArgumentException("weights must not be null");
        }
        return new WeightVector(weights.clone());
    }

    public static WeightVector of(final List<Double> weights) {
        if (weights == null) {
            throw new IllegalArgumentException("weights must not be null");
        }
        final double[] w = new double[weights.size()];
        for (int i = 0; i < w.length; i++) {
            final Double value = weights.get(i);
            if (value == null) {
                throw new IllegalArgumentException("Weight " + i + " is null");
            }
            w[i] = value;
        }
        return new WeightVector(w);
    }

    /**
     * Orders a name-keyed weight map by the criterion names, so weight
     * {@code j} belongs to {@code criteriaNames.get(j)}.
     *
     * @throws DimensionMismatchException if the map has more or fewer entries than there are names
     * @throws IllegalArgumentException if a name has no weight
     */
    public static WeightVector byName(final List<String> criteriaNames, final Map<String, Double> weights)
            throws DimensionMismatchException {
        if (criteriaNames == null || weights == null) {
            throw new IllegalArgumentException("criteriaNames and weights must not be null");
        }
        if (weights.size() != criteriaNames.size()) {
            throw new DimensionMismatchException("Weight count", criteriaNames.size(), weights.size());
        }
        final List<Double> ordered = new ArrayList<>(criteriaNames.size());
        for (final String name : criteriaNames) {
            final Double w = weights.get(name);
            if (w == null) {
                throw new IllegalArgumentException("No weight for criterion '" + name + "'");
            }
            ordered.add(w);
        }
        return of(ordered);
    }

    public int size() {
        return weights.length;
    }

    public double get(final int column) {
        return weights[column];
    }

    /** Every weight multiplied by {@code factor}. */
    public WeightVector scale(final double factor) {
        final double[] scaled = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            scaled[i] = weights[i] * factor;
        }
        return new WeightVector(scaled);
    }

    public double sum() {
        double total = 0.0;
        for (final double w : weights) {
            total += w;
        }
        return total;
    }

    @Override
    public String toString() {
        return Arrays.toString(weights);
    }
}
