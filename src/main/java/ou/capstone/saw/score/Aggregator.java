package ou.capstone.saw.score;

import java.util.Objects;

import ou.capstone.saw.matrix.Matrix;

/**
 * Sums the weighted contributions of each alternative into one score.
 * The sum is not normalized, so it scales with the total of the weights.
 */
public final class Aggregator {

    public ScoreVector aggregate(final Matrix weighted) {
        Objects.requireNonNull(weighted, "weighted");
        final double[] scores = new double[weighted.rows()];
        for (int a = 0; a < weighted.rows(); a++) {
            double total = 0.0;
            for (int c = 0; c < weighted.columns(); c++) {
                total += weighted.get(a, c);
            }
            scores[a] = total;
        }
        return ScoreVector.of(scores);
    }
}
