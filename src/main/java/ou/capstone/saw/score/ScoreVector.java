package ou.capstone.saw.score;

import java.util.Arrays;

/**
 * One final score per alternative, in alternative order.
 */
public final class ScoreVector {
    private final double[] scores;

    private ScoreVector(final double[] scores) {
        this.scores = scores;
    }

    public static ScoreVector of(final double... scores) {
        if (scores == null) {
            throw new IllegalArgumentException("scores must not be null");
        }
        return new ScoreVector(scores.clone());
    }

    public int size() {
        return scores.length;
    }

    public double get(final int alternative) {
        return scores[alternative];
    }

    public double[] toArray() {
        return scores.clone();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof ScoreVector && Arrays.equals(scores, ((ScoreVector) o).scores);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(scores);
    }

    @Override
    public String toString() {
        return Arrays.toString(scores);
    }
}
