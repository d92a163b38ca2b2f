package ou.capstone.saw.score;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import ou.capstone.saw.matrix.Matrix;
import ou.capstone.saw.weight.WeightVector;
import ou.capstone.saw.weight.WeightingEngine;

class AggregatorTest {

    private final Aggregator aggregator = new Aggregator();

    @Test
    void sumsEachAlternativeRow() {
        Matrix weighted = Matrix.of(
                new double[] {0.1665, 0.1},
                new double[] {0.3335, 0.1665},
                new double[] {0.5, 0.5});

        ScoreVector scores = aggregator.aggregate(weighted);

        assertArrayEquals(new double[] {0.2665, 0.5, 1.0}, scores.toArray(), 1e-9);
    }

    @Test
    void sumIsNotNormalized() {
        ScoreVector scores = aggregator.aggregate(Matrix.of(new double[] {2.0, 3.5}));

        assertEquals(5.5, scores.get(0), 1e-12);
    }

    @Test
    void scalingWeightsScalesScores() throws Exception {
        Matrix normalized = Matrix.of(
                new double[] {0.333, 0.2, 0.75},
                new double[] {0.667, 0.333, 1.0},
                new double[] {1.0, 1.0, 0.4});
        WeightVector weights = WeightVector.of(0.2, 0.3, 0.5);
        WeightingEngine engine = new WeightingEngine();

        for (double k : new double[] {0.0, 0.5, 3.0, 10.0}) {
            ScoreVector base = aggregator.aggregate(engine.applyWeights(normalized, weights));
            ScoreVector scaled = aggregator.aggregate(engine.applyWeights(normalized, weights.scale(k)));
            for (int i = 0; i < base.size(); i++) {
                assertEquals(k * base.get(i), scaled.get(i), 1e-9);
            }
        }
    }

    @Test
    void noAlternativesGivesNoScores() {
        assertEquals(0, aggregator.aggregate(Matrix.empty(0, 3)).size());
    }
}
