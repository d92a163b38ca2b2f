package ou.capstone.saw.weight;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import ou.capstone.saw.exceptions.DimensionMismatchException;
import ou.capstone.saw.matrix.Matrix;

class WeightingEngineTest {

    private final WeightingEngine engine = new WeightingEngine();

    @Test
    void multipliesEachColumnByItsWeight() throws Exception {
        Matrix alternatives = Matrix.of(
                new double[] {0.333, 0.2},
                new double[] {1.0, 1.0});

        Matrix weighted = engine.applyWeights(alternatives, WeightVector.of(0.25, 0.75));

        assertArrayEquals(new double[] {0.08325, 0.15}, weighted.row(0), 1e-12);
        assertArrayEquals(new double[] {0.25, 0.75}, weighted.row(1), 1e-12);
    }

    @Test
    void weightCountMustMatchCriteriaCount() {
        for (int criteria = 1; criteria <= 5; criteria++) {
            Matrix alternatives = Matrix.empty(3, criteria);
            for (int weights : new int[] {criteria - 1, criteria + 1}) {
                WeightVector w = WeightVector.of(new double[weights]);

                DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                        () -> engine.applyWeights(alternatives, w));

                assertEquals(criteria, e.getExpected());
                assertEquals(weights, e.getActual());
            }
        }
    }

    @Test
    void mismatchIsDetectedWithoutAlternatives() {
        Matrix noAlternatives = Matrix.empty(0, 2);

        assertThrows(DimensionMismatchException.class,
                () -> engine.applyWeights(noAlternatives, WeightVector.of(1.0)));
    }
}
