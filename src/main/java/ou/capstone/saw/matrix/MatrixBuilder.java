package ou.capstone.saw.matrix;

import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;

import ou.capstone.saw.exceptions.SawException;

/**
 * Builds the criterion-major decision matrix from the records being ranked.
 */
@FunctionalInterface
public interface MatrixBuilder {

    /**
     * Builds the decision matrix.
     *
     * @param records alternatives, one record each
     * @param criteriaCount number of criterion rows to produce
     * @param criteriaNames field names of the criteria, in row order
     * @param pivotIndex row that will be normalized benefit-style
     * @return a matrix with {@code criteriaCount} rows and one column per record
     * @throws SawException if the records cannot be turned into a matrix
     */
    Matrix build(List<ObjectNode> records,
                 int criteriaCount,
                 List<String> criteriaNames,
                 int pivotIndex) throws SawException;
}
