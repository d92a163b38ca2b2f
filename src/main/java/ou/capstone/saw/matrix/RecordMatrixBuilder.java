package ou.capstone.saw.matrix;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.saw.exceptions.DimensionMismatchException;
import ou.capstone.saw.exceptions.InvalidRecordException;

/**
 * Reads one numeric field per criterion from every record.
 * Row {@code i} of the result holds the values of {@code criteriaNames.get(i)}.
 * The pivot index plays no part in building the matrix.
 */
public final class RecordMatrixBuilder implements MatrixBuilder {
    private static final Logger logger = LoggerFactory.getLogger(RecordMatrixBuilder.class);

    @Override
    public Matrix build(final List<ObjectNode> records,
                        final int criteriaCount,
                        final List<String> criteriaNames,
                        final int pivotIndex) throws DimensionMismatchException, InvalidRecordException {
        if (records == null || criteriaNames == null) {
            throw new IllegalArgumentException("records and criteriaNames must not be null");
        }
        if (criteriaCount < 1) {
            throw new IllegalArgumentException("criteriaCount must be at least 1");
        }
        if (criteriaNames.size() < criteriaCount) {
            throw new DimensionMismatchException("Criterion names", criteriaCount, criteriaNames.size());
        }

        final double[][] values = new double[criteriaCount][records.size()];
        for (int c = 0; c < criteriaCount; c++) {
            final String field = criteriaNames.get(c);
            for (int a = 0; a < records.size(); a++) {
                values[c][a] = readNumber(records.get(a), a, field);
            }
        }
        logger.debug("Built {}x{} decision matrix", criteriaCount, records.size());
        return Matrix.of(records.size(), values);
    }

    private static double readNumber(final ObjectNode record, final int index, final String field)
            throws InvalidRecordException {
        final JsonNode n = (record == null) ? null : record.get(field);
        if (n == null || n.isNull()) {
            throw new InvalidRecordException(index, field);
        }
        final double value;
        if (n.isNumber()) {
            value = n.doubleValue();
        } else if (n.isTextual()) {
            try {
                value = Double.parseDouble(n.asText().trim());
            } catch (final NumberFormatException e) {
                logger.warn("Record {} field '{}' is not numeric: {}", index, field, e.getMessage());
                throw new InvalidRecordException(index, field, e);
            }
        } else {
            throw new InvalidRecordException(index, field);
        }
        if (!Double.isFinite(value)) {
            throw new InvalidRecordException(index, field);
        }
        return value;
    }
}
