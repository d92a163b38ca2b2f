package ou.capstone.saw.score;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;

import ou.capstone.saw.exceptions.RecordCountMismatchException;

/**
 * Writes each alternative's score back onto a copy of its original record.
 */
public final class ResultMerger {

    /**
     * @param records original records, left untouched
     * @param scores one score per record, same order
     * @param fieldName field the score is stored under; an existing value is overwritten
     * @return deep copies of the records with the score field set, in input order
     * @throws RecordCountMismatchException if the record and score counts differ
     */
    public List<ObjectNode> merge(final List<ObjectNode> records,
                                  final ScoreVector scores,
                                  final String fieldName) throws RecordCountMismatchException {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(scores, "scores");
        if (StringUtils.isBlank(fieldName)) {
            throw new IllegalArgumentException("fieldName must not be blank");
        }
        if (records.size() != scores.size()) {
            throw new RecordCountMismatchException(records.size(), scores.size());
        }

        final List<ObjectNode> merged = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            final ObjectNode copy = records.get(i).deepCopy();
            copy.put(fieldName, scores.get(i));
            merged.add(copy);
        }
        return merged;
    }
}
