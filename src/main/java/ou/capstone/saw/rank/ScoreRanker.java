package ou.capstone.saw.rank;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;

/**
 * Orders scored records best first.
 *
 * Records are sorted by the score field, highest first. Equal scores keep
 * their input order, and records without a numeric score go last.
 */
public final class ScoreRanker {

    private static final int DISPLAY_SCALE = 3;

    private final String fieldName;

    public ScoreRanker(final String fieldName) {
        if (StringUtils.isBlank(fieldName)) {
            throw new IllegalArgumentException("fieldName must not be blank");
        }
        this.fieldName = fieldName;
    }

    /** Return a new list of records sorted by descending score. */
    public List<ObjectNode> rank(final List<ObjectNode> scored) {
        final List<ObjectNode> copy = new ArrayList<>(scored);
        // List.sort is stable, so ties stay in input order
        copy.sort(Comparator.comparing(this::scoreOf,
                Comparator.nullsLast(Comparator.<Double>reverseOrder())));
        return copy;
    }

    /** Score stored on the record, or null if it has none. */
    public Double scoreOf(final ObjectNode record) {
        if (record == null) {
            return null;
        }
        final JsonNode n = record.get(fieldName);
        return (n == null || !n.isNumber()) ? null : n.doubleValue();
    }

    /**
     * Rounds a score for display, like "0.267".
     * Keeps formatting out of the scoring itself.
     */
    public static double scoreForDisplay(final double score) {
        return BigDecimal.valueOf(score).setScale(DISPLAY_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
