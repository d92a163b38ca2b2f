package ou.capstone.saw.score;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import ou.capstone.saw.exceptions.RecordCountMismatchException;

class ResultMergerTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final ResultMerger merger = new ResultMerger();

    private static ObjectNode record(final String name) {
        return mapper.createObjectNode().put("name", name).put("price", 10);
    }

    @Test
    void recordIAlwaysGetsScoreI() throws Exception {
        List<ObjectNode> records = new ArrayList<>();
        double[] raw = new double[20];
        for (int i = 0; i < raw.length; i++) {
            records.add(record("alt-" + i));
            raw[i] = i * 0.05;
        }

        List<ObjectNode> merged = merger.merge(records, ScoreVector.of(raw), "final_result");

        assertEquals(records.size(), merged.size());
        for (int i = 0; i < merged.size(); i++) {
            assertEquals("alt-" + i, merged.get(i).get("name").asText());
            assertEquals(raw[i], merged.get(i).get("final_result").asDouble());
            assertEquals(10, merged.get(i).get("price").asInt());
        }
    }

    @Test
    void originalsAreNotModified() throws Exception {
        ObjectNode original = record("A");

        merger.merge(List.of(original), ScoreVector.of(0.7), "final_result");

        assertFalse(original.has("final_result"));
    }

    @Test
    void existingFieldIsOverwritten() throws Exception {
        ObjectNode original = record("A").put("price", "stale");

        List<ObjectNode> merged = merger.merge(List.of(original), ScoreVector.of(0.42), "price");

        assertEquals(0.42, merged.get(0).get("price").asDouble());
        assertEquals("stale", original.get("price").asText());
    }

    @Test
    void countMismatchIsRejected() {
        RecordCountMismatchException e = assertThrows(RecordCountMismatchException.class,
                () -> merger.merge(List.of(record("A"), record("B")), ScoreVector.of(1.0), "score"));

        assertEquals(2, e.getRecordCount());
        assertEquals(1, e.getScoreCount());
    }

    @Test
    void blankFieldNameIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> merger.merge(List.of(record("A")), ScoreVector.of(1.0), " "));
    }
}
