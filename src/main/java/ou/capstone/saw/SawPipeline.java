package ou.capstone.saw;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.saw.exceptions.DimensionMismatchException;
import ou.capstone.saw.exceptions.SawException;
import ou.capstone.saw.matrix.Matrix;
import ou.capstone.saw.matrix.MatrixBuilder;
import ou.capstone.saw.matrix.MatrixTransposer;
import ou.capstone.saw.matrix.RecordMatrixBuilder;
import ou.capstone.saw.matrix.Transposer;
import ou.capstone.saw.normalize.Normalizer;
import ou.capstone.saw.rank.ScoreRanker;
import ou.capstone.saw.score.Aggregator;
import ou.capstone.saw.score.ResultMerger;
import ou.capstone.saw.score.ScoreVector;
import ou.capstone.saw.weight.WeightVector;
import ou.capstone.saw.weight.WeightingEngine;

/**
 * Simple Additive Weighting driver.
 *
 * Orchestrates the flow between components:
 * - Decision matrix construction (MatrixBuilder)
 * - Normalization (Normalizer)
 * - Transposition to alternative-major (Transposer)
 * - Weighting (WeightingEngine)
 * - Aggregation (Aggregator)
 * - Merging the score back into each record (ResultMerger)
 *
 * The first failing stage aborts the run; no partial result is returned.
 * Instances hold no per-run state and can be shared between threads.
 */
public final class SawPipeline {
    private static final Logger logger = LoggerFactory.getLogger(SawPipeline.class);

    private final SawConfig config;
    private final MatrixBuilder matrixBuilder;
    private final Transposer transposer;
    private final Normalizer normalizer;
    private final WeightingEngine weightingEngine;
    private final Aggregator aggregator;
    private final ResultMerger resultMerger;

    /** Default wiring: record field reader, plain transpose, default config. */
    public SawPipeline() {
        this(new SawConfig());
    }

    public SawPipeline(final SawConfig config) {
        this(config, new RecordMatrixBuilder(), new MatrixTransposer());
    }

    /**
     * Full constructor, used by tests to substitute the matrix collaborators.
     */
    public SawPipeline(final SawConfig config,
                       final MatrixBuilder matrixBuilder,
                       final Transposer transposer) {
        this.config = Objects.requireNonNull(config, "config");
        this.matrixBuilder = Objects.requireNonNull(matrixBuilder, "matrixBuilder");
        this.transposer = Objects.requireNonNull(transposer, "transposer");
        this.normalizer = new Normalizer(config.getScale());
        this.weightingEngine = new WeightingEngine();
        this.aggregator = new Aggregator();
        this.resultMerger = new ResultMerger();
    }

    /**
     * Scores the records, storing each score under the configured output field.
     *
     * @see #runSaw(List, int, int, List, WeightVector, String)
     */
    public List<ObjectNode> runSaw(final List<ObjectNode> records,
                                   final int criteriaCount,
                                   final int pivotIndex,
                                   final List<String> criteriaNames,
                                   final WeightVector weights) throws SawException {
        return runSaw(records, criteriaCount, pivotIndex, criteriaNames, weights, config.getOutputField());
    }

    /**
     * Scores the records.
     *
     * @param records alternatives to score, left unmodified
     * @param criteriaCount number of criteria
     * @param pivotIndex criterion normalized benefit-style; all others are cost-style
     * @param criteriaNames record fields holding the criteria, in weight order
     * @param weights one weight per criterion
     * @param outputField field the score is stored under
     * @return copies of the records, in input order, each with the score field set
     * @throws SawException if any stage fails
     */
    public List<ObjectNode> runSaw(final List<ObjectNode> records,
                                   final int criteriaCount,
                                   final int pivotIndex,
                                   final List<String> criteriaNames,
                                   final WeightVector weights,
                                   final String outputField) throws SawException {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(weights, "weights");
        logger.info("SAW run starting: {} alternatives, {} criteria, pivot {}",
                records.size(), criteriaCount, pivotIndex);

        try {
            final Matrix decision = matrixBuilder.build(records, criteriaCount, criteriaNames, pivotIndex);
            if (decision.rows() != criteriaCount) {
                throw new DimensionMismatchException("Decision matrix rows", criteriaCount, decision.rows());
            }
            logger.debug("Decision matrix {}", decision);

            final Matrix normalized = normalizer.normalize(decision, pivotIndex);
            logger.debug("Normalized matrix {}", normalized);

            final Matrix alternativeMajor = transposer.transpose(normalized);
            final Matrix weighted = weightingEngine.applyWeights(alternativeMajor, weights);
            final ScoreVector scores = aggregator.aggregate(weighted);
            logger.debug("Scores {}", scores);

            final List<ObjectNode> result = resultMerger.merge(records, scores, outputField);
            logger.info("SAW run completed: {} records scored into '{}'", result.size(), outputField);
            return result;
        } catch (final SawException e) {
            logger.error("SAW run failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Scores the records and returns them best first.
     */
    public List<ObjectNode> rank(final List<ObjectNode> records,
                                 final int criteriaCount,
                                 final int pivotIndex,
                                 final List<String> criteriaNames,
                                 final WeightVector weights) throws SawException {
        final List<ObjectNode> scored = runSaw(records, criteriaCount, pivotIndex, criteriaNames, weights);
        return new ScoreRanker(config.getOutputField()).rank(scored);
    }
}
