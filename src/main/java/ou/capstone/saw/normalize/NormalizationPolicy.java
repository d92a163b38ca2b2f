package ou.capstone.saw.normalize;

/**
 * Assigns a {@link NormalizationRule} to each criterion row of a decision matrix.
 */
@FunctionalInterface
public interface NormalizationPolicy {

    /**
     * @param criterion row index in the decision matrix
     * @return the rule used for that row, never null
     */
    NormalizationRule ruleFor(int criterion);
}
