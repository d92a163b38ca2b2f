package ou.capstone.saw.normalize;

/**
 * Exactly one pivot row is benefit-style; every other row is cost-style.
 * A second benefit-style row cannot be expressed with this policy.
 */
public final class PivotNormalizationPolicy implements NormalizationPolicy {

    private final int pivotIndex;

    public PivotNormalizationPolicy(final int pivotIndex) {
        if (pivotIndex < 0) {
            throw new IllegalArgumentException("pivotIndex must not be negative: " + pivotIndex);
        }
        this.pivotIndex = pivotIndex;
    }

    @Override
    public NormalizationRule ruleFor(final int criterion) {
        return criterion == pivotIndex
                ? NormalizationRule.BENEFIT_STYLE
                : NormalizationRule.COST_STYLE;
    }
}
