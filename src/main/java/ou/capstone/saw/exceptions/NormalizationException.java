package ou.capstone.saw.exceptions;

/**
 * Thrown when a criterion row cannot be normalized because a divisor is zero.
 */
public class NormalizationException extends SawException
{
    private final int criterion;
    private final int alternative;

    public NormalizationException( final int criterion, final int alternative, final String reason )
    {
        super( "Cannot normalize criterion " + criterion + ", alternative "
                + alternative + ": " + reason );
        this.criterion = criterion;
        this.alternative = alternative;
    }

    public int getCriterion()
    {
        return criterion;
    }

    public int getAlternative()
    {
        return alternative;
    }
}
