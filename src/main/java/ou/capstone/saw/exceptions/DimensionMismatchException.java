package ou.capstone.saw.exceptions;

/**
 * Thrown when the number of weights (or criterion names) does not line up
 * with the number of criterion columns.
 */
public class DimensionMismatchException extends SawException
{
    private final int expected;
    private final int actual;

    public DimensionMismatchException( final String what, final int expected, final int actual )
    {
        super( what + ": expected " + expected + " but got " + actual );
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected()
    {
        return expected;
    }

    public int getActual()
    {
        return actual;
    }
}
