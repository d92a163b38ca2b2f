package ou.capstone.saw.exceptions;

public class SawException extends Exception
{
    public SawException( final String msg )
    {
        super( msg );
    }

    public SawException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
