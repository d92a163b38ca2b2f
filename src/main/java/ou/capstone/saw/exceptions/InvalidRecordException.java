package ou.capstone.saw.exceptions;

/**
 * Thrown when a record lacks a numeric value for one of the criterion fields.
 */
public class InvalidRecordException extends SawException
{
    private final int recordIndex;
    private final String field;

    public InvalidRecordException( final int recordIndex, final String field )
    {
        super( "Record " + recordIndex + " has no numeric value for field '" + field + "'" );
        this.recordIndex = recordIndex;
        this.field = field;
    }

    public InvalidRecordException( final int recordIndex, final String field, final Exception cause )
    {
        super( "Record " + recordIndex + " has no numeric value for field '" + field + "'", cause );
        this.recordIndex = recordIndex;
        this.field = field;
    }

    public int getRecordIndex()
    {
        return recordIndex;
    }

    public String getField()
    {
        return field;
    }
}
