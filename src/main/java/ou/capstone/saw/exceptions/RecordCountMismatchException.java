package ou.capstone.saw.exceptions;

public class RecordCountMismatchException extends SawException
{
    private final int recordCount;
    private final int scoreCount;

    public RecordCountMismatchException( final int recordCount, final int scoreCount )
    {
        super( "Record count " + recordCount + " does not match score count " + scoreCount );
        this.recordCount = recordCount;
        this.scoreCount = scoreCount;
    }

    public int getRecordCount()
    {
        return recordCount;
    }

    public int getScoreCount()
    {
        return scoreCount;
    }
}
