/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

/**
    What happened to one line: a status, and the character offset in that line where it was decided.
    For SUCCESS the offset is 0.
**/
public class ParseOutcome
{
    public final ParserStatus status;
    public final int          position;

    public static final ParseOutcome SUCCESS             = new ParseOutcome (ParserStatus.SUCCESS,             0);
    public static final ParseOutcome SUCCESS_NO_EQUATION = new ParseOutcome (ParserStatus.SUCCESS_NO_EQUATION, 0);

    public ParseOutcome (ParserStatus status, int position)
    {
        this.status   = status;
        this.position = position;
    }

    public boolean isError ()
    {
        return status.isError ();
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof ParseOutcome)) return false;
        ParseOutcome that = (ParseOutcome) o;
        return status == that.status  &&  position == that.position;
    }

    public int hashCode ()
    {
        return status.hashCode () * 31 + position;
    }

    public String toString ()
    {
        return status + "@" + position;
    }
}
