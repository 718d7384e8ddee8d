/*
Copyright 2017-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

import java.io.PrintStream;

/**
    Reports the first problem found in a document, with enough context to point at it.
**/
@SuppressWarnings("serial")
public class ParseException extends Exception
{
    public ParserStatus status;
    public String       line       = "";
    public int          lineNumber = -1;  // 1-based
    public int          column     = -1;  // 0-based offset into line

    public ParseException (ParserStatus status, String line, int lineNumber, int column)
    {
        super (status.message () + " (line " + lineNumber + ", column " + (column + 1) + ")");
        this.status     = status;
        this.line       = line;
        this.lineNumber = lineNumber;
        this.column     = column;
    }

    public void print (PrintStream ps)
    {
        ps.println (getMessage ());
        ps.println (line);
        for (int i = 0; i < column; i++)
        {
            // Copy tabs so the caret lines up with the text above it.
            if (i < line.length ()  &&  line.charAt (i) == '\t') ps.print ("\t");
            else                                                  ps.print (" ");
        }
        ps.println ("^");
    }
}
