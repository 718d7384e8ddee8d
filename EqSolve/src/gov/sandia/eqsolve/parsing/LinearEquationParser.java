/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

import gov.sandia.eqsolve.linear.EquationSystem;
import gov.sandia.eqsolve.parsing.ParserSession.Mode;

import org.apache.log4j.Logger;

/**
    Line-at-a-time parser for a system of linear equations.

    <p>Each call consumes one line and adds whatever terms it finds to an EquationSystem
    owned by the caller. Terms alternate with operators:
    <pre>
    Term:     [+|-] number
              [+|-] variable
              [+|-] number variable
    Operator: +  -  =  =+  =-
    </pre>
    A number is up to 20 characters of digits and at most one decimal point, optionally followed
    by '^' and an exponent of up to two digits, which scales it by a power of 10. A variable is a
    run of letters and underscores. Blanks may separate any of these pieces, except that '^'
    must directly follow its number.</p>

    <p>An equation may continue on the next line, but only after an operator. A line that ends
    on a term closes the current equation. A term can never be split across lines.</p>

    <p>The parser itself holds no per-document state, so one instance may serve any number of
    documents, each with its own ParserSession and EquationSystem.</p>
**/
public class LinearEquationParser
{
    private static Logger logger = Logger.getLogger (LinearEquationParser.class);

    protected ParserLimits  limits;
    protected TermAssembler terms = new TermAssembler ();

    public LinearEquationParser ()
    {
        this (ParserLimits.DEFAULT);
    }

    public LinearEquationParser (ParserLimits limits)
    {
        this.limits = limits;
    }

    public ParserLimits limits ()
    {
        return limits;
    }

    /**
        Parses one line of a document.
        @param line Text of the line, without its line terminator.
        @param session State carried over from the previous line of the same document.
        @param system Receives the terms. Its equationCount is updated when an equation closes.
        @return SUCCESS_NO_EQUATION for a blank line, which changes nothing. Otherwise SUCCESS,
        or the first error found on the line together with the offset of the offending character.
        After an error, parsing of the document should stop. The session is left as it was at the
        point of failure.
    **/
    public ParseOutcome parse (String line, ParserSession session, EquationSystem system)
    {
        if (line == null) throw new IllegalArgumentException ("line must not be null");

        line = trimEnd (line);
        if (line.isEmpty ()) return ParseOutcome.SUCCESS_NO_EQUATION;

        LineScanner scanner = new LineScanner (line, limits);
        scanner.skipSpaces ();
        session.lineStart = scanner.position ();

        boolean operatorFoundLast = false;
        while (! scanner.atEnd ())
        {
            scanner.skipSpaces ();
            if (scanner.atEnd ()) break;

            if (session.mode == Mode.EXPECT_TERM)
            {
                if (! terms.scanTerm (scanner, session, system))
                {
                    if (! scanner.failed ()) scanner.fail (ParserStatus.ILLEGAL_EQUATION);
                    break;
                }
                session.mode = Mode.EXPECT_OPERATOR;
                operatorFoundLast = false;
            }
            else
            {
                if (! scanner.scanOperator (session))
                {
                    // A failed operator scan only reports an error if the scanner recorded one.
                    // Two terms with nothing between them, as in "x y", stop the line without an error.
                    if (scanner.failed ()  &&  scanner.position () == session.lineStart)
                    {
                        scanner.fail (ParserStatus.ILLEGAL_EQUATION);
                    }
                    break;
                }
                session.mode = Mode.EXPECT_TERM;
                operatorFoundLast = true;
            }
        }

        // Whether the line closes the equation depends only on where the scan stopped.
        // An error raised on the last character of a line that did not end on an operator still closes it.
        if (scanner.atEnd ()  &&  scanner.position () > 0  &&  ! operatorFoundLast)
        {
            session.resetForNewEquation ();
            system.equationCount = session.equationIndex;
            if (logger.isDebugEnabled ()) logger.debug ("closed equation " + (session.equationIndex - 1) + ": \"" + line + "\"");
        }

        ParseOutcome outcome = scanner.outcome ();
        if (outcome.isError ())
        {
            if (logger.isDebugEnabled ()) logger.debug (outcome + " in \"" + line + "\"");
        }
        else if (! scanner.atEnd ())
        {
            if (logger.isDebugEnabled ()) logger.debug ("line stopped at " + scanner.position () + " without error: \"" + line + "\"");
        }
        return outcome;
    }

    public static String trimEnd (String line)
    {
        int end = line.length ();
        while (end > 0  &&  Character.isWhitespace (line.charAt (end - 1))) end--;
        return line.substring (0, end);
    }
}
