/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

/**
    Character-level recognizers for one line of input.

    The scanner owns the read position and the first error raised while reading the line.
    Each scan method starts at the current position, consumes what it recognizes, and
    leaves the position just past it. A method that detects a malformed literal records
    the error with fail() and returns false. The caller checks failed() to tell
    "nothing here" from "something wrong here".
**/
public class LineScanner
{
    protected String       line;
    protected int          length;
    protected int          position;
    protected ParserLimits limits;

    protected ParserStatus status = ParserStatus.SUCCESS;
    protected int          errorPosition;

    public enum Sign
    {
        NONE,
        POSITIVE,
        NEGATIVE;

        public boolean present ()
        {
            return this != NONE;
        }

        public boolean negative ()
        {
            return this == NEGATIVE;
        }
    }

    public LineScanner (String line)
    {
        this (line, ParserLimits.DEFAULT);
    }

    public LineScanner (String line, ParserLimits limits)
    {
        this.line   = line;
        this.limits = limits;
        length      = line.length ();
    }

    public int position ()
    {
        return position;
    }

    public boolean atEnd ()
    {
        return position >= length;
    }

    /**
        @return The character at the current position, or 0 at end of line.
    **/
    public char peek ()
    {
        if (position >= length) return 0;
        return line.charAt (position);
    }

    public ParserLimits limits ()
    {
        return limits;
    }

    public void fail (ParserStatus status)
    {
        fail (status, position);
    }

    public void fail (ParserStatus status, int position)
    {
        this.status   = status;
        errorPosition = position;
    }

    public boolean failed ()
    {
        return status != ParserStatus.SUCCESS;
    }

    public ParserStatus status ()
    {
        return status;
    }

    public ParseOutcome outcome ()
    {
        if (! failed ()) return ParseOutcome.SUCCESS;
        return new ParseOutcome (status, errorPosition);
    }

    public static boolean isDigit (char c)
    {
        return c >= '0'  &&  c <= '9';
    }

    public static boolean isLetter (char c)
    {
        return (c >= 'a'  &&  c <= 'z')  ||  (c >= 'A'  &&  c <= 'Z');
    }

    public void skipSpaces ()
    {
        while (position < length  &&  Character.isWhitespace (line.charAt (position))) position++;
    }

    /**
        Consumes a single '+' or '-' if one is at the current position.
    **/
    public Sign scanSign ()
    {
        char c = peek ();
        if (c == '+')
        {
            position++;
            return Sign.POSITIVE;
        }
        if (c == '-')
        {
            position++;
            return Sign.NEGATIVE;
        }
        return Sign.NONE;
    }

    /**
        Collects a run of digits with at most one decimal point, in any order, so "12.5", ".5" and "12." are all accepted.
        @param number Receives the characters of the literal.
        @return true if at least one digit was found. A lone "." is consumed but does not count as a number.
        Also false if the literal is too long or has a second decimal point, in which case the error is recorded.
    **/
    public boolean scanNumber (StringBuilder number)
    {
        int     maximum    = limits.maximumNumberLength;
        int     digitCount = 0;
        int     pointCount = 0;
        boolean found      = false;
        while (position < length)
        {
            char c = line.charAt (position);
            if (isDigit (c))
            {
                if (++digitCount > maximum)
                {
                    fail (ParserStatus.TOO_MANY_DIGITS);
                    return false;
                }
                found = true;
            }
            else if (c == '.')
            {
                if (++pointCount > 1)
                {
                    fail (ParserStatus.MULTIPLE_DECIMAL_POINTS);
                    return false;
                }
            }
            else
            {
                break;
            }
            number.append (c);
            position++;
        }

        // The decimal point counts against the length too.
        if (number.length () > maximum)
        {
            fail (ParserStatus.TOO_MANY_DIGITS);
            return false;
        }
        return found;
    }

    /**
        Collects a run of ASCII letters and underscores.
        @return true if at least one character was found.
    **/
    public boolean scanVariableName (StringBuilder name)
    {
        int start = position;
        while (position < length)
        {
            char c = line.charAt (position);
            if (! isLetter (c)  &&  c != '_') break;
            name.append (c);
            position++;
        }
        return position > start;
    }

    /**
        Recognizes the operator between two terms: an optional '=' followed by an optional '+' or '-'.
        Updates the session's equal-sign flag and the sign that will apply to the next term.
        @return true if either an equal sign or a sign was found. False with MULTIPLE_EQUAL_SIGNS
        recorded if the current equation already has an equal sign.
    **/
    public boolean scanOperator (ParserSession session)
    {
        skipSpaces ();

        session.negativeOperator = false;
        boolean equalSign = false;
        if (peek () == '=')
        {
            if (session.equalSign)
            {
                fail (ParserStatus.MULTIPLE_EQUAL_SIGNS);
                return false;
            }
            session.equalSign = true;
            equalSign = true;
            position++;
        }

        Sign sign = scanSign ();
        session.negativeOperator = sign.negative ();
        return sign.present ()  ||  equalSign;
    }
}
