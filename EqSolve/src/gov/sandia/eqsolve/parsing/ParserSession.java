/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

/**
    Parser state that carries over from one line to the next.

    A document is parsed by handing each of its lines, in order, to
    LinearEquationParser.parse() along with the same session. This is what lets
    an equation continue onto the next line after a trailing operator.
    Use one session per document. Not thread-safe.

    An error does not reset the session. Call reset() before parsing the document again.
**/
public class ParserSession
{
    public enum Mode
    {
        EXPECT_TERM,
        EXPECT_OPERATOR
    }

    Mode    mode;
    int     equationIndex;           // 0-based index of the equation being assembled
    int     lineStart;               // offset of first non-blank character in the current line
    boolean negativeOperator;        // set by the most recent '+' or '-' operator
    boolean equalSign;               // '=' seen in current equation
    boolean termBeforeEqualSign;
    boolean termAfterEqualSign;
    boolean variableInEquation;

    public ParserSession ()
    {
        reset ();
    }

    /**
        Return to the state for the start of a new document.
    **/
    public void reset ()
    {
        clearEquation ();
        equationIndex = 0;
        lineStart     = 0;
    }

    /**
        Close the current equation and move on to the next one.
    **/
    public void resetForNewEquation ()
    {
        clearEquation ();
        lineStart = 0;
        equationIndex++;
    }

    protected void clearEquation ()
    {
        mode                = Mode.EXPECT_TERM;
        negativeOperator    = false;
        equalSign           = false;
        termBeforeEqualSign = false;
        termAfterEqualSign  = false;
        variableInEquation  = false;
    }

    public Mode mode ()
    {
        return mode;
    }

    public int equationIndex ()
    {
        return equationIndex;
    }

    /**
        @return true if the current equation has received any operator or term,
        that is, a previous line left it open.
    **/
    public boolean inEquation ()
    {
        return equalSign  ||  termBeforeEqualSign  ||  termAfterEqualSign  ||  variableInEquation;
    }

    /**
        Classifies the equation currently being assembled from the flags gathered so far.
        The line parser does not call this. It is meant for a host that wants to judge
        an equation that was left open, for example at the end of a document.
    **/
    public ParserStatus classifyEquation ()
    {
        if (! inEquation ())         return ParserStatus.SUCCESS_NO_EQUATION;
        if (! equalSign)             return ParserStatus.NO_EQUAL_SIGN;
        if (! termBeforeEqualSign)   return ParserStatus.NO_TERM_BEFORE_EQUAL_SIGN;
        if (! termAfterEqualSign)    return ParserStatus.NO_TERM_AFTER_EQUAL_SIGN;
        if (! variableInEquation)    return ParserStatus.NO_VARIABLE_IN_EQUATION;
        return ParserStatus.SUCCESS;
    }

    public String toString ()
    {
        return "equation " + equationIndex + " " + mode + (equalSign ? " after '='" : "");
    }
}
