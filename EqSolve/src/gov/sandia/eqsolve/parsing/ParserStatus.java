/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

/**
    Every result the line parser can report. The first two are not errors.
**/
public enum ParserStatus
{
    SUCCESS                   ("Success"),
    SUCCESS_NO_EQUATION       ("Success"),

    // structural
    ILLEGAL_EQUATION          ("Illegal equation"),
    NO_EQUAL_SIGN             ("The equation has no equal sign"),
    MULTIPLE_EQUAL_SIGNS      ("The equation has more than one equal sign"),
    NO_TERM_BEFORE_EQUAL_SIGN ("There is no term before the equal sign"),
    NO_TERM_AFTER_EQUAL_SIGN  ("There is no term after the equal sign"),
    NO_TERM_ENCOUNTERED       ("Expected a number or a variable"),
    NO_VARIABLE_IN_EQUATION   ("The equation contains no variable"),

    // numeric format
    MULTIPLE_DECIMAL_POINTS   ("A number has more than one decimal point"),
    TOO_MANY_DIGITS           ("A number has too many digits"),
    MISSING_EXPONENT          ("The exponent after '^' is missing"),
    ILLEGAL_EXPONENT          ("The exponent after '^' is not legal");

    protected String message;

    ParserStatus (String message)
    {
        this.message = message;
    }

    public boolean isError ()
    {
        return this != SUCCESS  &&  this != SUCCESS_NO_EQUATION;
    }

    /// Default English text. Hosts that translate should key on the constant instead.
    public String message ()
    {
        return message;
    }
}
