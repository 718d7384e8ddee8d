/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

import gov.sandia.eqsolve.linear.EquationSystem;
import gov.sandia.eqsolve.parsing.LineScanner.Sign;

/**
    Reads one term and folds it into the equation system.

    A term has the form [sign] [number [^[sign]exponent]] [variable], with blanks allowed
    between the sign, the number and the variable. At least one of number or variable
    must be present. A term with a variable adds to the coefficient table. A term without
    one is a constant, which moves to the right-hand side, so its value is subtracted from b.
    Terms after the equal sign are moved to the left-hand side, so they are negated.
**/
public class TermAssembler
{
    /**
        @return true if a term was found and recorded. On false, the scanner may or may not
        hold a specific error. If it does not, the caller decides how to report the failure.
    **/
    public boolean scanTerm (LineScanner scanner, ParserSession session, EquationSystem system)
    {
        Sign sign = scanner.scanSign ();
        scanner.skipSpaces ();

        StringBuilder number = new StringBuilder ();
        boolean haveNumber = scanner.scanNumber (number);
        if (scanner.failed ()) return false;

        if (haveNumber  &&  scanner.peek () == '^')
        {
            if (! scanExponent (scanner, number)) return false;
        }

        scanner.skipSpaces ();
        StringBuilder name = new StringBuilder ();
        boolean haveVariable = scanner.scanVariableName (name);

        boolean negative = session.equalSign ^ session.negativeOperator ^ sign.negative ();
        double value = 1;
        if (haveNumber) value = Double.parseDouble (number.toString ());
        if (negative) value = -value;

        int row = session.equationIndex;
        if (haveVariable)
        {
            session.variableInEquation = true;
            int column = system.variables.index (name.toString ());
            system.A.add (row, column, value);
        }
        else if (haveNumber)
        {
            system.b.add (row, -value);
        }
        else
        {
            scanner.fail (ParserStatus.NO_TERM_ENCOUNTERED);
            return false;
        }

        if (session.equalSign) session.termAfterEqualSign  = true;
        else                   session.termBeforeEqualSign = true;

        scanner.skipSpaces ();
        return true;
    }

    /**
        Reads the exponent clause that follows a number and appends it to the number in E notation.
        The scanner must be positioned on the '^'.
    **/
    protected boolean scanExponent (LineScanner scanner, StringBuilder number)
    {
        scanner.position++;  // skip '^'
        Sign sign = scanner.scanSign ();

        // The exponent is read with the same rules as a number, then held to a stricter standard.
        StringBuilder exponent = new StringBuilder ();
        if (! scanner.scanNumber (exponent))
        {
            scanner.fail (ParserStatus.MISSING_EXPONENT);
            return false;
        }

        int length = exponent.length ();
        if (length > scanner.limits ().maximumExponentLength)
        {
            scanner.fail (ParserStatus.ILLEGAL_EXPONENT);
            return false;
        }
        for (int i = 0; i < length; i++)
        {
            if (! LineScanner.isDigit (exponent.charAt (i)))
            {
                scanner.fail (ParserStatus.ILLEGAL_EXPONENT);
                return false;
            }
        }

        number.append ('E');
        if (sign.negative ()) number.append ('-');
        number.append (exponent);
        return true;
    }
}
