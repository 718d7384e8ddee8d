/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

/**
    Size limits on numeric literals.
**/
public class ParserLimits
{
    public final int maximumNumberLength;    // Characters in a literal, counting digits and the decimal point.
    public final int maximumExponentLength;  // Digits after '^'.

    public static final ParserLimits DEFAULT = new ParserLimits (20, 2);

    public ParserLimits (int maximumNumberLength, int maximumExponentLength)
    {
        if (maximumNumberLength   < 1) throw new IllegalArgumentException ("Maximum number length must be at least 1, not " + maximumNumberLength);
        if (maximumExponentLength < 1) throw new IllegalArgumentException ("Maximum exponent length must be at least 1, not " + maximumExponentLength);
        this.maximumNumberLength   = maximumNumberLength;
        this.maximumExponentLength = maximumExponentLength;
    }

    public String toString ()
    {
        return "maxDigits=" + maximumNumberLength + " maxExponent=" + maximumExponentLength;
    }
}
