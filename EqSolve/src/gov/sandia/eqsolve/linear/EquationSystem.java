/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

import java.io.StringWriter;

/**
    The system A*x=b as assembled by the parser, together with the names that label the columns of A.
    The caller creates one of these per document and hands it to every parse call for that document.
    Members are public because the parser and the solver both work on them directly.
**/
public class EquationSystem
{
    public MatrixSparse  A         = new MatrixSparse ();
    public VectorSparse  b         = new VectorSparse ();
    public VariableIndex variables = new VariableIndex ();
    public int           equationCount;  // Number of completed equations. Rows at or past this index belong to an equation still in progress.

    public enum Shape
    {
        SQUARE,
        TOO_FEW_EQUATIONS,
        TOO_MANY_EQUATIONS
    }

    public Shape checkShape ()
    {
        int variableCount = variables.size ();
        if (equationCount < variableCount) return Shape.TOO_FEW_EQUATIONS;
        if (equationCount > variableCount) return Shape.TOO_MANY_EQUATIONS;
        return Shape.SQUARE;
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof EquationSystem)) return false;
        EquationSystem that = (EquationSystem) o;
        return equationCount == that.equationCount
            && A        .equals (that.A)
            && b        .equals (that.b)
            && variables.equals (that.variables);
    }

    public int hashCode ()
    {
        return 31 * A.hashCode () + b.hashCode () + equationCount;
    }

    public String toString ()
    {
        return print (";", ",");
    }

    public String print ()
    {
        return print ("\n", "\t");
    }

    /**
        Renders the completed equations as a dense augmented matrix [A|b].
    **/
    public String print (String rowDivider, String columnDivider)
    {
        StringWriter stream = new StringWriter ();

        int rows    = equationCount;
        int columns = variables.size ();
        if (rows == 0) return "[]";

        stream.append ("[");
        int r = 0;
        while (true)
        {
            for (int c = 0; c < columns; c++)
            {
                stream.append (String.valueOf (A.get (r, c)));
                stream.append (columnDivider);
            }
            stream.append ("|");
            stream.append (columnDivider);
            stream.append (String.valueOf (b.get (r)));

            if (++r >= rows) break;
            stream.append (rowDivider);
        }
        stream.append ("]");

        return stream.toString ();
    }
}
