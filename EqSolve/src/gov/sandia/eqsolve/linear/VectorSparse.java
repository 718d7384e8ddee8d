/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

import java.util.HashMap;
import java.util.TreeMap;

/**
    Right-hand side of a linear system, indexed by equation.
    Same storage rules as MatrixSparse: absent entries read as zero and nothing is ever removed.
**/
public class VectorSparse
{
    HashMap<Integer,Double> data = new HashMap<Integer,Double> ();
    int                     count;  // Largest index seen, plus one.

    public int rows ()
    {
        return count;
    }

    public boolean contains (int row)
    {
        return data.containsKey (row);
    }

    public double get (int row)
    {
        Double result = data.get (row);
        if (result == null) return 0;
        return result;
    }

    public void set (int row, double a)
    {
        if (row < 0) throw new IllegalArgumentException ("Negative index " + row);
        data.put (row, a);
        count = Math.max (count, row + 1);
    }

    public void add (int row, double a)
    {
        set (row, get (row) + a);
    }

    public int size ()
    {
        return data.size ();
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof VectorSparse)) return false;
        VectorSparse that = (VectorSparse) o;
        return count == that.count  &&  data.equals (that.data);
    }

    public int hashCode ()
    {
        return data.hashCode ();
    }

    public String toString ()
    {
        return new TreeMap<Integer,Double> (data).toString ();
    }
}
