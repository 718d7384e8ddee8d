/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Map.Entry;

/**
    Coefficient table of a linear system. Rows are equations, columns are variables.
    Storage is one hash map per column, so a document with many short equations only
    pays for the terms it actually contains.

    Entries are never removed. An entry that accumulates to zero stays in the table,
    which keeps the set of (equation, variable) pairs seen by the parser intact.
**/
public class MatrixSparse
{
    List<HashMap<Integer,Double>> data = new ArrayList<HashMap<Integer,Double>> ();
    int rowCount;  // Largest index seen in any column, plus one.

    public MatrixSparse ()
    {
    }

    public int rows ()
    {
        return rowCount;
    }

    public int columns ()
    {
        return data.size ();
    }

    public boolean contains (int row, int column)
    {
        if (column >= data.size ()) return false;
        HashMap<Integer,Double> rows = data.get (column);
        if (rows == null) return false;
        return rows.containsKey (row);
    }

    public double get (int row, int column)
    {
        if (column >= data.size ()) return 0;
        HashMap<Integer,Double> rows = data.get (column);
        if (rows == null) return 0;
        Double result = rows.get (row);
        if (result == null) return 0;
        return result;
    }

    public void set (int row, int column, double a)
    {
        if (row < 0  ||  column < 0) throw new IllegalArgumentException ("Negative index (" + row + "," + column + ")");
        for (int c = data.size (); c <= column; c++) data.add (null);
        HashMap<Integer,Double> rows = data.get (column);
        if (rows == null)
        {
            rows = new HashMap<Integer,Double> ();
            data.set (column, rows);
        }
        rows.put (row, a);
        rowCount = Math.max (rowCount, row + 1);
    }

    /**
        Accumulates a into the element at (row, column). An absent element counts as zero.
    **/
    public void add (int row, int column, double a)
    {
        set (row, column, get (row, column) + a);
    }

    /**
        @return Number of stored elements, including any that have summed to zero.
    **/
    public int size ()
    {
        int result = 0;
        for (HashMap<Integer,Double> rows : data)
        {
            if (rows != null) result += rows.size ();
        }
        return result;
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof MatrixSparse)) return false;
        MatrixSparse that = (MatrixSparse) o;
        if (rows () != that.rows ()) return false;
        int w = Math.max (columns (), that.columns ());
        for (int c = 0; c < w; c++)
        {
            HashMap<Integer,Double> a = c < data     .size () ? data     .get (c) : null;
            HashMap<Integer,Double> b = c < that.data.size () ? that.data.get (c) : null;
            if (a == null) a = new HashMap<Integer,Double> ();
            if (b == null) b = new HashMap<Integer,Double> ();
            if (! a.equals (b)) return false;
        }
        return true;
    }

    public int hashCode ()
    {
        int result = rowCount;
        for (HashMap<Integer,Double> rows : data)
        {
            if (rows != null  &&  ! rows.isEmpty ()) result = 31 * result + rows.hashCode ();
        }
        return result;
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        IteratorSparse it = new IteratorSparse (this);
        while (it.hasNext ())
        {
            double value = it.next ();
            if (result.length () > 0) result.append (",");
            result.append ("(" + it.getRow () + "," + it.getColumn () + "):" + value);
        }
        return "{" + result + "}";
    }

    /**
        Visits the stored elements column by column. Order within a column is unspecified.
    **/
    public static class IteratorSparse implements Iterator<Double>
    {
        protected MatrixSparse                    A;
        protected int                             columns;

        protected Iterator<Entry<Integer,Double>> it;
        protected double                          value;
        protected int                             row;
        protected int                             column;

        public IteratorSparse (MatrixSparse A)
        {
            this.A = A;
            columns = A.columns ();
            if (columns > 0)
            {
                HashMap<Integer,Double> rows = A.data.get (0);
                if (rows != null) it = rows.entrySet ().iterator ();
            }
        }

        public boolean hasNext ()
        {
            while (true)
            {
                if (it != null  &&  it.hasNext ()) return true;
                if (++column >= columns) return false;
                HashMap<Integer,Double> rows = A.data.get (column);
                if (rows == null) it = null;
                else              it = rows.entrySet ().iterator ();
            }
        }

        public Double next ()
        {
            if (! hasNext ()) throw new NoSuchElementException ();
            Entry<Integer,Double> e = it.next ();
            row = e.getKey ();
            value = e.getValue ();
            return value;
        }

        public int getRow ()
        {
            return row;
        }

        public int getColumn ()
        {
            return column;
        }
    }
}
