/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
    Maps variable names to column numbers in the coefficient table.
    A new name gets the next unused column, so columns are dense and appear in
    the order the names were first seen. Names are case-sensitive.
**/
public class VariableIndex
{
    protected HashMap<String,Integer> indices = new HashMap<String,Integer> ();
    protected List<String>            names   = new ArrayList<String> ();

    /**
        @return The column assigned to name, assigning a fresh one if name has not been seen before.
    **/
    public int index (String name)
    {
        Integer result = indices.get (name);
        if (result != null) return result;

        int next = names.size ();
        indices.put (name, next);
        names.add (name);
        return next;
    }

    /**
        @return The column assigned to name, or -1 if name is unknown. Does not assign.
    **/
    public int find (String name)
    {
        Integer result = indices.get (name);
        if (result == null) return -1;
        return result;
    }

    public String name (int index)
    {
        return names.get (index);
    }

    /// Names in column order.
    public List<String> names ()
    {
        return new ArrayList<String> (names);
    }

    public int size ()
    {
        return names.size ();
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof VariableIndex)) return false;
        return names.equals (((VariableIndex) o).names);
    }

    public int hashCode ()
    {
        return names.hashCode ();
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        for (int i = 0; i < names.size (); i++)
        {
            if (i > 0) result.append (",");
            result.append (names.get (i) + ":" + i);
        }
        return "{" + result + "}";
    }
}
