/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

/**
    Result returned by a LinearSolver.
**/
public class Solution
{
    public enum Status
    {
        SUCCESS,
        SINGULAR,
        ILL_CONDITIONED
    }

    public Status   status;
    public double[] x;  // Indexed the same as EquationSystem.variables. Null unless status is SUCCESS.

    public Solution (double[] x)
    {
        status = Status.SUCCESS;
        this.x = x;
    }

    public Solution (Status status)
    {
        this.status = status;
    }

    public boolean succeeded ()
    {
        return status == Status.SUCCESS;
    }
}
