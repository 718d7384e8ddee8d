/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

/**
    Thrown when a parsed system cannot be handed to a solver, or the solver gives up on it.
**/
@SuppressWarnings("serial")
public class SolveException extends Exception
{
    public SolveException (String message)
    {
        super (message);
    }
}
