/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

/**
    Contract for anything that can solve a system assembled by the parser.

    The solver sees the first system.equationCount rows of A and b, and one unknown
    per entry in system.variables. Column c of A holds the coefficients of the variable
    whose name is system.variables.name (c), and the solution must use the same indexing.
    Implementations must not modify the system.
**/
public interface LinearSolver
{
    /**
        Solve A*x=b.
        @return Never null. Use the status of the result to report a singular or
        ill-conditioned system rather than throwing.
    **/
    public Solution solve (EquationSystem system);
}
