/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

import gov.sandia.eqsolve.linear.EquationSystem;
import gov.sandia.eqsolve.linear.LinearSolver;
import gov.sandia.eqsolve.linear.SolveException;
import gov.sandia.eqsolve.linear.Solution;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
    Drives the line parser over a whole document, the way an editor does when the user asks for a solution.
    Parsing stops at the first line with an error, which is reported as a ParseException.
**/
public class EquationDocument
{
    private static Logger logger = Logger.getLogger (EquationDocument.class);

    protected LinearEquationParser parser;

    public EquationDocument ()
    {
        this (new LinearEquationParser ());
    }

    public EquationDocument (LinearEquationParser parser)
    {
        this.parser = parser;
    }

    public EquationSystem parse (String text) throws ParseException
    {
        try
        {
            return parse (new BufferedReader (new StringReader (text)));
        }
        catch (IOException e)
        {
            throw new UncheckedIOException (e);  // StringReader does not throw, so this is not expected.
        }
    }

    public EquationSystem parse (BufferedReader reader) throws IOException, ParseException
    {
        EquationSystem system  = new EquationSystem ();
        ParserSession  session = new ParserSession ();
        parse (reader, session, system);
        return system;
    }

    /**
        Feeds every line of reader to the parser, continuing with the given session and system.
        @throws ParseException at the first line that produces an error, or at the end of input
        if the last equation was left open after an operator. In the second case the status
        comes from ParserSession.classifyEquation(), or is ILLEGAL_EQUATION if the flags alone
        do not explain why the equation is incomplete.
    **/
    public void parse (BufferedReader reader, ParserSession session, EquationSystem system) throws IOException, ParseException
    {
        String lastLine       = "";
        int    lastLineNumber = 0;
        int    lineNumber     = 0;
        String line;
        while ((line = reader.readLine ()) != null)
        {
            lineNumber++;
            ParseOutcome outcome = parser.parse (line, session, system);
            if (outcome.isError ()) throw new ParseException (outcome.status, line, lineNumber, outcome.position);
            if (outcome.status != ParserStatus.SUCCESS_NO_EQUATION)
            {
                lastLine       = line;
                lastLineNumber = lineNumber;
            }
        }

        if (session.inEquation ())
        {
            ParserStatus status = session.classifyEquation ();
            if (! status.isError ()) status = ParserStatus.ILLEGAL_EQUATION;
            throw new ParseException (status, lastLine, lastLineNumber, LinearEquationParser.trimEnd (lastLine).length ());
        }

        if (logger.isDebugEnabled ()) logger.debug ("parsed " + lineNumber + " lines: " + system.equationCount + " equations, " + system.variables.size () + " variables");
    }

    /**
        Hands a parsed system to a solver and formats the answer as one "name = value" line per variable, in column order.
        @throws SolveException if the number of equations does not match the number of variables,
        or if the solver reports that the system is singular or ill-conditioned.
    **/
    public static List<String> solve (EquationSystem system, LinearSolver solver) throws SolveException
    {
        int equations = system.equationCount;
        int variables = system.variables.size ();
        switch (system.checkShape ())
        {
            case TOO_FEW_EQUATIONS:
                throw new SolveException ("Too few equations: " + equations + " equations for " + variables + " variables");
            case TOO_MANY_EQUATIONS:
                throw new SolveException ("Too many equations: " + equations + " equations for " + variables + " variables");
            default:
                break;
        }

        Solution solution = solver.solve (system);
        if (! solution.succeeded ())
        {
            if (solution.status == Solution.Status.SINGULAR) throw new SolveException ("The system of equations is singular");
            throw new SolveException ("The system of equations is ill-conditioned");
        }

        List<String> result = new ArrayList<String> ();
        for (int i = 0; i < variables; i++)
        {
            result.add (system.variables.name (i) + " = " + solution.x[i]);
        }
        return result;
    }
}
