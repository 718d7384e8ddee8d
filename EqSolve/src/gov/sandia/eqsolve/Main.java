/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve;

import gov.sandia.eqsolve.linear.EquationSystem;
import gov.sandia.eqsolve.parsing.EquationDocument;
import gov.sandia.eqsolve.parsing.LinearEquationParser;
import gov.sandia.eqsolve.parsing.ParseException;
import gov.sandia.eqsolve.parsing.ParserLimits;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.log4j.Logger;

/**
    Headless front end. Parses a file of equations and prints the assembled system.
    <pre>
    -file=path       document to parse (a bare argument also names the file)
    -maxDigits=n     longest numeric literal, default 20
    -maxExponent=n   longest exponent after '^', default 2
    </pre>
**/
public class Main
{
    private static Logger logger = Logger.getLogger (Main.class);

    public static void main (String[] args)
    {
        System.exit (run (args, System.out, System.err));
    }

    public static int run (String[] args, PrintStream out, PrintStream err)
    {
        // Parse command line
        Path path        = null;
        int  maxDigits   = ParserLimits.DEFAULT.maximumNumberLength;
        int  maxExponent = ParserLimits.DEFAULT.maximumExponentLength;
        try
        {
            for (String arg : args)
            {
                if      (arg.startsWith ("-file="       )) path        = Paths.get (arg.substring (6));
                else if (arg.startsWith ("-maxDigits="  )) maxDigits   = Integer.parseInt (arg.substring (11));
                else if (arg.startsWith ("-maxExponent=")) maxExponent = Integer.parseInt (arg.substring (13));
                else if (! arg.startsWith ("-"))           path        = Paths.get (arg);
                else
                {
                    err.println ("Unknown option: " + arg);
                    return 2;
                }
            }
        }
        catch (NumberFormatException e)
        {
            err.println ("Bad number in command line: " + e.getMessage ());
            return 2;
        }
        catch (InvalidPathException e)
        {
            err.println ("Bad file name: " + e.getMessage ());
            return 2;
        }
        if (path == null)
        {
            err.println ("usage: Main [-maxDigits=n] [-maxExponent=n] -file=path");
            return 2;
        }

        ParserLimits limits;
        try
        {
            limits = new ParserLimits (maxDigits, maxExponent);
        }
        catch (IllegalArgumentException e)
        {
            err.println (e.getMessage ());
            return 2;
        }
        LinearEquationParser parser = new LinearEquationParser (limits);
        logger.info ("parsing " + path + " with " + parser.limits ());

        EquationDocument document = new EquationDocument (parser);
        EquationSystem system;
        try (BufferedReader reader = Files.newBufferedReader (path))
        {
            system = document.parse (reader);
        }
        catch (ParseException e)
        {
            err.println (path + ":");
            e.print (err);
            return 1;
        }
        catch (IOException e)
        {
            logger.error ("Could not read " + path, e);
            err.println ("Could not read " + path + ": " + e.getMessage ());
            return 1;
        }

        int equations = system.equationCount;
        int variables = system.variables.size ();
        logger.info (path + ": " + equations + " equations, " + variables + " variables");
        out.println (equations + " equations, " + variables + " variables " + system.variables.names ());
        out.println (system.print ());
        switch (system.checkShape ())
        {
            case TOO_FEW_EQUATIONS:
                out.println ("Too few equations to solve for every variable.");
                break;
            case TOO_MANY_EQUATIONS:
                out.println ("More equations than variables.");
                break;
            default:
                break;
        }
        return 0;
    }
}
