/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;

    @Before
    public void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return Main.run(args, out, err);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private File write(String name, String text) throws IOException {
        File file = folder.newFile(name);
        Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testSuccess() throws IOException {
        File file = write("pair.txt", "x + y = 10\nx - y = 2\n");
        assertEquals(0, run("-file=" + file.getPath()));
        String out = out();
        assertTrue(out, out.contains("2 equations, 2 variables [x, y]"));
        assertTrue(out, out.contains("1.0\t1.0\t|\t10.0"));
        assertTrue(out, out.contains("1.0\t-1.0\t|\t2.0"));
    }

    @Test
    public void testBareFileArgument() throws IOException {
        File file = write("single.txt", "x + y = 1\n");
        assertEquals(0, run(file.getPath()));
        assertTrue(out(), out().contains("Too few equations"));
    }

    @Test
    public void testParseError() throws IOException {
        File file = write("bad.txt", "x + y = 10\nx = y = 2\n");
        assertEquals(1, run("-file=" + file.getPath()));
        String err = err();
        assertTrue(err, err.contains("line 2, column 7"));
        assertTrue(err, err.contains("x = y = 2"));
        assertTrue(err, err.contains("      ^"));
    }

    @Test
    public void testLimitsFromCommandLine() throws IOException {
        File file = write("digits.txt", "1234x = 1\n");
        assertEquals(0, run("-file=" + file.getPath()));

        setUp();
        assertEquals(1, run("-maxDigits=3", "-file=" + file.getPath()));
        assertTrue(err(), err().contains("column 4"));
    }

    @Test
    public void testBadArguments() {
        assertEquals(2, run("-bogus"));
        assertTrue(err(), err().contains("Unknown option"));

        setUp();
        assertEquals(2, run("-maxDigits=many", "x.txt"));

        setUp();
        assertEquals(2, run("-maxDigits=0", "x.txt"));

        setUp();
        assertEquals(2, run());

        setUp();
        assertEquals(2, run("-file=bad\u0000name.txt"));
        assertTrue(err(), err().contains("Bad file name"));
    }

    @Test
    public void testMissingFile() {
        File missing = new File(folder.getRoot(), "missing.txt");
        assertEquals(1, run(missing.getPath()));
        assertTrue(err(), err().contains("Could not read"));
    }
}
