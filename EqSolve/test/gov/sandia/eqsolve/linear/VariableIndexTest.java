/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class VariableIndexTest {

    @Test
    public void testIndicesAreDenseAndStable() {
        VariableIndex index = new VariableIndex();
        assertEquals(0, index.index("y"));
        assertEquals(1, index.index("x"));
        assertEquals(0, index.index("y"));
        assertEquals(2, index.index("z"));
        assertEquals(1, index.index("x"));
        assertEquals(3, index.size());
        assertEquals(Arrays.asList("y", "x", "z"), index.names());
        assertEquals("x", index.name(1));
        assertEquals("{y:0,x:1,z:2}", index.toString());
    }

    @Test
    public void testNamesAreCaseSensitive() {
        VariableIndex index = new VariableIndex();
        assertEquals(0, index.index("x"));
        assertEquals(1, index.index("X"));
    }

    @Test
    public void testFindDoesNotAssign() {
        VariableIndex index = new VariableIndex();
        assertEquals(-1, index.find("a"));
        assertEquals(0, index.size());
        index.index("a");
        assertEquals(0, index.find("a"));
    }
}
