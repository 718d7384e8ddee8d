/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class VectorSparseTest {

    @Test
    public void testAccumulate() {
        VectorSparse b = new VectorSparse();
        assertEquals(0.0, b.get(5), 0);
        assertFalse(b.contains(5));
        b.add(5, -10);
        b.add(5, 4);
        assertEquals(-6.0, b.get(5), 0);
        assertEquals(6, b.rows());
        assertEquals(1, b.size());
        assertEquals("{5=-6.0}", b.toString());
    }

    @Test
    public void testZeroSumIsKept() {
        VectorSparse b = new VectorSparse();
        b.add(0, 3);
        b.add(0, -3);
        assertTrue(b.contains(0));
        assertEquals(1, b.size());
    }
}
