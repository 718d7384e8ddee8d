/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.linear;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.NoSuchElementException;

import org.junit.Test;

public class MatrixSparseTest {

    @Test
    public void testAbsentEntriesReadAsZero() {
        MatrixSparse A = new MatrixSparse();
        assertEquals(0, A.rows());
        assertEquals(0, A.columns());
        assertEquals(0.0, A.get(3, 7), 0);
        assertFalse(A.contains(3, 7));
    }

    @Test
    public void testAddAccumulates() {
        MatrixSparse A = new MatrixSparse();
        A.add(0, 1, 2.5);
        A.add(0, 1, -1);
        A.add(2, 0, 4);
        assertEquals(1.5, A.get(0, 1), 0);
        assertEquals(4.0, A.get(2, 0), 0);
        assertEquals(3, A.rows());
        assertEquals(2, A.columns());
        assertEquals(2, A.size());
    }

    @Test
    public void testZeroSumIsKept() {
        MatrixSparse A = new MatrixSparse();
        A.add(0, 0, 1);
        A.add(0, 0, -1);
        assertTrue(A.contains(0, 0));
        assertEquals(0.0, A.get(0, 0), 0);
        assertEquals(1, A.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeIndex() {
        new MatrixSparse().set(-1, 0, 1);
    }

    @Test
    public void testEquality() {
        MatrixSparse A = new MatrixSparse();
        MatrixSparse B = new MatrixSparse(0, 5);  // trailing empty columns do not matter
        A.set(1, 2, 3);
        B.set(1, 2, 3);
        assertEquals(A, B);
        assertEquals(A.hashCode(), B.hashCode());
        B.add(1, 2, 1);
        assertNotEquals(A, B);
    }

    @Test
    public void testIteratorVisitsEveryStoredElement() {
        MatrixSparse A = new MatrixSparse();
        A.set(0, 0, 1);
        A.set(1, 0, 2);
        A.set(4, 3, 5);
        MatrixSparse.IteratorSparse it = new MatrixSparse.IteratorSparse(A);
        double sum = 0;
        int count = 0;
        while (it.hasNext()) {
            double v = it.next();
            assertEquals(v, A.get(it.getRow(), it.getColumn()), 0);
            sum += v;
            count++;
        }
        assertEquals(3, count);
        assertEquals(8.0, sum, 0);
    }

    @Test(expected = NoSuchElementException.class)
    public void testIteratorPastEnd() {
        MatrixSparse A = new MatrixSparse();
        A.set(2, 1, 4);
        MatrixSparse.IteratorSparse it = new MatrixSparse.IteratorSparse(A);
        assertEquals(4.0, it.next(), 0);
        assertFalse(it.hasNext());
        it.next();
    }
}
