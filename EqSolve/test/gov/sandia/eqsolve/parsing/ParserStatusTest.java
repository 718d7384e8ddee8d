/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqsolve.parsing;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ParserStatusTest {

    @Test
    public void testOnlySuccessStatusesAreNotErrors() {
        for (ParserStatus status : ParserStatus.values()) {
            boolean success = status == ParserStatus.SUCCESS || status == ParserStatus.SUCCESS_NO_EQUATION;
            assertTrue(status.name(), success != status.isError());
            assertNotNull(status.message());
            assertFalse(status.message().isEmpty());
        }
    }

    @Test
    public void testOutcome() {
        assertFalse(ParseOutcome.SUCCESS.isError());
        assertTrue(new ParseOutcome(ParserStatus.ILLEGAL_EXPONENT, 3).isError());
        assertTrue(new ParseOutcome(ParserStatus.ILLEGAL_EXPONENT, 3).toString().contains("ILLEGAL_EXPONENT@3"));
    }
}
