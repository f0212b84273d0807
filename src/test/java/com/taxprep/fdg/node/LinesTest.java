package com.taxprep.fdg.node;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class LinesTest {

    @Test
    public void testSumTreatsAbsentAsZero() {
        assertEquals(5.0, Lines.sum(2.0, null, 3.0), 0.0);
        assertEquals(0.0, Lines.sum((Double) null), 0.0);
        assertEquals(4.5, Lines.sum(Arrays.asList(1.5, null, 3.0)), 0.0);
    }

    @Test
    public void testSumPresentKeepsAbsence() {
        assertNull(Lines.sumPresent(null, null));
        assertEquals(0.0, Lines.sumPresent(null, 0.0), 0.0);
        assertEquals(7.0, Lines.sumPresent(3.0, 4.0), 0.0);
    }

    @Test
    public void testHelpers() {
        assertNull(Lines.blankIfZero(0));
        assertEquals(12.0, Lines.blankIfZero(12), 0.0);
        assertEquals(0.0, Lines.orZero(null), 0.0);
        assertEquals(10.13, Lines.cents(10.125000001), 0.0);
    }
}
