package com.netmotif.motif;

import org.junit.Test;

import static org.junit.Assert.*;

public class DegreeCriteriaTest {

    @Test
    public void testComparators() {
        assertTrue(new DegreeCriteria(DegreeComparator.EQ, 2).test(2));
        assertFalse(new DegreeCriteria(DegreeComparator.EQ, 2).test(3));
        assertTrue(new DegreeCriteria(DegreeComparator.LT, 2).test(1));
        assertFalse(new DegreeCriteria(DegreeComparator.LT, 2).test(2));
        assertTrue(new DegreeCriteria(DegreeComparator.LE, 2).test(2));
        assertTrue(new DegreeCriteria(DegreeComparator.GT, 2).test(3));
        assertFalse(new DegreeCriteria(DegreeComparator.GT, 2).test(2));
        assertTrue(new DegreeCriteria(DegreeComparator.GE, 2).test(2));
    }

    @Test
    public void testFromSymbol() {
        for (DegreeComparator c : DegreeComparator.values())
            assertEquals(c, DegreeComparator.fromSymbol(c.symbol()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownSymbol() {
        DegreeComparator.fromSymbol("!=");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeValueRejected() {
        new DegreeCriteria(DegreeComparator.EQ, -1);
    }

    @Test
    public void testToString() {
        assertEquals("deg >= 3", new DegreeCriteria(DegreeComparator.GE, 3).toString());
        assertEquals("deg = 0", DegreeCriteria.exactly(0).toString());
    }
}
