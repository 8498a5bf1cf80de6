package com.netmotif.api;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class NodeSetTest {

    @Test
    public void testOfSortsAndDeduplicates() {
        NodeSet s = NodeSet.of(4, 0, 4, 2);
        assertEquals(3, s.size());
        assertArrayEquals(new int[] { 0, 2, 4 }, s.toArray());
        assertEquals("NodeSet({0, 2, 4})", s.toString());
        assertEquals(Value.Kind.NODE_SET, s.kind());
    }

    @Test
    public void testEmpty() {
        assertTrue(NodeSet.of().isEmpty());
        assertEquals(NodeSet.empty(), NodeSet.of());
        assertEquals("NodeSet({})", NodeSet.empty().toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeIdRejected() {
        NodeSet.of(1, -2);
    }

    @Test
    public void testIterationIsAscending() {
        List<Integer> seen = new ArrayList<>();
        for (int id : NodeSet.of(7, 3, 5))
            seen.add(id);
        assertEquals(List.of(3, 5, 7), seen);
    }

    @Test
    public void testSetAlgebra() {
        NodeSet a = NodeSet.of(0, 1, 2);
        NodeSet b = NodeSet.of(2, 3);

        assertEquals(NodeSet.of(0, 1, 2, 3), a.union(b));
        assertEquals(NodeSet.of(2), a.intersection(b));
        assertTrue(a.intersection(NodeSet.of(9)).isEmpty());
        assertTrue(a.contains(1));
        assertFalse(a.contains(3));
    }

    @Test
    public void testToArrayIsACopy() {
        NodeSet s = NodeSet.of(1, 2);
        s.toArray()[0] = 99;
        assertTrue(s.contains(1));
    }
}
