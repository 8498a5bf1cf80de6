package com.netmotif.motif;

import com.netmotif.api.Graph;
import com.netmotif.api.NodeSet;
import org.junit.Test;

import static org.junit.Assert.*;

public class MotifsTest {

    @Test
    public void testRing() {
        Graph g = Motifs.ring(4);
        assertEquals(4, g.nodeCount());
        assertEquals(4, g.edgeCount());
        for (int i = 0; i < 4; i++)
            assertEquals(2, g.degree(i));
        assertTrue(g.hasEdge(3, 0));
        assertTrue(g.isConnected());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRingTooSmall() {
        Motifs.ring(2);
    }

    @Test
    public void testStar() {
        Graph g = Motifs.star(3);
        assertEquals(4, g.nodeCount());
        assertEquals(3, g.edgeCount());
        assertEquals(3, g.degree(0));
        assertEquals(NodeSet.of(1, 2, 3), g.neighbors(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStarWithoutLeaves() {
        Motifs.star(0);
    }

    @Test
    public void testGrid() {
        // 0 1 2
        // 3 4 5
        Graph g = Motifs.grid(2, 3);
        assertEquals(6, g.nodeCount());
        assertEquals(7, g.edgeCount());
        assertEquals(NodeSet.of(1, 3, 5), g.neighbors(4));
        assertEquals(2, g.degree(0));
        assertFalse(g.hasEdge(2, 3));
    }

    @Test
    public void testSingleCellGrid() {
        Graph g = Motifs.grid(1, 1);
        assertEquals(1, g.nodeCount());
        assertEquals(0, g.edgeCount());
    }

    @Test
    public void testTree() {
        Graph g = Motifs.tree(2, 2);
        assertEquals(7, g.nodeCount());
        assertEquals(6, g.edgeCount());
        assertEquals(NodeSet.of(1, 2), g.neighbors(0));
        assertEquals(NodeSet.of(0, 3, 4), g.neighbors(1));
        assertEquals(NodeSet.of(2), g.neighbors(6));
        assertTrue(g.isConnected());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnaryTreeRejected() {
        Motifs.tree(1, 3);
    }

    @Test
    public void testTwoRingsBridge() {
        Graph g = Motifs.twoRingsBridge(3, 4);
        assertEquals(7, g.nodeCount());
        assertEquals(8, g.edgeCount());
        assertTrue(g.hasEdge(0, 3));
        assertTrue(g.hasEdge(6, 3));
        assertEquals(3, g.degree(0));
        assertEquals(3, g.degree(3));
    }

    @Test
    public void testPath() {
        Graph g = Motifs.path(4);
        assertEquals(4, g.nodeCount());
        assertEquals(3, g.edgeCount());
        assertEquals(1, g.degree(0));
        assertEquals(1, g.degree(3));
        assertFalse(g.hasEdge(0, 3));
    }

    @Test
    public void testMesh() {
        Graph g = Motifs.mesh(4);
        assertEquals(6, g.edgeCount());
        for (int i = 0; i < 4; i++)
            assertEquals(3, g.degree(i));
        assertEquals(0, Motifs.mesh(1).edgeCount());
    }

    @Test
    public void testTreeSizeSaturates() {
        assertEquals(7, Motifs.treeSize(2, 2));
        assertEquals(13, Motifs.treeSize(3, 2));
        assertEquals(Long.MAX_VALUE, Motifs.treeSize(2, 100));
    }

    @Test
    public void testBuildersAreDeterministic() {
        assertEquals(Motifs.grid(3, 3), Motifs.grid(3, 3));
        assertEquals(Motifs.twoRingsBridge(5, 3).edges(), Motifs.twoRingsBridge(5, 3).edges());
    }
}
