package com.netmotif.motif;

import com.netmotif.api.Graph;
import com.netmotif.api.NodeSet;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class GraphOpsTest {

    @Test
    public void testOverlayIsDisjointUnion() {
        Graph ring = Motifs.ring(3);
        Graph path = Motifs.path(2);
        Graph g = GraphOps.overlay(ring, path);

        assertEquals(5, g.nodeCount());
        assertEquals(4, g.edgeCount());
        assertTrue(g.hasEdge(3, 4));
        assertFalse(g.isConnected());
        // operands untouched
        assertEquals(3, ring.nodeCount());
        assertEquals(2, path.nodeCount());
    }

    @Test
    public void testConnectAddsOneBridge() {
        Graph g = GraphOps.connect(Motifs.ring(4), Motifs.star(3), 0, 0);

        assertEquals(8, g.nodeCount());
        assertEquals(8, g.edgeCount());
        assertEquals(3, g.degree(0));
        assertEquals(4, g.degree(4));
        assertTrue(g.hasEdge(0, 4));
        assertTrue(g.isConnected());
    }

    @Test
    public void testConnectToNonHubNode() {
        Graph g = GraphOps.connect(Motifs.path(2), Motifs.path(3), 1, 2);
        assertTrue(g.hasEdge(1, 4));
        assertEquals(4, g.edgeCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConnectRejectsOutOfRangeEndpoint() {
        GraphOps.connect(Motifs.ring(3), Motifs.ring(3), 5, 0);
    }

    @Test
    public void testRelabel() {
        Graph g = GraphOps.relabel(Motifs.star(2), Map.of(0, 2, 2, 0));
        assertEquals(2, g.degree(2));
        assertEquals(1, g.degree(0));
    }

    @Test
    public void testPick() {
        Graph c = GraphOps.connect(Motifs.ring(4), Motifs.star(3), 0, 0);

        assertEquals(NodeSet.of(0, 4), GraphOps.pick(c, new DegreeCriteria(DegreeComparator.GE, 3)));
        assertEquals(NodeSet.of(5, 6, 7), GraphOps.pick(c, DegreeCriteria.exactly(1)));
        assertEquals(NodeSet.of(1, 2, 3, 5, 6, 7), GraphOps.pick(c, new DegreeCriteria(DegreeComparator.LT, 3)));
        assertTrue(GraphOps.pick(c, new DegreeCriteria(DegreeComparator.GT, 10)).isEmpty());
    }

    @Test
    public void testPickOnEmptyGraph() {
        assertTrue(GraphOps.pick(Graph.empty(), DegreeCriteria.exactly(0)).isEmpty());
    }
}
