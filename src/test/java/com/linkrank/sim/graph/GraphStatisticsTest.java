package com.linkrank.sim.graph;

import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphStatisticsTest {

    private static Page page(long id) {
        return new Page(id, "/p" + id, "page", "c", 0.0);
    }

    @Test
    public void testCycleIsStronglyConnected() {
        GraphStats s = GraphStatistics.compute(List.of(page(1), page(2), page(3)),
                List.of(Edge.of(1, 2), Edge.of(2, 3), Edge.of(3, 1)));

        assertEquals(3, s.numNodes());
        assertEquals(3, s.numEdges());
        assertEquals(0.5, s.density(), 1e-12);
        assertEquals(1, s.weaklyConnectedComponents());
        assertEquals(1, s.stronglyConnectedComponents());
        assertTrue(s.stronglyConnected());
    }

    @Test
    public void testChainAndIsolatedPage() {
        GraphStats s = GraphStatistics.compute(List.of(page(1), page(2), page(3), page(4)),
                List.of(Edge.of(1, 2), Edge.of(2, 3), Edge.of(3, 9)));

        assertEquals(4, s.numNodes());
        assertEquals(2, s.numEdges());
        assertEquals(2, s.weaklyConnectedComponents());
        assertEquals(4, s.stronglyConnectedComponents());
        assertFalse(s.stronglyConnected());
    }

    @Test
    public void testEmptyGraph() {
        GraphStats s = GraphStatistics.compute(List.of(), List.of());
        assertEquals(0, s.numNodes());
        assertEquals(0.0, s.density(), 0.0);
        assertFalse(s.stronglyConnected());
    }
}
