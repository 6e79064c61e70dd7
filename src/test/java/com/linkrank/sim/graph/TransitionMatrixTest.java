package com.linkrank.sim.graph;

import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class TransitionMatrixTest {

    private GraphModel graph;

    @Before
    public void setUp() {
        // 1 -> 2, 1 -> 3, 2 -> 3; 3 is dangling
        graph = GraphModel.builder()
                .addPage(new Page(1, "/a", "t", "c", 0))
                .addPage(new Page(2, "/b", "t", "c", 0))
                .addPage(new Page(3, "/c", "t", "c", 0))
                .addEdge(1, 2)
                .addEdge(1, 3)
                .addEdge(2, 3)
                .build();
    }

    @Test
    public void testMultiplyPreservesMass() {
        TransitionMatrix m = TransitionMatrix.build(graph, Map.of(), Map.of());
        double[] p = { 0.2, 0.3, 0.5 };
        double[] out = new double[3];
        m.multiply(p, out);

        assertEquals(1.0, out[0] + out[1] + out[2], 1e-12);
        assertEquals(1, m.danglingCount());
        assertTrue(m.isDangling(2));
        // node 0 only gets the dangling share
        assertEquals(0.5 / 3, out[0], 1e-12);
        assertEquals(0.1 + 0.5 / 3, out[1], 1e-12);
        assertEquals(0.1 + 0.3 + 0.5 / 3, out[2], 1e-12);
    }

    @Test
    public void testWeightsNormalizePerSource() {
        TransitionMatrix m = TransitionMatrix.build(graph, Map.of(Edge.of(1, 2), 3.0, Edge.of(1, 3), 1.0), Map.of());
        double[] p = { 1.0, 0.0, 0.0 };
        double[] out = new double[3];
        m.multiply(p, out);

        assertEquals(0.0, out[0], 1e-12);
        assertEquals(0.75, out[1], 1e-12);
        assertEquals(0.25, out[2], 1e-12);
    }

    @Test
    public void testOutflowCapBecomesSelfLoop() {
        TransitionMatrix m = TransitionMatrix.build(graph, Map.of(), Map.of(0, 0.4));
        double[] p = { 1.0, 0.0, 0.0 };
        double[] out = new double[3];
        m.multiply(p, out);

        // raw row 0.4 + 0.4 + self 0.6, normalized by 1.4
        assertEquals(0.6 / 1.4, out[0], 1e-12);
        assertEquals(0.4 / 1.4, out[1], 1e-12);
        assertEquals(0.4 / 1.4, out[2], 1e-12);
    }

    @Test
    public void testCapScalesRowBeforeNormalizing() {
        GraphModel star = GraphModel.builder()
                .addPage(new Page(1, "/a", "t", "c", 0))
                .addPage(new Page(2, "/b", "t", "c", 0))
                .addPage(new Page(3, "/c", "t", "c", 0))
                .addPage(new Page(4, "/d", "t", "c", 0))
                .addEdge(1, 2)
                .addEdge(1, 3)
                .addEdge(1, 4)
                .build();
        TransitionMatrix m = TransitionMatrix.build(star, Map.of(), Map.of(0, 0.5));
        double[] p = { 1.0, 0.0, 0.0, 0.0 };
        double[] out = new double[4];
        m.multiply(p, out);

        // three links at 0.5 plus a 0.5 self-loop, row sum 2
        assertEquals(0.25, out[0], 1e-12);
        assertEquals(0.25, out[1], 1e-12);
        assertEquals(0.25, out[2], 1e-12);
        assertEquals(0.25, out[3], 1e-12);
    }

    @Test
    public void testCapOnDanglingNodeIsIgnored() {
        TransitionMatrix m = TransitionMatrix.build(graph, Map.of(), Map.of(2, 0.5));
        assertEquals(3, m.entryCount());
    }

    @Test
    public void testNegativeWeightRejected() {
        try {
            TransitionMatrix.build(graph, Map.of(Edge.of(1, 2), -1.0), Map.of());
            fail("Should have thrown");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("weight"));
        }
    }
}
