package com.linkrank.sim.weights;

import com.linkrank.sim.api.SimilarityProvider;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.LinkPosition;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class WeightBlenderTest {

    private final List<Edge> edges = List.of(Edge.of(1, 2), Edge.of(2, 3), Edge.of(3, 1));
    private final Map<Edge, LinkPosition> added = Map.of(Edge.of(2, 3), LinkPosition.SIDEBAR,
            Edge.of(3, 1), LinkPosition.HEADER);

    @Test
    public void testPositionalWeights() {
        Map<Edge, Double> w = WeightBlender.positional().blend(edges, added);

        assertEquals(WeightBlender.EXISTING_EDGE_WEIGHT, w.get(Edge.of(1, 2)), 0.0);
        assertEquals(0.40, w.get(Edge.of(2, 3)), 1e-12);
        assertEquals(1.0, w.get(Edge.of(3, 1)), 1e-12);
    }

    @Test
    public void testSemanticBlendZeroesWeakSimilarity() {
        // 1-2: 0.9, 2-3: 0.3 (below threshold), 3-1: 1.7 (clamped)
        WeightBlender blender = WeightBlender.semantic((a, b) -> a == 1 ? 0.9 : a == 2 ? 0.3 : 1.7, 0.4);
        Map<Edge, Double> w = blender.blend(edges, added);

        assertEquals((1.0 + 0.9) / 2, w.get(Edge.of(1, 2)), 1e-12);
        assertEquals(0.40 / 2, w.get(Edge.of(2, 3)), 1e-12);
        assertEquals((1.0 + 1.0) / 2, w.get(Edge.of(3, 1)), 1e-12);
    }

    @Test
    public void testSimilaritiesRequestedInOneBatch() {
        int[] batches = { 0 };
        WeightBlender blender = WeightBlender.semantic(new SimilarityProvider() {
            @Override
            public double similarity(long a, long b) {
                throw new AssertionError("single lookup not expected");
            }

            @Override
            public double[] similarities(List<Edge> pairs) {
                batches[0]++;
                return new double[pairs.size()];
            }
        }, 0.4);
        blender.blend(edges, added);
        assertEquals(1, batches[0]);
    }

    @Test
    public void testSemanticRequiresProvider() {
        try {
            WeightBlender.semantic(null, 0.4);
            fail("Should have thrown");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("provider"));
        }
    }
}
