package com.linkrank.sim.api;

import com.linkrank.sim.model.Edge;

import java.util.List;

/**
 * Pairwise relevance between two pages, as produced by an external
 * embedding model. Values are expected in [0, 1]; callers clamp anything
 * outside that range.
 */
@FunctionalInterface
public interface SimilarityProvider {

    double similarity(long pageA, long pageB);

    /**
     * Batched lookup, one value per pair in order. Implementations backed by a
     * remote model should override this to avoid a round trip per edge.
     */
    default double[] similarities(List<Edge> pairs) {
        double[] out = new double[pairs.size()];
        for (int i = 0; i < out.length; i++) {
            Edge e = pairs.get(i);
            out[i] = similarity(e.fromId(), e.toId());
        }
        return out;
    }
}
