package com.linkrank.sim.weights;

import com.linkrank.sim.api.SimilarityProvider;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.LinkPosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Assigns a weight to every edge of a graph.
 *
 * Pre-existing edges weigh 1.0; edges added by rules take their position
 * weight. With relevance weighting enabled each edge's similarity s (clamped
 * to [0, 1], zeroed below the threshold) is blended in as
 * (position + s) / 2. Similarities are requested in one batch.
 */
@Log4j2
public final class WeightBlender {
    public static final double EXISTING_EDGE_WEIGHT = 1.0;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.4;

    private final SimilarityProvider similarity;
    private final double threshold;

    private WeightBlender(SimilarityProvider similarity, double threshold) {
        this.similarity = similarity;
        this.threshold = threshold;
    }

    /** Position weights only. */
    public static WeightBlender positional() {
        return new WeightBlender(null, 0.0);
    }

    /** Position weights blended with similarity from {@code provider}. */
    public static WeightBlender semantic(SimilarityProvider provider, double threshold) {
        if (provider == null)
            throw new IllegalArgumentException("Semantic weighting requires a similarity provider");
        if (!(threshold >= 0 && threshold <= 1))
            throw new IllegalArgumentException("Similarity threshold must be in [0, 1]: " + threshold);
        return new WeightBlender(provider, threshold);
    }

    public boolean isSemantic() {
        return similarity != null;
    }

    /**
     * @param edges          Every edge of the final graph.
     * @param addedPositions Placement of the edges added by rules; edges absent
     *                       from this map are treated as pre-existing.
     * @return Weight per edge, in the iteration order of {@code edges}.
     */
    public Map<Edge, Double> blend(Collection<Edge> edges, Map<Edge, LinkPosition> addedPositions) {
        List<Edge> ordered = new ArrayList<>(edges);
        double[] sims = null;
        if (similarity != null && !ordered.isEmpty()) {
            sims = similarity.similarities(ordered);
            if (sims.length != ordered.size())
                throw new IllegalStateException("Similarity provider returned " + sims.length
                        + " value(s) for " + ordered.size() + " pair(s)");
        }

        Map<Edge, Double> out = new LinkedHashMap<>(ordered.size() * 2);
        for (int i = 0; i < ordered.size(); i++) {
            Edge e = ordered.get(i);
            LinkPosition position = addedPositions.get(e);
            double weight = position == null ? EXISTING_EDGE_WEIGHT : position.weight();
            if (sims != null)
                weight = (weight + effectiveSimilarity(sims[i])) / 2.0;
            out.put(e, weight);
        }
        log.debug("Blended weights for {} edge(s), semantic={}", out.size(), isSemantic());
        return out;
    }

    double effectiveSimilarity(double raw) {
        double s = Double.isNaN(raw) ? 0.0 : Math.max(0.0, Math.min(1.0, raw));
        return s < threshold ? 0.0 : s;
    }
}
