package com.linkrank.sim.model;

import java.util.Objects;

/**
 * A page of the simulated site.
 *
 * This is the single page value type used past the system boundary. Rule
 * filters, selection strategies and the solver all read pages through this
 * record; loaders are expected to normalize whatever they import into it.
 *
 * The baseline score is the page's current importance. It is replaced (never
 * mutated in place) when a baseline solve assigns fresh scores.
 */
public record Page(long id, String url, String type, String category, double baselineScore) {

    public Page {
        Objects.requireNonNull(url, "url");
        type = type == null ? "" : type;
        category = category == null ? "" : category;
        if (Double.isNaN(baselineScore) || baselineScore < 0)
            throw new IllegalArgumentException("baselineScore must be >= 0 for page " + id + ": " + baselineScore);
    }

    public Page withBaselineScore(double score) {
        return new Page(id, url, type, category, score);
    }

    public boolean hasBaseline() {
        return baselineScore > 0.0;
    }
}
