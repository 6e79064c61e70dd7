package com.linkrank.sim.sim;

import java.util.List;

/**
 * Dry run of a rule list: counts plus the first few links it would add.
 * {@code truncated} is set when more links would be added than are sampled.
 */
public record RulePreview(int rulesApplied, int totalNewLinks, int linksMarkedForRemoval, List<PreviewLink> sampleLinks,
        boolean truncated) {

    public RulePreview {
        sampleLinks = List.copyOf(sampleLinks);
    }
}
