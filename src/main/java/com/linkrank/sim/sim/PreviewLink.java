package com.linkrank.sim.sim;

/** One link a rule list would add, described by page attributes. */
public record PreviewLink(String fromUrl, String toUrl, String fromType, String toType, String fromCategory,
        String toCategory) {
}
