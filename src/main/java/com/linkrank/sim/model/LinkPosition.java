package com.linkrank.sim.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Where on a page a generated link is placed. Links higher on the page carry
 * more structural weight.
 */
public enum LinkPosition {
    HEADER(1.0),
    CONTENT_TOP(0.95),
    CONTENT(0.80),
    CONTENT_BOTTOM(0.60),
    SIDEBAR(0.40),
    FOOTER(0.20);

    private static final Logger log = LogManager.getLogger(LinkPosition.class);

    private final double weight;

    LinkPosition(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    /**
     * Resolves a position label such as {@code content_top} or {@code sidebar}.
     * Blank input means {@link #CONTENT}; unknown labels also resolve to
     * {@link #CONTENT} with a warning.
     */
    public static LinkPosition fromString(String text) {
        if (text == null || text.isBlank())
            return CONTENT;
        String normalized = text.trim().replace('-', '_');
        for (LinkPosition p : values()) {
            if (p.name().equalsIgnoreCase(normalized))
                return p;
        }
        log.warn("Unknown link position '{}', using {}", text, CONTENT);
        return CONTENT;
    }
}
