package com.linkrank.sim.rules;

/** The closed set of rule shapes the engine understands. */
public enum RuleKind {
    /** Attribute-filtered linking with a selection strategy. */
    LINKING,
    /** Site-wide navigation links pointing at a set of URLs. */
    MENU,
    /** Footer links from pages of selected types to a set of URLs. */
    FOOTER
}
