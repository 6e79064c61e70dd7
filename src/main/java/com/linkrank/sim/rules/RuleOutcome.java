package com.linkrank.sim.rules;

/** Per-rule tally of what the engine emitted. */
public record RuleOutcome(int ruleIndex, RuleKind kind, int linksAdded, int linksMarkedForRemoval) {
}
