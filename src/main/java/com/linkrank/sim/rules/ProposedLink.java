package com.linkrank.sim.rules;

import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.LinkPosition;

/** A link added by a rule, with its placement and the index of the rule that produced it. */
public record ProposedLink(Edge edge, LinkPosition position, int ruleIndex) {
}
