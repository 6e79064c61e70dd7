package com.linkrank.sim.rules;

import com.linkrank.sim.model.LinkPosition;

/** A rule that edits the link graph. Implemented by {@link RuleSpec} and {@link StructuralRuleSpec}. */
public interface LinkRule {

    RuleKind kind();

    /** Position of the links this rule adds, used for weighting. */
    LinkPosition position();
}
