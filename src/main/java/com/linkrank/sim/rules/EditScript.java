package com.linkrank.sim.rules;

import com.linkrank.sim.graph.GraphModel;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.LinkPosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of applying a rule list: ordered additions plus a set of edges to
 * exclude. Removals win over additions and are applied against the full
 * edge set (existing plus added), after every rule has run.
 */
public final class EditScript {
    private final List<ProposedLink> additions;
    private final Set<Edge> removals;
    private final List<RuleOutcome> outcomes;

    EditScript(List<ProposedLink> additions, Set<Edge> removals, List<RuleOutcome> outcomes) {
        this.additions = Collections.unmodifiableList(new ArrayList<>(additions));
        this.removals = Collections.unmodifiableSet(new LinkedHashSet<>(removals));
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public List<ProposedLink> additions() {
        return additions;
    }

    public Set<Edge> removals() {
        return removals;
    }

    public List<RuleOutcome> outcomes() {
        return outcomes;
    }

    public int rulesApplied() {
        return outcomes.size();
    }

    /** Additions that survive the removal pass, in emission order. */
    public List<ProposedLink> effectiveAdditions() {
        List<ProposedLink> out = new ArrayList<>(additions.size());
        for (ProposedLink link : additions) {
            if (!removals.contains(link.edge()))
                out.add(link);
        }
        return out;
    }

    /** Placement of every surviving added edge, used for weighting. */
    public Map<Edge, LinkPosition> addedPositions() {
        Map<Edge, LinkPosition> out = new LinkedHashMap<>();
        for (ProposedLink link : effectiveAdditions())
            out.put(link.edge(), link.position());
        return out;
    }

    /** Number of pre-existing edges of {@code base} that the removal pass deletes. */
    public int removedExistingCount(GraphModel base) {
        int count = 0;
        for (Edge e : removals) {
            if (base.containsEdge(e))
                count++;
        }
        return count;
    }

    /** Final edge set: existing plus additions, minus removals. Page indices are unchanged. */
    public GraphModel applyTo(GraphModel base) {
        Set<Edge> edges = new LinkedHashSet<>(base.edges());
        for (ProposedLink link : additions)
            edges.add(link.edge());
        edges.removeAll(removals);
        return base.withEdges(edges);
    }
}
