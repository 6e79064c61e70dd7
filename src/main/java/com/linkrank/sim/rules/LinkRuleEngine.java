package com.linkrank.sim.rules;

import com.linkrank.sim.graph.GraphModel;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Applies an ordered list of rules to a graph and produces an
 * {@link EditScript}.
 *
 * Rules are cumulative: the engine keeps a running set of edges that are
 * already present (pre-existing, or emitted by an earlier rule or earlier in
 * the same rule) and never emits one of those again. Later rules therefore
 * see what earlier rules added.
 *
 * Linking rules, for each page passing the source filter:
 * 1. Collect candidates passing the target filter, minus the page itself
 * when the rule avoids self links.
 * 2. Ask the rule's selection strategy for up to linksPerPage targets.
 * 3. Emit source->target, and target->source when bidirectional.
 *
 * Menu and footer rules resolve their targets by url. ADD connects every
 * eligible source to each target; REMOVE marks the same pairs for
 * exclusion. Self pairs are skipped in both cases.
 *
 * The engine is stateless; all randomness comes from the Random passed to
 * {@link #apply}.
 */
@Log4j2
public final class LinkRuleEngine {

    public EditScript apply(GraphModel graph, List<? extends LinkRule> rules, Random random) {
        Set<Edge> present = new HashSet<>(graph.edges());
        List<ProposedLink> additions = new ArrayList<>();
        Set<Edge> removals = new LinkedHashSet<>();
        List<RuleOutcome> outcomes = new ArrayList<>(rules.size());

        for (int i = 0; i < rules.size(); i++) {
            LinkRule rule = rules.get(i);
            int addedBefore = additions.size();
            int removedBefore = removals.size();
            switch (rule.kind()) {
                case LINKING -> applyLinking(graph, (RuleSpec) rule, i, present, additions, random);
                case MENU, FOOTER -> applyStructural(graph, (StructuralRuleSpec) rule, i, present, additions, removals);
            }
            RuleOutcome outcome = new RuleOutcome(i, rule.kind(), additions.size() - addedBefore,
                    removals.size() - removedBefore);
            outcomes.add(outcome);
            log.debug("Rule {} ({}) added {} link(s), marked {} for removal", i, rule.kind(),
                    outcome.linksAdded(), outcome.linksMarkedForRemoval());
        }
        return new EditScript(additions, removals, outcomes);
    }

    private void applyLinking(GraphModel graph, RuleSpec rule, int ruleIndex, Set<Edge> present,
            List<ProposedLink> additions, Random random) {
        if (rule.linksPerPage() == 0)
            return;
        List<Page> sources = filter(graph.pages(), rule.sourceFilter());
        List<Page> targets = filter(graph.pages(), rule.targetFilter());
        if (sources.isEmpty() || targets.isEmpty()) {
            log.debug("Rule {} matched {} source(s) and {} target(s), nothing to do", ruleIndex, sources.size(),
                    targets.size());
            return;
        }
        SelectionStrategy strategy = rule.selectionMethod().strategy();

        for (Page source : sources) {
            List<Page> candidates = targets;
            if (rule.avoidSelfLinks()) {
                candidates = new ArrayList<>(targets.size());
                for (Page t : targets) {
                    if (t.id() != source.id())
                        candidates.add(t);
                }
            }
            if (candidates.isEmpty())
                continue;

            for (Page target : strategy.select(source, candidates, rule.linksPerPage(), random)) {
                // self links are never emitted, even when the source stays in its own pool
                if (target.id() == source.id())
                    continue;
                emit(new Edge(source.id(), target.id()), rule, ruleIndex, present, additions);
                if (rule.bidirectional())
                    emit(new Edge(target.id(), source.id()), rule, ruleIndex, present, additions);
            }
        }
    }

    private void applyStructural(GraphModel graph, StructuralRuleSpec rule, int ruleIndex, Set<Edge> present,
            List<ProposedLink> additions, Set<Edge> removals) {
        List<Page> targets = new ArrayList<>();
        for (Page p : graph.pages()) {
            if (rule.matchesTarget(p))
                targets.add(p);
        }
        if (targets.isEmpty()) {
            log.warn("{} rule {} matched no target pages for {}", rule.kind(), ruleIndex, rule.targetUrls());
            return;
        }

        for (Page source : graph.pages()) {
            if (!rule.matchesSource(source))
                continue;
            for (Page target : targets) {
                if (source.id() == target.id())
                    continue;
                Edge edge = new Edge(source.id(), target.id());
                if (rule.action() == StructuralAction.ADD)
                    emit(edge, rule, ruleIndex, present, additions);
                else
                    removals.add(edge);
            }
        }
    }

    private static void emit(Edge edge, LinkRule rule, int ruleIndex, Set<Edge> present,
            List<ProposedLink> additions) {
        if (present.add(edge))
            additions.add(new ProposedLink(edge, rule.position(), ruleIndex));
    }

    static List<Page> filter(List<Page> pages, PageFilter filter) {
        if (filter.isUnrestricted())
            return pages;
        List<Page> out = new ArrayList<>();
        for (Page p : pages) {
            if (filter.matches(p))
                out.add(p);
        }
        return out;
    }
}
