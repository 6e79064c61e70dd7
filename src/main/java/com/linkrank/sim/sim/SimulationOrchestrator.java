package com.linkrank.sim.sim;

import com.linkrank.sim.api.SimilarityProvider;
import com.linkrank.sim.api.SimulationException;
import com.linkrank.sim.api.SimulationStore;
import com.linkrank.sim.api.ValidationException;
import com.linkrank.sim.graph.GraphModel;
import com.linkrank.sim.graph.GraphStatistics;
import com.linkrank.sim.graph.GraphStats;
import com.linkrank.sim.io.SimulatorSettings;
import com.linkrank.sim.model.BoostSpec;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;
import com.linkrank.sim.model.PageResult;
import com.linkrank.sim.model.ProtectSpec;
import com.linkrank.sim.model.RunStatus;
import com.linkrank.sim.model.ScoreUpdate;
import com.linkrank.sim.model.SimulationRun;
import com.linkrank.sim.rules.EditScript;
import com.linkrank.sim.rules.LinkRule;
import com.linkrank.sim.rules.LinkRuleEngine;
import com.linkrank.sim.rules.ProposedLink;
import com.linkrank.sim.rules.RuleSpec;
import com.linkrank.sim.rules.StructuralRuleSpec;
import com.linkrank.sim.solver.ConstrainedSolver;
import com.linkrank.sim.solver.ConstraintSet;
import com.linkrank.sim.solver.SolverOptions;
import com.linkrank.sim.solver.SolverResult;
import com.linkrank.sim.weights.WeightBlender;

import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import lombok.extern.log4j.Log4j2;

/**
 * Sequences one simulation run and owns its lifecycle.
 *
 * Steps of {@link #runSimulation}:
 * 1. Validate the request. Invalid requests fail before a run is created.
 * 2. Create the run (PENDING) and move it to RUNNING.
 * 3. Load pages and links. If any page lacks a baseline score, solve the
 * current graph once and persist every score in one bulk update.
 * 4. Apply the rules and the resulting edit script.
 * 5. Blend edge weights and translate boosts and protections into solver
 * constraints. A negative protection factor becomes an absolute floor of
 * current * (1 - |factor|).
 * 6. Solve, compute per-page deltas against the current scores, persist the
 * results and mark the run COMPLETED.
 *
 * Any failure after step 2 marks the run FAILED and is rethrown with the
 * original error as its cause. Failed runs never have results saved.
 */
@Log4j2
public final class SimulationOrchestrator {
    private final SimulationStore store;
    private final SimulatorSettings settings;
    private final WeightBlender blender;
    private final LinkRuleEngine ruleEngine = new LinkRuleEngine();

    public SimulationOrchestrator(SimulationStore store, SimulatorSettings settings) {
        this(store, null, settings);
    }

    /**
     * @param similarity Relevance source; only consulted when the settings
     *                   enable semantic weights. May be null.
     */
    public SimulationOrchestrator(SimulationStore store, SimilarityProvider similarity, SimulatorSettings settings) {
        this.store = store;
        this.settings = settings;
        if (settings.isSemanticWeights() && similarity != null) {
            this.blender = WeightBlender.semantic(similarity, settings.getSemanticThreshold());
        } else {
            if (settings.isSemanticWeights())
                log.warn("Semantic weights enabled but no similarity provider configured, using position weights");
            this.blender = WeightBlender.positional();
        }
    }

    public SimulatorSettings settings() {
        return settings;
    }

    public RunSummary runSimulation(long projectId, String name, List<LinkRule> rules, List<BoostSpec> boosts,
            List<ProtectSpec> protections) {
        return runSimulation(projectId, name, rules, boosts, protections, RunOptions.defaults());
    }

    public RunSummary runSimulation(long projectId, String name, List<LinkRule> rules, List<BoostSpec> boosts,
            List<ProtectSpec> protections, RunOptions options) {
        requireProject(projectId);
        validateRules(rules);
        List<Page> pages = requirePages(projectId);
        List<BoostSpec> boostList = boosts == null ? List.of() : boosts;
        List<ProtectSpec> protectList = protections == null ? List.of() : protections;
        RunOptions opts = options == null ? RunOptions.defaults() : options;

        SimulationRun run = store.createRun(projectId, name, rules, boostList, protectList);
        final long runId = run.id();
        log.info("Run {} '{}' created for project {}: {} rule(s), {} boost(s), {} protection(s)", runId, name,
                projectId, rules.size(), boostList.size(), protectList.size());
        try {
            store.updateRunStatus(runId, RunStatus.RUNNING);
            return execute(run, pages, opts);
        } catch (SimulationException e) {
            markFailed(runId, e);
            throw e;
        } catch (RuntimeException e) {
            SimulationException failure = new SimulationException(
                    "Simulation run " + runId + " failed: " + e.getMessage(), e);
            markFailed(runId, failure);
            throw failure;
        }
    }

    private RunSummary execute(SimulationRun run, List<Page> pages, RunOptions options) {
        final long projectId = run.projectId();
        GraphModel current = GraphModel.of(pages, store.getEdges(projectId));

        SolverOptions solverOptions = settings.toSolverOptions();
        if (options.protectBudget() != null || options.boostBudget() != null) {
            solverOptions = solverOptions.withBudgets(
                    options.protectBudget() != null ? options.protectBudget() : solverOptions.protectBudget(),
                    options.boostBudget() != null ? options.boostBudget() : solverOptions.boostBudget());
        }

        ExecutorService workers = createWorkers();
        try {
            ConstrainedSolver solver = new ConstrainedSolver(solverOptions, workers);
            solver.setCheckpoint(options.checkpoint());
            solver.setListener(options.listener());

            current = ensureBaseline(projectId, current, solver);

            EditScript script = ruleEngine.apply(current, run.rules(), random(options));
            GraphModel modified = script.applyTo(current);
            int newLinks = script.effectiveAdditions().size();
            int removedLinks = script.removedExistingCount(current);
            log.info("Run {}: {} link(s) added, {} removed, graph now has {} link(s)", run.id(), newLinks,
                    removedLinks, modified.edgeCount());

            Map<Edge, Double> weights = blender.blend(modified.edges(), script.addedPositions());
            ConstraintSet constraints = buildConstraints(current, run.boosts(), run.protections(),
                    options.outflowCaps());
            SolverResult result = solver.solve(modified, weights, constraints);

            List<PageResult> results = new ArrayList<>(current.nodeCount());
            for (Page page : current.pages()) {
                double score = result.score(page.id());
                results.add(new PageResult(page.id(), score, score - page.baselineScore()));
            }

            store.saveRunResults(run.id(), results);
            store.updateRunStatus(run.id(), RunStatus.COMPLETED);

            SummaryStats stats = SummaryStats.of(results, newLinks, removedLinks);
            log.info("Run {} completed: converged={}, {} gained, {} lost, total redistribution {}", run.id(),
                    result.converged(), stats.pagesWithPositiveChange(), stats.pagesWithNegativeChange(),
                    stats.totalRedistribution());
            return new RunSummary(run.id(), RunStatus.COMPLETED, newLinks, removedLinks, stats, result);
        } finally {
            if (workers != null)
                workers.shutdownNow();
        }
    }

    /**
     * Dry run of {@code rules} against a project, returning up to
     * {@code previewCount} of the links they would add. Nothing is persisted.
     */
    public RulePreview previewRules(long projectId, List<LinkRule> rules, int previewCount) {
        requireProject(projectId);
        validateRules(rules);
        if (previewCount < 0)
            throw new ValidationException("previewCount must be >= 0: " + previewCount);
        List<Page> pages = requirePages(projectId);

        GraphModel graph = GraphModel.of(pages, store.getEdges(projectId));
        EditScript script = ruleEngine.apply(graph, rules, random(RunOptions.defaults()));
        List<ProposedLink> added = script.effectiveAdditions();

        List<PreviewLink> sample = new ArrayList<>(Math.min(previewCount, added.size()));
        for (int i = 0; i < added.size() && i < previewCount; i++) {
            Edge e = added.get(i).edge();
            Page from = graph.page(graph.indexOf(e.fromId()));
            Page to = graph.page(graph.indexOf(e.toId()));
            sample.add(new PreviewLink(from.url(), to.url(), from.type(), to.type(), from.category(),
                    to.category()));
        }
        return new RulePreview(script.rulesApplied(), added.size(), script.removals().size(), sample,
                added.size() > previewCount);
    }

    public RulePreview previewRules(long projectId, List<LinkRule> rules) {
        return previewRules(projectId, rules, settings.getPreviewCount());
    }

    /** Connectivity statistics of a project's current link graph. */
    public GraphStats graphStats(long projectId) {
        requireProject(projectId);
        return GraphStatistics.compute(store.getPages(projectId), store.getEdges(projectId));
    }

    public static GraphStats graphStats(List<Page> pages, List<Edge> edges) {
        return GraphStatistics.compute(pages, edges);
    }

    private GraphModel ensureBaseline(long projectId, GraphModel graph, ConstrainedSolver solver) {
        int missing = 0;
        for (Page p : graph.pages()) {
            if (!p.hasBaseline())
                missing++;
        }
        if (missing == 0)
            return graph;

        log.info("{} page(s) in project {} have no baseline score, computing baseline", missing, projectId);
        SolverResult baseline = solver.solveBaseline(graph, Map.of());
        List<Page> updated = new ArrayList<>(graph.nodeCount());
        List<ScoreUpdate> updates = new ArrayList<>(graph.nodeCount());
        for (Page p : graph.pages()) {
            double score = baseline.score(p.id());
            updated.add(p.withBaselineScore(score));
            updates.add(new ScoreUpdate(p.id(), score));
        }
        store.bulkUpdateScores(projectId, updates);
        return GraphModel.of(updated, graph.edges());
    }

    private ConstraintSet buildConstraints(GraphModel graph, List<BoostSpec> boosts, List<ProtectSpec> protections,
            Map<String, Double> outflowCaps) {
        Map<String, Page> byUrl = new HashMap<>(graph.nodeCount() * 2);
        for (Page p : graph.pages())
            byUrl.putIfAbsent(p.url(), p);

        ConstraintSet.Builder b = ConstraintSet.builder();
        for (ProtectSpec protection : protections) {
            if (!protection.isRelative()) {
                b.protect(protection.url(), protection.protectionFactor());
                continue;
            }
            Page page = byUrl.get(protection.url());
            if (page == null) {
                log.warn("Protected page {} not found, skipping", protection.url());
            } else if (!page.hasBaseline()) {
                log.warn("Protected page {} has no current score, skipping", protection.url());
            } else {
                b.protectAbsolute(protection.url(), page.baselineScore() * (1.0 - protection.lossLimit()));
            }
        }
        for (BoostSpec boost : boosts)
            b.boost(boost.url(), boost.targetFactor());
        for (Map.Entry<String, Double> cap : outflowCaps.entrySet())
            b.outflowCap(cap.getKey(), cap.getValue());
        return b.build();
    }

    private void markFailed(long runId, SimulationException failure) {
        log.error("Run {} failed", runId, failure);
        try {
            store.updateRunStatus(runId, RunStatus.FAILED);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private void requireProject(long projectId) {
        if (!store.projectExists(projectId))
            throw new ValidationException("Unknown project: " + projectId);
    }

    private List<Page> requirePages(long projectId) {
        List<Page> pages = store.getPages(projectId);
        if (pages.isEmpty())
            throw new ValidationException("Project " + projectId + " has no pages");
        return pages;
    }

    private static void validateRules(List<LinkRule> rules) {
        if (rules == null)
            throw new ValidationException("Rule list is required");
        for (int i = 0; i < rules.size(); i++) {
            LinkRule rule = rules.get(i);
            if (rule == null)
                throw new ValidationException("Rule " + i + " is null");
            boolean shapeMatches = switch (rule.kind()) {
                case LINKING -> rule instanceof RuleSpec;
                case MENU, FOOTER -> rule instanceof StructuralRuleSpec;
            };
            if (!shapeMatches)
                throw new ValidationException("Rule " + i + " of kind " + rule.kind() + " has unsupported type "
                        + rule.getClass().getSimpleName());
        }
    }

    private Random random(RunOptions options) {
        Long seed = options.randomSeed() != null ? options.randomSeed() : settings.getRandomSeed();
        return seed != null ? new Random(seed) : new Random();
    }

    private ExecutorService createWorkers() {
        int parallelism = settings.getParallelism();
        return parallelism > 1 ? Executors.newFixedThreadPool(parallelism, DaemonThreadFactory.INSTANCE) : null;
    }
}
