package com.linkrank.sim.store;

import com.linkrank.sim.api.SimulationStore;
import com.linkrank.sim.api.ValidationException;
import com.linkrank.sim.model.BoostSpec;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;
import com.linkrank.sim.model.PageResult;
import com.linkrank.sim.model.ProtectSpec;
import com.linkrank.sim.model.RunStatus;
import com.linkrank.sim.model.ScoreUpdate;
import com.linkrank.sim.model.SimulationRun;
import com.linkrank.sim.rules.LinkRule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.log4j.Log4j2;

/**
 * Thread-safe in-memory {@link SimulationStore}.
 *
 * Every method holds the store's monitor for its whole body, so batch
 * updates are all-or-nothing: a bulk score update validates every page id
 * before writing any of them. Status changes are checked against the run
 * lifecycle and every accepted status is kept in a per-run history.
 */
@Log4j2
public final class InMemorySimulationStore implements SimulationStore {
    private final Map<Long, List<Page>> pages = new HashMap<>();
    private final Map<Long, List<Edge>> edges = new HashMap<>();
    private final Map<Long, SimulationRun> runs = new LinkedHashMap<>();
    private final Map<Long, List<RunStatus>> statusHistory = new HashMap<>();
    private final AtomicLong runIds = new AtomicLong();

    /** Registers (or replaces) a project's pages and links. */
    public synchronized InMemorySimulationStore putProject(long projectId, List<Page> projectPages,
            List<Edge> projectEdges) {
        pages.put(projectId, new ArrayList<>(projectPages));
        edges.put(projectId, new ArrayList<>(projectEdges));
        return this;
    }

    @Override
    public synchronized boolean projectExists(long projectId) {
        return pages.containsKey(projectId);
    }

    @Override
    public synchronized List<Page> getPages(long projectId) {
        return List.copyOf(pages.getOrDefault(projectId, List.of()));
    }

    @Override
    public synchronized List<Edge> getEdges(long projectId) {
        return List.copyOf(edges.getOrDefault(projectId, List.of()));
    }

    @Override
    public synchronized void bulkUpdateScores(long projectId, List<ScoreUpdate> updates) {
        List<Page> current = pages.get(projectId);
        if (current == null)
            throw new ValidationException("Unknown project: " + projectId);

        Map<Long, Integer> index = new HashMap<>(current.size() * 2);
        for (int i = 0; i < current.size(); i++)
            index.put(current.get(i).id(), i);
        for (ScoreUpdate u : updates) {
            if (!index.containsKey(u.pageId()))
                throw new ValidationException("Unknown page " + u.pageId() + " in project " + projectId);
        }

        List<Page> next = new ArrayList<>(current);
        for (ScoreUpdate u : updates) {
            int i = index.get(u.pageId());
            next.set(i, next.get(i).withBaselineScore(u.score()));
        }
        pages.put(projectId, next);
        log.debug("Updated {} score(s) in project {}", updates.size(), projectId);
    }

    @Override
    public synchronized SimulationRun createRun(long projectId, String name, List<LinkRule> rules,
            List<BoostSpec> boosts, List<ProtectSpec> protections) {
        long id = runIds.incrementAndGet();
        SimulationRun run = new SimulationRun(id, projectId, name, rules, boosts, protections, RunStatus.PENDING,
                List.of());
        runs.put(id, run);
        List<RunStatus> history = new ArrayList<>();
        history.add(RunStatus.PENDING);
        statusHistory.put(id, history);
        return run;
    }

    @Override
    public synchronized void updateRunStatus(long runId, RunStatus status) {
        SimulationRun run = requireRun(runId);
        if (!run.status().canTransitionTo(status))
            throw new IllegalStateException("Run " + runId + " cannot move from " + run.status() + " to " + status);
        SimulationRun next = run.withStatus(status);
        if (status == RunStatus.FAILED && !next.results().isEmpty()) {
            log.debug("Discarding {} result(s) of failed run {}", next.results().size(), runId);
            next = next.withResults(List.of());
        }
        runs.put(runId, next);
        statusHistory.get(runId).add(status);
    }

    @Override
    public synchronized void saveRunResults(long runId, List<PageResult> results) {
        SimulationRun run = requireRun(runId);
        if (run.status() != RunStatus.RUNNING)
            throw new IllegalStateException("Run " + runId + " is " + run.status() + ", results not accepted");
        runs.put(runId, run.withResults(results));
    }

    @Override
    public synchronized Optional<SimulationRun> getRun(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /** Every status the run has been in, oldest first. */
    public synchronized List<RunStatus> statusHistory(long runId) {
        List<RunStatus> history = statusHistory.get(runId);
        return history == null ? List.of() : List.copyOf(history);
    }

    public synchronized List<SimulationRun> runs() {
        return List.copyOf(runs.values());
    }

    private SimulationRun requireRun(long runId) {
        SimulationRun run = runs.get(runId);
        if (run == null)
            throw new IllegalArgumentException("Unknown run: " + runId);
        return run;
    }
}
