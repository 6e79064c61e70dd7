package com.linkrank.sim.api;

import com.linkrank.sim.model.BoostSpec;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;
import com.linkrank.sim.model.PageResult;
import com.linkrank.sim.model.ProtectSpec;
import com.linkrank.sim.model.RunStatus;
import com.linkrank.sim.model.ScoreUpdate;
import com.linkrank.sim.model.SimulationRun;
import com.linkrank.sim.rules.LinkRule;

import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for pages, links and simulation runs.
 *
 * Each call is expected to apply atomically: a bulk score update or a result
 * batch is either fully visible or not at all.
 */
public interface SimulationStore {

    boolean projectExists(long projectId);

    List<Page> getPages(long projectId);

    List<Edge> getEdges(long projectId);

    void bulkUpdateScores(long projectId, List<ScoreUpdate> updates);

    /** Creates a run in {@link RunStatus#PENDING}. */
    SimulationRun createRun(long projectId, String name, List<LinkRule> rules,
            List<BoostSpec> boosts, List<ProtectSpec> protections);

    /**
     * Moves a run along its lifecycle. Moving a run to {@link RunStatus#FAILED}
     * discards any results saved for it.
     */
    void updateRunStatus(long runId, RunStatus status);

    void saveRunResults(long runId, List<PageResult> results);

    Optional<SimulationRun> getRun(long runId);
}
