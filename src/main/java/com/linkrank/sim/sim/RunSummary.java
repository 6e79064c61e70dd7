package com.linkrank.sim.sim;

import com.linkrank.sim.model.RunStatus;
import com.linkrank.sim.solver.SolverResult;

/** What a completed run reports back to its caller. */
public record RunSummary(long runId, RunStatus status, int newLinksCount, int removedLinksCount, SummaryStats stats,
        SolverResult diagnostics) {
}
