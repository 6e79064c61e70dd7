package com.linkrank.sim.api;

import com.linkrank.sim.solver.SolverPhase;
import com.linkrank.sim.solver.SolverResult;
import com.linkrank.sim.solver.SolverWarning;

/**
 * Observability interface for the constrained solver.
 *
 * Implementations are registered with the ConstrainedSolver and receive
 * callbacks from inside its iteration loop. Typical uses:
 *
 * - Tracing: recording the residual curve of a slow-converging run.
 * - Budget analysis: seeing how much teleport mass protections and boosts
 * actually consumed per iteration.
 * - Alerting: reacting to degenerate projections or budget clamps.
 *
 * Callbacks run on the solving thread. Keep them light, anything slow here
 * slows every iteration.
 */
public interface SolverListener {

    /** Called when the solver enters a new phase. */
    void onPhase(SolverPhase phase);

    /**
     * Called after each completed iteration of the constrained loop.
     *
     * @param iteration   Zero-based iteration number.
     * @param residual    L1 distance between this iterate and the previous one.
     * @param protectUsed Teleport mass allocated to protected pages.
     * @param boostUsed   Teleport mass allocated to boosted pages.
     */
    void onIteration(int iteration, double residual, double protectUsed, double boostUsed);

    /** Called when a non-fatal condition is recorded in the diagnostics. */
    void onWarning(SolverWarning warning, String detail);

    /** Called once with the final result, before it is returned. */
    void onFinished(SolverResult result);
}
