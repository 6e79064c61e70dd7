package com.linkrank.sim.solver;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Scores and diagnostics of one solve.
 *
 * @param scores              Score per page id, in graph order. Sums to 1.
 * @param phase               Terminal phase: CONVERGED or MAX_ITER_REACHED.
 * @param converged           Whether the residual fell below tolerance.
 * @param iterationsRun       Iterations of the final loop (baseline loop when unconstrained).
 * @param finalResidual       L1 residual of the last iteration.
 * @param protectBudgetUsed   Protection teleport mass used in the last iteration.
 * @param boostBudgetUsed     Boost teleport mass used in the last iteration.
 * @param protectBudget       Protection budget after clamping.
 * @param boostBudget         Boost budget after clamping.
 * @param degenerateProjections Number of iterations whose projection relaxed bounds.
 * @param estimatedSeconds    Size-based runtime estimate.
 * @param largeGraph          Whether the estimate exceeds the configured threshold.
 * @param warnings            Non-fatal conditions seen during the solve.
 */
public record SolverResult(Map<Long, Double> scores, SolverPhase phase, boolean converged, int iterationsRun,
        double finalResidual, double protectBudgetUsed, double boostBudgetUsed, double protectBudget,
        double boostBudget, int degenerateProjections, double estimatedSeconds, boolean largeGraph,
        Set<SolverWarning> warnings) {

    public SolverResult {
        scores = Collections.unmodifiableMap(scores);
        warnings = warnings.isEmpty() ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(warnings));
    }

    public double score(long pageId) {
        Double s = scores.get(pageId);
        if (s == null)
            throw new IllegalArgumentException("No score for page " + pageId);
        return s;
    }

    public boolean hasWarning(SolverWarning warning) {
        return warnings.contains(warning);
    }
}
