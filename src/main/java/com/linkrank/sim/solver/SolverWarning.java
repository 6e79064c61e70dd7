package com.linkrank.sim.solver;

/** Non-fatal conditions recorded in solver diagnostics. */
public enum SolverWarning {
    /** Iteration limit hit before the residual fell below tolerance. */
    NON_CONVERGENCE,
    /** Protection and boost budgets summed above 1 and were clamped. */
    BUDGET_OVERFLOW,
    /** Projection could not satisfy every bound and relaxed some. */
    DEGENERATE_PROJECTION,
    /** A constraint named a url with no matching page and was ignored. */
    UNKNOWN_CONSTRAINT_URL
}
