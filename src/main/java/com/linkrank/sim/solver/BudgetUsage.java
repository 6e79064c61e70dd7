package com.linkrank.sim.solver;

/** Teleport mass actually allocated to protected and boosted pages in one iteration. */
public record BudgetUsage(double protectUsed, double boostUsed) {

    public static final BudgetUsage ZERO = new BudgetUsage(0.0, 0.0);
}
