package com.linkrank.sim.solver;

import java.util.Arrays;

/**
 * Builds the conditional teleportation vector for one iteration.
 *
 * Protected pages below their floor share the protection budget in
 * proportion to their shortfall; boosted pages below their target share the
 * boost budget the same way. Whatever part of either budget is not needed
 * goes back to the uniform share, so with no needs the vector is uniform.
 */
final class TeleportAllocator {
    private final int n;
    private final int[] protectedIdx;
    private final double[] floors;
    private final int[] boostedIdx;
    private final double[] targets;
    private final double protectBudget;
    private final double boostBudget;

    /**
     * @param floors  Floor per protected page, aligned with protectedIdx.
     * @param targets Target score per boosted page, aligned with boostedIdx.
     */
    TeleportAllocator(int n, int[] protectedIdx, double[] floors, int[] boostedIdx, double[] targets,
            double protectBudget, double boostBudget) {
        this.n = n;
        this.protectedIdx = protectedIdx;
        this.floors = floors;
        this.boostedIdx = boostedIdx;
        this.targets = targets;
        this.protectBudget = protectBudget;
        this.boostBudget = boostBudget;
    }

    /** Fills {@code teleport} for the current iterate {@code p}. */
    BudgetUsage allocate(double[] p, double[] teleport) {
        Arrays.fill(teleport, 0.0);
        double protectUsed = distribute(p, protectedIdx, floors, protectBudget, teleport);
        double boostUsed = distribute(p, boostedIdx, targets, boostBudget, teleport);

        double uniform = 1.0 - protectBudget - boostBudget
                + (protectBudget - protectUsed) + (boostBudget - boostUsed);
        double share = uniform / n;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            teleport[i] += share;
            sum += teleport[i];
        }
        if (sum > 0 && sum != 1.0) {
            for (int i = 0; i < n; i++)
                teleport[i] /= sum;
        }
        return new BudgetUsage(protectUsed, boostUsed);
    }

    private static double distribute(double[] p, int[] idx, double[] goal, double budget, double[] teleport) {
        if (budget <= 0 || idx.length == 0)
            return 0.0;
        double totalNeed = 0.0;
        for (int k = 0; k < idx.length; k++) {
            double need = goal[k] - p[idx[k]];
            if (need > 0)
                totalNeed += need;
        }
        if (totalNeed <= 0)
            return 0.0;

        double perUnit = budget / totalNeed;
        double used = 0.0;
        for (int k = 0; k < idx.length; k++) {
            double need = goal[k] - p[idx[k]];
            if (need <= 0)
                continue;
            double alloc = Math.min(need * perUnit, budget - used);
            if (alloc <= 0)
                break;
            teleport[idx[k]] += alloc;
            used += alloc;
        }
        return used;
    }
}
