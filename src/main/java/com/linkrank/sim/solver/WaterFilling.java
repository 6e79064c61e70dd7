package com.linkrank.sim.solver;

import java.util.Arrays;

/**
 * Projection of a score vector onto {floor <= v <= ceiling, sum(v) = 1}.
 *
 * Steps:
 * 1. Clamp every entry into its bounds.
 * 2. Compute the deficit 1 - sum. Accept if it is below 1e-10 in magnitude.
 * 3. Positive deficit: spread it over entries still below their ceiling,
 * in proportion to their remaining headroom, or evenly when the headroom
 * is unbounded. Negative deficit: take it from entries above their floor,
 * in proportion to their distance to the floor.
 * 4. Clip and repeat until the deficit is absorbed. Every round either
 * finishes or saturates at least one entry, so at most N + 1 rounds run.
 *
 * If no entry can move (every entry saturated), the bounds are infeasible.
 * Ceilings are relaxed before floors: missing mass is added in proportion
 * to the current values, and excess mass with every entry at its floor is
 * removed by rescaling the whole vector.
 */
public final class WaterFilling {
    static final double ACCEPT_EPSILON = 1e-10;

    public enum Outcome {
        /** Bounds satisfied and sum is 1. */
        FEASIBLE,
        /** Bounds were infeasible and some were relaxed. */
        DEGENERATE
    }

    private final double[] floors;
    private final double[] ceilings;

    /**
     * Ceilings below their floor are raised to the floor.
     */
    public WaterFilling(double[] floors, double[] ceilings) {
        if (floors.length != ceilings.length)
            throw new IllegalArgumentException("floors and ceilings differ in length");
        this.floors = floors.clone();
        this.ceilings = ceilings.clone();
        for (int i = 0; i < floors.length; i++) {
            if (this.ceilings[i] < this.floors[i])
                this.ceilings[i] = this.floors[i];
        }
    }

    /** Unconstrained bounds: floor 0 and ceiling +infinity everywhere. */
    public static WaterFilling unbounded(int n) {
        double[] ceilings = new double[n];
        Arrays.fill(ceilings, Double.POSITIVE_INFINITY);
        return new WaterFilling(new double[n], ceilings);
    }

    /** Projects {@code v} in place. */
    public Outcome project(double[] v) {
        final int n = v.length;
        if (n == 0)
            return Outcome.FEASIBLE;
        clamp(v);

        Outcome outcome = Outcome.FEASIBLE;
        for (int round = 0; round <= n; round++) {
            double deficit = 1.0 - sum(v);
            if (Math.abs(deficit) < ACCEPT_EPSILON)
                break;
            boolean moved = deficit > 0 ? raise(v, deficit) : lower(v, -deficit);
            if (!moved) {
                relax(v, deficit);
                outcome = Outcome.DEGENERATE;
                break;
            }
            clamp(v);
        }

        double total = sum(v);
        if (total > 0) {
            for (int i = 0; i < n; i++)
                v[i] /= total;
        } else {
            Arrays.fill(v, 1.0 / n);
            outcome = Outcome.DEGENERATE;
        }
        return outcome;
    }

    private boolean raise(double[] v, double deficit) {
        int adjustable = 0;
        int unboundedCount = 0;
        double headroom = 0.0;
        for (int i = 0; i < v.length; i++) {
            if (v[i] < ceilings[i]) {
                adjustable++;
                if (Double.isInfinite(ceilings[i]))
                    unboundedCount++;
                else
                    headroom += ceilings[i] - v[i];
            }
        }
        if (adjustable == 0)
            return false;

        if (unboundedCount > 0) {
            double share = deficit / adjustable;
            for (int i = 0; i < v.length; i++) {
                if (v[i] < ceilings[i])
                    v[i] += share;
            }
        } else if (headroom >= deficit) {
            double ratio = deficit / headroom;
            for (int i = 0; i < v.length; i++) {
                if (v[i] < ceilings[i])
                    v[i] += ratio * (ceilings[i] - v[i]);
            }
        } else {
            // not enough room: saturate, the next round reports it
            for (int i = 0; i < v.length; i++)
                v[i] = Math.max(v[i], ceilings[i]);
        }
        return true;
    }

    private boolean lower(double[] v, double excess) {
        double slack = 0.0;
        for (int i = 0; i < v.length; i++) {
            if (v[i] > floors[i])
                slack += v[i] - floors[i];
        }
        if (slack <= 0)
            return false;

        if (slack >= excess) {
            double ratio = excess / slack;
            for (int i = 0; i < v.length; i++) {
                if (v[i] > floors[i])
                    v[i] -= ratio * (v[i] - floors[i]);
            }
        } else {
            System.arraycopy(floors, 0, v, 0, v.length);
        }
        return true;
    }

    private static void relax(double[] v, double deficit) {
        if (deficit > 0) {
            double total = sum(v);
            if (total > 0) {
                for (int i = 0; i < v.length; i++)
                    v[i] += deficit * v[i] / total;
            } else {
                double share = deficit / v.length;
                for (int i = 0; i < v.length; i++)
                    v[i] += share;
            }
        }
        // excess mass with all entries at their floors is left to the final rescale
    }

    private void clamp(double[] v) {
        for (int i = 0; i < v.length; i++) {
            double x = v[i];
            if (Double.isNaN(x) || x < floors[i])
                x = floors[i];
            if (x > ceilings[i])
                x = ceilings[i];
            v[i] = x;
        }
    }

    private static double sum(double[] v) {
        double s = 0.0;
        for (double x : v)
            s += x;
        return s;
    }
}
