package com.linkrank.sim.sim;

import com.linkrank.sim.api.SolverCheckpoint;
import com.linkrank.sim.api.SolverListener;

import java.util.Map;

/**
 * Per-run overrides. Null budgets and seed fall back to the simulator
 * settings.
 */
public record RunOptions(Double protectBudget, Double boostBudget, Long randomSeed, Map<String, Double> outflowCaps,
        SolverCheckpoint checkpoint, SolverListener listener) {

    private static final RunOptions DEFAULTS = new RunOptions(null, null, null, Map.of(), SolverCheckpoint.NONE, null);

    public RunOptions {
        outflowCaps = outflowCaps == null ? Map.of() : Map.copyOf(outflowCaps);
        checkpoint = checkpoint == null ? SolverCheckpoint.NONE : checkpoint;
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public RunOptions withBudgets(double protect, double boost) {
        return new RunOptions(protect, boost, randomSeed, outflowCaps, checkpoint, listener);
    }

    public RunOptions withSeed(long seed) {
        return new RunOptions(protectBudget, boostBudget, seed, outflowCaps, checkpoint, listener);
    }

    public RunOptions withOutflowCaps(Map<String, Double> caps) {
        return new RunOptions(protectBudget, boostBudget, randomSeed, caps, checkpoint, listener);
    }

    public RunOptions withCheckpoint(SolverCheckpoint cp) {
        return new RunOptions(protectBudget, boostBudget, randomSeed, outflowCaps, cp, listener);
    }

    public RunOptions withListener(SolverListener l) {
        return new RunOptions(protectBudget, boostBudget, randomSeed, outflowCaps, checkpoint, l);
    }
}
