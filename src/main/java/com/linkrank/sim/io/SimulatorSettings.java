package com.linkrank.sim.io;

import com.linkrank.sim.solver.SolverOptions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Simulator configuration, bound from JSON. Field initializers are the
 * defaults used when a key is absent.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SimulatorSettings {
    private double damping = SolverOptions.DEFAULT_DAMPING;
    private int maxIterations = SolverOptions.DEFAULT_MAX_ITERATIONS;
    private double tolerance = SolverOptions.DEFAULT_TOLERANCE;
    private double protectBudget = SolverOptions.DEFAULT_PROTECT_BUDGET;
    private double boostBudget = SolverOptions.DEFAULT_BOOST_BUDGET;

    private boolean semanticWeights;
    private double semanticThreshold = 0.4;

    private double timeThresholdMinutes = 15;
    private int convergenceCheckInterval = 10;
    private int yieldInterval = 100;
    private int parallelism = 1;
    private int parallelThreshold = 50_000;

    /** Seed for rule randomness; null draws a fresh seed per run. */
    private Long randomSeed;
    private int previewCount = 5;

    public static SimulatorSettings defaults() {
        return new SimulatorSettings();
    }

    /**
     * Solver options derived from these settings.
     *
     * @throws IllegalArgumentException if a numeric setting is out of range.
     */
    public SolverOptions toSolverOptions() {
        return new SolverOptions(damping, tolerance, maxIterations, protectBudget, boostBudget,
                convergenceCheckInterval, yieldInterval, timeThresholdMinutes * 60.0, parallelism, parallelThreshold);
    }
}
