package com.linkrank.sim.solver;

/**
 * Numeric settings of one solve.
 *
 * @param damping                  Probability of following a link, in (0, 1).
 * @param tolerance                L1 residual below which the solve has converged.
 * @param maxIterations            Hard iteration limit.
 * @param protectBudget            Teleport mass reserved for protected pages.
 * @param boostBudget              Teleport mass reserved for boosted pages.
 * @param convergenceCheckInterval Residual is tested every this many iterations.
 * @param yieldInterval            Checkpoint is offered a yield every this many iterations.
 * @param timeThresholdSeconds     Estimated runtime above which a run is reported as large.
 * @param parallelism              Worker threads for the multiply; 1 means sequential.
 * @param parallelThreshold        Minimum node count before the multiply is parallelized.
 */
public record SolverOptions(double damping, double tolerance, int maxIterations, double protectBudget,
        double boostBudget, int convergenceCheckInterval, int yieldInterval, double timeThresholdSeconds,
        int parallelism, int parallelThreshold) {

    public static final double DEFAULT_DAMPING = 0.85;
    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final int DEFAULT_MAX_ITERATIONS = 200;
    public static final double DEFAULT_PROTECT_BUDGET = 0.05;
    public static final double DEFAULT_BOOST_BUDGET = 0.08;

    public SolverOptions {
        if (!(damping > 0 && damping < 1))
            throw new IllegalArgumentException("damping must be in (0, 1): " + damping);
        if (!(tolerance > 0))
            throw new IllegalArgumentException("tolerance must be > 0: " + tolerance);
        if (maxIterations < 1)
            throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        if (!(protectBudget >= 0 && protectBudget <= 1))
            throw new IllegalArgumentException("protectBudget must be in [0, 1]: " + protectBudget);
        if (!(boostBudget >= 0 && boostBudget <= 1))
            throw new IllegalArgumentException("boostBudget must be in [0, 1]: " + boostBudget);
        if (convergenceCheckInterval < 1 || yieldInterval < 1)
            throw new IllegalArgumentException("check and yield intervals must be >= 1");
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
    }

    public static SolverOptions defaults() {
        return new SolverOptions(DEFAULT_DAMPING, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS, DEFAULT_PROTECT_BUDGET,
                DEFAULT_BOOST_BUDGET, 10, 100, 15 * 60.0, 1, 50_000);
    }

    public SolverOptions withBudgets(double protect, double boost) {
        return new SolverOptions(damping, tolerance, maxIterations, protect, boost, convergenceCheckInterval,
                yieldInterval, timeThresholdSeconds, parallelism, parallelThreshold);
    }

    public SolverOptions withIterations(int max, double tol) {
        return new SolverOptions(damping, tol, max, protectBudget, boostBudget, convergenceCheckInterval,
                yieldInterval, timeThresholdSeconds, parallelism, parallelThreshold);
    }

    public SolverOptions withParallelism(int workers, int threshold) {
        return new SolverOptions(damping, tolerance, maxIterations, protectBudget, boostBudget,
                convergenceCheckInterval, yieldInterval, timeThresholdSeconds, workers, threshold);
    }
}
