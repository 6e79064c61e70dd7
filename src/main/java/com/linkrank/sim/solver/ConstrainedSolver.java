package com.linkrank.sim.solver;

import com.linkrank.sim.api.SimulationCancelledException;
import com.linkrank.sim.api.SolverCheckpoint;
import com.linkrank.sim.api.SolverListener;
import com.linkrank.sim.graph.GraphModel;
import com.linkrank.sim.graph.TransitionMatrix;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.util.WarningRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Damped power iteration over a weighted link graph, optionally under
 * per-page floor and ceiling constraints.
 *
 * Algorithm Details:
 *
 * 1. Baseline: plain PageRank on the weighted graph (no outflow caps),
 * started from the uniform vector. Protection floors are factors of this
 * baseline, boost targets are multiples of it.
 *
 * 2. Constrained loop, started from the baseline:
 * a. Conditional teleport: protected pages below their floor and boosted
 * pages below their target receive dedicated teleport mass from two
 * budgets (see TeleportAllocator). Unused budget returns to the uniform
 * share.
 * b. Step: p = d * M p + (1 - d) * teleport, where M honours outflow caps.
 * c. Projection: water-filling onto [floor, ceiling] with sum 1.
 *
 * 3. Convergence: the L1 residual is computed every iteration and tested
 * against the tolerance every convergenceCheckInterval iterations. Hitting
 * maxIterations is not an error; it is reported as NON_CONVERGENCE.
 *
 * Budgets: if the protection and boost budgets add up to more than 1 they
 * are clamped (protection to at most 0.4, boost to at most 0.6 minus the
 * protection budget) and BUDGET_OVERFLOW is recorded.
 *
 * Cancellation: the checkpoint is queried at every iteration boundary. A
 * cancelled solve throws SimulationCancelledException and produces no
 * result.
 *
 * Instances are not thread-safe; one solver drives one solve at a time.
 */
public final class ConstrainedSolver {
    private static final Logger log = LogManager.getLogger(ConstrainedSolver.class);

    /** Boosted pages are capped at this multiple of their target. */
    public static final double BOOST_CEILING_MULTIPLIER = 2.0;

    static final double CLAMPED_MAX_PROTECT_BUDGET = 0.4;
    static final double CLAMPED_TOTAL_BUDGET = 0.6;

    private final SolverOptions options;
    private final ExecutorService workers;
    private final WarningRateLimiter degenerateWarnings = new WarningRateLimiter(log, 1000);

    private SolverListener listener;
    private SolverCheckpoint checkpoint = SolverCheckpoint.NONE;

    public ConstrainedSolver(SolverOptions options) {
        this(options, null);
    }

    /**
     * @param workers Pool used to split the multiply into row blocks when the
     *                graph is large enough; null for sequential solving.
     */
    public ConstrainedSolver(SolverOptions options, ExecutorService workers) {
        this.options = options;
        this.workers = workers;
    }

    public void setListener(SolverListener listener) {
        this.listener = listener;
    }

    public void setCheckpoint(SolverCheckpoint checkpoint) {
        this.checkpoint = checkpoint == null ? SolverCheckpoint.NONE : checkpoint;
    }

    /**
     * Size heuristic, in seconds, for a graph of n pages and m links.
     */
    public static double estimateSeconds(int n, int m, int maxIterations) {
        return 0.1 + (n * 1e-5 + m * 1e-6) * Math.min(100, maxIterations);
    }

    /** Unconstrained importance scores. */
    public SolverResult solveBaseline(GraphModel graph, Map<Edge, Double> weights) {
        return solve(graph, weights, ConstraintSet.NONE);
    }

    public SolverResult solve(GraphModel graph, Map<Edge, Double> weights, ConstraintSet constraints) {
        final int n = graph.nodeCount();
        if (n == 0)
            throw new IllegalArgumentException("Cannot solve an empty graph");

        final SolverListener l = this.listener;
        final EnumSet<SolverWarning> warnings = EnumSet.noneOf(SolverWarning.class);

        phase(l, SolverPhase.INIT);
        double estimate = estimateSeconds(n, graph.edgeCount(), options.maxIterations());
        boolean large = estimate > options.timeThresholdSeconds();
        if (large)
            log.warn("Graph with {} pages and {} links is estimated at {}s, above the {}s threshold; solving anyway",
                    n, graph.edgeCount(), String.format("%.1f", estimate), options.timeThresholdSeconds());

        double protectBudget = options.protectBudget();
        double boostBudget = options.boostBudget();
        if (protectBudget + boostBudget > 1.0) {
            double clampedProtect = Math.min(protectBudget, CLAMPED_MAX_PROTECT_BUDGET);
            double clampedBoost = Math.min(boostBudget, CLAMPED_TOTAL_BUDGET - clampedProtect);
            log.warn("Protection and boost budgets sum above 1 ({} + {}), clamped to {} + {}",
                    protectBudget, boostBudget, clampedProtect, clampedBoost);
            warn(l, warnings, SolverWarning.BUDGET_OVERFLOW,
                    "budgets clamped to " + clampedProtect + " + " + clampedBoost);
            protectBudget = clampedProtect;
            boostBudget = clampedBoost;
        }

        // 1. Baseline
        phase(l, SolverPhase.BASELINE);
        TransitionMatrix plain = TransitionMatrix.build(graph, weights, Map.of());
        double[] uniform = new double[n];
        Arrays.fill(uniform, 1.0 / n);
        LoopState baseline = iterate(plain, uniform, null, null, l);
        log.debug("Baseline pass: {} iteration(s), residual {}, converged={}", baseline.iterations,
                baseline.residual, baseline.converged);

        if (constraints.isEmpty())
            return finish(graph, baseline, l, warnings, protectBudget, boostBudget, estimate, large);

        // 2. Resolve constraints onto indices
        double[] floors = new double[n];
        double[] ceilings = new double[n];
        Arrays.fill(ceilings, Double.POSITIVE_INFINITY);

        List<Integer> protectedList = new ArrayList<>();
        List<Double> floorList = new ArrayList<>();
        for (Map.Entry<String, ConstraintSet.Protection> e : constraints.protections().entrySet()) {
            int idx = graph.indexOfUrl(e.getKey());
            if (idx < 0) {
                unknownUrl(l, warnings, "protection", e.getKey());
                continue;
            }
            ConstraintSet.Protection protection = e.getValue();
            double floor = protection.absolute() ? protection.value() : protection.value() * baseline.p[idx];
            floors[idx] = Math.max(floors[idx], floor);
            protectedList.add(idx);
            floorList.add(floor);
        }

        List<Integer> boostedList = new ArrayList<>();
        List<Double> targetList = new ArrayList<>();
        for (Map.Entry<String, Double> e : constraints.boosts().entrySet()) {
            int idx = graph.indexOfUrl(e.getKey());
            if (idx < 0) {
                unknownUrl(l, warnings, "boost", e.getKey());
                continue;
            }
            double target = e.getValue() * baseline.p[idx];
            ceilings[idx] = Math.min(ceilings[idx], BOOST_CEILING_MULTIPLIER * target);
            boostedList.add(idx);
            targetList.add(target);
        }

        Map<Integer, Double> caps = new HashMap<>();
        for (Map.Entry<String, Double> e : constraints.outflowCaps().entrySet()) {
            int idx = graph.indexOfUrl(e.getKey());
            if (idx < 0) {
                unknownUrl(l, warnings, "outflow cap", e.getKey());
                continue;
            }
            caps.put(idx, e.getValue());
        }

        TeleportAllocator allocator = new TeleportAllocator(n, toIntArray(protectedList), toDoubleArray(floorList),
                toIntArray(boostedList), toDoubleArray(targetList), protectBudget, boostBudget);
        WaterFilling projection = new WaterFilling(floors, ceilings);
        TransitionMatrix capped = caps.isEmpty() ? plain : TransitionMatrix.build(graph, weights, caps);

        // 3. Constrained loop from the baseline
        phase(l, SolverPhase.FAST);
        LoopState fast = iterate(capped, baseline.p.clone(), allocator, projection, l);
        if (fast.degenerate > 0)
            warn(l, warnings, SolverWarning.DEGENERATE_PROJECTION,
                    fast.degenerate + " iteration(s) relaxed infeasible bounds");

        return finish(graph, fast, l, warnings, protectBudget, boostBudget, estimate, large);
    }

    private LoopState iterate(TransitionMatrix matrix, double[] start, TeleportAllocator allocator,
            WaterFilling projection, SolverListener l) {
        final int n = start.length;
        final double d = options.damping();
        final int checkEvery = options.convergenceCheckInterval();
        final int yieldEvery = options.yieldInterval();

        LoopState state = new LoopState();
        double[] p = start;
        double[] next = new double[n];
        double[] teleport = new double[n];
        Arrays.fill(teleport, 1.0 / n);
        BudgetUsage usage = BudgetUsage.ZERO;

        for (int iter = 0; iter < options.maxIterations(); iter++) {
            if (checkpoint.isCancelled())
                throw new SimulationCancelledException("Solve cancelled at iteration " + iter);

            if (allocator != null)
                usage = allocator.allocate(p, teleport);

            multiply(matrix, p, next);
            for (int i = 0; i < n; i++)
                next[i] = d * next[i] + (1.0 - d) * teleport[i];

            if (projection != null) {
                if (projection.project(next) == WaterFilling.Outcome.DEGENERATE) {
                    state.degenerate++;
                    degenerateWarnings.warn("Projection bounds infeasible at iteration " + iter
                            + "; relaxed ceilings before floors");
                }
            } else {
                normalize(next);
            }

            double residual = 0.0;
            for (int i = 0; i < n; i++)
                residual += Math.abs(next[i] - p[i]);

            double[] tmp = p;
            p = next;
            next = tmp;
            state.iterations = iter + 1;
            state.residual = residual;

            if (l != null)
                l.onIteration(iter, residual, usage.protectUsed(), usage.boostUsed());

            if (iter % checkEvery == 0 && residual < options.tolerance()) {
                state.converged = true;
                break;
            }
            if ((iter + 1) % yieldEvery == 0)
                checkpoint.yieldControl(iter + 1);
        }
        if (!state.converged && state.residual < options.tolerance())
            state.converged = true;

        state.p = p;
        state.usage = usage;
        return state;
    }

    private void multiply(TransitionMatrix matrix, double[] p, double[] out) {
        final int n = matrix.nodeCount();
        final int blocks = options.parallelism();
        if (workers == null || blocks <= 1 || n < options.parallelThreshold()) {
            matrix.multiply(p, out);
            return;
        }

        final double share = matrix.danglingShare(p);
        final int blockSize = (n + blocks - 1) / blocks;
        List<Callable<Void>> tasks = new ArrayList<>(blocks);
        for (int from = 0; from < n; from += blockSize) {
            final int lo = from;
            final int hi = Math.min(n, from + blockSize);
            tasks.add(() -> {
                matrix.multiplyRows(p, out, lo, hi, share);
                return null;
            });
        }
        try {
            for (Future<Void> f : workers.invokeAll(tasks))
                f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulationCancelledException("Solve interrupted during multiply");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Row block multiply failed", e.getCause());
        }
    }

    private SolverResult finish(GraphModel graph, LoopState state, SolverListener l, EnumSet<SolverWarning> warnings,
            double protectBudget, double boostBudget, double estimate, boolean large) {
        if (!state.converged) {
            log.warn("No convergence after {} iteration(s), residual {} above tolerance {}", state.iterations,
                    state.residual, options.tolerance());
            warn(l, warnings, SolverWarning.NON_CONVERGENCE, "residual " + state.residual);
        }
        SolverPhase terminal = state.converged ? SolverPhase.CONVERGED : SolverPhase.MAX_ITER_REACHED;
        phase(l, terminal);

        Map<Long, Double> scores = new LinkedHashMap<>(graph.nodeCount() * 2);
        for (int i = 0; i < graph.nodeCount(); i++)
            scores.put(graph.page(i).id(), state.p[i]);

        SolverResult result = new SolverResult(scores, terminal, state.converged, state.iterations, state.residual,
                state.usage.protectUsed(), state.usage.boostUsed(), protectBudget, boostBudget, state.degenerate,
                estimate, large, warnings);
        log.info("Solve finished: phase={}, iterations={}, residual={}", terminal, state.iterations, state.residual);
        if (l != null)
            l.onFinished(result);
        return result;
    }

    private static void phase(SolverListener l, SolverPhase phase) {
        log.debug("Solver phase {}", phase);
        if (l != null)
            l.onPhase(phase);
    }

    private static void warn(SolverListener l, EnumSet<SolverWarning> warnings, SolverWarning w, String detail) {
        warnings.add(w);
        if (l != null)
            l.onWarning(w, detail);
    }

    private static void unknownUrl(SolverListener l, EnumSet<SolverWarning> warnings, String what, String url) {
        log.warn("Ignoring {} for unknown url {}", what, url);
        warn(l, warnings, SolverWarning.UNKNOWN_CONSTRAINT_URL, what + " " + url);
    }

    private static void normalize(double[] v) {
        double s = 0.0;
        for (double x : v)
            s += x;
        if (s > 0) {
            for (int i = 0; i < v.length; i++)
                v[i] /= s;
        }
    }

    private static int[] toIntArray(List<Integer> values) {
        int[] out = new int[values.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = values.get(i);
        return out;
    }

    private static double[] toDoubleArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = values.get(i);
        return out;
    }

    private static final class LoopState {
        double[] p;
        boolean converged;
        int iterations;
        double residual = Double.POSITIVE_INFINITY;
        int degenerate;
        BudgetUsage usage = BudgetUsage.ZERO;
    }
}
