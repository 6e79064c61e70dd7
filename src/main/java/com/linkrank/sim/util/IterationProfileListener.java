package com.linkrank.sim.util;

import com.linkrank.sim.api.SolverListener;
import com.linkrank.sim.solver.SolverPhase;
import com.linkrank.sim.solver.SolverResult;
import com.linkrank.sim.solver.SolverWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Records the residual and budget trace of a solve, grouped by phase. */
public class IterationProfileListener implements SolverListener {

    /** One recorded iteration. */
    public record Sample(SolverPhase phase, int iteration, double residual, double protectUsed, double boostUsed) {
    }

    private final List<Sample> samples = new ArrayList<>();
    private final List<SolverPhase> phases = new ArrayList<>();
    private final Map<SolverWarning, Integer> warningCounts = new EnumMap<>(SolverWarning.class);
    private SolverPhase currentPhase = SolverPhase.INIT;
    private long phaseStartNanos;
    private final Map<SolverPhase, Long> phaseNanos = new EnumMap<>(SolverPhase.class);
    private SolverResult lastResult;

    @Override
    public synchronized void onPhase(SolverPhase phase) {
        long now = System.nanoTime();
        if (!phases.isEmpty())
            phaseNanos.merge(currentPhase, now - phaseStartNanos, Long::sum);
        currentPhase = phase;
        phaseStartNanos = now;
        phases.add(phase);
    }

    @Override
    public synchronized void onIteration(int iteration, double residual, double protectUsed, double boostUsed) {
        samples.add(new Sample(currentPhase, iteration, residual, protectUsed, boostUsed));
    }

    @Override
    public synchronized void onWarning(SolverWarning warning, String detail) {
        warningCounts.merge(warning, 1, Integer::sum);
    }

    @Override
    public synchronized void onFinished(SolverResult result) {
        lastResult = result;
    }

    public synchronized List<Sample> samples() {
        return Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public synchronized List<Sample> samples(SolverPhase phase) {
        List<Sample> out = new ArrayList<>();
        for (Sample s : samples) {
            if (s.phase() == phase)
                out.add(s);
        }
        return out;
    }

    public synchronized List<SolverPhase> phases() {
        return Collections.unmodifiableList(new ArrayList<>(phases));
    }

    public synchronized int warningCount(SolverWarning warning) {
        return warningCounts.getOrDefault(warning, 0);
    }

    public synchronized SolverResult lastResult() {
        return lastResult;
    }

    /**
     * Returns a formatted table of time spent and iterations per phase.
     */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-18s | %10s | %12s | %14s%n", "Phase", "Iterations", "Time (ms)", "Last residual"));
        sb.append("--------------------------------------------------------------------\n");
        for (SolverPhase phase : SolverPhase.values()) {
            List<Sample> inPhase = samples(phase);
            Long nanos = phaseNanos.get(phase);
            if (inPhase.isEmpty() && nanos == null)
                continue;
            double lastResidual = inPhase.isEmpty() ? Double.NaN : inPhase.get(inPhase.size() - 1).residual();
            sb.append(String.format("%-18s | %10d | %12.3f | %14.3e%n", phase, inPhase.size(),
                    nanos == null ? 0.0 : nanos / 1e6, lastResidual));
        }
        return sb.toString();
    }
}
