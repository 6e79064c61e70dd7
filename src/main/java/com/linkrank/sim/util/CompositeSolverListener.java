package com.linkrank.sim.util;

import com.linkrank.sim.api.SolverListener;
import com.linkrank.sim.solver.SolverPhase;
import com.linkrank.sim.solver.SolverResult;
import com.linkrank.sim.solver.SolverWarning;

import java.util.Arrays;

/**
 * Fans solver callbacks out to several {@link SolverListener} instances.
 * Listeners are held in an array replaced on every add, so iteration in the
 * solver loop allocates nothing.
 */
public class CompositeSolverListener implements SolverListener {
    private SolverListener[] listeners = new SolverListener[0];

    public CompositeSolverListener add(SolverListener listener) {
        SolverListener[] old = listeners;
        SolverListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPhase(SolverPhase phase) {
        for (SolverListener l : listeners)
            l.onPhase(phase);
    }

    @Override
    public void onIteration(int iteration, double residual, double protectUsed, double boostUsed) {
        for (SolverListener l : listeners)
            l.onIteration(iteration, residual, protectUsed, boostUsed);
    }

    @Override
    public void onWarning(SolverWarning warning, String detail) {
        for (SolverListener l : listeners)
            l.onWarning(warning, detail);
    }

    @Override
    public void onFinished(SolverResult result) {
        for (SolverListener l : listeners)
            l.onFinished(result);
    }
}
