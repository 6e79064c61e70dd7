package com.linkrank.sim.solver;

public enum SolverPhase {
    INIT,
    BASELINE,
    FAST,
    CONVERGED,
    MAX_ITER_REACHED;

    public boolean isTerminal() {
        return this == CONVERGED || this == MAX_ITER_REACHED;
    }
}
