package com.linkrank.sim.model;

/**
 * Lifecycle of a simulation run. COMPLETED and FAILED are terminal: a failed
 * run is never resumed, a new run has to be created instead.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(RunStatus next) {
        switch (this) {
            case PENDING:
                return next == RUNNING || next == FAILED;
            case RUNNING:
                return next == COMPLETED || next == FAILED;
            default:
                return false;
        }
    }
}
