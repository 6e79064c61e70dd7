package com.linkrank.sim.api;

/**
 * Cooperative scheduling hook for long solves. The solver asks
 * {@link #isCancelled()} at every iteration boundary and offers
 * {@link #yieldControl(int)} every few iterations.
 */
public interface SolverCheckpoint {

    SolverCheckpoint NONE = new SolverCheckpoint() {
        @Override
        public boolean isCancelled() {
            return false;
        }
    };

    boolean isCancelled();

    default void yieldControl(int iteration) {
    }
}
