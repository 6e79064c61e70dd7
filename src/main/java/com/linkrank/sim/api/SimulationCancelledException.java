package com.linkrank.sim.api;

/** Raised at an iteration boundary when the run's checkpoint reports cancellation. */
public class SimulationCancelledException extends SimulationException {

    public SimulationCancelledException(String message) {
        super(message);
    }
}
