package com.linkrank.sim.api;

/**
 * Base failure of a simulation run. Unchecked: callers either let it
 * propagate to the run boundary (where the run is marked failed) or handle
 * the specific subtypes.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
