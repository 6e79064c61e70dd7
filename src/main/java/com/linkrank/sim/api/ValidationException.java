package com.linkrank.sim.api;

/** Invalid input: unknown project, empty page set, malformed rule, boost or protection. */
public class ValidationException extends SimulationException {

    public ValidationException(String message) {
        super(message);
    }
}
