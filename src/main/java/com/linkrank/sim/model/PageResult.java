package com.linkrank.sim.model;

/** Outcome of a run for one page: the simulated score and its change against the baseline. */
public record PageResult(long pageId, double newScore, double delta) {
}
