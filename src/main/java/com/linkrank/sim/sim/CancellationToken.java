package com.linkrank.sim.sim;

import com.linkrank.sim.api.SolverCheckpoint;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between a caller and a running solve. Also
 * yields the solving thread when offered, so other work on the same
 * scheduler gets a turn during long solves.
 */
public final class CancellationToken implements SolverCheckpoint {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public void yieldControl(int iteration) {
        Thread.yield();
    }
}
