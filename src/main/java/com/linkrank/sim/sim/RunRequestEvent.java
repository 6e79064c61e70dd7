package com.linkrank.sim.sim;

import java.util.concurrent.CompletableFuture;

/**
 * A mutable slot in the dispatcher's ring buffer.
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every request that passes through their slot. The consumer clears the slot
 * after the run finishes so it holds no references to finished work.
 */
final class RunRequestEvent {
    private RunRequest request;
    private CompletableFuture<RunSummary> result;
    private CancellationToken token;
    private long submittedNanos;

    void set(RunRequest request, CompletableFuture<RunSummary> result, CancellationToken token) {
        this.request = request;
        this.result = result;
        this.token = token;
        this.submittedNanos = System.nanoTime();
    }

    RunRequest request() {
        return request;
    }

    CompletableFuture<RunSummary> result() {
        return result;
    }

    CancellationToken token() {
        return token;
    }

    long submittedNanos() {
        return submittedNanos;
    }

    void clear() {
        request = null;
        result = null;
        token = null;
        submittedNanos = 0;
    }

    @Override
    public String toString() {
        return request == null ? "RunRequestEvent[empty]"
                : "RunRequestEvent[" + request.name() + ", project " + request.projectId() + "]";
    }
}
