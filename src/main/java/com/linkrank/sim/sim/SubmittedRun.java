package com.linkrank.sim.sim;

import java.util.concurrent.CompletableFuture;

/** Handle for a queued run: its eventual summary and a way to cancel it. */
public record SubmittedRun(CompletableFuture<RunSummary> result, CancellationToken token) {

    public void cancel() {
        token.cancel();
    }
}
