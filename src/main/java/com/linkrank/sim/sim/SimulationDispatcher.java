package com.linkrank.sim.sim;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.concurrent.CompletableFuture;

import lombok.extern.log4j.Log4j2;

/**
 * Runs simulations one at a time on a single consumer thread.
 *
 * Workflow:
 * 1. Any thread calls {@link #submit(RunRequest)}, which claims a ring buffer
 * slot, fills it and publishes it.
 * 2. The Disruptor hands slots to the single consumer in publish order.
 * 3. The consumer runs the simulation through the orchestrator with the
 * request's cancellation token as solver checkpoint, then completes the
 * request's future with the summary or the failure.
 *
 * Runs never overlap, so every run sees the store as the previous run left
 * it. A cancelled request fails at the solver's next iteration boundary, or
 * before its run is created if it was cancelled while still queued.
 */
@Log4j2
public final class SimulationDispatcher implements AutoCloseable {
    private final Disruptor<RunRequestEvent> disruptor;
    private final RingBuffer<RunRequestEvent> ringBuffer;
    private final SimulationOrchestrator orchestrator;

    /**
     * @param bufferSize Ring buffer capacity, a power of two. Submitters block
     *                   when this many runs are queued.
     */
    public SimulationDispatcher(SimulationOrchestrator orchestrator, int bufferSize) {
        if (bufferSize < 1 || Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of 2: " + bufferSize);
        this.orchestrator = orchestrator;
        this.disruptor = new Disruptor<>(RunRequestEvent::new, bufferSize, DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI, new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new RunHandler());
        this.ringBuffer = disruptor.start();
        log.info("Simulation dispatcher started with {} slot(s)", bufferSize);
    }

    public SubmittedRun submit(RunRequest request) {
        CompletableFuture<RunSummary> future = new CompletableFuture<>();
        CancellationToken token = new CancellationToken();
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).set(request, future, token);
        } finally {
            ringBuffer.publish(seq);
        }
        return new SubmittedRun(future, token);
    }

    /** Waits for queued runs to finish, then stops the consumer thread. */
    @Override
    public void close() {
        disruptor.shutdown();
        log.info("Simulation dispatcher stopped");
    }

    private final class RunHandler implements EventHandler<RunRequestEvent> {
        @Override
        public void onEvent(RunRequestEvent event, long sequence, boolean endOfBatch) {
            RunRequest request = event.request();
            CompletableFuture<RunSummary> future = event.result();
            CancellationToken token = event.token();
            try {
                if (token.isCancelled()) {
                    future.cancel(false);
                    log.info("Run '{}' cancelled before it started", request.name());
                    return;
                }
                double waitedMs = (System.nanoTime() - event.submittedNanos()) / 1e6;
                log.debug("Starting run '{}' after {} ms in queue (seq {})", request.name(), waitedMs, sequence);
                RunSummary summary = orchestrator.runSimulation(request.projectId(), request.name(),
                        request.rules(), request.boosts(), request.protections(),
                        request.options().withCheckpoint(token));
                future.complete(summary);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            } finally {
                event.clear();
            }
        }
    }
}
