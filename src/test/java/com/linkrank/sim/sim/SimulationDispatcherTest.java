package com.linkrank.sim.sim;

import com.linkrank.sim.api.SolverListener;
import com.linkrank.sim.io.SimulatorSettings;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;
import com.linkrank.sim.model.RunStatus;
import com.linkrank.sim.rules.LinkRule;
import com.linkrank.sim.rules.StructuralAction;
import com.linkrank.sim.rules.StructuralRuleSpec;
import com.linkrank.sim.solver.SolverPhase;
import com.linkrank.sim.solver.SolverResult;
import com.linkrank.sim.solver.SolverWarning;
import com.linkrank.sim.store.InMemorySimulationStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class SimulationDispatcherTest {

    private static final long PROJECT = 1L;

    private InMemorySimulationStore store;
    private SimulationDispatcher dispatcher;

    @Before
    public void setUp() {
        store = new InMemorySimulationStore();
        store.putProject(PROJECT, List.of(
                new Page(1, "/", "home", "main", 0.0),
                new Page(2, "/a", "product", "main", 0.0),
                new Page(3, "/b", "product", "main", 0.0)),
                List.of(Edge.of(1, 2), Edge.of(2, 3), Edge.of(3, 1)));
        dispatcher = new SimulationDispatcher(new SimulationOrchestrator(store, SimulatorSettings.defaults()), 8);
    }

    @After
    public void tearDown() {
        dispatcher.close();
    }

    private static List<LinkRule> menuToB() {
        return List.of(StructuralRuleSpec.menu(StructuralAction.ADD, List.of("/b")));
    }

    @Test
    public void testRunsCompleteInSubmissionOrder() throws Exception {
        List<SubmittedRun> submitted = new ArrayList<>();
        for (int i = 0; i < 3; i++)
            submitted.add(dispatcher.submit(new RunRequest(PROJECT, "run-" + i, menuToB(), null, null, null)));

        long previous = 0;
        for (SubmittedRun s : submitted) {
            RunSummary summary = s.result().get(10, TimeUnit.SECONDS);
            assertEquals(RunStatus.COMPLETED, summary.status());
            assertTrue(summary.runId() > previous);
            previous = summary.runId();
        }
        assertEquals(3, store.runs().size());
    }

    @Test
    public void testCancelWhileQueuedSkipsRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean blocked = new AtomicBoolean();
        SolverListener blocker = new SolverListener() {
            @Override
            public void onPhase(SolverPhase phase) {
                if (blocked.compareAndSet(false, true)) {
                    started.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }

            @Override
            public void onIteration(int iteration, double residual, double protectUsed, double boostUsed) {
            }

            @Override
            public void onWarning(SolverWarning warning, String detail) {
            }

            @Override
            public void onFinished(SolverResult result) {
            }
        };

        SubmittedRun first = dispatcher.submit(new RunRequest(PROJECT, "first", menuToB(), null, null,
                RunOptions.defaults().withListener(blocker)));
        assertTrue(started.await(10, TimeUnit.SECONDS));

        SubmittedRun second = dispatcher.submit(new RunRequest(PROJECT, "second", menuToB(), null, null, null));
        second.cancel();
        release.countDown();

        assertEquals(RunStatus.COMPLETED, first.result().get(10, TimeUnit.SECONDS).status());
        try {
            second.result().get(10, TimeUnit.SECONDS);
            fail("Should have thrown");
        } catch (CancellationException e) {
            assertTrue(second.result().isCancelled());
        }
        assertEquals(1, store.runs().size());
    }

    @Test
    public void testCloseDrainsQueuedRuns() throws Exception {
        SimulationDispatcher own = new SimulationDispatcher(
                new SimulationOrchestrator(store, SimulatorSettings.defaults()), 4);
        List<SubmittedRun> submitted = new ArrayList<>();
        for (int i = 0; i < 3; i++)
            submitted.add(own.submit(new RunRequest(PROJECT, "queued-" + i, menuToB(), null, null, null)));
        own.close();

        for (SubmittedRun s : submitted) {
            assertTrue(s.result().isDone());
            assertEquals(RunStatus.COMPLETED, s.result().get().status());
        }
        assertEquals(3, store.runs().size());
    }

    @Test
    public void testInvalidBufferSize() {
        try {
            new SimulationDispatcher(new SimulationOrchestrator(store, SimulatorSettings.defaults()), 6);
            fail("Should have thrown");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("power of 2"));
        }
    }
}
