package com.linkrank.sim.solver;

import com.linkrank.sim.api.SimulationCancelledException;
import com.linkrank.sim.api.SolverCheckpoint;
import com.linkrank.sim.graph.GraphModel;
import com.linkrank.sim.model.Page;
import com.linkrank.sim.util.IterationProfileListener;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.Assert.*;

public class ConstrainedSolverTest {

    private ConstrainedSolver solver;

    @Before
    public void setUp() {
        solver = new ConstrainedSolver(SolverOptions.defaults());
    }

    private static Page page(long id) {
        return new Page(id, "/p" + id, "page", "c", 0.0);
    }

    private static GraphModel graph(int n, long[][] edges) {
        GraphModel.Builder b = GraphModel.builder();
        for (long id = 1; id <= n; id++)
            b.addPage(page(id));
        for (long[] e : edges)
            b.addEdge(e[0], e[1]);
        return b.build();
    }

    private static GraphModel hub() {
        return graph(4, new long[][] { { 2, 1 }, { 3, 1 }, { 4, 1 }, { 1, 2 }, { 1, 3 }, { 2, 3 }, { 3, 4 } });
    }

    private static double sum(SolverResult r) {
        double s = 0;
        for (double v : r.scores().values())
            s += v;
        return s;
    }

    @Test
    public void testThreeCycleIsUniform() {
        SolverResult r = solver.solveBaseline(graph(3, new long[][] { { 1, 2 }, { 2, 3 }, { 3, 1 } }), Map.of());

        for (long id = 1; id <= 3; id++)
            assertEquals(1.0 / 3, r.score(id), 1e-3);
        assertEquals(r.score(1), r.score(2), 1e-9);
        assertEquals(r.score(2), r.score(3), 1e-9);
        assertTrue(r.converged());
        assertEquals(SolverPhase.CONVERGED, r.phase());
    }

    @Test
    public void testNoEdgesGivesUniformScores() {
        SolverResult r = solver.solveBaseline(graph(4, new long[0][]), Map.of());
        for (long id = 1; id <= 4; id++)
            assertEquals(0.25, r.score(id), 1e-3);
        assertEquals(1.0, sum(r), 1e-6);
    }

    @Test
    public void testHubOutranksLeaves() {
        SolverResult r = solver.solveBaseline(hub(), Map.of());
        for (long leaf = 2; leaf <= 4; leaf++)
            assertTrue("hub should beat page " + leaf, r.score(1) > r.score(leaf));
    }

    @Test
    public void testScoresSumToOneOnRandomGraph() {
        Random rnd = new Random(7);
        GraphModel.Builder b = GraphModel.builder();
        for (long id = 1; id <= 60; id++)
            b.addPage(page(id));
        for (int i = 0; i < 200; i++) {
            long from = 1 + rnd.nextInt(60);
            long to = 1 + rnd.nextInt(60);
            if (from != to)
                b.addEdge(from, to);
        }
        GraphModel g = b.build();

        assertEquals(1.0, sum(solver.solveBaseline(g, Map.of())), 1e-6);

        ConstraintSet constraints = ConstraintSet.builder()
                .protect("/p3", 1.1)
                .boost("/p10", 3.0)
                .outflowCap("/p5", 0.5)
                .build();
        assertEquals(1.0, sum(solver.solve(g, Map.of(), constraints)), 1e-6);
    }

    @Test
    public void testAbsoluteFloorIsHonoured() {
        ConstraintSet constraints = ConstraintSet.builder().protectAbsolute("/p4", 0.5).build();
        SolverResult r = solver.solve(hub(), Map.of(), constraints);

        assertTrue(r.score(4) >= 0.5 - 1e-6);
        assertEquals(1.0, sum(r), 1e-6);
    }

    @Test
    public void testFactorFloorIsRelativeToBaseline() {
        GraphModel g = hub();
        double baseline = solver.solveBaseline(g, Map.of()).score(4);

        SolverResult r = solver.solve(g, Map.of(), ConstraintSet.builder().protect("/p4", 1.2).build());
        assertTrue(r.score(4) >= 1.2 * baseline - 1e-6);
    }

    @Test
    public void testBoostRaisesScoreWithinCeiling() {
        GraphModel g = hub();
        double baseline = solver.solveBaseline(g, Map.of()).score(4);

        SolverResult r = solver.solve(g, Map.of(), ConstraintSet.builder().boost("/p4", 1.5).build());
        assertTrue(r.score(4) > baseline);
        assertTrue(r.score(4) <= ConstrainedSolver.BOOST_CEILING_MULTIPLIER * 1.5 * baseline + 1e-9);
        assertTrue(r.boostBudgetUsed() > 0);
    }

    @Test
    public void testBudgetOverflowIsClamped() {
        ConstrainedSolver s = new ConstrainedSolver(SolverOptions.defaults().withBudgets(0.7, 0.5));
        SolverResult r = s.solve(hub(), Map.of(), ConstraintSet.builder().protect("/p2", 1.0).build());

        assertEquals(0.4, r.protectBudget(), 1e-12);
        assertEquals(0.2, r.boostBudget(), 1e-12);
        assertTrue(r.hasWarning(SolverWarning.BUDGET_OVERFLOW));
    }

    @Test
    public void testIterationLimitReportsNonConvergence() {
        ConstrainedSolver s = new ConstrainedSolver(SolverOptions.defaults().withIterations(1, 1e-15));
        SolverResult r = s.solveBaseline(hub(), Map.of());

        assertFalse(r.converged());
        assertEquals(SolverPhase.MAX_ITER_REACHED, r.phase());
        assertEquals(1, r.iterationsRun());
        assertTrue(r.hasWarning(SolverWarning.NON_CONVERGENCE));
        assertEquals(1.0, sum(r), 1e-6);
    }

    @Test
    public void testCancelledCheckpointAbortsSolve() {
        solver.setCheckpoint(new SolverCheckpoint() {
            @Override
            public boolean isCancelled() {
                return true;
            }
        });
        try {
            solver.solveBaseline(hub(), Map.of());
            fail("Should have been cancelled");
        } catch (SimulationCancelledException e) {
            assertTrue(e.getMessage().contains("cancelled"));
        }
    }

    @Test
    public void testUnknownConstraintUrlIsIgnored() {
        SolverResult r = solver.solve(hub(), Map.of(), ConstraintSet.builder().boost("/missing", 2.0).build());
        assertTrue(r.hasWarning(SolverWarning.UNKNOWN_CONSTRAINT_URL));
        assertEquals(1.0, sum(r), 1e-6);
    }

    @Test
    public void testOutflowCapKeepsMassOnCappedPage() {
        GraphModel g = graph(2, new long[][] { { 1, 2 }, { 2, 1 } });
        SolverResult r = solver.solve(g, Map.of(), ConstraintSet.builder().outflowCap("/p1", 0.5).build());
        assertTrue(r.score(1) > r.score(2));
    }

    @Test
    public void testListenerSeesPhasesInOrder() {
        IterationProfileListener profile = new IterationProfileListener();
        solver.setListener(profile);
        solver.solve(hub(), Map.of(), ConstraintSet.builder().protect("/p2", 1.0).build());

        assertEquals(List.of(SolverPhase.INIT, SolverPhase.BASELINE, SolverPhase.FAST, SolverPhase.CONVERGED),
                profile.phases());
        assertFalse(profile.samples(SolverPhase.BASELINE).isEmpty());
        assertFalse(profile.samples(SolverPhase.FAST).isEmpty());
        assertNotNull(profile.lastResult());
    }

    @Test
    public void testParallelMultiplyMatchesSequential() {
        GraphModel g = hub();
        SolverResult sequential = solver.solveBaseline(g, Map.of());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            ConstrainedSolver parallel = new ConstrainedSolver(SolverOptions.defaults().withParallelism(2, 1), pool);
            SolverResult r = parallel.solveBaseline(g, Map.of());
            for (long id = 1; id <= 4; id++)
                assertEquals(sequential.score(id), r.score(id), 1e-12);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testSizeEstimate() {
        assertEquals(0.1 + (1000 * 1e-5 + 5000 * 1e-6) * 100, ConstrainedSolver.estimateSeconds(1000, 5000, 200),
                1e-12);
        assertEquals(0.1 + (1000 * 1e-5) * 50, ConstrainedSolver.estimateSeconds(1000, 0, 50), 1e-12);
    }

    @Test
    public void testEmptyGraphIsRejected() {
        try {
            solver.solveBaseline(GraphModel.builder().build(), Map.of());
            fail("Should have thrown");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("empty"));
        }
    }
}
