package com.linkrank.sim.util;

import com.linkrank.sim.solver.SolverPhase;
import com.linkrank.sim.solver.SolverWarning;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompositeSolverListenerTest {

    @Test
    public void testFansOutToAllListeners() {
        IterationProfileListener a = new IterationProfileListener();
        IterationProfileListener b = new IterationProfileListener();
        CompositeSolverListener composite = new CompositeSolverListener().add(a).add(b);
        assertEquals(2, composite.size());

        composite.onPhase(SolverPhase.FAST);
        composite.onIteration(0, 0.5, 0.01, 0.02);
        composite.onWarning(SolverWarning.BUDGET_OVERFLOW, "clamped");

        for (IterationProfileListener l : new IterationProfileListener[] { a, b }) {
            assertEquals(1, l.samples().size());
            assertEquals(SolverPhase.FAST, l.samples().get(0).phase());
            assertEquals(1, l.warningCount(SolverWarning.BUDGET_OVERFLOW));
        }
    }

    @Test
    public void testEmptyCompositeIsNoop() {
        CompositeSolverListener composite = new CompositeSolverListener();
        composite.onPhase(SolverPhase.INIT);
        composite.onIteration(3, 0.1, 0, 0);
        assertEquals(0, composite.size());
    }
}
