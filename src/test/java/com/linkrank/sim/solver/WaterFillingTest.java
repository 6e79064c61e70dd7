package com.linkrank.sim.solver;

import org.junit.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.*;

public class WaterFillingTest {

    private static double sum(double[] v) {
        return Arrays.stream(v).sum();
    }

    @Test
    public void testBoundsAndSumHoldForFeasibleInputs() {
        Random rnd = new Random(11);
        for (int trial = 0; trial < 200; trial++) {
            int n = 2 + rnd.nextInt(30);
            double[] v = new double[n];
            for (int i = 0; i < n; i++)
                v[i] = rnd.nextDouble();
            double total = sum(v);
            for (int i = 0; i < n; i++)
                v[i] /= total;

            // floors sum below 1; ceilings sum above 1
            double[] floors = new double[n];
            double[] ceilings = new double[n];
            for (int i = 0; i < n; i++) {
                floors[i] = v[i] * rnd.nextDouble() * 1.8 * (rnd.nextBoolean() ? 1 : 0);
                ceilings[i] = Math.max(floors[i], v[i]) * (1.0 + rnd.nextDouble());
            }
            double floorSum = sum(floors);
            if (floorSum > 1.0) {
                for (int i = 0; i < n; i++)
                    floors[i] /= floorSum;
            }

            double[] out = v.clone();
            WaterFilling.Outcome outcome = new WaterFilling(floors, ceilings).project(out);

            assertEquals(WaterFilling.Outcome.FEASIBLE, outcome);
            assertEquals(1.0, sum(out), 1e-9);
            for (int i = 0; i < n; i++) {
                double ceiling = Math.max(floors[i], ceilings[i]);
                assertTrue("floor violated at " + i, out[i] >= floors[i] - 1e-9);
                assertTrue("ceiling violated at " + i, out[i] <= ceiling + 1e-9);
            }
        }
    }

    @Test
    public void testAcceptsVectorAlreadyInBounds() {
        double[] v = { 0.2, 0.3, 0.5 };
        WaterFilling wf = WaterFilling.unbounded(3);
        assertEquals(WaterFilling.Outcome.FEASIBLE, wf.project(v));
        assertArrayEquals(new double[] { 0.2, 0.3, 0.5 }, v, 1e-15);
    }

    @Test
    public void testRaisedFloorTakesMassFromOthersProportionally() {
        double[] v = { 0.1, 0.3, 0.6 };
        double[] floors = { 0.4, 0.0, 0.0 };
        double[] ceilings = { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY };

        new WaterFilling(floors, ceilings).project(v);

        assertEquals(0.4, v[0], 1e-12);
        // 0.3 removed from 0.9 of slack, split 1:2
        assertEquals(0.2, v[1], 1e-12);
        assertEquals(0.4, v[2], 1e-12);
    }

    @Test
    public void testCeilingSurplusGoesToUnboundedEntriesEvenly() {
        double[] v = { 0.6, 0.2, 0.2 };
        double[] floors = new double[3];
        double[] ceilings = { 0.3, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY };

        new WaterFilling(floors, ceilings).project(v);

        assertEquals(0.3, v[0], 1e-12);
        assertEquals(0.35, v[1], 1e-12);
        assertEquals(0.35, v[2], 1e-12);
    }

    @Test
    public void testInfeasibleFloorsAreRescaled() {
        double[] v = { 0.5, 0.5 };
        double[] floors = { 0.8, 0.6 };
        double[] ceilings = { 1.0, 1.0 };

        WaterFilling.Outcome outcome = new WaterFilling(floors, ceilings).project(v);

        assertEquals(WaterFilling.Outcome.DEGENERATE, outcome);
        assertEquals(1.0, sum(v), 1e-12);
        assertEquals(0.8 / 1.4, v[0], 1e-12);
    }

    @Test
    public void testInfeasibleCeilingsAreRelaxedKeepingFloors() {
        double[] v = { 0.5, 0.5 };
        double[] floors = { 0.1, 0.0 };
        double[] ceilings = { 0.2, 0.2 };

        WaterFilling.Outcome outcome = new WaterFilling(floors, ceilings).project(v);

        assertEquals(WaterFilling.Outcome.DEGENERATE, outcome);
        assertEquals(1.0, sum(v), 1e-12);
        assertTrue(v[0] >= 0.1);
        assertEquals(0.5, v[0], 1e-12);
    }
}
