package com.linkrank.sim.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class WarningRateLimiterTest {

    private WarningRateLimiter limiter;

    @Before
    public void setUp() {
        limiter = new WarningRateLimiter(LogManager.getLogger(WarningRateLimiterTest.class), 60_000);
    }

    @Test
    public void testFirstWarningPassesRepeatsAreCounted() {
        assertTrue(limiter.warn("bounds infeasible"));
        assertEquals(0, limiter.suppressedCount());

        assertFalse(limiter.warn("bounds infeasible"));
        assertFalse(limiter.warn("bounds infeasible"));
        assertEquals(2, limiter.suppressedCount());
    }
}
