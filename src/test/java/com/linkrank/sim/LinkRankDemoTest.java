package com.linkrank.sim;

import com.linkrank.sim.model.RunStatus;
import com.linkrank.sim.sim.RunSummary;
import org.junit.Test;

import static org.junit.Assert.*;

public class LinkRankDemoTest {

    @Test
    public void testDemoRunCompletes() throws Exception {
        RunSummary summary = LinkRankDemo.runDemo();

        assertEquals(RunStatus.COMPLETED, summary.status());
        // footer links from 8 product and category pages, two cross links per product
        assertEquals(8 + 12, summary.newLinksCount());
        assertEquals(0, summary.removedLinksCount());
        assertEquals(LinkRankDemo.demoPages().size(), summary.stats().totalPages());
        assertTrue(summary.diagnostics().iterationsRun() > 0);
    }
}
