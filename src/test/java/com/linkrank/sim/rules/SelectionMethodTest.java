package com.linkrank.sim.rules;

import com.linkrank.sim.model.Page;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class SelectionMethodTest {

    private static List<Page> pool(int same, int other) {
        List<Page> pages = new ArrayList<>();
        long id = 100;
        for (int i = 0; i < same; i++)
            pages.add(new Page(id++, "/s" + i, "product", "shoes", i));
        for (int i = 0; i < other; i++)
            pages.add(new Page(id++, "/o" + i, "product", "bags", i));
        return pages;
    }

    private static final Page SOURCE = new Page(1, "/src", "product", "shoes", 0.1);

    @Test
    public void testAliasesResolve() {
        assertEquals(SelectionMethod.CATEGORY, SelectionMethod.fromString("category"));
        assertEquals(SelectionMethod.RELEVANCE_MIX, SelectionMethod.fromString("semantic"));
        assertEquals(SelectionMethod.RELEVANCE_MIX, SelectionMethod.fromString("Relevance-Mix"));
        assertEquals(SelectionMethod.RANK_HIGH, SelectionMethod.fromString("pagerank_high"));
        assertEquals(SelectionMethod.RANK_LOW, SelectionMethod.fromString("PAGERANK_LOW"));
        assertEquals(SelectionMethod.RANDOM, SelectionMethod.fromString(" random "));
    }

    @Test
    public void testUnknownMethodFallsBackToCategory() {
        assertEquals(SelectionMethod.CATEGORY, SelectionMethod.fromString("clustering"));
        assertEquals(SelectionMethod.CATEGORY, SelectionMethod.fromString(null));
    }

    @Test
    public void testRelevanceMixSplitsSlots() {
        List<Page> picked = SelectionMethod.RELEVANCE_MIX.strategy().select(SOURCE, pool(10, 10), 10, new Random(1));
        long same = picked.stream().filter(p -> p.category().equals("shoes")).count();
        assertEquals(10, picked.size());
        assertEquals(7, same);
    }

    @Test
    public void testRelevanceMixDoesNotTopUpShortBucket() {
        List<Page> picked = SelectionMethod.RELEVANCE_MIX.strategy().select(SOURCE, pool(1, 2), 10, new Random(1));
        // one same-category page, then min(2, 10 - 1) others
        assertEquals(3, picked.size());
    }

    @Test
    public void testCategoryReturnsAllWhenFewerThanMax() {
        List<Page> candidates = pool(2, 5);
        List<Page> picked = SelectionMethod.CATEGORY.strategy().select(SOURCE, candidates, 5, new Random(1));
        assertEquals(candidates.subList(0, 2), picked);
    }

    @Test
    public void testRankLowOrdersByScoreThenId() {
        List<Page> picked = SelectionMethod.RANK_LOW.strategy().select(SOURCE, pool(3, 3), 2, new Random(1));
        // scores 0 tie between /s0 (id 100) and /o0 (id 103)
        assertEquals(100L, picked.get(0).id());
        assertEquals(103L, picked.get(1).id());
    }

    @Test
    public void testRandomSamplesDistinctPages() {
        List<Page> picked = SelectionMethod.RANDOM.strategy().select(SOURCE, pool(20, 20), 15, new Random(4));
        assertEquals(15, picked.size());
        assertEquals(15, picked.stream().map(Page::id).distinct().count());
    }
}
