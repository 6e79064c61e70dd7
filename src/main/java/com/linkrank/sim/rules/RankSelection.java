package com.linkrank.sim.rules;

import com.linkrank.sim.model.Page;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/** Deterministic pick of the highest (or lowest) baseline scores. Ties break on page id. */
final class RankSelection implements SelectionStrategy {

    private final Comparator<Page> order;

    RankSelection(boolean highestFirst) {
        Comparator<Page> byScore = Comparator.comparingDouble(Page::baselineScore);
        if (highestFirst)
            byScore = byScore.reversed();
        this.order = byScore.thenComparingLong(Page::id);
    }

    @Override
    public List<Page> select(Page source, List<Page> candidates, int maxTargets, Random random) {
        if (maxTargets <= 0 || candidates.isEmpty())
            return List.of();
        List<Page> sorted = new ArrayList<>(candidates);
        sorted.sort(order);
        return new ArrayList<>(sorted.subList(0, Math.min(maxTargets, sorted.size())));
    }
}
