package com.linkrank.sim.rules;

import com.linkrank.sim.model.Page;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Mixes same-category targets (about 70% of the slots) with targets from
 * other categories. If one bucket runs short the other is not topped up
 * beyond its own share of the remaining slots.
 */
final class RelevanceMixSelection implements SelectionStrategy {

    static final double SAME_CATEGORY_SHARE = 0.7;

    @Override
    public List<Page> select(Page source, List<Page> candidates, int maxTargets, Random random) {
        List<Page> same = new ArrayList<>();
        List<Page> other = new ArrayList<>();
        for (Page p : candidates) {
            if (p.category().equals(source.category()))
                same.add(p);
            else
                other.add(p);
        }
        int sameCount = Math.min(same.size(), (int) Math.floor(maxTargets * SAME_CATEGORY_SHARE));
        int otherCount = Math.min(other.size(), maxTargets - sameCount);

        List<Page> out = new ArrayList<>(sameCount + otherCount);
        if (sameCount > 0)
            out.addAll(Sampling.sample(same, sameCount, random));
        if (otherCount > 0)
            out.addAll(Sampling.sample(other, otherCount, random));
        return out;
    }
}
