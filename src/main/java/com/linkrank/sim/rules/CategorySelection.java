package com.linkrank.sim.rules;

import com.linkrank.sim.model.Page;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Targets share the source's category; sampled uniformly when there are more than needed. */
final class CategorySelection implements SelectionStrategy {

    @Override
    public List<Page> select(Page source, List<Page> candidates, int maxTargets, Random random) {
        List<Page> same = new ArrayList<>();
        for (Page p : candidates) {
            if (p.category().equals(source.category()))
                same.add(p);
        }
        return Sampling.sample(same, maxTargets, random);
    }
}
