package com.linkrank.sim.rules;

import com.linkrank.sim.model.Page;

import java.util.List;
import java.util.Random;

final class RandomSelection implements SelectionStrategy {

    @Override
    public List<Page> select(Page source, List<Page> candidates, int maxTargets, Random random) {
        return Sampling.sample(candidates, maxTargets, random);
    }
}
