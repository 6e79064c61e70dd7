package com.linkrank.sim.rules;

import com.linkrank.sim.model.Page;

import java.util.List;
import java.util.Random;

/**
 * Picks link targets for one source page.
 *
 * Candidates have already been filtered by the rule's target filter (and
 * have had the source removed when the rule avoids self links). A strategy
 * returns at most {@code maxTargets} distinct pages and draws all randomness
 * from the supplied generator so seeded runs are reproducible.
 */
@FunctionalInterface
public interface SelectionStrategy {

    List<Page> select(Page source, List<Page> candidates, int maxTargets, Random random);
}
