package com.linkrank.sim.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/** Uniform sampling without replacement. */
final class Sampling {

    private Sampling() {
    }

    /**
     * Returns {@code k} distinct elements drawn uniformly from {@code items}.
     * When {@code k} covers the whole list every element is returned in input
     * order. Uses a partial Fisher-Yates shuffle on a copy.
     */
    static <T> List<T> sample(List<T> items, int k, Random random) {
        int n = items.size();
        if (k <= 0 || n == 0)
            return List.of();
        if (k >= n)
            return new ArrayList<>(items);
        List<T> pool = new ArrayList<>(items);
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            Collections.swap(pool, i, j);
        }
        return new ArrayList<>(pool.subList(0, k));
    }
}
