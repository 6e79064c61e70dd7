package com.linkrank.sim.sim;

import com.linkrank.sim.model.PageResult;

import java.util.List;

/**
 * Aggregate view of a run's score changes. A page counts as changed when its
 * delta exceeds {@link #CHANGE_EPSILON} in magnitude.
 */
public record SummaryStats(int totalPages, int newLinksAdded, int linksRemoved, int pagesWithPositiveChange,
        int pagesWithNegativeChange, int pagesUnchanged, double averageDelta, double maxPositiveDelta,
        double maxNegativeDelta, double totalRedistribution) {

    public static final double CHANGE_EPSILON = 1e-12;

    public static SummaryStats of(List<PageResult> results, int newLinksAdded, int linksRemoved) {
        int positive = 0;
        int negative = 0;
        double sum = 0.0;
        double maxGain = 0.0;
        double maxLoss = 0.0;
        double redistribution = 0.0;
        for (PageResult r : results) {
            double d = r.delta();
            if (d > CHANGE_EPSILON)
                positive++;
            else if (d < -CHANGE_EPSILON)
                negative++;
            sum += d;
            maxGain = Math.max(maxGain, d);
            maxLoss = Math.min(maxLoss, d);
            redistribution += Math.abs(d);
        }
        int n = results.size();
        return new SummaryStats(n, newLinksAdded, linksRemoved, positive, negative, n - positive - negative,
                n == 0 ? 0.0 : sum / n, maxGain, maxLoss, redistribution);
    }
}
