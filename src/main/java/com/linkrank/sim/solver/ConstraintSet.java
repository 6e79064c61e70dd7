package com.linkrank.sim.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-url constraints handed to the solver.
 *
 * A protection is either a factor of the solver's baseline score or an
 * absolute floor. A boost is a target factor of the baseline; its ceiling is
 * {@link ConstrainedSolver#BOOST_CEILING_MULTIPLIER} times the target. Outflow
 * caps limit the share of a page's mass that leaves through its links.
 */
public final class ConstraintSet {

    public static final ConstraintSet NONE = builder().build();

    /** Floor of a protected page. */
    public record Protection(double value, boolean absolute) {
    }

    private final Map<String, Protection> protections;
    private final Map<String, Double> boosts;
    private final Map<String, Double> outflowCaps;

    private ConstraintSet(Map<String, Protection> protections, Map<String, Double> boosts,
            Map<String, Double> outflowCaps) {
        this.protections = protections;
        this.boosts = boosts;
        this.outflowCaps = outflowCaps;
    }

    public Map<String, Protection> protections() {
        return protections;
    }

    public Map<String, Double> boosts() {
        return boosts;
    }

    public Map<String, Double> outflowCaps() {
        return outflowCaps;
    }

    public boolean isEmpty() {
        return protections.isEmpty() && boosts.isEmpty() && outflowCaps.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Protection> protections = new LinkedHashMap<>();
        private final Map<String, Double> boosts = new LinkedHashMap<>();
        private final Map<String, Double> outflowCaps = new LinkedHashMap<>();

        /** Floor of {@code factor} times the page's baseline score. */
        public Builder protect(String url, double factor) {
            if (!(factor >= 0) || Double.isInfinite(factor))
                throw new IllegalArgumentException("Protection factor must be >= 0 for " + url + ": " + factor);
            protections.put(url, new Protection(factor, false));
            return this;
        }

        /** Floor given directly as a score. */
        public Builder protectAbsolute(String url, double floor) {
            if (!(floor >= 0) || Double.isInfinite(floor))
                throw new IllegalArgumentException("Absolute floor must be >= 0 for " + url + ": " + floor);
            protections.put(url, new Protection(floor, true));
            return this;
        }

        public Builder boost(String url, double targetFactor) {
            if (!(targetFactor > 0) || Double.isInfinite(targetFactor))
                throw new IllegalArgumentException("Boost factor must be > 0 for " + url + ": " + targetFactor);
            boosts.put(url, targetFactor);
            return this;
        }

        public Builder outflowCap(String url, double cap) {
            if (!(cap > 0 && cap <= 1))
                throw new IllegalArgumentException("Outflow cap must be in (0, 1] for " + url + ": " + cap);
            outflowCaps.put(url, cap);
            return this;
        }

        public ConstraintSet build() {
            return new ConstraintSet(Collections.unmodifiableMap(new LinkedHashMap<>(protections)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(boosts)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(outflowCaps)));
        }
    }
}
