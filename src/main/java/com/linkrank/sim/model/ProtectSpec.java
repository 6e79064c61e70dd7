package com.linkrank.sim.model;

import com.linkrank.sim.api.ValidationException;

/**
 * Protection of a page's score.
 *
 * A positive factor is a floor expressed as a fraction of the solver's
 * baseline for the page. A negative factor is a maximum relative loss against
 * the page's current score: {@code -0.02} means "do not lose more than 2%".
 * The orchestrator turns relative protections into absolute floors before
 * solving.
 */
public record ProtectSpec(String url, double protectionFactor) {

    public ProtectSpec {
        if (url == null || url.isBlank())
            throw new ValidationException("Protection requires a url");
        if (Double.isNaN(protectionFactor) || Double.isInfinite(protectionFactor))
            throw new ValidationException("Protection factor must be finite for " + url);
        if (protectionFactor < -1.0)
            throw new ValidationException("Relative protection cannot exceed a 100% loss for " + url);
    }

    public boolean isRelative() {
        return protectionFactor < 0;
    }

    /** Maximum tolerated relative loss, only meaningful when {@link #isRelative()}. */
    public double lossLimit() {
        return Math.abs(protectionFactor);
    }
}
