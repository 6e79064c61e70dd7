package com.linkrank.sim.model;

import com.linkrank.sim.api.ValidationException;

/**
 * Requests that the page at {@code url} be pushed toward
 * {@code targetFactor} times its baseline score.
 */
public record BoostSpec(String url, double targetFactor) {

    public BoostSpec {
        if (url == null || url.isBlank())
            throw new ValidationException("Boost requires a url");
        if (!(targetFactor > 0) || Double.isInfinite(targetFactor))
            throw new ValidationException("Boost target factor must be > 0 for " + url + ": " + targetFactor);
    }
}
