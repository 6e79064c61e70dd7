package com.linkrank.sim.model;

/** A page score to persist as part of a bulk update. */
public record ScoreUpdate(long pageId, double score) {
}
