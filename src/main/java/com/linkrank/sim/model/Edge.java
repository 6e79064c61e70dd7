package com.linkrank.sim.model;

/** A directed link between two pages, identified by page ids. */
public record Edge(long fromId, long toId) {

    public static Edge of(long fromId, long toId) {
        return new Edge(fromId, toId);
    }

    public boolean isSelfLoop() {
        return fromId == toId;
    }

    public Edge reversed() {
        return new Edge(toId, fromId);
    }

    @Override
    public String toString() {
        return fromId + "->" + toId;
    }
}
