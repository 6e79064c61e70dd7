package com.linkrank.sim.graph;

/** Structural summary of a link graph. */
public record GraphStats(int numNodes, int numEdges, double density, int weaklyConnectedComponents,
        int stronglyConnectedComponents, boolean stronglyConnected) {
}
