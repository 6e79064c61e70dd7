package com.linkrank.sim.graph;

import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.Collection;

/**
 * Connectivity statistics for a project's link graph.
 *
 * Density is m / (n(n-1)) for a directed graph without self-loops. Links
 * whose endpoints are not among the given pages are ignored, duplicates
 * count once.
 */
public final class GraphStatistics {

    private GraphStatistics() {
    }

    public static GraphStats compute(Collection<Page> pages, Collection<Edge> edges) {
        Graph<Long, DefaultEdge> g = toJGraphT(pages, edges);
        int n = g.vertexSet().size();
        int m = g.edgeSet().size();
        double density = n > 1 ? (double) m / ((double) n * (n - 1)) : 0.0;

        if (n == 0)
            return new GraphStats(0, 0, 0.0, 0, 0, false);

        int weak = new ConnectivityInspector<>(g).connectedSets().size();
        var scc = new KosarajuStrongConnectivityInspector<>(g);
        int strong = scc.stronglyConnectedSets().size();
        return new GraphStats(n, m, density, weak, strong, scc.isStronglyConnected());
    }

    public static GraphStats compute(GraphModel graph) {
        return compute(graph.pages(), graph.edges());
    }

    static Graph<Long, DefaultEdge> toJGraphT(Collection<Page> pages, Collection<Edge> edges) {
        Graph<Long, DefaultEdge> g = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (Page p : pages)
            g.addVertex(p.id());
        for (Edge e : edges) {
            if (e.isSelfLoop() || !g.containsVertex(e.fromId()) || !g.containsVertex(e.toId()))
                continue;
            g.addEdge(e.fromId(), e.toId());
        }
        return g;
    }
}
