package com.linkrank.sim.graph;

import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable, indexed snapshot of a project's link graph.
 *
 * Pages are assigned dense indices 0..N-1 in insertion order; the solver
 * and the transition matrix work exclusively on those indices. The model
 * keeps the id and url lookups needed to translate between page identity
 * and matrix position.
 *
 * Edges are unique: adding a directed edge twice is a no-op. Self-loops are
 * rejected by the builder unless explicitly permitted.
 */
@Log4j2
public final class GraphModel {
    private final List<Page> pages;
    private final Map<Long, Integer> idToIndex;
    private final Map<String, Integer> urlToIndex;
    private final Set<Edge> edges;

    private GraphModel(List<Page> pages, Map<Long, Integer> idToIndex, Map<String, Integer> urlToIndex,
            Set<Edge> edges) {
        this.pages = pages;
        this.idToIndex = idToIndex;
        this.urlToIndex = urlToIndex;
        this.edges = edges;
    }

    /**
     * Builds a model from loaded data. Edges that point at unknown pages or
     * loop on a single page are dropped with a warning rather than failing
     * the load.
     */
    public static GraphModel of(Collection<Page> pages, Collection<Edge> edges) {
        Builder b = builder();
        for (Page p : pages)
            b.addPage(p);
        int dropped = 0;
        for (Edge e : edges) {
            if (e.isSelfLoop() || !b.idToIdx.containsKey(e.fromId()) || !b.idToIdx.containsKey(e.toId())) {
                dropped++;
                continue;
            }
            b.addEdge(e);
        }
        if (dropped > 0)
            log.warn("Dropped {} link(s) with unknown endpoints or self-loops", dropped);
        return b.build();
    }

    public int nodeCount() {
        return pages.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Page page(int index) {
        return pages.get(index);
    }

    public List<Page> pages() {
        return pages;
    }

    /** Edges in insertion order. */
    public Set<Edge> edges() {
        return edges;
    }

    public boolean containsEdge(Edge edge) {
        return edges.contains(edge);
    }

    /** Resolves a page id to its index. */
    public int indexOf(long pageId) {
        Integer idx = idToIndex.get(pageId);
        if (idx == null)
            throw new IllegalArgumentException("Unknown page: " + pageId);
        return idx;
    }

    /** Resolves a url to its index, or -1 if no page has that url. */
    public int indexOfUrl(String url) {
        Integer idx = urlToIndex.get(url);
        return idx == null ? -1 : idx;
    }

    /**
     * Returns a model with the same pages and the given edge set. Used to
     * apply an edit script without disturbing page indices.
     */
    public GraphModel withEdges(Collection<Edge> newEdges) {
        Builder b = builder();
        for (Page p : pages)
            b.addPage(p);
        for (Edge e : newEdges)
            b.addEdge(e);
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Page> pages = new ArrayList<>();
        private final Map<Long, Integer> idToIdx = new HashMap<>();
        private final Map<String, Integer> urlToIdx = new HashMap<>();
        private final Set<Edge> edges = new LinkedHashSet<>();
        private boolean allowSelfLoops;

        public Builder addPage(Page page) {
            if (idToIdx.containsKey(page.id()))
                throw new IllegalArgumentException("Duplicate page id: " + page.id());
            int idx = pages.size();
            pages.add(page);
            idToIdx.put(page.id(), idx);
            // first page wins for duplicate urls
            urlToIdx.putIfAbsent(page.url(), idx);
            return this;
        }

        public Builder allowSelfLoops(boolean allow) {
            this.allowSelfLoops = allow;
            return this;
        }

        /** Adds a directed edge. Returns normally (and ignores it) if already present. */
        public Builder addEdge(Edge edge) {
            if (edge.isSelfLoop() && !allowSelfLoops)
                throw new IllegalArgumentException("Self-edge not allowed: " + edge.fromId());
            requireKnown(edge.fromId());
            requireKnown(edge.toId());
            edges.add(edge);
            return this;
        }

        public Builder addEdge(long fromId, long toId) {
            return addEdge(new Edge(fromId, toId));
        }

        private void requireKnown(long id) {
            if (!idToIdx.containsKey(id))
                throw new IllegalArgumentException("Unknown page: " + id);
        }

        public GraphModel build() {
            return new GraphModel(Collections.unmodifiableList(new ArrayList<>(pages)), Map.copyOf(idToIdx),
                    Map.copyOf(urlToIdx), Collections.unmodifiableSet(new LinkedHashSet<>(edges)));
        }
    }
}
