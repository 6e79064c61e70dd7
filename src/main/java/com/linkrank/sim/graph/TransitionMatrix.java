package com.linkrank.sim.graph;

import com.linkrank.sim.model.Edge;

import java.util.Arrays;
import java.util.Map;

/**
 * Column-stochastic transition operator in CSR form, stored by incoming
 * edges so that one output row can be computed independently of the others.
 *
 * Data layout:
 * - inOffset[i] .. inOffset[i+1] delimits target i's incoming entries.
 * - inSource[k] is the source index of entry k, inProb[k] its probability.
 * - dangling lists the nodes with no positive out-weight. Their mass is
 * spread uniformly over all nodes at multiply time instead of being
 * materialized as N entries each.
 *
 * An outflow cap c on a node with positive out-weight W scales its raw
 * outgoing weights by c and adds 1 - c as a self-loop weight before the row
 * is normalized, so a link of weight w gets c·w / (c·W + 1 - c) and the
 * self-loop (1 - c) / (c·W + 1 - c).
 */
public final class TransitionMatrix {
    private final int n;
    private final int[] inOffset;
    private final int[] inSource;
    private final double[] inProb;
    private final int[] dangling;

    private TransitionMatrix(int n, int[] inOffset, int[] inSource, double[] inProb, int[] dangling) {
        this.n = n;
        this.inOffset = inOffset;
        this.inSource = inSource;
        this.inProb = inProb;
        this.dangling = dangling;
    }

    /**
     * Builds the operator.
     *
     * @param graph       Graph whose edges define the links.
     * @param weights     Edge weights; edges missing from the map weigh 1.0.
     * @param outflowCaps Cap per node index, each in (0, 1]. May be empty.
     */
    public static TransitionMatrix build(GraphModel graph, Map<Edge, Double> weights, Map<Integer, Double> outflowCaps) {
        final int n = graph.nodeCount();
        final int m = graph.edgeCount();

        int[] from = new int[m];
        int[] to = new int[m];
        double[] w = new double[m];
        double[] outWeight = new double[n];

        // 1. Resolve endpoints and accumulate out-weight per source
        int k = 0;
        for (Edge e : graph.edges()) {
            double weight = weights.getOrDefault(e, 1.0);
            if (Double.isNaN(weight) || weight < 0)
                throw new IllegalArgumentException("Edge weight must be >= 0 for " + e + ": " + weight);
            from[k] = graph.indexOf(e.fromId());
            to[k] = graph.indexOf(e.toId());
            w[k] = weight;
            outWeight[from[k]] += weight;
            k++;
        }

        double[] cap = new double[n];
        Arrays.fill(cap, 1.0);
        for (Map.Entry<Integer, Double> entry : outflowCaps.entrySet()) {
            double c = entry.getValue();
            if (!(c > 0 && c <= 1.0))
                throw new IllegalArgumentException("Outflow cap must be in (0, 1]: " + c);
            cap[entry.getKey()] = c;
        }

        // 2. Count incoming entries per target, including cap self-loops
        int[] inDegree = new int[n];
        for (int i = 0; i < m; i++) {
            if (w[i] > 0)
                inDegree[to[i]]++;
        }
        int danglingCount = 0;
        for (int j = 0; j < n; j++) {
            if (outWeight[j] <= 0)
                danglingCount++;
            else if (cap[j] < 1.0)
                inDegree[j]++;
        }

        // 3. Offsets
        int[] offset = new int[n + 1];
        for (int i = 0; i < n; i++)
            offset[i + 1] = offset[i] + inDegree[i];

        // 4. Row normalizers, capped rows include their self-loop weight
        double[] rowSum = new double[n];
        for (int j = 0; j < n; j++)
            rowSum[j] = cap[j] < 1.0 ? cap[j] * outWeight[j] + (1.0 - cap[j]) : outWeight[j];

        // 5. Fill
        int total = offset[n];
        int[] src = new int[total];
        double[] prob = new double[total];
        int[] cursor = new int[n];
        System.arraycopy(offset, 0, cursor, 0, n);
        for (int i = 0; i < m; i++) {
            if (w[i] <= 0)
                continue;
            int j = from[i];
            int slot = cursor[to[i]]++;
            src[slot] = j;
            prob[slot] = cap[j] * w[i] / rowSum[j];
        }
        int[] danglingIdx = new int[danglingCount];
        int d = 0;
        for (int j = 0; j < n; j++) {
            if (outWeight[j] <= 0) {
                danglingIdx[d++] = j;
            } else if (cap[j] < 1.0) {
                int slot = cursor[j]++;
                src[slot] = j;
                prob[slot] = (1.0 - cap[j]) / rowSum[j];
            }
        }
        return new TransitionMatrix(n, offset, src, prob, danglingIdx);
    }

    public int nodeCount() {
        return n;
    }

    public int entryCount() {
        return inSource.length;
    }

    public int danglingCount() {
        return dangling.length;
    }

    public boolean isDangling(int index) {
        for (int j : dangling) {
            if (j == index)
                return true;
        }
        return false;
    }

    /** Per-node share of the mass held by dangling nodes. */
    public double danglingShare(double[] p) {
        if (dangling.length == 0)
            return 0.0;
        double mass = 0.0;
        for (int j : dangling)
            mass += p[j];
        return mass / n;
    }

    /** Computes rows [from, to) of M·p into out. */
    public void multiplyRows(double[] p, double[] out, int from, int to, double danglingShare) {
        for (int i = from; i < to; i++) {
            double sum = danglingShare;
            for (int k = inOffset[i], end = inOffset[i + 1]; k < end; k++)
                sum += inProb[k] * p[inSource[k]];
            out[i] = sum;
        }
    }

    /** out = M·p. */
    public void multiply(double[] p, double[] out) {
        multiplyRows(p, out, 0, n, danglingShare(p));
    }
}
