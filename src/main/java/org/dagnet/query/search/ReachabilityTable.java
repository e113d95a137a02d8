package org.dagnet.query.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntCollection;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.graph.GraphQueries;

import java.util.BitSet;

/**
 * Per-call memo of closure sets and topological ranks.
 *
 * <p>One table is created for one compilation and discarded with it; nothing is shared
 * across calls. Not thread-safe.</p>
 */
public final class ReachabilityTable {
    private final FunnelGraph graph;
    private final BitSet[] descendants;
    private final BitSet[] ancestors;
    private int[] topoRank;

    public ReachabilityTable(FunnelGraph graph) {
        this.graph = graph;
        this.descendants = new BitSet[graph.nodeCount()];
        this.ancestors = new BitSet[graph.nodeCount()];
    }

    public FunnelGraph graph() {
        return graph;
    }

    /**
     * Returns the memoized descendant set of a node. Callers must not mutate it.
     */
    public BitSet descendantsOf(int node) {
        BitSet cached = descendants[node];
        if (cached == null) {
            cached = GraphQueries.descendants(graph, node);
            descendants[node] = cached;
        }
        return cached;
    }

    /**
     * Returns the memoized ancestor set of a node. Callers must not mutate it.
     */
    public BitSet ancestorsOf(int node) {
        BitSet cached = ancestors[node];
        if (cached == null) {
            cached = GraphQueries.ancestors(graph, node);
            ancestors[node] = cached;
        }
        return cached;
    }

    /**
     * Returns whether {@code to} can be reached from {@code from} by at least one edge.
     */
    public boolean reaches(int from, int to) {
        return descendantsOf(from).get(to);
    }

    /**
     * Returns whether {@code node} equals {@code anchor} or is one of its ancestors.
     */
    public boolean isUpstreamOrSelf(int node, int anchor) {
        return node == anchor || ancestorsOf(anchor).get(node);
    }

    public int topoRank(int node) {
        if (topoRank == null) {
            topoRank = GraphQueries.topologicalRank(graph);
        }
        return topoRank[node];
    }

    /**
     * Returns the distinct nodes of {@code nodes} ordered by topological rank.
     */
    public int[] sortByTopo(IntCollection nodes) {
        IntArrayList sorted = new IntArrayList();
        BitSet seen = new BitSet(graph.nodeCount());
        for (int node : nodes) {
            if (!seen.get(node)) {
                seen.set(node);
                sorted.add(node);
            }
        }
        sorted.sort((left, right) -> Integer.compare(topoRank(left), topoRank(right)));
        return sorted.toIntArray();
    }
}
