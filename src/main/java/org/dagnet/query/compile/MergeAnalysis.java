package org.dagnet.query.compile;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.graph.GraphQueries;
import org.dagnet.query.graph.SimplePaths;
import org.dagnet.query.search.ReachabilityTable;

import java.util.BitSet;

/**
 * Post-dominator style analysis of competing branches below a split node.
 *
 * <p>Assumes an acyclic graph. One instance memoizes closures for one graph and must not be
 * shared across threads.</p>
 */
public final class MergeAnalysis {
    private final FunnelGraph graph;
    private final ReachabilityTable table;
    private final int maxSimplePaths;

    public MergeAnalysis(FunnelGraph graph, int maxSimplePaths) {
        this(new ReachabilityTable(graph), maxSimplePaths);
    }

    MergeAnalysis(ReachabilityTable table, int maxSimplePaths) {
        if (maxSimplePaths <= 0) {
            throw new IllegalArgumentException("maxSimplePaths must be > 0");
        }
        this.table = table;
        this.graph = table.graph();
        this.maxSimplePaths = maxSimplePaths;
    }

    /**
     * Successors of {@code split}, other than {@code keptTarget}, that reach {@code merge}.
     */
    public int[] competingFirstHops(int split, int keptTarget, int merge) {
        IntArrayList hops = new IntArrayList();
        int degree = graph.outDegree(split);
        for (int i = 0; i < degree; i++) {
            int hop = graph.successor(split, i);
            if (hop != keptTarget && (hop == merge || table.reaches(hop, merge))) {
                hops.add(hop);
            }
        }
        return hops.toIntArray();
    }

    /**
     * Topologically earliest node common to the closed descendant sets of every successor of
     * {@code split}; {@code keptTarget} when the split has no other successor or the branches
     * never reconverge.
     */
    public int findMerge(int split, int keptTarget) {
        int degree = graph.outDegree(split);
        if (degree == 0 || (degree == 1 && graph.successor(split, 0) == keptTarget)) {
            return keptTarget;
        }
        BitSet common = null;
        for (int i = 0; i < degree; i++) {
            int hop = graph.successor(split, i);
            BitSet closed = (BitSet) table.descendantsOf(hop).clone();
            closed.set(hop);
            if (common == null) {
                common = closed;
            } else {
                common.and(closed);
            }
        }
        int merge = earliest(common);
        return merge < 0 ? keptTarget : merge;
    }

    /**
     * Earliest node every journey from {@code branchFirstHop} to {@code merge} must cross,
     * ignoring the split and the kept path before the merge; {@code merge} when none remains.
     *
     * <p>Simple paths are enumerated only between the branch and the merge. When the path cap
     * is hit, candidates are decided by node-removal reachability instead.</p>
     */
    public int findSeparator(int split, int branchFirstHop, int merge, int[] keptPath) {
        BitSet candidates = commonNodes(branchFirstHop, merge);
        if (candidates.isEmpty()) {
            return merge;
        }
        for (int node : keptPath) {
            if (node != merge) {
                candidates.clear(node);
            }
        }
        candidates.clear(split);
        int separator = earliest(candidates);
        return separator < 0 ? merge : separator;
    }

    private BitSet commonNodes(int from, int merge) {
        SimplePaths enumerated = GraphQueries.simplePaths(graph, from, merge, maxSimplePaths);
        if (enumerated.truncated()) {
            return cutNodes(from, merge);
        }
        BitSet common = null;
        for (int[] path : enumerated.paths()) {
            BitSet onPath = new BitSet(graph.nodeCount());
            for (int node : path) {
                onPath.set(node);
            }
            if (common == null) {
                common = onPath;
            } else {
                common.and(onPath);
            }
        }
        return common == null ? new BitSet() : common;
    }

    /**
     * Nodes whose removal disconnects {@code from} from {@code merge}, endpoints included.
     */
    private BitSet cutNodes(int from, int merge) {
        BitSet cut = new BitSet(graph.nodeCount());
        if (from != merge && !table.reaches(from, merge)) {
            return cut;
        }
        cut.set(from);
        cut.set(merge);
        BitSet between = (BitSet) table.descendantsOf(from).clone();
        between.and(table.ancestorsOf(merge));
        BitSet avoid = new BitSet(graph.nodeCount());
        for (int node = between.nextSetBit(0); node >= 0; node = between.nextSetBit(node + 1)) {
            if (node == from || node == merge) {
                continue;
            }
            avoid.set(node);
            if (!GraphQueries.reaches(graph, from, merge, avoid)) {
                cut.set(node);
            }
            avoid.clear(node);
        }
        return cut;
    }

    private int earliest(BitSet nodes) {
        int best = -1;
        for (int node = nodes.nextSetBit(0); node >= 0; node = nodes.nextSetBit(node + 1)) {
            if (best < 0 || table.topoRank(node) < table.topoRank(best)) {
                best = node;
            }
        }
        return best;
    }
}
