package org.dagnet.query.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.graph.GraphQueries;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Bounded witness finder for one anchor edge.
 *
 * <p>A witness is a journey {@code entry -> ... -> source -> target} ending with the anchor
 * edge, where {@code entry} is a node with no incoming edge. The journey is built by
 * concatenating breadth-first segments through the required nodes in topological order,
 * trying entry nodes in ascending id order. When the graph has no entry node (every node
 * lies on a cycle) the source itself acts as entry.</p>
 *
 * <p>Every call to {@link #find(WitnessRequest)} counts as exactly one reachability check,
 * regardless of how many segments it explores. Not thread-safe.</p>
 */
public final class WitnessSearch {
    private final FunnelGraph graph;
    private final ReachabilityTable table;
    private final int source;
    private final int target;
    private final int[] entries;
    private int checks;

    public WitnessSearch(ReachabilityTable table, int source, int target) {
        this.table = table;
        this.graph = table.graph();
        this.source = source;
        this.target = target;
        int[] entryNodes = graph.entryNodes();
        this.entries = entryNodes.length == 0 ? new int[]{source} : entryNodes;
    }

    /**
     * Searches one witness honoring {@code request}; counts one check.
     */
    public WitnessPath find(WitnessRequest request) {
        checks++;
        return locate(request);
    }

    /**
     * Returns the number of checks performed so far.
     */
    public int checks() {
        return checks;
    }

    private WitnessPath locate(WitnessRequest request) {
        if (!graph.hasEdge(source, target)) {
            return WitnessPath.none();
        }
        BitSet avoid = request.avoidBits(graph.nodeCount());
        if (avoid.get(source) || avoid.get(target)) {
            return WitnessPath.none();
        }

        IntArrayList waypoints = new IntArrayList();
        for (int node : request.getRequired()) {
            if (avoid.get(node)) {
                return WitnessPath.none();
            }
            if (node != source && table.isUpstreamOrSelf(node, source)) {
                waypoints.add(node);
            }
        }
        int include = request.getIncludeNode();
        if (include >= 0 && include != source) {
            if (avoid.get(include) || !table.isUpstreamOrSelf(include, source)) {
                return WitnessPath.none();
            }
            waypoints.add(include);
        }

        int[] path = route(waypoints, avoid);
        if (path.length == 0) {
            return WitnessPath.none();
        }
        List<IntSet> groups = request.getGroups();
        // each round pins one member of a distinct group, so groups.size() rounds settle it
        for (int round = 0; round <= groups.size(); round++) {
            IntSet missing = firstUnsatisfied(groups, path);
            if (missing == null) {
                return WitnessPath.of(path);
            }
            int[] pinned = pinMember(missing, waypoints, avoid);
            if (pinned.length == 0) {
                return WitnessPath.none();
            }
            path = pinned;
        }
        return WitnessPath.none();
    }

    private int[] pinMember(IntSet group, IntArrayList waypoints, BitSet avoid) {
        int[] members = group.toIntArray();
        Arrays.sort(members);
        for (int member : members) {
            if (avoid.get(member) || !table.isUpstreamOrSelf(member, source)) {
                continue;
            }
            waypoints.add(member);
            int[] candidate = route(waypoints, avoid);
            if (candidate.length > 0) {
                return candidate;
            }
            waypoints.removeInt(waypoints.size() - 1);
        }
        return new int[0];
    }

    private static IntSet firstUnsatisfied(List<IntSet> groups, int[] path) {
        for (IntSet group : groups) {
            boolean hit = false;
            for (int node : path) {
                if (group.contains(node)) {
                    hit = true;
                    break;
                }
            }
            if (!hit) {
                return group;
            }
        }
        return null;
    }

    private int[] route(IntArrayList waypoints, BitSet avoid) {
        int[] ordered = table.sortByTopo(waypoints);
        for (int entry : entries) {
            if (avoid.get(entry) || !table.isUpstreamOrSelf(entry, source)) {
                continue;
            }
            int[] journey = concatenate(entry, ordered, avoid);
            if (journey.length > 0) {
                return journey;
            }
        }
        return new int[0];
    }

    private int[] concatenate(int entry, int[] waypoints, BitSet avoid) {
        IntArrayList journey = new IntArrayList();
        journey.add(entry);
        int cursor = entry;
        for (int i = 0; i <= waypoints.length; i++) {
            int next = i < waypoints.length ? waypoints[i] : source;
            int[] segment = GraphQueries.shortestPath(graph, cursor, next, avoid);
            if (segment.length == 0) {
                return new int[0];
            }
            for (int j = 1; j < segment.length; j++) {
                journey.add(segment[j]);
            }
            cursor = next;
        }
        journey.add(target);
        return journey.toIntArray();
    }
}
