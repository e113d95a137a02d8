package org.dagnet.query.graph;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Stateless structural queries over a {@link FunnelGraph}.
 *
 * <p>All traversals iterate successors in insertion order and break ties by node id,
 * so results are reproducible for a given graph.</p>
 */
@UtilityClass
public final class GraphQueries {

    /**
     * Returns every node reachable from {@code node} by at least one edge.
     * The node itself is only included when it lies on a cycle.
     */
    public static BitSet descendants(FunnelGraph graph, int node) {
        BitSet seen = new BitSet(graph.nodeCount());
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(node);
        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            int degree = graph.outDegree(current);
            for (int i = 0; i < degree; i++) {
                int next = graph.successor(current, i);
                if (!seen.get(next)) {
                    seen.set(next);
                    queue.enqueue(next);
                }
            }
        }
        return seen;
    }

    /**
     * Returns every node that can reach {@code node} by at least one edge.
     */
    public static BitSet ancestors(FunnelGraph graph, int node) {
        BitSet seen = new BitSet(graph.nodeCount());
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(node);
        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            int degree = graph.inDegree(current);
            for (int i = 0; i < degree; i++) {
                int previous = graph.predecessor(current, i);
                if (!seen.get(previous)) {
                    seen.set(previous);
                    queue.enqueue(previous);
                }
            }
        }
        return seen;
    }

    /**
     * Kahn topological order. Nodes left on cycles are appended in ascending id order,
     * so the result is always a permutation of all node ids.
     */
    public static int[] topologicalOrder(FunnelGraph graph) {
        int nodeCount = graph.nodeCount();
        int[] remainingIn = new int[nodeCount];
        IntArrayFIFOQueue ready = new IntArrayFIFOQueue();
        for (int node = 0; node < nodeCount; node++) {
            remainingIn[node] = graph.inDegree(node);
            if (remainingIn[node] == 0) {
                ready.enqueue(node);
            }
        }

        int[] order = new int[nodeCount];
        BitSet placed = new BitSet(nodeCount);
        int cursor = 0;
        while (!ready.isEmpty()) {
            int node = ready.dequeueInt();
            order[cursor++] = node;
            placed.set(node);
            int degree = graph.outDegree(node);
            for (int i = 0; i < degree; i++) {
                int next = graph.successor(node, i);
                if (--remainingIn[next] == 0) {
                    ready.enqueue(next);
                }
            }
        }
        for (int node = placed.nextClearBit(0); node < nodeCount; node = placed.nextClearBit(node + 1)) {
            order[cursor++] = node;
        }
        return order;
    }

    /**
     * Returns {@code rank[node]} = position of node in {@link #topologicalOrder(FunnelGraph)}.
     */
    public static int[] topologicalRank(FunnelGraph graph) {
        int[] order = topologicalOrder(graph);
        int[] rank = new int[order.length];
        for (int i = 0; i < order.length; i++) {
            rank[order[i]] = i;
        }
        return rank;
    }

    public static boolean isAcyclic(FunnelGraph graph) {
        int nodeCount = graph.nodeCount();
        int[] remainingIn = new int[nodeCount];
        IntArrayFIFOQueue ready = new IntArrayFIFOQueue();
        for (int node = 0; node < nodeCount; node++) {
            remainingIn[node] = graph.inDegree(node);
            if (remainingIn[node] == 0) {
                ready.enqueue(node);
            }
        }
        int processed = 0;
        while (!ready.isEmpty()) {
            int node = ready.dequeueInt();
            processed++;
            int degree = graph.outDegree(node);
            for (int i = 0; i < degree; i++) {
                if (--remainingIn[graph.successor(node, i)] == 0) {
                    ready.enqueue(graph.successor(node, i));
                }
            }
        }
        return processed == nodeCount;
    }

    /**
     * Breadth-first shortest path that never enters a node of {@code avoid}.
     *
     * @return node sequence from {@code from} to {@code to}; {@code [from]} when both are equal;
     * an empty array when no such path exists or an endpoint is avoided.
     */
    public static int[] shortestPath(FunnelGraph graph, int from, int to, BitSet avoid) {
        if (avoid.get(from) || avoid.get(to)) {
            return new int[0];
        }
        if (from == to) {
            return new int[]{from};
        }
        int[] parent = new int[graph.nodeCount()];
        Arrays.fill(parent, -1);
        parent[from] = from;
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(from);
        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            int degree = graph.outDegree(current);
            for (int i = 0; i < degree; i++) {
                int next = graph.successor(current, i);
                if (parent[next] != -1 || avoid.get(next)) {
                    continue;
                }
                parent[next] = current;
                if (next == to) {
                    return unwind(parent, from, to);
                }
                queue.enqueue(next);
            }
        }
        return new int[0];
    }

    /**
     * Returns whether {@code to} is reachable from {@code from} without entering {@code avoid}.
     */
    public static boolean reaches(FunnelGraph graph, int from, int to, BitSet avoid) {
        return shortestPath(graph, from, to, avoid).length > 0;
    }

    /**
     * Enumerates simple paths from {@code from} to {@code to} with an explicit stack.
     * Enumeration stops once {@code maxPaths} paths have been collected.
     */
    public static SimplePaths simplePaths(FunnelGraph graph, int from, int to, int maxPaths) {
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths must be > 0");
        }
        List<int[]> paths = new ArrayList<>();
        if (from == to) {
            paths.add(new int[]{from});
            return new SimplePaths(List.copyOf(paths), false);
        }

        IntArrayList stack = new IntArrayList();
        // next successor index to try, per stack depth
        IntArrayList cursor = new IntArrayList();
        BitSet onStack = new BitSet(graph.nodeCount());
        stack.add(from);
        cursor.add(0);
        onStack.set(from);

        while (!stack.isEmpty()) {
            int depth = stack.size() - 1;
            int node = stack.getInt(depth);
            int index = cursor.getInt(depth);
            if (index >= graph.outDegree(node)) {
                stack.removeInt(depth);
                cursor.removeInt(depth);
                onStack.clear(node);
                continue;
            }
            cursor.set(depth, index + 1);
            int next = graph.successor(node, index);
            if (onStack.get(next)) {
                continue;
            }
            if (next == to) {
                int[] path = new int[stack.size() + 1];
                stack.getElements(0, path, 0, stack.size());
                path[stack.size()] = to;
                paths.add(path);
                if (paths.size() >= maxPaths) {
                    return new SimplePaths(List.copyOf(paths), true);
                }
                continue;
            }
            stack.add(next);
            cursor.add(0);
            onStack.set(next);
        }
        return new SimplePaths(List.copyOf(paths), false);
    }

    private static int[] unwind(int[] parent, int from, int to) {
        IntArrayList reversed = new IntArrayList();
        int node = to;
        while (node != from) {
            reversed.add(node);
            node = parent[node];
        }
        reversed.add(from);
        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(path.length - 1 - i);
        }
        return path;
    }
}
