package org.dagnet.query.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.dagnet.core.id.NodeIdMapper;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable directed graph of funnel touchpoints.
 * <p>
 * Nodes are addressed by dense internal ids; {@link #nodeId(String)} and
 * {@link #nodeKey(int)} translate to and from the node keys that appear in queries. Layout:
 * <ul>
 * <li>CSR (Compressed Sparse Row) successor ranges, edges grouped by origin.</li>
 * <li>Reverse CSR for predecessor scans.</li>
 * <li>Entry nodes (in-degree 0) precomputed in id order.</li>
 * </ul>
 * Node ids follow first-appearance order in the builder and successors keep insertion
 * order, so every traversal over the same builder input is reproducible.
 * Acyclicity is not enforced here; see {@link GraphQueries#isAcyclic(FunnelGraph)}.
 */
public final class FunnelGraph {

    private final NodeIdMapper nodeIds;

    // first_edge[node] -> start index in edge arrays
    private final int[] firstEdge;
    private final int[] edgeTarget;
    private final PredecessorIndex predecessors;
    private final int[] entryNodes;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private FunnelGraph(NodeIdMapper nodeIds, int[] firstEdge, int[] edgeTarget, int[] edgeOrigin) {
        this.nodeIds = nodeIds;
        this.nodeCount = nodeIds.size();
        this.edgeCount = edgeTarget.length;
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.predecessors = PredecessorIndex.build(nodeCount, edgeOrigin, edgeTarget);

        IntArrayList entries = new IntArrayList();
        for (int node = 0; node < nodeCount; node++) {
            if (predecessors.inDegree(node) == 0) {
                entries.add(node);
            }
        }
        this.entryNodes = entries.toIntArray();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // NODE IDENTITY
    // ========================================================================

    /**
     * Resolves a node key to its internal id.
     *
     * @throws NodeIdMapper.UnknownNodeException when the key is not part of the graph.
     */
    public int nodeId(String nodeKey) {
        return nodeIds.toInternal(nodeKey);
    }

    public String nodeKey(int nodeId) {
        return nodeIds.toExternal(nodeId);
    }

    public boolean containsNode(String nodeKey) {
        return nodeIds.containsExternal(nodeKey);
    }

    // ========================================================================
    // ADJACENCY
    // ========================================================================

    public int outDegree(int nodeId) {
        validateNode(nodeId);
        return firstEdge[nodeId + 1] - firstEdge[nodeId];
    }

    /**
     * Returns the {@code index}-th successor of a node, in insertion order.
     */
    public int successor(int nodeId, int index) {
        int degree = outDegree(nodeId);
        if (index < 0 || index >= degree) {
            throw new IndexOutOfBoundsException("successor index " + index + " out of range for node " + nodeId);
        }
        return edgeTarget[firstEdge[nodeId] + index];
    }

    public int inDegree(int nodeId) {
        return predecessors.inDegree(nodeId);
    }

    public int predecessor(int nodeId, int index) {
        return predecessors.predecessor(nodeId, index);
    }

    public boolean hasEdge(int fromNode, int toNode) {
        validateNode(fromNode);
        validateNode(toNode);
        int end = firstEdge[fromNode + 1];
        for (int edge = firstEdge[fromNode]; edge < end; edge++) {
            if (edgeTarget[edge] == toNode) {
                return true;
            }
        }
        return false;
    }

    /**
     * Key-space edge lookup; unknown keys simply yield {@code false}.
     */
    public boolean hasEdge(String fromKey, String toKey) {
        if (!containsNode(fromKey) || !containsNode(toKey)) {
            return false;
        }
        return hasEdge(nodeId(fromKey), nodeId(toKey));
    }

    /**
     * Returns nodes with no incoming edge, ascending by id.
     */
    public int[] entryNodes() {
        return entryNodes.clone();
    }

    @Override
    public String toString() {
        return String.format("FunnelGraph[nodes=%d, edges=%d, entries=%d]", nodeCount, edgeCount, entryNodes.length);
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds [0, " + nodeCount + ")");
        }
    }

    /**
     * Collects nodes and edges; duplicate edges collapse, self-loops are rejected.
     */
    public static final class Builder {
        private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Declares a node, which may stay isolated.
         */
        public Builder node(String nodeKey) {
            requireToken(nodeKey);
            adjacency.computeIfAbsent(nodeKey, ignored -> new LinkedHashSet<>());
            return this;
        }

        public Builder edge(String fromKey, String toKey) {
            requireToken(fromKey);
            requireToken(toKey);
            if (fromKey.equals(toKey)) {
                throw new IllegalArgumentException("Self-loop is not a funnel transition: " + fromKey);
            }
            node(fromKey);
            node(toKey);
            adjacency.get(fromKey).add(toKey);
            return this;
        }

        /**
         * Adds edges given as {@code {from, to}} pairs.
         */
        public Builder edges(String[]... pairs) {
            for (String[] pair : pairs) {
                if (pair == null || pair.length != 2) {
                    throw new IllegalArgumentException("Edge pair must hold exactly two node keys");
                }
                edge(pair[0], pair[1]);
            }
            return this;
        }

        public FunnelGraph build() {
            NodeIdMapper mapper = NodeIdMapper.fromOrderedKeys(adjacency.keySet());
            int nodeCount = mapper.size();
            int edgeCount = 0;
            for (Set<String> targets : adjacency.values()) {
                edgeCount += targets.size();
            }

            int[] firstEdge = new int[nodeCount + 1];
            int[] targets = new int[edgeCount];
            int[] origins = new int[edgeCount];
            int cursor = 0;
            for (Map.Entry<String, Set<String>> entry : adjacency.entrySet()) {
                int origin = mapper.toInternal(entry.getKey());
                firstEdge[origin] = cursor;
                for (String target : entry.getValue()) {
                    origins[cursor] = origin;
                    targets[cursor] = mapper.toInternal(target);
                    cursor++;
                }
            }
            firstEdge[nodeCount] = edgeCount;
            return new FunnelGraph(mapper, firstEdge, targets, origins);
        }

        private static void requireToken(String nodeKey) {
            Objects.requireNonNull(nodeKey, "nodeKey");
            if (!NodeIdMapper.isValidToken(nodeKey)) {
                throw new IllegalArgumentException("Node key must match [a-z0-9_-]+, got: " + nodeKey);
            }
        }
    }
}
