package org.dagnet.query.graph;

import java.util.Arrays;

/**
 * Immutable reverse adjacency for incoming-edge traversal by node.
 *
 * <p>Backed by CSR-style arrays where each node maps to a contiguous range inside
 * {@code incomingOrigins}. Within a range, predecessors keep edge-id order.</p>
 */
final class PredecessorIndex {
    private final int nodeCount;
    private final int[] firstIncomingByNode;
    private final int[] incomingOrigins;

    private PredecessorIndex(int nodeCount, int[] firstIncomingByNode, int[] incomingOrigins) {
        this.nodeCount = nodeCount;
        this.firstIncomingByNode = firstIncomingByNode;
        this.incomingOrigins = incomingOrigins;
    }

    /**
     * Builds reverse adjacency from forward edge arrays.
     */
    static PredecessorIndex build(int nodeCount, int[] edgeOrigin, int[] edgeTarget) {
        int edgeCount = edgeTarget.length;

        int[] incomingDegree = new int[nodeCount];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            incomingDegree[edgeTarget[edgeId]]++;
        }

        int[] firstIncoming = new int[nodeCount + 1];
        int cursor = 0;
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            firstIncoming[nodeId] = cursor;
            cursor += incomingDegree[nodeId];
        }
        firstIncoming[nodeCount] = edgeCount;

        int[] fillCursor = Arrays.copyOf(firstIncoming, firstIncoming.length);
        int[] origins = new int[edgeCount];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            int position = fillCursor[edgeTarget[edgeId]]++;
            origins[position] = edgeOrigin[edgeId];
        }
        return new PredecessorIndex(nodeCount, firstIncoming, origins);
    }

    /**
     * Returns number of incoming edges of one node.
     */
    int inDegree(int nodeId) {
        validateNode(nodeId);
        return firstIncomingByNode[nodeId + 1] - firstIncomingByNode[nodeId];
    }

    /**
     * Returns the origin of the {@code index}-th incoming edge of one node.
     */
    int predecessor(int nodeId, int index) {
        validateNode(nodeId);
        int position = firstIncomingByNode[nodeId] + index;
        if (index < 0 || position >= firstIncomingByNode[nodeId + 1]) {
            throw new IndexOutOfBoundsException("predecessor index " + index + " out of range for node " + nodeId);
        }
        return incomingOrigins[position];
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }
}
