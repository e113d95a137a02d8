package org.dagnet.query.search;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.BitSet;
import java.util.List;

/**
 * Constraints one witness search must honor.
 *
 * <p>{@code required} nodes are visited in topological order, {@code avoid} nodes are never
 * entered, {@code includeNode} (when {@code >= 0}) is visited, and every OR-group in
 * {@code groups} has at least one member on the journey.</p>
 */
@Value
@Builder(toBuilder = true)
public class WitnessRequest {
    @Builder.Default
    IntSet required = IntSets.EMPTY_SET;
    @Builder.Default
    IntSet avoid = IntSets.EMPTY_SET;
    @Builder.Default
    int includeNode = -1;
    @Singular
    List<IntSet> groups;

    static WitnessRequest unconstrained() {
        return WitnessRequest.builder().build();
    }

    BitSet avoidBits(int nodeCount) {
        BitSet bits = new BitSet(nodeCount);
        for (int node : avoid) {
            bits.set(node);
        }
        return bits;
    }

    /**
     * Convenience for building node sets from varargs.
     */
    static IntSet nodes(int... nodes) {
        return new IntOpenHashSet(nodes);
    }
}
