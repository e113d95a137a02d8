package org.dagnet.query.search;

import java.util.function.IntPredicate;

/**
 * Outcome of one witness search.
 *
 * @param found whether a journey honoring the request exists.
 * @param nodes the journey from an entry node through the anchor edge (empty when not found).
 */
public record WitnessPath(boolean found, int[] nodes) {

    /**
     * Creates the canonical "no witness" result.
     */
    public static WitnessPath none() {
        return new WitnessPath(false, new int[0]);
    }

    static WitnessPath of(int[] nodes) {
        return new WitnessPath(true, nodes);
    }

    public boolean contains(int node) {
        for (int candidate : nodes) {
            if (candidate == node) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the first node of this witness absent from {@code reference} and accepted by {@code eligible},
     * or {@code -1}.
     */
    public int firstDivergence(WitnessPath reference, IntPredicate eligible) {
        if (!found || !reference.found()) {
            return -1;
        }
        for (int node : nodes) {
            if (!reference.contains(node) && eligible.test(node)) {
                return node;
            }
        }
        return -1;
    }
}
