package org.dagnet.query.synthesis;

/**
 * Terminal state of one synthesis call.
 */
public enum SynthesisStatus {
    /** Fixed point reached: no violating witness remains. */
    EXACT,
    /** A cap or a stalled remedy stopped the loop; literals may be non-minimal. */
    DEGRADED,
    /** No journey honors the condition. */
    UNSATISFIABLE,
    /** The anchor edge is not part of the graph. */
    INVALID_ANCHOR;

    /**
     * Returns whether the result carries a usable constraint set.
     */
    public boolean isSatisfied() {
        return this == EXACT || this == DEGRADED;
    }
}
