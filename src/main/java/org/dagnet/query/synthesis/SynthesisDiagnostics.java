package org.dagnet.query.synthesis;

import lombok.Value;

/**
 * Informational counters of one synthesis call.
 */
@Value
public class SynthesisDiagnostics {
    private static final SynthesisDiagnostics NONE = new SynthesisDiagnostics(0, 0, 0, null);

    /** Witness searches performed, bootstrap included. */
    int checks;
    /** Node literals in the output (visited, exclude, visitedAny groups). */
    int literals;
    /** Violation-loop passes started. */
    int iterations;
    /** Null unless the loop stopped early. */
    DegradationReason degradedReason;

    public static SynthesisDiagnostics none() {
        return NONE;
    }

    public boolean capReached() {
        return degradedReason == DegradationReason.CHECK_CAP || degradedReason == DegradationReason.ITERATION_CAP;
    }
}
