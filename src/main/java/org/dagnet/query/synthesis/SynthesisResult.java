package org.dagnet.query.synthesis;

import lombok.Value;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.graph.AnchorEdge;

/**
 * Literals discriminating one anchor edge, with status and diagnostics.
 */
@Value
public class SynthesisResult {
    AnchorEdge anchor;
    SynthesisStatus status;
    /** Literals to add to {@code from(source).to(target)}; empty unless satisfied. */
    ConstraintSet constraints;
    SynthesisDiagnostics diagnostics;

    static SynthesisResult invalidAnchor(AnchorEdge anchor) {
        return new SynthesisResult(anchor, SynthesisStatus.INVALID_ANCHOR, ConstraintSet.empty(), SynthesisDiagnostics.none());
    }

    public boolean isSatisfied() {
        return status.isSatisfied();
    }
}
