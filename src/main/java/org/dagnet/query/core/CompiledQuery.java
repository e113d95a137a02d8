package org.dagnet.query.core;

import lombok.Builder;
import lombok.Value;
import org.dagnet.query.compile.CompilationResult;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.graph.AnchorEdge;
import org.dagnet.query.synthesis.SynthesisDiagnostics;
import org.dagnet.query.synthesis.SynthesisStatus;

/**
 * Final query for one anchor edge.
 *
 * <p>{@code constraints} is what gets serialized after {@code from(..).to(..)}: the synthesized
 * literals when the provider evaluates exclusions natively, otherwise the exclusion-free base
 * plus signed terms.</p>
 */
@Value
@Builder
public class CompiledQuery {
    AnchorEdge anchor;
    SynthesisStatus synthesisStatus;
    /** Literals as synthesized, exclusions included. */
    ConstraintSet synthesized;
    ConstraintSet constraints;
    boolean nativeExclude;
    SynthesisDiagnostics diagnostics;
    /** Null unless exclusions were rewritten. */
    CompilationResult compilation;

    public boolean hasSignedTerms() {
        return !constraints.terms().isEmpty();
    }

    /**
     * Returns whether synthesis reached a fixed point and any rewrite was exact.
     */
    public boolean isExact() {
        return synthesisStatus == SynthesisStatus.EXACT && (compilation == null || compilation.isExact());
    }
}
