package org.dagnet.query.synthesis;

import lombok.Builder;
import lombok.Value;
import org.dagnet.query.config.QueryProperties;

/**
 * Tuning knobs for {@link ConstraintSynthesizer}.
 *
 * <p>Unset bounds resolve from {@link QueryProperties} when the builder runs.</p>
 */
@Value
@Builder(toBuilder = true)
public class SynthesisOptions {
    /** Upper bound on witness searches, bootstrap included. */
    @Builder.Default
    int maxChecks = QueryProperties.maxChecks();
    /** Upper bound on violation-loop passes. */
    @Builder.Default
    int maxIterations = QueryProperties.maxIterations();
    @Builder.Default
    LiteralWeights literalWeights = LiteralWeights.uniform();
    /** Seed the output with the condition's own literals instead of rewriting them. */
    @Builder.Default
    boolean preserveCondition = true;
    /** Carry case/context pairs of the condition into the output. */
    @Builder.Default
    boolean preserveCaseContext = true;

    public static SynthesisOptions defaults() {
        return SynthesisOptions.builder().build();
    }

    /**
     * Fails fast on bounds that could never let synthesis run.
     *
     * @throws IllegalArgumentException when a bound is not positive or weights are missing.
     */
    public SynthesisOptions validate() {
        if (maxChecks <= 0) {
            throw new IllegalArgumentException("maxChecks must be > 0, got: " + maxChecks);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be > 0, got: " + maxIterations);
        }
        if (literalWeights == null) {
            throw new IllegalArgumentException("literalWeights must be provided");
        }
        return this;
    }
}
