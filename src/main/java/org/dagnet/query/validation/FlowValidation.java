package org.dagnet.query.validation;

import lombok.Value;

/**
 * Synthetic-flow comparison of a signed term sum against the true non-direct flow.
 */
@Value
public class FlowValidation {
    /** Flow over every simple path from source to merge. */
    double totalFlow;
    /** Flow over the direct two-node path, zero when there is no direct edge. */
    double directFlow;
    /** {@code totalFlow - directFlow}. */
    double nonDirectFlow;
    /** {@code sum(-coefficient * termFlow)} over the validated terms. */
    double compiledFlow;
    int pathCount;
    int termCount;
    double tolerance;

    public boolean isExact() {
        return Math.abs(compiledFlow - nonDirectFlow) <= tolerance;
    }

    public double error() {
        return compiledFlow - nonDirectFlow;
    }
}
