package org.dagnet.query.plan;

import lombok.Builder;
import lombok.Value;
import org.dagnet.query.synthesis.SynthesisOptions;

/**
 * Planner filters. Unset filters select everything.
 */
@Value
@Builder(toBuilder = true)
public class PlanOptions {
    /** Null selects defaults. */
    SynthesisOptions synthesisOptions;
    /** Only edges whose source is this node or one of its descendants. */
    String downstreamOf;
    /** Only the edge {@code from->to}. */
    String edgeKey;
    /** Only the conditional at this index; base, cost and case-variant queries are skipped. */
    Integer conditionalIndex;

    public static PlanOptions defaults() {
        return PlanOptions.builder().build();
    }
}
