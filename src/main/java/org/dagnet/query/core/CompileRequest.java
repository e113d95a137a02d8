package org.dagnet.query.core;

import lombok.Builder;
import lombok.Value;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.synthesis.SynthesisOptions;

/**
 * One edge-query compilation request, in node-key space.
 */
@Value
@Builder(toBuilder = true)
public class CompileRequest {
    FunnelGraph graph;
    /** Anchor edge source key. */
    String fromNode;
    /** Anchor edge target key. */
    String toNode;
    /** Optional pre-existing condition. */
    ConstraintSet condition;
    /** Optional; defaults resolved from system properties. */
    SynthesisOptions synthesisOptions;
    /** Connection used for the capability lookup. */
    String connectionName;
    /** Provider type used when the connection is unknown. */
    String providerName;
    /** Skips the capability lookup when set. */
    Boolean nativeExcludeOverride;
    /** Optional inclusion-exclusion term budget. */
    Integer termBudget;
}
