package org.dagnet.query.plan;

import lombok.Builder;
import lombok.Value;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.core.CompiledQuery;

/**
 * Compiled query for one parameter.
 */
@Value
@Builder
public class ParameterQuery {
    ParameterType type;
    /** Real parameter or case id, else {@code synthetic:<edge or node>:<slot>}. */
    String paramId;
    String edgeKey;
    /** Condition the query was compiled under; empty for unconditioned parameters. */
    ConstraintSet condition;
    CompiledQuery compiled;
}
