package org.dagnet.query.plan;

import lombok.Value;
import org.dagnet.query.constraint.ConstraintSet;

/**
 * Conditional probability of an edge: the probability given {@code condition}.
 */
@Value
public class ConditionalParameter {
    ConstraintSet condition;
    ParameterSlot slot;
}
