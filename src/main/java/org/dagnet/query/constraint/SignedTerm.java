package org.dagnet.query.constraint;

import java.util.Objects;

/**
 * Positive sub-query with a {@code +1/-1} weight; it shares the outer query's anchor.
 */
public record SignedTerm(ConstraintSet constraints, Coefficient coefficient) implements Literal {

    public SignedTerm {
        Objects.requireNonNull(constraints, "constraints");
        Objects.requireNonNull(coefficient, "coefficient");
        if (!constraints.exclude().isEmpty() || !constraints.terms().isEmpty()) {
            throw new IllegalArgumentException("signed term must be positive: no exclude literals or nested terms");
        }
    }

    @Override
    public LiteralKind kind() {
        return LiteralKind.SIGNED_TERM;
    }
}
