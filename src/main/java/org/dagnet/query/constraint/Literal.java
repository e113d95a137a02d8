package org.dagnet.query.constraint;

/**
 * One clause of a constraint query.
 *
 * <p>Implementations are immutable records; {@link #kind()} identifies the variant.</p>
 */
public interface Literal {

    LiteralKind kind();
}
