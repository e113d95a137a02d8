package org.dagnet.query.constraint;

/**
 * Discriminator of the literal variants a constraint query is made of.
 */
public enum LiteralKind {
    VISITED,
    EXCLUDE,
    VISITED_ANY,
    CASE,
    CONTEXT,
    SIGNED_TERM
}
