package org.dagnet.query.constraint;

/**
 * Journey must pass through {@code node}.
 */
public record VisitedLiteral(String node) implements Literal {

    public VisitedLiteral {
        Tokens.require(node, "node");
    }

    @Override
    public LiteralKind kind() {
        return LiteralKind.VISITED;
    }
}
