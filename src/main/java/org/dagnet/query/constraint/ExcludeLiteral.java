package org.dagnet.query.constraint;

/**
 * Journey must not pass through {@code node}.
 */
public record ExcludeLiteral(String node) implements Literal {

    public ExcludeLiteral {
        Tokens.require(node, "node");
    }

    @Override
    public LiteralKind kind() {
        return LiteralKind.EXCLUDE;
    }
}
