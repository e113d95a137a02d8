package org.dagnet.query.constraint;

/**
 * Opaque context filter, {@code context(key:value)}.
 */
public record ContextLiteral(String key, String value) implements Literal {

    public ContextLiteral {
        Tokens.require(key, "key");
        Tokens.require(value, "value");
    }

    @Override
    public LiteralKind kind() {
        return LiteralKind.CONTEXT;
    }
}
