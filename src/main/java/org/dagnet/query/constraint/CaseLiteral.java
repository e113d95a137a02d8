package org.dagnet.query.constraint;

/**
 * Experiment-variant filter, {@code case(caseId:variant)}.
 */
public record CaseLiteral(String caseId, String variant) implements Literal {

    public CaseLiteral {
        Tokens.require(caseId, "caseId");
        Tokens.require(variant, "variant");
    }

    @Override
    public LiteralKind kind() {
        return LiteralKind.CASE;
    }
}
