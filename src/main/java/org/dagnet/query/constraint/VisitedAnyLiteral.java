package org.dagnet.query.constraint;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * OR-group: journey must pass through at least one of {@code nodes}.
 *
 * <p>Members are stored sorted and deduplicated, so two groups over the same node set are equal.</p>
 */
public record VisitedAnyLiteral(List<String> nodes) implements Literal {

    public VisitedAnyLiteral {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("visitedAny group must hold at least one node");
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String node : nodes) {
            sorted.add(Tokens.require(node, "visitedAny member"));
        }
        nodes = List.copyOf(sorted);
    }

    public static VisitedAnyLiteral of(Collection<String> nodes) {
        return new VisitedAnyLiteral(nodes == null ? null : List.copyOf(nodes));
    }

    public static VisitedAnyLiteral of(String... nodes) {
        return new VisitedAnyLiteral(List.of(nodes));
    }

    @Override
    public LiteralKind kind() {
        return LiteralKind.VISITED_ANY;
    }
}
