package org.dagnet.query.constraint;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable, canonical set of literals for one anchored query.
 *
 * <p>Canonical means order- and duplicate-insensitive: visited and exclude nodes are sorted
 * sets, visitedAny groups are deduplicated by member set and ordered by their joined members,
 * case and context pairs are sorted. Signed terms keep the order they were added in.
 * Two sets built from permutations of the same literals are equal.</p>
 */
@EqualsAndHashCode
@ToString
public final class ConstraintSet {
    private static final Comparator<CaseLiteral> CASE_ORDER =
            Comparator.comparing(CaseLiteral::caseId).thenComparing(CaseLiteral::variant);
    private static final Comparator<ContextLiteral> CONTEXT_ORDER =
            Comparator.comparing(ContextLiteral::key).thenComparing(ContextLiteral::value);
    private static final ConstraintSet EMPTY = new Builder().build();

    private final List<String> visited;
    private final List<String> exclude;
    private final List<VisitedAnyLiteral> visitedAny;
    private final List<CaseLiteral> cases;
    private final List<ContextLiteral> contexts;
    private final List<SignedTerm> terms;

    private ConstraintSet(Builder builder) {
        this.visited = List.copyOf(builder.visited);
        this.exclude = List.copyOf(builder.exclude);
        this.visitedAny = List.copyOf(builder.visitedAny.values());
        TreeSet<CaseLiteral> sortedCases = new TreeSet<>(CASE_ORDER);
        sortedCases.addAll(builder.cases);
        this.cases = List.copyOf(sortedCases);
        TreeSet<ContextLiteral> sortedContexts = new TreeSet<>(CONTEXT_ORDER);
        sortedContexts.addAll(builder.contexts);
        this.contexts = List.copyOf(sortedContexts);
        this.terms = List.copyOf(builder.terms);
    }

    public static ConstraintSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a canonical set from literals given in any order.
     */
    public static ConstraintSet fromLiterals(Collection<? extends Literal> literals) {
        Builder builder = new Builder();
        for (Literal literal : Objects.requireNonNull(literals, "literals")) {
            builder.literal(literal);
        }
        return builder.build();
    }

    public List<String> visited() {
        return visited;
    }

    public List<String> exclude() {
        return exclude;
    }

    public List<VisitedAnyLiteral> visitedAny() {
        return visitedAny;
    }

    public List<CaseLiteral> cases() {
        return cases;
    }

    public List<ContextLiteral> contexts() {
        return contexts;
    }

    public List<SignedTerm> terms() {
        return terms;
    }

    /**
     * Returns whether the set carries any visited, exclude or visitedAny literal.
     */
    public boolean hasNodeLiterals() {
        return !visited.isEmpty() || !exclude.isEmpty() || !visitedAny.isEmpty();
    }

    public boolean isEmpty() {
        return !hasNodeLiterals() && cases.isEmpty() && contexts.isEmpty() && terms.isEmpty();
    }

    /**
     * Number of node literals: visited and exclude nodes plus visitedAny groups.
     */
    public int literalCount() {
        return visited.size() + exclude.size() + visitedAny.size();
    }

    /**
     * Returns every literal in canonical order: visited, exclude, visitedAny, case, context, terms.
     */
    public List<Literal> literals() {
        List<Literal> literals = new ArrayList<>();
        for (String node : visited) {
            literals.add(new VisitedLiteral(node));
        }
        for (String node : exclude) {
            literals.add(new ExcludeLiteral(node));
        }
        literals.addAll(visitedAny);
        literals.addAll(cases);
        literals.addAll(contexts);
        literals.addAll(terms);
        return List.copyOf(literals);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        for (Literal literal : literals()) {
            builder.literal(literal);
        }
        return builder;
    }

    /**
     * Returns a copy without exclude literals.
     */
    public ConstraintSet withoutExclude() {
        Builder builder = toBuilder();
        builder.exclude.clear();
        return builder.build();
    }

    /**
     * Mutable collector; duplicates and ordering are normalized by {@link #build()}.
     */
    public static final class Builder {
        private final TreeSet<String> visited = new TreeSet<>();
        private final TreeSet<String> exclude = new TreeSet<>();
        // joined members -> group, which dedups by set equality and orders groups
        private final Map<String, VisitedAnyLiteral> visitedAny = new TreeMap<>();
        private final List<CaseLiteral> cases = new ArrayList<>();
        private final List<ContextLiteral> contexts = new ArrayList<>();
        private final List<SignedTerm> terms = new ArrayList<>();

        private Builder() {
        }

        public Builder visited(String... nodes) {
            for (String node : nodes) {
                visited.add(new VisitedLiteral(node).node());
            }
            return this;
        }

        public Builder visited(Collection<String> nodes) {
            return visited(nodes.toArray(new String[0]));
        }

        public Builder exclude(String... nodes) {
            for (String node : nodes) {
                exclude.add(new ExcludeLiteral(node).node());
            }
            return this;
        }

        public Builder exclude(Collection<String> nodes) {
            return exclude(nodes.toArray(new String[0]));
        }

        public Builder visitedAny(Collection<String> nodes) {
            return visitedAny(VisitedAnyLiteral.of(nodes));
        }

        public Builder visitedAny(VisitedAnyLiteral group) {
            Objects.requireNonNull(group, "group");
            visitedAny.putIfAbsent(String.join(",", group.nodes()), group);
            return this;
        }

        public Builder caseVariant(String caseId, String variant) {
            cases.add(new CaseLiteral(caseId, variant));
            return this;
        }

        public Builder context(String key, String value) {
            contexts.add(new ContextLiteral(key, value));
            return this;
        }

        public Builder term(SignedTerm term) {
            terms.add(Objects.requireNonNull(term, "term"));
            return this;
        }

        /**
         * Adds one literal of any kind.
         */
        public Builder literal(Literal literal) {
            Objects.requireNonNull(literal, "literal");
            switch (literal.kind()) {
                case VISITED -> visited.add(((VisitedLiteral) literal).node());
                case EXCLUDE -> exclude.add(((ExcludeLiteral) literal).node());
                case VISITED_ANY -> visitedAny((VisitedAnyLiteral) literal);
                case CASE -> cases.add((CaseLiteral) literal);
                case CONTEXT -> contexts.add((ContextLiteral) literal);
                case SIGNED_TERM -> terms.add((SignedTerm) literal);
                default -> throw new IllegalArgumentException("unsupported literal kind: " + literal.kind());
            }
            return this;
        }

        public ConstraintSet build() {
            return new ConstraintSet(this);
        }
    }
}
