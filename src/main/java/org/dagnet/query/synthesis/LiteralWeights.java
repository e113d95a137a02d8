package org.dagnet.query.synthesis;

import lombok.Value;

/**
 * Relative cost of the two discriminator families. Lower is preferred.
 */
@Value
public class LiteralWeights {
    private static final LiteralWeights UNIFORM = new LiteralWeights(1.0d, 1.0d);

    double visited;
    double exclude;

    private LiteralWeights(double visited, double exclude) {
        this.visited = requireCost(visited, "visited");
        this.exclude = requireCost(exclude, "exclude");
    }

    public static LiteralWeights uniform() {
        return UNIFORM;
    }

    public static LiteralWeights of(double visited, double exclude) {
        return new LiteralWeights(visited, exclude);
    }

    /**
     * Returns whether a visited literal costs no more than an exclude literal.
     */
    public boolean prefersVisited() {
        return visited <= exclude;
    }

    private static double requireCost(double cost, String fieldName) {
        if (!Double.isFinite(cost) || cost < 0.0d) {
            throw new IllegalArgumentException(fieldName + " weight must be finite and >= 0, got: " + cost);
        }
        return cost;
    }
}
