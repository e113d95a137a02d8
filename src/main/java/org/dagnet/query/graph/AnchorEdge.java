package org.dagnet.query.graph;

import lombok.Value;

import java.util.Objects;

/**
 * The single transition a query is built to isolate, in node-key space.
 */
@Value
public class AnchorEdge {
    String source;
    String target;

    public AnchorEdge(String source, String target) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public static AnchorEdge of(String source, String target) {
        return new AnchorEdge(source, target);
    }

    /**
     * Returns whether the edge exists in the given graph.
     */
    public boolean existsIn(FunnelGraph graph) {
        return graph.hasEdge(source, target);
    }

    /**
     * Returns the {@code from->to} form used as edge key in parameter plans.
     */
    public String key() {
        return source + "->" + target;
    }
}
