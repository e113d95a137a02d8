package org.dagnet.query.validation;

import org.dagnet.query.compile.CompilationResult;
import org.dagnet.query.config.QueryProperties;
import org.dagnet.query.constraint.SignedTerm;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.graph.GraphQueries;
import org.dagnet.query.graph.SimplePaths;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Offline oracle proving a compilation strategy exact on a given graph.
 *
 * <p>Flow injected at the source splits evenly over the outgoing edges of every node. A term
 * matches a path when all of its visited nodes lie strictly inside the path (subset
 * containment, the way a provider evaluates {@code visited}). The signed term sum must equal
 * the flow of every non-direct path within {@code 1e-9 * max(1, total)}.</p>
 *
 * <p>Verification only; enumerates every simple path between source and merge.</p>
 */
public final class FlowValidator {
    static final double RELATIVE_TOLERANCE = 1e-9d;

    private final int maxSimplePaths;

    public FlowValidator() {
        this(QueryProperties.maxSimplePaths());
    }

    public FlowValidator(int maxSimplePaths) {
        if (maxSimplePaths <= 0) {
            throw new IllegalArgumentException("maxSimplePaths must be > 0");
        }
        this.maxSimplePaths = maxSimplePaths;
    }

    public FlowValidation validate(FunnelGraph graph, String source, String merge, CompilationResult result,
                                   double initialFlow) {
        return validate(graph, source, merge, Objects.requireNonNull(result, "result").getTerms(), initialFlow);
    }

    /**
     * Evaluates {@code terms} against the synthetic flow of every simple path from source to merge.
     *
     * @throws IllegalArgumentException on unknown nodes, non-positive flow, or when the path cap is hit.
     */
    public FlowValidation validate(FunnelGraph graph, String source, String merge, List<SignedTerm> terms,
                                   double initialFlow) {
        Objects.requireNonNull(terms, "terms");
        List<WeightedPath> paths = weightedPaths(graph, source, merge, initialFlow);

        double total = 0.0d;
        double direct = 0.0d;
        for (WeightedPath path : paths) {
            total += path.flow;
            if (path.isDirect()) {
                direct += path.flow;
            }
        }

        double compiled = 0.0d;
        for (SignedTerm term : terms) {
            BitSet required = new BitSet(graph.nodeCount());
            for (String node : term.constraints().visited()) {
                required.set(graph.nodeId(node));
            }
            double termFlow = 0.0d;
            for (WeightedPath path : paths) {
                if (!path.isDirect() && path.interiorContains(required)) {
                    termFlow += path.flow;
                }
            }
            compiled += -term.coefficient().sign() * termFlow;
        }

        return new FlowValidation(
                total,
                direct,
                total - direct,
                compiled,
                paths.size(),
                terms.size(),
                RELATIVE_TOLERANCE * Math.max(1.0d, total)
        );
    }

    /**
     * Flow the naive per-path MECE rewrite would subtract: one {@code visited(interior)} term per
     * non-direct path, each matching every path whose interior contains it.
     */
    public double naivePerPathSubtraction(FunnelGraph graph, String source, String merge, double initialFlow) {
        List<WeightedPath> paths = weightedPaths(graph, source, merge, initialFlow);
        double subtracted = 0.0d;
        for (WeightedPath term : paths) {
            if (term.isDirect()) {
                continue;
            }
            for (WeightedPath path : paths) {
                if (!path.isDirect() && path.interiorContains(term.interior)) {
                    subtracted += path.flow;
                }
            }
        }
        return subtracted;
    }

    private List<WeightedPath> weightedPaths(FunnelGraph graph, String source, String merge, double initialFlow) {
        Objects.requireNonNull(graph, "graph");
        if (!(initialFlow > 0.0d) || Double.isInfinite(initialFlow)) {
            throw new IllegalArgumentException("initialFlow must be finite and > 0, got: " + initialFlow);
        }
        int from = requireNode(graph, source, "source");
        int to = requireNode(graph, merge, "merge");
        SimplePaths enumerated = GraphQueries.simplePaths(graph, from, to, maxSimplePaths);
        if (enumerated.truncated()) {
            throw new IllegalArgumentException("flow validation needs every simple path; cap of "
                    + maxSimplePaths + " reached between " + source + " and " + merge);
        }
        List<WeightedPath> weighted = new ArrayList<>(enumerated.paths().size());
        for (int[] path : enumerated.paths()) {
            double flow = initialFlow;
            for (int i = 0; i + 1 < path.length; i++) {
                flow /= graph.outDegree(path[i]);
            }
            weighted.add(new WeightedPath(path, flow, graph.nodeCount()));
        }
        return weighted;
    }

    private static int requireNode(FunnelGraph graph, String key, String fieldName) {
        if (key == null || !graph.containsNode(key)) {
            throw new IllegalArgumentException(fieldName + " is not a node of the graph: " + key);
        }
        return graph.nodeId(key);
    }

    private static final class WeightedPath {
        final int[] nodes;
        final double flow;
        final BitSet interior;

        WeightedPath(int[] nodes, double flow, int nodeCount) {
            this.nodes = nodes;
            this.flow = flow;
            this.interior = new BitSet(nodeCount);
            for (int i = 1; i + 1 < nodes.length; i++) {
                interior.set(nodes[i]);
            }
        }

        boolean isDirect() {
            return nodes.length == 2;
        }

        boolean interiorContains(BitSet required) {
            BitSet missing = (BitSet) required.clone();
            missing.andNot(interior);
            return missing.isEmpty();
        }
    }
}
