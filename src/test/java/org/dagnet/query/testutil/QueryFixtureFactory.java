package org.dagnet.query.testutil;

import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.constraint.VisitedAnyLiteral;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.graph.GraphQueries;
import org.dagnet.query.graph.SimplePaths;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Shared funnel graphs and journey oracles for query-compiler tests.
 */
public final class QueryFixtureFactory {
    private QueryFixtureFactory() {
    }

    /**
     * Reference funnel: one split at {@code a}, five first hops, reconverging at {@code m}.
     * {@code c} is isolated. Topological order is {@code a, c, f, d, e, b, g, m}.
     */
    public static FunnelGraph referenceFunnel() {
        return FunnelGraph.builder()
                .node("a").node("b").node("c").node("d").node("e").node("f").node("g").node("m")
                .edges(
                        new String[]{"a", "m"},
                        new String[]{"a", "b"},
                        new String[]{"b", "m"},
                        new String[]{"a", "f"},
                        new String[]{"f", "b"},
                        new String[]{"f", "g"},
                        new String[]{"a", "e"},
                        new String[]{"e", "b"},
                        new String[]{"e", "g"},
                        new String[]{"a", "d"},
                        new String[]{"d", "m"},
                        new String[]{"d", "g"},
                        new String[]{"d", "e"},
                        new String[]{"g", "m"}
                )
                .build();
    }

    /**
     * {@code x -> y -> z}.
     */
    public static FunnelGraph singlePath() {
        return FunnelGraph.builder()
                .edges(new String[]{"x", "y"}, new String[]{"y", "z"})
                .build();
    }

    /**
     * {@code a -> b -> d} and {@code a -> c -> d}.
     */
    public static FunnelGraph diamond() {
        return FunnelGraph.builder()
                .edges(
                        new String[]{"a", "b"},
                        new String[]{"a", "c"},
                        new String[]{"b", "d"},
                        new String[]{"c", "d"}
                )
                .build();
    }

    /**
     * {@code x -> y -> t} plus a second entry {@code z -> t} that {@code y} cannot reach.
     */
    public static FunnelGraph unreachableSibling() {
        return FunnelGraph.builder()
                .edges(
                        new String[]{"x", "y"},
                        new String[]{"y", "t"},
                        new String[]{"z", "t"}
                )
                .build();
    }

    /**
     * {@code a <-> b}, {@code a -> c}, {@code b -> c}, {@code c -> d}, {@code d -> b}: no entry node.
     */
    public static FunnelGraph cyclic() {
        return FunnelGraph.builder()
                .edges(
                        new String[]{"a", "b"},
                        new String[]{"b", "a"},
                        new String[]{"a", "c"},
                        new String[]{"b", "c"},
                        new String[]{"c", "d"},
                        new String[]{"d", "b"}
                )
                .build();
    }

    /**
     * Seeded random DAG over {@code n0..n<size-1>}; each pair {@code i < j} becomes the edge
     * {@code ni -> nj} with the given probability.
     */
    public static FunnelGraph randomDag(int size, double edgeProbability, long seed) {
        Random random = new Random(seed);
        FunnelGraph.Builder builder = FunnelGraph.builder();
        for (int i = 0; i < size; i++) {
            builder.node("n" + i);
        }
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (random.nextDouble() < edgeProbability) {
                    builder.edge("n" + i, "n" + j);
                }
            }
        }
        return builder.build();
    }

    /**
     * Every journey {@code entry -> ... -> source -> target} ending with the anchor edge,
     * where entry nodes have no incoming edge.
     */
    public static List<List<String>> journeys(FunnelGraph graph, String source, String target) {
        List<List<String>> journeys = new ArrayList<>();
        if (!graph.hasEdge(source, target)) {
            return journeys;
        }
        int sourceId = graph.nodeId(source);
        for (int entry : graph.entryNodes()) {
            SimplePaths paths = GraphQueries.simplePaths(graph, entry, sourceId, 100_000);
            for (int[] path : paths.paths()) {
                List<String> journey = new ArrayList<>();
                for (int node : path) {
                    journey.add(graph.nodeKey(node));
                }
                journey.add(target);
                journeys.add(journey);
            }
        }
        return journeys;
    }

    /**
     * Returns whether a journey honors the node literals of {@code constraints}; the anchor target
     * does not count as visited.
     */
    public static boolean honors(List<String> journey, ConstraintSet constraints) {
        Set<String> upstream = new HashSet<>(journey.subList(0, journey.size() - 1));
        for (String node : constraints.visited()) {
            if (!upstream.contains(node)) {
                return false;
            }
        }
        for (String node : constraints.exclude()) {
            if (upstream.contains(node)) {
                return false;
            }
        }
        for (VisitedAnyLiteral group : constraints.visitedAny()) {
            boolean hit = false;
            for (String member : group.nodes()) {
                hit |= upstream.contains(member);
            }
            if (!hit) {
                return false;
            }
        }
        return true;
    }
}
