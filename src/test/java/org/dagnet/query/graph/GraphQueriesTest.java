package org.dagnet.query.graph;

import org.dagnet.query.testutil.QueryFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GraphQueries Tests")
class GraphQueriesTest {

    @Test
    @DisplayName("Topological order is deterministic Kahn order")
    void testTopologicalOrder() {
        FunnelGraph graph = QueryFixtureFactory.referenceFunnel();
        int[] order = GraphQueries.topologicalOrder(graph);

        StringBuilder keys = new StringBuilder();
        for (int node : order) {
            keys.append(graph.nodeKey(node));
        }
        assertEquals("acfdebgm", keys.toString());
        assertTrue(GraphQueries.isAcyclic(graph));
    }

    @Test
    @DisplayName("Cyclic leftovers are appended so order stays a permutation")
    void testCyclicGraph() {
        FunnelGraph graph = FunnelGraph.builder()
                .edges(new String[]{"s", "p"}, new String[]{"p", "q"}, new String[]{"q", "p"})
                .build();

        assertFalse(GraphQueries.isAcyclic(graph));
        int[] order = GraphQueries.topologicalOrder(graph);
        assertEquals(3, order.length);
        assertEquals(graph.nodeId("s"), order[0]);
        assertTrue(GraphQueries.descendants(graph, graph.nodeId("p")).get(graph.nodeId("p")));
    }

    @Test
    @DisplayName("Descendants and ancestors exclude the node itself on a DAG")
    void testClosures() {
        FunnelGraph graph = QueryFixtureFactory.referenceFunnel();
        int d = graph.nodeId("d");

        BitSet below = GraphQueries.descendants(graph, d);
        assertTrue(below.get(graph.nodeId("e")));
        assertTrue(below.get(graph.nodeId("b")));
        assertFalse(below.get(d));
        assertFalse(below.get(graph.nodeId("f")));

        BitSet above = GraphQueries.ancestors(graph, graph.nodeId("b"));
        assertEquals(4, above.cardinality());
        assertFalse(above.get(graph.nodeId("g")));
    }

    @Test
    @DisplayName("Shortest path honors the avoid set")
    void testShortestPath() {
        FunnelGraph graph = QueryFixtureFactory.referenceFunnel();
        int a = graph.nodeId("a");
        int b = graph.nodeId("b");

        assertArrayEquals(new int[]{a, b}, GraphQueries.shortestPath(graph, a, b, new BitSet()));

        BitSet avoid = new BitSet();
        avoid.set(graph.nodeId("f"));
        avoid.set(graph.nodeId("e"));
        avoid.set(b);
        assertEquals(0, GraphQueries.shortestPath(graph, a, b, avoid).length);

        avoid.clear(b);
        int[] detour = GraphQueries.shortestPath(graph, graph.nodeId("d"), b, avoid);
        assertEquals(0, detour.length);

        assertArrayEquals(new int[]{a}, GraphQueries.shortestPath(graph, a, a, new BitSet()));
    }

    @Test
    @DisplayName("Simple paths enumerate every route and flag truncation")
    void testSimplePaths() {
        FunnelGraph graph = QueryFixtureFactory.referenceFunnel();
        int a = graph.nodeId("a");
        int m = graph.nodeId("m");

        SimplePaths all = GraphQueries.simplePaths(graph, a, m, 1_000);
        assertEquals(10, all.paths().size());
        assertFalse(all.truncated());

        SimplePaths capped = GraphQueries.simplePaths(graph, a, m, 3);
        assertEquals(3, capped.paths().size());
        assertTrue(capped.truncated());

        assertThrows(IllegalArgumentException.class, () -> GraphQueries.simplePaths(graph, a, m, 0));
    }
}
