package org.dagnet.query.compile;

import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.testutil.QueryFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("MergeAnalysis Tests")
class MergeAnalysisTest {
    private final FunnelGraph funnel = QueryFixtureFactory.referenceFunnel();

    @Test
    @DisplayName("Competing first hops are the other successors that reach the merge")
    void testCompetingFirstHops() {
        MergeAnalysis analysis = new MergeAnalysis(funnel, 1_000);

        int[] hops = analysis.competingFirstHops(id("a"), id("m"), id("m"));
        assertArrayEquals(new int[]{id("b"), id("f"), id("e"), id("d")}, hops);
        assertEquals(0, analysis.competingFirstHops(id("g"), id("m"), id("m")).length);
    }

    @Test
    @DisplayName("Merge is the earliest node shared by every branch")
    void testFindMerge() {
        MergeAnalysis analysis = new MergeAnalysis(funnel, 1_000);
        assertEquals(id("m"), analysis.findMerge(id("a"), id("m")));
        assertEquals(id("m"), analysis.findMerge(id("b"), id("m")));

        FunnelGraph diamond = QueryFixtureFactory.diamond();
        MergeAnalysis diamondAnalysis = new MergeAnalysis(diamond, 1_000);
        assertEquals(diamond.nodeId("d"), diamondAnalysis.findMerge(diamond.nodeId("a"), diamond.nodeId("b")));
    }

    @Test
    @DisplayName("Separator of a branch is its first hop; the merge itself yields the merge")
    void testFindSeparator() {
        MergeAnalysis analysis = new MergeAnalysis(funnel, 1_000);
        int[] kept = {id("a"), id("m")};

        assertEquals(id("f"), analysis.findSeparator(id("a"), id("f"), id("m"), kept));
        assertEquals(id("d"), analysis.findSeparator(id("a"), id("d"), id("m"), kept));
        assertEquals(id("m"), analysis.findSeparator(id("a"), id("m"), id("m"), kept));
    }

    @Test
    @DisplayName("Hitting the path cap falls back to cut nodes with the same answer")
    void testPathCapFallback() {
        MergeAnalysis capped = new MergeAnalysis(funnel, 1);
        int[] kept = {id("a"), id("m")};

        assertEquals(id("f"), capped.findSeparator(id("a"), id("f"), id("m"), kept));
        assertEquals(id("d"), capped.findSeparator(id("a"), id("d"), id("m"), kept));
        assertThrows(IllegalArgumentException.class, () -> new MergeAnalysis(funnel, 0));
    }

    private int id(String key) {
        return funnel.nodeId(key);
    }
}
