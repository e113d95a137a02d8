package org.dagnet.query.plan;

import org.dagnet.query.capability.StaticExcludeCapabilityRegistry;
import org.dagnet.query.constraint.CaseLiteral;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.core.QueryCompilerException;
import org.dagnet.query.testutil.QueryFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ParameterQueryPlanner Tests")
class ParameterQueryPlannerTest {
    private static final DataSourceRef AMPLITUDE_PROD = DataSourceRef.of("amplitude-prod", "amplitude");
    private static final DataSourceRef WAREHOUSE = DataSourceRef.of(null, "warehouse");

    private final ParameterQueryPlanner planner = new ParameterQueryPlanner(
            StaticExcludeCapabilityRegistry.builder().connection("amplitude-prod", true).build());

    @Test
    @DisplayName("Plans base, conditional, cost and case-variant parameters in model order")
    void testPlanAll() {
        List<ParameterQuery> queries = planner.planAll(model(), PlanOptions.defaults());

        assertEquals(8, queries.size());
        assertQuery(queries.get(0), ParameterType.EDGE_BASE_P, "p-am", "a->m");
        assertQuery(queries.get(1), ParameterType.EDGE_BASE_P, "synthetic:a->b:p", "a->b");
        assertQuery(queries.get(2), ParameterType.EDGE_CONDITIONAL_P, "synthetic:b->m:conditional_p[0]", "b->m");
        assertQuery(queries.get(3), ParameterType.COST_GBP, "cost-bm", "b->m");
        assertQuery(queries.get(4), ParameterType.CASE_VARIANT_EDGE, "exp-checkout", "a->m");
        assertQuery(queries.get(5), ParameterType.CASE_VARIANT_EDGE, "exp-checkout", "a->b");
        assertQuery(queries.get(6), ParameterType.CASE_VARIANT_EDGE, "exp-checkout", "a->m");
        assertEquals(List.of(new CaseLiteral("exp-checkout", "treatment")), queries.get(7).getCondition().cases());
    }

    @Test
    @DisplayName("Native exclude is decided per edge from its data sources")
    void testCapabilityPerEdge() {
        List<ParameterQuery> queries = planner.planAll(model(), PlanOptions.defaults());

        ParameterQuery directBase = queries.get(0);
        assertTrue(directBase.getCompiled().isNativeExclude());
        assertEquals(List.of("b", "d", "g"), directBase.getCompiled().getConstraints().exclude());

        ParameterQuery unboundBase = queries.get(1);
        assertFalse(unboundBase.getCompiled().isNativeExclude());
        assertTrue(unboundBase.getCompiled().hasSignedTerms());
        assertTrue(unboundBase.getCompiled().getConstraints().exclude().isEmpty());
    }

    @Test
    @DisplayName("Conditional queries compile under their condition")
    void testConditionalQuery() {
        ParameterQuery conditional = planner.planAll(model(), PlanOptions.defaults()).get(2);

        assertEquals(ConstraintSet.builder().visited("f").build(), conditional.getCondition());
        assertEquals(List.of("f"), conditional.getCompiled().getConstraints().visited());
    }

    @Test
    @DisplayName("Pessimistic capability: every data source must support native exclude")
    void testPessimisticCapability() {
        EdgeParameters mixed = EdgeParameters.builder()
                .from("a").to("m")
                .p(ParameterSlot.of("p-am", AMPLITUDE_PROD))
                .costTime(ParameterSlot.of("time-am", WAREHOUSE))
                .build();
        EdgeParameters allSupported = EdgeParameters.builder()
                .from("a").to("m")
                .p(ParameterSlot.of("p-am", AMPLITUDE_PROD))
                .costTime(ParameterSlot.of("time-am", DataSourceRef.of("amplitude-prod", null)))
                .build();
        EdgeParameters bare = EdgeParameters.builder().from("a").to("m").build();

        assertFalse(planner.supportsNativeExclude(mixed));
        assertTrue(planner.supportsNativeExclude(allSupported));
        assertFalse(planner.supportsNativeExclude(bare));
    }

    @Test
    @DisplayName("Cost parameters share the unconditioned query of the edge")
    void testCostSharesBaseQuery() {
        FunnelModel costed = FunnelModel.builder()
                .graph(QueryFixtureFactory.referenceFunnel())
                .edge(EdgeParameters.builder()
                        .from("a").to("m")
                        .p(ParameterSlot.unbound("p-am"))
                        .costGbp(ParameterSlot.unbound(null))
                        .costTime(ParameterSlot.unbound("time-am"))
                        .build())
                .build();

        List<ParameterQuery> queries = planner.planAll(costed, PlanOptions.defaults());
        assertEquals(3, queries.size());
        assertEquals("synthetic:a->m:cost_gbp", queries.get(1).getParamId());
        assertSame(queries.get(0).getCompiled(), queries.get(1).getCompiled());
        assertSame(queries.get(0).getCompiled(), queries.get(2).getCompiled());
    }

    @Test
    @DisplayName("Edge, conditional and downstream filters narrow the plan")
    void testFilters() {
        FunnelModel model = model();

        List<ParameterQuery> byEdge = planner.planAll(model, PlanOptions.builder().edgeKey("b->m").build());
        assertEquals(2, byEdge.size());

        List<ParameterQuery> byConditional = planner.planAll(model, PlanOptions.builder().conditionalIndex(0).build());
        assertEquals(1, byConditional.size());
        assertEquals(ParameterType.EDGE_CONDITIONAL_P, byConditional.get(0).getType());

        List<ParameterQuery> downstream = planner.planAll(model, PlanOptions.builder().downstreamOf("b").build());
        assertEquals(2, downstream.size());
        downstream.forEach(query -> assertEquals("b->m", query.getEdgeKey()));

        List<ParameterQuery> fromSplit = planner.planAll(model, PlanOptions.builder().downstreamOf("a").build());
        assertEquals(8, fromSplit.size());
    }

    @Test
    @DisplayName("Case without an id gets a synthetic parameter id and is named after its node")
    void testCaseWithoutId() {
        FunnelModel model = FunnelModel.builder()
                .graph(QueryFixtureFactory.diamond())
                .edge(EdgeParameters.builder().from("a").to("b").build())
                .edge(EdgeParameters.builder().from("a").to("c").build())
                .caseNode(CaseNode.builder().nodeKey("a").variant("control").build())
                .build();

        List<ParameterQuery> queries = planner.planAll(model, PlanOptions.defaults());
        assertEquals(2, queries.size());
        for (ParameterQuery query : queries) {
            assertEquals(ParameterType.CASE_VARIANT_EDGE, query.getType());
            assertEquals("synthetic:a:case", query.getParamId());
            assertEquals(List.of(new CaseLiteral("a", "control")), query.getCompiled().getConstraints().cases());
        }
    }

    @Test
    @DisplayName("Grouping by type keeps every type, in declaration order")
    void testPlanByType() {
        Map<ParameterType, List<ParameterQuery>> byType = planner.planByType(model(), PlanOptions.defaults());

        assertEquals(List.of(ParameterType.values()), List.copyOf(byType.keySet()));
        assertEquals(2, byType.get(ParameterType.EDGE_BASE_P).size());
        assertEquals(1, byType.get(ParameterType.EDGE_CONDITIONAL_P).size());
        assertEquals(1, byType.get(ParameterType.COST_GBP).size());
        assertTrue(byType.get(ParameterType.COST_TIME).isEmpty());
        assertEquals(4, byType.get(ParameterType.CASE_VARIANT_EDGE).size());
    }

    @Test
    @DisplayName("Validation: model, downstream node and conditional index")
    void testValidation() {
        QueryCompilerException missing = assertThrows(QueryCompilerException.class,
                () -> planner.planAll(null, PlanOptions.defaults()));
        assertEquals(ParameterQueryPlanner.REASON_MODEL_REQUIRED, missing.getReasonCode());

        QueryCompilerException unknown = assertThrows(QueryCompilerException.class,
                () -> planner.planAll(model(), PlanOptions.builder().downstreamOf("zz").build()));
        assertEquals(ParameterQueryPlanner.REASON_UNKNOWN_DOWNSTREAM_NODE, unknown.getReasonCode());

        QueryCompilerException negative = assertThrows(QueryCompilerException.class,
                () -> planner.planAll(model(), PlanOptions.builder().conditionalIndex(-1).build()));
        assertEquals(ParameterQueryPlanner.REASON_INVALID_CONDITIONAL_INDEX, negative.getReasonCode());
    }

    private static FunnelModel model() {
        return FunnelModel.builder()
                .graph(QueryFixtureFactory.referenceFunnel())
                .edge(EdgeParameters.builder()
                        .from("a").to("m")
                        .p(ParameterSlot.of("p-am", AMPLITUDE_PROD))
                        .build())
                .edge(EdgeParameters.builder()
                        .from("a").to("b")
                        .p(ParameterSlot.unbound(null))
                        .build())
                .edge(EdgeParameters.builder()
                        .from("b").to("m")
                        .conditional(new ConditionalParameter(
                                ConstraintSet.builder().visited("f").build(),
                                ParameterSlot.of(null, WAREHOUSE)))
                        .costGbp(ParameterSlot.unbound("cost-bm"))
                        .build())
                .caseNode(CaseNode.builder()
                        .nodeKey("a")
                        .caseId("exp-checkout")
                        .variant("control")
                        .variant("treatment")
                        .build())
                .build();
    }

    private static void assertQuery(ParameterQuery query, ParameterType type, String paramId, String edgeKey) {
        assertEquals(type, query.getType());
        assertEquals(paramId, query.getParamId());
        assertEquals(edgeKey, query.getEdgeKey());
        assertNotNull(query.getCompiled());
    }
}
