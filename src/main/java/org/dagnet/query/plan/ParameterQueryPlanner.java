package org.dagnet.query.plan;

import org.dagnet.query.capability.ExcludeCapabilityResolver;
import org.dagnet.query.capability.StaticExcludeCapabilityRegistry;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.core.CompileRequest;
import org.dagnet.query.core.CompiledQuery;
import org.dagnet.query.core.QueryCompiler;
import org.dagnet.query.core.QueryCompilerException;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.graph.GraphQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generates one compiled query per data-bearing parameter of a funnel model.
 *
 * <p>Edges are visited in model order; per edge the base probability comes first, then the
 * conditionals in index order, then the cost parameters. Case-variant queries follow, per case
 * node, variant and outgoing edge. Native exclusion is decided once per edge and pessimistically:
 * only when every data source on the edge supports it.</p>
 */
public final class ParameterQueryPlanner {
    public static final String REASON_MODEL_REQUIRED = "P1_MODEL_REQUIRED";
    public static final String REASON_UNKNOWN_DOWNSTREAM_NODE = "P1_UNKNOWN_DOWNSTREAM_NODE";
    public static final String REASON_INVALID_CONDITIONAL_INDEX = "P1_INVALID_CONDITIONAL_INDEX";

    private static final Logger LOG = LoggerFactory.getLogger(ParameterQueryPlanner.class);

    private final QueryCompiler compiler;
    private final ExcludeCapabilityResolver capabilityResolver;

    public ParameterQueryPlanner(ExcludeCapabilityResolver capabilityResolver) {
        this(QueryCompiler.builder().capabilityResolver(capabilityResolver).build(), capabilityResolver);
    }

    public ParameterQueryPlanner(QueryCompiler compiler, ExcludeCapabilityResolver capabilityResolver) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.capabilityResolver = capabilityResolver == null ? StaticExcludeCapabilityRegistry.empty() : capabilityResolver;
    }

    /**
     * Plans every parameter selected by {@code options}.
     *
     * @throws QueryCompilerException on a missing model, an unknown downstream node or a
     *                                negative conditional index.
     */
    public List<ParameterQuery> planAll(FunnelModel model, PlanOptions options) {
        if (model == null) {
            throw new QueryCompilerException(REASON_MODEL_REQUIRED, "funnel model must be provided");
        }
        PlanOptions resolved = options == null ? PlanOptions.defaults() : options;
        Integer conditionalIndex = resolved.getConditionalIndex();
        if (conditionalIndex != null && conditionalIndex < 0) {
            throw new QueryCompilerException(
                    REASON_INVALID_CONDITIONAL_INDEX,
                    "conditionalIndex must be >= 0, got: " + conditionalIndex
            );
        }
        Selection selection = new Selection(model.getGraph(), resolved);

        List<ParameterQuery> queries = new ArrayList<>();
        for (EdgeParameters edge : model.getEdges()) {
            if (selection.accepts(edge.getFrom(), edge.getTo())) {
                planEdge(model.getGraph(), edge, resolved, queries);
            }
        }
        if (conditionalIndex == null) {
            for (CaseNode caseNode : model.getCaseNodes()) {
                planCaseNode(model, caseNode, resolved, selection, queries);
            }
        }
        LOG.debug("planned {} parameter queries over {} edges", queries.size(), model.getEdges().size());
        return queries;
    }

    /**
     * Plans every parameter and groups the queries by type, in {@link ParameterType} order.
     */
    public Map<ParameterType, List<ParameterQuery>> planByType(FunnelModel model, PlanOptions options) {
        Map<ParameterType, List<ParameterQuery>> byType = new EnumMap<>(ParameterType.class);
        for (ParameterType type : ParameterType.values()) {
            byType.put(type, new ArrayList<>());
        }
        for (ParameterQuery query : planAll(model, options)) {
            byType.get(query.getType()).add(query);
        }
        return byType;
    }

    /**
     * Returns whether every data source on the edge supports native exclusion; false when the
     * edge has none.
     */
    public boolean supportsNativeExclude(EdgeParameters edge) {
        List<DataSourceRef> sources = edge.dataSources();
        if (sources.isEmpty()) {
            return false;
        }
        for (DataSourceRef source : sources) {
            if (!capabilityResolver.supportsNativeExclude(source.getConnectionName(), source.getProviderName())) {
                return false;
            }
        }
        return true;
    }

    private void planEdge(FunnelGraph graph, EdgeParameters edge, PlanOptions options, List<ParameterQuery> out) {
        boolean nativeExclude = supportsNativeExclude(edge);
        String edgeKey = edge.edgeKey();
        Integer conditionalIndex = options.getConditionalIndex();

        CompiledQuery unconditioned = null;
        if (edge.getP() != null && conditionalIndex == null) {
            unconditioned = compile(graph, edge.getFrom(), edge.getTo(), null, nativeExclude, options);
            out.add(query(ParameterType.EDGE_BASE_P, slotId(edge.getP(), edgeKey, "p"), edgeKey,
                    ConstraintSet.empty(), unconditioned));
        }

        List<ConditionalParameter> conditionals = edge.getConditionals();
        for (int i = 0; i < conditionals.size(); i++) {
            if (conditionalIndex != null && conditionalIndex != i) {
                continue;
            }
            ConditionalParameter conditional = conditionals.get(i);
            ConstraintSet condition = conditional.getCondition() == null ? ConstraintSet.empty() : conditional.getCondition();
            CompiledQuery compiled = compile(graph, edge.getFrom(), edge.getTo(), condition, nativeExclude, options);
            out.add(query(ParameterType.EDGE_CONDITIONAL_P,
                    slotId(conditional.getSlot(), edgeKey, "conditional_p[" + i + "]"), edgeKey, condition, compiled));
        }

        if (conditionalIndex != null) {
            return;
        }
        // cost parameters share the unconditioned query
        if (edge.getCostGbp() != null) {
            unconditioned = unconditioned != null
                    ? unconditioned
                    : compile(graph, edge.getFrom(), edge.getTo(), null, nativeExclude, options);
            out.add(query(ParameterType.COST_GBP, slotId(edge.getCostGbp(), edgeKey, "cost_gbp"), edgeKey,
                    ConstraintSet.empty(), unconditioned));
        }
        if (edge.getCostTime() != null) {
            unconditioned = unconditioned != null
                    ? unconditioned
                    : compile(graph, edge.getFrom(), edge.getTo(), null, nativeExclude, options);
            out.add(query(ParameterType.COST_TIME, slotId(edge.getCostTime(), edgeKey, "cost_time"), edgeKey,
                    ConstraintSet.empty(), unconditioned));
        }
    }

    private void planCaseNode(FunnelModel model, CaseNode caseNode, PlanOptions options,
                              Selection selection, List<ParameterQuery> out) {
        String nodeKey = caseNode.getNodeKey();
        String caseId = caseNode.getCaseId();
        String paramId = caseId != null ? caseId : "synthetic:" + nodeKey + ":case";
        // case literals need a valid token, so an id-less case is named after its node
        String caseToken = caseId != null ? caseId : nodeKey;

        for (String variant : caseNode.getVariants()) {
            ConstraintSet condition = ConstraintSet.builder().caseVariant(caseToken, variant).build();
            for (EdgeParameters edge : model.getEdges()) {
                if (!edge.getFrom().equals(nodeKey) || !selection.accepts(edge.getFrom(), edge.getTo())) {
                    continue;
                }
                CompiledQuery compiled = compile(model.getGraph(), edge.getFrom(), edge.getTo(), condition,
                        supportsNativeExclude(edge), options);
                out.add(query(ParameterType.CASE_VARIANT_EDGE, paramId, edge.edgeKey(), condition, compiled));
            }
        }
    }

    private CompiledQuery compile(FunnelGraph graph, String from, String to, ConstraintSet condition,
                                  boolean nativeExclude, PlanOptions options) {
        return compiler.compile(CompileRequest.builder()
                .graph(graph)
                .fromNode(from)
                .toNode(to)
                .condition(condition)
                .synthesisOptions(options.getSynthesisOptions())
                .nativeExcludeOverride(nativeExclude)
                .build());
    }

    private static ParameterQuery query(ParameterType type, String paramId, String edgeKey,
                                        ConstraintSet condition, CompiledQuery compiled) {
        return ParameterQuery.builder()
                .type(type)
                .paramId(paramId)
                .edgeKey(edgeKey)
                .condition(condition)
                .compiled(compiled)
                .build();
    }

    private static String slotId(ParameterSlot slot, String edgeKey, String slotName) {
        if (slot != null && slot.getId() != null && !slot.getId().isBlank()) {
            return slot.getId();
        }
        return "synthetic:" + edgeKey + ":" + slotName;
    }

    /**
     * Edge filters resolved once per planning call.
     */
    private static final class Selection {
        private final String edgeKey;
        private final FunnelGraph graph;
        private final BitSet downstream;

        Selection(FunnelGraph graph, PlanOptions options) {
            this.graph = graph;
            this.edgeKey = options.getEdgeKey();
            String downstreamOf = options.getDownstreamOf();
            if (downstreamOf == null) {
                this.downstream = null;
            } else {
                if (!graph.containsNode(downstreamOf)) {
                    throw new QueryCompilerException(
                            REASON_UNKNOWN_DOWNSTREAM_NODE,
                            "unknown downstreamOf node: " + downstreamOf
                    );
                }
                int node = graph.nodeId(downstreamOf);
                this.downstream = GraphQueries.descendants(graph, node);
                this.downstream.set(node);
            }
        }

        boolean accepts(String from, String to) {
            if (edgeKey != null && !edgeKey.equals(from + "->" + to)) {
                return false;
            }
            if (downstream == null) {
                return true;
            }
            return graph.containsNode(from) && downstream.get(graph.nodeId(from));
        }
    }
}
