package org.dagnet.query.core;

import lombok.Builder;
import org.dagnet.query.capability.ExcludeCapabilityResolver;
import org.dagnet.query.capability.StaticExcludeCapabilityRegistry;
import org.dagnet.query.compile.CompilationResult;
import org.dagnet.query.compile.InclusionExclusionCompiler;
import org.dagnet.query.config.QueryProperties;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.graph.AnchorEdge;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.synthesis.ConstraintSynthesizer;
import org.dagnet.query.synthesis.SynthesisOptions;
import org.dagnet.query.synthesis.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Public facade compiling one anchor edge into a provider-ready query.
 *
 * <p>Pipeline: request validation, witness-guided synthesis, capability lookup and, when the
 * provider cannot evaluate exclusions natively, inclusion-exclusion rewrite with the anchor
 * target as merge node. Contract violations throw {@link QueryCompilerException}; search
 * outcomes (unsatisfiable, degraded, invalid anchor) are reported through the result.</p>
 */
public final class QueryCompiler {
    public static final String REASON_REQUEST_REQUIRED = "Q1_REQUEST_REQUIRED";
    public static final String REASON_GRAPH_REQUIRED = "Q1_GRAPH_REQUIRED";
    public static final String REASON_FROM_NODE_REQUIRED = "Q1_FROM_NODE_REQUIRED";
    public static final String REASON_TO_NODE_REQUIRED = "Q1_TO_NODE_REQUIRED";
    public static final String REASON_UNKNOWN_NODE = "Q1_UNKNOWN_NODE";
    public static final String REASON_INVALID_OPTIONS = "Q1_INVALID_OPTIONS";
    public static final String REASON_INVALID_TERM_BUDGET = "Q1_INVALID_TERM_BUDGET";
    public static final String REASON_REWRITE_FAILED = "Q2_REWRITE_FAILED";

    private static final Logger LOG = LoggerFactory.getLogger(QueryCompiler.class);

    private final ExcludeCapabilityResolver capabilityResolver;
    private final ConstraintSynthesizer synthesizer;
    private final InclusionExclusionCompiler rewriter;

    /**
     * Creates a compiler.
     *
     * @param capabilityResolver optional; defaults to a registry that knows no provider.
     * @param synthesizer optional synthesizer override.
     * @param rewriter optional inclusion-exclusion compiler override (pruned by default).
     */
    @Builder
    public QueryCompiler(
            ExcludeCapabilityResolver capabilityResolver,
            ConstraintSynthesizer synthesizer,
            InclusionExclusionCompiler rewriter
    ) {
        this.capabilityResolver = capabilityResolver == null ? StaticExcludeCapabilityRegistry.empty() : capabilityResolver;
        this.synthesizer = synthesizer == null ? new ConstraintSynthesizer() : synthesizer;
        this.rewriter = rewriter == null ? new InclusionExclusionCompiler() : rewriter;
    }

    /**
     * Compiles one edge query.
     *
     * @param request request in node-key space.
     * @return compiled query; never null.
     * @throws QueryCompilerException when request contracts fail.
     */
    public CompiledQuery compile(CompileRequest request) {
        if (request == null) {
            throw new QueryCompilerException(REASON_REQUEST_REQUIRED, "compile request must be provided");
        }
        FunnelGraph graph = request.getGraph();
        if (graph == null) {
            throw new QueryCompilerException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        String from = requireNode(graph, request.getFromNode(), REASON_FROM_NODE_REQUIRED, "fromNode");
        String to = requireNode(graph, request.getToNode(), REASON_TO_NODE_REQUIRED, "toNode");
        SynthesisOptions options = resolveOptions(request.getSynthesisOptions());
        int termBudget = resolveTermBudget(request.getTermBudget());

        AnchorEdge anchor = AnchorEdge.of(from, to);
        SynthesisResult synthesis = synthesizer.synthesize(graph, anchor, request.getCondition(), options);
        ConstraintSet synthesized = synthesis.getConstraints();
        boolean nativeExclude = request.getNativeExcludeOverride() != null
                ? request.getNativeExcludeOverride()
                : capabilityResolver.supportsNativeExclude(request.getConnectionName(), request.getProviderName());

        CompiledQuery.CompiledQueryBuilder builder = CompiledQuery.builder()
                .anchor(anchor)
                .synthesisStatus(synthesis.getStatus())
                .synthesized(synthesized)
                .nativeExclude(nativeExclude)
                .diagnostics(synthesis.getDiagnostics());

        if (!synthesis.isSatisfied() || synthesized.exclude().isEmpty() || nativeExclude) {
            LOG.debug("edge {}: status={} excludes={} native={}",
                    anchor.key(), synthesis.getStatus(), synthesized.exclude().size(), nativeExclude);
            return builder.constraints(synthesized).build();
        }

        CompilationResult compilation;
        try {
            compilation = rewriter.compile(graph, from, to, to, synthesized.exclude(), synthesized, termBudget);
        } catch (IllegalArgumentException ex) {
            throw new QueryCompilerException(
                    REASON_REWRITE_FAILED,
                    "failed to rewrite exclusions for " + anchor.key() + ": " + ex.getMessage(),
                    ex
            );
        }
        if (!compilation.isExact()) {
            LOG.warn("edge {}: exclusion rewrite degraded ({}), {} partial terms",
                    anchor.key(), compilation.getReason(), compilation.getTerms().size());
        } else {
            LOG.debug("edge {}: {} excludes rewritten into {} terms",
                    anchor.key(), synthesized.exclude().size(), compilation.getTerms().size());
        }
        return builder
                .compilation(compilation)
                .constraints(compilation.toConstraintSet())
                .build();
    }

    private static String requireNode(FunnelGraph graph, String nodeKey, String missingReason, String fieldName) {
        if (nodeKey == null || nodeKey.isBlank()) {
            throw new QueryCompilerException(missingReason, fieldName + " must be provided");
        }
        if (!graph.containsNode(nodeKey)) {
            throw new QueryCompilerException(REASON_UNKNOWN_NODE, "unknown " + fieldName + ": " + nodeKey);
        }
        return nodeKey;
    }

    private static SynthesisOptions resolveOptions(SynthesisOptions options) {
        if (options == null) {
            return SynthesisOptions.defaults();
        }
        try {
            return options.validate();
        } catch (IllegalArgumentException ex) {
            throw new QueryCompilerException(REASON_INVALID_OPTIONS, ex.getMessage(), ex);
        }
    }

    private static int resolveTermBudget(Integer termBudget) {
        if (termBudget == null) {
            return QueryProperties.termBudget();
        }
        if (termBudget <= 0) {
            throw new QueryCompilerException(REASON_INVALID_TERM_BUDGET, "termBudget must be > 0, got: " + termBudget);
        }
        return termBudget;
    }
}
