package org.dagnet.query.synthesis;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.dagnet.query.constraint.CaseLiteral;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.constraint.ContextLiteral;
import org.dagnet.query.constraint.VisitedAnyLiteral;
import org.dagnet.query.graph.AnchorEdge;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.search.ReachabilityTable;
import org.dagnet.query.search.WitnessPath;
import org.dagnet.query.search.WitnessRequest;
import org.dagnet.query.search.WitnessSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.Objects;

/**
 * Witness-guided synthesis of the literals that isolate one anchor edge.
 *
 * <p>Instead of enumerating simple paths, the synthesizer iterates to a fixed point:</p>
 * <ul>
 * <li>Bootstrap: find one journey honoring the condition. It seeds the first-divergence heuristic.</li>
 * <li>Without a condition, other direct predecessors of the target reachable from the source
 * are excluded eagerly.</li>
 * <li>Each pass looks for one violating witness: a condition visited node that can be skipped,
 * a condition OR-group that can be skipped, or a condition exclude node that can be entered.</li>
 * <li>The first violation found gets exactly one remedy, chosen by literal weights.</li>
 * </ul>
 * <p>Only nodes of the literal universe (ancestors of the source, anchor endpoints excluded) or
 * the source itself are checked; other condition literals pass through untouched in both
 * preserve and rewrite mode.
 * Stateless; safe to share across threads.</p>
 */
public final class ConstraintSynthesizer {
    private static final Logger LOG = LoggerFactory.getLogger(ConstraintSynthesizer.class);

    /**
     * Synthesizes the discriminating literals for {@code anchor}.
     *
     * @param graph funnel graph, read-only for the call.
     * @param anchor edge to isolate.
     * @param condition pre-existing constraints the query must honor; may be null.
     * @param options caps, weights and rewrite policy.
     * @return result with status {@code EXACT}, {@code DEGRADED}, {@code UNSATISFIABLE} or {@code INVALID_ANCHOR}.
     * @throws IllegalArgumentException when options are out of range.
     */
    public SynthesisResult synthesize(FunnelGraph graph, AnchorEdge anchor, ConstraintSet condition, SynthesisOptions options) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(anchor, "anchor");
        SynthesisOptions resolved = Objects.requireNonNull(options, "options").validate();
        ConstraintSet canonical = condition == null ? ConstraintSet.empty() : ConstraintSet.fromLiterals(condition.literals());

        if (!anchor.existsIn(graph)) {
            LOG.debug("anchor {} is not an edge of {}", anchor.key(), graph);
            return SynthesisResult.invalidAnchor(anchor);
        }

        Run run = new Run(graph, anchor, canonical, resolved);
        return run.execute();
    }

    /**
     * Mutable working set of one call.
     */
    private static final class Run {
        private final FunnelGraph graph;
        private final AnchorEdge anchor;
        private final ConstraintSet condition;
        private final SynthesisOptions options;
        private final LiteralWeights weights;
        private final int source;
        private final int target;
        private final ReachabilityTable table;
        private final WitnessSearch search;
        private final BitSet universe;
        private final SynthesisState state;
        private WitnessPath bootstrap;

        Run(FunnelGraph graph, AnchorEdge anchor, ConstraintSet condition, SynthesisOptions options) {
            this.graph = graph;
            this.anchor = anchor;
            this.condition = condition;
            this.options = options;
            this.weights = options.getLiteralWeights();
            this.source = graph.nodeId(anchor.getSource());
            this.target = graph.nodeId(anchor.getTarget());
            this.table = new ReachabilityTable(graph);
            this.search = new WitnessSearch(table, source, target);
            this.universe = (BitSet) table.ancestorsOf(source).clone();
            this.universe.clear(source);
            this.universe.clear(target);
            this.state = new SynthesisState(graph);
        }

        SynthesisResult execute() {
            bootstrap = search.find(bootstrapRequest());
            if (!bootstrap.found()) {
                LOG.debug("no journey honors the condition for {}", anchor.key());
                return result(SynthesisStatus.UNSATISFIABLE, ConstraintSet.builder(), 0, null);
            }
            if (options.isPreserveCondition()) {
                state.seed(condition);
            } else {
                // only literals the loop can check are rewritten
                state.seedUnchecked(condition, this::eligible);
            }
            if (!condition.hasNodeLiterals()) {
                excludeReachableSiblingParents();
            }

            int iterations = 0;
            DegradationReason degraded = null;
            while (true) {
                if (iterations >= options.getMaxIterations()) {
                    degraded = DegradationReason.ITERATION_CAP;
                    break;
                }
                iterations++;
                Violation violation = findViolation();
                if (violation == null) {
                    break;
                }
                if (violation.kind == ViolationKind.CAPPED) {
                    degraded = DegradationReason.CHECK_CAP;
                    break;
                }
                if (!remedy(violation)) {
                    degraded = DegradationReason.NO_PROGRESS;
                    break;
                }
            }

            if (degraded != null) {
                LOG.warn("synthesis for {} degraded after {} checks and {} iterations: {}",
                        anchor.key(), search.checks(), iterations, degraded);
                return result(SynthesisStatus.DEGRADED, state.toBuilder(), iterations, degraded);
            }
            return result(SynthesisStatus.EXACT, state.toBuilder(), iterations, null);
        }

        private WitnessRequest bootstrapRequest() {
            WitnessRequest.WitnessRequestBuilder builder = WitnessRequest.builder()
                    .required(state.toIds(condition.visited()))
                    .avoid(state.toIds(condition.exclude()));
            for (VisitedAnyLiteral group : condition.visitedAny()) {
                builder.group(state.toIds(group.nodes()));
            }
            return builder.build();
        }

        /**
         * Other direct parents of the target that the source can reach are alternate routes.
         * Read from the memo table; not counted as witness checks.
         */
        private void excludeReachableSiblingParents() {
            int parents = graph.inDegree(target);
            for (int i = 0; i < parents; i++) {
                int parent = graph.predecessor(target, i);
                if (parent != source && table.reaches(source, parent)) {
                    state.addExclude(parent);
                }
            }
        }

        private Violation findViolation() {
            IntSet conditionExclude = state.toIds(condition.exclude());

            for (String requiredKey : condition.visited()) {
                int required = knownId(requiredKey);
                if (required < 0 || !eligible(required)) {
                    continue;
                }
                if (capReached()) {
                    return Violation.CAPPED;
                }
                IntSet avoid = new IntOpenHashSet(conditionExclude);
                avoid.add(required);
                WitnessPath witness = search.find(state.request(avoid).build());
                if (witness.found()) {
                    return new Violation(ViolationKind.MISSING_VISITED, required, IntSets.EMPTY_SET, witness);
                }
            }

            for (VisitedAnyLiteral group : condition.visitedAny()) {
                IntSet upstream = new IntOpenHashSet();
                for (int member : state.toIds(group.nodes())) {
                    if (eligible(member)) {
                        upstream.add(member);
                    }
                }
                if (upstream.isEmpty()) {
                    continue;
                }
                if (capReached()) {
                    return Violation.CAPPED;
                }
                IntSet avoid = new IntOpenHashSet(conditionExclude);
                avoid.addAll(upstream);
                WitnessPath witness = search.find(state.request(avoid).build());
                if (witness.found()) {
                    return new Violation(ViolationKind.MISSING_GROUP, -1, upstream, witness);
                }
            }

            for (String forbiddenKey : condition.exclude()) {
                int forbidden = knownId(forbiddenKey);
                if (forbidden < 0 || !eligible(forbidden)) {
                    continue;
                }
                if (capReached()) {
                    return Violation.CAPPED;
                }
                WitnessPath witness = search.find(state.request(IntSets.EMPTY_SET).includeNode(forbidden).build());
                if (witness.found()) {
                    return new Violation(ViolationKind.FORBIDDEN_INCLUDED, forbidden, IntSets.EMPTY_SET, witness);
                }
            }
            return null;
        }

        private boolean remedy(Violation violation) {
            return switch (violation.kind) {
                case MISSING_VISITED -> remedyMissingVisited(violation);
                case MISSING_GROUP -> remedyMissingGroup(violation);
                case FORBIDDEN_INCLUDED -> remedyForbiddenIncluded(violation);
                case CAPPED -> false;
            };
        }

        private boolean remedyMissingVisited(Violation violation) {
            int missing = violation.node;
            if (weights.prefersVisited()) {
                LOG.debug("{}: visited({})", anchor.key(), graph.nodeKey(missing));
                return state.addVisited(missing);
            }
            if (!options.isPreserveCondition() && isParentOfSource(missing)) {
                IntSet siblings = sourceParentsExcept(IntSets.singleton(missing));
                if (!siblings.isEmpty() && state.addExcludes(siblings)) {
                    LOG.debug("{}: excluded siblings of {}", anchor.key(), graph.nodeKey(missing));
                    return true;
                }
            }
            if (excludeDivergence(violation.witness)) {
                return true;
            }
            return state.addVisited(missing);
        }

        private boolean remedyMissingGroup(Violation violation) {
            IntSet members = violation.members;
            if (options.isPreserveCondition()) {
                return state.addGroup(members);
            }
            IntSet siblings = sourceParentsExcept(members);
            if (!siblings.isEmpty()
                    && weights.getExclude() * siblings.size() < weights.getVisited()
                    && state.addExcludes(siblings)) {
                LOG.debug("{}: excluded {} siblings instead of an OR-group", anchor.key(), siblings.size());
                return true;
            }
            if (weights.prefersVisited() && state.addGroup(members)) {
                return true;
            }
            if (excludeDivergence(violation.witness)) {
                return true;
            }
            return state.addGroup(members);
        }

        private boolean remedyForbiddenIncluded(Violation violation) {
            int forbidden = violation.node;
            if (!options.isPreserveCondition() && weights.prefersVisited()) {
                IntSet siblings = new IntOpenHashSet();
                int parents = graph.inDegree(source);
                for (int i = 0; i < parents; i++) {
                    int parent = graph.predecessor(source, i);
                    if (parent != forbidden && universe.get(parent)) {
                        siblings.add(parent);
                    }
                }
                if (!siblings.isEmpty() && state.addGroup(siblings)) {
                    LOG.debug("{}: OR-group over siblings of {}", anchor.key(), graph.nodeKey(forbidden));
                    return true;
                }
            }
            LOG.debug("{}: exclude({})", anchor.key(), graph.nodeKey(forbidden));
            return state.addExclude(forbidden);
        }

        /**
         * Excludes the first node of the violating witness that leaves the bootstrap journey.
         */
        private boolean excludeDivergence(WitnessPath witness) {
            int divergence = witness.firstDivergence(bootstrap, universe::get);
            if (divergence < 0) {
                return false;
            }
            boolean added = state.addExclude(divergence);
            if (added) {
                LOG.debug("{}: exclude({}) at first divergence", anchor.key(), graph.nodeKey(divergence));
            }
            return added;
        }

        /**
         * Direct parents of the source inside the universe, minus {@code except} and minus
         * anything on the bootstrap journey, so the bootstrap witness always stays valid.
         */
        private IntSet sourceParentsExcept(IntSet except) {
            IntSet siblings = new IntOpenHashSet();
            int parents = graph.inDegree(source);
            for (int i = 0; i < parents; i++) {
                int parent = graph.predecessor(source, i);
                if (universe.get(parent) && !except.contains(parent) && !bootstrap.contains(parent)) {
                    siblings.add(parent);
                }
            }
            return siblings;
        }

        private boolean isParentOfSource(int node) {
            return graph.hasEdge(node, source);
        }

        private int knownId(String key) {
            return graph.containsNode(key) ? graph.nodeId(key) : -1;
        }

        private boolean eligible(int node) {
            return node == source || universe.get(node);
        }

        private boolean capReached() {
            return search.checks() >= options.getMaxChecks();
        }

        private SynthesisResult result(SynthesisStatus status, ConstraintSet.Builder literals, int iterations,
                                       DegradationReason degraded) {
            if (options.isPreserveCaseContext()) {
                for (CaseLiteral caseLiteral : condition.cases()) {
                    literals.literal(caseLiteral);
                }
                for (ContextLiteral context : condition.contexts()) {
                    literals.literal(context);
                }
            }
            ConstraintSet constraints = literals.build();
            SynthesisDiagnostics diagnostics = new SynthesisDiagnostics(
                    search.checks(),
                    constraints.literalCount(),
                    iterations,
                    degraded
            );
            return new SynthesisResult(anchor, status, constraints, diagnostics);
        }
    }

    private enum ViolationKind {
        MISSING_VISITED,
        MISSING_GROUP,
        FORBIDDEN_INCLUDED,
        CAPPED
    }

    private static final class Violation {
        static final Violation CAPPED = new Violation(ViolationKind.CAPPED, -1, IntSets.EMPTY_SET, WitnessPath.none());

        final ViolationKind kind;
        final int node;
        final IntSet members;
        final WitnessPath witness;

        Violation(ViolationKind kind, int node, IntSet members, WitnessPath witness) {
            this.kind = kind;
            this.node = node;
            this.members = members;
            this.witness = witness;
        }
    }
}
