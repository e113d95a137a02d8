package org.dagnet.query.compile;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.dagnet.query.config.QueryProperties;
import org.dagnet.query.constraint.Coefficient;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.constraint.SignedTerm;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.graph.GraphQueries;
import org.dagnet.query.search.ReachabilityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Rewrites exclusions into positive sub-queries by inclusion-exclusion.
 *
 * <p>For excluded nodes with separators {@code s1..sn}, the journeys avoiding all of them are
 * {@code base - |visited(s1) u ... u visited(sn)|}, and the union expands into one
 * {@code visited(S)} term per non-empty subset {@code S} with coefficient {@code (-1)^|S|}
 * (terms are subtracted, so odd subsets carry {@link Coefficient#MINUS}).</p>
 *
 * <p>{@link Strategy#PRUNED} keeps only subsets whose nodes can co-occur on one journey,
 * then merges terms whose forced-node closures coincide: such terms match the same journeys,
 * so their coefficients add up and a cancelling group disappears.</p>
 */
public final class InclusionExclusionCompiler {
    public static final String REASON_TERM_BUDGET_EXCEEDED = "IE_TERM_BUDGET_EXCEEDED";
    public static final String REASON_SEPARATOR_LIMIT = "IE_SEPARATOR_LIMIT";

    private static final Logger LOG = LoggerFactory.getLogger(InclusionExclusionCompiler.class);

    // subsets are long bit masks over separator indices
    private static final int MAX_SEPARATORS = 62;

    /**
     * Subset enumeration policy.
     */
    public enum Strategy {
        /** Every non-empty subset, no elimination. */
        FULL,
        /** Reachability chains only, then dominance elimination. */
        PRUNED
    }

    private final Strategy strategy;
    private final int maxSimplePaths;

    public InclusionExclusionCompiler() {
        this(Strategy.PRUNED, QueryProperties.maxSimplePaths());
    }

    public InclusionExclusionCompiler(Strategy strategy) {
        this(strategy, QueryProperties.maxSimplePaths());
    }

    public InclusionExclusionCompiler(Strategy strategy, int maxSimplePaths) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        if (maxSimplePaths <= 0) {
            throw new IllegalArgumentException("maxSimplePaths must be > 0");
        }
        this.maxSimplePaths = maxSimplePaths;
    }

    /**
     * Compiles exclusions against an empty base.
     */
    public CompilationResult compile(FunnelGraph graph, String source, String target, String merge,
                                     Collection<String> excludedFirstHops, int termBudget) {
        return compile(graph, source, target, merge, excludedFirstHops, ConstraintSet.empty(), termBudget);
    }

    /**
     * Compiles {@code from(source).to(target)} minus every journey through an excluded node.
     *
     * @param base constraints inherited by the base query and every term; exclude literals are dropped.
     * @param termBudget maximum number of candidate terms before compilation degrades.
     * @throws IllegalArgumentException on unknown nodes or a non-positive budget.
     */
    public CompilationResult compile(FunnelGraph graph, String source, String target, String merge,
                                     Collection<String> excludedFirstHops, ConstraintSet base, int termBudget) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(excludedFirstHops, "excludedFirstHops");
        if (termBudget <= 0) {
            throw new IllegalArgumentException("termBudget must be > 0, got: " + termBudget);
        }
        Job job = new Job(graph, requireNode(graph, source, "source"), requireNode(graph, target, "target"),
                requireNode(graph, merge, "merge"));
        ConstraintSet shared = base == null ? ConstraintSet.empty() : base.withoutExclude();
        if (base != null && !base.terms().isEmpty()) {
            throw new IllegalArgumentException("base constraints must not carry signed terms");
        }

        TreeSet<String> excluded = new TreeSet<>(excludedFirstHops);
        int[] separators = job.separators(excluded);

        CompilationResult.CompilationResultBuilder result = CompilationResult.builder()
                .strategy(strategy)
                .base(shared);
        for (int separator : separators) {
            result.separator(graph.nodeKey(separator));
        }
        if (separators.length == 0) {
            return result.status(CompilationStatus.EXACT).build();
        }
        if (separators.length > MAX_SEPARATORS) {
            LOG.warn("{} separators exceed the enumeration limit of {}", separators.length, MAX_SEPARATORS);
            return result.status(CompilationStatus.DEGRADED).reason(REASON_SEPARATOR_LIMIT).build();
        }

        Enumeration enumeration = strategy == Strategy.FULL
                ? job.enumerateAll(separators.length, termBudget)
                : job.enumerateChains(separators, termBudget);
        result.candidateTerms(enumeration.masks.size());

        List<Candidate> kept;
        if (enumeration.exceeded || strategy == Strategy.FULL) {
            kept = new ArrayList<>();
            for (long mask : enumeration.masks) {
                kept.add(new Candidate(mask, Coefficient.forSubsetSize(Long.bitCount(mask))));
            }
        } else {
            kept = job.eliminateDominated(separators, enumeration.masks);
            result.eliminatedTerms(enumeration.masks.size() - kept.size());
        }
        kept.sort(Candidate.ORDER);
        for (Candidate candidate : kept) {
            ConstraintSet.Builder term = shared.toBuilder();
            for (int index = 0; index < separators.length; index++) {
                if ((candidate.mask & (1L << index)) != 0) {
                    term.visited(graph.nodeKey(separators[index]));
                }
            }
            result.term(new SignedTerm(term.build(), candidate.coefficient));
        }

        if (enumeration.exceeded) {
            LOG.warn("inclusion-exclusion for {}->{} exceeded term budget {}; result is approximate",
                    source, target, termBudget);
            return result.status(CompilationStatus.DEGRADED).reason(REASON_TERM_BUDGET_EXCEEDED).build();
        }
        LOG.debug("inclusion-exclusion for {}->{}: {} separators, {} candidates, {} terms",
                source, target, separators.length, enumeration.masks.size(), kept.size());
        return result.status(CompilationStatus.EXACT).build();
    }

    private static int requireNode(FunnelGraph graph, String key, String fieldName) {
        if (key == null || !graph.containsNode(key)) {
            throw new IllegalArgumentException(fieldName + " is not a node of the graph: " + key);
        }
        return graph.nodeId(key);
    }

    /**
     * Working state of one compilation.
     */
    private final class Job {
        private final FunnelGraph graph;
        private final ReachabilityTable table;
        private final MergeAnalysis analysis;
        private final int source;
        private final int target;
        private final int merge;

        Job(FunnelGraph graph, int source, int target, int merge) {
            this.graph = graph;
            this.table = new ReachabilityTable(graph);
            this.analysis = new MergeAnalysis(table, maxSimplePaths);
            this.source = source;
            this.target = target;
            this.merge = merge;
        }

        /**
         * Distinct separators of the excluded nodes in topological order; separators that
         * collapse onto the source or the merge carry no information and are dropped.
         */
        int[] separators(Collection<String> excluded) {
            int[] keptPath = {source, target};
            IntArrayList separators = new IntArrayList();
            for (String key : excluded) {
                if (!graph.containsNode(key)) {
                    throw new IllegalArgumentException("excluded node is not a node of the graph: " + key);
                }
                int separator = analysis.findSeparator(source, graph.nodeId(key), merge, keptPath);
                if (separator != source && separator != merge) {
                    separators.add(separator);
                }
            }
            return table.sortByTopo(separators);
        }

        Enumeration enumerateAll(int count, int termBudget) {
            Enumeration enumeration = new Enumeration();
            long limit = 1L << count;
            for (long mask = 1; mask < limit; mask++) {
                if (!enumeration.offer(mask, termBudget)) {
                    break;
                }
            }
            return enumeration;
        }

        /**
         * Subsets whose nodes lie on one journey: upstream nodes of the source chained in order,
         * then downstream nodes chained from the source towards the merge.
         */
        Enumeration enumerateChains(int[] separators, int termBudget) {
            Enumeration enumeration = new Enumeration();
            extend(separators, 0, 0L, -1, -1, enumeration, termBudget);
            return enumeration;
        }

        private boolean extend(int[] separators, int start, long mask, int lastUpstream, int lastDownstream,
                               Enumeration enumeration, int termBudget) {
            for (int index = start; index < separators.length; index++) {
                int node = separators[index];
                int nextUpstream = lastUpstream;
                int nextDownstream = lastDownstream;
                if (table.reaches(node, source)) {
                    if (lastDownstream >= 0 || (lastUpstream >= 0 && !table.reaches(lastUpstream, node))
                            || !table.reaches(source, merge)) {
                        continue;
                    }
                    nextUpstream = node;
                } else if (table.reaches(source, node)) {
                    int previous = lastDownstream >= 0 ? lastDownstream : source;
                    if (!table.reaches(previous, node) || !table.reaches(node, merge)) {
                        continue;
                    }
                    nextDownstream = node;
                } else {
                    continue;
                }
                long extended = mask | (1L << index);
                if (!enumeration.offer(extended, termBudget)) {
                    return false;
                }
                if (!extend(separators, index + 1, extended, nextUpstream, nextDownstream, enumeration, termBudget)) {
                    return false;
                }
            }
            return true;
        }

        /**
         * Groups candidates by forced-node closure and folds each group's coefficients.
         */
        List<Candidate> eliminateDominated(int[] separators, LongArrayList masks) {
            Long2ObjectLinkedOpenHashMap<List<Candidate>> groups = new Long2ObjectLinkedOpenHashMap<>();
            for (long mask : masks) {
                long closure = closure(separators, mask);
                groups.computeIfAbsent(closure, ignored -> new ArrayList<>())
                        .add(new Candidate(mask, Coefficient.forSubsetSize(Long.bitCount(mask))));
            }
            List<Candidate> kept = new ArrayList<>();
            for (List<Candidate> group : groups.values()) {
                int net = 0;
                for (Candidate candidate : group) {
                    net += candidate.coefficient.sign();
                }
                if (net == 0) {
                    continue;
                }
                if (Math.abs(net) == 1) {
                    Candidate smallest = group.stream().min(Candidate.ORDER).orElseThrow();
                    kept.add(new Candidate(smallest.mask, net > 0 ? Coefficient.PLUS : Coefficient.MINUS));
                } else {
                    kept.addAll(group);
                }
            }
            return kept;
        }

        /**
         * Separators every journey through {@code mask} must also cross, {@code mask} included.
         */
        private long closure(int[] separators, long mask) {
            IntArrayList waypoints = new IntArrayList();
            boolean sourceAdded = false;
            for (int index = 0; index < separators.length; index++) {
                if ((mask & (1L << index)) == 0) {
                    continue;
                }
                if (!sourceAdded && !table.reaches(separators[index], source)) {
                    waypoints.add(source);
                    sourceAdded = true;
                }
                waypoints.add(separators[index]);
            }
            if (!sourceAdded) {
                waypoints.add(source);
            }
            waypoints.add(merge);

            long closure = mask;
            BitSet avoid = new BitSet(graph.nodeCount());
            for (int index = 0; index < separators.length; index++) {
                if ((mask & (1L << index)) != 0) {
                    continue;
                }
                avoid.set(separators[index]);
                for (int i = 0; i + 1 < waypoints.size(); i++) {
                    if (!GraphQueries.reaches(graph, waypoints.getInt(i), waypoints.getInt(i + 1), avoid)) {
                        closure |= 1L << index;
                        break;
                    }
                }
                avoid.clear(separators[index]);
            }
            return closure;
        }
    }

    /**
     * Candidate subsets collected under a term budget.
     */
    private static final class Enumeration {
        final LongArrayList masks = new LongArrayList();
        boolean exceeded;

        boolean offer(long mask, int termBudget) {
            if (masks.size() >= termBudget) {
                exceeded = true;
                return false;
            }
            masks.add(mask);
            return true;
        }
    }

    private static final class Candidate {
        // size first, then lowest differing separator index (topological order)
        static final Comparator<Candidate> ORDER = (left, right) -> {
            int bySize = Integer.compare(Long.bitCount(left.mask), Long.bitCount(right.mask));
            if (bySize != 0) {
                return bySize;
            }
            return Long.compareUnsigned(Long.reverse(right.mask), Long.reverse(left.mask));
        };

        final long mask;
        final Coefficient coefficient;

        Candidate(long mask, Coefficient coefficient) {
            this.mask = mask;
            this.coefficient = coefficient;
        }
    }
}
