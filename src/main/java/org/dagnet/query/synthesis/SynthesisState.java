package org.dagnet.query.synthesis;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.constraint.VisitedAnyLiteral;
import org.dagnet.query.graph.FunnelGraph;
import org.dagnet.query.search.WitnessRequest;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.IntPredicate;

/**
 * Literals accumulated by one synthesis call.
 *
 * <p>Held in node-key space so condition literals naming unknown nodes survive as
 * pass-through; translated to id sets whenever a witness request is built.
 * Every {@code add*} method reports whether the state actually changed.</p>
 */
final class SynthesisState {
    private final FunnelGraph graph;
    private final TreeSet<String> visited = new TreeSet<>();
    private final TreeSet<String> exclude = new TreeSet<>();
    // joined members -> members
    private final Map<String, List<String>> groups = new TreeMap<>();

    SynthesisState(FunnelGraph graph) {
        this.graph = graph;
    }

    /**
     * Seeds the state with the node literals of a condition.
     */
    void seed(ConstraintSet condition) {
        visited.addAll(condition.visited());
        exclude.addAll(condition.exclude());
        for (VisitedAnyLiteral group : condition.visitedAny()) {
            groups.putIfAbsent(String.join(",", group.nodes()), group.nodes());
        }
    }

    /**
     * Seeds only the node literals {@code checked} rejects or the graph does not know. A group
     * is seeded when none of its members is checked.
     */
    void seedUnchecked(ConstraintSet condition, IntPredicate checked) {
        for (String key : condition.visited()) {
            if (!isChecked(key, checked)) {
                visited.add(key);
            }
        }
        for (String key : condition.exclude()) {
            if (!isChecked(key, checked)) {
                exclude.add(key);
            }
        }
        for (VisitedAnyLiteral group : condition.visitedAny()) {
            boolean anyChecked = false;
            for (String member : group.nodes()) {
                anyChecked |= isChecked(member, checked);
            }
            if (!anyChecked) {
                groups.putIfAbsent(String.join(",", group.nodes()), group.nodes());
            }
        }
    }

    boolean addVisited(int node) {
        return visited.add(graph.nodeKey(node));
    }

    boolean addExclude(int node) {
        return exclude.add(graph.nodeKey(node));
    }

    /**
     * Adds every node; returns whether at least one was new.
     */
    boolean addExcludes(IntSet nodes) {
        boolean changed = false;
        for (int node : nodes) {
            changed |= addExclude(node);
        }
        return changed;
    }

    /**
     * Adds an OR-group unless an equal member set is already present.
     */
    boolean addGroup(IntSet members) {
        if (members.isEmpty()) {
            return false;
        }
        TreeSet<String> keys = new TreeSet<>();
        for (int node : members) {
            keys.add(graph.nodeKey(node));
        }
        return groups.putIfAbsent(String.join(",", keys), List.copyOf(keys)) == null;
    }

    /**
     * Base request honoring the accumulated visited nodes and OR-groups, avoiding
     * accumulated excludes plus {@code extraAvoid}.
     */
    WitnessRequest.WitnessRequestBuilder request(IntSet extraAvoid) {
        IntSet avoid = toIds(exclude);
        avoid.addAll(extraAvoid);
        WitnessRequest.WitnessRequestBuilder builder = WitnessRequest.builder()
                .required(toIds(visited))
                .avoid(avoid);
        for (List<String> members : groups.values()) {
            builder.group(toIds(members));
        }
        return builder;
    }

    /**
     * Materializes the accumulated node literals.
     */
    ConstraintSet.Builder toBuilder() {
        ConstraintSet.Builder builder = ConstraintSet.builder()
                .visited(visited)
                .exclude(exclude);
        for (List<String> members : groups.values()) {
            builder.visitedAny(members);
        }
        return builder;
    }

    private boolean isChecked(String key, IntPredicate checked) {
        return graph.containsNode(key) && checked.test(graph.nodeId(key));
    }

    /**
     * Translates node keys to ids, skipping keys the graph does not know.
     */
    IntSet toIds(Collection<String> keys) {
        IntSet ids = new IntOpenHashSet();
        for (String key : keys) {
            if (graph.containsNode(key)) {
                ids.add(graph.nodeId(key));
            }
        }
        return ids;
    }
}
