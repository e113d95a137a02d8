package org.dagnet.query.compile;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.dagnet.query.constraint.ConstraintSet;
import org.dagnet.query.constraint.SignedTerm;

import java.util.List;

/**
 * Positive base query plus signed sub-queries replacing a set of exclusions.
 *
 * <p>{@code base - sum(terms)} counts the journeys of {@code base} that avoid every excluded
 * node, when {@link #getStatus()} is {@link CompilationStatus#EXACT}.</p>
 */
@Value
@Builder
public class CompilationResult {
    CompilationStatus status;
    /** Reason code when degraded; null otherwise. */
    String reason;
    InclusionExclusionCompiler.Strategy strategy;
    /** Constraints shared by the base query and every term (never holds exclude literals). */
    ConstraintSet base;
    @Singular
    List<SignedTerm> terms;
    /** Distinct separator nodes, topological order. */
    @Singular
    List<String> separators;
    /** Subsets enumerated before dominance elimination. */
    int candidateTerms;
    /** Candidates removed by dominance elimination. */
    int eliminatedTerms;

    public boolean isExact() {
        return status == CompilationStatus.EXACT;
    }

    /**
     * Returns the base constraints with every signed term attached.
     */
    public ConstraintSet toConstraintSet() {
        ConstraintSet.Builder builder = base.toBuilder();
        for (SignedTerm term : terms) {
            builder.term(term);
        }
        return builder.build();
    }
}
