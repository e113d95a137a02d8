package org.dagnet.query.constraint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ConstraintSet Tests")
class ConstraintSetTest {

    @Test
    @DisplayName("Permutations and duplicates of the same literals build equal sets")
    void testCanonicalOrdering() {
        List<Literal> forward = List.of(
                new VisitedLiteral("b"),
                new ExcludeLiteral("d"),
                VisitedAnyLiteral.of("f", "e"),
                new CaseLiteral("exp", "treatment"),
                new ContextLiteral("channel", "paid")
        );
        List<Literal> shuffled = List.of(
                new ContextLiteral("channel", "paid"),
                VisitedAnyLiteral.of("e", "f", "e"),
                new ExcludeLiteral("d"),
                new CaseLiteral("exp", "treatment"),
                new VisitedLiteral("b"),
                new VisitedLiteral("b")
        );

        ConstraintSet left = ConstraintSet.fromLiterals(forward);
        ConstraintSet right = ConstraintSet.fromLiterals(shuffled);

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertEquals(List.of("e", "f"), right.visitedAny().get(0).nodes());
        assertEquals(3, right.literalCount());
    }

    @Test
    @DisplayName("Literals are listed in canonical kind order")
    void testLiteralOrder() {
        ConstraintSet set = ConstraintSet.builder()
                .context("k", "v")
                .exclude("z", "y")
                .visited("b", "a")
                .build();

        assertEquals(List.of(
                new VisitedLiteral("a"),
                new VisitedLiteral("b"),
                new ExcludeLiteral("y"),
                new ExcludeLiteral("z"),
                new ContextLiteral("k", "v")
        ), set.literals());
        assertEquals(set, set.toBuilder().build());
    }

    @Test
    @DisplayName("withoutExclude drops exclude literals only")
    void testWithoutExclude() {
        ConstraintSet set = ConstraintSet.builder()
                .visited("a")
                .exclude("b")
                .caseVariant("exp", "control")
                .build();

        ConstraintSet stripped = set.withoutExclude();
        assertTrue(stripped.exclude().isEmpty());
        assertEquals(List.of("a"), stripped.visited());
        assertEquals(1, stripped.cases().size());
        assertEquals(List.of("b"), set.exclude());
    }

    @Test
    @DisplayName("Empty set reports no literals")
    void testEmpty() {
        assertTrue(ConstraintSet.empty().isEmpty());
        assertFalse(ConstraintSet.empty().hasNodeLiterals());
        assertFalse(ConstraintSet.builder().context("k", "v").build().isEmpty());
        assertFalse(ConstraintSet.builder().context("k", "v").build().hasNodeLiterals());
    }

    @Test
    @DisplayName("Tokens outside [a-z0-9_-]+ are rejected")
    void testTokenValidation() {
        assertThrows(IllegalArgumentException.class, () -> new VisitedLiteral("Checkout"));
        assertThrows(IllegalArgumentException.class, () -> new CaseLiteral("exp", "a:b"));
        assertThrows(IllegalArgumentException.class, () -> new ContextLiteral(null, "v"));
        assertThrows(IllegalArgumentException.class, () -> VisitedAnyLiteral.of(List.of()));
        assertThrows(IllegalArgumentException.class, () -> ConstraintSet.builder().exclude("has space"));
    }

    @Test
    @DisplayName("Signed terms stay positive and keep insertion order")
    void testSignedTerms() {
        ConstraintSet first = ConstraintSet.builder().visited("b").build();
        ConstraintSet second = ConstraintSet.builder().visited("a").build();
        ConstraintSet withTerms = ConstraintSet.builder()
                .term(new SignedTerm(first, Coefficient.MINUS))
                .term(new SignedTerm(second, Coefficient.PLUS))
                .build();

        assertEquals(first, withTerms.terms().get(0).constraints());
        assertEquals(Coefficient.PLUS, withTerms.terms().get(1).coefficient());
        assertFalse(withTerms.isEmpty());

        ConstraintSet negative = ConstraintSet.builder().exclude("b").build();
        assertThrows(IllegalArgumentException.class, () -> new SignedTerm(negative, Coefficient.MINUS));
        assertThrows(IllegalArgumentException.class, () -> new SignedTerm(withTerms, Coefficient.PLUS));
    }

    @Test
    @DisplayName("Coefficient follows subset parity")
    void testCoefficientParity() {
        assertEquals(Coefficient.MINUS, Coefficient.forSubsetSize(1));
        assertEquals(Coefficient.PLUS, Coefficient.forSubsetSize(2));
        assertEquals(Coefficient.MINUS, Coefficient.forSubsetSize(3));
        assertEquals(-1, Coefficient.MINUS.sign());
        assertThrows(IllegalArgumentException.class, () -> Coefficient.forSubsetSize(0));
    }
}
