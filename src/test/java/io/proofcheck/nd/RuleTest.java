package io.proofcheck.nd;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

class RuleTest {

    static Formula f(String src) {
        return FormulaParser.parse(src);
    }

    static Formula apply(Rule rule, String... inputs) {
        List<Formula> formulas = new ArrayList<>();
        for (String in : inputs) formulas.add(f(in));
        return rule.apply(formulas);
    }

    static void assertDerives(String expected, Rule rule, String... inputs) {
        assertEquals(f(expected), apply(rule, inputs));
    }

    static void assertViolates(Rule rule, String... inputs) {
        ProofException e = assertThrows(ProofException.class, () -> apply(rule, inputs));
        assertEquals(ProofException.Kind.RULE_VIOLATION, e.kind());
    }

    // --- Catalog tests ---

    @Test void lookupByName() {
        assertEquals(Rule.IMPLIES_ELIM, Rule.byName("→e"));
        assertEquals(Rule.DOUBLE_NOT_ELIM, Rule.byName("¬¬e"));
        assertEquals(Rule.PBC, Rule.byName("PBC"));
        assertEquals(Rule.COPY, Rule.byName("Copy"));
    }

    @Test void unknownName() {
        ProofException e = assertThrows(ProofException.class, () -> Rule.byName("INVALID_RULE"));
        assertEquals(ProofException.Kind.UNKNOWN_RULE, e.kind());
    }

    @Test void namesAreCaseSensitive() {
        assertThrows(ProofException.class, () -> Rule.byName("copy"));
    }

    @Test void everyRuleIsNamedUniquely() {
        for (Rule r : Rule.values()) assertSame(r, Rule.byName(r.displayName()));
    }

    @Test void wrongInputCount() { assertViolates(Rule.AND_INTRO, "p"); }

    @Test void hypothesesAreNotInferences() {
        assertViolates(Rule.ASSUMPTION);
        assertViolates(Rule.PREMISE);
    }

    // --- Conjunction ---

    @Test void andIntroKeepsOrder() {
        Formula result = apply(Rule.AND_INTRO, "p", "q");
        assertEquals(Formula.and(f("p"), f("q")), result);
        assertNotEquals(Formula.and(f("q"), f("p")), result);
    }

    @Test void andElimLeft() { assertDerives("p → q", Rule.AND_ELIM_1, "(p → q) ∧ (r → s)"); }
    @Test void andElimRight() { assertDerives("r → s", Rule.AND_ELIM_2, "(p → q) ∧ (r → s)"); }
    @Test void andElimOnNonConjunction() { assertViolates(Rule.AND_ELIM_1, "p ∨ q"); }

    // --- Implication ---

    @Test void modusPonens() { assertDerives("c ∨ d", Rule.IMPLIES_ELIM, "(a ∧ b) → (c ∨ d)", "a ∧ b"); }
    @Test void modusPonensImplicationSecond() { assertDerives("q", Rule.IMPLIES_ELIM, "p", "p → q"); }
    @Test void modusPonensCommutativeAntecedent() { assertDerives("r", Rule.IMPLIES_ELIM, "(p ∧ q) → r", "q ∧ p"); }
    @Test void modusPonensMismatch() { assertViolates(Rule.IMPLIES_ELIM, "a → b", "c"); }
    @Test void modusPonensWithoutImplication() { assertViolates(Rule.IMPLIES_ELIM, "p", "q"); }

    @Test void modusTollens() { assertDerives("¬(a ∧ b)", Rule.MODUS_TOLLENS, "(a ∧ b) → (c ∨ d)", "¬(c ∨ d)"); }
    @Test void modusTollensMismatch() { assertViolates(Rule.MODUS_TOLLENS, "a → b", "¬c"); }
    @Test void modusTollensOnConjunction() { assertViolates(Rule.MODUS_TOLLENS, "p ∧ q", "¬q"); }
    @Test void modusTollensWithoutNegation() { assertViolates(Rule.MODUS_TOLLENS, "p → q", "q"); }

    @Test void impliesIntro() { assertDerives("q → p", Rule.IMPLIES_INTRO, "q", "p"); }

    // --- Negation ---

    @Test void notElim() { assertDerives("⊥", Rule.NOT_ELIM, "a", "¬a"); }
    @Test void notElimEitherOrder() { assertDerives("⊥", Rule.NOT_ELIM, "¬a", "a"); }
    @Test void notElimTwoPositives() { assertViolates(Rule.NOT_ELIM, "a", "b"); }
    @Test void notElimTwoNegatives() { assertViolates(Rule.NOT_ELIM, "¬a", "¬b"); }

    @Test void doubleNotElim() { assertDerives("a ∧ b", Rule.DOUBLE_NOT_ELIM, "¬(¬(a ∧ b))"); }
    @Test void doubleNotElimSingleNegation() { assertViolates(Rule.DOUBLE_NOT_ELIM, "¬a"); }
    @Test void doubleNotIntro() { assertDerives("¬¬a", Rule.DOUBLE_NOT_INTRO, "a"); }

    @Test void notIntro() { assertDerives("¬p", Rule.NOT_INTRO, "p", "⊥"); }
    @Test void notIntroWithoutContradiction() { assertViolates(Rule.NOT_INTRO, "p", "q"); }

    @Test void proofByContradiction() { assertDerives("p", Rule.PBC, "¬p", "⊥"); }
    @Test void proofByContradictionNeedsNegation() { assertViolates(Rule.PBC, "p", "⊥"); }
    @Test void proofByContradictionNeedsBottom() { assertViolates(Rule.PBC, "¬p", "q"); }

    @Test void bottomElim() { assertDerives("q ∧ r", Rule.BOTTOM_ELIM, "⊥", "q ∧ r"); }
    @Test void bottomElimWithoutBottom() { assertViolates(Rule.BOTTOM_ELIM, "p", "q"); }

    // --- Disjunction ---

    @Test void orIntroLeft() { assertDerives("p ∨ ¬p", Rule.OR_INTRO_1, "p", "p ∨ ¬p"); }
    @Test void orIntroRight() { assertDerives("p ∨ ¬p", Rule.OR_INTRO_2, "¬p", "p ∨ ¬p"); }
    @Test void orIntroWrongDisjunct() { assertViolates(Rule.OR_INTRO_1, "p", "q ∨ p"); }
    @Test void orIntroTargetNotDisjunction() { assertViolates(Rule.OR_INTRO_1, "p", "p ∧ q"); }

    @Test void orElim() { assertDerives("p → q", Rule.OR_ELIM, "¬p ∨ q", "p → q", "p → q"); }
    @Test void orElimDifferentConclusions() { assertViolates(Rule.OR_ELIM, "p ∨ q", "r", "s"); }
    @Test void orElimWithoutDisjunction() { assertViolates(Rule.OR_ELIM, "p ∧ q", "r", "r"); }

    @Test void excludedMiddle() { assertDerives("p ∨ ¬p", Rule.LEM, "p ∨ ¬p"); }

    @Test void excludedMiddleNegationFirst() {
        Formula result = apply(Rule.LEM, "¬p ∨ p");
        assertTrue(Formula.structurallyEqual(f("¬p ∨ p"), result));
    }

    @Test void excludedMiddleCompound() { assertDerives("(p → q) ∨ ¬(p → q)", Rule.LEM, "(p → q) ∨ ¬(p → q)"); }
    @Test void excludedMiddleNotATautology() { assertViolates(Rule.LEM, "p ∨ q"); }
    @Test void excludedMiddleNotADisjunction() { assertViolates(Rule.LEM, "p ∧ ¬p"); }

    @Test void copy() { assertDerives("p → q", Rule.COPY, "p → q"); }
}
