package io.proofcheck.nd;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The inference rule catalog. Each rule is a pure function over an ordered,
 * fixed-size list of input formulas, plus the shape of the references a proof
 * line must cite to feed it.
 */
public enum Rule {
    PREMISE("Premise", 0, List.of(), false, Rule::hypothesis),
    ASSUMPTION("Assumption", 0, List.of(), false, Rule::hypothesis),
    AND_INTRO("∧i", 2, List.of(Ref.LINE, Ref.LINE), false, Rule::andIntro),
    AND_ELIM_1("∧e1", 1, List.of(Ref.LINE), false, in -> conjunction(in.get(0)).left()),
    AND_ELIM_2("∧e2", 1, List.of(Ref.LINE), false, in -> conjunction(in.get(0)).right()),
    IMPLIES_ELIM("→e", 2, List.of(Ref.LINE, Ref.LINE), false, Rule::impliesElim),
    NOT_ELIM("¬e", 2, List.of(Ref.LINE, Ref.LINE), false, Rule::notElim),
    DOUBLE_NOT_ELIM("¬¬e", 1, List.of(Ref.LINE), false, Rule::doubleNotElim),
    DOUBLE_NOT_INTRO("¬¬i", 1, List.of(Ref.LINE), false, in -> Formula.not(Formula.not(in.get(0)))),
    MODUS_TOLLENS("MT", 2, List.of(Ref.LINE, Ref.LINE), false, Rule::modusTollens),
    OR_INTRO_1("∨i1", 2, List.of(Ref.LINE), true, in -> orIntro(in, true)),
    OR_INTRO_2("∨i2", 2, List.of(Ref.LINE), true, in -> orIntro(in, false)),
    OR_ELIM("∨e", 3, List.of(Ref.LINE, Ref.BOX_CONCLUSION, Ref.BOX_CONCLUSION), false, Rule::orElim),
    IMPLIES_INTRO("→i", 2, List.of(Ref.BOX), false, in -> Formula.implies(in.get(0), in.get(1))),
    NOT_INTRO("¬i", 2, List.of(Ref.BOX), false, Rule::notIntro),
    PBC("PBC", 2, List.of(Ref.BOX), false, Rule::proofByContradiction),
    BOTTOM_ELIM("⊥e", 2, List.of(Ref.LINE), true, Rule::bottomElim),
    LEM("LEM", 1, List.of(), true, Rule::excludedMiddle),
    COPY("Copy", 1, List.of(Ref.LINE), false, in -> in.get(0));

    /** What a cited reference contributes to the rule's inputs. */
    public enum Ref {
        /** A single visible line: its formula. */
        LINE,
        /** A start-end block: its assumption, then its conclusion. */
        BOX,
        /** A start-end block: its conclusion only. */
        BOX_CONCLUSION
    }

    private static final Map<String, Rule> BY_NAME;

    static {
        Map<String, Rule> byName = new HashMap<>();
        for (Rule r : values()) byName.put(r.displayName, r);
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String displayName;
    private final int arity;
    private final List<Ref> references;
    private final boolean takesTarget;
    private final Function<List<Formula>, Formula> fn;

    Rule(String displayName, int arity, List<Ref> references, boolean takesTarget,
         Function<List<Formula>, Formula> fn) {
        this.displayName = displayName;
        this.arity = arity;
        this.references = references;
        this.takesTarget = takesTarget;
        this.fn = fn;
    }

    /**
     * Look a rule up by the name used in proof text, e.g. {@code "→e"}.
     * @throws ProofException of kind UNKNOWN_RULE
     */
    public static Rule byName(String name) {
        Rule rule = BY_NAME.get(name);
        if (rule == null) throw new ProofException(ProofException.Kind.UNKNOWN_RULE, "rule not found: " + name);
        return rule;
    }

    public String displayName() { return displayName; }
    public List<Ref> references() { return references; }

    /** Whether the line's own declared formula is appended as the last input. */
    public boolean takesTarget() { return takesTarget; }

    /** Premise and Assumption introduce hypotheses instead of deriving a formula. */
    public boolean isHypothesis() { return this == PREMISE || this == ASSUMPTION; }

    /**
     * Apply the rule to its ordered inputs.
     * @throws ProofException of kind RULE_VIOLATION when a precondition fails
     */
    public Formula apply(List<Formula> inputs) {
        if (isHypothesis()) return fn.apply(inputs);
        if (inputs.size() != arity) {
            throw ProofException.violation(displayName + " expects " + arity + " inputs, got " + inputs.size());
        }
        return fn.apply(inputs);
    }

    private static Formula hypothesis(List<Formula> in) {
        throw ProofException.violation("hypotheses are introduced, not inferred");
    }

    private static Formula andIntro(List<Formula> in) {
        return Formula.and(in.get(0), in.get(1));
    }

    private static Formula.And conjunction(Formula f) {
        if (f instanceof Formula.And and) return and;
        throw ProofException.violation("not a conjunction: " + FormulaPrinter.print(f));
    }

    // the implication may be cited first or second
    private static Formula impliesElim(List<Formula> in) {
        Formula a = in.get(0);
        Formula b = in.get(1);
        if (a instanceof Formula.Implies imp && Formula.structurallyEqual(imp.left(), b)) return imp.right();
        if (b instanceof Formula.Implies imp && Formula.structurallyEqual(imp.left(), a)) return imp.right();
        throw ProofException.violation("no implication whose antecedent matches the other input");
    }

    private static Formula notElim(List<Formula> in) {
        Formula a = in.get(0);
        Formula b = in.get(1);
        if (a instanceof Formula.Not n && Formula.structurallyEqual(n.child(), b)) return Formula.bottom();
        if (b instanceof Formula.Not n && Formula.structurallyEqual(n.child(), a)) return Formula.bottom();
        throw ProofException.violation("inputs are not a formula and its negation");
    }

    private static Formula doubleNotElim(List<Formula> in) {
        if (in.get(0) instanceof Formula.Not outer && outer.child() instanceof Formula.Not inner) {
            return inner.child();
        }
        throw ProofException.violation("not a double negation: " + FormulaPrinter.print(in.get(0)));
    }

    private static Formula modusTollens(List<Formula> in) {
        if (!(in.get(0) instanceof Formula.Implies imp)) {
            throw ProofException.violation("first input is not an implication");
        }
        if (!(in.get(1) instanceof Formula.Not neg)) {
            throw ProofException.violation("second input is not a negation");
        }
        if (!Formula.structurallyEqual(neg.child(), imp.right())) {
            throw ProofException.violation("negation does not match the consequent");
        }
        return Formula.not(imp.left());
    }

    private static Formula orIntro(List<Formula> in, boolean leftDisjunct) {
        if (!(in.get(1) instanceof Formula.Or or)) {
            throw ProofException.violation("target is not a disjunction");
        }
        Formula disjunct = leftDisjunct ? or.left() : or.right();
        if (!Formula.structurallyEqual(in.get(0), disjunct)) {
            throw ProofException.violation("input is not the " + (leftDisjunct ? "left" : "right") + " disjunct");
        }
        return or;
    }

    private static Formula orElim(List<Formula> in) {
        if (!(in.get(0) instanceof Formula.Or)) {
            throw ProofException.violation("first input is not a disjunction");
        }
        if (!Formula.structurallyEqual(in.get(1), in.get(2))) {
            throw ProofException.violation("branches reach different conclusions");
        }
        return in.get(1);
    }

    private static Formula notIntro(List<Formula> in) {
        if (!(in.get(1) instanceof Formula.Bottom)) {
            throw ProofException.violation("box does not end in ⊥");
        }
        return Formula.not(in.get(0));
    }

    private static Formula proofByContradiction(List<Formula> in) {
        if (!(in.get(0) instanceof Formula.Not neg)) {
            throw ProofException.violation("assumption is not a negation");
        }
        if (!(in.get(1) instanceof Formula.Bottom)) {
            throw ProofException.violation("box does not end in ⊥");
        }
        return neg.child();
    }

    private static Formula bottomElim(List<Formula> in) {
        if (!(in.get(0) instanceof Formula.Bottom)) {
            throw ProofException.violation("input is not ⊥");
        }
        return in.get(1);
    }

    // A ∨ ¬A, accepted in either orientation
    private static Formula excludedMiddle(List<Formula> in) {
        if (in.get(0) instanceof Formula.Or or) {
            if (or.right() instanceof Formula.Not n && Formula.structurallyEqual(n.child(), or.left())) {
                return Formula.or(or.left(), Formula.not(or.left()));
            }
            if (or.left() instanceof Formula.Not n && Formula.structurallyEqual(n.child(), or.right())) {
                return Formula.or(or.right(), Formula.not(or.right()));
            }
        }
        throw ProofException.violation("not an instance of A ∨ ¬A");
    }
}
