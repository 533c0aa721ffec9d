package io.proofcheck.nd;

import java.util.Objects;

/**
 * Propositional formula tree. Sealed interface with record variants; trees are
 * immutable, so subtrees can be embedded in new results without copying.
 */
public sealed interface Formula {
    record Atom(String name) implements Formula {
        public Atom {
            Objects.requireNonNull(name, "name");
        }
    }
    record Not(Formula child) implements Formula {}
    record And(Formula left, Formula right) implements Formula {}
    record Or(Formula left, Formula right) implements Formula {}
    record Implies(Formula left, Formula right) implements Formula {}
    record Iff(Formula left, Formula right) implements Formula {}
    record Bottom() implements Formula {}
    record Top() implements Formula {}

    static Formula atom(String name) { return new Atom(name); }
    static Formula not(Formula child) { return new Not(child); }
    static Formula and(Formula l, Formula r) { return new And(l, r); }
    static Formula or(Formula l, Formula r) { return new Or(l, r); }
    static Formula implies(Formula l, Formula r) { return new Implies(l, r); }
    static Formula iff(Formula l, Formula r) { return new Iff(l, r); }
    static Formula bottom() { return new Bottom(); }
    static Formula top() { return new Top(); }

    /** Connective symbol, or the atom name. */
    default String symbol() {
        if (this instanceof Atom a) return a.name();
        if (this instanceof Not) return "¬";
        if (this instanceof And) return "∧";
        if (this instanceof Or) return "∨";
        if (this instanceof Implies) return "→";
        if (this instanceof Iff) return "↔";
        if (this instanceof Bottom) return "⊥";
        return "⊤";
    }

    default boolean isBinary() {
        return this instanceof And || this instanceof Or || this instanceof Implies || this instanceof Iff;
    }

    /** Left operand of a binary connective, the operand of ¬, otherwise null. */
    default Formula left() {
        if (this instanceof And f) return f.left();
        if (this instanceof Or f) return f.left();
        if (this instanceof Implies f) return f.left();
        if (this instanceof Iff f) return f.left();
        if (this instanceof Not n) return n.child();
        return null;
    }

    /** Right operand of a binary connective, otherwise null. */
    default Formula right() {
        if (this instanceof And f) return f.right();
        if (this instanceof Or f) return f.right();
        if (this instanceof Implies f) return f.right();
        if (this instanceof Iff f) return f.right();
        return null;
    }

    /**
     * Syntactic equality that lets ∧ and ∨ match with their operands swapped.
     * Two nulls are equal.
     */
    static boolean structurallyEqual(Formula a, Formula b) {
        if (a == null || b == null) return a == b;
        if (a.getClass() != b.getClass()) return false;
        if (a instanceof Atom x) return x.name().equals(((Atom) b).name());
        if (a instanceof Bottom || a instanceof Top) return true;
        if (a instanceof Not x) return structurallyEqual(x.child(), ((Not) b).child());

        boolean inOrder = structurallyEqual(a.left(), b.left()) && structurallyEqual(a.right(), b.right());
        if (inOrder) return true;
        if (a instanceof And || a instanceof Or) {
            return structurallyEqual(a.left(), b.right()) && structurallyEqual(a.right(), b.left());
        }
        return false;
    }
}
