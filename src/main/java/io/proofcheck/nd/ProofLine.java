package io.proofcheck.nd;

import java.util.List;

/**
 * One parsed line of a proof: either a numbered step or a scope marker.
 * Steps without a rule clause carry a null rule name.
 */
public record ProofLine(Kind kind, Integer lineNumber, Formula formula, String ruleName,
                        List<Reference> references, int indent) {

    public enum Kind { STEP, BEGIN_SCOPE, END_SCOPE }

    public ProofLine {
        if (kind == null) throw new IllegalArgumentException("proof line needs a kind");
        if (kind == Kind.STEP && (lineNumber == null || formula == null)) {
            throw new IllegalArgumentException("a step needs a line number and a formula");
        }
        references = references == null ? List.of() : List.copyOf(references);
    }

    static ProofLine step(int lineNumber, Formula formula, String ruleName, List<Reference> references, int indent) {
        return new ProofLine(Kind.STEP, lineNumber, formula, ruleName, references, indent);
    }

    static ProofLine beginScope(int indent) {
        return new ProofLine(Kind.BEGIN_SCOPE, null, null, null, List.of(), indent);
    }

    static ProofLine endScope(int indent) {
        return new ProofLine(Kind.END_SCOPE, null, null, null, List.of(), indent);
    }

    public boolean isStep() {
        return kind == Kind.STEP;
    }

    public boolean hasRule() {
        return ruleName != null;
    }
}
