package io.proofcheck.nd;

/**
 * Failure raised while parsing or checking a proof. The {@link Kind} decides
 * whether it rejects a single line or the whole proof.
 */
public class ProofException extends RuntimeException {

    public enum Kind {
        /** Malformed formula or proof-line text. Aborts the whole parse. */
        SYNTAX,
        /** Rule name not in the catalog. Rejects the current line. */
        UNKNOWN_RULE,
        /** A rule precondition does not hold. Rejects the current line. */
        RULE_VIOLATION,
        /** Reference to a line or block that may not be used here. Rejects the current line. */
        SCOPE_VIOLATION,
        /** EndScope with no open scope. Aborts verification. */
        UNMATCHED_SCOPE
    }

    private final Kind kind;

    public ProofException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    static ProofException syntax(String message) {
        return new ProofException(Kind.SYNTAX, message);
    }

    static ProofException violation(String message) {
        return new ProofException(Kind.RULE_VIOLATION, message);
    }

    static ProofException scope(String message) {
        return new ProofException(Kind.SCOPE_VIOLATION, message);
    }
}
