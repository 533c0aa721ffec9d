package io.proofcheck.nd;

/**
 * Well-formedness report for a single formula.
 */
public final class FormulaReport {
    private FormulaReport() {}

    public static final String VALID = "Valid Formula";
    public static final String INVALID = "Invalid Formula";

    /**
     * {@code "Valid Formula"} followed by the pre-order parse tree, or {@code "Invalid Formula"}.
     */
    public static String report(String src) {
        if (!FormulaParser.isWellFormed(src)) return INVALID;
        return VALID + "\n" + FormulaPrinter.tree(FormulaParser.parse(src));
    }
}
