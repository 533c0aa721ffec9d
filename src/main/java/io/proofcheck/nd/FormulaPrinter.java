package io.proofcheck.nd;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical text form and indented parse-tree rendering of formulas.
 */
public final class FormulaPrinter {
    private FormulaPrinter() {}

    /**
     * Print with the fewest parentheses that still reparse to an equal tree.
     */
    public static String print(Formula f) {
        if (f instanceof Formula.Not n) {
            return FormulaParser.NOT + wrapIf(n.child().isBinary(), print(n.child()));
        }
        if (!f.isBinary()) return f.symbol();

        int rank = FormulaParser.rank(f.symbol());
        String left = wrapIf(rankOf(f.left()) > rank, print(f.left()));
        String right = wrapIf(rankOf(f.right()) >= rank, print(f.right()));
        return left + " " + f.symbol() + " " + right;
    }

    /**
     * Pre-order tree, one node per line, two spaces of indent per level.
     */
    public static String tree(Formula f) {
        List<String> lines = new ArrayList<>();
        preorder(f, 0, lines);
        return String.join("\n", lines);
    }

    private static void preorder(Formula f, int depth, List<String> out) {
        if (f == null) return;
        out.add("  ".repeat(depth) + f.symbol());
        preorder(f.left(), depth + 1, out);
        preorder(f.right(), depth + 1, out);
    }

    // atoms and constants bind tightest
    private static int rankOf(Formula f) {
        if (f.isBinary() || f instanceof Formula.Not) return FormulaParser.rank(f.symbol());
        return 0;
    }

    private static String wrapIf(boolean wrap, String s) {
        return wrap ? "(" + s + ")" : s;
    }
}
