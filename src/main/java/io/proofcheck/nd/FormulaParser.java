package io.proofcheck.nd;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokenizer, well-formedness scanner and operator-precedence parser for
 * propositional formulas in Unicode notation.
 */
public final class FormulaParser {
    private FormulaParser() {}

    static final String NOT = "¬";
    static final String AND = "∧";
    static final String OR = "∨";
    static final String IMPLIES = "→";
    static final String IFF = "↔";
    static final String BOTTOM = "⊥";
    static final String TOP = "⊤";

    private enum State { START, AFTER_NEGATION, AFTER_ATOM_OR_CLOSE, AFTER_OPERATOR, AFTER_OPEN }

    /**
     * Parse formula text, rejecting anything that is not well formed.
     * @throws ProofException of kind SYNTAX
     */
    public static Formula parse(String src) {
        List<String> tokens = tokenize(src);
        if (!isWellFormed(tokens)) throw ProofException.syntax("malformed formula: " + src.trim());
        return parseTree(tokens);
    }

    public static boolean isWellFormed(String src) {
        return isWellFormed(tokenize(src));
    }

    /** One token per symbol; whitespace is dropped. */
    static List<String> tokenize(String src) {
        List<String> tokens = new ArrayList<>();
        src.codePoints()
            .filter(cp -> !Character.isWhitespace(cp))
            .forEach(cp -> tokens.add(new String(Character.toChars(cp))));
        return tokens;
    }

    static boolean isWellFormed(List<String> tokens) {
        State state = State.START;
        Deque<String> parens = new ArrayDeque<>();

        for (String tok : tokens) {
            if (tok.equals("(")) {
                parens.push(tok);
            } else if (tok.equals(")")) {
                if (parens.isEmpty()) return false;
                parens.pop();
            }

            switch (state) {
                case START, AFTER_NEGATION, AFTER_OPERATOR, AFTER_OPEN -> {
                    if (tok.equals(NOT)) state = State.AFTER_NEGATION;
                    else if (tok.equals("(")) state = State.AFTER_OPEN;
                    else if (isOperand(tok)) state = State.AFTER_ATOM_OR_CLOSE;
                    else return false;
                }
                case AFTER_ATOM_OR_CLOSE -> {
                    if (isBinaryOperator(tok)) state = State.AFTER_OPERATOR;
                    else if (tok.equals(")")) state = State.AFTER_ATOM_OR_CLOSE;
                    else return false;
                }
            }
        }
        return state == State.AFTER_ATOM_OR_CLOSE && parens.isEmpty();
    }

    /**
     * Build the tree from tokens already accepted by {@link #isWellFormed(List)}.
     * Lower rank binds tighter; binary operators reduce left-associatively.
     */
    static Formula parseTree(List<String> tokens) {
        Deque<String> operators = new ArrayDeque<>();
        Deque<Formula> operands = new ArrayDeque<>();

        for (String tok : tokens) {
            if (tok.equals("(")) {
                operators.push(tok);
            } else if (tok.equals(")")) {
                while (!operators.peek().equals("(")) reduce(operators, operands);
                operators.pop();
            } else if (tok.equals(NOT)) {
                // prefix: nothing to its left can be reduced yet
                operators.push(tok);
            } else if (isBinaryOperator(tok)) {
                while (!operators.isEmpty() && !operators.peek().equals("(")
                        && rank(operators.peek()) <= rank(tok)) {
                    reduce(operators, operands);
                }
                operators.push(tok);
            } else {
                operands.push(operand(tok));
            }
        }
        while (!operators.isEmpty()) reduce(operators, operands);
        if (operands.size() != 1) throw ProofException.syntax("dangling operands in formula");
        return operands.pop();
    }

    private static void reduce(Deque<String> operators, Deque<Formula> operands) {
        String op = operators.pop();
        Formula right = operands.pop();
        if (op.equals(NOT)) {
            operands.push(Formula.not(right));
            return;
        }
        Formula left = operands.pop();
        operands.push(switch (op) {
            case AND -> Formula.and(left, right);
            case OR -> Formula.or(left, right);
            case IMPLIES -> Formula.implies(left, right);
            case IFF -> Formula.iff(left, right);
            default -> throw ProofException.syntax("unknown operator: " + op);
        });
    }

    static int rank(String op) {
        return switch (op) {
            case NOT -> 1;
            case AND -> 2;
            case OR -> 3;
            case IMPLIES -> 4;
            case IFF -> 5;
            default -> 100;
        };
    }

    private static Formula operand(String tok) {
        if (tok.equals(BOTTOM)) return Formula.bottom();
        if (tok.equals(TOP)) return Formula.top();
        return Formula.atom(tok);
    }

    private static boolean isOperand(String tok) {
        return tok.equals(BOTTOM) || tok.equals(TOP) || Character.isLetter(tok.codePointAt(0));
    }

    private static boolean isBinaryOperator(String tok) {
        return tok.equals(AND) || tok.equals(OR) || tok.equals(IMPLIES) || tok.equals(IFF);
    }
}
