package io.proofcheck.nd;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks a natural-deduction proof in one pass over its lines, tracking which
 * lines are established and which scopes (boxes) are open.
 *
 * <p>Instances keep per-proof state and are not thread-safe; use one per
 * thread, or the static {@link #check(String)}.
 */
public final class ProofVerifier {
    private static final Logger LOGGER = Logger.getLogger(ProofVerifier.class.getName());

    public static final String VALID = "Valid Deduction";
    public static final String INVALID_AT_LINE = "Invalid Deduction at Line ";
    public static final String UNMATCHED_END_SCOPE = "Invalid Deduction: unmatched EndScope";
    public static final String UNCLOSED_SCOPE = "Invalid Deduction: unclosed scope";
    public static final String INVALID_FORMAT = "Invalid input format: ";

    /** Verdict for a whole proof. {@code failedLine} is set only for a line rejection. */
    public record Result(boolean valid, Integer failedLine, String message) {
        static Result ok() { return new Result(true, null, VALID); }
        static Result atLine(int n) { return new Result(false, n, INVALID_AT_LINE + n); }
        static Result unmatchedEndScope() { return new Result(false, null, UNMATCHED_END_SCOPE); }
        static Result unclosedScope() { return new Result(false, null, UNCLOSED_SCOPE); }
        static Result badFormat(String detail) { return new Result(false, null, INVALID_FORMAT + detail); }
    }

    private final Options options;
    private final Set<Integer> validLines = new HashSet<>();
    private final Deque<Scope> scopeStack = new ArrayDeque<>();
    private final List<Scope> closedScopes = new ArrayList<>();
    private final Map<Integer, ProofLine> lineMap = new HashMap<>();
    private final Map<Integer, Integer> textOrder = new HashMap<>();

    public ProofVerifier() {
        this(new Options());
    }

    public ProofVerifier(Options options) {
        this.options = options;
    }

    /**
     * Verify proof text with default options and return the verdict message.
     */
    public static String check(String proof) {
        return new ProofVerifier().verify(proof).message();
    }

    public Result verify(String proof) {
        List<ProofLine> lines;
        try {
            lines = ProofParser.parse(proof);
        } catch (ProofException e) {
            LOGGER.fine("Proof text rejected: " + e.getMessage());
            return Result.badFormat(e.getMessage());
        }
        return verify(lines);
    }

    public Result verify(List<ProofLine> lines) {
        reset();
        for (int i = 0; i < lines.size(); i++) {
            ProofLine line = lines.get(i);
            switch (line.kind()) {
                case BEGIN_SCOPE -> scopeStack.push(new Scope(scopeStack.peek()));
                case END_SCOPE -> {
                    if (scopeStack.size() == 1) {
                        LOGGER.fine("EndScope without an open scope");
                        return Result.unmatchedEndScope();
                    }
                    closedScopes.add(scopeStack.pop());
                }
                case STEP -> {
                    int n = line.lineNumber();
                    try {
                        step(line, i);
                    } catch (ProofException e) {
                        LOGGER.fine("Line " + n + " rejected (" + e.kind() + "): " + e.getMessage());
                        return Result.atLine(n);
                    }
                }
            }
        }
        if (options.rejectUnclosedScopes && scopeStack.size() > 1) {
            LOGGER.fine((scopeStack.size() - 1) + " scope(s) left open");
            return Result.unclosedScope();
        }
        LOGGER.fine("Proof of " + lineMap.size() + " line(s) verified");
        return Result.ok();
    }

    private void reset() {
        validLines.clear();
        scopeStack.clear();
        scopeStack.push(new Scope(null));
        closedScopes.clear();
        lineMap.clear();
        textOrder.clear();
    }

    private void step(ProofLine line, int position) {
        int n = line.lineNumber();
        if (lineMap.containsKey(n)) throw ProofException.scope("line number " + n + " is used twice");
        lineMap.put(n, line);
        textOrder.put(n, position);

        if (!line.hasRule()) {
            establish(n, scopeStack.getLast());
            return;
        }
        Rule rule = Rule.byName(line.ruleName());
        if (rule.isHypothesis()) {
            if (!line.references().isEmpty()) {
                throw ProofException.violation(rule.displayName() + " cites no lines");
            }
            // premises always belong to the outermost level
            establish(n, rule == Rule.PREMISE ? scopeStack.getLast() : scopeStack.peek());
            return;
        }

        List<Formula> inputs = resolveInputs(rule, line);
        if (rule == Rule.OR_ELIM) {
            checkOrBranches(line, inputs.get(0));
        }
        Formula derived = rule.apply(inputs);
        if (!Formula.structurallyEqual(derived, line.formula())) {
            throw ProofException.violation(rule.displayName() + " derives " + FormulaPrinter.print(derived)
                + ", line states " + FormulaPrinter.print(line.formula()));
        }
        establish(n, scopeStack.peek());
    }

    private void establish(int n, Scope level) {
        validLines.add(n);
        level.lines.add(n);
        // a line written inside a scope also widens every scope around it
        for (Scope open : scopeStack) {
            if (open.first == null) open.first = n;
            open.last = n;
        }
    }

    private List<Formula> resolveInputs(Rule rule, ProofLine line) {
        List<Rule.Ref> shape = rule.references();
        List<Reference> refs = line.references();
        if (refs.size() != shape.size()) {
            throw ProofException.violation(rule.displayName() + " cites " + shape.size()
                + " reference(s), got " + refs.size());
        }
        List<Formula> inputs = new ArrayList<>();
        for (int i = 0; i < shape.size(); i++) {
            switch (shape.get(i)) {
                case LINE -> inputs.add(visibleLine(refs.get(i)).formula());
                case BOX -> {
                    Reference.Box box = box(refs.get(i));
                    inputs.add(lineMap.get(box.start()).formula());
                    inputs.add(lineMap.get(box.end()).formula());
                }
                case BOX_CONCLUSION -> inputs.add(lineMap.get(box(refs.get(i)).end()).formula());
            }
        }
        if (rule.takesTarget()) inputs.add(line.formula());
        return inputs;
    }

    private ProofLine visibleLine(Reference ref) {
        if (!(ref instanceof Reference.Line l)) {
            throw ProofException.scope("expected a line, got box " + ref);
        }
        int k = l.number();
        if (!validLines.contains(k)) throw ProofException.scope("line " + k + " is not established");
        if (scopeStack.stream().noneMatch(level -> level.lines.contains(k))) {
            throw ProofException.scope("line " + k + " is inside a closed scope");
        }
        return lineMap.get(k);
    }

    /**
     * A box is exactly one scope, open or closed, whose enclosing level is still
     * open. It opens with an Assumption and all its lines are established.
     */
    private Reference.Box box(Reference ref) {
        if (!(ref instanceof Reference.Box b)) {
            throw ProofException.scope("expected a box, got line " + ref);
        }
        if (b.start() > b.end()) throw ProofException.scope("box " + b + " is reversed");
        ProofLine first = lineMap.get(b.start());
        if (first == null || !Rule.ASSUMPTION.displayName().equals(first.ruleName())) {
            throw ProofException.scope("box " + b + " does not open with an Assumption");
        }
        if (!validLines.contains(b.end())) throw ProofException.scope("box " + b + " has no established end");
        if (!isScope(b)) throw ProofException.scope("box " + b + " is not a scope visible here");
        for (Integer k : lineMap.keySet()) {
            if (k >= b.start() && k <= b.end() && !validLines.contains(k)) {
                throw ProofException.scope("box " + b + " contains unestablished line " + k);
            }
        }
        return b;
    }

    private boolean isScope(Reference.Box b) {
        for (Scope open : scopeStack) {
            if (open.spans(b)) return true;
        }
        for (Scope closed : closedScopes) {
            if (closed.spans(b) && scopeStack.contains(closed.parent)) return true;
        }
        return false;
    }

    /** One nesting level: the lines recorded at it and the first and last line written inside it. */
    private static final class Scope {
        final Scope parent;
        final Set<Integer> lines = new HashSet<>();
        Integer first;
        Integer last;

        Scope(Scope parent) {
            this.parent = parent;
        }

        boolean spans(Reference.Box b) {
            return parent != null && first != null && first == b.start() && last == b.end();
        }
    }

    // branch boxes are already resolved; here only their order and assumptions
    private void checkOrBranches(ProofLine line, Formula disjunction) {
        Reference.Box first = (Reference.Box) line.references().get(1);
        Reference.Box second = (Reference.Box) line.references().get(2);
        if (options.orderedOrBranches && textOrder.get(first.end()) >= textOrder.get(second.start())) {
            throw ProofException.scope("∨e branch " + first + " must end before " + second + " begins");
        }
        if (!(disjunction instanceof Formula.Or or)) return;
        Formula a1 = lineMap.get(first.start()).formula();
        Formula a2 = lineMap.get(second.start()).formula();
        boolean straight = Formula.structurallyEqual(a1, or.left()) && Formula.structurallyEqual(a2, or.right());
        boolean swapped = Formula.structurallyEqual(a1, or.right()) && Formula.structurallyEqual(a2, or.left());
        if (!straight && !swapped) {
            throw ProofException.violation("∨e branches do not assume the disjuncts of "
                + FormulaPrinter.print(disjunction));
        }
    }
}
