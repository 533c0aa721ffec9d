package io.proofcheck.nd;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies one rule to numbered facts and prints the derived formula.
 *
 * <pre>
 * 1    A → B
 * 2    A
 * →e,1,2
 * </pre>
 */
public final class RuleApplier {
    private static final Logger LOGGER = Logger.getLogger(RuleApplier.class.getName());

    public static final String CANNOT_APPLY = "Rule Cannot Be Applied";

    private static final Pattern FACT = Pattern.compile("(\\d+)\\s+(.+)");

    private RuleApplier() {}

    /**
     * Apply the rule clause on the last non-blank line to the facts above it.
     * @return the derived formula in canonical form, or {@link #CANNOT_APPLY}
     */
    public static String apply(String src) {
        try {
            return FormulaPrinter.print(derive(src));
        } catch (ProofException e) {
            LOGGER.fine("Rule not applied (" + e.kind() + "): " + e.getMessage());
            return CANNOT_APPLY;
        }
    }

    static Formula derive(String src) {
        List<String> lines = new ArrayList<>();
        for (String raw : src.split("\\R")) {
            if (!raw.isBlank()) lines.add(raw.strip());
        }
        if (lines.isEmpty()) throw ProofException.syntax("no rule clause");

        Map<Integer, Formula> facts = new HashMap<>();
        for (String text : lines.subList(0, lines.size() - 1)) {
            Matcher m = FACT.matcher(text);
            if (!m.matches()) throw ProofException.syntax("malformed fact: " + text);
            int number;
            try {
                number = Integer.parseInt(m.group(1));
            } catch (NumberFormatException e) {
                throw ProofException.syntax("fact number out of range: " + text);
            }
            if (facts.put(number, FormulaParser.parse(m.group(2))) != null) {
                throw ProofException.syntax("fact " + number + " given twice");
            }
        }

        ProofParser.RuleClause clause = ProofParser.parseRuleClause(lines.get(lines.size() - 1));
        Rule rule = Rule.byName(clause.name());
        boolean linesOnly = rule.references().stream().allMatch(r -> r == Rule.Ref.LINE);
        if (rule.isHypothesis() || rule.takesTarget() || !linesOnly) {
            throw ProofException.violation(rule.displayName() + " cannot be applied to facts alone");
        }
        if (clause.references().size() != rule.references().size()) {
            throw ProofException.violation(rule.displayName() + " cites " + rule.references().size()
                + " fact(s), got " + clause.references().size());
        }

        List<Formula> inputs = new ArrayList<>();
        for (Reference ref : clause.references()) {
            if (!(ref instanceof Reference.Line l)) throw ProofException.scope("boxes are not facts: " + ref);
            Formula fact = facts.get(l.number());
            if (fact == null) throw ProofException.scope("no fact " + l.number());
            inputs.add(fact);
        }
        return rule.apply(inputs);
    }
}
