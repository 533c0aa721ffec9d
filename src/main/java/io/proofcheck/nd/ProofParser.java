package io.proofcheck.nd;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented parser for proof text.
 *
 * <pre>
 *  1    p → q        Premise
 *       BeginScope
 *  2      p          Assumption
 *  3      q          →e, 1, 2
 *       EndScope
 *  4    p → q        →i, 2-3
 * </pre>
 *
 * Fields are separated by runs of two or more spaces; indentation is cosmetic.
 */
public final class ProofParser {
    private ProofParser() {}

    static final String BEGIN_SCOPE = "BeginScope";
    static final String END_SCOPE = "EndScope";

    private static final Pattern STEP = Pattern.compile("(\\d+)(?:\\s+(.*))?");
    private static final Pattern FIELD_SEPARATOR = Pattern.compile("\\s{2,}|\\t");
    private static final Pattern LINE_REF = Pattern.compile("\\d+");
    private static final Pattern BOX_REF = Pattern.compile("(\\d+)\\s*-\\s*(\\d+)");

    /** Rule name plus the references cited after it. */
    public record RuleClause(String name, List<Reference> references) {}

    /**
     * Parse a whole proof. Blank lines are skipped.
     * @throws ProofException of kind SYNTAX on the first malformed line
     */
    public static List<ProofLine> parse(String src) {
        List<ProofLine> lines = new ArrayList<>();
        for (String raw : src.split("\\R")) {
            String text = raw.strip();
            if (text.isEmpty()) continue;
            lines.add(parseLine(text, indentOf(raw)));
        }
        return lines;
    }

    static ProofLine parseLine(String text, int indent) {
        if (text.equals(BEGIN_SCOPE)) return ProofLine.beginScope(indent);
        if (text.equals(END_SCOPE)) return ProofLine.endScope(indent);

        Matcher m = STEP.matcher(text);
        if (!m.matches() || m.group(2) == null || m.group(2).isBlank()) {
            throw ProofException.syntax("malformed line: " + text);
        }
        int number = number(m.group(1), text);
        String[] fields = FIELD_SEPARATOR.split(m.group(2).strip(), 2);

        Formula formula;
        try {
            formula = FormulaParser.parse(fields[0]);
        } catch (ProofException e) {
            throw ProofException.syntax(e.getMessage() + " in line: " + text);
        }
        if (fields.length == 1) {
            return ProofLine.step(number, formula, null, List.of(), indent);
        }
        RuleClause clause = parseRuleClause(fields[1]);
        return ProofLine.step(number, formula, clause.name(), clause.references(), indent);
    }

    /**
     * Parse {@code Name} or {@code Name, ref(, ref)*} where a ref is {@code n} or {@code n-m}.
     */
    public static RuleClause parseRuleClause(String text) {
        String[] parts = text.split(",", -1);
        String name = parts[0].strip();
        if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
            throw ProofException.syntax("malformed rule clause: " + text.strip());
        }
        List<Reference> refs = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            refs.add(parseReference(parts[i].strip(), text));
        }
        return new RuleClause(name, refs);
    }

    private static Reference parseReference(String ref, String clause) {
        if (LINE_REF.matcher(ref).matches()) return Reference.line(number(ref, clause));
        Matcher box = BOX_REF.matcher(ref);
        if (box.matches()) return Reference.box(number(box.group(1), clause), number(box.group(2), clause));
        throw ProofException.syntax("malformed reference '" + ref + "' in: " + clause.strip());
    }

    private static int number(String digits, String context) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw ProofException.syntax("line number out of range in: " + context.strip());
        }
    }

    private static int indentOf(String raw) {
        int spaces = 0;
        while (spaces < raw.length() && raw.charAt(spaces) == ' ') spaces++;
        return spaces / 2;
    }
}
