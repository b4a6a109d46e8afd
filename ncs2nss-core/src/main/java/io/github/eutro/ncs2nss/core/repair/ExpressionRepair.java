package io.github.eutro.ncs2nss.core.repair;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parenthesizes the multiplicative part of short arithmetic chains that mix it with addition,
 * so that the grouping is visible in the text.
 * <p>
 * {@code a + b * c + d} becomes {@code a + (b * c) + d}, {@code a + b * c} becomes {@code a + (b * c)}
 * and {@code a * b + c} becomes {@code (a * b) + c}. Only whole expressions, between an assignment, an
 * opening parenthesis or a comma and a terminator, are touched, which keeps the rewrite meaning-preserving.
 */
public class ExpressionRepair implements RepairRule {
    public static final ExpressionRepair INSTANCE = new ExpressionRepair();

    private static final String OPERAND = "([A-Za-z_0-9][\\w.]*)";
    private static final String BEFORE = "(?<=[=(,]\\s{0,8})";
    private static final String AFTER = "(?=\\s*[;),])";

    private static final Pattern FOUR = Pattern.compile(BEFORE + OPERAND
            + "\\s*([+-])\\s*" + OPERAND
            + "\\s*([*/])\\s*" + OPERAND
            + "\\s*([+-])\\s*" + OPERAND + AFTER);
    private static final Pattern THREE = Pattern.compile(BEFORE + OPERAND
            + "\\s*([-+*/])\\s*" + OPERAND
            + "\\s*([-+*/])\\s*" + OPERAND + AFTER);

    @Override
    public boolean isEnabled(RepairConfig config) {
        return config.isExpressionRepair();
    }

    @Override
    public void apply(List<String> lines, RepairLog log) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String fixed = SourceText.replace(line, FOUR, m -> {
                String repaired = g(line, m, 1) + " " + g(line, m, 2) + " (" + g(line, m, 3) + " " + g(line, m, 4)
                        + " " + g(line, m, 5) + ") " + g(line, m, 6) + " " + g(line, m, 7);
                log.applied("Fixed operator precedence: " + line.substring(m.start(), m.end()) + " -> " + repaired);
                return repaired;
            });
            String line2 = fixed;
            fixed = SourceText.replace(line2, THREE, m -> {
                String op1 = g(line2, m, 2);
                String op2 = g(line2, m, 4);
                boolean tightFirst = isMultiplicative(op1);
                if (tightFirst == isMultiplicative(op2)) return null;
                String repaired = tightFirst
                        ? "(" + g(line2, m, 1) + " " + op1 + " " + g(line2, m, 3) + ") " + op2 + " " + g(line2, m, 5)
                        : g(line2, m, 1) + " " + op1 + " (" + g(line2, m, 3) + " " + op2 + " " + g(line2, m, 5) + ")";
                log.applied("Fixed operator precedence: " + line2.substring(m.start(), m.end()) + " -> " + repaired);
                return repaired;
            });
            lines.set(i, fixed);
        }
    }

    private static boolean isMultiplicative(String op) {
        return "*".equals(op) || "/".equals(op);
    }

    private static String g(String line, Matcher m, int group) {
        return SourceText.group(line, m, group);
    }
}
