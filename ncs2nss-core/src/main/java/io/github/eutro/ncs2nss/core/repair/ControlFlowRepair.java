package io.github.eutro.ncs2nss.core.repair;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes statement headers. Conditions of {@code if} and {@code while} get their parentheses,
 * {@code for} headers are respaced to one space after each {@code ;}, and {@code return} gets its {@code ;}.
 */
public class ControlFlowRepair implements RepairRule {
    public static final ControlFlowRepair INSTANCE = new ControlFlowRepair();

    private static final Pattern CONDITIONAL = Pattern.compile("^(\\}\\s*else\\s+)?(if|while)\\b\\s*(.*?)\\s*\\{$");
    private static final Pattern FOR = Pattern.compile("^for\\s*\\((.*)\\)\\s*\\{$");
    private static final Pattern RETURN = Pattern.compile("^return\\b");

    @Override
    public boolean isEnabled(RepairConfig config) {
        return config.isControlFlowRepair();
    }

    @Override
    public void apply(List<String> lines, RepairLog log) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String masked = SourceText.mask(line);
            int end = SourceText.codeEnd(masked);
            String indent = SourceText.indentOf(line);
            if (indent.length() >= end) continue;
            String code = line.substring(indent.length(), end);
            String maskedCode = masked.substring(indent.length(), end);
            String tail = line.substring(end);

            String fixed = conditional(code, maskedCode, log);
            if (fixed == null) fixed = forHeader(code, maskedCode, log);
            if (fixed == null && RETURN.matcher(maskedCode).find()) {
                char last = maskedCode.charAt(maskedCode.length() - 1);
                if (last != ';' && last != '{' && last != '}') {
                    fixed = code + ";";
                    log.applied("Fixed return statement: " + code + " -> " + fixed);
                }
            }
            if (fixed != null) lines.set(i, indent + fixed + tail);
        }
    }

    private static String conditional(String code, String masked, RepairLog log) {
        Matcher m = CONDITIONAL.matcher(masked);
        if (!m.matches() || m.start(3) == m.end(3)) return null;
        String condition = code.substring(m.start(3), m.end(3));
        if (isWrapped(masked.substring(m.start(3), m.end(3)))) return null;
        String keyword = m.group(2);
        String fixed = (m.group(1) == null ? "" : "} else ") + keyword + " (" + condition + ") {";
        log.applied("Fixed " + keyword + " statement condition: " + code + " -> " + fixed);
        return fixed;
    }

    private static String forHeader(String code, String masked, RepairLog log) {
        Matcher m = FOR.matcher(masked);
        if (!m.matches()) return null;
        List<String> parts = splitTopLevel(code.substring(m.start(1), m.end(1)), masked.substring(m.start(1), m.end(1)));
        if (parts.size() != 3) return null;
        String fixed = "for (" + parts.get(0).trim() + "; " + parts.get(1).trim() + "; " + parts.get(2).trim() + ") {";
        if (fixed.equals(code)) return null;
        log.applied("Fixed for statement: " + code + " -> " + fixed);
        return fixed;
    }

    /**
     * Whether an expression is entirely enclosed by one pair of parentheses.
     */
    static boolean isWrapped(String masked) {
        if (masked.isEmpty() || masked.charAt(0) != '(') return false;
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') depth++;
            else if (c == ')' && --depth == 0) return i == masked.length() - 1;
        }
        return false;
    }

    private static List<String> splitTopLevel(String text, String masked) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            else if (c == ';' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }
}
