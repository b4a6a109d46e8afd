package io.github.eutro.ncs2nss.core.repair;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Terminates statements missing their {@code ;} and closes unclosed braces at the end of the text.
 * Surplus closing braces are only reported.
 */
public class SyntaxRepair implements RepairRule {
    public static final SyntaxRepair INSTANCE = new SyntaxRepair();

    private static final Pattern CONTROL = Pattern.compile("^(?:if|else|while|for|do|switch|return)\\b");
    private static final Pattern LABEL = Pattern.compile("^(?:case\\b.*|default\\s*):$");

    @Override
    public boolean isEnabled(RepairConfig config) {
        return config.isSyntaxRepair();
    }

    @Override
    public void apply(List<String> lines, RepairLog log) {
        int open = 0;
        int close = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String masked = SourceText.mask(line);
            for (int j = 0; j < masked.length(); j++) {
                char c = masked.charAt(j);
                if (c == '{') open++;
                else if (c == '}') close++;
            }
            if (needsTerminator(masked.trim())) {
                int end = SourceText.codeEnd(masked);
                lines.set(i, line.substring(0, end) + ";" + line.substring(end));
                log.applied("Added missing semicolon: " + line.trim());
            }
        }

        if (open > close) {
            int missing = open - close;
            // keep a trailing newline last
            int at = !lines.isEmpty() && lines.get(lines.size() - 1).isEmpty() ? lines.size() - 1 : lines.size();
            for (int i = 0; i < missing; i++) lines.add(at, "}");
            log.applied("Added " + missing + " missing closing brace(s)");
        } else if (close > open) {
            log.warn("Found " + (close - open) + " extra closing brace(s), manual review needed");
        }
    }

    private static boolean needsTerminator(String code) {
        if (code.isEmpty()) return false;
        char last = code.charAt(code.length() - 1);
        if (last == ';' || last == '{' || last == '}' || last == ')') return false;
        char first = code.charAt(0);
        if (first == '{' || first == '}') return false;
        return !CONTROL.matcher(code).find() && !LABEL.matcher(code).matches();
    }
}
