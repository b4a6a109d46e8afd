package io.github.eutro.ncs2nss.core.repair;

import io.github.eutro.ncs2nss.core.DiagnosticKind;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips casts to names that are not NWScript types, leaving the operand.
 */
public class TypeRepair implements RepairRule {
    public static final TypeRepair INSTANCE = new TypeRepair();

    // a parenthesized name that is not a call's argument list or a statement's condition,
    // directly applied to an operand
    private static final Pattern CAST = Pattern.compile(
            "(?<![\\w)\\]])(?<!\\b(?:if|while|switch)\\s{0,8})"
                    + "\\(\\s*([A-Za-z_]\\w*)\\s*\\)\\s*(?=[\\w(\"\\[!~.-])");

    @Override
    public boolean isEnabled(RepairConfig config) {
        return config.isTypeRepair();
    }

    @Override
    public void apply(List<String> lines, RepairLog log) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            lines.set(i, SourceText.replace(line, CAST, m -> {
                String type = SourceText.group(line, m, 1);
                if (NssVocabulary.isType(type)) return null;
                log.report(DiagnosticKind.UNKNOWN_CAST_TYPE, "Removed cast to unknown type " + type);
                log.applied("Removed invalid type cast: (" + type + ") in " + line.trim());
                return "";
            }));
        }
    }
}
