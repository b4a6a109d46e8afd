package io.github.eutro.ncs2nss.core.repair;

import io.github.eutro.ncs2nss.core.DiagnosticKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixes the types and parameter names of top-level function headers and prototypes.
 * <p>
 * Types outside the vocabulary are corrected through a fixed table of misspellings, or become {@code int}.
 * Parameters with a missing or reserved name get one derived from their type.
 */
public class FunctionSignatureRepair implements RepairRule {
    public static final FunctionSignatureRepair INSTANCE = new FunctionSignatureRepair();

    private static final Pattern HEADER = Pattern.compile("^([A-Za-z_]\\w*)\\s+([A-Za-z_]\\w*)\\s*\\((.*)\\)\\s*(?:\\{|;)?$");
    private static final Pattern PARAMETER = Pattern.compile("^([A-Za-z_]\\w*)\\s+([A-Za-z_]\\w*)(\\s*=.*)?$");
    private static final Pattern LONE = Pattern.compile("^[A-Za-z_]\\w*$");
    private static final Pattern PLACEHOLDER_TYPE = Pattern.compile("(?i)unknown|invalid|missing");

    @Override
    public boolean isEnabled(RepairConfig config) {
        return config.isFunctionSignatureRepair();
    }

    @Override
    public void apply(List<String> lines, RepairLog log) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isEmpty() || Character.isWhitespace(line.charAt(0))) continue;
            String masked = SourceText.mask(line);
            int end = SourceText.codeEnd(masked);
            Matcher m = HEADER.matcher(masked.substring(0, end));
            if (!m.matches() || NssVocabulary.CONTROL_KEYWORDS.contains(m.group(1))) continue;

            String name = m.group(2);
            String returnType = line.substring(m.start(1), m.end(1));
            String fixedReturn = fixType(returnType, "return type of " + name, log);
            String params = line.substring(m.start(3), m.end(3));
            String fixedParams = fixParameters(params, masked.substring(m.start(3), m.end(3)), name, log);
            if (fixedReturn.equals(returnType) && fixedParams.equals(params)) continue;

            String fixed = fixedReturn + line.substring(m.end(1), m.start(3)) + fixedParams + line.substring(m.end(3));
            log.applied("Fixed function signature: " + line.trim() + " -> " + fixed.trim());
            lines.set(i, fixed);
        }
    }

    private static String fixType(String type, String where, RepairLog log) {
        if (NssVocabulary.isType(type)) return type;
        String corrected = NssVocabulary.correction(type);
        if (corrected != null) return corrected;
        log.report(DiagnosticKind.UNKNOWN_SIGNATURE_TYPE, "Unknown type " + type + " in " + where + ", using int");
        return "int";
    }

    private static String fixParameters(String params, String masked, String function, RepairLog log) {
        if (params.trim().isEmpty()) return params;
        List<String> pieces = new ArrayList<>();
        List<String> maskedPieces = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            else if (c == ',' && depth == 0) {
                pieces.add(params.substring(start, i).trim());
                maskedPieces.add(masked.substring(start, i).trim());
                start = i + 1;
            }
        }
        pieces.add(params.substring(start).trim());
        maskedPieces.add(masked.substring(start).trim());

        int n = pieces.size();
        String[] types = new String[n];
        String[] names = new String[n];
        String[] defaults = new String[n];
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < n; i++) {
            String piece = pieces.get(i);
            Matcher m = PARAMETER.matcher(maskedPieces.get(i));
            if (m.matches()) {
                types[i] = fixType(m.group(1), "parameter " + m.group(2) + " of " + function, log);
                names[i] = NssVocabulary.isKeyword(m.group(2)) ? null : m.group(2);
                defaults[i] = m.group(3) == null ? "" : piece.substring(m.start(3), m.end(3));
            } else if (LONE.matcher(piece).matches()) {
                if (NssVocabulary.isType(piece) || NssVocabulary.correction(piece) != null
                        || PLACEHOLDER_TYPE.matcher(piece).matches()) {
                    types[i] = fixType(piece, "parameter " + (i + 1) + " of " + function, log);
                    names[i] = null;
                } else {
                    types[i] = "int";
                    names[i] = NssVocabulary.isKeyword(piece) ? null : piece;
                }
                defaults[i] = "";
            } else {
                // leave anything unrecognised as written
                types[i] = piece;
                defaults[i] = "";
                names[i] = "";
            }
            if (names[i] != null) taken.add(names[i]);
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (names[i] == null) names[i] = freshName(types[i], taken);
            if (i != 0) sb.append(", ");
            sb.append(types[i]);
            if (!names[i].isEmpty()) sb.append(' ').append(names[i]);
            sb.append(defaults[i]);
        }
        String fixed = sb.toString();
        return fixed.equals(String.join(", ", pieces)) ? params : fixed;
    }

    private static String freshName(String type, Set<String> taken) {
        String base = NssVocabulary.parameterName(type);
        String name = base;
        for (int k = 2; taken.contains(name); k++) name = base + k;
        taken.add(name);
        return name;
    }
}
