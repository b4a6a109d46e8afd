package io.github.eutro.ncs2nss.core.repair;

import io.github.eutro.ncs2nss.core.util.F;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line helpers shared by the repair rules.
 */
final class SourceText {
    private SourceText() {
    }

    static List<String> split(String text) {
        return new ArrayList<>(Arrays.asList(text.split("\r\n|\r|\n", -1)));
    }

    static String join(List<String> lines) {
        return String.join("\n", lines);
    }

    /**
     * Blank out the contents of string literals and comments, keeping every other character in place,
     * so that patterns only see code.
     *
     * @param line The line.
     * @return The masked line, of the same length.
     */
    static String mask(String line) {
        char[] cs = line.toCharArray();
        int i = 0;
        while (i < cs.length) {
            char c = cs[i];
            if (c == '"') {
                i++;
                while (i < cs.length && cs[i] != '"') {
                    if (cs[i] == '\\' && i + 1 < cs.length) cs[i++] = ' ';
                    cs[i++] = ' ';
                }
                i++;
            } else if (c == '/' && i + 1 < cs.length && cs[i + 1] == '/') {
                Arrays.fill(cs, i, cs.length, ' ');
                break;
            } else if (c == '/' && i + 1 < cs.length && cs[i + 1] == '*') {
                int end = line.indexOf("*/", i + 2);
                int stop = end == -1 ? cs.length : end + 2;
                Arrays.fill(cs, i, stop, ' ');
                i = stop;
            } else {
                i++;
            }
        }
        return new String(cs);
    }

    /**
     * Get the index just past the last code character of a masked line.
     *
     * @param masked The masked line.
     * @return The index, or 0 if the line has no code.
     */
    static int codeEnd(String masked) {
        int end = masked.length();
        while (end > 0 && Character.isWhitespace(masked.charAt(end - 1))) end--;
        return end;
    }

    /**
     * Replace the matches of a pattern over the code of a line.
     *
     * @param line     The line.
     * @param pattern  The pattern, matched against the masked line.
     * @param replacer Builds each replacement from a matcher over the masked line, or returns null to keep the match.
     *                 Group text should be read from the original line by index.
     * @return The line, with the replacements made.
     */
    static String replace(String line, Pattern pattern, F<Matcher, String> replacer) {
        Matcher m = pattern.matcher(mask(line));
        StringBuilder sb = null;
        int last = 0;
        while (m.find()) {
            String replacement = replacer.apply(m);
            if (replacement == null) continue;
            if (sb == null) sb = new StringBuilder();
            sb.append(line, last, m.start()).append(replacement);
            last = m.end();
        }
        if (sb == null) return line;
        return sb.append(line, last, line.length()).toString();
    }

    static String group(String line, Matcher m, int group) {
        return line.substring(m.start(group), m.end(group));
    }

    static String indentOf(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) i++;
        return line.substring(0, i);
    }
}
