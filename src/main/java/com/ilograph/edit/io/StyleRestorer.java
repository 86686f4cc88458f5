package com.ilograph.edit.io;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suppresses diffs that only change presentation.
 *
 * <p>
 * The emitted text is aligned line by line with the original. Every
 * replacement block of equal length whose lines normalise to the same text is
 * swapped back for the original lines, so untouched regions keep their exact
 * bytes even when the emitter would have written them differently. Lines that
 * did change keep the original spacing in front of an unchanged inline comment.
 */
public final class StyleRestorer {
    private static final Pattern BLOCK_HEADER = Pattern.compile(":\\s*([|>])\\d?([+-]?)\\d?$");
    private static final Pattern DOUBLE_QUOTED_VALUE = Pattern.compile(
            "^(?<head>(?:-\\s+)?(?:[^\"{}\\[\\]]*?:\\s+)?)\"(?<body>(?:[^\"\\\\]|\\\\.)*)\"$");
    private static final String FLOW_PUNCTUATION = "{}[],:";

    private StyleRestorer() {
        // Utility class
    }

    public static String restore(String before, String after) {
        if (before.equals(after)) {
            return after;
        }
        List<String> a = LineDiff.lines(before);
        List<String> b = LineDiff.lines(after);
        List<String> merged = new ArrayList<>(b.size());
        for (LineDiff.Opcode op : LineDiff.opcodes(a, b)) {
            switch (op.kind()) {
                case EQUAL -> merged.addAll(a.subList(op.i1(), op.i2()));
                case REPLACE -> {
                    List<String> original = a.subList(op.i1(), op.i2());
                    List<String> emitted = b.subList(op.j1(), op.j2());
                    if (styleEquivalent(original, emitted)) {
                        merged.addAll(original);
                    } else if (original.size() == emitted.size()) {
                        for (int i = 0; i < emitted.size(); i++) {
                            merged.add(restoreLine(original.get(i), emitted.get(i)));
                        }
                    } else {
                        merged.addAll(emitted);
                    }
                }
                case INSERT -> merged.addAll(b.subList(op.j1(), op.j2()));
                case DELETE -> {
                    // dropped
                }
            }
        }
        String joined = String.join("\n", merged);
        return after.endsWith("\n") ? joined + "\n" : joined;
    }

    /** An equivalent line at the same indent stays as written; a changed one keeps its comment gap. */
    static String restoreLine(String original, String emitted) {
        if (leadingSpaces(original) == leadingSpaces(emitted) && normalize(original).equals(normalize(emitted))) {
            return original;
        }
        return keepCommentGap(original, emitted);
    }

    static boolean styleEquivalent(List<String> original, List<String> emitted) {
        if (original.size() != emitted.size()) {
            return false;
        }
        for (int i = 0; i < original.size(); i++) {
            if (!normalize(original.get(i)).equals(normalize(emitted.get(i)))) {
                return false;
            }
        }
        return true;
    }

    static String normalize(String line) {
        String s = line.replaceFirst("^ +", "");
        int hash = inlineCommentStart(s);
        String comment = hash < 0 ? "" : " " + s.substring(hash);
        String body = hash < 0 ? s : s.substring(0, hash).stripTrailing();
        body = BLOCK_HEADER.matcher(body).replaceFirst(": $1$2");
        Matcher quoted = DOUBLE_QUOTED_VALUE.matcher(body);
        if (quoted.matches()) {
            String text = unescapeDoubleQuoted(quoted.group("body"));
            if (text != null) {
                return quoted.group("head") + "\"" + text + "\"" + comment;
            }
        }
        if (body.indexOf('{') < 0 && body.indexOf('[') < 0) {
            return body + comment;
        }
        return normalizeFlowSpacing(body) + comment;
    }

    /**
     * Puts the original whitespace back in front of an inline comment whose
     * text did not change.
     */
    static String keepCommentGap(String original, String emitted) {
        int o = inlineCommentStart(original);
        int e = inlineCommentStart(emitted);
        if (o < 0 || e < 0 || !original.substring(o).equals(emitted.substring(e))) {
            return emitted;
        }
        String body = emitted.substring(0, e).stripTrailing();
        String gap = original.substring(original.substring(0, o).stripTrailing().length(), o);
        return body + gap + emitted.substring(e);
    }

    /**
     * Index of the {@code #} opening an inline comment, or -1. A {@code #}
     * counts when it follows whitespace outside quotes; a quote opens only at
     * the start of a scalar.
     */
    static int inlineCommentStart(String line) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inSingle) {
                if (c == '\'') {
                    inSingle = false;
                }
                continue;
            }
            if (inDouble) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inDouble = false;
                }
                continue;
            }
            boolean scalarStart = i == 0 || Character.isWhitespace(line.charAt(i - 1))
                    || "[{,".indexOf(line.charAt(i - 1)) >= 0;
            if (c == '#' && i > 0 && Character.isWhitespace(line.charAt(i - 1))) {
                return line.substring(0, i).isBlank() ? -1 : i;
            }
            if (scalarStart && c == '\'') {
                inSingle = true;
            } else if (scalarStart && c == '"') {
                inDouble = true;
            }
        }
        return -1;
    }

    /** Decodes the body of a double-quoted scalar on one line; null on an unknown escape. */
    static String unescapeDoubleQuoted(String body) {
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (++i >= body.length()) {
                return null;
            }
            char e = body.charAt(i);
            int hexDigits = switch (e) {
                case 'x' -> 2;
                case 'u' -> 4;
                case 'U' -> 8;
                default -> 0;
            };
            if (hexDigits > 0) {
                if (i + hexDigits >= body.length()) {
                    return null;
                }
                try {
                    out.appendCodePoint(Integer.parseInt(body.substring(i + 1, i + 1 + hexDigits), 16));
                } catch (IllegalArgumentException ex) {
                    return null;
                }
                i += hexDigits;
                continue;
            }
            switch (e) {
                case '0' -> out.append('\u0000');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 't', '\t' -> out.append('\t');
                case 'n' -> out.append('\n');
                case 'v' -> out.append('\u000B');
                case 'f' -> out.append('\f');
                case 'r' -> out.append('\r');
                case 'e' -> out.append('\u001B');
                case ' ' -> out.append(' ');
                case '"' -> out.append('"');
                case '/' -> out.append('/');
                case '\\' -> out.append('\\');
                case 'N' -> out.append('\u0085');
                case '_' -> out.append('\u00A0');
                case 'L' -> out.append('\u2028');
                case 'P' -> out.append('\u2029');
                default -> {
                    return null;
                }
            }
        }
        return out.toString();
    }

    /** Removes spaces around flow punctuation outside quotes; collapses other whitespace runs to one space. */
    static String normalizeFlowSpacing(String line) {
        StringBuilder out = new StringBuilder(line.length());
        boolean pendingSpace = false;
        boolean inSingle = false;
        boolean inDouble = false;
        boolean escapeNext = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inSingle) {
                out.append(c);
                if (c == '\'') {
                    inSingle = false;
                }
                continue;
            }
            if (inDouble) {
                out.append(c);
                if (escapeNext) {
                    escapeNext = false;
                } else if (c == '\\') {
                    escapeNext = true;
                } else if (c == '"') {
                    inDouble = false;
                }
                continue;
            }
            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }
            if (FLOW_PUNCTUATION.indexOf(c) >= 0) {
                if (out.length() > 0 && out.charAt(out.length() - 1) == ' ') {
                    out.setLength(out.length() - 1);
                }
                out.append(c);
                pendingSpace = false;
                continue;
            }
            if (pendingSpace && out.length() > 0 && FLOW_PUNCTUATION.indexOf(out.charAt(out.length() - 1)) < 0) {
                out.append(' ');
            }
            pendingSpace = false;
            out.append(c);
            if (c == '\'') {
                inSingle = true;
            } else if (c == '"') {
                inDouble = true;
            }
        }
        return out.toString();
    }

    private static int leadingSpaces(String s) {
        int n = 0;
        while (n < s.length() && s.charAt(n) == ' ') {
            n++;
        }
        return n;
    }
}
