package com.ilograph.edit.io;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handling of bare bracket values such as {@code from: [*.example.com]}.
 *
 * <p>
 * The diagram format reads these as scalar reference expressions while YAML
 * reads a flow sequence (or fails on {@code *} as an alias). Before parsing,
 * such lines are rewritten to single-quoted scalars; after emitting, the
 * quotes are dropped again for every (key, value) pair that was bare in the
 * source.
 */
final class BracketScalars {
    static final Set<String> REFERENCE_KEYS = Set.of("from", "to", "via", "resourceId", "parentId", "for",
            "select", "focus", "highlight", "include", "exclude", "root", "center", "zoomTo", "expand", "hide",
            "start", "toAndBack", "toAsync", "restartAt");

    private static final Pattern KEY_VALUE_LINE = Pattern.compile(
            "^(?<prefix>\\s*(?:-\\s*)?)(?<key>[A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*(?<value>\\[[^\\n#]*\\])"
                    + "(?<suffix>\\s*(?:#.*)?)$");
    private static final Pattern QUOTED_KEY_VALUE_LINE = Pattern.compile(
            "^(?<prefix>\\s*(?:-\\s*)?)(?<key>[A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*'(?<value>\\[[^'\\n#]*\\])'"
                    + "(?<suffix>\\s*(?:#.*)?)$");

    private BracketScalars() {
        // Utility class
    }

    static Set<BracketScalar> detect(String source) {
        Set<BracketScalar> out = new LinkedHashSet<>();
        for (String line : LineDiff.lines(source)) {
            Matcher m = KEY_VALUE_LINE.matcher(line);
            if (m.matches() && REFERENCE_KEYS.contains(m.group("key"))) {
                out.add(new BracketScalar(m.group("key"), m.group("value").strip()));
            }
        }
        return out;
    }

    /** Rewrites every bare bracket reference value to a single-quoted scalar. */
    static String quote(String source) {
        return rewriteLines(source, line -> {
            Matcher m = KEY_VALUE_LINE.matcher(line);
            if (!m.matches() || !REFERENCE_KEYS.contains(m.group("key"))) {
                return line;
            }
            String escaped = m.group("value").replace("'", "''");
            return m.group("prefix") + m.group("key") + ": '" + escaped + "'" + m.group("suffix");
        });
    }

    /** Drops the quotes again on values recorded as originally bare. */
    static String restore(String emitted, Set<BracketScalar> originallyBare) {
        if (originallyBare.isEmpty()) {
            return emitted;
        }
        return rewriteLines(emitted, line -> {
            Matcher m = QUOTED_KEY_VALUE_LINE.matcher(line);
            if (!m.matches()) {
                return line;
            }
            String value = m.group("value").strip();
            if (!originallyBare.contains(new BracketScalar(m.group("key"), value))) {
                return line;
            }
            return m.group("prefix") + m.group("key") + ": " + value + m.group("suffix");
        });
    }

    /** Applies {@code fn} to each line body, keeping line terminators untouched. */
    static String rewriteLines(String text, UnaryOperator<String> fn) {
        StringBuilder out = new StringBuilder(text.length() + 64);
        int start = 0;
        while (start < text.length()) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? text.length() : nl;
            int bodyEnd = end > start && text.charAt(end - 1) == '\r' ? end - 1 : end;
            out.append(fn.apply(text.substring(start, bodyEnd)));
            out.append(text, bodyEnd, nl < 0 ? end : end + 1);
            start = nl < 0 ? end : end + 1;
        }
        return out.toString();
    }
}
