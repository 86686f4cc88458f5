package com.ilograph.edit.ref;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parser for the reference expression language embedded in diagram strings.
 *
 * <p>
 * Grammar, informally:
 *
 * <pre>
 * expression := segment (',' segment)*
 * segment    := ('../' | '.../')* component ('/' | '//') component ... [ ' *' cloneId ]
 * component  := text | '[' text ']'
 * </pre>
 *
 * <p>
 * Comma and slash splitting are depth-aware: separators inside {@code [...]}
 * or {@code (...)} are part of the component. Quotes ({@code '} and
 * {@code "}) also shield commas, and a backslash escapes the next character
 * only while inside quotes.
 *
 * <p>
 * All functions are pure.
 */
public final class ReferenceParser {
    /** Characters that may not appear in resource ids or alias names. */
    public static final String RESTRICTED_ID_CHARS = "/^*[],";

    /** Tokens with a fixed meaning in every context. */
    public static final Set<String> SPECIAL_TOKENS = Set.of("*", "none", "^");

    private ReferenceParser() {
        // Utility class
    }

    /** Splits an expression on top-level commas. Empty segments are dropped, segments are trimmed. */
    public static List<String> splitList(String raw) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int square = 0;
        int paren = 0;
        boolean inSingle = false;
        boolean inDouble = false;
        boolean escaped = false;

        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (escaped) {
                current.append(c);
                escaped = false;
                continue;
            }
            if (c == '\\' && (inSingle || inDouble)) {
                current.append(c);
                escaped = true;
                continue;
            }
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
                current.append(c);
                continue;
            }
            if (c == '"' && !inSingle) {
                inDouble = !inDouble;
                current.append(c);
                continue;
            }
            if (!inSingle && !inDouble) {
                if (c == '[') {
                    square++;
                } else if (c == ']' && square > 0) {
                    square--;
                } else if (c == '(') {
                    paren++;
                } else if (c == ')' && paren > 0) {
                    paren--;
                } else if (c == ',' && square == 0 && paren == 0) {
                    addTrimmed(parts, current);
                    current.setLength(0);
                    continue;
                }
            }
            current.append(c);
        }
        addTrimmed(parts, current);
        return parts;
    }

    /** Inverse of {@link #splitList(String)} for already-split segments. */
    public static String joinList(List<String> parts) {
        return String.join(", ", parts);
    }

    /** Parses every segment of an expression into its components. */
    public static List<ReferenceComponent> parseComponents(String raw) {
        List<ReferenceComponent> out = new ArrayList<>();
        for (String part : splitList(raw)) {
            out.addAll(parseSegment(part));
        }
        return out;
    }

    /** Plain tokens of an expression: special and wildcard components are skipped. */
    public static Set<String> extractTokens(String raw) {
        Set<String> tokens = new LinkedHashSet<>();
        for (ReferenceComponent c : parseComponents(raw)) {
            if (c.isPlain() && !c.token().isEmpty()) {
                tokens.add(c.token());
            }
        }
        return tokens;
    }

    /** True when some component of {@code raw} is exactly {@code identifier}. */
    public static boolean containsIdentifier(String raw, String identifier) {
        for (ReferenceComponent c : parseComponents(raw)) {
            if (c.token().equals(identifier)) {
                return true;
            }
        }
        return false;
    }

    /** Components of a single comma-free segment. */
    public static List<ReferenceComponent> parseSegment(String part) {
        List<ReferenceComponent> out = new ArrayList<>();
        String base = stripCloneSuffix(part.strip());
        if (base.isEmpty()) {
            return out;
        }

        boolean relative = false;
        while (true) {
            if (base.startsWith("../")) {
                relative = true;
                base = base.substring(3).stripLeading();
            } else if (base.startsWith(".../")) {
                relative = true;
                base = base.substring(4).stripLeading();
            } else {
                break;
            }
        }
        if (base.isEmpty()) {
            return out;
        }

        for (String rawComponent : splitPath(base)) {
            String token = rawComponent.strip();
            if (token.length() >= 2 && token.startsWith("[") && token.endsWith("]")) {
                token = token.substring(1, token.length() - 1).strip();
            }
            if (token.isEmpty()) {
                continue;
            }
            boolean special = SPECIAL_TOKENS.contains(token.toLowerCase(Locale.ROOT));
            out.add(new ReferenceComponent(token, rawComponent, relative,
                    !special && token.indexOf('*') >= 0, token.contains("::"), special));
        }
        return out;
    }

    /** Splits a segment on {@code /} and {@code //}, outside brackets and parentheses. */
    static List<String> splitPath(String raw) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int square = 0;
        int paren = 0;
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '[') {
                square++;
            } else if (c == ']' && square > 0) {
                square--;
            } else if (c == '(') {
                paren++;
            } else if (c == ')' && paren > 0) {
                paren--;
            }

            if (c == '/' && square == 0 && paren == 0) {
                addTrimmed(parts, current);
                current.setLength(0);
                if (i + 1 < raw.length() && raw.charAt(i + 1) == '/') {
                    i++;
                }
                i++;
                continue;
            }
            current.append(c);
            i++;
        }
        addTrimmed(parts, current);
        return parts;
    }

    /**
     * Drops a trailing clone marker: {@code *suffix} preceded by whitespace,
     * outside brackets and parentheses, with a non-empty suffix that holds no
     * whitespace, slash or comma.
     */
    static String stripCloneSuffix(String raw) {
        String text = raw.stripTrailing();
        int square = 0;
        int paren = 0;
        for (int i = text.length() - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == ']') {
                square++;
                continue;
            }
            if (c == '[' && square > 0) {
                square--;
                continue;
            }
            if (c == ')') {
                paren++;
                continue;
            }
            if (c == '(' && paren > 0) {
                paren--;
                continue;
            }
            if (square > 0 || paren > 0 || c != '*' || i == 0) {
                continue;
            }
            if (!Character.isWhitespace(text.charAt(i - 1))) {
                continue;
            }
            String suffix = text.substring(i + 1).strip();
            if (suffix.isEmpty() || !isCloneId(suffix)) {
                continue;
            }
            return text.substring(0, i - 1).stripTrailing();
        }
        return text;
    }

    private static boolean isCloneId(String suffix) {
        for (int i = 0; i < suffix.length(); i++) {
            char c = suffix.charAt(i);
            if (Character.isWhitespace(c) || c == '/' || c == ',') {
                return false;
            }
        }
        return true;
    }

    /** First restricted character in {@code value}, or null when clean. */
    public static Character firstRestrictedChar(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (RESTRICTED_ID_CHARS.indexOf(c) >= 0) {
                return c;
            }
        }
        return null;
    }

    private static void addTrimmed(List<String> parts, StringBuilder sb) {
        String segment = sb.toString().strip();
        if (!segment.isEmpty()) {
            parts.add(segment);
        }
    }
}
