package com.ilograph.edit.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Shifts each top-level block so its first sequence item lands on the column
 * recorded in the source, since the emitter applies one global indent.
 */
final class SectionIndenter {
    private SectionIndenter() {
        // Utility class
    }

    static String apply(String text, Map<String, Integer> indents) {
        if (indents.isEmpty()) {
            return text;
        }
        List<String> lines = splitKeepEnds(text);
        StringBuilder out = new StringBuilder(text.length() + 256);
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            Matcher key = FormatProfiles.TOP_LEVEL_KEY_LINE.matcher(stripEol(line));
            out.append(line);
            i++;
            if (!key.matches()) {
                continue;
            }
            int blockStart = i;
            while (i < lines.size() && !FormatProfiles.TOP_LEVEL_KEY_PREFIX.matcher(lines.get(i)).find()) {
                i++;
            }
            List<String> block = lines.subList(blockStart, i);
            Integer desired = indents.get(key.group("key"));
            Integer current = desired == null ? null : firstItemIndent(block);
            if (current == null || current.equals(desired)) {
                block.forEach(out::append);
                continue;
            }
            int delta = desired - current;
            for (String b : block) {
                if (b.isBlank()) {
                    out.append(b);
                } else if (delta > 0) {
                    out.append(" ".repeat(delta)).append(b);
                } else {
                    out.append(b.substring(Math.min(-delta, leadingSpaces(b))));
                }
            }
        }
        return out.toString();
    }

    private static Integer firstItemIndent(List<String> block) {
        for (String b : block) {
            String stripped = b.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            Matcher seq = FormatProfiles.SEQUENCE_LINE.matcher(b);
            return seq.find() ? seq.group("indent").length() : null;
        }
        return null;
    }

    private static int leadingSpaces(String s) {
        int n = 0;
        while (n < s.length() && s.charAt(n) == ' ') {
            n++;
        }
        return n;
    }

    static List<String> splitKeepEnds(String text) {
        List<String> out = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? text.length() : nl + 1;
            out.add(text.substring(start, end));
            start = end;
        }
        return out;
    }

    private static String stripEol(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}
