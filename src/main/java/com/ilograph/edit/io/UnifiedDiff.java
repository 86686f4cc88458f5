package com.ilograph.edit.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Unified diff rendering for dry-run previews, plus small statistics.
 */
public final class UnifiedDiff {
    public static final int DEFAULT_CONTEXT = 3;

    private UnifiedDiff() {
        // Utility class
    }

    /** Added/deleted line counts and hunk count of a rendered diff. */
    public record Summary(int added, int deleted, int hunks) {
        @Override
        public String toString() {
            return "+" + added + " -" + deleted + " (" + hunks + " hunks)";
        }
    }

    /** Changed line counts attributed to one top-level section. */
    public record SectionChange(String name, int added, int deleted) {
        @Override
        public String toString() {
            return name + "(+" + added + "/-" + deleted + ")";
        }
    }

    /**
     * Renders {@code a/path} vs {@code b/path}. Returns no lines when the
     * texts are equal line for line.
     */
    public static List<String> render(String before, String after, String path, int context) {
        List<String> a = LineDiff.lines(before);
        List<String> b = LineDiff.lines(after);
        List<List<LineDiff.Opcode>> groups = groupedOpcodes(LineDiff.opcodes(a, b), context);
        List<String> out = new ArrayList<>();
        if (groups.isEmpty()) {
            return out;
        }
        String normalized = normalizePath(path);
        out.add("--- a/" + normalized);
        out.add("+++ b/" + normalized);
        for (List<LineDiff.Opcode> group : groups) {
            LineDiff.Opcode first = group.get(0);
            LineDiff.Opcode last = group.get(group.size() - 1);
            out.add("@@ -" + range(first.i1(), last.i2()) + " +" + range(first.j1(), last.j2()) + " @@");
            for (LineDiff.Opcode op : group) {
                if (op.kind() == LineDiff.Kind.EQUAL) {
                    a.subList(op.i1(), op.i2()).forEach(l -> out.add(" " + l));
                    continue;
                }
                if (op.kind() == LineDiff.Kind.REPLACE || op.kind() == LineDiff.Kind.DELETE) {
                    a.subList(op.i1(), op.i2()).forEach(l -> out.add("-" + l));
                }
                if (op.kind() == LineDiff.Kind.REPLACE || op.kind() == LineDiff.Kind.INSERT) {
                    b.subList(op.j1(), op.j2()).forEach(l -> out.add("+" + l));
                }
            }
        }
        return out;
    }

    public static Summary summarize(List<String> diffLines) {
        int added = 0;
        int deleted = 0;
        int hunks = 0;
        for (String line : diffLines) {
            if (line.startsWith("@@")) {
                hunks++;
            } else if (line.startsWith("+++") || line.startsWith("---")) {
                continue;
            } else if (line.startsWith("+")) {
                added++;
            } else if (line.startsWith("-")) {
                deleted++;
            }
        }
        return new Summary(added, deleted, hunks);
    }

    /** Per top-level key, how many lines were added and deleted inside it. */
    public static List<SectionChange> touchedSections(String before, String after) {
        List<String> a = LineDiff.lines(before);
        List<String> b = LineDiff.lines(after);
        String[] ownerA = owners(a);
        String[] ownerB = owners(b);
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (LineDiff.Opcode op : LineDiff.opcodes(a, b)) {
            if (op.kind() == LineDiff.Kind.EQUAL) {
                continue;
            }
            for (int i = op.i1(); i < op.i2(); i++) {
                counts.computeIfAbsent(ownerA[i], k -> new int[2])[1]++;
            }
            for (int j = op.j1(); j < op.j2(); j++) {
                counts.computeIfAbsent(ownerB[j], k -> new int[2])[0]++;
            }
        }
        List<SectionChange> out = new ArrayList<>();
        counts.forEach((name, c) -> out.add(new SectionChange(name, c[0], c[1])));
        return out;
    }

    private static String[] owners(List<String> lines) {
        String[] owner = new String[lines.size()];
        String current = "(root)";
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = FormatProfiles.TOP_LEVEL_KEY_PREFIX.matcher(lines.get(i));
            if (m.find()) {
                String line = lines.get(i);
                current = line.substring(0, line.indexOf(':')).strip();
            }
            owner[i] = current;
        }
        return owner;
    }

    static List<List<LineDiff.Opcode>> groupedOpcodes(List<LineDiff.Opcode> codes, int n) {
        List<LineDiff.Opcode> ops = new ArrayList<>(codes);
        if (ops.isEmpty()) {
            ops.add(new LineDiff.Opcode(LineDiff.Kind.EQUAL, 0, 1, 0, 1));
        }
        LineDiff.Opcode head = ops.get(0);
        if (head.kind() == LineDiff.Kind.EQUAL) {
            ops.set(0, new LineDiff.Opcode(LineDiff.Kind.EQUAL, Math.max(head.i1(), head.i2() - n), head.i2(),
                    Math.max(head.j1(), head.j2() - n), head.j2()));
        }
        LineDiff.Opcode tail = ops.get(ops.size() - 1);
        if (tail.kind() == LineDiff.Kind.EQUAL) {
            ops.set(ops.size() - 1, new LineDiff.Opcode(LineDiff.Kind.EQUAL, tail.i1(),
                    Math.min(tail.i2(), tail.i1() + n), tail.j1(), Math.min(tail.j2(), tail.j1() + n)));
        }

        List<List<LineDiff.Opcode>> groups = new ArrayList<>();
        List<LineDiff.Opcode> group = new ArrayList<>();
        for (LineDiff.Opcode op : ops) {
            int i1 = op.i1();
            int j1 = op.j1();
            if (op.kind() == LineDiff.Kind.EQUAL && op.i2() - i1 > 2 * n) {
                group.add(new LineDiff.Opcode(LineDiff.Kind.EQUAL, i1, Math.min(op.i2(), i1 + n), j1,
                        Math.min(op.j2(), j1 + n)));
                groups.add(group);
                group = new ArrayList<>();
                i1 = Math.max(i1, op.i2() - n);
                j1 = Math.max(j1, op.j2() - n);
            }
            group.add(new LineDiff.Opcode(op.kind(), i1, op.i2(), j1, op.j2()));
        }
        if (!group.isEmpty() && !(group.size() == 1 && group.get(0).kind() == LineDiff.Kind.EQUAL)) {
            groups.add(group);
        }
        return groups;
    }

    private static String range(int start, int stop) {
        int beginning = start + 1;
        int length = stop - start;
        if (length == 1) {
            return Integer.toString(beginning);
        }
        if (length == 0) {
            beginning--;
        }
        return beginning + "," + length;
    }

    static String normalizePath(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized.isEmpty() ? path : normalized;
    }
}
