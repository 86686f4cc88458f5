package com.ilograph.edit.io;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line alignment based on Myers' O(ND) shortest-edit-script algorithm.
 *
 * <p>
 * Output is a list of opcodes in the form popularised by Python's difflib:
 * each opcode covers {@code before[i1, i2)} and {@code after[j1, j2)}. A run
 * of deletions and insertions between two equal stretches is reported as one
 * {@link Kind#REPLACE}.
 */
public final class LineDiff {
    private LineDiff() {
        // Utility class
    }

    public enum Kind {
        EQUAL, REPLACE, INSERT, DELETE
    }

    public record Opcode(Kind kind, int i1, int i2, int j1, int j2) {
    }

    /** Splits on {@code \n}, dropping a trailing {@code \r} and the empty tail after a final newline. */
    public static List<String> lines(String text) {
        List<String> out = new ArrayList<>();
        if (text.isEmpty()) {
            return out;
        }
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                out.add(stripCr(text.substring(start, i)));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            out.add(stripCr(text.substring(start)));
        }
        return out;
    }

    private static String stripCr(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    public static List<Opcode> opcodes(List<String> a, List<String> b) {
        int prefix = 0;
        while (prefix < a.size() && prefix < b.size() && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < a.size() - prefix && suffix < b.size() - prefix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }

        // true = line kept; per side
        boolean[] keptA = new boolean[a.size()];
        boolean[] keptB = new boolean[b.size()];
        Arrays.fill(keptA, 0, prefix, true);
        Arrays.fill(keptB, 0, prefix, true);
        Arrays.fill(keptA, a.size() - suffix, a.size(), true);
        Arrays.fill(keptB, b.size() - suffix, b.size(), true);
        myers(a.subList(prefix, a.size() - suffix), b.subList(prefix, b.size() - suffix), keptA, keptB, prefix);

        return group(keptA, keptB);
    }

    private static void myers(List<String> a, List<String> b, boolean[] keptA, boolean[] keptB, int offset) {
        int n = a.size();
        int m = b.size();
        if (n == 0 || m == 0) {
            return;
        }
        int max = n + m;
        int[] v = new int[2 * max + 2];
        List<int[]> trace = new ArrayList<>();

        search:
        for (int d = 0; d <= max; d++) {
            trace.add(v.clone());
            for (int k = -d; k <= d; k += 2) {
                int x;
                if (k == -d || (k != d && v[max + k - 1] < v[max + k + 1])) {
                    x = v[max + k + 1];
                } else {
                    x = v[max + k - 1] + 1;
                }
                int y = x - k;
                while (x < n && y < m && a.get(x).equals(b.get(y))) {
                    x++;
                    y++;
                }
                v[max + k] = x;
                if (x >= n && y >= m) {
                    break search;
                }
            }
        }

        int x = n;
        int y = m;
        for (int d = trace.size() - 1; d >= 0; d--) {
            int[] vd = trace.get(d);
            int k = x - y;
            int prevK = (k == -d || (k != d && vd[max + k - 1] < vd[max + k + 1])) ? k + 1 : k - 1;
            int prevX = vd[max + prevK];
            int prevY = prevX - prevK;
            while (x > prevX && y > prevY) {
                keptA[offset + x - 1] = true;
                keptB[offset + y - 1] = true;
                x--;
                y--;
            }
            if (d == 0) {
                break;
            }
            x = prevX;
            y = prevY;
        }
    }

    private static List<Opcode> group(boolean[] keptA, boolean[] keptB) {
        List<Opcode> out = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < keptA.length || j < keptB.length) {
            if (i < keptA.length && j < keptB.length && keptA[i] && keptB[j]) {
                int i1 = i;
                int j1 = j;
                while (i < keptA.length && j < keptB.length && keptA[i] && keptB[j]) {
                    i++;
                    j++;
                }
                out.add(new Opcode(Kind.EQUAL, i1, i, j1, j));
                continue;
            }
            int i1 = i;
            int j1 = j;
            while (i < keptA.length && !keptA[i]) {
                i++;
            }
            while (j < keptB.length && !keptB[j]) {
                j++;
            }
            Kind kind = i > i1 && j > j1 ? Kind.REPLACE : (i > i1 ? Kind.DELETE : Kind.INSERT);
            out.add(new Opcode(kind, i1, i, j1, j));
        }
        return out;
    }
}
