package com.ilograph.edit.api;

import java.util.List;

/**
 * The single user-facing failure of the editor.
 *
 * <p>
 * Raised for precondition violations, lookup failures, invariant violations,
 * malformed documents, lock conflicts and concurrent modifications. Every
 * operation that throws it leaves the document and the file untouched.
 */
public class DiagramException extends RuntimeException {
    /** Maximum number of detail lines rendered into a compound message. */
    public static final int MAX_DETAIL_LINES = 8;

    public DiagramException(String message) {
        super(message);
    }

    public DiagramException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Builds a multi-line error: the header followed by {@code - line} entries,
     * capped at {@link #MAX_DETAIL_LINES} with a {@code - ... and N more} tail.
     */
    public static DiagramException of(String header, List<String> lines) {
        return new DiagramException(compound(header, lines));
    }

    public static String compound(String header, List<String> lines) {
        StringBuilder sb = new StringBuilder(header);
        int shown = Math.min(lines.size(), MAX_DETAIL_LINES);
        for (int i = 0; i < shown; i++) {
            sb.append('\n').append("- ").append(lines.get(i));
        }
        int remaining = lines.size() - shown;
        if (remaining > 0) {
            sb.append('\n').append("- ... and ").append(remaining).append(" more");
        }
        return sb.toString();
    }
}
