package com.ilograph.edit.ref;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Boundary-safe identifier substitution inside reference strings.
 *
 * <p>
 * An occurrence of the old identifier is replaced only when neither
 * neighbouring character belongs to {@code [A-Za-z0-9_.:-]}, so renaming
 * {@code db} never touches {@code db_replica} or {@code ns::db}.
 */
public final class ReferenceRewriter {
    private static final String BOUNDARY = "A-Za-z0-9_.:\\-";

    private ReferenceRewriter() {
        // Utility class
    }

    public static String replaceIdentifier(String raw, String oldId, String newId) {
        if (oldId.equals(newId) || oldId.isEmpty()) {
            return raw;
        }
        return pattern(oldId).matcher(raw).replaceAll(Matcher.quoteReplacement(newId));
    }

    /** True when {@code raw} holds a boundary-delimited occurrence of {@code id}. */
    public static boolean mentions(String raw, String id) {
        return !id.isEmpty() && pattern(id).matcher(raw).find();
    }

    private static Pattern pattern(String id) {
        return Pattern.compile("(?<![" + BOUNDARY + "])" + Pattern.quote(id) + "(?![" + BOUNDARY + "])");
    }
}
