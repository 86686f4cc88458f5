package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/** Editable relation keys. Declaration order is the order keys are written. */
public enum RelationField {
    FROM("from"),
    TO("to"),
    VIA("via"),
    LABEL("label"),
    DESCRIPTION("description"),
    ARROW_DIRECTION("arrowDirection"),
    COLOR("color"),
    SECONDARY("secondary");

    private final String key;

    RelationField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static RelationField fromKey(String key) {
        for (RelationField f : values()) {
            if (f.key.equals(key)) {
                return f;
            }
        }
        return null;
    }

    /** Parses clear-field names, reporting every unknown one at once. */
    public static List<RelationField> parseAll(List<String> keys) {
        List<RelationField> out = new ArrayList<>();
        StringJoiner invalid = new StringJoiner(", ");
        for (String key : keys) {
            RelationField f = fromKey(key);
            if (f == null) {
                invalid.add(key);
            } else {
                out.add(f);
            }
        }
        if (invalid.length() > 0) {
            StringJoiner allowed = new StringJoiner(", ");
            Arrays.stream(values()).map(RelationField::key).sorted().forEach(allowed::add);
            throw new DiagramException("invalid clear field(s): " + invalid + " (allowed: " + allowed + ")");
        }
        return out;
    }
}
