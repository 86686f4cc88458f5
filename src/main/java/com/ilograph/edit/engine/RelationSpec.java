package com.ilograph.edit.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ilograph.edit.api.ArrowDirection;
import com.ilograph.edit.api.DiagramException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relation field values used to create, match or patch relations. Null
 * components are absent.
 *
 * <p>
 * String values may carry the {@code {context}} placeholder, expanded once
 * per target context by {@link #render(String)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationSpec(String from, String to, String via, String label, String description,
        ArrowDirection arrowDirection, String color, Boolean secondary) {

    public static final String CONTEXT_TOKEN = "{context}";

    public static RelationSpec between(String from, String to) {
        return new RelationSpec(from, to, null, null, null, null, null, null);
    }

    /** Present values keyed by relation key, strings and booleans only. */
    public Map<String, Object> values() {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfPresent(out, RelationField.FROM, from);
        putIfPresent(out, RelationField.TO, to);
        putIfPresent(out, RelationField.VIA, via);
        putIfPresent(out, RelationField.LABEL, label);
        putIfPresent(out, RelationField.DESCRIPTION, description);
        putIfPresent(out, RelationField.ARROW_DIRECTION, arrowDirection == null ? null : arrowDirection.label());
        putIfPresent(out, RelationField.COLOR, color);
        putIfPresent(out, RelationField.SECONDARY, secondary);
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, RelationField field, Object value) {
        if (value != null) {
            out.put(field.key(), value);
        }
    }

    public boolean isEmpty() {
        return values().isEmpty();
    }

    public boolean usesContext() {
        return values().values().stream().anyMatch(v -> v instanceof String s && s.contains(CONTEXT_TOKEN));
    }

    /**
     * Values with {@code {context}} replaced. A placeholder with no context
     * to expand it is an error.
     */
    public Map<String, Object> render(String context) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values().entrySet()) {
            if (e.getValue() instanceof String s && s.contains(CONTEXT_TOKEN)) {
                if (context == null) {
                    throw new DiagramException("template contains '{context}' but target.contexts is not set "
                            + "(set target.contexts or remove template token)");
                }
                out.put(e.getKey(), s.replace(CONTEXT_TOKEN, context));
            } else {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }
}
