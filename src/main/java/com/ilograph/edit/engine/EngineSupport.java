package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.doc.DocNode;
import com.ilograph.edit.doc.DocScalar;
import com.ilograph.edit.index.ReferenceField;
import com.ilograph.edit.index.ReferenceFields;
import com.ilograph.edit.ref.ReferenceParser;
import com.ilograph.edit.ref.ReferenceRewriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Shared argument checks and small tree helpers for the operation classes.
 */
final class EngineSupport {
    static final String NONE_TOKEN = "none";

    private EngineSupport() {
        // Utility class
    }

    /** True when the user means "no parent". */
    static boolean isNone(String value) {
        return value != null && value.strip().toLowerCase(Locale.ROOT).equals(NONE_TOKEN);
    }

    static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new DiagramException(field + " must not be empty");
        }
        return value.strip();
    }

    /** Strips; blank input is rejected rather than treated as absent. */
    static String optional(String value, String field) {
        return value == null ? null : required(value, field);
    }

    /** A new resource id: non-blank and free of reference syntax characters. */
    static String cleanId(String value, String field) {
        String id = required(value, field);
        Character bad = ReferenceParser.firstRestrictedChar(id);
        if (bad != null) {
            throw new DiagramException(field + " contains restricted character '" + bad + "'");
        }
        return id;
    }

    /** Converts a 1-based insert position (size + 1 means append) to a list index. */
    static int insertIndex(int index1, int size) {
        return checkIndex(index1, size + 1);
    }

    /** Converts a 1-based position of an existing element to a list index. */
    static int existingIndex(int index1, int size) {
        return checkIndex(index1, size);
    }

    private static int checkIndex(int index1, int max) {
        if (index1 < 1) {
            throw new DiagramException("index must be >= 1");
        }
        if (index1 > max) {
            throw new DiagramException("index out of range: " + index1);
        }
        return index1 - 1;
    }

    /** Appends, or inserts at a 1-based position when one is given. */
    static void place(DocList list, DocNode node, Integer index1) {
        if (index1 == null) {
            list.add(node);
        } else {
            list.add(insertIndex(index1, list.size()), node);
        }
    }

    /** Comma-separated identifier list, as used by {@code extends}. */
    static List<String> splitTokens(String raw) {
        List<String> out = new ArrayList<>();
        for (String t : raw.split(",")) {
            if (!t.isBlank()) {
                out.add(t.strip());
            }
        }
        return out;
    }

    /**
     * Value fingerprint of a mapping's direct entries, for changed/unchanged
     * detection around in-place edits.
     */
    static List<String> snapshot(DocMap map) {
        List<String> out = new ArrayList<>();
        for (DocMap.Entry e : map.entries()) {
            out.add(e.name() + "=" + render(e.value()));
        }
        return out;
    }

    private static String render(DocNode node) {
        if (node instanceof DocScalar s) {
            return s.tag().getValue() + ":" + s.value();
        }
        return node.getClass().getSimpleName() + "#" + node.nodeId();
    }

    /** Sets or removes a string entry. Returns whether the mapping changed. */
    static boolean setOrClear(DocMap map, String key, String value, boolean clear) {
        if (clear) {
            return map.remove(key) != null;
        }
        if (value != null && !Objects.equals(map.getString(key), value)) {
            map.putString(key, value);
            return true;
        }
        return false;
    }

    /**
     * Rewrites {@code oldId} to {@code newId} in every reference field and in
     * every string value of every context.
     */
    static void rewriteReferences(DocMap document, String oldId, String newId) {
        for (ReferenceField field : ReferenceFields.all(document)) {
            String value = field.value();
            String updated = ReferenceRewriter.replaceIdentifier(value, oldId, newId);
            if (!updated.equals(value)) {
                field.setValue(updated);
            }
        }
        DocList contexts = document.getList("contexts");
        if (contexts == null) {
            return;
        }
        for (DocMap context : contexts.maps()) {
            for (String key : context.keys()) {
                String value = context.getString(key);
                if (value == null) {
                    continue;
                }
                String updated = ReferenceRewriter.replaceIdentifier(value, oldId, newId);
                if (!updated.equals(value)) {
                    context.putString(key, updated);
                }
            }
        }
    }

    /** YAML boolean value of a scalar, or null when the node is not a boolean. */
    static Boolean booleanValue(DocNode node) {
        if (node instanceof DocScalar s && s.isBoolean()) {
            return switch (s.value().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "y", "on" -> Boolean.TRUE;
                default -> Boolean.FALSE;
            };
        }
        return null;
    }

    /** Writes a string or boolean template value. */
    static void putValue(DocMap map, String key, Object value) {
        if (value instanceof Boolean b) {
            map.putBoolean(key, b);
        } else {
            map.putString(key, String.valueOf(value));
        }
    }

    // ── extends lists ────────────────────────────────────────────────

    /** Names of the nodes whose {@code extends} lists {@code target}. */
    static List<String> extendsReferrers(List<DocMap> nodes, Function<DocMap, String> naming, String target) {
        List<String> out = new ArrayList<>();
        for (DocMap node : nodes) {
            String ext = node.getString("extends");
            if (ext != null && splitTokens(ext).contains(target)) {
                out.add(naming.apply(node));
            }
        }
        return out;
    }

    /** Drops {@code target} from every {@code extends}; an emptied list removes the key. */
    static void removeFromExtends(List<DocMap> nodes, String target) {
        for (DocMap node : nodes) {
            String ext = node.getString("extends");
            if (ext == null) {
                continue;
            }
            List<String> tokens = splitTokens(ext);
            if (!tokens.remove(target)) {
                continue;
            }
            if (tokens.isEmpty()) {
                node.remove("extends");
            } else {
                node.putString("extends", String.join(", ", tokens));
            }
        }
    }

    static void rewriteExtends(List<DocMap> nodes, String oldName, String newName) {
        for (DocMap node : nodes) {
            String ext = node.getString("extends");
            if (ext == null) {
                continue;
            }
            String rewritten = ReferenceRewriter.replaceIdentifier(ext, oldName, newName);
            if (!rewritten.equals(ext)) {
                node.putString("extends", rewritten);
            }
        }
    }

    /** Moves the element at {@code from} to the 1-based position {@code index1} of existing slots. */
    static boolean reorder(DocList list, int from, int index1) {
        int destination = existingIndex(index1, list.size());
        if (destination == from) {
            return false;
        }
        DocNode node = list.remove(from);
        list.add(destination, node);
        return true;
    }

    /** Numeric value of an int or float scalar, else null. */
    static Double numberValue(DocNode node) {
        if (node instanceof DocScalar s && !s.isString() && !s.isNull() && !s.isBoolean()) {
            try {
                return Double.valueOf(s.value().replace("_", ""));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Index of the first mapping whose string {@code key} equals {@code value}, or -1. */
    static int indexOfEntry(DocList list, String key, String value) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) instanceof DocMap m && value.equals(m.getString(key))) {
                return i;
            }
        }
        return -1;
    }
}
