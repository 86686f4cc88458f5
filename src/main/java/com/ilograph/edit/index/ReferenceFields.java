package com.ilograph.edit.index;

import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates every reference-bearing string field of a document according to
 * {@link ReferenceSection}.
 */
public final class ReferenceFields {
    private ReferenceFields() {
        // Utility class
    }

    /** All reference fields, {@code instanceOf} included. */
    public static List<ReferenceField> all(DocMap document) {
        return collect(document, true);
    }

    /** Fields subject to broken-reference validation ({@code instanceOf} excluded). */
    public static List<ReferenceField> validated(DocMap document) {
        return collect(document, false);
    }

    public static List<ReferenceField> collect(DocMap document, boolean includeInstanceOf) {
        List<ReferenceField> out = new ArrayList<>();

        DocList resources = document.getList("resources");
        if (resources != null && includeInstanceOf) {
            resourceFields(resources, "resources", out);
        }

        DocList perspectives = document.getList("perspectives");
        if (perspectives != null) {
            for (int i = 0; i < perspectives.size(); i++) {
                if (perspectives.get(i) instanceof DocMap p) {
                    perspectiveFields(p, DocumentIndex.identifier(p), "perspectives[" + i + "]", out);
                }
            }
        }

        DocList contexts = document.getList("contexts");
        if (contexts != null) {
            for (int i = 0; i < contexts.size(); i++) {
                if (contexts.get(i) instanceof DocMap c) {
                    addKeys(c, ReferenceSection.CONTEXTS.keys(), "contexts[" + i + "]", null,
                            ReferenceSection.CONTEXTS, out);
                }
            }
        }
        return out;
    }

    private static void resourceFields(DocList resources, String base, List<ReferenceField> out) {
        for (int i = 0; i < resources.size(); i++) {
            if (!(resources.get(i) instanceof DocMap r)) {
                continue;
            }
            String path = base + "[" + i + "]";
            addKeys(r, ReferenceSection.RESOURCE_INSTANCE_OF.keys(), path, null,
                    ReferenceSection.RESOURCE_INSTANCE_OF, out);
            DocList children = r.getList("children");
            if (children != null) {
                resourceFields(children, path + ".children", out);
            }
        }
    }

    private static void perspectiveFields(DocMap p, String perspective, String base, List<ReferenceField> out) {
        listFields(p, "relations", ReferenceSection.RELATIONS, perspective, base, out);
        listFields(p, "overrides", ReferenceSection.OVERRIDES, perspective, base, out);
        listFields(p, "aliases", ReferenceSection.ALIASES, perspective, base, out);
        listFields(p, "walkthrough", ReferenceSection.WALKTHROUGH, perspective, base, out);

        DocMap sequence = p.getMap("sequence");
        if (sequence != null) {
            String seqPath = base + ".sequence";
            addKeys(sequence, ReferenceSection.SEQUENCE.keys(), seqPath, perspective, ReferenceSection.SEQUENCE,
                    out);
            DocList steps = sequence.getList("steps");
            if (steps != null) {
                stepFields(steps, perspective, seqPath + ".steps", out);
            }
        }
    }

    private static void listFields(DocMap p, String listKey, ReferenceSection section, String perspective,
            String base, List<ReferenceField> out) {
        DocList list = p.getList(listKey);
        if (list == null) {
            return;
        }
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) instanceof DocMap item) {
                addKeys(item, section.keys(), base + "." + listKey + "[" + i + "]", perspective, section, out);
            }
        }
    }

    private static void stepFields(DocList steps, String perspective, String base, List<ReferenceField> out) {
        for (int i = 0; i < steps.size(); i++) {
            if (!(steps.get(i) instanceof DocMap step)) {
                continue;
            }
            String stepPath = base + "[" + i + "]";
            addKeys(step, ReferenceSection.STEP_KEYS, stepPath, perspective, ReferenceSection.SEQUENCE, out);
            DocMap sub = step.getMap("subSequence");
            if (sub != null && sub.getList("steps") != null) {
                stepFields(sub.getList("steps"), perspective, stepPath + ".subSequence.steps", out);
            }
        }
    }

    private static void addKeys(DocMap container, List<String> keys, String path, String perspective,
            ReferenceSection section, List<ReferenceField> out) {
        // Walk the container's own key order so fields come out in document order.
        for (String key : container.keys()) {
            if (keys.contains(key) && container.getString(key) != null) {
                out.add(new ReferenceField(container, key, path + "." + key, perspective, section));
            }
        }
    }
}
