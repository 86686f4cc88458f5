package com.ilograph.edit.engine;

import com.ilograph.edit.api.ImpactHit;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;
import com.ilograph.edit.index.ReferenceField;
import com.ilograph.edit.index.ReferenceFields;
import com.ilograph.edit.index.ReferenceSection;
import com.ilograph.edit.index.ResourceLocation;
import com.ilograph.edit.ref.ReferenceParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists every place an identifier is defined or mentioned: resource
 * definitions, reference fields ({@code instanceOf} included), string values
 * of contexts and perspectives carrying the same identifier.
 */
public final class ImpactAnalyzer {
    private static final String ID_OR_NAME = "id/name";

    private ImpactAnalyzer() {
        // Utility class
    }

    public static List<ImpactHit> impact(DocMap document, String identifier) {
        List<ImpactHit> hits = new ArrayList<>();
        for (ResourceLocation loc : DocumentIndex.resources(document)) {
            if (loc.identifier().equals(identifier)) {
                hits.add(new ImpactHit(null, "resource", loc.path(), ID_OR_NAME, loc.identifier()));
            }
        }

        for (ReferenceField field : ReferenceFields.all(document)) {
            // context strings are reported below with their context name
            if (field.section() != ReferenceSection.CONTEXTS
                    && ReferenceParser.containsIdentifier(field.value(), identifier)) {
                hits.add(new ImpactHit(field.perspective(), field.section().label(), field.path(), field.key(),
                        field.value()));
            }
        }

        DocList contexts = document.getList("contexts");
        if (contexts != null) {
            for (int i = 0; i < contexts.size(); i++) {
                if (!(contexts.get(i) instanceof DocMap context)) {
                    continue;
                }
                String name = context.getString("id") != null ? context.getString("id") : context.getString("name");
                String section = "contexts:" + (name != null ? name : "context[" + i + "]");
                for (String key : context.keys()) {
                    String value = context.getString(key);
                    if (value != null && ReferenceParser.containsIdentifier(value, identifier)) {
                        hits.add(new ImpactHit(null, section, "contexts[" + i + "]." + key, key, value));
                    }
                }
            }
        }

        for (PerspectiveLocation p : DocumentIndex.perspectives(document)) {
            if (p.identifier().equals(identifier)) {
                hits.add(new ImpactHit(p.identifier(), "perspective", p.path(), ID_OR_NAME, p.identifier()));
            }
        }
        return hits;
    }
}
