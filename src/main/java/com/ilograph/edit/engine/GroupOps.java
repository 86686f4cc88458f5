package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Group helpers: a group is a resource created to hold other resources. */
public final class GroupOps {
    private GroupOps() {
        // Utility class
    }

    public static boolean create(DocMap document, String id, String name, String parentId, String subtitle) {
        String groupId = EngineSupport.cleanId(id, "id");
        String displayName = EngineSupport.required(name, "name");
        String parent = EngineSupport.required(parentId, "parent");
        if (DocumentIndex.resourcesById(document).containsKey(groupId)) {
            throw new DiagramException("resource id already exists: " + groupId + " (group id must be unique)");
        }
        DocList target;
        if (EngineSupport.isNone(parent)) {
            if (document.containsKey("resources") && document.getList("resources") == null) {
                throw new DiagramException("resources is not an array/list (invalid diagram structure)");
            }
            target = DocumentIndex.ensureResources(document);
        } else {
            target = DocumentIndex.singleResourceById(document, parent).node().ensureList("children");
        }

        DocMap group = new DocMap();
        group.putString("id", groupId);
        group.putString("name", displayName);
        if (subtitle != null && !subtitle.isEmpty()) {
            group.putString("subtitle", subtitle);
        }
        target.add(group);
        return true;
    }

    /**
     * Moves each id under {@code newParentId} ({@code none} = root), in the
     * order given. All ids are looked up before the first move.
     */
    public static boolean moveMany(DocMap document, List<String> ids, String newParentId) {
        if (ids == null || ids.isEmpty()) {
            throw new DiagramException("--ids must include at least one resource id");
        }
        String parent = EngineSupport.required(newParentId, "new-parent");
        Set<String> seen = new LinkedHashSet<>();
        List<String> cleaned = new ArrayList<>();
        for (String raw : ids) {
            String id = EngineSupport.required(raw, "ids");
            if (!seen.add(id)) {
                throw new DiagramException("duplicate id in --ids: " + id + " (each resource id must appear once)");
            }
            cleaned.add(id);
        }
        for (String id : cleaned) {
            DocumentIndex.singleResourceById(document, id);
        }

        boolean changed = false;
        for (String id : cleaned) {
            boolean moved = EngineSupport.isNone(parent)
                    ? ResourceOps.moveToRoot(document, id)
                    : ResourceOps.move(document, id, parent, false);
            changed |= moved;
        }
        return changed;
    }
}
