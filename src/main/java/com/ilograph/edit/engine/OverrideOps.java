package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Perspective overrides, addressed by {@code resourceId}. An override always
 * keeps at least one of {@code parentId} and {@code scale}.
 */
public final class OverrideOps {
    private static final String RESOURCE_ID = "resourceId";
    private static final String PARENT_ID = "parentId";
    private static final String SCALE = "scale";

    private OverrideOps() {
        // Utility class
    }

    public static List<OverrideRow> list(DocMap document, String perspective) {
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        List<OverrideRow> rows = new ArrayList<>();
        DocList overrides = loc.node().getList("overrides");
        if (overrides == null) {
            return rows;
        }
        for (int i = 0; i < overrides.size(); i++) {
            if (overrides.get(i) instanceof DocMap item && item.getString(RESOURCE_ID) != null) {
                rows.add(new OverrideRow(loc.identifier(), i + 1, item.getString(RESOURCE_ID),
                        item.getString(PARENT_ID), EngineSupport.numberValue(item.get(SCALE))));
            }
        }
        return rows;
    }

    public static boolean add(DocMap document, String perspective, String resourceId, String parentId, Double scale,
            Integer index1) {
        if (parentId == null && scale == null) {
            throw new DiagramException("override requires --parent-id or --scale");
        }
        String id = EngineSupport.required(resourceId, "resource-id");
        DocMap node = DocumentIndex.singlePerspective(document, perspective).node();
        DocList existing = node.getList("overrides");
        if (existing != null && EngineSupport.indexOfEntry(existing, RESOURCE_ID, id) >= 0) {
            throw new DiagramException("override already exists for resourceId: " + id);
        }
        if (index1 != null && existing == null) {
            EngineSupport.insertIndex(index1, 0);
        }
        DocMap entry = new DocMap();
        entry.putString(RESOURCE_ID, id);
        if (parentId != null) {
            entry.putString(PARENT_ID, parentId);
        }
        if (scale != null) {
            entry.putNumber(SCALE, scale);
        }
        EngineSupport.place(node.ensureList("overrides"), entry, index1);
        return true;
    }

    /**
     * Updates one override. Clears win over sets for the same field. The
     * result is checked before anything is written.
     */
    public static boolean edit(DocMap document, String perspective, String resourceId, String newResourceId,
            String parentId, Double scale, boolean clearParentId, boolean clearScale) {
        if (newResourceId == null && parentId == null && scale == null && !clearParentId && !clearScale) {
            throw new DiagramException("set at least one update field");
        }
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        DocList overrides = requireOverrides(loc);
        int index = find(overrides, resourceId);
        DocMap target = (DocMap) overrides.get(index);

        boolean renaming = newResourceId != null && !newResourceId.equals(resourceId);
        if (renaming) {
            int clash = EngineSupport.indexOfEntry(overrides, RESOURCE_ID, newResourceId);
            if (clash >= 0 && clash != index) {
                throw new DiagramException("override already exists for resourceId: " + newResourceId);
            }
        }
        boolean keepsParent = !clearParentId && (parentId != null || target.containsKey(PARENT_ID));
        boolean keepsScale = !clearScale && (scale != null || target.containsKey(SCALE));
        if (!keepsParent && !keepsScale) {
            throw new DiagramException("override requires parentId or scale");
        }

        boolean changed = false;
        if (renaming) {
            target.putString(RESOURCE_ID, newResourceId);
            changed = true;
        }
        if (clearParentId) {
            changed |= target.remove(PARENT_ID) != null;
        } else if (parentId != null && !parentId.equals(target.getString(PARENT_ID))) {
            target.putString(PARENT_ID, parentId);
            changed = true;
        }
        if (clearScale) {
            changed |= target.remove(SCALE) != null;
        } else if (scale != null && !Objects.equals(scale, EngineSupport.numberValue(target.get(SCALE)))) {
            target.putNumber(SCALE, scale);
            changed = true;
        }
        return changed;
    }

    public static boolean remove(DocMap document, String perspective, String resourceId) {
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        DocList overrides = requireOverrides(loc);
        overrides.remove(find(overrides, resourceId));
        return true;
    }

    private static DocList requireOverrides(PerspectiveLocation loc) {
        DocList overrides = loc.node().getList("overrides");
        if (overrides == null) {
            throw new DiagramException("perspective has no overrides: " + loc.identifier());
        }
        return overrides;
    }

    private static int find(DocList overrides, String resourceId) {
        int index = EngineSupport.indexOfEntry(overrides, RESOURCE_ID, resourceId);
        if (index < 0) {
            throw new DiagramException("override not found for resourceId: " + resourceId);
        }
        return index;
    }
}
