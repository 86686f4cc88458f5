package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.doc.DocTrees;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.ResourceLocation;
import lombok.extern.log4j.Log4j2;

import java.util.Set;

/**
 * Resource mutations. Resources are addressed by explicit {@code id}.
 *
 * <p>
 * Every method returns {@code true} when the document changed and throws
 * {@link DiagramException} before touching the tree when a precondition
 * fails.
 */
@Log4j2
public final class ResourceOps {
    private ResourceOps() {
        // Utility class
    }

    // ── Create / rename ──────────────────────────────────────────────

    /** Creates {@code {id, name, subtitle?}} under {@code parentId}, or at the root for {@code none}. */
    public static boolean create(DocMap document, String id, String name, String parentId, String subtitle) {
        String newId = EngineSupport.cleanId(id, "id");
        String displayName = EngineSupport.required(name, "name");
        String parent = EngineSupport.required(parentId, "parent");
        if (DocumentIndex.resourcesById(document).containsKey(newId)) {
            throw new DiagramException("resource id already exists: " + newId);
        }
        DocList target = EngineSupport.isNone(parent)
                ? DocumentIndex.ensureResources(document)
                : DocumentIndex.singleResourceById(document, parent).node().ensureList("children");

        DocMap resource = new DocMap();
        resource.putString("id", newId);
        resource.putString("name", displayName);
        if (subtitle != null) {
            resource.putString("subtitle", subtitle);
        }
        target.add(resource);
        log.debug("Created resource {} under {}", newId, parent);
        return true;
    }

    /** Sets the display name. */
    public static boolean rename(DocMap document, String id, String newName) {
        String name = EngineSupport.required(newName, "name");
        ResourceLocation loc = DocumentIndex.singleResourceById(document, EngineSupport.required(id, "id"));
        if (name.equals(loc.node().getString("name"))) {
            return false;
        }
        loc.node().putString("name", name);
        return true;
    }

    /**
     * Changes a resource's explicit id and rewrites every reference to its old
     * identifier, context strings included. The node's anchor is kept.
     */
    public static boolean renameId(DocMap document, String oldId, String newId) {
        String from = EngineSupport.required(oldId, "from");
        String to = EngineSupport.cleanId(newId, "to");
        if (from.equals(to)) {
            throw new DiagramException("old/new ids are identical (choose a different value for --to)");
        }
        if (DocumentIndex.resourcesById(document).containsKey(to)) {
            throw new DiagramException("target id already exists: " + to + " (resource ids must be unique)");
        }
        ResourceLocation loc = DocumentIndex.singleResourceById(document, from);
        String oldIdentifier = loc.identifier();
        if (oldIdentifier == null) {
            throw new DiagramException("resource has no identifier: " + from
                    + " (set an explicit id before rename)");
        }
        loc.node().putString("id", to);
        EngineSupport.rewriteReferences(document, oldIdentifier, to);
        log.debug("Renamed resource id {} -> {}", oldIdentifier, to);
        return true;
    }

    // ── Move ─────────────────────────────────────────────────────────

    /**
     * Moves a subtree to the end of {@code newParentId}'s children.
     *
     * <p>
     * Already being the last child of the target is a no-op, except that
     * {@code inheritStyleFromParent} still drops the node's own {@code style}.
     */
    public static boolean move(DocMap document, String id, String newParentId, boolean inheritStyleFromParent) {
        ResourceLocation loc = DocumentIndex.singleResourceById(document, EngineSupport.required(id, "id"));
        ResourceLocation target = DocumentIndex.singleResourceById(document,
                EngineSupport.required(newParentId, "new-parent"));

        if (loc.node() == target.node()) {
            throw new DiagramException("resource cannot be parent of itself (same --id and --new-parent)");
        }
        if (DocumentIndex.isSelfOrDescendant(loc.node(), target.node())) {
            throw new DiagramException("resource cannot be moved under its own descendant (would create a cycle)");
        }

        DocList current = target.node().getList("children");
        if (current == loc.container() && loc.index() == current.size() - 1) {
            return inheritStyleFromParent && dropStyle(loc.node());
        }

        loc.container().remove(loc.index());
        target.node().ensureList("children").add(loc.node());
        if (inheritStyleFromParent) {
            dropStyle(loc.node());
        }
        return true;
    }

    /** Moves a nested subtree to the end of the root list; roots are left alone. */
    public static boolean moveToRoot(DocMap document, String id) {
        ResourceLocation loc = DocumentIndex.singleResourceById(document, EngineSupport.required(id, "id"));
        if (loc.parent() == null) {
            return false;
        }
        loc.container().remove(loc.index());
        DocumentIndex.ensureResources(document).add(loc.node());
        return true;
    }

    private static boolean dropStyle(DocMap resource) {
        return resource.remove("style") != null;
    }

    // ── Delete / clone ───────────────────────────────────────────────

    public static boolean delete(DocMap document, String id, boolean deleteSubtree) {
        ResourceLocation loc = DocumentIndex.singleResourceById(document, EngineSupport.required(id, "id"));
        DocList children = loc.node().getList("children");
        if (children != null && !children.isEmpty() && !deleteSubtree) {
            throw new DiagramException("resource has children; pass --delete-subtree");
        }
        loc.container().remove(loc.index());
        return true;
    }

    /**
     * Deep-copies a resource with a new id.
     *
     * <p>
     * {@code newParentId} null appends beside the source, {@code none} appends
     * at the root, anything else names the new parent. With
     * {@code withChildren} the copy keeps its subtree, which must not carry
     * explicit ids already in use.
     */
    public static boolean clone(DocMap document, String id, String newId, String newParentId, String newName,
            boolean withChildren) {
        String sourceId = EngineSupport.required(id, "id");
        String cloneId = EngineSupport.cleanId(newId, "new-id");
        if (sourceId.equals(cloneId)) {
            throw new DiagramException("id/new-id are identical (choose a different value for --new-id)");
        }
        Set<String> existing = DocumentIndex.resourcesById(document).keySet();
        if (existing.contains(cloneId)) {
            throw new DiagramException("resource id already exists: " + cloneId);
        }
        ResourceLocation source = DocumentIndex.singleResourceById(document, sourceId);

        DocMap copy = source.node().deepCopy();
        DocTrees.clearAnchors(copy);
        copy.putString("id", cloneId);
        if (newName != null) {
            copy.putString("name", EngineSupport.required(newName, "new-name"));
        }
        if (!withChildren) {
            copy.remove("children");
        } else {
            for (String childId : DocumentIndex.descendantIds(copy)) {
                if (existing.contains(childId)) {
                    throw new DiagramException("cannot clone subtree with explicit child ids; conflicting id: "
                            + childId + ". Use --shallow or rename child ids after clone.");
                }
            }
        }

        DocList target;
        if (newParentId == null) {
            target = source.container();
        } else if (EngineSupport.isNone(newParentId)) {
            target = DocumentIndex.ensureResources(document);
        } else {
            target = DocumentIndex.singleResourceById(document, newParentId.strip()).node().ensureList("children");
        }
        target.add(copy);
        return true;
    }
}
