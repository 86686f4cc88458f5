package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.doc.DocTrees;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;

import java.util.List;

/**
 * Perspective-level operations. Perspectives are looked up by identifier
 * (id, else name). Renaming or deleting one keeps the {@code extends} lists
 * of the others consistent.
 */
public final class PerspectiveOps {
    private PerspectiveOps() {
        // Utility class
    }

    public static List<PerspectiveRow> list(DocMap document) {
        return DocumentIndex.perspectives(document).stream()
                .map(p -> new PerspectiveRow(p.index() + 1, p.identifier(), p.node().getString("id"),
                        p.node().getString("name"), p.node().getString("extends"),
                        p.node().getString("orientation"), p.node().getList("relations") != null,
                        p.node().getMap("sequence") != null))
                .toList();
    }

    /** Inserts a new perspective; {@code index1} null appends. */
    public static boolean create(DocMap document, String id, String name, String extendsList, String orientation,
            Integer index1) {
        String newId = EngineSupport.required(id, "id");
        String displayName = EngineSupport.required(name, "name");
        requireNewIdentifier(document, newId);
        if (extendsList != null) {
            for (String token : EngineSupport.splitTokens(extendsList)) {
                DocumentIndex.singlePerspective(document, token);
            }
        }
        DocMap perspective = new DocMap();
        perspective.putString("id", newId);
        perspective.putString("name", displayName);
        if (extendsList != null) {
            perspective.putString("extends", extendsList);
        }
        if (orientation != null) {
            perspective.putString("orientation", orientation);
        }
        EngineSupport.place(document.ensureList("perspectives"), perspective, index1);
        return true;
    }

    /** Changes the id and/or name. An id change is propagated into every {@code extends}. */
    public static boolean rename(DocMap document, String perspective, String newId, String newName) {
        if (newId == null && newName == null) {
            throw new DiagramException("set --new-id or --new-name");
        }
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        DocMap node = loc.node();
        List<String> before = EngineSupport.snapshot(node);
        if (newId != null && !newId.equals(loc.identifier())) {
            requireNewIdentifier(document, newId);
            node.putString("id", newId);
            EngineSupport.rewriteExtends(nodes(document), loc.identifier(), newId);
        }
        if (newName != null) {
            node.putString("name", newName);
        }
        return !before.equals(EngineSupport.snapshot(node));
    }

    /** Removes a perspective. With {@code force}, references in {@code extends} are dropped too. */
    public static boolean delete(DocMap document, String perspective, boolean force) {
        DocList perspectives = requirePerspectives(document);
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        List<String> blockers = EngineSupport.extendsReferrers(nodes(document), DocumentIndex::identifier,
                loc.identifier());
        if (!blockers.isEmpty() && !force) {
            throw new DiagramException("perspective is referenced in extends; pass --force to remove references ("
                    + String.join(", ", blockers) + ")");
        }
        perspectives.remove(loc.index());
        if (force) {
            EngineSupport.removeFromExtends(nodes(document), loc.identifier());
        }
        return true;
    }

    public static boolean reorder(DocMap document, String perspective, int index1) {
        DocList perspectives = requirePerspectives(document);
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        return EngineSupport.reorder(perspectives, loc.index(), index1);
    }

    /** Deep-copies a perspective under a new id; anchors in the copy are cleared. */
    public static boolean copy(DocMap document, String perspective, String newId, String newName, Integer index1) {
        String id = EngineSupport.required(newId, "new-id");
        requireNewIdentifier(document, id);
        PerspectiveLocation source = DocumentIndex.singlePerspective(document, perspective);
        DocMap copy = source.node().deepCopy();
        DocTrees.clearAnchors(copy);
        copy.putString("id", id);
        if (newName != null) {
            copy.putString("name", newName);
        }
        EngineSupport.place(document.ensureList("perspectives"), copy, index1);
        return true;
    }

    private static DocList requirePerspectives(DocMap document) {
        DocList perspectives = document.getList("perspectives");
        if (perspectives == null) {
            throw new DiagramException("diagram has no perspectives");
        }
        return perspectives;
    }

    private static void requireNewIdentifier(DocMap document, String candidate) {
        for (PerspectiveLocation p : DocumentIndex.perspectives(document)) {
            if (p.identifier().equals(candidate)) {
                throw new DiagramException("perspective id already exists: " + candidate);
            }
        }
    }

    private static List<DocMap> nodes(DocMap document) {
        return DocumentIndex.perspectives(document).stream().map(PerspectiveLocation::node).toList();
    }
}
