package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.doc.DocTrees;
import com.ilograph.edit.index.ContextLocation;
import com.ilograph.edit.index.DocumentIndex;

import java.util.List;
import java.util.Set;

/** Context operations. Contexts are addressed by their unique {@code name}. */
public final class ContextOps {
    private ContextOps() {
        // Utility class
    }

    public static List<ContextRow> list(DocMap document) {
        return DocumentIndex.contexts(document).stream()
                .map(c -> new ContextRow(c.index() + 1, c.node().getString("name"), c.node().getString("extends"),
                        Boolean.TRUE.equals(EngineSupport.booleanValue(c.node().get("hidden"))),
                        c.node().getList("roots") != null))
                .toList();
    }

    public static boolean create(DocMap document, String name, String extendsList, Boolean hidden, Integer index1) {
        String contextName = EngineSupport.required(name, "name");
        requireNewName(document, contextName);
        if (extendsList != null) {
            Set<String> available = DocumentIndex.contextNames(document);
            List<String> missing = EngineSupport.splitTokens(extendsList).stream()
                    .filter(t -> !available.contains(t))
                    .toList();
            if (!missing.isEmpty()) {
                throw new DiagramException("unknown extends context(s): " + String.join(", ", missing));
            }
        }
        DocMap context = new DocMap();
        context.putString("name", contextName);
        if (extendsList != null) {
            context.putString("extends", extendsList);
        }
        if (hidden != null) {
            context.putBoolean("hidden", hidden);
        }
        EngineSupport.place(document.ensureList("contexts"), context, index1);
        return true;
    }

    /** Renames a context and every {@code extends} naming it. */
    public static boolean rename(DocMap document, String name, String newName) {
        String target = EngineSupport.required(newName, "new-name");
        if (target.equals(name)) {
            return false;
        }
        requireNewName(document, target);
        ContextLocation loc = DocumentIndex.singleContext(document, name);
        loc.node().putString("name", target);
        EngineSupport.rewriteExtends(nodes(document), name, target);
        return true;
    }

    public static boolean delete(DocMap document, String name, boolean force) {
        ContextLocation loc = DocumentIndex.singleContext(document, name);
        List<String> blockers = EngineSupport.extendsReferrers(nodes(document), c -> c.getString("name"), name);
        if (!blockers.isEmpty() && !force) {
            throw new DiagramException("context is referenced in extends; pass --force to remove references ("
                    + String.join(", ", blockers) + ")");
        }
        document.getList("contexts").remove(loc.index());
        if (force) {
            EngineSupport.removeFromExtends(nodes(document), name);
        }
        return true;
    }

    public static boolean reorder(DocMap document, String name, int index1) {
        ContextLocation loc = DocumentIndex.singleContext(document, name);
        return EngineSupport.reorder(document.getList("contexts"), loc.index(), index1);
    }

    public static boolean copy(DocMap document, String name, String newName, Integer index1) {
        String target = EngineSupport.required(newName, "new-name");
        requireNewName(document, target);
        ContextLocation source = DocumentIndex.singleContext(document, name);
        DocMap copy = source.node().deepCopy();
        DocTrees.clearAnchors(copy);
        copy.putString("name", target);
        DocList contexts = document.ensureList("contexts");
        EngineSupport.place(contexts, copy, index1);
        return true;
    }

    private static void requireNewName(DocMap document, String name) {
        if (DocumentIndex.contextNames(document).contains(name)) {
            throw new DiagramException("context already exists: " + name);
        }
    }

    private static List<DocMap> nodes(DocMap document) {
        return DocumentIndex.contexts(document).stream().map(ContextLocation::node).toList();
    }
}
