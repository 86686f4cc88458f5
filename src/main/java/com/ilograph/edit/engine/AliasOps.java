package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;

import java.util.ArrayList;
import java.util.List;

/** Perspective aliases, addressed by alias name. */
public final class AliasOps {
    private static final String ALIAS = "alias";
    private static final String FOR = "for";

    private AliasOps() {
        // Utility class
    }

    public static List<AliasRow> list(DocMap document, String perspective) {
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        List<AliasRow> rows = new ArrayList<>();
        DocList aliases = loc.node().getList("aliases");
        if (aliases == null) {
            return rows;
        }
        for (int i = 0; i < aliases.size(); i++) {
            if (aliases.get(i) instanceof DocMap item && item.getString(ALIAS) != null) {
                rows.add(new AliasRow(loc.identifier(), i + 1, item.getString(ALIAS), item.getString(FOR)));
            }
        }
        return rows;
    }

    public static boolean add(DocMap document, String perspective, String alias, String target, Integer index1) {
        String name = EngineSupport.required(alias, "alias");
        String expression = EngineSupport.required(target, "for");
        DocMap node = DocumentIndex.singlePerspective(document, perspective).node();
        DocList existing = node.getList("aliases");
        if (existing != null && EngineSupport.indexOfEntry(existing, ALIAS, name) >= 0) {
            throw new DiagramException("alias already exists: " + name);
        }
        if (index1 != null && existing == null) {
            EngineSupport.insertIndex(index1, 0);
        }
        DocMap entry = new DocMap();
        entry.putString(ALIAS, name);
        entry.putString(FOR, expression);
        EngineSupport.place(node.ensureList("aliases"), entry, index1);
        return true;
    }

    /** Renames an alias and/or points it at a new expression. */
    public static boolean edit(DocMap document, String perspective, String alias, String newAlias, String newFor) {
        if (newAlias == null && newFor == null) {
            throw new DiagramException("set --new-alias or --new-for");
        }
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        DocList aliases = requireAliases(loc);
        int index = find(aliases, alias);
        DocMap target = (DocMap) aliases.get(index);

        if (newAlias != null && !newAlias.equals(alias)) {
            int clash = EngineSupport.indexOfEntry(aliases, ALIAS, newAlias);
            if (clash >= 0 && clash != index) {
                throw new DiagramException("alias already exists: " + newAlias);
            }
        }
        boolean changed = false;
        if (newAlias != null && !newAlias.equals(alias)) {
            target.putString(ALIAS, newAlias);
            changed = true;
        }
        if (newFor != null && !newFor.equals(target.getString(FOR))) {
            target.putString(FOR, newFor);
            changed = true;
        }
        return changed;
    }

    public static boolean remove(DocMap document, String perspective, String alias) {
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        DocList aliases = requireAliases(loc);
        aliases.remove(find(aliases, alias));
        return true;
    }

    private static DocList requireAliases(PerspectiveLocation loc) {
        DocList aliases = loc.node().getList("aliases");
        if (aliases == null) {
            throw new DiagramException("perspective has no aliases: " + loc.identifier());
        }
        return aliases;
    }

    private static int find(DocList aliases, String alias) {
        int index = EngineSupport.indexOfEntry(aliases, ALIAS, alias);
        if (index < 0) {
            throw new DiagramException("alias not found: " + alias);
        }
        return index;
    }
}
