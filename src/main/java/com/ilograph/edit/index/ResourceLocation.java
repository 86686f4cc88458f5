package com.ilograph.edit.index;

import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;

/**
 * Where a resource sits in the resource forest.
 *
 * @param identifier id, or trimmed name when no id is set
 * @param node       the resource mapping
 * @param parent     owning resource, null for roots
 * @param container  list holding the node ({@code resources} or a {@code children} list)
 * @param index      position inside {@code container}
 * @param path       document path, e.g. {@code resources[0].children[2]}
 */
public record ResourceLocation(String identifier, DocMap node, DocMap parent, DocList container, int index,
        String path) {

    /** Explicit id, trimmed, or null. */
    public String explicitId() {
        return node.getTrimmed("id");
    }
}
