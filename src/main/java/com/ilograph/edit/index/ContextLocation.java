package com.ilograph.edit.index;

import com.ilograph.edit.doc.DocMap;

/** A context and its position in {@code contexts}. */
public record ContextLocation(String name, DocMap node, int index) {
    public String path() {
        return "contexts[" + index + "]";
    }
}
