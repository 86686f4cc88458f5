package com.ilograph.edit.index;

import com.ilograph.edit.doc.DocMap;

/** A perspective and its position in {@code perspectives}. */
public record PerspectiveLocation(String identifier, DocMap node, int index) {
    public String path() {
        return "perspectives[" + index + "]";
    }
}
