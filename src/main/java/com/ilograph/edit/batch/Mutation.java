package com.ilograph.edit.batch;

import com.ilograph.edit.doc.DocMap;

/** An in-memory edit of a loaded document; returns whether anything changed. */
@FunctionalInterface
public interface Mutation {
    boolean apply(DocMap document);
}
