package com.ilograph.edit.engine;

/** Listing entry for one context; {@code index} is 1-based. */
public record ContextRow(int index, String name, String extendsList, boolean hidden, boolean hasRoots) {
}
