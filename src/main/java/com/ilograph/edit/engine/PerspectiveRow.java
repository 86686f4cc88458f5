package com.ilograph.edit.engine;

/** Listing entry for one perspective; {@code index} is 1-based. */
public record PerspectiveRow(int index, String identifier, String id, String name, String extendsList,
        String orientation, boolean hasRelations, boolean hasSequence) {
}
