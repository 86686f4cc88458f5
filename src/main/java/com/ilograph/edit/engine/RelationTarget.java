package com.ilograph.edit.engine;

import java.util.List;

/**
 * Where a match-many relation operation applies.
 *
 * @param perspectives perspective identifiers; null selects every perspective
 * @param contexts     context names expanding {@code {context}}; null for none
 */
public record RelationTarget(List<String> perspectives, List<String> contexts) {

    public static RelationTarget allPerspectives() {
        return new RelationTarget(null, null);
    }

    public static RelationTarget of(List<String> perspectives) {
        return new RelationTarget(List.copyOf(perspectives), null);
    }

    public RelationTarget withContexts(List<String> names) {
        return new RelationTarget(perspectives, names == null ? null : List.copyOf(names));
    }

    public boolean isAllPerspectives() {
        return perspectives == null;
    }
}
