package com.ilograph.edit.api;

import com.fasterxml.jackson.annotation.JsonValue;

/** Classification of one token of a reference expression. */
public enum ResolveStatus {
    RESOLVED("resolved"),
    AMBIGUOUS("ambiguous"),
    ALIAS("alias"),
    SPECIAL("special"),
    WILDCARD("wildcard"),
    IMPORTED_NAMESPACE("imported-namespace"),
    UNRESOLVED_NAMESPACE("unresolved-namespace"),
    UNRESOLVED("unresolved"),
    EMPTY("empty");

    private final String label;

    ResolveStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
