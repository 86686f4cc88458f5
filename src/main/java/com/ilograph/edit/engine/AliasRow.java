package com.ilograph.edit.engine;

/** One alias of a perspective; {@code index} is 1-based. */
public record AliasRow(String perspective, int index, String alias, String target) {
}
