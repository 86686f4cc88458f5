package com.ilograph.edit.engine;

/** One override of a perspective; {@code index} is 1-based. */
public record OverrideRow(String perspective, int index, String resourceId, String parentId, Double scale) {
}
