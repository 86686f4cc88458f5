package com.ilograph.edit.engine;

/** One relation as listed, with its 1-based position in its perspective. */
public record RelationRow(String perspective, int index, String from, String to, String via, String label,
        String description, String arrowDirection, String color, boolean secondary) {
}
