package com.ilograph.edit.engine;

/** One sequence step as listed; {@code index} is 1-based. */
public record StepRow(String perspective, int index, String to, String toAndBack, String toAsync,
        String restartAt, String label, String description, boolean bidirectional, String color) {
}
