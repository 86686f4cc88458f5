package com.ilograph.edit.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Allowed values of a relation's {@code arrowDirection}. */
public enum ArrowDirection {
    FORWARD("forward"),
    BACKWARD("backward"),
    BIDIRECTIONAL("bidirectional");

    private final String label;

    ArrowDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ArrowDirection fromString(String s) {
        for (ArrowDirection d : values()) {
            if (d.label.equalsIgnoreCase(s.trim())) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown arrowDirection: " + s
                + " (expected forward, backward or bidirectional)");
    }
}
