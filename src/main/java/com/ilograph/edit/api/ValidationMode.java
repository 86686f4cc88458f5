package com.ilograph.edit.api;

/**
 * Tolerance level of the document validator.
 */
public enum ValidationMode {
    /** Write-gate mode: unresolved namespaced references are errors. */
    STRICT("strict"),
    /** Mirrors the diagram tool itself: imports are not resolved, so namespaced tokens pass. */
    ILOGRAPH_NATIVE("ilograph-native");

    private final String label;

    ValidationMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ValidationMode fromString(String s) {
        for (ValidationMode m : values()) {
            if (m.label.equalsIgnoreCase(s) || m.name().equalsIgnoreCase(s)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown validation mode: " + s);
    }
}
