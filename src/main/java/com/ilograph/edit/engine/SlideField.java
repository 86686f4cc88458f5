package com.ilograph.edit.engine;

/** Editable walkthrough slide keys. */
public enum SlideField {
    TEXT("text"),
    SELECT("select"),
    EXPAND("expand"),
    HIGHLIGHT("highlight"),
    HIDE("hide"),
    DETAIL("detail");

    private final String key;

    SlideField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static SlideField fromString(String s) {
        for (SlideField f : values()) {
            if (f.key.equals(s)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown slide field: " + s);
    }
}
