package com.ilograph.edit.io;

/** How block sequence items sit relative to their parent key. */
public enum SequenceIndentStyle {
    /** {@code key:} then {@code "  - item"}. */
    INDENTED,
    /** {@code key:} then {@code "- item"} at the key's own column. */
    INDENTLESS
}
