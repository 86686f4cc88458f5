package com.ilograph.edit.index;

import java.util.List;

/**
 * Declarative registry of reference-bearing keys, scoped by document section.
 */
public enum ReferenceSection {
    /** Imported type path; yielded for impact and rename, never validated. */
    RESOURCE_INSTANCE_OF("resource.instanceOf", List.of("instanceOf")),
    RELATIONS("relations", List.of("from", "to", "via")),
    OVERRIDES("overrides", List.of("resourceId", "parentId")),
    ALIASES("aliases", List.of("for")),
    WALKTHROUGH("walkthrough",
            List.of("select", "expand", "hide", "focus", "highlight", "include", "exclude", "root", "center",
                    "zoomTo")),
    /** {@code sequence.start}; step keys are listed in {@link #STEP_KEYS}. */
    SEQUENCE("sequence", List.of("start")),
    /** Context {@code extends}: names other contexts rather than resources. */
    CONTEXTS("contexts", List.of("extends"));

    /** Reference keys of a sequence step, nested sub-sequences included. */
    public static final List<String> STEP_KEYS = List.of("to", "toAndBack", "toAsync", "restartAt");

    private final String label;
    private final List<String> keys;

    ReferenceSection(String label, List<String> keys) {
        this.label = label;
        this.keys = keys;
    }

    public String label() {
        return label;
    }

    public List<String> keys() {
        return keys;
    }
}
