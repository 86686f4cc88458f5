package com.ilograph.edit.engine;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields of a sequence step. Exactly one of the action fields ({@code to},
 * {@code toAndBack}, {@code toAsync}, {@code restartAt}) names the step's
 * target.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SequenceStep(String to, String toAndBack, String toAsync, String restartAt, String label,
        String description, Boolean bidirectional, String color) {

    public static SequenceStep to(String target) {
        return new SequenceStep(target, null, null, null, null, null, null, null);
    }

    /** Present action fields, keyed by YAML key. */
    public Map<String, String> actions() {
        Map<String, String> out = new LinkedHashMap<>();
        if (to != null) {
            out.put("to", to);
        }
        if (toAndBack != null) {
            out.put("toAndBack", toAndBack);
        }
        if (toAsync != null) {
            out.put("toAsync", toAsync);
        }
        if (restartAt != null) {
            out.put("restartAt", restartAt);
        }
        return out;
    }
}
