package com.ilograph.edit.engine;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Walkthrough slide fields; null components are absent. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Slide(String text, String select, String expand, String highlight, String hide, Double detail) {

    public boolean isEmpty() {
        return text == null && select == null && expand == null && highlight == null && hide == null
                && detail == null;
    }
}
