package com.ilograph.edit.index;

import com.ilograph.edit.doc.DocMap;

/**
 * A string entry whose value is a reference expression. Writes go through
 * the owning mapping so the scalar's formatting is kept.
 */
public final class ReferenceField {
    private final DocMap container;
    private final String key;
    private final String path;
    private final String perspective;
    private final ReferenceSection section;

    ReferenceField(DocMap container, String key, String path, String perspective, ReferenceSection section) {
        this.container = container;
        this.key = key;
        this.path = path;
        this.perspective = perspective;
        this.section = section;
    }

    public DocMap container() {
        return container;
    }

    public String key() {
        return key;
    }

    public String path() {
        return path;
    }

    /** Identifier of the owning perspective, null outside perspectives. */
    public String perspective() {
        return perspective;
    }

    public ReferenceSection section() {
        return section;
    }

    public String value() {
        String v = container.getString(key);
        return v == null ? "" : v;
    }

    public void setValue(String value) {
        container.putString(key, value);
    }

    @Override
    public String toString() {
        return path + "=" + value();
    }
}
