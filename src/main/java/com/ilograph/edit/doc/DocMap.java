package com.ilograph.edit.doc;

import org.yaml.snakeyaml.DumperOptions.FlowStyle;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered mapping node.
 *
 * <p>
 * Keys are nodes themselves so that comments attached to a key line survive a
 * round trip. Lookups by name match string-valued scalar keys only.
 */
public final class DocMap extends DocNode {
    private final List<Entry> entries = new ArrayList<>();
    private FlowStyle flowStyle;

    public DocMap() {
        this(FlowStyle.BLOCK);
    }

    public DocMap(FlowStyle flowStyle) {
        super(Tag.MAP);
        this.flowStyle = flowStyle;
    }

    /** One key/value pair. The value is replaceable in place. */
    public static final class Entry {
        private final DocNode key;
        private DocNode value;

        Entry(DocNode key, DocNode value) {
            this.key = key;
            this.value = value;
        }

        public DocNode key() {
            return key;
        }

        public DocNode value() {
            return value;
        }

        /** Key text for scalar keys, null otherwise. */
        public String name() {
            return key instanceof DocScalar s ? s.value() : null;
        }
    }

    public FlowStyle flowStyle() {
        return flowStyle;
    }

    public void setFlowStyle(FlowStyle flowStyle) {
        this.flowStyle = flowStyle;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<String> keys() {
        List<String> out = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            if (e.name() != null) {
                out.add(e.name());
            }
        }
        return out;
    }

    private Entry entry(String key) {
        for (Entry e : entries) {
            if (key.equals(e.name())) {
                return e;
            }
        }
        return null;
    }

    public boolean containsKey(String key) {
        return entry(key) != null;
    }

    public DocNode get(String key) {
        Entry e = entry(key);
        return e == null ? null : e.value;
    }

    /** Raw text of a string-valued entry; null when absent or not a string. */
    public String getString(String key) {
        return get(key) instanceof DocScalar s && s.isString() ? s.value() : null;
    }

    /** Trimmed non-blank text of a string-valued entry, else null. */
    public String getTrimmed(String key) {
        String raw = getString(key);
        if (raw == null) {
            return null;
        }
        String t = raw.trim();
        return t.isEmpty() ? null : t;
    }

    public DocMap getMap(String key) {
        return get(key) instanceof DocMap m ? m : null;
    }

    public DocList getList(String key) {
        return get(key) instanceof DocList l ? l : null;
    }

    /** Returns the list stored under {@code key}, creating (or replacing a non-list) as needed. */
    public DocList ensureList(String key) {
        DocList existing = getList(key);
        if (existing != null) {
            return existing;
        }
        DocList created = new DocList();
        put(key, created);
        return created;
    }

    /** Appends a new entry, or replaces the value of the existing one in place. */
    public void put(String key, DocNode value) {
        Entry e = entry(key);
        if (e != null) {
            e.value = value;
            return;
        }
        entries.add(new Entry(DocScalar.ofString(key), value));
    }

    /** Inserts a new entry at {@code index}; an existing key is updated where it is. */
    public void put(int index, String key, DocNode value) {
        Entry e = entry(key);
        if (e != null) {
            e.value = value;
            return;
        }
        entries.add(Math.max(0, Math.min(index, entries.size())), new Entry(DocScalar.ofString(key), value));
    }

    /**
     * Sets a string value. An existing scalar is updated in place so its
     * quoting, anchor and comments are kept.
     */
    public void putString(String key, String value) {
        if (get(key) instanceof DocScalar s) {
            s.setValue(value);
            s.setTag(Tag.STR);
            return;
        }
        put(key, DocScalar.ofString(value));
    }

    public void putBoolean(String key, boolean value) {
        if (get(key) instanceof DocScalar s) {
            s.setValue(Boolean.toString(value));
            s.setTag(Tag.BOOL);
            return;
        }
        put(key, DocScalar.ofBoolean(value));
    }

    public void putNumber(String key, Number value) {
        DocScalar fresh = DocScalar.ofNumber(value);
        if (get(key) instanceof DocScalar s) {
            s.setValue(fresh.value());
            s.setTag(fresh.tag());
            return;
        }
        put(key, fresh);
    }

    /** Removes an entry; returns its former value or null. */
    public DocNode remove(String key) {
        for (int i = 0; i < entries.size(); i++) {
            if (key.equals(entries.get(i).name())) {
                return entries.remove(i).value;
            }
        }
        return null;
    }

    /** Adds a raw entry; used by the YAML bridge for non-string keys. */
    public void addEntry(DocNode key, DocNode value) {
        entries.add(new Entry(key, value));
    }

    @Override
    public DocMap deepCopy() {
        DocMap copy = new DocMap(flowStyle);
        copyMetadataTo(copy);
        for (Entry e : entries) {
            copy.entries.add(new Entry(e.key.deepCopy(), e.value.deepCopy()));
        }
        return copy;
    }
}
