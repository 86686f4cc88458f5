package com.ilograph.edit.doc;

import org.yaml.snakeyaml.DumperOptions.FlowStyle;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered sequence node.
 */
public final class DocList extends DocNode implements Iterable<DocNode> {
    private final List<DocNode> items = new ArrayList<>();
    private FlowStyle flowStyle;

    public DocList() {
        this(FlowStyle.BLOCK);
    }

    public DocList(FlowStyle flowStyle) {
        super(Tag.SEQ);
        this.flowStyle = flowStyle;
    }

    public FlowStyle flowStyle() {
        return flowStyle;
    }

    public void setFlowStyle(FlowStyle flowStyle) {
        this.flowStyle = flowStyle;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public DocNode get(int index) {
        return items.get(index);
    }

    public void add(DocNode node) {
        items.add(node);
    }

    public void add(int index, DocNode node) {
        items.add(index, node);
    }

    public DocNode set(int index, DocNode node) {
        return items.set(index, node);
    }

    public DocNode remove(int index) {
        return items.remove(index);
    }

    /** Removes by identity; returns the former index or -1. */
    public int removeNode(DocNode node) {
        int idx = indexOf(node);
        if (idx >= 0) {
            items.remove(idx);
        }
        return idx;
    }

    /** Identity-based index lookup. */
    public int indexOf(DocNode node) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    public List<DocNode> items() {
        return Collections.unmodifiableList(items);
    }

    /** The mapping items, in order; other item kinds are skipped. */
    public List<DocMap> maps() {
        List<DocMap> out = new ArrayList<>(items.size());
        for (DocNode n : items) {
            if (n instanceof DocMap m) {
                out.add(m);
            }
        }
        return out;
    }

    @Override
    public Iterator<DocNode> iterator() {
        return items().iterator();
    }

    @Override
    public DocList deepCopy() {
        DocList copy = new DocList(flowStyle);
        copyMetadataTo(copy);
        for (DocNode n : items) {
            copy.items.add(n.deepCopy());
        }
        return copy;
    }
}
