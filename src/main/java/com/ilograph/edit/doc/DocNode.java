package com.ilograph.edit.doc;

import org.yaml.snakeyaml.comments.CommentLine;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base of the editable document tree.
 *
 * <p>
 * Every node receives a process-unique integer id when constructed. Loaded
 * nodes get theirs at parse time; the id survives moves and is what anchor
 * snapshots are keyed by. Formatting data (anchor label, comments, tag) is
 * carried as sidecar metadata and never mixed into the value.
 */
public abstract class DocNode {
    private static final AtomicInteger NEXT_ID = new AtomicInteger(1);

    private final int nodeId;
    private Tag tag;
    private String anchor;
    private List<CommentLine> blockComments = List.of();
    private List<CommentLine> inlineComments = List.of();
    private List<CommentLine> endComments = List.of();

    protected DocNode(Tag tag) {
        this.nodeId = NEXT_ID.getAndIncrement();
        this.tag = tag;
    }

    public final int nodeId() {
        return nodeId;
    }

    public Tag tag() {
        return tag;
    }

    public void setTag(Tag tag) {
        this.tag = tag;
    }

    public String anchor() {
        return anchor;
    }

    public void setAnchor(String anchor) {
        this.anchor = anchor;
    }

    public List<CommentLine> blockComments() {
        return blockComments;
    }

    public void setBlockComments(List<CommentLine> comments) {
        this.blockComments = comments == null ? List.of() : comments;
    }

    public List<CommentLine> inlineComments() {
        return inlineComments;
    }

    public void setInlineComments(List<CommentLine> comments) {
        this.inlineComments = comments == null ? List.of() : comments;
    }

    public List<CommentLine> endComments() {
        return endComments;
    }

    public void setEndComments(List<CommentLine> comments) {
        this.endComments = comments == null ? List.of() : comments;
    }

    /**
     * Structural copy with fresh node ids. Comments and anchors are copied;
     * callers that insert the copy next to its source clear anchors with
     * {@link DocTrees#clearAnchors(DocNode)}.
     */
    public abstract DocNode deepCopy();

    protected final void copyMetadataTo(DocNode target) {
        target.tag = tag;
        target.anchor = anchor;
        target.blockComments = new ArrayList<>(blockComments);
        target.inlineComments = new ArrayList<>(inlineComments);
        target.endComments = new ArrayList<>(endComments);
    }
}
