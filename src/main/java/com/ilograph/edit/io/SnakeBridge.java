package com.ilograph.edit.io;

import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.doc.DocNode;
import com.ilograph.edit.doc.DocScalar;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.comments.CommentLine;
import org.yaml.snakeyaml.comments.CommentType;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between SnakeYAML's composed node graph and the document model.
 *
 * <p>
 * Aliased nodes are one object in both graphs: an alias composes to the very
 * node carrying the anchor, and the identity maps keep it shared the other
 * way round. Literal and folded scalars remember their source lines; leading
 * comments of block sequence items and unchanged block scalars are handed to
 * {@link EmitPlaceholders} on the way out.
 */
final class SnakeBridge {
    private SnakeBridge() {
        // Utility class
    }

    /**
     * @param sourceLines lines of the text the node was composed from
     */
    static DocNode toDoc(Node node, List<String> sourceLines) {
        return toDoc(node, new IdentityHashMap<>(), sourceLines);
    }

    private static DocNode toDoc(Node node, Map<Node, DocNode> seen, List<String> sourceLines) {
        DocNode existing = seen.get(node);
        if (existing != null) {
            return existing;
        }
        DocNode out;
        if (node instanceof ScalarNode s) {
            DocScalar scalar = new DocScalar(s.getTag(), s.getValue(), s.getScalarStyle());
            scalar.setSourceBlock(sourceBlock(s, sourceLines));
            out = scalar;
            seen.put(node, out);
        } else if (node instanceof MappingNode m) {
            DocMap map = new DocMap(m.getFlowStyle());
            map.setTag(m.getTag());
            seen.put(node, map);
            for (NodeTuple t : m.getValue()) {
                map.addEntry(toDoc(t.getKeyNode(), seen, sourceLines), toDoc(t.getValueNode(), seen, sourceLines));
            }
            out = map;
        } else if (node instanceof SequenceNode q) {
            DocList list = new DocList(q.getFlowStyle());
            list.setTag(q.getTag());
            seen.put(node, list);
            for (Node item : q.getValue()) {
                list.add(toDoc(item, seen, sourceLines));
            }
            out = list;
        } else {
            throw new IllegalStateException("Unsupported node type: " + node.getNodeId());
        }
        out.setAnchor(node.getAnchor());
        out.setBlockComments(node.getBlockComments());
        out.setInlineComments(node.getInLineComments());
        out.setEndComments(node.getEndComments());
        return out;
    }

    /** Literal or folded source of a string scalar, or null for any other scalar. */
    private static DocScalar.SourceBlock sourceBlock(ScalarNode s, List<String> sourceLines) {
        DumperOptions.ScalarStyle style = s.getScalarStyle();
        if ((style != DumperOptions.ScalarStyle.LITERAL && style != DumperOptions.ScalarStyle.FOLDED)
                || !Tag.STR.equals(s.getTag())) {
            return null;
        }
        Mark start = s.getStartMark();
        Mark end = s.getEndMark();
        if (start == null || end == null || start.getLine() >= sourceLines.size()) {
            return null;
        }
        String header = sourceLines.get(start.getLine());
        String indicator = null;
        for (String token : header.substring(Math.min(start.getColumn(), header.length())).trim().split("\\s+")) {
            if (token.startsWith("|") || token.startsWith(">")) {
                indicator = token;
                break;
            }
        }
        if (indicator == null) {
            return null;
        }
        int last = end.getLine();
        if (last < sourceLines.size()
                && !sourceLines.get(last).substring(0, Math.min(end.getColumn(), sourceLines.get(last).length()))
                        .isBlank()) {
            last++;
        }
        List<String> lines = sourceLines.subList(start.getLine() + 1, Math.min(Math.max(last, start.getLine() + 1),
                sourceLines.size()));
        int headerIndent = 0;
        while (headerIndent < header.length() && header.charAt(headerIndent) == ' ') {
            headerIndent++;
        }
        return new DocScalar.SourceBlock(indicator, headerIndent, lines, s.getValue());
    }

    static Node toNode(DocNode doc, EmitPlaceholders placeholders) {
        return toNode(doc, new IdentityHashMap<>(), placeholders);
    }

    private static Node toNode(DocNode doc, Map<DocNode, Node> seen, EmitPlaceholders placeholders) {
        Node existing = seen.get(doc);
        if (existing != null) {
            return existing;
        }
        Node out;
        List<CommentLine> ownComments = new ArrayList<>();
        if (doc instanceof DocScalar s) {
            DocScalar.SourceBlock block = s.sourceBlock();
            out = block == null
                    ? new ScalarNode(s.tag(), s.value(), null, null, s.style())
                    : new ScalarNode(Tag.STR, placeholders.blockMarker(block), null, null,
                            DumperOptions.ScalarStyle.PLAIN);
            ownComments.addAll(doc.blockComments());
            seen.put(doc, out);
        } else if (doc instanceof DocMap m) {
            List<NodeTuple> tuples = new ArrayList<>(m.size());
            MappingNode mapping = new MappingNode(m.tag(), tuples, m.flowStyle());
            ownComments.addAll(doc.blockComments());
            seen.put(doc, mapping);
            for (DocMap.Entry e : m.entries()) {
                tuples.add(new NodeTuple(toNode(e.key(), seen, placeholders), toNode(e.value(), seen, placeholders)));
            }
            out = mapping;
        } else if (doc instanceof DocList l) {
            List<Node> items = new ArrayList<>(l.size());
            SequenceNode sequence = new SequenceNode(l.tag(), items, l.flowStyle());
            seen.put(doc, sequence);
            boolean block = l.flowStyle() != DumperOptions.FlowStyle.FLOW;
            // Own-line comments before a block sequence sit above its first item.
            List<CommentLine> aboveFirst = new ArrayList<>();
            for (CommentLine c : doc.blockComments()) {
                if (block && c.getCommentType() != CommentType.IN_LINE) {
                    aboveFirst.add(c);
                } else {
                    ownComments.add(c);
                }
            }
            for (DocNode item : l) {
                boolean fresh = !seen.containsKey(item);
                Node node = toNode(item, seen, placeholders);
                if (block && fresh) {
                    hoistLeadingComments(node, items.isEmpty() ? aboveFirst : List.of(), placeholders);
                } else if (items.isEmpty()) {
                    ownComments.addAll(aboveFirst);
                }
                items.add(node);
            }
            if (items.isEmpty()) {
                ownComments.addAll(aboveFirst);
            }
            out = sequence;
        } else {
            throw new IllegalStateException("Unsupported document node: " + doc.getClass().getSimpleName());
        }
        out.setAnchor(doc.anchor());
        out.setBlockComments(orNull(ownComments));
        out.setInLineComments(orNull(doc.inlineComments()));
        out.setEndComments(orNull(doc.endComments()));
        return out;
    }

    /**
     * Replaces the comments above a block sequence item (those passed in, its
     * own, and those of its first key when it is a block mapping) by one marker.
     */
    private static void hoistLeadingComments(Node item, List<CommentLine> above, EmitPlaceholders placeholders) {
        List<CommentLine> leading = new ArrayList<>(above);
        if (item.getBlockComments() != null) {
            leading.addAll(item.getBlockComments());
        }
        Node carrier = item;
        if (item instanceof MappingNode m && m.getFlowStyle() != DumperOptions.FlowStyle.FLOW
                && !m.getValue().isEmpty()) {
            carrier = m.getValue().get(0).getKeyNode();
            if (carrier.getBlockComments() != null) {
                leading.addAll(carrier.getBlockComments());
            }
        }
        if (leading.isEmpty()) {
            return;
        }
        item.setBlockComments(null);
        List<CommentLine> marker = new ArrayList<>();
        marker.add(placeholders.itemMarker(leading));
        carrier.setBlockComments(marker);
    }

    private static List<CommentLine> orNull(List<CommentLine> comments) {
        return comments.isEmpty() ? null : new ArrayList<>(comments);
    }
}
