package com.ilograph.edit.doc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Tree walks over the document model.
 */
public final class DocTrees {
    private DocTrees() {
        // Utility class
    }

    /**
     * Every node reachable from {@code root}, values only (mapping keys are
     * skipped), each shared node once, in document order.
     */
    public static List<DocNode> reachable(DocNode root) {
        List<DocNode> out = new ArrayList<>();
        if (root == null) {
            return out;
        }
        Set<DocNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<DocNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            DocNode current = stack.pop();
            if (!seen.add(current)) {
                continue;
            }
            out.add(current);
            if (current instanceof DocMap m) {
                List<DocMap.Entry> entries = m.entries();
                for (int i = entries.size() - 1; i >= 0; i--) {
                    stack.push(entries.get(i).value());
                }
            } else if (current instanceof DocList l) {
                for (int i = l.size() - 1; i >= 0; i--) {
                    stack.push(l.get(i));
                }
            }
        }
        return out;
    }

    /** Clears every anchor label below and including {@code root}. */
    public static void clearAnchors(DocNode root) {
        for (DocNode n : reachable(root)) {
            n.setAnchor(null);
        }
    }

    /** Anchor labels currently present under {@code root}. */
    public static Set<String> anchorNames(DocNode root) {
        Set<String> names = new HashSet<>();
        for (DocNode n : reachable(root)) {
            if (n.anchor() != null) {
                names.add(n.anchor());
            }
        }
        return names;
    }
}
