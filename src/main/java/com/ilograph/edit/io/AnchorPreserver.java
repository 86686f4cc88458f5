package com.ilograph.edit.io;

import com.ilograph.edit.doc.DocNode;
import com.ilograph.edit.doc.DocTrees;
import lombok.extern.log4j.Log4j2;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keeps authored anchor labels stable across a mutation.
 *
 * <p>
 * A snapshot maps each node id to its anchor before the mutation. Restoring
 * puts every snapshotted label back on the node with the same id and clears
 * any other node's label that collides with a preserved name (for example a
 * copy made from an anchored node).
 */
@Log4j2
public final class AnchorPreserver {
    private AnchorPreserver() {
        // Utility class
    }

    public static Map<Integer, String> snapshot(DocNode root) {
        Map<Integer, String> snapshot = new HashMap<>();
        for (DocNode n : DocTrees.reachable(root)) {
            if (n.anchor() != null) {
                snapshot.put(n.nodeId(), n.anchor());
            }
        }
        return snapshot;
    }

    public static void restore(DocNode root, Map<Integer, String> snapshot) {
        if (snapshot.isEmpty()) {
            return;
        }
        Set<String> preserved = new HashSet<>(snapshot.values());
        for (DocNode n : DocTrees.reachable(root)) {
            String expected = snapshot.get(n.nodeId());
            if (expected != null) {
                n.setAnchor(expected);
            } else if (n.anchor() != null && preserved.contains(n.anchor())) {
                log.debug("Clearing colliding anchor '{}' on node {}", n.anchor(), n.nodeId());
                n.setAnchor(null);
            }
        }
    }
}
