package com.ilograph.edit.doc;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class DocMapTest {

    @Test
    public void testKeepsInsertionOrder() {
        DocMap m = new DocMap();
        m.putString("name", "Web");
        m.putString("id", "web");
        m.put(0, "subtitle", DocScalar.ofString("tier"));
        assertEquals(List.of("subtitle", "name", "id"), m.keys());
        m.putString("name", "Web Tier");
        assertEquals(List.of("subtitle", "name", "id"), m.keys());
        assertEquals("Web Tier", m.getString("name"));
    }

    @Test
    public void testPutStringKeepsScalarIdentity() {
        DocMap m = new DocMap();
        m.putString("name", "a");
        DocNode before = m.get("name");
        before.setAnchor("n");
        m.putString("name", "b");
        assertSame(before, m.get("name"));
        assertEquals("n", m.get("name").anchor());
    }

    @Test
    public void testTrimmedAndTypedAccess() {
        DocMap m = new DocMap();
        m.putString("id", "  ");
        m.putBoolean("hidden", true);
        assertNull(m.getTrimmed("id"));
        assertNull(m.getString("hidden"));
        assertNull(m.getList("id"));
        DocList children = m.ensureList("children");
        assertSame(children, m.ensureList("children"));
    }

    @Test
    public void testDeepCopyIsIndependentWithFreshIds() {
        DocMap child = new DocMap();
        child.putString("id", "worker");
        DocMap root = new DocMap();
        root.ensureList("children").add(child);
        root.setAnchor("root");

        DocMap copy = root.deepCopy();
        DocMap copiedChild = copy.getList("children").maps().get(0);
        assertNotSame(child, copiedChild);
        assertNotEquals(child.nodeId(), copiedChild.nodeId());
        assertEquals("root", copy.anchor());

        copiedChild.putString("id", "other");
        assertEquals("worker", child.getString("id"));
    }

    @Test
    public void testReachableAndAnchors() {
        DocMap root = new DocMap();
        DocMap style = new DocMap();
        style.setAnchor("box");
        root.put("style", style);
        root.put("again", style);
        assertEquals(2, DocTrees.reachable(root).size());
        assertEquals(java.util.Set.of("box"), DocTrees.anchorNames(root));
        DocTrees.clearAnchors(root);
        assertTrue(DocTrees.anchorNames(root).isEmpty());
        assertNull(root.remove("missing"));
        assertSame(style, root.remove("again"));
    }
}
