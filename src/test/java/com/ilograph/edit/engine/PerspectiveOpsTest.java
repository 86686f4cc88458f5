package com.ilograph.edit.engine;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class PerspectiveOpsTest {

    private final DocMap doc = Fixtures.sample();

    private List<String> identifiers() {
        return PerspectiveOps.list(doc).stream().map(PerspectiveRow::identifier).toList();
    }

    @Test
    public void testList() {
        List<PerspectiveRow> rows = PerspectiveOps.list(doc);
        assertEquals(2, rows.size());
        assertTrue(rows.get(0).hasRelations());
        assertFalse(rows.get(0).hasSequence());
        assertEquals("flow", rows.get(1).extendsList());
        assertNull(rows.get(1).id());
        assertTrue(rows.get(1).hasSequence());
    }

    @Test
    public void testCreateAtIndex() {
        assertTrue(PerspectiveOps.create(doc, "deploy", "Deployment", "flow", "leftToRight", 1));
        assertEquals(List.of("deploy", "flow", "Steps"), identifiers());
        assertEquals("leftToRight", PerspectiveOps.list(doc).get(0).orientation());
    }

    @Test
    public void testCreateChecksExtendsAndUniqueness() {
        try {
            PerspectiveOps.create(doc, "x", "X", "flow, ghost", null, null);
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("perspective not found: ghost"));
        }
        try {
            PerspectiveOps.create(doc, "Steps", "Dup", null, null, null);
            fail();
        } catch (DiagramException e) {
            assertEquals("perspective id already exists: Steps", e.getMessage());
        }
    }

    @Test
    public void testRenameRewritesExtends() {
        assertTrue(PerspectiveOps.rename(doc, "flow", "requests", null));
        assertEquals("requests", DocumentIndex.singlePerspective(doc, "Steps").node().getString("extends"));
        assertFalse(PerspectiveOps.rename(doc, "requests", null, "Request Flow"));
    }

    @Test
    public void testDeleteBlockedByExtendsUnlessForced() {
        try {
            PerspectiveOps.delete(doc, "flow", false);
            fail();
        } catch (DiagramException e) {
            assertEquals("perspective is referenced in extends; pass --force to remove references (Steps)",
                    e.getMessage());
        }
        assertTrue(PerspectiveOps.delete(doc, "flow", true));
        assertEquals(List.of("Steps"), identifiers());
        assertFalse(DocumentIndex.singlePerspective(doc, "Steps").node().containsKey("extends"));
    }

    @Test
    public void testReorder() {
        assertTrue(PerspectiveOps.reorder(doc, "Steps", 1));
        assertEquals(List.of("Steps", "flow"), identifiers());
        assertFalse(PerspectiveOps.reorder(doc, "Steps", 1));
        try {
            PerspectiveOps.reorder(doc, "Steps", 3);
            fail();
        } catch (DiagramException e) {
            assertEquals("index out of range: 3", e.getMessage());
        }
    }

    @Test
    public void testCopy() {
        assertTrue(PerspectiveOps.copy(doc, "flow", "flow2", "Request Flow 2", null));
        assertEquals(List.of("flow", "Steps", "flow2"), identifiers());
        assertEquals(3, RelationOps.list(doc, List.of("flow2"), null).size());
    }
}
