package com.ilograph.edit.engine;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class ContextOpsTest {

    private final DocMap doc = Fixtures.sample();

    private List<String> names() {
        return ContextOps.list(doc).stream().map(ContextRow::name).toList();
    }

    @Test
    public void testCreateHiddenWithExtends() {
        assertTrue(ContextOps.create(doc, "Audit", "Default, Storage", true, null));
        ContextRow row = ContextOps.list(doc).get(2);
        assertEquals("Audit", row.name());
        assertTrue(row.hidden());
        assertFalse(row.hasRoots());
    }

    @Test
    public void testCreateRejectsUnknownExtends() {
        try {
            ContextOps.create(doc, "Audit", "Default, Nope, Gone", null, null);
            fail();
        } catch (DiagramException e) {
            assertEquals("unknown extends context(s): Nope, Gone", e.getMessage());
        }
    }

    @Test
    public void testRenameRewritesExtends() {
        assertTrue(ContextOps.rename(doc, "Default", "Base"));
        assertEquals("Base", DocumentIndex.singleContext(doc, "Storage").node().getString("extends"));
        assertFalse(ContextOps.rename(doc, "Base", "Base"));
    }

    @Test
    public void testDeleteForceStripsReferences() {
        try {
            ContextOps.delete(doc, "Default", false);
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("context is referenced in extends"));
        }
        assertTrue(ContextOps.delete(doc, "Default", true));
        assertEquals(List.of("Storage"), names());
        assertNull(DocumentIndex.singleContext(doc, "Storage").node().getString("extends"));
    }

    @Test
    public void testReorderAndCopy() {
        assertTrue(ContextOps.reorder(doc, "Storage", 1));
        assertEquals(List.of("Storage", "Default"), names());
        assertTrue(ContextOps.copy(doc, "Default", "Default Copy", 2));
        assertEquals(List.of("Storage", "Default Copy", "Default"), names());
        try {
            ContextOps.copy(doc, "Default", "Storage", null);
            fail();
        } catch (DiagramException e) {
            assertEquals("context already exists: Storage", e.getMessage());
        }
    }
}
