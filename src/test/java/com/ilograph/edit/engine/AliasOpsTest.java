package com.ilograph.edit.engine;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocMap;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class AliasOpsTest {

    private final DocMap doc = Fixtures.sample();

    @Test
    public void testAddListEditRemove() {
        assertTrue(AliasOps.add(doc, "flow", "edge", "api, web", 1));
        List<AliasRow> rows = AliasOps.list(doc, "flow");
        assertEquals("edge", rows.get(0).alias());
        assertEquals("backend", rows.get(1).alias());

        assertTrue(AliasOps.edit(doc, "flow", "edge", "front", null));
        assertFalse(AliasOps.edit(doc, "flow", "front", null, "api, web"));
        assertEquals("front", AliasOps.list(doc, "flow").get(0).alias());

        assertTrue(AliasOps.remove(doc, "flow", "front"));
        assertEquals(1, AliasOps.list(doc, "flow").size());
    }

    @Test
    public void testDuplicateAndMissingAliases() {
        try {
            AliasOps.add(doc, "flow", "backend", "db", null);
            fail();
        } catch (DiagramException e) {
            assertEquals("alias already exists: backend", e.getMessage());
        }
        try {
            AliasOps.remove(doc, "Steps", "backend");
            fail();
        } catch (DiagramException e) {
            assertEquals("perspective has no aliases: Steps", e.getMessage());
        }
        try {
            AliasOps.add(doc, "Steps", "x", "db", 2);
            fail();
        } catch (DiagramException e) {
            assertEquals("index out of range: 2", e.getMessage());
        }
        assertTrue(AliasOps.list(doc, "Steps").isEmpty());
    }
}
