package com.ilograph.edit.engine;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class GroupOpsTest {

    private final DocMap doc = Fixtures.sample();

    @Test
    public void testCreateGroupAndMoveMany() {
        assertTrue(GroupOps.create(doc, "data", "Data Tier", "none", null));
        assertTrue(GroupOps.moveMany(doc, List.of("db", "db_replica"), "data"));
        assertEquals(List.of("db", "db_replica"),
                DocumentIndex.descendantIds(DocumentIndex.singleResourceById(doc, "data").node()));
    }

    @Test
    public void testMoveManyToRoot() {
        assertTrue(GroupOps.moveMany(doc, List.of("api", "worker"), "none"));
        assertNull(DocumentIndex.singleResourceById(doc, "api").parent());
        assertNull(DocumentIndex.singleResourceById(doc, "worker").parent());
    }

    @Test
    public void testMoveManyRejectsDuplicates() {
        try {
            GroupOps.moveMany(doc, List.of("db", "db"), "vpc");
            fail();
        } catch (DiagramException e) {
            assertEquals("duplicate id in --ids: db (each resource id must appear once)", e.getMessage());
        }
    }

    @Test
    public void testMoveManyChecksAllIdsFirst() {
        try {
            GroupOps.moveMany(doc, List.of("db", "ghost"), "vpc");
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("resource id not found: ghost"));
        }
        assertNull(DocumentIndex.singleResourceById(doc, "db").parent());
    }

    @Test
    public void testDuplicateGroupId() {
        try {
            GroupOps.create(doc, "vpc", "Again", "none", null);
            fail();
        } catch (DiagramException e) {
            assertEquals("resource id already exists: vpc (group id must be unique)", e.getMessage());
        }
    }
}
