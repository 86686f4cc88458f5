package com.ilograph.edit.batch;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.ResourceLocation;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class OperationDispatcherTest {

    @Test
    public void testAppliesInOrder() {
        DocMap doc = Fixtures.sample();
        boolean changed = OperationDispatcher.applyAll(List.of(
                new Operations.GroupCreate("storage", "Storage", "none", null),
                new Operations.GroupMoveMany(List.of("db", "db_replica"), "storage")), doc);
        assertTrue(changed);
        ResourceLocation db = DocumentIndex.singleResourceById(doc, "db");
        assertEquals("storage", db.parent().getString("id"));
    }

    @Test
    public void testMoveToNoneMeansRoot() {
        DocMap doc = Fixtures.sample();
        assertTrue(OperationDispatcher.apply(new Operations.MoveResource("worker", "none", false), doc));
        assertNull(DocumentIndex.singleResourceById(doc, "worker").parent());
    }

    @Test
    public void testFmtStableChangesNothing() {
        DocMap doc = Fixtures.sample();
        assertFalse(OperationDispatcher.apply(new Operations.FmtStable(), doc));
    }

    @Test
    public void testNoOpReportsUnchanged() {
        DocMap doc = Fixtures.sample();
        assertFalse(OperationDispatcher.applyAll(List.of(
                new Operations.RenameResource("db", "Orders DB")), doc));
    }

    @Test
    public void testFailurePropagates() {
        DocMap doc = Fixtures.sample();
        try {
            OperationDispatcher.apply(new Operations.RenameResource("ghost", "Ghost"), doc);
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("resource id not found: ghost"));
        }
    }
}
