package com.ilograph.edit.engine;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.api.ValidationMode;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.ResourceLocation;
import com.ilograph.edit.io.DiagramYaml;
import com.ilograph.edit.io.FormatProfile;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class ResourceOpsTest {

    private final DocMap doc = Fixtures.sample();

    private String dump() {
        return DiagramYaml.dump(doc, FormatProfile.defaults());
    }

    private DocMap relation(String perspective, int i) {
        return DocumentIndex.singlePerspective(doc, perspective).node().getList("relations").maps().get(i);
    }

    @Test
    public void testCreateUnderParentAndRoot() {
        assertTrue(ResourceOps.create(doc, "cdn", "CDN", "none", null));
        assertTrue(ResourceOps.create(doc, "lb", "Load Balancer", "vpc", "L7"));
        assertNull(DocumentIndex.singleResourceById(doc, "cdn").parent());
        ResourceLocation lb = DocumentIndex.singleResourceById(doc, "lb");
        assertEquals("vpc", lb.parent().getString("id"));
        assertEquals("L7", lb.node().getString("subtitle"));
    }

    @Test
    public void testCreateRejectsDuplicateAndRestrictedIds() {
        try {
            ResourceOps.create(doc, "db", "Again", "none", null);
            fail();
        } catch (DiagramException e) {
            assertEquals("resource id already exists: db", e.getMessage());
        }
        try {
            ResourceOps.create(doc, "a/b", "Bad", "none", null);
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("restricted character '/'"));
        }
    }

    @Test
    public void testRenameIdRespectsBoundaries() {
        assertTrue(ResourceOps.renameId(doc, "db", "postgres"));
        assertEquals("postgres", relation("flow", 1).getString("to"));
        assertEquals("[db_replica]", relation("flow", 2).getString("to"));
        assertEquals("postgres, db_replica", DocumentIndex.aliasTable(
                DocumentIndex.singlePerspective(doc, "flow").node()).get("backend"));
        assertEquals("postgres",
                DocumentIndex.singlePerspective(doc, "Steps").node().getMap("sequence").getList("steps").maps()
                        .get(1).getString("toAndBack"));
        assertEquals("vpc, postgres", DocumentIndex.singleContext(doc, "Default").node().getString("roots"));
        assertEquals("postgres, db_replica",
                DocumentIndex.singleContext(doc, "Storage").node().getString("roots"));
        assertTrue(DocumentValidator.validate(doc, ValidationMode.STRICT).isEmpty());
    }

    @Test
    public void testRenameIdRejectsExistingTarget() {
        try {
            ResourceOps.renameId(doc, "db", "api");
            fail();
        } catch (DiagramException e) {
            assertEquals("target id already exists: api (resource ids must be unique)", e.getMessage());
        }
    }

    @Test
    public void testRenameDisplayName() {
        assertTrue(ResourceOps.rename(doc, "db", "Primary DB"));
        assertFalse(ResourceOps.rename(doc, "db", "Primary DB"));
        assertEquals("Primary DB", DocumentIndex.singleResourceById(doc, "db").node().getString("name"));
    }

    @Test
    public void testMoveRejectsSelfAndEveryDescendant() {
        for (String target : List.of("vpc", "web", "worker")) {
            String before = dump();
            try {
                ResourceOps.move(doc, "vpc", target, false);
                fail("moved under " + target);
            } catch (DiagramException e) {
                assertTrue(e.getMessage(), e.getMessage().startsWith("resource cannot be"));
            }
            assertEquals(before, dump());
        }
    }

    @Test
    public void testMoveAppendsAndDropsStyle() {
        assertTrue(ResourceOps.move(doc, "db", "web", false));
        assertEquals(List.of("api", "web", "worker", "db"),
                DocumentIndex.descendantIds(DocumentIndex.singleResourceById(doc, "vpc").node()));

        assertTrue(ResourceOps.move(doc, "vpc", "db_replica", true));
        assertFalse(DocumentIndex.singleResourceById(doc, "vpc").node().containsKey("style"));
    }

    @Test
    public void testMoveToCurrentLastPositionIsNoop() {
        assertFalse(ResourceOps.move(doc, "worker", "web", false));
        assertFalse(DocumentIndex.singleResourceById(doc, "web").node().getList("children").isEmpty());
    }

    @Test
    public void testMoveToRoot() {
        assertTrue(ResourceOps.moveToRoot(doc, "worker"));
        assertNull(DocumentIndex.singleResourceById(doc, "worker").parent());
        assertFalse(ResourceOps.moveToRoot(doc, "worker"));
    }

    @Test
    public void testDeleteNeedsSubtreeFlagForParents() {
        try {
            ResourceOps.delete(doc, "web", false);
            fail();
        } catch (DiagramException e) {
            assertEquals("resource has children; pass --delete-subtree", e.getMessage());
        }
        assertTrue(ResourceOps.delete(doc, "web", true));
        assertFalse(DocumentIndex.resourcesById(doc).containsKey("worker"));
    }

    @Test
    public void testCloneShallowBesideSource() {
        assertTrue(ResourceOps.clone(doc, "vpc", "vpc2", null, "VPC 2", false));
        ResourceLocation copy = DocumentIndex.singleResourceById(doc, "vpc2");
        assertNull(copy.parent());
        assertEquals("VPC 2", copy.node().getString("name"));
        assertFalse(copy.node().containsKey("children"));
        assertNull(copy.node().get("style").anchor());
        assertEquals("boxStyle", DocumentIndex.singleResourceById(doc, "vpc").node().get("style").anchor());
    }

    @Test
    public void testCloneWithConflictingChildIdsFails() {
        try {
            ResourceOps.clone(doc, "web", "web2", "none", null, true);
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("conflicting id: worker"));
        }
        assertFalse(DocumentIndex.resourcesById(doc).containsKey("web2"));
    }
}
