package com.ilograph.edit.index;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocMap;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Test;
import static org.junit.Assert.*;

public class DocumentIndexTest {

    private final DocMap doc = Fixtures.sample();

    @Test
    public void testWalksResourcesDepthFirst() {
        List<String> ids = DocumentIndex.resources(doc).stream().map(ResourceLocation::identifier).toList();
        assertEquals(List.of("vpc", "api", "web", "worker", "db", "db_replica", "Cache"), ids);
        ResourceLocation worker = DocumentIndex.singleResource(doc, "worker");
        assertEquals("resources[0].children[1].children[0]", worker.path());
    }

    @Test
    public void testReferencePathsIndexIdsAndNames() {
        Map<String, List<String>> paths = DocumentIndex.referencePaths(doc);
        assertEquals(List.of("resources[1]"), paths.get("db"));
        assertEquals(List.of("resources[1]"), paths.get("Orders DB"));
        assertEquals(List.of("resources[3]"), paths.get("Cache"));
    }

    @Test
    public void testIdAndNameEqualOnOneNodeCountOnce() {
        DocMap d = Fixtures.parse("resources:\n  - id: x\n    name: x\n");
        assertEquals(List.of("resources[0]"), DocumentIndex.referencePaths(d).get("x"));
    }

    @Test
    public void testDescendants() {
        DocMap vpc = DocumentIndex.singleResourceById(doc, "vpc").node();
        DocMap worker = DocumentIndex.singleResourceById(doc, "worker").node();
        assertTrue(DocumentIndex.isSelfOrDescendant(vpc, worker));
        assertFalse(DocumentIndex.isSelfOrDescendant(worker, vpc));
        assertEquals(List.of("api", "web", "worker"), DocumentIndex.descendantIds(vpc));
    }

    @Test
    public void testPerspectivesUseIdThenName() {
        assertEquals(List.of("flow", "Steps"),
                DocumentIndex.perspectives(doc).stream().map(PerspectiveLocation::identifier).toList());
        assertEquals("db, db_replica", DocumentIndex.aliasTable(DocumentIndex.singlePerspective(doc, "flow")
                .node()).get("backend"));
    }

    @Test
    public void testContextsAndImports() {
        assertEquals(Set.of("Default", "Storage"), DocumentIndex.contextNames(doc));
        assertEquals(1, DocumentIndex.singleContext(doc, "Storage").index());
        assertEquals(Set.of("AWS"), DocumentIndex.importNamespaces(doc));
    }

    @Test
    public void testLookupFailures() {
        try {
            DocumentIndex.singleResourceById(doc, "Cache");
            fail("name-only resource has no id");
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("Cache"));
        }
        try {
            DocumentIndex.singleContext(Fixtures.parse("resources: []\n"), "Default");
            fail();
        } catch (DiagramException e) {
            assertEquals("diagram has no contexts", e.getMessage());
        }
    }

    @Test
    public void testReferenceFieldsCoverSections() {
        List<ReferenceField> fields = ReferenceFields.all(doc);
        assertTrue(fields.stream().anyMatch(f -> f.section() == ReferenceSection.RESOURCE_INSTANCE_OF));
        assertTrue(fields.stream().anyMatch(f -> f.path().equals("perspectives[1].sequence.steps[1].toAndBack")));
        assertTrue(fields.stream().anyMatch(f -> f.path().equals("contexts[1].extends")));
        assertTrue(ReferenceFields.validated(doc).stream()
                .noneMatch(f -> f.section() == ReferenceSection.RESOURCE_INSTANCE_OF));
    }
}
