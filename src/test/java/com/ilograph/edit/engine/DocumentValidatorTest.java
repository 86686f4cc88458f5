package com.ilograph.edit.engine;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.api.ValidationIssue;
import com.ilograph.edit.api.ValidationMode;
import com.ilograph.edit.doc.DocMap;

import java.util.List;
import java.util.Map;

import org.junit.Test;
import static org.junit.Assert.*;

public class DocumentValidatorTest {

    private static final String NAMESPACED = """
            resources:
              - id: app
                name: App
            perspectives:
              - id: p
                relations:
                  - from: app
                    to: Ext::Thing
            """;

    @Test
    public void testSampleIsValid() {
        assertTrue(DocumentValidator.validate(Fixtures.sample(), ValidationMode.STRICT).isEmpty());
    }

    @Test
    public void testNamespacedTokenStrictVersusNative() {
        DocMap doc = Fixtures.parse(NAMESPACED);
        List<ValidationIssue> strict = DocumentValidator.validate(doc, ValidationMode.STRICT);
        assertEquals(1, strict.size());
        assertEquals(DocumentValidator.BROKEN_REFERENCE, strict.get(0).code());
        assertEquals("perspectives[0].relations[0].to", strict.get(0).path());
        assertTrue(DocumentValidator.validate(doc, ValidationMode.ILOGRAPH_NATIVE).isEmpty());
    }

    @Test
    public void testImportedNamespacePassesStrict() {
        DocMap doc = Fixtures.parse("imports:\n  - from: x/y\n    namespace: Ext\n" + NAMESPACED);
        assertTrue(DocumentValidator.validate(doc, ValidationMode.STRICT).isEmpty());
    }

    @Test
    public void testStructuralChecks() {
        DocMap doc = Fixtures.parse("""
                resources:
                  - id: a
                  - id: a
                  - id: b/c
                  - name: x,y
                perspectives:
                  - id: p
                    aliases:
                      - alias: "bad*"
                        for: a
                  - id: p
                contexts:
                  - name: C
                    extends: Missing
                """);
        Map<String, Integer> byCode = DocumentValidator.check(doc, ValidationMode.STRICT).getSummaryByCode();
        assertEquals(Integer.valueOf(2), byCode.get(DocumentValidator.DUPLICATE_RESOURCE_ID));
        assertEquals(Integer.valueOf(2), byCode.get(DocumentValidator.DUPLICATE_PERSPECTIVE_ID));
        assertEquals(Integer.valueOf(1), byCode.get(DocumentValidator.RESTRICTED_RESOURCE_ID_CHAR));
        assertEquals(Integer.valueOf(1), byCode.get(DocumentValidator.NAME_NEEDS_ID));
        assertEquals(Integer.valueOf(1), byCode.get(DocumentValidator.RESTRICTED_ALIAS_CHAR));
        assertEquals(Integer.valueOf(1), byCode.get(DocumentValidator.BROKEN_REFERENCE));
    }

    @Test
    public void testAliasesAndPerspectiveIdsResolve() {
        DocMap doc = Fixtures.parse("""
                resources:
                  - id: a
                perspectives:
                  - id: p
                    aliases:
                      - alias: grp
                        for: a
                    relations:
                      - from: grp
                        to: p
                """);
        assertTrue(DocumentValidator.validate(doc, ValidationMode.STRICT).isEmpty());
    }

    @Test
    public void testOneIssuePerPathAndToken() {
        DocMap doc = Fixtures.parse("perspectives:\n  - id: p\n    relations:\n      - from: ghost, ghost/ghost\n");
        assertEquals(1, DocumentValidator.validate(doc, ValidationMode.STRICT).size());
    }

    @Test
    public void testWriteGateListsIssues() {
        try {
            DocumentValidator.requireValidForWrite(Fixtures.parse(NAMESPACED));
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith(
                    "mutation would produce invalid document (1 issue(s), strict mode):\n- broken-reference at "));
        }
    }
}
