package com.ilograph.edit.ref;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.ResolveRow;
import com.ilograph.edit.api.ResolveStatus;
import com.ilograph.edit.doc.DocMap;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class ReferenceResolverTest {

    private final DocMap doc = Fixtures.sample();

    @Test
    public void testResolvesIdsAndNames() {
        List<ResolveRow> rows = ReferenceResolver.resolve(doc, "api, Orders DB", null);
        assertEquals(2, rows.size());
        assertEquals(ResolveStatus.RESOLVED, rows.get(0).status());
        assertEquals("resources[0].children[0]", rows.get(0).details());
        assertEquals(ResolveStatus.RESOLVED, rows.get(1).status());
        assertEquals("resources[1]", rows.get(1).details());
    }

    @Test
    public void testClassifiesEveryStatus() {
        List<ResolveRow> rows = ReferenceResolver.resolve(doc,
                "*, web-*, backend, AWS::Lambda, Other::Thing, ghost", "flow");
        assertEquals(ResolveStatus.SPECIAL, rows.get(0).status());
        assertEquals(ResolveStatus.WILDCARD, rows.get(1).status());
        assertEquals(ResolveStatus.ALIAS, rows.get(2).status());
        assertEquals("db, db_replica", rows.get(2).details());
        assertEquals(ResolveStatus.IMPORTED_NAMESPACE, rows.get(3).status());
        assertEquals(ResolveStatus.UNRESOLVED_NAMESPACE, rows.get(4).status());
        assertEquals(ResolveStatus.UNRESOLVED, rows.get(5).status());
    }

    @Test
    public void testAmbiguousListsAllPaths() {
        DocMap d = Fixtures.parse("resources:\n  - id: a\n    name: Shared\n  - id: b\n    name: Shared\n");
        ResolveRow row = ReferenceResolver.resolve(d, "Shared", null).get(0);
        assertEquals(ResolveStatus.AMBIGUOUS, row.status());
        assertEquals("resources[0], resources[1]", row.details());
    }

    @Test
    public void testEmptyExpression() {
        List<ResolveRow> rows = ReferenceResolver.resolve(doc, " , ", null);
        assertEquals(1, rows.size());
        assertEquals(ResolveStatus.EMPTY, rows.get(0).status());
    }

    @Test
    public void testAliasesOnlyApplyWithPerspective() {
        assertEquals(ResolveStatus.UNRESOLVED, ReferenceResolver.resolve(doc, "backend", null).get(0).status());
    }

    @Test
    public void testUnknownPerspectiveHasNoAliases() {
        List<ResolveRow> rows = ReferenceResolver.resolve(doc, "api, backend", "nope");
        assertEquals(ResolveStatus.RESOLVED, rows.get(0).status());
        assertEquals(ResolveStatus.UNRESOLVED, rows.get(1).status());
    }
}
