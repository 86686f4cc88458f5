package com.ilograph.edit.io;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class UnifiedDiffTest {

    @Test
    public void testRendersHunkWithContext() {
        String before = "a\nb\nc\nd\ne\n";
        String after = "a\nb\nC\nd\ne\n";
        List<String> diff = UnifiedDiff.render(before, after, "/tmp/x.yaml", 1);
        assertEquals(List.of("--- a/tmp/x.yaml", "+++ b/tmp/x.yaml", "@@ -2,3 +2,3 @@", " b", "-c", "+C", " d"),
                diff);
    }

    @Test
    public void testEqualTextsProduceNothing() {
        assertTrue(UnifiedDiff.render("a\n", "a\n", "x", 3).isEmpty());
    }

    @Test
    public void testSummaryCountsLinesAndHunks() {
        String before = "1\n2\n3\n4\n5\n6\n7\n8\n9\n10\n";
        String after = "1\nX\n3\n4\n5\n6\n7\n8\n9\n10\n11\n";
        UnifiedDiff.Summary s = UnifiedDiff.summarize(UnifiedDiff.render(before, after, "f", 1));
        assertEquals(2, s.added());
        assertEquals(1, s.deleted());
        assertEquals(2, s.hunks());
        assertEquals("+2 -1 (2 hunks)", s.toString());
    }

    @Test
    public void testTouchedSections() {
        String before = "resources:\n- id: a\nperspectives:\n- id: p\n";
        String after = "resources:\n- id: b\nperspectives:\n- id: p\n";
        List<UnifiedDiff.SectionChange> sections = UnifiedDiff.touchedSections(before, after);
        assertEquals(List.of(new UnifiedDiff.SectionChange("resources", 1, 1)), sections);
    }
}
