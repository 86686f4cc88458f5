package com.ilograph.edit.io;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocMap;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class DiagramYamlTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static String cycle(String text) {
        return DiagramYaml.dump(DiagramYaml.parse(text, "t.yaml"), FormatProfiles.detect(text));
    }

    @Test
    public void testDumpIsStableAfterOneCycle() {
        String once = cycle(Fixtures.text("sample.yaml"));
        assertEquals(once, cycle(once));
    }

    @Test
    public void testKeepsCommentsAndAnchors() {
        String out = cycle(Fixtures.text("sample.yaml"));
        assertTrue(out, out.contains("# Sample diagram used across tests"));
        assertTrue(out, out.contains("&boxStyle"));
    }

    @Test
    public void testBareBracketReferencesStayBare() {
        String text = "perspectives:\n- id: p\n  relations:\n  - from: [*.example.com]\n    to: api\n";
        DocMap doc = DiagramYaml.parse(text, "t.yaml");
        DocMap relation = doc.getList("perspectives").maps().get(0).getList("relations").maps().get(0);
        assertEquals("[*.example.com]", relation.getString("from"));
        String out = cycle(text);
        assertTrue(out, out.contains("from: [*.example.com]"));
    }

    @Test
    public void testQuotedBracketReferencesStayQuoted() {
        String text = "perspectives:\n- id: p\n  relations:\n  - from: '[db]'\n    to: api\n";
        assertTrue(cycle(text).contains("from: '[db]'"));
    }

    @Test
    public void testIndentlessStyleDetectedAndKept() {
        String text = "resources:\n- id: a\n  children:\n  - id: b\n";
        assertEquals(SequenceIndentStyle.INDENTLESS, FormatProfiles.detect(text).sequenceIndentStyle());
        String out = cycle(text);
        assertTrue(out, out.contains("\n- id: a"));
    }

    @Test
    public void testIndentedStyleDetected() {
        String text = "resources:\n  - id: a\n    children:\n      - id: b\n";
        assertEquals(SequenceIndentStyle.INDENTED, FormatProfiles.detect(text).sequenceIndentStyle());
        assertTrue(cycle(text).contains("\n  - id: a"));
    }

    @Test
    public void testEmptyTextIsEmptyDocument() {
        assertTrue(DiagramYaml.parse("", "t.yaml").isEmpty());
    }

    @Test
    public void testNonMappingRootRejected() {
        try {
            DiagramYaml.parse("- a\n- b\n", "list.yaml");
            fail();
        } catch (DiagramException e) {
            assertEquals("yaml root must be a mapping/object (file: list.yaml)", e.getMessage());
        }
    }

    @Test
    public void testSyntaxErrorNamesSource() {
        try {
            DiagramYaml.parse("a: [b\n", "broken.yaml");
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("yaml parse error in broken.yaml"));
        }
    }

    @Test
    public void testLoadReadsFileAndProfile() throws Exception {
        Path file = tmp.newFile("d.yaml").toPath();
        Files.writeString(file, "resources:\n- id: a\n");
        LoadedDiagram loaded = DiagramYaml.load(file);
        assertEquals("resources:\n- id: a\n", loaded.text());
        assertEquals(SequenceIndentStyle.INDENTLESS, loaded.profile().sequenceIndentStyle());
        assertEquals("a", loaded.document().getList("resources").maps().get(0).getString("id"));
    }

    @Test
    public void testBlankLinesBetweenItemsSurvive() {
        String text = "resources:\n- id: a\n  name: A\n\n- id: b\n  name: B\n\n# about c\n- id: c\n  name: C\n";
        String once = cycle(text);
        assertEquals(text, once);
        assertEquals(once, cycle(once));
    }

    @Test
    public void testBlankLinesBetweenIndentedItemsSurvive() {
        String text = "resources:\n  - id: a\n\n  # about b\n  - id: b\n";
        assertEquals(text, cycle(text));
    }

    @Test
    public void testCommentsStayAboveSequenceItems() {
        String text = "resources:\n# leading comment for a\n- id: a # trailing\n  children:\n"
                + "  # about child\n  - id: b\n    name: B\n";
        String out = cycle(text);
        assertTrue(out, out.contains("resources:\n# leading comment for a\n- id: a # trailing\n"));
        assertTrue(out, out.contains("\n  # about child\n  - id: b\n    name: B\n"));
        assertFalse(out, out.contains("- #"));
        assertFalse(out, out.matches("(?ms).*^ *-$.*"));
        assertEquals(out, cycle(out));
    }

    @Test
    public void testUnchangedFoldedScalarKeepsItsLines() {
        String text = "resources:\n- id: a\n  description: >-\n    folded\n    text\n\nperspectives:\n- id: p\n";
        assertEquals(text, cycle(text));
    }

    @Test
    public void testEditedFoldedScalarIsWrittenAgain() {
        String text = "resources:\n- id: a\n  description: >-\n    folded\n    text\n";
        DocMap doc = DiagramYaml.parse(text, "t.yaml");
        doc.getList("resources").maps().get(0).putString("description", "rewritten");
        String out = DiagramYaml.dump(doc, FormatProfiles.detect(text));
        assertTrue(out, out.contains("rewritten"));
        assertFalse(out, out.contains("folded"));
    }

    @Test
    public void testHandwrittenLayoutIsStable() {
        String text = Fixtures.text("handwritten.yaml");
        String once = cycle(text);
        assertEquals(once, cycle(once));
        assertTrue(once, once.contains("  name: A\n  subtitle: \"café \\\"q\\\"\"\n\n- id: b\n"));
        assertTrue(once, once.contains("  description: >-\n    folded\n    text\n\n# about c\n- id: c\n"));
        assertTrue(once, once.contains("  children:\n  # first child\n  - id: d\n"));
        assertEquals(text, StyleRestorer.restore(text, once));
    }
}
