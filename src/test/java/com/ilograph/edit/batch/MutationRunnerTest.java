package com.ilograph.edit.batch;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.engine.RelationOps;
import com.ilograph.edit.engine.RelationSpec;
import com.ilograph.edit.engine.ResourceOps;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class MutationRunnerTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path file;
    private String original;

    @Before
    public void setUp() throws Exception {
        original = Fixtures.text("sample.yaml");
        file = tmp.newFile("diagram.yaml").toPath();
        Files.writeString(file, original);
    }

    @Test
    public void testWritesOnlyTouchedLines() throws Exception {
        MutationResult result = new MutationRunner().run(file, doc -> ResourceOps.rename(doc, "db", "Primary DB"));
        assertEquals(MutationResult.Status.WRITTEN, result.status());
        String written = Files.readString(file);
        assertEquals(original.replace("name: Orders DB", "name: Primary DB"), written);
        assertEquals(1, result.summary().added());
        assertEquals(1, result.summary().deleted());
        assertEquals("resources", result.sections().get(0).name());
        assertFalse(Files.exists(DiagramLock.lockPathFor(file)));
    }

    @Test
    public void testBrokenReferenceLeavesFileByteIdentical() throws Exception {
        try {
            new MutationRunner().run(file, doc -> RelationOps.add(doc, "flow", RelationSpec.between("api", "ghost")));
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("mutation would produce invalid document"));
        }
        assertEquals(original, Files.readString(file));
        assertFalse(Files.exists(DiagramLock.lockPathFor(file)));
    }

    @Test
    public void testBatchIsAllOrNothing() throws Exception {
        List<Operation> ops = List.of(
                new Operations.RenameResource("db", "Primary DB"),
                new Operations.ResourceDelete("ghost", false));
        try {
            new MutationRunner().apply(file, ops);
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("resource id not found: ghost"));
        }
        assertEquals(original, Files.readString(file));
    }

    @Test
    public void testRenameIdBatch() throws Exception {
        MutationResult result = new MutationRunner().apply(file, List.of(
                new Operations.RenameResourceId("db", "postgres")));
        assertTrue(result.changed());
        String written = Files.readString(file);
        assertTrue(written.contains("to: postgres"));
        assertTrue(written.contains("roots: vpc, postgres"));
        assertTrue(written.contains("[db_replica]"));
        assertTrue(written.contains("# Sample diagram used across tests"));
    }

    @Test
    public void testDryRunDoesNotWriteOrLock() throws Exception {
        Files.writeString(DiagramLock.lockPathFor(file), "pid=1\n");
        MutationResult result = new MutationRunner().dryRun(true)
                .run(file, doc -> ResourceOps.rename(doc, "db", "Primary DB"));
        assertEquals(MutationResult.Status.WOULD_WRITE, result.status());
        assertEquals("--- a/" + file.toString().replace('\\', '/').replaceFirst("^/+", ""), result.diff().get(0));
        assertEquals(original, Files.readString(file));
    }

    @Test
    public void testUnchangedSkipsWrite() throws Exception {
        MutationResult result = new MutationRunner().run(file, doc -> ResourceOps.rename(doc, "db", "Orders DB"));
        assertEquals(MutationResult.Status.UNCHANGED, result.status());
        assertTrue(result.diff().isEmpty());
    }

    @Test
    public void testHeldLockFails() throws Exception {
        Files.writeString(DiagramLock.lockPathFor(file), "pid=1\n");
        try {
            new MutationRunner().withLockWait(Duration.ofMillis(120))
                    .run(file, doc -> ResourceOps.rename(doc, "db", "Primary DB"));
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("file is locked by another command"));
        }
        assertEquals(original, Files.readString(file));
        assertTrue(Files.exists(DiagramLock.lockPathFor(file)));
    }

    @Test
    public void testConcurrentModificationDetected() throws Exception {
        try {
            new MutationRunner().run(file, doc -> {
                try {
                    Files.writeString(file, original + "\n# edited elsewhere\n");
                } catch (java.io.IOException e) {
                    throw new java.io.UncheckedIOException(e);
                }
                return ResourceOps.rename(doc, "db", "Primary DB");
            });
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("file changed on disk since it was read"));
        }
        assertTrue(Files.readString(file).endsWith("# edited elsewhere\n"));
    }

    @Test
    public void testMissingFile() {
        try {
            new MutationRunner().run(tmp.getRoot().toPath().resolve("nope.yaml"), doc -> false);
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("nope.yaml"));
        }
    }

    @Test
    public void testRenameInHandwrittenLayoutTouchesOneLine() throws Exception {
        String text = Fixtures.text("handwritten.yaml");
        Path handwritten = tmp.newFile("handwritten.yaml").toPath();
        Files.writeString(handwritten, text);
        MutationResult result = new MutationRunner().run(handwritten, doc -> ResourceOps.rename(doc, "a", "Alpha"));
        assertEquals(text.replace("  name: A\n", "  name: Alpha\n"), Files.readString(handwritten));
        assertEquals(1, result.summary().added());
        assertEquals(1, result.summary().deleted());
    }

    @Test
    public void testRenameIdInHandwrittenLayoutKeepsCommentGaps() throws Exception {
        String text = Fixtures.text("handwritten.yaml");
        Path handwritten = tmp.newFile("handwritten.yaml").toPath();
        Files.writeString(handwritten, text);
        MutationResult result = new MutationRunner().apply(handwritten, List.of(
                new Operations.RenameResourceId("b", "postgres")));
        String expected = text.replace("- id: b\n", "- id: postgres\n")
                .replace("    to: b   # main path\n", "    to: postgres   # main path\n")
                .replace("  - from: b\n", "  - from: postgres\n");
        assertEquals(expected, Files.readString(handwritten));
        assertEquals(3, result.summary().added());
        assertEquals(3, result.summary().deleted());
    }
}
