package com.ilograph.edit;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.api.ResolveRow;
import com.ilograph.edit.api.ResolveStatus;
import com.ilograph.edit.api.ValidationMode;
import com.ilograph.edit.batch.MutationResult;
import com.ilograph.edit.batch.MutationRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class IloEditTest {

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
    public void testCheckSample() {
        assertTrue(IloEdit.check(file, ValidationMode.STRICT).isOk());
    }

    @Test
    public void testResolveAlias() {
        List<ResolveRow> rows = IloEdit.resolve(file, "backend", "flow");
        assertEquals(1, rows.size());
        assertEquals(ResolveStatus.ALIAS, rows.get(0).status());
    }

    @Test
    public void testImpactAsJson() {
        String json = IloEdit.toJson(IloEdit.impact(file, "db"));
        assertTrue(json, json.contains("\"section\" : \"contexts:Storage\""));
    }

    @Test
    public void testFmtStable() throws Exception {
        MutationResult result = IloEdit.fmtStable(file);
        assertFalse(result.changed());
        assertEquals(original, Files.readString(file));
    }

    @Test
    public void testApplyInline() throws Exception {
        MutationResult result = IloEdit.applyInline(file, List.of(
                "{\"op\": \"resource.create\", \"id\": \"queue\", \"name\": \"Queue\"}",
                "{\"op\": \"relation.add\", \"perspective\": \"flow\", \"from\": \"web\", \"to\": \"queue\"}"),
                new MutationRunner());
        assertEquals(MutationResult.Status.WRITTEN, result.status());
        String written = Files.readString(file);
        assertTrue(written.contains("id: queue"));
        assertTrue(written.contains("to: queue"));
    }

    @Test
    public void testApplyOpsFileDryRun() throws Exception {
        Path ops = tmp.newFile("ops.yaml").toPath();
        Files.writeString(ops, "ops:\n  - op: rename.resource\n    id: db\n    name: Primary DB\n");
        MutationResult result = IloEdit.applyOpsFile(file, ops, new MutationRunner().dryRun(true));
        assertEquals(MutationResult.Status.WOULD_WRITE, result.status());
        assertTrue(result.diff().contains("+    name: Primary DB"));
        assertEquals(original, Files.readString(file));
    }

    @Test
    public void testMissingFile() {
        try {
            IloEdit.load(tmp.getRoot().toPath().resolve("absent.yaml"));
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("absent.yaml"));
        }
    }
}
