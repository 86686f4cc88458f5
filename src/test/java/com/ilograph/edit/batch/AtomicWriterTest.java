package com.ilograph.edit.batch;

import com.ilograph.edit.api.DiagramException;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class AtomicWriterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testReplacesContent() throws Exception {
        Path target = tmp.newFile("diagram.yaml").toPath();
        Files.writeString(target, "resources: []\n");
        AtomicWriter.write(target, "resources: []\n", "resources:\n  - id: a\n");
        assertEquals("resources:\n  - id: a\n", Files.readString(target));
        File[] left = tmp.getRoot().listFiles();
        assertEquals(1, left.length);
    }

    @Test
    public void testRejectsStaleExpectation() throws Exception {
        Path target = tmp.newFile("diagram.yaml").toPath();
        Files.writeString(target, "resources: []\n# touched\n");
        try {
            AtomicWriter.write(target, "resources: []\n", "resources:\n  - id: a\n");
            fail();
        } catch (DiagramException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("file changed on disk since it was read: "));
        }
        assertEquals("resources: []\n# touched\n", Files.readString(target));
    }
}
