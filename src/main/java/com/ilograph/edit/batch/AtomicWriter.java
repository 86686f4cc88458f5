package com.ilograph.edit.batch;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.io.DiagramYaml;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Compare-and-swap file replacement through a same-directory temp file. */
@Log4j2
public final class AtomicWriter {
    private AtomicWriter() {
        // Utility class
    }

    /**
     * Replaces {@code target} with {@code text} provided its current content
     * is still {@code expected}.
     */
    public static void write(Path target, String expected, String text) {
        String current = DiagramYaml.readText(target);
        if (!current.equals(expected)) {
            throw new DiagramException("file changed on disk since it was read: " + target
                    + " (re-run the command against the current content)");
        }
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".tmp");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, replacing {} non-atomically", dir, target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException e) {
            throw new DiagramException("failed to write " + target + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
