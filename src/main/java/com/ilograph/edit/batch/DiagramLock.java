package com.ilograph.edit.batch;

import com.ilograph.edit.api.DiagramException;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * Advisory lock held as a sibling {@code <file>.lock} created atomically.
 * Released on {@link #close()}.
 */
@Log4j2
public final class DiagramLock implements AutoCloseable {
    private static final long POLL_MILLIS = 50;

    @Getter
    private final Path lockFile;

    private DiagramLock(Path lockFile) {
        this.lockFile = lockFile;
    }

    public static Path lockPathFor(Path target) {
        return target.resolveSibling(target.getFileName() + ".lock");
    }

    /**
     * Creates the lock file, retrying until {@code wait} has elapsed when it
     * already exists.
     */
    public static DiagramLock acquire(Path target, Duration wait) {
        Path lockFile = lockPathFor(target);
        long deadline = System.nanoTime() + wait.toNanos();
        byte[] content = ("pid=" + ProcessHandle.current().pid() + "\n").getBytes(StandardCharsets.UTF_8);
        while (true) {
            try {
                Files.write(lockFile, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.debug("Acquired lock {}", lockFile);
                return new DiagramLock(lockFile);
            } catch (FileAlreadyExistsException e) {
                if (System.nanoTime() >= deadline) {
                    throw new DiagramException("file is locked by another command: " + lockFile
                            + " (retry later or remove a stale lock)", e);
                }
                sleep();
            } catch (IOException e) {
                throw new DiagramException("cannot create lock file " + lockFile + ": " + e.getMessage(), e);
            }
        }
    }

    private static void sleep() {
        try {
            Thread.sleep(POLL_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiagramException("interrupted while waiting for lock", e);
        }
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(lockFile);
            log.debug("Released lock {}", lockFile);
        } catch (IOException e) {
            log.warn("Failed to remove lock file {}: {}", lockFile, e.getMessage());
        }
    }
}
