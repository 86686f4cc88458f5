package com.ilograph.edit.batch;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.engine.DocumentValidator;
import com.ilograph.edit.io.AnchorPreserver;
import com.ilograph.edit.io.DiagramYaml;
import com.ilograph.edit.io.LoadedDiagram;
import com.ilograph.edit.io.StyleRestorer;
import com.ilograph.edit.io.UnifiedDiff;
import lombok.extern.log4j.Log4j2;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs one all-or-nothing transaction against a diagram file: lock, load,
 * mutate, validate, serialize, then compare-and-swap write.
 *
 * <p>
 * Any failure leaves the file exactly as it was.
 */
@Log4j2
public final class MutationRunner {
    public static final String LOCK_WAIT_PROPERTY = "ilograph.edit.lockWaitMillis";

    private Duration lockWait = Duration.ofMillis(Long.getLong(LOCK_WAIT_PROPERTY, 0L));
    private int diffContext = UnifiedDiff.DEFAULT_CONTEXT;
    private boolean dryRun;

    public MutationRunner withLockWait(Duration wait) {
        this.lockWait = wait;
        return this;
    }

    public MutationRunner withDiffContext(int lines) {
        if (lines < 0) {
            throw new IllegalArgumentException("diff context must be >= 0");
        }
        this.diffContext = lines;
        return this;
    }

    public MutationRunner dryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    /** Applies a batch of operations as one transaction. */
    public MutationResult apply(Path file, List<? extends Operation> ops) {
        if (ops.isEmpty()) {
            throw new DiagramException("ops must contain at least one operation (example op: rename.resource)");
        }
        return run(file, document -> OperationDispatcher.applyAll(ops, document));
    }

    public MutationResult run(Path file, Mutation mutation) {
        try {
            if (dryRun) {
                return execute(file, mutation);
            }
            try (DiagramLock ignored = DiagramLock.acquire(file, lockWait)) {
                return execute(file, mutation);
            }
        } catch (UncheckedIOException e) {
            throw new DiagramException(e.getMessage() + ": " + e.getCause().getMessage(), e);
        }
    }

    private MutationResult execute(Path file, Mutation mutation) {
        LoadedDiagram loaded = DiagramYaml.load(file);
        Map<Integer, String> anchors = AnchorPreserver.snapshot(loaded.document());

        if (!mutation.apply(loaded.document())) {
            return unchanged(loaded);
        }
        AnchorPreserver.restore(loaded.document(), anchors);
        DocumentValidator.requireValidForWrite(loaded.document());

        String after = StyleRestorer.restore(loaded.text(),
                DiagramYaml.dump(loaded.document(), loaded.profile()));
        if (after.equals(loaded.text())) {
            return unchanged(loaded);
        }
        String path = file.toString().replace('\\', '/');
        List<String> diff = UnifiedDiff.render(loaded.text(), after, path, diffContext);
        UnifiedDiff.Summary summary = UnifiedDiff.summarize(diff);
        List<UnifiedDiff.SectionChange> sections = UnifiedDiff.touchedSections(loaded.text(), after);

        if (dryRun) {
            log.debug("Dry run on {}: {}", file, summary);
            return new MutationResult(MutationResult.Status.WOULD_WRITE, diff, summary, sections, after);
        }
        AtomicWriter.write(file, loaded.text(), after);
        log.info("Wrote {} {} sections={}", file, summary, sections);
        return new MutationResult(MutationResult.Status.WRITTEN, diff, summary, sections, after);
    }

    private static MutationResult unchanged(LoadedDiagram loaded) {
        log.debug("No changes for {}", loaded.path());
        return new MutationResult(MutationResult.Status.UNCHANGED, List.of(), new UnifiedDiff.Summary(0, 0, 0),
                List.of(), loaded.text());
    }
}
