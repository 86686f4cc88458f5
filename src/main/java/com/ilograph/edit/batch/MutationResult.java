package com.ilograph.edit.batch;

import com.ilograph.edit.io.UnifiedDiff;

import java.util.List;

/**
 * Outcome of one transaction.
 *
 * @param diff    unified diff of the file before and after; empty when unchanged
 * @param after   text that was (or, for a dry run, would be) written
 */
public record MutationResult(Status status, List<String> diff, UnifiedDiff.Summary summary,
        List<UnifiedDiff.SectionChange> sections, String after) {

    public enum Status {
        /** The file was rewritten. */
        WRITTEN,
        /** Dry run; the file would have been rewritten. */
        WOULD_WRITE,
        /** Nothing to write. */
        UNCHANGED
    }

    public boolean changed() {
        return status != Status.UNCHANGED;
    }
}
