package com.ilograph.edit.io;

import java.util.Map;
import java.util.Set;

/**
 * Formatting choices inferred from a document's source text and reapplied
 * when the document is written back.
 *
 * @param sequenceIndentStyle     global sequence indentation
 * @param topLevelSequenceIndents column of the first item for each top-level key holding a sequence
 * @param unquotedBrackets        reference values that were written without quotes
 */
public record FormatProfile(SequenceIndentStyle sequenceIndentStyle, Map<String, Integer> topLevelSequenceIndents,
        Set<BracketScalar> unquotedBrackets) {

    public FormatProfile {
        topLevelSequenceIndents = Map.copyOf(topLevelSequenceIndents);
        unquotedBrackets = Set.copyOf(unquotedBrackets);
    }

    /** Profile used for documents created from scratch. */
    public static FormatProfile defaults() {
        return new FormatProfile(SequenceIndentStyle.INDENTED, Map.of(), Set.of());
    }
}
