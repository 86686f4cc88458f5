package com.ilograph.edit.io;

import lombok.extern.log4j.Log4j2;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers a {@link FormatProfile} from raw source text.
 */
@Log4j2
public final class FormatProfiles {
    static final Pattern TOP_LEVEL_KEY_LINE = Pattern.compile("^(?<key>[A-Za-z_][A-Za-z0-9_-]*)\\s*:\\s*(?:#.*)?$");
    static final Pattern TOP_LEVEL_KEY_PREFIX = Pattern.compile("^[A-Za-z_][A-Za-z0-9_-]*\\s*:");
    static final Pattern SEQUENCE_LINE = Pattern.compile("^(?<indent>\\s*)-\\s");
    static final Pattern MAP_KEY_LINE = Pattern.compile(
            "^(?<indent>\\s*)(?<key>[A-Za-z_][A-Za-z0-9_-]*)\\s*:\\s*(?:#.*)?$");

    private FormatProfiles() {
        // Utility class
    }

    public static FormatProfile detect(String source) {
        List<String> lines = LineDiff.lines(source);
        FormatProfile profile = new FormatProfile(detectSequenceIndentStyle(lines),
                detectTopLevelSequenceIndents(lines), BracketScalars.detect(source));
        log.debug("Detected format profile: {}", profile);
        return profile;
    }

    /**
     * Majority vote over every {@code key:} line whose next significant line
     * opens a sequence item. Ties go to indentless; no samples means indented.
     */
    static SequenceIndentStyle detectSequenceIndentStyle(List<String> lines) {
        int indentless = 0;
        int indented = 0;
        for (int i = 0; i < lines.size(); i++) {
            Matcher key = MAP_KEY_LINE.matcher(lines.get(i));
            if (!key.matches()) {
                continue;
            }
            Integer itemIndent = nextSequenceIndent(lines, i + 1);
            if (itemIndent == null) {
                continue;
            }
            int delta = itemIndent - key.group("indent").length();
            if (delta == 0) {
                indentless++;
            } else if (delta >= 2) {
                indented++;
            }
        }
        if (indentless == 0 && indented == 0) {
            return SequenceIndentStyle.INDENTED;
        }
        return indentless >= indented ? SequenceIndentStyle.INDENTLESS : SequenceIndentStyle.INDENTED;
    }

    static Map<String, Integer> detectTopLevelSequenceIndents(List<String> lines) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher key = TOP_LEVEL_KEY_LINE.matcher(lines.get(i));
            if (!key.matches()) {
                continue;
            }
            Integer itemIndent = nextSequenceIndent(lines, i + 1);
            if (itemIndent != null) {
                out.put(key.group("key"), itemIndent);
            }
        }
        return out;
    }

    /** Indent of the sequence item opened by the next significant line, or null if it is something else. */
    private static Integer nextSequenceIndent(List<String> lines, int from) {
        for (int j = from; j < lines.size(); j++) {
            String candidate = lines.get(j);
            String stripped = candidate.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            Matcher seq = SEQUENCE_LINE.matcher(candidate);
            return seq.find() ? seq.group("indent").length() : null;
        }
        return null;
    }
}
