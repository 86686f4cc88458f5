package com.ilograph.edit.engine;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.api.ValidationIssue;
import com.ilograph.edit.api.ValidationMode;

import java.util.*;

/**
 * Validator output with rule filtering and a per-code summary.
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
@JsonPropertyOrder({ "ok", "mode", "summary", "issues" })
public final class CheckResult {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ValidationMode mode;
    private final List<ValidationIssue> issues;

    public CheckResult(ValidationMode mode, List<ValidationIssue> issues) {
        this.mode = mode;
        this.issues = List.copyOf(issues);
    }

    public ValidationMode mode() {
        return mode;
    }

    @JsonProperty("issues")
    public List<ValidationIssue> getIssues() {
        return issues;
    }

    @JsonProperty("ok")
    public boolean isOk() {
        return issues.isEmpty();
    }

    @JsonProperty("mode")
    public String modeLabel() {
        return mode.label();
    }

    /** Issue count per rule code, codes sorted. */
    public Map<String, Integer> getSummaryByCode() {
        Map<String, Integer> counts = new TreeMap<>();
        issues.forEach(i -> counts.merge(i.code(), 1, Integer::sum));
        return counts;
    }

    @JsonProperty("summary")
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", issues.size());
        summary.put("by_code", getSummaryByCode());
        return summary;
    }

    /**
     * Keeps issues whose code is in {@code only} (when non-empty) and not in
     * {@code ignore}. Entries may be comma-separated lists.
     */
    public CheckResult filter(Collection<String> only, Collection<String> ignore) {
        Set<String> onlyCodes = ruleNames(only);
        Set<String> ignoreCodes = ruleNames(ignore);
        List<ValidationIssue> kept = issues.stream()
                .filter(i -> onlyCodes.isEmpty() || onlyCodes.contains(i.code()))
                .filter(i -> !ignoreCodes.contains(i.code()))
                .toList();
        return new CheckResult(mode, kept);
    }

    private static Set<String> ruleNames(Collection<String> raw) {
        Set<String> names = new HashSet<>();
        if (raw != null) {
            for (String item : raw) {
                for (String candidate : item.split(",")) {
                    if (!candidate.isBlank()) {
                        names.add(candidate.strip());
                    }
                }
            }
        }
        return names;
    }

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new DiagramException("failed to render check result: " + e.getOriginalMessage(), e);
        }
    }
}
