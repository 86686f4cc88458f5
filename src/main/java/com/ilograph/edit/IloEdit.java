package com.ilograph.edit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.api.ImpactHit;
import com.ilograph.edit.api.ResolveRow;
import com.ilograph.edit.api.ValidationMode;
import com.ilograph.edit.batch.MutationResult;
import com.ilograph.edit.batch.MutationRunner;
import com.ilograph.edit.batch.Operation;
import com.ilograph.edit.batch.OpsFileParser;
import com.ilograph.edit.engine.CheckResult;
import com.ilograph.edit.engine.DocumentValidator;
import com.ilograph.edit.engine.ImpactAnalyzer;
import com.ilograph.edit.io.DiagramYaml;
import com.ilograph.edit.io.LoadedDiagram;
import com.ilograph.edit.io.UnifiedDiff;
import com.ilograph.edit.ref.ReferenceResolver;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * File-level entry points: read-only diagnostics and transactional edits.
 */
public final class IloEdit {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IloEdit() {
        // Utility class
    }

    // ── Read-only ────────────────────────────────────────────────────

    public static LoadedDiagram load(Path file) {
        try {
            return DiagramYaml.load(file);
        } catch (UncheckedIOException e) {
            throw new DiagramException(e.getMessage() + ": " + e.getCause().getMessage(), e);
        }
    }

    public static CheckResult check(Path file, ValidationMode mode) {
        return DocumentValidator.check(load(file).document(), mode);
    }

    public static List<ResolveRow> resolve(Path file, String expression, String perspective) {
        return ReferenceResolver.resolve(load(file).document(), expression, perspective);
    }

    public static List<ImpactHit> impact(Path file, String identifier) {
        return ImpactAnalyzer.impact(load(file).document(), identifier);
    }

    // ── Edits ────────────────────────────────────────────────────────

    /** Applies an ops file to {@code file} as one transaction. */
    public static MutationResult applyOpsFile(Path file, Path opsFile, MutationRunner runner) {
        List<Operation> ops = OpsFileParser.parseFile(opsFile);
        return runner.apply(file, ops);
    }

    /** Applies inline JSON operations, each an object with an {@code op} key. */
    public static MutationResult applyInline(Path file, List<String> opJson, MutationRunner runner) {
        List<Operation> ops = opJson.stream().map(OpsFileParser::parseInline).toList();
        return runner.apply(file, ops);
    }

    /**
     * Loads and strictly validates {@code file} without changing it. Fails
     * when the file would not pass the write gate.
     */
    public static MutationResult fmtStable(Path file) {
        LoadedDiagram loaded = load(file);
        DocumentValidator.requireValidForWrite(loaded.document());
        return new MutationResult(MutationResult.Status.UNCHANGED, List.of(), new UnifiedDiff.Summary(0, 0, 0),
                List.of(), loaded.text());
    }

    /** Pretty JSON rendering of diagnostics rows. */
    public static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DiagramException("Failed to render JSON: " + e.getOriginalMessage(), e);
        }
    }
}
