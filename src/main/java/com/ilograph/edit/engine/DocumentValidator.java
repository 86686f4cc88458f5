package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.api.ValidationIssue;
import com.ilograph.edit.api.ValidationMode;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;
import com.ilograph.edit.index.ReferenceField;
import com.ilograph.edit.index.ReferenceFields;
import com.ilograph.edit.index.ReferenceSection;
import com.ilograph.edit.index.ResourceLocation;
import com.ilograph.edit.ref.ReferenceComponent;
import com.ilograph.edit.ref.ReferenceParser;

import java.util.*;

/**
 * Consistency checks over a whole document.
 *
 * <p>
 * Rule codes:
 * <ul>
 * <li>{@code duplicate-resource-id}, {@code duplicate-perspective-id}: explicit ids must be unique</li>
 * <li>{@code restricted-resource-id-char}, {@code restricted-alias-char}: ids and aliases may not
 * contain reference syntax</li>
 * <li>{@code name-needs-id}: a name with reference syntax needs an explicit id</li>
 * <li>{@code broken-reference}: a reference token that names nothing known</li>
 * </ul>
 *
 * <p>
 * {@link ValidationMode#STRICT} gates every write. In
 * {@link ValidationMode#ILOGRAPH_NATIVE} namespaced tokens are accepted
 * without a matching import.
 */
public final class DocumentValidator {
    public static final String DUPLICATE_RESOURCE_ID = "duplicate-resource-id";
    public static final String DUPLICATE_PERSPECTIVE_ID = "duplicate-perspective-id";
    public static final String RESTRICTED_RESOURCE_ID_CHAR = "restricted-resource-id-char";
    public static final String NAME_NEEDS_ID = "name-needs-id";
    public static final String RESTRICTED_ALIAS_CHAR = "restricted-alias-char";
    public static final String BROKEN_REFERENCE = "broken-reference";

    private DocumentValidator() {
        // Utility class
    }

    public static List<ValidationIssue> validate(DocMap document, ValidationMode mode) {
        List<ValidationIssue> issues = new ArrayList<>();
        duplicateResourceIds(document, issues);
        duplicatePerspectiveIds(document, issues);
        restrictedChars(document, issues);
        brokenReferences(document, mode, issues);
        return issues;
    }

    public static CheckResult check(DocMap document, ValidationMode mode) {
        return new CheckResult(mode, validate(document, mode));
    }

    /**
     * Rejects a document that fails strict validation, listing the first
     * issues in the message.
     */
    public static void requireValidForWrite(DocMap document) {
        List<ValidationIssue> issues = validate(document, ValidationMode.STRICT);
        if (!issues.isEmpty()) {
            throw DiagramException.of("mutation would produce invalid document (" + issues.size()
                    + " issue(s), strict mode):", issues.stream().map(ValidationIssue::render).toList());
        }
    }

    // ── Uniqueness ───────────────────────────────────────────────────

    private static void duplicateResourceIds(DocMap document, List<ValidationIssue> issues) {
        List<ResourceLocation> withId = DocumentIndex.resources(document).stream()
                .filter(l -> l.explicitId() != null)
                .toList();
        Map<String, Integer> counts = new HashMap<>();
        withId.forEach(l -> counts.merge(l.explicitId(), 1, Integer::sum));
        for (ResourceLocation loc : withId) {
            if (counts.get(loc.explicitId()) > 1) {
                issues.add(new ValidationIssue(DUPLICATE_RESOURCE_ID, loc.path(),
                        "duplicate resource id: " + loc.explicitId() + " (ids must be unique)"));
            }
        }
    }

    private static void duplicatePerspectiveIds(DocMap document, List<ValidationIssue> issues) {
        DocList perspectives = document.getList("perspectives");
        if (perspectives == null) {
            return;
        }
        Map<String, Integer> counts = new HashMap<>();
        for (DocMap p : perspectives.maps()) {
            String id = p.getTrimmed("id");
            if (id != null) {
                counts.merge(id, 1, Integer::sum);
            }
        }
        for (int i = 0; i < perspectives.size(); i++) {
            if (perspectives.get(i) instanceof DocMap p && p.getTrimmed("id") != null
                    && counts.get(p.getTrimmed("id")) > 1) {
                issues.add(new ValidationIssue(DUPLICATE_PERSPECTIVE_ID, "perspectives[" + i + "]",
                        "duplicate perspective id: " + p.getTrimmed("id") + " (ids must be unique)"));
            }
        }
    }

    // ── Restricted characters ────────────────────────────────────────

    private static void restrictedChars(DocMap document, List<ValidationIssue> issues) {
        for (ResourceLocation loc : DocumentIndex.resources(document)) {
            String id = loc.node().getString("id");
            if (id != null) {
                Character bad = ReferenceParser.firstRestrictedChar(id);
                if (bad != null) {
                    issues.add(new ValidationIssue(RESTRICTED_RESOURCE_ID_CHAR, loc.path() + ".id",
                            "resource id contains restricted char '" + bad + "' (use letters, digits, ., -, _)"));
                }
            }
            String name = loc.node().getString("name");
            if (name != null && !loc.node().containsKey("id")) {
                Character bad = ReferenceParser.firstRestrictedChar(name);
                if (bad != null) {
                    issues.add(new ValidationIssue(NAME_NEEDS_ID, loc.path() + ".name",
                            "resource name has restricted char and requires explicit id ('" + bad
                                    + "'; add a clean `id` field)"));
                }
            }
        }

        DocList perspectives = document.getList("perspectives");
        if (perspectives == null) {
            return;
        }
        for (int p = 0; p < perspectives.size(); p++) {
            DocList aliases = perspectives.get(p) instanceof DocMap m ? m.getList("aliases") : null;
            if (aliases == null) {
                continue;
            }
            for (int a = 0; a < aliases.size(); a++) {
                String alias = aliases.get(a) instanceof DocMap m ? m.getString("alias") : null;
                Character bad = alias == null ? null : ReferenceParser.firstRestrictedChar(alias);
                if (bad != null) {
                    issues.add(new ValidationIssue(RESTRICTED_ALIAS_CHAR,
                            "perspectives[" + p + "].aliases[" + a + "].alias",
                            "alias contains restricted char '" + bad + "' (use letters, digits, ., -, _)"));
                }
            }
        }
    }

    // ── References ───────────────────────────────────────────────────

    private static void brokenReferences(DocMap document, ValidationMode mode, List<ValidationIssue> issues) {
        Set<String> known = knownIdentifiers(document);
        Set<String> contextNames = DocumentIndex.contextNames(document);
        Set<String> namespaces = DocumentIndex.importNamespaces(document);
        Map<String, Set<String>> aliases = new HashMap<>();
        for (PerspectiveLocation p : DocumentIndex.perspectives(document)) {
            aliases.computeIfAbsent(p.identifier(), k -> new HashSet<>())
                    .addAll(DocumentIndex.aliasTable(p.node()).keySet());
        }

        Set<String> emitted = new HashSet<>();
        for (ReferenceField field : ReferenceFields.validated(document)) {
            if (field.section() == ReferenceSection.CONTEXTS) {
                for (String token : EngineSupport.splitTokens(field.value())) {
                    if (!contextNames.contains(token) && emitted.add(field.path() + "\u0000" + token)) {
                        issues.add(new ValidationIssue(BROKEN_REFERENCE, field.path(), "unknown context '" + token
                                + "' in extends (expected values from contexts[].name)"));
                    }
                }
                continue;
            }
            Set<String> scope = field.perspective() == null ? Set.of()
                    : aliases.getOrDefault(field.perspective(), Set.of());
            for (ReferenceComponent c : ReferenceParser.parseComponents(field.value())) {
                String token = c.token();
                if (!c.isPlain() || known.contains(token) || scope.contains(token)) {
                    continue;
                }
                if (c.namespaced() && (namespaces.contains(c.namespace()) || mode == ValidationMode.ILOGRAPH_NATIVE)) {
                    continue;
                }
                if (emitted.add(field.path() + "\u0000" + token)) {
                    issues.add(new ValidationIssue(BROKEN_REFERENCE, field.path(), "unknown reference '" + token
                            + "' (not found in resources, aliases, or imports)"));
                }
            }
        }
    }

    private static Set<String> knownIdentifiers(DocMap document) {
        Set<String> known = new HashSet<>(DocumentIndex.referencePaths(document).keySet());
        DocumentIndex.perspectives(document).forEach(p -> known.add(p.identifier()));
        return known;
    }
}
