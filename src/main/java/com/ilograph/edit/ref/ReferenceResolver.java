package com.ilograph.edit.ref;

import com.ilograph.edit.api.ResolveRow;
import com.ilograph.edit.api.ResolveStatus;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies every token of a reference expression against a document.
 *
 * <p>
 * Precedence per token: special, wildcard, alias of the selected perspective,
 * namespaced (imported or not), then the id/name index (unresolved, ambiguous
 * or resolved).
 */
public final class ReferenceResolver {
    private static final String NONE = "-";

    private ReferenceResolver() {
        // Utility class
    }

    /**
     * @param perspective identifier whose alias table applies; null or an unknown
     *                    identifier means no aliases
     */
    public static List<ResolveRow> resolve(DocMap document, String expression, String perspective) {
        Map<String, List<String>> index = DocumentIndex.referencePaths(document);
        Map<String, String> aliases = aliasesFor(document, perspective);
        Set<String> namespaces = DocumentIndex.importNamespaces(document);

        List<ResolveRow> rows = new ArrayList<>();
        List<String> parts = ReferenceParser.splitList(expression);
        if (parts.isEmpty()) {
            rows.add(new ResolveRow(expression, NONE, ResolveStatus.EMPTY, NONE));
            return rows;
        }

        for (String part : parts) {
            List<ReferenceComponent> components = ReferenceParser.parseSegment(part);
            if (components.isEmpty()) {
                rows.add(new ResolveRow(part, NONE, ResolveStatus.EMPTY, NONE));
                continue;
            }
            for (ReferenceComponent c : components) {
                rows.add(classify(part, c, index, aliases, namespaces));
            }
        }
        return rows;
    }

    /** Alias table of the first perspective with that identifier; empty when none matches. */
    private static Map<String, String> aliasesFor(DocMap document, String perspective) {
        if (perspective == null) {
            return Map.of();
        }
        for (PerspectiveLocation loc : DocumentIndex.perspectives(document)) {
            if (loc.identifier().equals(perspective)) {
                return DocumentIndex.aliasTable(loc.node());
            }
        }
        return Map.of();
    }

    private static ResolveRow classify(String part, ReferenceComponent c, Map<String, List<String>> index,
            Map<String, String> aliases, Set<String> namespaces) {
        String token = c.token();
        if (c.special()) {
            return new ResolveRow(part, token, ResolveStatus.SPECIAL, NONE);
        }
        if (c.wildcard()) {
            return new ResolveRow(part, token, ResolveStatus.WILDCARD, NONE);
        }
        if (aliases.containsKey(token)) {
            return new ResolveRow(part, token, ResolveStatus.ALIAS, aliases.get(token));
        }
        if (c.namespaced()) {
            ResolveStatus status = namespaces.contains(c.namespace())
                    ? ResolveStatus.IMPORTED_NAMESPACE
                    : ResolveStatus.UNRESOLVED_NAMESPACE;
            return new ResolveRow(part, token, status, NONE);
        }
        List<String> paths = index.getOrDefault(token, List.of());
        if (paths.isEmpty()) {
            return new ResolveRow(part, token, ResolveStatus.UNRESOLVED, NONE);
        }
        if (paths.size() > 1) {
            return new ResolveRow(part, token, ResolveStatus.AMBIGUOUS, String.join(", ", paths));
        }
        return new ResolveRow(part, token, ResolveStatus.RESOLVED, paths.get(0));
    }
}
