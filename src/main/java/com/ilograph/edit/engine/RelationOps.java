package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;
import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * Relation CRUD inside perspectives, addressed by 1-based index, plus the
 * match-many variants that apply one template across several perspectives
 * and contexts.
 */
@Log4j2
public final class RelationOps {
    private RelationOps() {
        // Utility class
    }

    // ── Listing ──────────────────────────────────────────────────────

    /**
     * Lists relations of the given perspectives (all when null) that match
     * {@code filter}; a null filter matches everything.
     */
    public static List<RelationRow> list(DocMap document, List<String> perspectives, RelationSpec filter) {
        List<String> selected = perspectives == null
                ? DocumentIndex.perspectives(document).stream().map(PerspectiveLocation::identifier).toList()
                : perspectives;
        Map<String, Object> expected = filter == null ? Map.of() : filter.values();
        List<RelationRow> rows = new ArrayList<>();
        for (String id : selected) {
            PerspectiveLocation p = DocumentIndex.singlePerspective(document, id);
            DocList relations = p.node().getList("relations");
            if (relations == null) {
                continue;
            }
            for (int i = 0; i < relations.size(); i++) {
                if (relations.get(i) instanceof DocMap r && matches(r, expected)) {
                    rows.add(new RelationRow(p.identifier(), i + 1, r.getString("from"), r.getString("to"),
                            r.getString("via"), r.getString("label"), r.getString("description"),
                            r.getString("arrowDirection"), r.getString("color"), secondary(r)));
                }
            }
        }
        return rows;
    }

    // ── Single relation ──────────────────────────────────────────────

    public static boolean add(DocMap document, String perspective, RelationSpec spec) {
        if (spec.from() == null && spec.to() == null) {
            throw new DiagramException("relation requires from or to (set --from and/or --to)");
        }
        PerspectiveLocation p = DocumentIndex.singlePerspective(document, perspective);
        DocMap relation = new DocMap();
        spec.values().forEach((k, v) -> EngineSupport.putValue(relation, k, v));
        p.node().ensureList("relations").add(relation);
        return true;
    }

    public static boolean remove(DocMap document, String perspective, int index1) {
        DocList relations = existingRelations(document, perspective, "nothing to remove");
        relations.remove(relationIndex(index1, relations));
        return true;
    }

    /**
     * Sets the non-null values of {@code set}, then drops the {@code clear}
     * keys. The relation must keep {@code from} or {@code to}.
     */
    public static boolean edit(DocMap document, String perspective, int index1, RelationSpec set,
            Collection<RelationField> clear) {
        DocList relations = existingRelations(document, perspective, "nothing to edit");
        int idx = relationIndex(index1, relations);
        if (!(relations.get(idx) instanceof DocMap relation)) {
            throw new DiagramException("relation at index " + index1 + " is not a mapping/object");
        }
        Map<String, Object> values = new LinkedHashMap<>(set == null ? Map.of() : set.values());
        clear.forEach(f -> values.remove(f.key()));
        if (!patch(relation.deepCopy(), values, clear)) {
            return false;
        }
        patch(relation, values, clear);
        return true;
    }

    private static DocList existingRelations(DocMap document, String perspective, String hint) {
        PerspectiveLocation p = DocumentIndex.singlePerspective(document, perspective);
        DocList relations = p.node().getList("relations");
        if (relations == null) {
            throw new DiagramException("perspective has no relations: " + perspective + " (" + hint + ")");
        }
        return relations;
    }

    private static int relationIndex(int index1, DocList relations) {
        if (index1 < 1) {
            throw new DiagramException("--index must be >= 1 (1-based relation index)");
        }
        if (index1 > relations.size()) {
            throw new DiagramException("relation index out of range: " + index1 + " (valid range: 1.."
                    + relations.size() + ")");
        }
        return index1 - 1;
    }

    // ── Match-many ───────────────────────────────────────────────────

    /** Adds the rendered template to every target perspective, once per distinct rendering. */
    public static int addMany(DocMap document, RelationTarget target, RelationSpec template) {
        List<String> perspectives = resolvePerspectives(document, target);
        List<Map<String, Object>> payloads = expand(template, resolveContexts(document, target));
        for (Map<String, Object> payload : payloads) {
            if (!payload.containsKey("from") && !payload.containsKey("to")) {
                throw new DiagramException("relation requires from or to (set --from and/or --to)");
            }
        }
        int added = 0;
        for (String perspective : perspectives) {
            DocList relations = DocumentIndex.singlePerspective(document, perspective).node()
                    .ensureList("relations");
            for (Map<String, Object> payload : payloads) {
                DocMap relation = new DocMap();
                payload.forEach((k, v) -> EngineSupport.putValue(relation, k, v));
                relations.add(relation);
                added++;
            }
        }
        log.debug("relation.add-many added {} relation(s) across {} perspective(s)", added, perspectives.size());
        return added;
    }

    /** Removes every relation matching any rendering of {@code match}. */
    public static int removeMatchMany(DocMap document, RelationTarget target, RelationSpec match,
            boolean requireMatch) {
        List<String> perspectives = resolvePerspectives(document, target);
        List<Map<String, Object>> patterns = expand(match, resolveContexts(document, target));
        int removed = 0;
        for (String perspective : perspectives) {
            DocList relations = DocumentIndex.singlePerspective(document, perspective).node().getList("relations");
            if (relations == null) {
                continue;
            }
            for (int i = relations.size() - 1; i >= 0; i--) {
                if (relations.get(i) instanceof DocMap r && patterns.stream().anyMatch(m -> matches(r, m))) {
                    relations.remove(i);
                    removed++;
                }
            }
        }
        if (requireMatch && removed == 0) {
            throw new DiagramException("no relations matched for relation.remove-match "
                    + "(adjust match/target or set requireMatch=false)");
        }
        return removed;
    }

    /**
     * Patches every matching relation with the first matching rendering's
     * {@code set} values, then drops the {@code clear} keys. Counts relations
     * that actually changed.
     */
    public static int editMatchMany(DocMap document, RelationTarget target, RelationSpec match, RelationSpec set,
            Collection<RelationField> clear, boolean requireMatch) {
        List<String> perspectives = resolvePerspectives(document, target);
        List<String> contexts = resolveContexts(document, target);
        List<EditSpec> specs = expandEdits(match, set, contexts);

        // Patch copies first so a failing patch leaves every relation untouched.
        Map<DocMap, EditSpec> pending = new LinkedHashMap<>();
        for (String perspective : perspectives) {
            DocList relations = DocumentIndex.singlePerspective(document, perspective).node().getList("relations");
            if (relations == null) {
                continue;
            }
            for (DocMap relation : relations.maps()) {
                for (EditSpec spec : specs) {
                    if (matches(relation, spec.match())) {
                        if (patch(relation.deepCopy(), spec.set(), clear)) {
                            pending.put(relation, spec);
                        }
                        break;
                    }
                }
            }
        }
        pending.forEach((relation, spec) -> patch(relation, spec.set(), clear));
        if (requireMatch && pending.isEmpty()) {
            throw new DiagramException("no relations matched for relation.edit-match "
                    + "(adjust match/target or set requireMatch=false)");
        }
        return pending.size();
    }

    private record EditSpec(Map<String, Object> match, Map<String, Object> set) {
    }

    private static List<EditSpec> expandEdits(RelationSpec match, RelationSpec set, List<String> contexts) {
        List<EditSpec> specs = new ArrayList<>();
        Set<List<Object>> seen = new HashSet<>();
        for (String context : contexts == null ? Collections.<String>singletonList(null) : contexts) {
            Map<String, Object> m = match == null ? Map.of() : match.render(context);
            Map<String, Object> s = set == null ? Map.of() : set.render(context);
            if (seen.add(List.of(signature(m), signature(s)))) {
                specs.add(new EditSpec(m, s));
            }
        }
        return specs;
    }

    private static List<Map<String, Object>> expand(RelationSpec template, List<String> contexts) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (contexts == null) {
            out.add(template.render(null));
            return out;
        }
        Set<String> seen = new HashSet<>();
        for (String context : contexts) {
            Map<String, Object> rendered = template.render(context);
            if (seen.add(signature(rendered))) {
                out.add(rendered);
            }
        }
        return out;
    }

    private static String signature(Map<String, Object> values) {
        return new TreeMap<>(values).toString();
    }

    private static List<String> resolvePerspectives(DocMap document, RelationTarget target) {
        List<String> available = DocumentIndex.perspectives(document).stream()
                .map(PerspectiveLocation::identifier).toList();
        if (available.isEmpty()) {
            throw new DiagramException("diagram has no perspectives (cannot apply relation operation)");
        }
        if (target.isAllPerspectives()) {
            return available;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String id : target.perspectives()) {
            if (!seen.add(id)) {
                throw new DiagramException("target.perspectives has duplicate: " + id);
            }
            DocumentIndex.singlePerspective(document, id);
        }
        return new ArrayList<>(seen);
    }

    private static List<String> resolveContexts(DocMap document, RelationTarget target) {
        if (target.contexts() == null) {
            return null;
        }
        Set<String> available = DocumentIndex.contextNames(document);
        List<String> missing = target.contexts().stream().filter(c -> !available.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new DiagramException("unknown context(s): " + String.join(", ", missing)
                    + " (expected values from contexts[].name)");
        }
        return target.contexts();
    }

    // ── Matching and patching ────────────────────────────────────────

    /** A missing {@code secondary} counts as false; other keys compare as strings. */
    static boolean matches(DocMap relation, Map<String, Object> expected) {
        for (Map.Entry<String, Object> e : expected.entrySet()) {
            if (e.getKey().equals(RelationField.SECONDARY.key())) {
                if (!e.getValue().equals(secondary(relation))) {
                    return false;
                }
            } else if (!e.getValue().equals(relation.getString(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean secondary(DocMap relation) {
        return Boolean.TRUE.equals(EngineSupport.booleanValue(relation.get(RelationField.SECONDARY.key())));
    }

    private static boolean patch(DocMap relation, Map<String, Object> set, Collection<RelationField> clear) {
        List<String> before = EngineSupport.snapshot(relation);
        for (RelationField field : clear) {
            relation.remove(field.key());
        }
        set.forEach((k, v) -> EngineSupport.putValue(relation, k, v));
        if (!relation.containsKey("from") && !relation.containsKey("to")) {
            throw new DiagramException("relation must define from or to");
        }
        return !before.equals(EngineSupport.snapshot(relation));
    }
}
