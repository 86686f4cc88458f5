package com.ilograph.edit.index;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;

import java.util.*;

/**
 * Read-only views over a diagram document.
 *
 * <p>
 * Two lookup disciplines exist. <b>By identifier</b> matches the id, or the
 * trimmed name when no id is set; it serves read paths and perspectives.
 * <b>By explicit id</b> matches only {@code id} and is what resource
 * mutations use. Both fail on zero or several matches.
 *
 * <p>
 * Views are rebuilt on every call: documents are small and mutations
 * invalidate any cache immediately.
 */
public final class DocumentIndex {
    private DocumentIndex() {
        // Utility class
    }

    // ── Identifiers ──────────────────────────────────────────────────

    /** Trimmed {@code id} if non-blank, else trimmed {@code name}, else null. */
    public static String identifier(DocMap node) {
        String id = node.getTrimmed("id");
        return id != null ? id : node.getTrimmed("name");
    }

    // ── Resources ────────────────────────────────────────────────────

    /** Depth-first walk of the resource forest. Nodes without identifier are skipped with their subtree. */
    public static List<ResourceLocation> resources(DocMap document) {
        List<ResourceLocation> out = new ArrayList<>();
        DocList roots = document.getList("resources");
        if (roots != null) {
            walk(roots, null, "resources", out);
        }
        return out;
    }

    private static void walk(DocList container, DocMap parent, String prefix, List<ResourceLocation> out) {
        for (int i = 0; i < container.size(); i++) {
            if (!(container.get(i) instanceof DocMap node)) {
                continue;
            }
            String identifier = identifier(node);
            if (identifier == null) {
                continue;
            }
            ResourceLocation loc = new ResourceLocation(identifier, node, parent, container, i,
                    prefix + "[" + i + "]");
            out.add(loc);
            DocList children = node.getList("children");
            if (children != null) {
                walk(children, node, loc.path() + ".children", out);
            }
        }
    }

    public static Map<String, List<ResourceLocation>> resourcesByIdentifier(DocMap document) {
        Map<String, List<ResourceLocation>> index = new LinkedHashMap<>();
        for (ResourceLocation loc : resources(document)) {
            index.computeIfAbsent(loc.identifier(), k -> new ArrayList<>()).add(loc);
        }
        return index;
    }

    public static Map<String, List<ResourceLocation>> resourcesById(DocMap document) {
        Map<String, List<ResourceLocation>> index = new LinkedHashMap<>();
        for (ResourceLocation loc : resources(document)) {
            String id = loc.explicitId();
            if (id != null) {
                index.computeIfAbsent(id, k -> new ArrayList<>()).add(loc);
            }
        }
        return index;
    }

    /** Every id and every name, each mapped to the paths that carry it. */
    public static Map<String, List<String>> referencePaths(DocMap document) {
        Map<String, List<String>> index = new LinkedHashMap<>();
        for (ResourceLocation loc : resources(document)) {
            String id = loc.node().getTrimmed("id");
            if (id != null) {
                index.computeIfAbsent(id, k -> new ArrayList<>()).add(loc.path());
            }
            String name = loc.node().getTrimmed("name");
            if (name != null) {
                List<String> paths = index.computeIfAbsent(name, k -> new ArrayList<>());
                // id and name may coincide on one node
                if (!paths.contains(loc.path())) {
                    paths.add(loc.path());
                }
            }
        }
        return index;
    }

    public static ResourceLocation singleResource(DocMap document, String identifier) {
        List<ResourceLocation> found = resourcesByIdentifier(document).getOrDefault(identifier, List.of());
        if (found.isEmpty()) {
            throw new DiagramException("resource not found: " + identifier
                    + " (lookup checks id first, then name)");
        }
        return requireUnique(identifier, found);
    }

    public static ResourceLocation singleResourceById(DocMap document, String id) {
        List<ResourceLocation> found = resourcesById(document).getOrDefault(id, List.of());
        if (found.isEmpty()) {
            throw new DiagramException("resource id not found: " + id
                    + " (expected exact match in resources[].id)");
        }
        return requireUnique(id, found);
    }

    private static ResourceLocation requireUnique(String key, List<ResourceLocation> found) {
        if (found.size() > 1) {
            StringJoiner paths = new StringJoiner(", ");
            found.forEach(l -> paths.add(l.path()));
            throw new DiagramException("resource id not unique: " + key + " (" + paths
                    + ") (set explicit unique ids)");
        }
        return found.get(0);
    }

    /** True when {@code candidate} is {@code node} or lies anywhere below it. */
    public static boolean isSelfOrDescendant(DocMap node, DocMap candidate) {
        if (node == candidate) {
            return true;
        }
        DocList children = node.getList("children");
        if (children == null) {
            return false;
        }
        for (DocMap child : children.maps()) {
            if (isSelfOrDescendant(child, candidate)) {
                return true;
            }
        }
        return false;
    }

    /** Explicit ids of every resource strictly below {@code node}. */
    public static List<String> descendantIds(DocMap node) {
        List<String> out = new ArrayList<>();
        DocList children = node.getList("children");
        if (children != null) {
            for (DocMap child : children.maps()) {
                String id = child.getTrimmed("id");
                if (id != null) {
                    out.add(id);
                }
                out.addAll(descendantIds(child));
            }
        }
        return out;
    }

    /** The resource forest, created when missing. */
    public static DocList ensureResources(DocMap document) {
        return document.ensureList("resources");
    }

    // ── Perspectives ─────────────────────────────────────────────────

    public static List<PerspectiveLocation> perspectives(DocMap document) {
        List<PerspectiveLocation> out = new ArrayList<>();
        DocList list = document.getList("perspectives");
        if (list == null) {
            return out;
        }
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) instanceof DocMap node) {
                String identifier = identifier(node);
                if (identifier != null) {
                    out.add(new PerspectiveLocation(identifier, node, i));
                }
            }
        }
        return out;
    }

    public static PerspectiveLocation singlePerspective(DocMap document, String identifier) {
        List<PerspectiveLocation> found = new ArrayList<>();
        for (PerspectiveLocation loc : perspectives(document)) {
            if (loc.identifier().equals(identifier)) {
                found.add(loc);
            }
        }
        if (found.isEmpty()) {
            throw new DiagramException("perspective not found: " + identifier
                    + " (lookup checks id first, then name)");
        }
        if (found.size() > 1) {
            StringJoiner indices = new StringJoiner(", ");
            found.forEach(l -> indices.add(Integer.toString(l.index())));
            throw new DiagramException("perspective id not unique: " + identifier + " (" + indices
                    + ") (set explicit unique ids)");
        }
        return found.get(0);
    }

    /** Alias name to {@code for} expression, in declaration order. */
    public static Map<String, String> aliasTable(DocMap perspective) {
        Map<String, String> table = new LinkedHashMap<>();
        DocList aliases = perspective.getList("aliases");
        if (aliases != null) {
            for (DocMap alias : aliases.maps()) {
                String name = alias.getString("alias");
                String target = alias.getString("for");
                if (name != null && target != null) {
                    table.put(name, target);
                }
            }
        }
        return table;
    }

    // ── Contexts ─────────────────────────────────────────────────────

    public static List<ContextLocation> contexts(DocMap document) {
        List<ContextLocation> out = new ArrayList<>();
        DocList list = document.getList("contexts");
        if (list == null) {
            return out;
        }
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) instanceof DocMap node) {
                String name = node.getTrimmed("name");
                if (name != null) {
                    out.add(new ContextLocation(name, node, i));
                }
            }
        }
        return out;
    }

    public static Set<String> contextNames(DocMap document) {
        Set<String> names = new LinkedHashSet<>();
        contexts(document).forEach(c -> names.add(c.name()));
        return names;
    }

    public static ContextLocation singleContext(DocMap document, String name) {
        if (document.getList("contexts") == null) {
            throw new DiagramException("diagram has no contexts");
        }
        List<ContextLocation> found = new ArrayList<>();
        for (ContextLocation loc : contexts(document)) {
            if (loc.name().equals(name)) {
                found.add(loc);
            }
        }
        if (found.isEmpty()) {
            throw new DiagramException("context not found: " + name);
        }
        if (found.size() > 1) {
            StringJoiner indices = new StringJoiner(", ");
            found.forEach(l -> indices.add(Integer.toString(l.index())));
            throw new DiagramException("context name not unique: " + name + " (" + indices + ")");
        }
        return found.get(0);
    }

    // ── Imports ──────────────────────────────────────────────────────

    public static Set<String> importNamespaces(DocMap document) {
        Set<String> namespaces = new LinkedHashSet<>();
        DocList imports = document.getList("imports");
        if (imports != null) {
            for (DocMap item : imports.maps()) {
                String ns = item.getTrimmed("namespace");
                if (ns != null) {
                    namespaces.add(ns);
                }
            }
        }
        return namespaces;
    }
}
