package com.ilograph.edit.batch;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.ilograph.edit.api.ArrowDirection;
import com.ilograph.edit.engine.RelationField;
import com.ilograph.edit.engine.RelationSpec;
import com.ilograph.edit.engine.RelationTarget;
import com.ilograph.edit.engine.SequenceStep;
import com.ilograph.edit.engine.Slide;
import com.ilograph.edit.engine.SlideField;
import com.ilograph.edit.ref.ReferenceParser;

import java.util.*;

/**
 * Typed operation records, one per {@link OperationKind}. Field names follow
 * the ops file keys; snake_case spellings are accepted as aliases.
 */
public final class Operations {
    private Operations() {
        // Utility class
    }

    // ── Resources ────────────────────────────────────────────────────

    public record ResourceCreate(String id, String name, String parent, String subtitle) implements Operation {
        public OperationKind kind() {
            return OperationKind.RESOURCE_CREATE;
        }

        /** Defaults to the root. */
        public String parentOrRoot() {
            return parent == null ? "none" : parent;
        }

        public List<String> validate() {
            return new Problems().cleanId("id", id).required("name", name).optional("parent", parent)
                    .list();
        }
    }

    public record ResourceDelete(String id, @JsonAlias("delete_subtree") boolean deleteSubtree) implements Operation {
        public OperationKind kind() {
            return OperationKind.RESOURCE_DELETE;
        }

        public List<String> validate() {
            return new Problems().required("id", id).list();
        }
    }

    public record ResourceClone(String id, @JsonAlias("new_id") String newId,
            @JsonAlias("new_parent") String newParent, @JsonAlias("new_name") String newName,
            @JsonAlias("with_children") boolean withChildren) implements Operation {
        public OperationKind kind() {
            return OperationKind.RESOURCE_CLONE;
        }

        public List<String> validate() {
            Problems p = new Problems().required("id", id).cleanId("newId", newId).optional("newParent", newParent)
                    .optional("newName", newName);
            if (id != null && newId != null && id.strip().equals(newId.strip())) {
                p.add("newId", "id/new-id are identical");
            }
            return p.list();
        }
    }

    public record RenameResource(String id, String name) implements Operation {
        public OperationKind kind() {
            return OperationKind.RENAME_RESOURCE;
        }

        public List<String> validate() {
            return new Problems().required("id", id).required("name", name).list();
        }
    }

    public record RenameResourceId(String from, String to) implements Operation {
        public OperationKind kind() {
            return OperationKind.RENAME_RESOURCE_ID;
        }

        public List<String> validate() {
            Problems p = new Problems().required("from", from).cleanId("to", to);
            if (from != null && to != null && from.strip().equals(to.strip())) {
                p.add("to", "--from and --to must be different");
            }
            return p.list();
        }
    }

    public record MoveResource(String id, @JsonAlias("new_parent") String newParent,
            @JsonAlias("inherit_style_from_parent") boolean inheritStyleFromParent) implements Operation {
        public OperationKind kind() {
            return OperationKind.MOVE_RESOURCE;
        }

        public List<String> validate() {
            return new Problems().required("id", id).required("newParent", newParent).list();
        }
    }

    public record GroupCreate(String id, String name, String parent, String subtitle) implements Operation {
        public OperationKind kind() {
            return OperationKind.GROUP_CREATE;
        }

        public List<String> validate() {
            return new Problems().cleanId("id", id).required("name", name).required("parent", parent).list();
        }
    }

    public record GroupMoveMany(List<String> ids, @JsonAlias("new_parent") String newParent) implements Operation {
        public OperationKind kind() {
            return OperationKind.GROUP_MOVE_MANY;
        }

        public List<String> validate() {
            Problems p = new Problems().required("newParent", newParent);
            if (ids == null) {
                p.add("ids", "field required");
            } else if (ids.isEmpty()) {
                p.add("ids", "--ids must include at least one resource id");
            } else {
                ids.forEach(id -> p.cleanId("ids", id));
            }
            return p.list();
        }
    }

    // ── Relations ────────────────────────────────────────────────────

    public record RelationAdd(String perspective, String from, String to, String via, String label,
            String description, @JsonAlias("arrow_direction") ArrowDirection arrowDirection, String color,
            Boolean secondary) implements Operation {
        public OperationKind kind() {
            return OperationKind.RELATION_ADD;
        }

        public RelationSpec spec() {
            return new RelationSpec(from, to, via, label, description, arrowDirection, color, secondary);
        }

        public List<String> validate() {
            Problems p = new Problems().required("perspective", perspective).relationStrings(spec());
            if (from == null && to == null) {
                p.add("from", "relation must define from or to (set --from and/or --to)");
            }
            return p.list();
        }
    }

    public record RelationAddMany(Target target, String from, String to, String via, String label,
            String description, @JsonAlias("arrow_direction") ArrowDirection arrowDirection, String color,
            Boolean secondary) implements Operation {
        public OperationKind kind() {
            return OperationKind.RELATION_ADD_MANY;
        }

        public RelationSpec spec() {
            return new RelationSpec(from, to, via, label, description, arrowDirection, color, secondary);
        }

        public List<String> validate() {
            Problems p = new Problems().target(target).relationStrings(spec());
            if (from == null && to == null) {
                p.add("from", "relation must define from or to (set from and/or to)");
            }
            return p.list();
        }
    }

    public record RelationRemove(String perspective, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.RELATION_REMOVE;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).relationIndex(index).list();
        }
    }

    public record RelationRemoveMatch(Target target, RelationSpec match,
            @JsonAlias("require_match") Boolean requireMatch) implements Operation {
        public OperationKind kind() {
            return OperationKind.RELATION_REMOVE_MATCH;
        }

        public boolean requireMatchOrDefault() {
            return requireMatch == null || requireMatch;
        }

        public List<String> validate() {
            return new Problems().target(target).match(match).list();
        }
    }

    public record RelationEdit(String perspective, Integer index, String from, String to, String via, String label,
            String description, @JsonAlias("arrow_direction") ArrowDirection arrowDirection, String color,
            Boolean secondary, @JsonAlias("clear_from") boolean clearFrom, @JsonAlias("clear_to") boolean clearTo,
            @JsonAlias("clear_via") boolean clearVia, @JsonAlias("clear_label") boolean clearLabel,
            @JsonAlias("clear_description") boolean clearDescription) implements Operation {
        public OperationKind kind() {
            return OperationKind.RELATION_EDIT;
        }

        public RelationSpec spec() {
            return new RelationSpec(from, to, via, label, description, arrowDirection, color, secondary);
        }

        public List<RelationField> clears() {
            List<RelationField> out = new ArrayList<>();
            if (clearFrom) {
                out.add(RelationField.FROM);
            }
            if (clearTo) {
                out.add(RelationField.TO);
            }
            if (clearVia) {
                out.add(RelationField.VIA);
            }
            if (clearLabel) {
                out.add(RelationField.LABEL);
            }
            if (clearDescription) {
                out.add(RelationField.DESCRIPTION);
            }
            return out;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).relationIndex(index)
                    .relationStrings(spec()).list();
        }
    }

    public record RelationEditMatch(Target target, RelationSpec match, RelationSpec set, List<String> clear,
            @JsonAlias("require_match") Boolean requireMatch) implements Operation {
        public OperationKind kind() {
            return OperationKind.RELATION_EDIT_MATCH;
        }

        public boolean requireMatchOrDefault() {
            return requireMatch == null || requireMatch;
        }

        public List<String> clearOrEmpty() {
            return clear == null ? List.of() : clear;
        }

        public List<String> validate() {
            Problems p = new Problems().target(target).match(match);
            if (set != null) {
                if (set.isEmpty()) {
                    p.add("set", "set must define at least one field to update");
                }
                p.relationStrings(set);
            }
            if (set == null && clearOrEmpty().isEmpty()) {
                p.add("clear", "edit-match requires `set` or non-empty `clear` (provide fields to update or clear)");
            }
            if (new HashSet<>(clearOrEmpty()).size() != clearOrEmpty().size()) {
                p.add("clear", "clear has duplicates (each field can appear once)");
            }
            for (String field : clearOrEmpty()) {
                if (RelationField.fromKey(field) == null) {
                    p.add("clear", "unknown relation field '" + field + "'");
                }
            }
            return p.list();
        }
    }

    /**
     * Target of a match-many relation operation. {@code perspectives} is
     * {@code "*"} (the default) or a list of perspective identifiers.
     */
    public record Target(JsonNode perspectives, List<String> contexts) {
        public RelationTarget toRelationTarget() {
            RelationTarget base = perspectives == null || perspectives.isTextual()
                    ? RelationTarget.allPerspectives()
                    : RelationTarget.of(strings(perspectives));
            return base.withContexts(contexts == null ? null : contexts.stream().map(String::strip).toList());
        }

        private static List<String> strings(JsonNode array) {
            List<String> out = new ArrayList<>();
            array.forEach(n -> out.add(n.asText().strip()));
            return out;
        }
    }

    // ── Perspectives ─────────────────────────────────────────────────

    public record PerspectiveCreate(String id, String name, @JsonProperty("extends") String extendsList,
            String orientation, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.PERSPECTIVE_CREATE;
        }

        public List<String> validate() {
            return new Problems().required("id", id).required("name", name).optional("extends", extendsList)
                    .optionalIndex("index", index).list();
        }
    }

    public record PerspectiveRename(String perspective, @JsonAlias("new_id") String newId,
            @JsonAlias("new_name") String newName) implements Operation {
        public OperationKind kind() {
            return OperationKind.PERSPECTIVE_RENAME;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).optional("newId", newId)
                    .optional("newName", newName).list();
        }
    }

    public record PerspectiveDelete(String perspective, boolean force) implements Operation {
        public OperationKind kind() {
            return OperationKind.PERSPECTIVE_DELETE;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).list();
        }
    }

    public record PerspectiveReorder(String perspective, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.PERSPECTIVE_REORDER;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).requiredIndex("index", index).list();
        }
    }

    public record PerspectiveCopy(String perspective, @JsonAlias("new_id") String newId,
            @JsonAlias("new_name") String newName, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.PERSPECTIVE_COPY;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).required("newId", newId)
                    .optional("newName", newName).optionalIndex("index", index).list();
        }
    }

    // ── Contexts ─────────────────────────────────────────────────────

    public record ContextCreate(String name, @JsonProperty("extends") String extendsList, Boolean hidden,
            Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.CONTEXT_CREATE;
        }

        public List<String> validate() {
            return new Problems().required("name", name).optional("extends", extendsList)
                    .optionalIndex("index", index).list();
        }
    }

    public record ContextRename(String name, @JsonAlias("new_name") String newName) implements Operation {
        public OperationKind kind() {
            return OperationKind.CONTEXT_RENAME;
        }

        public List<String> validate() {
            return new Problems().required("name", name).required("newName", newName).list();
        }
    }

    public record ContextDelete(String name, boolean force) implements Operation {
        public OperationKind kind() {
            return OperationKind.CONTEXT_DELETE;
        }

        public List<String> validate() {
            return new Problems().required("name", name).list();
        }
    }

    public record ContextReorder(String name, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.CONTEXT_REORDER;
        }

        public List<String> validate() {
            return new Problems().required("name", name).requiredIndex("index", index).list();
        }
    }

    public record ContextCopy(String name, @JsonAlias("new_name") String newName, Integer index)
            implements Operation {
        public OperationKind kind() {
            return OperationKind.CONTEXT_COPY;
        }

        public List<String> validate() {
            return new Problems().required("name", name).required("newName", newName)
                    .optionalIndex("index", index).list();
        }
    }

    // ── Aliases and overrides ────────────────────────────────────────

    public record AliasAdd(String perspective, String alias, @JsonProperty("for") String target, Integer index)
            implements Operation {
        public OperationKind kind() {
            return OperationKind.ALIAS_ADD;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).required("alias", alias)
                    .required("for", target).optionalIndex("index", index).list();
        }
    }

    public record AliasEdit(String perspective, String alias, @JsonAlias("new_alias") String newAlias,
            @JsonAlias("new_for") String newFor) implements Operation {
        public OperationKind kind() {
            return OperationKind.ALIAS_EDIT;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).required("alias", alias)
                    .optional("newAlias", newAlias).optional("newFor", newFor).list();
        }
    }

    public record AliasRemove(String perspective, String alias) implements Operation {
        public OperationKind kind() {
            return OperationKind.ALIAS_REMOVE;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).required("alias", alias).list();
        }
    }

    public record OverrideAdd(String perspective, @JsonAlias("resource_id") String resourceId,
            @JsonAlias("parent_id") String parentId, Double scale, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.OVERRIDE_ADD;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).required("resourceId", resourceId)
                    .optional("parentId", parentId).optionalIndex("index", index).list();
        }
    }

    public record OverrideEdit(String perspective, @JsonAlias("resource_id") String resourceId,
            @JsonAlias("new_resource_id") String newResourceId, @JsonAlias("parent_id") String parentId,
            Double scale, @JsonAlias("clear_parent_id") boolean clearParentId,
            @JsonAlias("clear_scale") boolean clearScale) implements Operation {
        public OperationKind kind() {
            return OperationKind.OVERRIDE_EDIT;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).required("resourceId", resourceId)
                    .optional("newResourceId", newResourceId).optional("parentId", parentId).list();
        }
    }

    public record OverrideRemove(String perspective, @JsonAlias("resource_id") String resourceId)
            implements Operation {
        public OperationKind kind() {
            return OperationKind.OVERRIDE_REMOVE;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).required("resourceId", resourceId).list();
        }
    }

    // ── Sequence and walkthrough ─────────────────────────────────────

    public record SequenceAdd(String perspective, String to, @JsonAlias("to_and_back") String toAndBack,
            @JsonAlias("to_async") String toAsync, @JsonAlias("restart_at") String restartAt, String label,
            String description, Boolean bidirectional, String color, Integer index, String start)
            implements Operation {
        public OperationKind kind() {
            return OperationKind.SEQUENCE_ADD;
        }

        public SequenceStep step() {
            return new SequenceStep(to, toAndBack, toAsync, restartAt, label, description, bidirectional, color);
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).optionalIndex("index", index)
                    .optional("start", start).list();
        }
    }

    public record SequenceEdit(String perspective, Integer index, String to,
            @JsonAlias("to_and_back") String toAndBack, @JsonAlias("to_async") String toAsync,
            @JsonAlias("restart_at") String restartAt, String label, String description, Boolean bidirectional,
            String color, @JsonAlias("clear_label") boolean clearLabel,
            @JsonAlias("clear_description") boolean clearDescription, @JsonAlias("clear_color") boolean clearColor)
            implements Operation {
        public OperationKind kind() {
            return OperationKind.SEQUENCE_EDIT;
        }

        public SequenceStep step() {
            return new SequenceStep(to, toAndBack, toAsync, restartAt, label, description, bidirectional, color);
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).requiredIndex("index", index).list();
        }
    }

    public record SequenceRemove(String perspective, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.SEQUENCE_REMOVE;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).requiredIndex("index", index).list();
        }
    }

    public record WalkthroughAdd(String perspective, String text, String select, String expand, String highlight,
            String hide, Double detail, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.WALKTHROUGH_ADD;
        }

        public Slide slide() {
            return new Slide(text, select, expand, highlight, hide, detail);
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).optionalIndex("index", index).list();
        }
    }

    public record WalkthroughEdit(String perspective, Integer index, String text, String select, String expand,
            String highlight, String hide, Double detail, List<String> clear) implements Operation {
        public OperationKind kind() {
            return OperationKind.WALKTHROUGH_EDIT;
        }

        public Slide slide() {
            return new Slide(text, select, expand, highlight, hide, detail);
        }

        public List<SlideField> clears() {
            return clear == null ? List.of() : clear.stream().map(SlideField::fromString).toList();
        }

        public List<String> validate() {
            Problems p = new Problems().required("perspective", perspective).requiredIndex("index", index);
            if (clear != null) {
                for (String field : clear) {
                    try {
                        SlideField.fromString(field);
                    } catch (IllegalArgumentException e) {
                        p.add("clear", e.getMessage());
                    }
                }
            }
            return p.list();
        }
    }

    public record WalkthroughRemove(String perspective, Integer index) implements Operation {
        public OperationKind kind() {
            return OperationKind.WALKTHROUGH_REMOVE;
        }

        public List<String> validate() {
            return new Problems().required("perspective", perspective).requiredIndex("index", index).list();
        }
    }

    /** Load, validate and re-emit; never changes the document. */
    public record FmtStable() implements Operation {
        public OperationKind kind() {
            return OperationKind.FMT_STABLE;
        }
    }

    // ── Schema checks ────────────────────────────────────────────────

    /** Collects {@code field: message} problems for one operation. */
    static final class Problems {
        private final List<String> lines = new ArrayList<>();

        Problems add(String field, String message) {
            lines.add(field + ": " + message);
            return this;
        }

        Problems required(String field, String value) {
            if (value == null) {
                return add(field, "field required");
            }
            return optional(field, value);
        }

        Problems optional(String field, String value) {
            if (value != null && value.isBlank()) {
                add(field, field + " must not be empty");
            }
            return this;
        }

        Problems cleanId(String field, String value) {
            required(field, value);
            Character bad = value == null ? null : ReferenceParser.firstRestrictedChar(value.strip());
            if (bad != null) {
                add(field, field + " contains restricted character '" + bad + "'");
            }
            return this;
        }

        Problems requiredIndex(String field, Integer value) {
            if (value == null) {
                return add(field, "field required");
            }
            return optionalIndex(field, value);
        }

        Problems optionalIndex(String field, Integer value) {
            if (value != null && value < 1) {
                add(field, "index must be >= 1");
            }
            return this;
        }

        Problems relationIndex(Integer value) {
            if (value == null) {
                return add("index", "field required");
            }
            if (value < 1) {
                add("index", "--index must be >= 1 (1-based relation index)");
            }
            return this;
        }

        Problems relationStrings(RelationSpec spec) {
            return optional("from", spec.from()).optional("to", spec.to()).optional("via", spec.via())
                    .optional("label", spec.label()).optional("description", spec.description())
                    .optional("color", spec.color());
        }

        Problems match(RelationSpec match) {
            if (match == null) {
                return add("match", "field required");
            }
            if (match.isEmpty()) {
                add("match", "match must define at least one field to compare");
            }
            return relationStrings(match);
        }

        Problems target(Target target) {
            if (target == null) {
                return add("target", "field required");
            }
            JsonNode perspectives = target.perspectives();
            if (perspectives != null) {
                if (perspectives.isTextual()) {
                    if (!perspectives.asText().equals("*")) {
                        add("target.perspectives", "must be '*' or a list of perspective ids");
                    }
                } else if (perspectives.isArray()) {
                    uniqueList("target.perspectives", perspectives);
                } else {
                    add("target.perspectives", "must be '*' or a list of perspective ids");
                }
            }
            if (target.contexts() != null) {
                Set<String> seen = new HashSet<>();
                for (String c : target.contexts()) {
                    if (c == null || c.isBlank()) {
                        add("target.contexts", "target.contexts must not be empty");
                    } else if (!seen.add(c.strip())) {
                        add("target.contexts", "target.contexts has duplicates");
                    }
                }
                if (target.contexts().isEmpty()) {
                    add("target.contexts", "target.contexts must not be empty");
                }
            }
            return this;
        }

        private void uniqueList(String field, JsonNode array) {
            Set<String> seen = new HashSet<>();
            for (JsonNode item : array) {
                if (!item.isTextual() || item.asText().isBlank()) {
                    add(field, field + " must not be empty");
                } else if (!seen.add(item.asText().strip())) {
                    add(field, field + " has duplicates");
                }
            }
            if (array.isEmpty()) {
                add(field, field + " must not be empty");
            }
        }

        List<String> list() {
            return lines;
        }
    }
}
