package com.ilograph.edit.batch;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Closed set of operation kinds, keyed by the {@code op} label used in ops
 * files.
 */
public enum OperationKind {
    RESOURCE_CREATE("resource.create", Operations.ResourceCreate.class),
    RESOURCE_DELETE("resource.delete", Operations.ResourceDelete.class),
    RESOURCE_CLONE("resource.clone", Operations.ResourceClone.class),
    RENAME_RESOURCE("rename.resource", Operations.RenameResource.class),
    RENAME_RESOURCE_ID("rename.resource-id", Operations.RenameResourceId.class),
    MOVE_RESOURCE("move.resource", Operations.MoveResource.class),
    GROUP_CREATE("group.create", Operations.GroupCreate.class),
    GROUP_MOVE_MANY("group.move-many", Operations.GroupMoveMany.class),
    RELATION_ADD("relation.add", Operations.RelationAdd.class),
    RELATION_ADD_MANY("relation.add-many", Operations.RelationAddMany.class),
    RELATION_REMOVE("relation.remove", Operations.RelationRemove.class),
    RELATION_REMOVE_MATCH("relation.remove-match", Operations.RelationRemoveMatch.class),
    RELATION_EDIT("relation.edit", Operations.RelationEdit.class),
    RELATION_EDIT_MATCH("relation.edit-match", Operations.RelationEditMatch.class),
    PERSPECTIVE_CREATE("perspective.create", Operations.PerspectiveCreate.class),
    PERSPECTIVE_RENAME("perspective.rename", Operations.PerspectiveRename.class),
    PERSPECTIVE_DELETE("perspective.delete", Operations.PerspectiveDelete.class),
    PERSPECTIVE_REORDER("perspective.reorder", Operations.PerspectiveReorder.class),
    PERSPECTIVE_COPY("perspective.copy", Operations.PerspectiveCopy.class),
    CONTEXT_CREATE("context.create", Operations.ContextCreate.class),
    CONTEXT_RENAME("context.rename", Operations.ContextRename.class),
    CONTEXT_DELETE("context.delete", Operations.ContextDelete.class),
    CONTEXT_REORDER("context.reorder", Operations.ContextReorder.class),
    CONTEXT_COPY("context.copy", Operations.ContextCopy.class),
    ALIAS_ADD("alias.add", Operations.AliasAdd.class),
    ALIAS_EDIT("alias.edit", Operations.AliasEdit.class),
    ALIAS_REMOVE("alias.remove", Operations.AliasRemove.class),
    OVERRIDE_ADD("override.add", Operations.OverrideAdd.class),
    OVERRIDE_EDIT("override.edit", Operations.OverrideEdit.class),
    OVERRIDE_REMOVE("override.remove", Operations.OverrideRemove.class),
    SEQUENCE_ADD("sequence.add", Operations.SequenceAdd.class),
    SEQUENCE_EDIT("sequence.edit", Operations.SequenceEdit.class),
    SEQUENCE_REMOVE("sequence.remove", Operations.SequenceRemove.class),
    WALKTHROUGH_ADD("walkthrough.add", Operations.WalkthroughAdd.class),
    WALKTHROUGH_EDIT("walkthrough.edit", Operations.WalkthroughEdit.class),
    WALKTHROUGH_REMOVE("walkthrough.remove", Operations.WalkthroughRemove.class),
    FMT_STABLE("fmt.stable", Operations.FmtStable.class);

    private final String label;
    private final Class<? extends Operation> type;

    OperationKind(String label, Class<? extends Operation> type) {
        this.label = label;
        this.type = type;
    }

    public String label() {
        return label;
    }

    /** Record class the operation's fields bind to. */
    public Class<? extends Operation> type() {
        return type;
    }

    public static OperationKind fromString(String s) {
        for (OperationKind k : values()) {
            if (k.label.equals(s)) {
                return k;
            }
        }
        throw new IllegalArgumentException("unknown operation '" + s + "' (expected one of: "
                + Arrays.stream(values()).map(OperationKind::label).collect(Collectors.joining(", ")) + ")");
    }
}
