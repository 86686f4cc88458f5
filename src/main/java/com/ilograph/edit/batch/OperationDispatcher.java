package com.ilograph.edit.batch;

import com.ilograph.edit.batch.Operations.*;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.engine.*;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Locale;

/**
 * Applies typed operations to an in-memory document, one engine call per
 * {@link OperationKind}.
 */
@Log4j2
public final class OperationDispatcher {
    private OperationDispatcher() {
        // Utility class
    }

    /** Applies every operation in order; true when any of them changed the document. */
    public static boolean applyAll(List<? extends Operation> ops, DocMap document) {
        boolean changed = false;
        for (Operation op : ops) {
            changed |= apply(op, document);
        }
        return changed;
    }

    public static boolean apply(Operation op, DocMap document) {
        boolean changed = switch (op.kind()) {
            case RESOURCE_CREATE -> {
                ResourceCreate o = (ResourceCreate) op;
                yield ResourceOps.create(document, o.id(), o.name(), o.parentOrRoot(), o.subtitle());
            }
            case RESOURCE_DELETE -> {
                ResourceDelete o = (ResourceDelete) op;
                yield ResourceOps.delete(document, o.id(), o.deleteSubtree());
            }
            case RESOURCE_CLONE -> {
                ResourceClone o = (ResourceClone) op;
                yield ResourceOps.clone(document, o.id(), o.newId(), o.newParent(), o.newName(), o.withChildren());
            }
            case RENAME_RESOURCE -> {
                RenameResource o = (RenameResource) op;
                yield ResourceOps.rename(document, o.id(), o.name());
            }
            case RENAME_RESOURCE_ID -> {
                RenameResourceId o = (RenameResourceId) op;
                yield ResourceOps.renameId(document, o.from(), o.to());
            }
            case MOVE_RESOURCE -> {
                MoveResource o = (MoveResource) op;
                yield isRoot(o.newParent())
                        ? ResourceOps.moveToRoot(document, o.id())
                        : ResourceOps.move(document, o.id(), o.newParent(), o.inheritStyleFromParent());
            }
            case GROUP_CREATE -> {
                GroupCreate o = (GroupCreate) op;
                yield GroupOps.create(document, o.id(), o.name(), o.parent(), o.subtitle());
            }
            case GROUP_MOVE_MANY -> {
                GroupMoveMany o = (GroupMoveMany) op;
                yield GroupOps.moveMany(document, o.ids(), o.newParent());
            }
            case RELATION_ADD -> {
                RelationAdd o = (RelationAdd) op;
                yield RelationOps.add(document, o.perspective(), o.spec());
            }
            case RELATION_ADD_MANY -> {
                RelationAddMany o = (RelationAddMany) op;
                yield RelationOps.addMany(document, o.target().toRelationTarget(), o.spec()) > 0;
            }
            case RELATION_REMOVE -> {
                RelationRemove o = (RelationRemove) op;
                yield RelationOps.remove(document, o.perspective(), o.index());
            }
            case RELATION_REMOVE_MATCH -> {
                RelationRemoveMatch o = (RelationRemoveMatch) op;
                yield RelationOps.removeMatchMany(document, o.target().toRelationTarget(), o.match(),
                        o.requireMatchOrDefault()) > 0;
            }
            case RELATION_EDIT -> {
                RelationEdit o = (RelationEdit) op;
                yield RelationOps.edit(document, o.perspective(), o.index(), o.spec(), o.clears());
            }
            case RELATION_EDIT_MATCH -> {
                RelationEditMatch o = (RelationEditMatch) op;
                yield RelationOps.editMatchMany(document, o.target().toRelationTarget(), o.match(), o.set(),
                        RelationField.parseAll(o.clearOrEmpty()), o.requireMatchOrDefault()) > 0;
            }
            case PERSPECTIVE_CREATE -> {
                PerspectiveCreate o = (PerspectiveCreate) op;
                yield PerspectiveOps.create(document, o.id(), o.name(), o.extendsList(), o.orientation(), o.index());
            }
            case PERSPECTIVE_RENAME -> {
                PerspectiveRename o = (PerspectiveRename) op;
                yield PerspectiveOps.rename(document, o.perspective(), o.newId(), o.newName());
            }
            case PERSPECTIVE_DELETE -> {
                PerspectiveDelete o = (PerspectiveDelete) op;
                yield PerspectiveOps.delete(document, o.perspective(), o.force());
            }
            case PERSPECTIVE_REORDER -> {
                PerspectiveReorder o = (PerspectiveReorder) op;
                yield PerspectiveOps.reorder(document, o.perspective(), o.index());
            }
            case PERSPECTIVE_COPY -> {
                PerspectiveCopy o = (PerspectiveCopy) op;
                yield PerspectiveOps.copy(document, o.perspective(), o.newId(), o.newName(), o.index());
            }
            case CONTEXT_CREATE -> {
                ContextCreate o = (ContextCreate) op;
                yield ContextOps.create(document, o.name(), o.extendsList(), o.hidden(), o.index());
            }
            case CONTEXT_RENAME -> {
                ContextRename o = (ContextRename) op;
                yield ContextOps.rename(document, o.name(), o.newName());
            }
            case CONTEXT_DELETE -> {
                ContextDelete o = (ContextDelete) op;
                yield ContextOps.delete(document, o.name(), o.force());
            }
            case CONTEXT_REORDER -> {
                ContextReorder o = (ContextReorder) op;
                yield ContextOps.reorder(document, o.name(), o.index());
            }
            case CONTEXT_COPY -> {
                ContextCopy o = (ContextCopy) op;
                yield ContextOps.copy(document, o.name(), o.newName(), o.index());
            }
            case ALIAS_ADD -> {
                AliasAdd o = (AliasAdd) op;
                yield AliasOps.add(document, o.perspective(), o.alias(), o.target(), o.index());
            }
            case ALIAS_EDIT -> {
                AliasEdit o = (AliasEdit) op;
                yield AliasOps.edit(document, o.perspective(), o.alias(), o.newAlias(), o.newFor());
            }
            case ALIAS_REMOVE -> {
                AliasRemove o = (AliasRemove) op;
                yield AliasOps.remove(document, o.perspective(), o.alias());
            }
            case OVERRIDE_ADD -> {
                OverrideAdd o = (OverrideAdd) op;
                yield OverrideOps.add(document, o.perspective(), o.resourceId(), o.parentId(), o.scale(), o.index());
            }
            case OVERRIDE_EDIT -> {
                OverrideEdit o = (OverrideEdit) op;
                yield OverrideOps.edit(document, o.perspective(), o.resourceId(), o.newResourceId(), o.parentId(),
                        o.scale(), o.clearParentId(), o.clearScale());
            }
            case OVERRIDE_REMOVE -> {
                OverrideRemove o = (OverrideRemove) op;
                yield OverrideOps.remove(document, o.perspective(), o.resourceId());
            }
            case SEQUENCE_ADD -> {
                SequenceAdd o = (SequenceAdd) op;
                yield SequenceOps.add(document, o.perspective(), o.step(), o.index(), o.start());
            }
            case SEQUENCE_EDIT -> {
                SequenceEdit o = (SequenceEdit) op;
                yield SequenceOps.edit(document, o.perspective(), o.index(), o.step(), o.clearLabel(),
                        o.clearDescription(), o.clearColor());
            }
            case SEQUENCE_REMOVE -> {
                SequenceRemove o = (SequenceRemove) op;
                yield SequenceOps.remove(document, o.perspective(), o.index());
            }
            case WALKTHROUGH_ADD -> {
                WalkthroughAdd o = (WalkthroughAdd) op;
                yield WalkthroughOps.add(document, o.perspective(), o.slide(), o.index());
            }
            case WALKTHROUGH_EDIT -> {
                WalkthroughEdit o = (WalkthroughEdit) op;
                yield WalkthroughOps.edit(document, o.perspective(), o.index(), o.slide(), o.clears());
            }
            case WALKTHROUGH_REMOVE -> {
                WalkthroughRemove o = (WalkthroughRemove) op;
                yield WalkthroughOps.remove(document, o.perspective(), o.index());
            }
            case FMT_STABLE -> false;
        };
        log.debug("Applied {} (changed={})", op.kind().label(), changed);
        return changed;
    }

    private static boolean isRoot(String parent) {
        return parent != null && parent.strip().toLowerCase(Locale.ROOT).equals("none");
    }
}
