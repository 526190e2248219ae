package org.schemaforge.exception;

import org.schemaforge.classify.DestructiveChange;

import java.util.List;

/**
 * The operator declined the destructive-change confirmation. Nothing was written.
 */
public class DestructiveChangeBlockedException extends MigrationException {
    private final List<DestructiveChange> changes;

    public DestructiveChangeBlockedException(List<DestructiveChange> changes) {
        super("Destructive changes require a default value or --force. Aborting.");
        this.changes = List.copyOf(changes);
    }

    public List<DestructiveChange> getChanges() {
        return changes;
    }
}
