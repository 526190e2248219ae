package org.schemaforge.classify;

import java.util.List;
import java.util.Optional;

/**
 * Asks the operator whether to go on with destructive changes.
 * <p>
 * A non-blank answer counts as acknowledgement; an empty or blank answer aborts the run.
 */
@FunctionalInterface
public interface ConfirmationProvider {

    Optional<String> confirm(List<DestructiveChange> destructiveChanges);

    /**
     * Provider for non-interactive runs: never acknowledges.
     */
    static ConfirmationProvider decline() {
        return changes -> Optional.empty();
    }
}
