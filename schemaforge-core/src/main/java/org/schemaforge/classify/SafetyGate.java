package org.schemaforge.classify;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.diff.Changes;
import org.schemaforge.exception.DestructiveChangeBlockedException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * All-or-nothing check run once per invocation, before any artifact is written.
 */
@Slf4j
public class SafetyGate {
    private final DestructiveChangeClassifier classifier;
    private final ConfirmationProvider confirmationProvider;

    public SafetyGate(ConfirmationProvider confirmationProvider) {
        this(new DestructiveChangeClassifier(), confirmationProvider);
    }

    public SafetyGate(DestructiveChangeClassifier classifier, ConfirmationProvider confirmationProvider) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.confirmationProvider = Objects.requireNonNull(confirmationProvider, "confirmationProvider must not be null");
    }

    /**
     * @return the destructive changes that were let through (empty when there were none)
     * @throws DestructiveChangeBlockedException when confirmation was required and not given
     */
    public List<DestructiveChange> check(List<Changes> pending, boolean force) {
        List<DestructiveChange> destructive = classifier.classify(pending);
        if (destructive.isEmpty()) {
            return destructive;
        }
        if (force) {
            log.warn("Proceeding with {} destructive change(s) (forced)", destructive.size());
            return destructive;
        }

        Optional<String> answer = confirmationProvider.confirm(destructive);
        if (answer.map(String::trim).filter(s -> !s.isEmpty()).isEmpty()) {
            throw new DestructiveChangeBlockedException(destructive);
        }
        log.info("Destructive changes acknowledged: {}", answer.get().trim());
        return destructive;
    }
}
