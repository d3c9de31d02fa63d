package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

import java.util.List;

/**
 * Per-store outcome of deleting one identity.
 */
public record DeletionResult(String identity, List<StoreOutcome> outcomes) {

    public DeletionResult {
        outcomes = List.copyOf(outcomes);
    }

    public static DeletionResult notRegistered(final String identity) {
        return new DeletionResult(identity, List.of());
    }

    /**
     * @return {@code true} if at least one store changed
     */
    public boolean success() {
        return outcomes.stream().anyMatch(StoreOutcome::isRemoved);
    }

    public List<EStore> removedStores() {
        return outcomes.stream().filter(StoreOutcome::isRemoved).map(StoreOutcome::store).toList();
    }

    public List<EStore> failedStores() {
        return outcomes.stream().filter(StoreOutcome::isFailed).map(StoreOutcome::store).toList();
    }

    public List<String> errors() {
        return outcomes.stream()
                .filter(StoreOutcome::isFailed)
                .map(o -> o.store() + ": " + o.error())
                .toList();
    }

    public EDeletionStatus status() {
        if (outcomes.isEmpty()) {
            return EDeletionStatus.NOT_REGISTERED;
        }
        final boolean removed = success();
        final boolean failed = outcomes.stream().anyMatch(StoreOutcome::isFailed);
        if (removed) {
            return failed ? EDeletionStatus.PARTIALLY_REMOVED : EDeletionStatus.FULLY_REMOVED;
        }
        return failed ? EDeletionStatus.FAILED : EDeletionStatus.NOTHING_TO_REMOVE;
    }
}
