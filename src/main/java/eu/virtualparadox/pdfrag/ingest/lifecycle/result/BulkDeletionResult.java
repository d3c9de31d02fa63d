package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

import java.util.List;

/**
 * Outcome of deleting every known document.
 *
 * @param deletions       per-document results of the forced deletions
 * @param indexCleared    whether the final unconditional index clear succeeded
 * @param registryCleared whether the registry was cleared
 * @param errors          failures of the final clear steps
 */
public record BulkDeletionResult(List<DeletionResult> deletions,
                                 boolean indexCleared,
                                 boolean registryCleared,
                                 List<String> errors) {

    public BulkDeletionResult {
        deletions = List.copyOf(deletions);
        errors = List.copyOf(errors);
    }

    public long documentsRemoved() {
        return deletions.stream().filter(DeletionResult::success).count();
    }

    public boolean success() {
        return indexCleared && registryCleared && errors.isEmpty()
                && deletions.stream().allMatch(d -> d.failedStores().isEmpty());
    }
}
