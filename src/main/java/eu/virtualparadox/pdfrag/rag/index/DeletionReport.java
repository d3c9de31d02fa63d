package eu.virtualparadox.pdfrag.rag.index;

import java.util.List;

/**
 * Outcome of a delete-by-predicate.
 *
 * @param matched        number of records matching the predicate before deletion
 * @param notRemovedIds  ids of matching records still present afterwards
 */
public record DeletionReport(int matched, List<String> notRemovedIds) {

    public DeletionReport {
        notRemovedIds = List.copyOf(notRemovedIds);
    }

    public static DeletionReport complete(final int matched) {
        return new DeletionReport(matched, List.of());
    }

    public int removed() {
        return matched - notRemovedIds.size();
    }

    public boolean isComplete() {
        return notRemovedIds.isEmpty();
    }
}
